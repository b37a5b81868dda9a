package com.github.salilvnair.researchengine.engine.history.provider;

import com.github.salilvnair.researchengine.engine.history.core.ConversationStore;
import com.github.salilvnair.researchengine.engine.model.ConversationTurn;
import com.github.salilvnair.researchengine.engine.model.IntentType;
import com.github.salilvnair.researchengine.engine.model.TurnRole;
import com.github.salilvnair.researchengine.entity.ReConversationTurn;
import com.github.salilvnair.researchengine.repo.ConversationTurnRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;

@Component
@RequiredArgsConstructor
public class JpaConversationStore implements ConversationStore {

    private final ConversationTurnRepository conversationTurnRepository;

    @Override
    public List<ConversationTurn> lastTurns(String conversationId, int limit) {
        if (conversationId == null || conversationId.isBlank() || limit <= 0) {
            return List.of();
        }
        List<ReConversationTurn> rows = conversationTurnRepository
                .findByConversationIdOrderByCreatedAtDescTurnIdDesc(conversationId, PageRequest.of(0, limit))
                .getContent();

        List<ConversationTurn> turns = new ArrayList<>();
        for (ReConversationTurn row : rows) {
            turns.add(toTurn(row));
        }
        // newest first from the repository
        Collections.reverse(turns);
        return turns;
    }

    @Override
    public void append(String conversationId, String userId, ConversationTurn turn) {
        Instant createdAt = turn.createdAt() == null ? Instant.now() : turn.createdAt();
        ReConversationTurn row = ReConversationTurn.builder()
                .conversationId(conversationId)
                .userId(userId)
                .role(turn.role().name())
                .contentText(turn.content())
                .intentType(turn.intentType() == null ? null : turn.intentType().code())
                .parameters(new LinkedHashMap<>(turn.parameters()))
                .createdAt(createdAt.atOffset(ZoneOffset.UTC))
                .build();
        conversationTurnRepository.save(row);
    }

    private ConversationTurn toTurn(ReConversationTurn row) {
        return new ConversationTurn(
                TurnRole.valueOf(row.getRole()),
                row.getContentText(),
                row.getIntentType() == null ? null : IntentType.fromCode(row.getIntentType()),
                row.getParameters(),
                row.getCreatedAt() == null ? null : row.getCreatedAt().toInstant()
        );
    }
}
