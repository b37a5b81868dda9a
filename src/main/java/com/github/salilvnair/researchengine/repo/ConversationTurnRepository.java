package com.github.salilvnair.researchengine.repo;

import com.github.salilvnair.researchengine.entity.ReConversationTurn;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ConversationTurnRepository extends JpaRepository<ReConversationTurn, Long> {

    Page<ReConversationTurn>
    findByConversationIdOrderByCreatedAtDescTurnIdDesc(
            String conversationId,
            Pageable pageable
    );
}
