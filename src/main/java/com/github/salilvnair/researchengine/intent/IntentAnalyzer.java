package com.github.salilvnair.researchengine.intent;

import com.github.salilvnair.researchengine.config.ResearchEngineIntentConfig;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.model.ConversationTurn;
import com.github.salilvnair.researchengine.engine.model.Intent;
import com.github.salilvnair.researchengine.engine.model.IntentType;
import com.github.salilvnair.researchengine.engine.model.Query;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies a query into one {@link Intent}. Patterns are tried first; the language model is
 * consulted only when enabled and the patterns produced nothing acceptable. Anything below the
 * policy threshold becomes {@link IntentType#UNKNOWN}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntentAnalyzer {

    private final PatternIntentClassifier patternClassifier;
    private final SlotExtractor slotExtractor;
    private final ConfidencePolicy confidencePolicy;
    private final LlmIntentClassifier llmClassifier;
    private final ResearchEngineIntentConfig config;

    public Intent classify(Query query, List<ConversationTurn> recentTurns) {
        List<ConversationTurn> window = window(recentTurns);
        String text = query.text() == null ? "" : query.text();

        Intent fromPatterns = patternClassifier.classify(text)
                .map(candidate -> score(candidate, text, window))
                .orElse(Intent.unknown(0.0d));
        if (fromPatterns.type() != IntentType.UNKNOWN || !config.isLlmAssistEnabled()) {
            return logged(query, fromPatterns);
        }

        Optional<Intent> fromModel = llmClassifier.classify(text, window).map(signal -> score(signal, text, window));
        if (fromModel.isPresent() && fromModel.get().type() != IntentType.UNKNOWN) {
            return logged(query, fromModel.get());
        }
        return logged(query, fromPatterns);
    }

    private Intent score(IntentCandidate candidate, String text, List<ConversationTurn> window) {
        SlotFill slots = slotExtractor.extract(candidate.type(), text, window);
        double confidence = confidencePolicy.score(candidate.strength(), slots.requiredSlotMissing(), slots.coreferenced());
        if (!confidencePolicy.accepts(confidence)) {
            log.debug("Intent {} below threshold confidence={} missingSlot={}", candidate.type(), confidence, slots.requiredSlotMissing());
            return Intent.unknown(confidence);
        }
        return new Intent(candidate.type(), slots.parameters(), confidence);
    }

    private Intent score(ModelIntentSignal signal, String text, List<ConversationTurn> window) {
        if (signal.type() == IntentType.UNKNOWN) {
            return Intent.unknown(0.0d);
        }
        SlotFill slots = slotExtractor.extract(signal.type(), text, window);
        Map<String, Object> parameters = new LinkedHashMap<>(signal.parameters());
        parameters.putAll(slots.parameters());
        boolean missing = slotExtractor.requiredSlotMissing(signal.type(), parameters);
        double confidence = confidencePolicy.scoreModelSignal(signal.confidence(), missing, slots.coreferenced());
        if (!confidencePolicy.accepts(confidence)) {
            return Intent.unknown(confidence);
        }
        return new Intent(signal.type(), parameters, confidence);
    }

    private List<ConversationTurn> window(List<ConversationTurn> recentTurns) {
        if (recentTurns == null || recentTurns.isEmpty()) {
            return List.of();
        }
        int size = Math.max(0, config.getHistoryWindow());
        return List.copyOf(recentTurns.subList(Math.max(0, recentTurns.size() - size), recentTurns.size()));
    }

    private Intent logged(Query query, Intent intent) {
        if (intent.type() == IntentType.UNKNOWN) {
            log.info("Intent unresolved conversationId={} reason={} confidence={}",
                    query.conversationId(), ResearchEngineErrorCode.CLASSIFICATION_AMBIGUOUS, intent.confidence());
        } else {
            log.info("Intent resolved conversationId={} intent={} confidence={} parameters={}",
                    query.conversationId(), intent.type().code(), intent.confidence(), intent.parameters());
        }
        return intent;
    }
}
