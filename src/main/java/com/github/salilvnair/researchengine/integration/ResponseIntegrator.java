package com.github.salilvnair.researchengine.integration;

import com.github.salilvnair.researchengine.config.ResearchEngineLlmConfig;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineException;
import com.github.salilvnair.researchengine.engine.model.AggregatedResult;
import com.github.salilvnair.researchengine.engine.model.ConversationTurn;
import com.github.salilvnair.researchengine.engine.model.IntegratedResponse;
import com.github.salilvnair.researchengine.engine.model.Intent;
import com.github.salilvnair.researchengine.engine.model.IntentType;
import com.github.salilvnair.researchengine.engine.model.Query;
import com.github.salilvnair.researchengine.engine.model.ResponseMetadata;
import com.github.salilvnair.researchengine.integration.digest.ResearchDigest;
import com.github.salilvnair.researchengine.integration.digest.ResultDigester;
import com.github.salilvnair.researchengine.llm.core.LlmClient;
import com.github.salilvnair.researchengine.llm.core.LlmGenerationOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Turns tool results into the user facing answer. Tool and transport error details are logged
 * but never placed in the message.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ResponseIntegrator {

    private final ResultDigester digester;
    private final ResponsePromptBuilder promptBuilder;
    private final FallbackSummaryRenderer fallbackRenderer;
    private final LlmClient llmClient;
    private final ResearchEngineLlmConfig llmConfig;
    private final Clock clock;

    public IntegratedResponse integrate(Query query,
                                        Intent intent,
                                        AggregatedResult aggregated,
                                        List<ConversationTurn> conversation) {
        ResponseStrategy strategy = ResponseStrategy.forIntent(intent.type());
        if (intent.type() == IntentType.UNKNOWN) {
            return response(query, intent, fallbackRenderer.clarification(query), strategy, false, false, List.of());
        }

        ResearchDigest digest = digester.digest(aggregated);
        if (!aggregated.hasSuccess()) {
            log.warn("No tool data for intent={} conversationId={} failedTools={}",
                    intent.type().code(), query.conversationId(), digest.unavailableSources());
            return error(query, intent);
        }

        boolean degraded = aggregated.hasFailures();
        String prompt = promptBuilder.build(query, intent, digest, conversation);
        String message;
        try {
            message = llmClient.generate(prompt, LlmGenerationOptions.forResponse(llmConfig));
        } catch (ResearchEngineException e) {
            log.warn("Response generation failed, using templated summary errorCode={} message={}",
                    e.getErrorCode(), e.getMessage());
            message = null;
        } catch (RuntimeException e) {
            log.error("Unexpected response generation failure, using templated summary", e);
            message = null;
        }
        if (message == null || message.isBlank()) {
            message = fallbackRenderer.summary(query, intent, digest);
            degraded = true;
        }
        return response(query, intent, message.trim(), strategy, degraded, false, digest.dataSources());
    }

    public IntegratedResponse error(Query query, Intent intent) {
        return response(query, intent, fallbackRenderer.error(), ResponseStrategy.forIntent(intent.type()),
                true, true, List.of());
    }

    private IntegratedResponse response(Query query,
                                        Intent intent,
                                        String message,
                                        ResponseStrategy strategy,
                                        boolean degraded,
                                        boolean error,
                                        List<String> dataSources) {
        ResponseMetadata metadata = new ResponseMetadata(
                intent.type(),
                intent.confidence(),
                processingTimeMs(query),
                degraded,
                error,
                strategy.code(),
                dataSources
        );
        return new IntegratedResponse(message, metadata, strategy.suggestions());
    }

    private long processingTimeMs(Query query) {
        if (query.timestamp() == null) {
            return 0L;
        }
        Instant now = clock.instant();
        return Math.max(0L, Duration.between(query.timestamp(), now).toMillis());
    }
}
