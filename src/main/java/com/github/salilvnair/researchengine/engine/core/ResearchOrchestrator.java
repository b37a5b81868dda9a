package com.github.salilvnair.researchengine.engine.core;

import com.github.salilvnair.researchengine.config.ResearchEngineAsyncConfiguration;
import com.github.salilvnair.researchengine.config.ResearchEngineIntentConfig;
import com.github.salilvnair.researchengine.dispatch.ToolDispatcher;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineException;
import com.github.salilvnair.researchengine.engine.history.core.ConversationStore;
import com.github.salilvnair.researchengine.engine.model.ConversationTurn;
import com.github.salilvnair.researchengine.engine.model.IntegratedResponse;
import com.github.salilvnair.researchengine.engine.model.Intent;
import com.github.salilvnair.researchengine.engine.model.Query;
import com.github.salilvnair.researchengine.integration.ResponseIntegrator;
import com.github.salilvnair.researchengine.intent.IntentAnalyzer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs one query through classification, tool dispatch and integration. Every query ends in an
 * {@link IntegratedResponse}; unexpected faults become the generic error response.
 */
@Slf4j
@Component
public class ResearchOrchestrator {

    private final IntentAnalyzer intentAnalyzer;
    private final ToolDispatcher toolDispatcher;
    private final ResponseIntegrator responseIntegrator;
    private final ConversationStore conversationStore;
    private final ResearchEngineIntentConfig intentConfig;
    private final Executor executor;
    private final Clock clock;

    public ResearchOrchestrator(IntentAnalyzer intentAnalyzer,
                                ToolDispatcher toolDispatcher,
                                ResponseIntegrator responseIntegrator,
                                ConversationStore conversationStore,
                                ResearchEngineIntentConfig intentConfig,
                                @Qualifier(ResearchEngineAsyncConfiguration.ENGINE_EXECUTOR) Executor executor,
                                Clock clock) {
        this.intentAnalyzer = intentAnalyzer;
        this.toolDispatcher = toolDispatcher;
        this.responseIntegrator = responseIntegrator;
        this.conversationStore = conversationStore;
        this.intentConfig = intentConfig;
        this.executor = executor;
        this.clock = clock;
    }

    public CompletableFuture<IntegratedResponse> process(Query query) {
        if (query == null || query.text() == null || query.text().isBlank()) {
            return CompletableFuture.failedFuture(
                    new ResearchEngineException(ResearchEngineErrorCode.INVALID_REQUEST, "Query text is required"));
        }
        List<ConversationTurn> history = history(query);
        return CompletableFuture
                .supplyAsync(() -> intentAnalyzer.classify(query, history), executor)
                .thenCompose(intent -> toolDispatcher.dispatch(intent)
                        .thenApplyAsync(aggregated -> responseIntegrator.integrate(query, intent, aggregated, history), executor)
                        .exceptionally(failure -> failed(query, intent, failure))
                        .thenApply(response -> recorded(query, intent, response)))
                .exceptionally(failure -> failed(query, Intent.unknown(0.0d), failure));
    }

    private List<ConversationTurn> history(Query query) {
        if (query.conversationId() == null) {
            return List.of();
        }
        try {
            return conversationStore.lastTurns(query.conversationId(), intentConfig.getHistoryWindow());
        } catch (RuntimeException e) {
            log.warn("Conversation history unavailable conversationId={} message={}",
                    query.conversationId(), e.getMessage());
            return List.of();
        }
    }

    private IntegratedResponse failed(Query query, Intent intent, Throwable failure) {
        Throwable cause = failure instanceof CompletionException && failure.getCause() != null ? failure.getCause() : failure;
        log.error("Research query failed conversationId={} intent={}", query.conversationId(), intent.type().code(), cause);
        return responseIntegrator.error(query, intent);
    }

    private IntegratedResponse recorded(Query query, Intent intent, IntegratedResponse response) {
        if (query.conversationId() == null) {
            return response;
        }
        try {
            conversationStore.append(query.conversationId(), query.userId(),
                    ConversationTurn.user(query.text(), query.timestamp() == null ? clock.instant() : query.timestamp()));
            conversationStore.append(query.conversationId(), query.userId(),
                    ConversationTurn.assistant(response.message(), intent, clock.instant()));
        } catch (RuntimeException e) {
            log.error("Failed to persist conversation turns conversationId={}: {}", query.conversationId(), e.getMessage());
        }
        return response;
    }
}
