package com.github.salilvnair.researchengine.engine.core;

import com.github.salilvnair.researchengine.config.ResearchEngineIntentConfig;
import com.github.salilvnair.researchengine.dispatch.ToolDispatcher;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineException;
import com.github.salilvnair.researchengine.engine.history.core.ConversationStore;
import com.github.salilvnair.researchengine.engine.model.AggregatedResult;
import com.github.salilvnair.researchengine.engine.model.ConversationTurn;
import com.github.salilvnair.researchengine.engine.model.IntegratedResponse;
import com.github.salilvnair.researchengine.engine.model.Intent;
import com.github.salilvnair.researchengine.engine.model.IntentType;
import com.github.salilvnair.researchengine.engine.model.Query;
import com.github.salilvnair.researchengine.engine.model.ResponseMetadata;
import com.github.salilvnair.researchengine.engine.model.TurnRole;
import com.github.salilvnair.researchengine.integration.ResponseIntegrator;
import com.github.salilvnair.researchengine.intent.IntentAnalyzer;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static com.github.salilvnair.researchengine.support.TestConstants.BOOM;
import static com.github.salilvnair.researchengine.support.TestConstants.CONVERSATION_ID;
import static com.github.salilvnair.researchengine.support.TestConstants.KEYWORD_DEEP_LEARNING;
import static com.github.salilvnair.researchengine.support.TestConstants.LLM_ANSWER;
import static com.github.salilvnair.researchengine.support.TestConstants.QUERY_DEEP_LEARNING;
import static com.github.salilvnair.researchengine.support.TestConstants.QUERY_WHO_IS_BENGIO;
import static com.github.salilvnair.researchengine.support.TestConstants.USER_ID;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ResearchOrchestratorTest {

    private static final Instant NOW = Instant.parse("2026-10-17T10:00:00Z");

    @Mock
    private IntentAnalyzer intentAnalyzer;
    @Mock
    private ToolDispatcher toolDispatcher;
    @Mock
    private ResponseIntegrator responseIntegrator;
    @Mock
    private ConversationStore conversationStore;

    private ResearchOrchestrator orchestrator;

    private final Query query = new Query(QUERY_DEEP_LEARNING, USER_ID, CONVERSATION_ID, NOW);
    private final Intent intent = new Intent(IntentType.SEARCH_PAPERS, Map.of(Intent.KEYWORDS, List.of(KEYWORD_DEEP_LEARNING)), 0.85d);
    private final AggregatedResult aggregated = AggregatedResult.empty(intent);
    private final IntegratedResponse answer = new IntegratedResponse(LLM_ANSWER,
            new ResponseMetadata(IntentType.SEARCH_PAPERS, 0.85d, 12L, false, false, "paper_list", List.of("search_papers")),
            List.of());
    private final IntegratedResponse errorAnswer = new IntegratedResponse("Sorry",
            new ResponseMetadata(IntentType.SEARCH_PAPERS, 0.85d, 12L, true, true, "paper_list", List.of()),
            List.of());

    @BeforeEach
    void setUp() {
        orchestrator = new ResearchOrchestrator(intentAnalyzer, toolDispatcher, responseIntegrator, conversationStore,
                new ResearchEngineIntentConfig(), Runnable::run, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void processRunsPipelineAndAppendsBothTurns() throws Exception {
        List<ConversationTurn> history = List.of(ConversationTurn.user(QUERY_WHO_IS_BENGIO, NOW.minusSeconds(60)));
        when(conversationStore.lastTurns(CONVERSATION_ID, 6)).thenReturn(history);
        when(intentAnalyzer.classify(query, history)).thenReturn(intent);
        when(toolDispatcher.dispatch(intent)).thenReturn(CompletableFuture.completedFuture(aggregated));
        when(responseIntegrator.integrate(query, intent, aggregated, history)).thenReturn(answer);

        IntegratedResponse response = orchestrator.process(query).get(1, TimeUnit.SECONDS);

        assertSame(answer, response);
        ArgumentCaptor<ConversationTurn> turns = ArgumentCaptor.forClass(ConversationTurn.class);
        InOrder order = inOrder(conversationStore);
        order.verify(conversationStore, times(2)).append(eq(CONVERSATION_ID), eq(USER_ID), turns.capture());
        assertEquals(TurnRole.USER, turns.getAllValues().get(0).role());
        assertEquals(QUERY_DEEP_LEARNING, turns.getAllValues().get(0).content());
        assertEquals(TurnRole.ASSISTANT, turns.getAllValues().get(1).role());
        assertEquals(IntentType.SEARCH_PAPERS, turns.getAllValues().get(1).intentType());
        assertEquals(List.of(KEYWORD_DEEP_LEARNING), turns.getAllValues().get(1).parameters().get(Intent.KEYWORDS));
    }

    @Test
    void unreadableHistoryFallsBackToEmptyWindow() throws Exception {
        when(conversationStore.lastTurns(anyString(), anyInt())).thenThrow(new IllegalStateException(BOOM));
        when(intentAnalyzer.classify(query, List.of())).thenReturn(intent);
        when(toolDispatcher.dispatch(intent)).thenReturn(CompletableFuture.completedFuture(aggregated));
        when(responseIntegrator.integrate(query, intent, aggregated, List.of())).thenReturn(answer);

        assertSame(answer, orchestrator.process(query).get(1, TimeUnit.SECONDS));
    }

    @Test
    void failedTurnAppendDoesNotFailResponse() throws Exception {
        when(conversationStore.lastTurns(CONVERSATION_ID, 6)).thenReturn(List.of());
        when(intentAnalyzer.classify(query, List.of())).thenReturn(intent);
        when(toolDispatcher.dispatch(intent)).thenReturn(CompletableFuture.completedFuture(aggregated));
        when(responseIntegrator.integrate(query, intent, aggregated, List.of())).thenReturn(answer);
        doThrow(new IllegalStateException(BOOM)).when(conversationStore).append(anyString(), anyString(), any());

        assertSame(answer, orchestrator.process(query).get(1, TimeUnit.SECONDS));
    }

    @Test
    void dispatchFaultBecomesErrorResponse() throws Exception {
        when(conversationStore.lastTurns(CONVERSATION_ID, 6)).thenReturn(List.of());
        when(intentAnalyzer.classify(query, List.of())).thenReturn(intent);
        when(toolDispatcher.dispatch(intent)).thenReturn(CompletableFuture.failedFuture(new IllegalStateException(BOOM)));
        when(responseIntegrator.error(query, intent)).thenReturn(errorAnswer);

        assertSame(errorAnswer, orchestrator.process(query).get(1, TimeUnit.SECONDS));
        verify(conversationStore, times(2)).append(eq(CONVERSATION_ID), eq(USER_ID), any());
    }

    @Test
    void classificationFaultBecomesErrorResponseForUnknownIntent() throws Exception {
        when(conversationStore.lastTurns(CONVERSATION_ID, 6)).thenReturn(List.of());
        when(intentAnalyzer.classify(query, List.of())).thenThrow(new IllegalStateException(BOOM));
        ArgumentCaptor<Intent> intentCaptor = ArgumentCaptor.forClass(Intent.class);
        when(responseIntegrator.error(eq(query), intentCaptor.capture())).thenReturn(errorAnswer);

        assertSame(errorAnswer, orchestrator.process(query).get(1, TimeUnit.SECONDS));
        assertEquals(IntentType.UNKNOWN, intentCaptor.getValue().type());
        verifyNoInteractions(toolDispatcher);
    }

    @Test
    void queryWithoutConversationSkipsStore() throws Exception {
        Query anonymous = new Query(QUERY_DEEP_LEARNING, USER_ID, null, NOW);
        when(intentAnalyzer.classify(anonymous, List.of())).thenReturn(intent);
        when(toolDispatcher.dispatch(intent)).thenReturn(CompletableFuture.completedFuture(aggregated));
        when(responseIntegrator.integrate(anonymous, intent, aggregated, List.of())).thenReturn(answer);

        assertSame(answer, orchestrator.process(anonymous).get(1, TimeUnit.SECONDS));
        verifyNoInteractions(conversationStore);
    }

    @Test
    void blankQueryIsRejected() {
        CompletableFuture<IntegratedResponse> future = orchestrator.process(new Query("  ", USER_ID, CONVERSATION_ID, NOW));

        ExecutionException failure = assertThrows(ExecutionException.class, () -> future.get(1, TimeUnit.SECONDS));
        ResearchEngineException cause = assertInstanceOf(ResearchEngineException.class, failure.getCause());
        assertEquals(ResearchEngineErrorCode.INVALID_REQUEST, cause.getErrorCode());
        verifyNoInteractions(intentAnalyzer);
    }
}
