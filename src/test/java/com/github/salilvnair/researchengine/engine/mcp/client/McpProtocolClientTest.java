package com.github.salilvnair.researchengine.engine.mcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.researchengine.config.ResearchEngineMcpConfig;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.model.ToolInvocation;
import com.github.salilvnair.researchengine.engine.model.ToolResult;
import com.github.salilvnair.researchengine.engine.model.ToolStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static com.github.salilvnair.researchengine.support.TestConstants.KEYWORD_DEEP_LEARNING;
import static com.github.salilvnair.researchengine.support.TestConstants.TITLE_DEEP_LEARNING;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class McpProtocolClientTest {

    private static final String SEARCH_PAPERS = "search_papers";

    private final ObjectMapper mapper = new ObjectMapper();
    private final AtomicInteger created = new AtomicInteger();
    private final List<FakeMcpTransport> transports = new CopyOnWriteArrayList<>();

    private ExecutorService executor;
    private ScheduledExecutorService scheduler;
    private ResearchEngineMcpConfig config;
    private McpProtocolClient client;

    @BeforeEach
    void setUp() {
        executor = Executors.newCachedThreadPool();
        scheduler = Executors.newSingleThreadScheduledExecutor();
        config = new ResearchEngineMcpConfig();
        config.setConnectTimeoutMs(1000L);
        config.setCallTimeoutMs(1000L);
        config.setMaxRetries(3);
        config.setRetryDelayMs(10L);
        config.setTimeoutThreshold(3);
    }

    @AfterEach
    void tearDown() {
        if (client != null) {
            client.close();
        }
        executor.shutdownNow();
        scheduler.shutdownNow();
    }

    @Test
    void requestPerformsHandshakeBeforeFirstToolCall() throws Exception {
        clientWith(() -> new FakeMcpTransport(mapper, (transport, id, toolName, arguments) ->
                transport.replyText(id, "{\"papers\":[{\"title\":\"" + TITLE_DEEP_LEARNING + "\"}]}", false)));

        ToolResult result = call(Map.of("query", KEYWORD_DEEP_LEARNING));

        assertEquals(ToolStatus.OK, result.status());
        assertEquals(SEARCH_PAPERS, result.toolName());
        assertTrue(result.payload().path("content").get(0).path("text").asText().contains(TITLE_DEEP_LEARNING));
        assertEquals(ConnectionState.READY, client.state());

        FakeMcpTransport transport = transports.get(0);
        assertEquals(McpMessageCodec.METHOD_INITIALIZE, transport.sent().get(0).path("method").asText());
        assertEquals(McpMessageCodec.METHOD_INITIALIZED, transport.sent().get(1).path("method").asText());
        JsonNode toolCall = transport.sentToolCalls().get(0);
        assertEquals(SEARCH_PAPERS, toolCall.path("params").path("name").asText());
        assertEquals(KEYWORD_DEEP_LEARNING, toolCall.path("params").path("arguments").path("query").asText());
        assertEquals(result.correlationId(), toolCall.path("id").asLong());
    }

    @Test
    void toolReportedErrorBecomesFailedResultWithoutRetry() throws Exception {
        clientWith(() -> new FakeMcpTransport(mapper, (transport, id, toolName, arguments) ->
                transport.replyText(id, "Paper not found", true)));

        ToolResult result = call(Map.of("paper_id", "missing"));

        assertEquals(ToolStatus.ERROR, result.status());
        assertEquals(ResearchEngineErrorCode.TOOL_ERROR, result.error().code());
        assertEquals("Paper not found", result.error().detail());
        assertEquals(1, transports.get(0).sentToolCalls().size());
        assertEquals(ConnectionState.READY, client.state());
    }

    @Test
    void jsonRpcErrorBecomesToolError() throws Exception {
        clientWith(() -> new FakeMcpTransport(mapper, (transport, id, toolName, arguments) ->
                transport.replyRpcError(id, -32602, "Unknown tool")));

        ToolResult result = call(Map.of());

        assertEquals(ToolStatus.ERROR, result.status());
        assertEquals(ResearchEngineErrorCode.TOOL_ERROR, result.error().code());
        assertTrue(result.error().detail().contains("Unknown tool"));
    }

    @Test
    void serverLogOutputOnStdoutIsIgnored() throws Exception {
        clientWith(() -> new FakeMcpTransport(mapper, (transport, id, toolName, arguments) -> {
            transport.emitRaw("INFO academic data server ready");
            transport.emitRaw("");
            transport.replyText(id, "{\"papers\":[]}", false);
        }));

        ToolResult result = call(Map.of());

        assertEquals(ToolStatus.OK, result.status());
    }

    @Test
    void callTimeoutReturnsTimeoutResultAndKeepsConnection() throws Exception {
        config.setCallTimeoutMs(100L);
        clientWith(() -> new FakeMcpTransport(mapper, (transport, id, toolName, arguments) -> { }));

        ToolResult result = call(Map.of());

        assertEquals(ToolStatus.TIMEOUT, result.status());
        assertEquals(ResearchEngineErrorCode.PROTOCOL_TIMEOUT, result.error().code());
        assertEquals(ConnectionState.READY, client.state());
        assertEquals(1, created.get());
        assertEquals(1, client.health().consecutiveTimeouts());
    }

    @Test
    void consecutiveTimeoutsPastThresholdDegradeConnection() throws Exception {
        config.setCallTimeoutMs(100L);
        config.setTimeoutThreshold(2);
        config.setRetryDelayMs(60_000L);
        clientWith(() -> new FakeMcpTransport(mapper, (transport, id, toolName, arguments) -> { }));

        assertEquals(ToolStatus.TIMEOUT, call(Map.of()).status());
        assertEquals(ConnectionState.READY, client.state());
        assertEquals(ToolStatus.TIMEOUT, call(Map.of()).status());

        assertEquals(ConnectionState.DEGRADED, client.state());
        awaitClosed(transports.get(0));
    }

    @Test
    void connectFailuresAreBoundedAndClosedClientFailsFast() throws Exception {
        clientWith(() -> FakeMcpTransport.failingToStart(mapper));

        ToolResult first = call(Map.of());

        assertEquals(ToolStatus.ERROR, first.status());
        assertEquals(ResearchEngineErrorCode.MCP_CLIENT_CLOSED, first.error().code());
        assertEquals(ConnectionState.CLOSED, client.state());
        assertEquals(config.getMaxRetries(), created.get());

        ToolResult second = call(Map.of());

        assertEquals(ResearchEngineErrorCode.MCP_CLIENT_CLOSED, second.error().code());
        assertEquals(config.getMaxRetries(), created.get());
    }

    @Test
    void handshakeWithoutAnswerCountsAsConnectFailure() throws Exception {
        config.setConnectTimeoutMs(100L);
        config.setMaxRetries(2);
        clientWith(() -> FakeMcpTransport.silent(mapper));

        ToolResult result = call(Map.of());

        assertEquals(ResearchEngineErrorCode.MCP_CLIENT_CLOSED, result.error().code());
        assertEquals(2, created.get());
        assertTrue(transports.stream().allMatch(FakeMcpTransport::isClosed));
    }

    @Test
    void resetReopensClosedClient() throws Exception {
        AtomicInteger attempts = new AtomicInteger();
        clientWith(() -> attempts.incrementAndGet() <= config.getMaxRetries()
                ? FakeMcpTransport.failingToStart(mapper)
                : new FakeMcpTransport(mapper, (transport, id, toolName, arguments) -> transport.replyText(id, "{}", false)));

        assertEquals(ResearchEngineErrorCode.MCP_CLIENT_CLOSED, call(Map.of()).error().code());
        assertEquals(ConnectionState.CLOSED, client.state());

        client.reset();
        assertEquals(ConnectionState.DISCONNECTED, client.state());

        ToolResult result = call(Map.of());

        assertEquals(ToolStatus.OK, result.status());
        assertEquals(ConnectionState.READY, client.state());
        assertEquals(config.getMaxRetries() + 1, created.get());
    }

    @Test
    void transportLossIsRetriedOnReconnectedSession() throws Exception {
        clientWith(() -> created.get() == 1
                ? new FakeMcpTransport(mapper, (transport, id, toolName, arguments) -> transport.die())
                : new FakeMcpTransport(mapper, (transport, id, toolName, arguments) ->
                        transport.replyText(id, "{\"papers\":[]}", false)));

        ToolResult result = call(Map.of());

        assertEquals(ToolStatus.OK, result.status());
        assertEquals(2, created.get());
        awaitClosed(transports.get(0));
        awaitState(ConnectionState.READY);
    }

    @Test
    void slowTeardownOfDegradedConnectionDoesNotDelayOtherTimeouts() throws Exception {
        config.setCallTimeoutMs(100L);
        config.setTimeoutThreshold(1);
        clientWith(() -> created.get() == 1
                ? new FakeMcpTransport(mapper, (transport, id, toolName, arguments) -> { }).slowToClose(3000L)
                : new FakeMcpTransport(mapper, (transport, id, toolName, arguments) -> { }));

        long firstStart = System.nanoTime();
        assertEquals(ToolStatus.TIMEOUT, call(Map.of()).status());
        long firstTook = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - firstStart);

        awaitState(ConnectionState.READY);
        long secondStart = System.nanoTime();
        assertEquals(ToolStatus.TIMEOUT, call(Map.of()).status());
        long secondTook = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - secondStart);

        assertTrue(firstTook < 1000L, "first call took " + firstTook + "ms");
        assertTrue(secondTook < 1000L, "second call took " + secondTook + "ms");
    }

    @Test
    void concurrentCallsOnBrokenConnectionShareOneReconnect() throws Exception {
        config.setRetryDelayMs(50L);
        clientWith(() -> created.get() == 1
                ? new FakeMcpTransport(mapper, (transport, id, toolName, arguments) -> transport.die())
                : new FakeMcpTransport(mapper, (transport, id, toolName, arguments) ->
                        transport.replyText(id, "{\"papers\":[]}", false)));
        client.start().get(5, TimeUnit.SECONDS);

        List<CompletableFuture<ToolResult>> futures = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            futures.add(client.request(SEARCH_PAPERS, Map.of("query", "q" + i), Duration.ofSeconds(2)));
        }

        for (CompletableFuture<ToolResult> future : futures) {
            assertEquals(ToolStatus.OK, future.get(5, TimeUnit.SECONDS).status());
        }
        assertEquals(2, created.get());
        assertEquals(ConnectionState.READY, client.state());
    }

    @Test
    void correlationIdsWrapAndSkipIdsStillPending() throws Exception {
        CountDownLatch held = new CountDownLatch(1);
        clientWith(() -> new FakeMcpTransport(mapper, (transport, id, toolName, arguments) -> held.countDown()));
        client.start().get(5, TimeUnit.SECONDS);
        awaitToolsListed();

        CompletableFuture<ToolResult> pending = client.request(
                new ToolInvocation(SEARCH_PAPERS, Map.of(), 1L), Duration.ofSeconds(30));
        assertTrue(held.await(5, TimeUnit.SECONDS));
        client.seedCorrelationSequence(Long.MAX_VALUE - 1L);

        assertEquals(Long.MAX_VALUE, client.nextCorrelationId());
        assertEquals(2L, client.nextCorrelationId());
        assertFalse(pending.isDone());
    }

    @Test
    void concurrentCallsAreDemultiplexedByCorrelationId() throws Exception {
        List<Long> received = new ArrayList<>();
        List<String> queries = new ArrayList<>();
        clientWith(() -> new FakeMcpTransport(mapper, (transport, id, toolName, arguments) -> {
            synchronized (received) {
                received.add(id);
                queries.add(arguments.path("query").asText());
                if (received.size() < 3) {
                    return;
                }
                // answer in reverse order of arrival
                for (int i = received.size() - 1; i >= 0; i--) {
                    ObjectNode result = mapper.createObjectNode();
                    result.putObject("structuredContent").put("echo", queries.get(i));
                    transport.reply(received.get(i), result);
                }
            }
        }));

        List<CompletableFuture<ToolResult>> futures = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            futures.add(client.request(SEARCH_PAPERS, Map.of("query", "q" + i), Duration.ofSeconds(2)));
        }

        Set<Long> ids = new HashSet<>();
        for (int i = 0; i < 3; i++) {
            ToolResult result = futures.get(i).get(5, TimeUnit.SECONDS);
            assertEquals(ToolStatus.OK, result.status());
            assertEquals("q" + i, result.payload().path("structuredContent").path("echo").asText());
            ids.add(result.correlationId());
        }
        assertEquals(3, ids.size());
    }

    @Test
    void closeFailsInFlightAndLaterCalls() throws Exception {
        CountDownLatch inFlight = new CountDownLatch(1);
        clientWith(() -> new FakeMcpTransport(mapper, (transport, id, toolName, arguments) -> inFlight.countDown()));

        CompletableFuture<ToolResult> pending = client.request(SEARCH_PAPERS, Map.of(), Duration.ofSeconds(30));
        assertTrue(inFlight.await(5, TimeUnit.SECONDS));

        client.close();

        ToolResult result = pending.get(5, TimeUnit.SECONDS);
        assertEquals(ToolStatus.ERROR, result.status());
        assertEquals(ConnectionState.CLOSED, client.state());
        assertEquals(ResearchEngineErrorCode.MCP_CLIENT_CLOSED, call(Map.of()).error().code());
        assertEquals(1, created.get());
        assertFalse(client.health().alive());
    }

    private void clientWith(Supplier<FakeMcpTransport> supplier) {
        client = new McpProtocolClient(() -> {
            created.incrementAndGet();
            FakeMcpTransport transport = supplier.get();
            transports.add(transport);
            return transport;
        }, config, mapper, executor, scheduler);
    }

    private ToolResult call(Map<String, Object> arguments) throws Exception {
        return client.request(SEARCH_PAPERS, arguments, Duration.ofMillis(config.getCallTimeoutMs()))
                .get(5, TimeUnit.SECONDS);
    }

    private void awaitToolsListed() throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000L;
        while (client.availableTools().isEmpty() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10L);
        }
        assertFalse(client.availableTools().isEmpty());
    }

    private void awaitClosed(FakeMcpTransport transport) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000L;
        while (!transport.isClosed() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10L);
        }
        assertTrue(transport.isClosed());
    }

    private void awaitState(ConnectionState expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 5000L;
        while (client.state() != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(10L);
        }
        assertEquals(expected, client.state());
    }
}
