package com.github.salilvnair.researchengine.engine.mcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.salilvnair.researchengine.config.ResearchEngineMcpConfig;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineException;
import com.github.salilvnair.researchengine.engine.model.ToolInvocation;
import com.github.salilvnair.researchengine.engine.model.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Owns the data service subprocess and multiplexes tool calls over it.
 * <p>
 * Lifecycle: DISCONNECTED -> CONNECTING -> READY, READY -> DEGRADED on a broken transport or
 * too many consecutive timeouts, DEGRADED -> CONNECTING after the retry delay, and CLOSED once
 * {@code maxRetries} consecutive connect attempts failed or on {@link #close()}. CLOSED fails
 * every call fast until {@link #reset()}.
 * <p>
 * All state changes happen under {@code stateLock}. While a connect attempt is running every
 * caller waits on the same readiness future, so only one attempt is ever in progress.
 * The supplied executor must run tasks asynchronously.
 */
@Slf4j
public class McpProtocolClient implements McpToolClient, AutoCloseable {

    private static final long HANDSHAKE_WAIT_MARGIN_MS = 500L;

    private final McpTransportFactory transportFactory;
    private final ResearchEngineMcpConfig config;
    private final McpMessageCodec codec;
    private final Executor executor;
    private final ScheduledExecutorService scheduler;

    private final Object stateLock = new Object();
    private final AtomicLong correlationSequence = new AtomicLong();
    private final AtomicLong connectionSequence = new AtomicLong();
    private final AtomicInteger consecutiveTimeouts = new AtomicInteger();

    private ConnectionState state = ConnectionState.DISCONNECTED;
    private McpConnection connection;
    private CompletableFuture<McpConnection> readiness;
    private int consecutiveConnectFailures;
    private volatile List<String> availableTools = List.of();

    public McpProtocolClient(McpTransportFactory transportFactory,
                             ResearchEngineMcpConfig config,
                             ObjectMapper mapper,
                             Executor executor,
                             ScheduledExecutorService scheduler) {
        this.transportFactory = transportFactory;
        this.config = config;
        this.codec = new McpMessageCodec(mapper);
        this.executor = executor;
        this.scheduler = scheduler;
    }

    public ConnectionState state() {
        synchronized (stateLock) {
            return state;
        }
    }

    public List<String> availableTools() {
        return availableTools;
    }

    /**
     * Starts connecting without issuing a call. The future fails if the client ends up CLOSED.
     */
    public CompletableFuture<Void> start() {
        return awaitReady().thenApply(ignored -> null);
    }

    @Override
    public Duration defaultCallTimeout() {
        return Duration.ofMillis(config.getCallTimeoutMs());
    }

    @Override
    public long nextCorrelationId() {
        McpConnection current;
        synchronized (stateLock) {
            current = connection;
        }
        long id;
        do {
            id = correlationSequence.updateAndGet(value -> value == Long.MAX_VALUE ? 1L : value + 1L);
        } while (current != null && current.isPending(id));
        return id;
    }

    void seedCorrelationSequence(long lastIssued) {
        correlationSequence.set(lastIssued);
    }

    @Override
    public CompletableFuture<ToolResult> request(ToolInvocation invocation, Duration timeout) {
        CompletableFuture<ToolResult> result = new CompletableFuture<>();
        attempt(invocation, timeout == null ? defaultCallTimeout() : timeout, 1, result);
        return result;
    }

    public McpClientHealth health() {
        synchronized (stateLock) {
            return new McpClientHealth(
                    state,
                    connection != null && connection.isAlive(),
                    consecutiveConnectFailures,
                    consecutiveTimeouts.get(),
                    connection == null ? 0 : connection.pendingCount(),
                    availableTools
            );
        }
    }

    /**
     * Leaves CLOSED so that the next call connects again. No effect in any other state.
     */
    public void reset() {
        synchronized (stateLock) {
            if (state != ConnectionState.CLOSED) {
                return;
            }
            consecutiveConnectFailures = 0;
            consecutiveTimeouts.set(0);
            transition(ConnectionState.DISCONNECTED, "explicit reset");
        }
    }

    @Override
    public void close() {
        McpConnection current;
        CompletableFuture<McpConnection> waiters;
        synchronized (stateLock) {
            if (state == ConnectionState.CLOSED && connection == null && readiness == null) {
                return;
            }
            current = connection;
            waiters = readiness;
            connection = null;
            readiness = null;
            transition(ConnectionState.CLOSED, "shutdown");
        }
        if (waiters != null) {
            waiters.completeExceptionally(new ResearchEngineException(ResearchEngineErrorCode.MCP_CLIENT_CLOSED,
                    "MCP client shut down"));
        }
        if (current != null) {
            current.close();
        }
    }

    private void attempt(ToolInvocation invocation, Duration timeout, int attemptNo, CompletableFuture<ToolResult> result) {
        awaitReady().whenComplete((active, readyFailure) -> {
            if (readyFailure != null) {
                completeWithFailure(invocation, asEngineException(readyFailure), result);
                return;
            }
            try {
                active.call(invocation.correlationId(), McpMessageCodec.METHOD_TOOLS_CALL,
                                codec.toolCallParams(invocation.toolName(), invocation.arguments()), timeout)
                        .whenComplete((response, callFailure) ->
                                onCallComplete(invocation, timeout, attemptNo, active, response, callFailure, result));
            } catch (RuntimeException e) {
                completeWithFailure(invocation, asEngineException(e), result);
            }
        });
    }

    private void onCallComplete(ToolInvocation invocation,
                                Duration timeout,
                                int attemptNo,
                                McpConnection active,
                                JsonNode response,
                                Throwable callFailure,
                                CompletableFuture<ToolResult> result) {
        if (callFailure == null) {
            consecutiveTimeouts.set(0);
            result.complete(codec.toToolResult(invocation, response));
            return;
        }
        ResearchEngineException failure = asEngineException(callFailure);
        switch (failure.getErrorCode()) {
            case PROTOCOL_TIMEOUT -> {
                onCallTimeout(active, invocation);
                result.complete(ToolResult.timeout(invocation.correlationId(), invocation.toolName(), failure.getMessage()));
            }
            case TRANSPORT_ERROR -> {
                connectionLost(active, failure);
                if (attemptNo < maxRetries()) {
                    log.warn("MCP call tool={} id={} hit a transport failure, retrying after reconnect (attempt {}/{})",
                            invocation.toolName(), invocation.correlationId(), attemptNo + 1, maxRetries());
                    attempt(invocation, timeout, attemptNo + 1, result);
                } else {
                    completeWithFailure(invocation, failure, result);
                }
            }
            default -> completeWithFailure(invocation, failure, result);
        }
    }

    private void completeWithFailure(ToolInvocation invocation, ResearchEngineException failure, CompletableFuture<ToolResult> result) {
        log.warn("MCP call tool={} id={} failed errorCode={} detail={}",
                invocation.toolName(), invocation.correlationId(), failure.getErrorCode(), failure.getMessage());
        result.complete(ToolResult.error(invocation.correlationId(), invocation.toolName(),
                failure.getErrorCode(), failure.getMessage()));
    }

    private void onCallTimeout(McpConnection active, ToolInvocation invocation) {
        int timeouts = consecutiveTimeouts.incrementAndGet();
        log.warn("MCP call tool={} id={} timed out consecutiveTimeouts={}",
                invocation.toolName(), invocation.correlationId(), timeouts);
        if (timeouts >= Math.max(1, config.getTimeoutThreshold())) {
            connectionLost(active, new ResearchEngineException(ResearchEngineErrorCode.PROTOCOL_TIMEOUT,
                    timeouts + " consecutive call timeouts"));
        }
    }

    private CompletableFuture<McpConnection> awaitReady() {
        synchronized (stateLock) {
            switch (state) {
                case READY -> {
                    return CompletableFuture.completedFuture(connection);
                }
                case CLOSED -> {
                    return CompletableFuture.failedFuture(new ResearchEngineException(ResearchEngineErrorCode.MCP_CLIENT_CLOSED));
                }
                case CONNECTING, DEGRADED -> {
                    return readiness;
                }
                default -> {
                    readiness = new CompletableFuture<>();
                    transition(ConnectionState.CONNECTING, "first use");
                    scheduleConnect(0L);
                    return readiness;
                }
            }
        }
    }

    private void scheduleConnect(long delayMs) {
        Executor target = delayMs > 0
                ? CompletableFuture.delayedExecutor(delayMs, TimeUnit.MILLISECONDS, executor)
                : executor;
        try {
            target.execute(this::connectAttempt);
        } catch (RejectedExecutionException e) {
            log.error("MCP reconnect could not be scheduled, closing client", e);
            CompletableFuture<McpConnection> waiters = readiness;
            readiness = null;
            transition(ConnectionState.CLOSED, "executor rejected connect attempt");
            if (waiters != null) {
                waiters.completeExceptionally(new ResearchEngineException(ResearchEngineErrorCode.MCP_CLIENT_CLOSED,
                        "MCP connect attempt rejected", e));
            }
        }
    }

    private void connectAttempt() {
        synchronized (stateLock) {
            if (state == ConnectionState.CLOSED) {
                return;
            }
            if (state != ConnectionState.CONNECTING) {
                transition(ConnectionState.CONNECTING, "retry " + (consecutiveConnectFailures + 1) + "/" + maxRetries());
            }
        }

        McpConnection candidate;
        try {
            candidate = openConnection();
        } catch (ResearchEngineException e) {
            onConnectFailure(e);
            return;
        }

        CompletableFuture<McpConnection> waiters = null;
        boolean discard = false;
        synchronized (stateLock) {
            if (state == ConnectionState.CLOSED) {
                discard = true;
            } else {
                connection = candidate;
                consecutiveConnectFailures = 0;
                consecutiveTimeouts.set(0);
                waiters = readiness;
                readiness = null;
                transition(ConnectionState.READY, "handshake complete on connection #" + candidate.ordinal());
            }
        }
        if (discard) {
            candidate.close();
            return;
        }
        if (waiters != null) {
            waiters.complete(candidate);
        }
        refreshTools(candidate);
    }

    private McpConnection openConnection() {
        long connectTimeoutMs = config.getConnectTimeoutMs();
        McpConnection candidate;
        try {
            candidate = new McpConnection(connectionSequence.incrementAndGet(), transportFactory.create(),
                    codec, scheduler, executor, this::connectionLost);
        } catch (RuntimeException e) {
            throw new ResearchEngineException(ResearchEngineErrorCode.MCP_STARTUP_FAILED,
                    "MCP transport could not be created: " + e.getMessage(), e);
        }
        try {
            candidate.open();
            JsonNode response = candidate.call(nextCorrelationId(), McpMessageCodec.METHOD_INITIALIZE,
                            codec.initializeParams(config.getProtocolVersion(), config.getClientName(), config.getClientVersion()),
                            Duration.ofMillis(connectTimeoutMs))
                    .get(connectTimeoutMs + HANDSHAKE_WAIT_MARGIN_MS, TimeUnit.MILLISECONDS);
            if (response.hasNonNull("error")) {
                throw new ResearchEngineException(ResearchEngineErrorCode.MCP_STARTUP_FAILED,
                        "initialize rejected: " + codec.errorMessage(response));
            }
            candidate.notify(McpMessageCodec.METHOD_INITIALIZED, null);
            JsonNode serverInfo = response.path("result").path("serverInfo");
            log.info("MCP connection #{} initialized server={} version={}",
                    candidate.ordinal(), serverInfo.path("name").asText("?"), serverInfo.path("version").asText("?"));
            return candidate;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            candidate.close();
            throw new ResearchEngineException(ResearchEngineErrorCode.MCP_STARTUP_FAILED, "MCP handshake interrupted", e);
        } catch (IOException | ExecutionException | TimeoutException e) {
            candidate.close();
            Throwable cause = e instanceof ExecutionException && e.getCause() != null ? e.getCause() : e;
            throw new ResearchEngineException(ResearchEngineErrorCode.MCP_STARTUP_FAILED,
                    "MCP handshake failed: " + cause.getMessage(), cause);
        } catch (RuntimeException e) {
            candidate.close();
            throw new ResearchEngineException(ResearchEngineErrorCode.MCP_STARTUP_FAILED,
                    "MCP handshake failed: " + e.getMessage(), e);
        }
    }

    private void onConnectFailure(ResearchEngineException failure) {
        CompletableFuture<McpConnection> waiters = null;
        int failures;
        synchronized (stateLock) {
            if (state == ConnectionState.CLOSED) {
                return;
            }
            failures = ++consecutiveConnectFailures;
            if (failures >= maxRetries()) {
                waiters = readiness;
                readiness = null;
                transition(ConnectionState.CLOSED, "connect failed " + failures + " consecutive times");
            } else {
                transition(ConnectionState.DEGRADED, "connect failed: " + failure.getMessage());
                log.warn("MCP reconnect scheduled in {}ms (failure {}/{})", config.getRetryDelayMs(), failures, maxRetries());
                scheduleConnect(config.getRetryDelayMs());
            }
        }
        if (waiters != null) {
            log.error("MCP client closed after {} failed connect attempts, last error: {}", failures, failure.getMessage());
            waiters.completeExceptionally(new ResearchEngineException(ResearchEngineErrorCode.MCP_CLIENT_CLOSED,
                    "MCP client closed after " + failures + " failed connect attempts", failure));
        }
    }

    private void connectionLost(McpConnection lost, Throwable cause) {
        synchronized (stateLock) {
            if (state != ConnectionState.READY || connection != lost) {
                return;
            }
            connection = null;
            readiness = new CompletableFuture<>();
            transition(ConnectionState.DEGRADED, cause == null ? "transport closed" : cause.getMessage());
            log.warn("MCP reconnect scheduled in {}ms", config.getRetryDelayMs());
            scheduleConnect(config.getRetryDelayMs());
        }
        // teardown can block on the process and must not run on the timer thread
        try {
            executor.execute(lost::close);
        } catch (RejectedExecutionException e) {
            log.warn("MCP connection #{} teardown could not be scheduled, closing inline", lost.ordinal());
            lost.close();
        }
    }

    private void refreshTools(McpConnection active) {
        active.call(nextCorrelationId(), McpMessageCodec.METHOD_TOOLS_LIST, null, Duration.ofMillis(config.getConnectTimeoutMs()))
                .whenComplete((response, failure) -> {
                    if (failure != null) {
                        log.warn("MCP tools/list failed on connection #{}: {}", active.ordinal(),
                                asEngineException(failure).getMessage());
                        return;
                    }
                    List<String> names = new ArrayList<>();
                    for (JsonNode tool : response.path("result").path("tools")) {
                        names.add(tool.path("name").asText());
                    }
                    availableTools = List.copyOf(names);
                    log.info("MCP connection #{} exposes {} tools", active.ordinal(), names.size());
                });
    }

    private void transition(ConnectionState next, String reason) {
        if (state != next) {
            log.info("MCP client state {} -> {} reason={}", state, next, reason);
        }
        state = next;
    }

    private int maxRetries() {
        return Math.max(1, config.getMaxRetries());
    }

    private static ResearchEngineException asEngineException(Throwable failure) {
        Throwable cause = failure;
        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause instanceof ResearchEngineException engineException) {
            return engineException;
        }
        return new ResearchEngineException(ResearchEngineErrorCode.TRANSPORT_ERROR,
                cause.getClass().getSimpleName() + ": " + cause.getMessage(), cause);
    }
}
