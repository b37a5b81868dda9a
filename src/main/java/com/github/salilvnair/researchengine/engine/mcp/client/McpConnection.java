package com.github.salilvnair.researchengine.engine.mcp.client;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BiConsumer;

/**
 * One live subprocess session. Demultiplexes responses to their pending futures by correlation id.
 */
@Slf4j
class McpConnection implements McpTransportListener {

    private final long ordinal;
    private final McpTransport transport;
    private final McpMessageCodec codec;
    private final ScheduledExecutorService scheduler;
    private final Executor callbackExecutor;
    private final BiConsumer<McpConnection, Throwable> lostHandler;

    private final Map<Long, CompletableFuture<JsonNode>> pending = new ConcurrentHashMap<>();
    private final AtomicBoolean closed = new AtomicBoolean();

    McpConnection(long ordinal,
                  McpTransport transport,
                  McpMessageCodec codec,
                  ScheduledExecutorService scheduler,
                  Executor callbackExecutor,
                  BiConsumer<McpConnection, Throwable> lostHandler) {
        this.ordinal = ordinal;
        this.transport = transport;
        this.codec = codec;
        this.scheduler = scheduler;
        this.callbackExecutor = callbackExecutor;
        this.lostHandler = lostHandler;
    }

    void open() throws IOException {
        transport.start(this);
    }

    long ordinal() {
        return ordinal;
    }

    boolean isAlive() {
        return !closed.get() && transport.isAlive();
    }

    boolean isPending(long id) {
        return pending.containsKey(id);
    }

    int pendingCount() {
        return pending.size();
    }

    CompletableFuture<JsonNode> call(long id, String method, JsonNode params, Duration timeout) {
        CompletableFuture<JsonNode> response = new CompletableFuture<>();
        if (closed.get()) {
            response.completeExceptionally(transportFailure("connection #" + ordinal + " is closed", null));
            return response;
        }
        if (pending.putIfAbsent(id, response) != null) {
            response.completeExceptionally(new ResearchEngineException(ResearchEngineErrorCode.PROTOCOL_VIOLATION,
                    "correlation id " + id + " is already in flight"));
            return response;
        }
        if (closed.get() && pending.remove(id, response)) {
            response.completeExceptionally(transportFailure("connection #" + ordinal + " is closed", null));
            return response;
        }

        ScheduledFuture<?> timer = scheduler.schedule(() -> expire(id, method, response, timeout),
                timeout.toMillis(), TimeUnit.MILLISECONDS);
        response.whenComplete((ignored, failure) -> timer.cancel(false));

        try {
            transport.send(codec.encodeRequest(id, method, params));
            if (log.isDebugEnabled()) {
                log.debug("MCP -> connection={} id={} method={}", ordinal, id, method);
            }
        } catch (IOException e) {
            if (pending.remove(id, response)) {
                response.completeExceptionally(transportFailure("write failed for id " + id, e));
            }
            onClosed(e);
        } catch (RuntimeException e) {
            if (pending.remove(id, response)) {
                response.completeExceptionally(e);
            }
        }
        return response;
    }

    void notify(String method, JsonNode params) throws IOException {
        transport.send(codec.encodeNotification(method, params));
    }

    @Override
    public void onMessage(String line) {
        JsonNode message = codec.decode(line).orElse(null);
        if (message == null) {
            log.debug("MCP connection={} skipped non protocol output: {}", ordinal, line);
            return;
        }
        if (!codec.isResponse(message)) {
            log.debug("MCP connection={} server message method={}", ordinal, message.path("method").asText(""));
            return;
        }
        OptionalLong id = codec.responseId(message);
        CompletableFuture<JsonNode> waiter = id.isPresent() ? pending.remove(id.getAsLong()) : null;
        if (waiter == null) {
            log.debug("MCP connection={} dropped late or unknown response id={}", ordinal, message.get("id"));
            return;
        }
        if (log.isDebugEnabled()) {
            log.debug("MCP <- connection={} id={}", ordinal, id.getAsLong());
        }
        try {
            callbackExecutor.execute(() -> waiter.complete(message));
        } catch (RejectedExecutionException e) {
            waiter.complete(message);
        }
    }

    @Override
    public void onClosed(Throwable cause) {
        if (shutdown(transportFailure("connection #" + ordinal + " lost", cause))) {
            log.warn("MCP connection={} lost: {}", ordinal, cause == null ? "stream ended" : cause.getMessage());
            lostHandler.accept(this, cause);
        }
    }

    void close() {
        shutdown(transportFailure("connection #" + ordinal + " closed", null));
        transport.close();
    }

    private boolean shutdown(ResearchEngineException failure) {
        if (!closed.compareAndSet(false, true)) {
            return false;
        }
        List<Long> ids = new ArrayList<>(pending.keySet());
        for (Long id : ids) {
            CompletableFuture<JsonNode> waiter = pending.remove(id);
            if (waiter != null) {
                waiter.completeExceptionally(failure);
            }
        }
        return true;
    }

    private void expire(long id, String method, CompletableFuture<JsonNode> response, Duration timeout) {
        if (pending.remove(id, response)) {
            response.completeExceptionally(new ResearchEngineException(ResearchEngineErrorCode.PROTOCOL_TIMEOUT,
                    method + " id=" + id + " got no response within " + timeout.toMillis() + "ms"));
        }
    }

    private ResearchEngineException transportFailure(String message, Throwable cause) {
        return new ResearchEngineException(ResearchEngineErrorCode.TRANSPORT_ERROR, message, cause);
    }
}
