package com.github.salilvnair.researchengine.dispatch;

import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.mcp.client.McpToolClient;
import com.github.salilvnair.researchengine.engine.model.AggregatedResult;
import com.github.salilvnair.researchengine.engine.model.Intent;
import com.github.salilvnair.researchengine.engine.model.ToolExchange;
import com.github.salilvnair.researchengine.engine.model.ToolInvocation;
import com.github.salilvnair.researchengine.engine.model.ToolResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Runs the tool plan of an intent. Stages run one after another, the steps of a stage are
 * issued together, and the aggregated result lists exchanges in issue order. A failed call
 * never stops the remaining calls and is not retried here.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolDispatcher {

    private final ToolDispatchTable dispatchTable;
    private final McpToolClient toolClient;

    public ToolPlan plan(Intent intent) {
        return dispatchTable.planFor(intent.type());
    }

    public CompletableFuture<AggregatedResult> dispatch(Intent intent) {
        ToolPlan plan = plan(intent);
        if (plan.isEmpty()) {
            return CompletableFuture.completedFuture(AggregatedResult.empty(intent));
        }
        CompletableFuture<List<ToolExchange>> chain = CompletableFuture.completedFuture(List.of());
        for (ToolStage stage : plan.stages()) {
            chain = chain.thenCompose(done -> runStage(intent, stage, done));
        }
        return chain.thenApply(exchanges -> {
            AggregatedResult aggregated = new AggregatedResult(intent, exchanges);
            log.info("Dispatch finished intent={} tools={} failed={}",
                    intent.type().code(), plan.toolNames(), aggregated.failedResults().size());
            return aggregated;
        });
    }

    private CompletableFuture<List<ToolExchange>> runStage(Intent intent, ToolStage stage, List<ToolExchange> done) {
        List<ToolResult> earlier = done.stream().map(ToolExchange::result).toList();
        List<CompletableFuture<ToolExchange>> issued = new ArrayList<>();
        for (ToolStep step : stage.steps()) {
            issued.add(issue(intent, step, earlier));
        }
        return CompletableFuture.allOf(issued.toArray(new CompletableFuture<?>[0]))
                .thenApply(ignored -> {
                    List<ToolExchange> exchanges = new ArrayList<>(done);
                    issued.forEach(future -> exchanges.add(future.join()));
                    return exchanges;
                });
    }

    private CompletableFuture<ToolExchange> issue(Intent intent, ToolStep step, List<ToolResult> earlier) {
        long correlationId = toolClient.nextCorrelationId();
        Optional<Map<String, Object>> arguments = step.binder().bind(intent, earlier);
        if (arguments.isEmpty()) {
            ToolInvocation invocation = new ToolInvocation(step.toolName(), Map.of(), correlationId);
            log.warn("Tool {} skipped, required input unavailable intent={}", step.toolName(), intent.type().code());
            return CompletableFuture.completedFuture(new ToolExchange(invocation,
                    ToolResult.error(correlationId, step.toolName(), ResearchEngineErrorCode.DEPENDENCY_UNRESOLVED,
                            "no input for " + step.toolName())));
        }

        ToolInvocation invocation = new ToolInvocation(step.toolName(), arguments.get(), correlationId);
        log.debug("Issuing tool={} id={} arguments={}", invocation.toolName(), correlationId, invocation.arguments());
        return toolClient.request(invocation, toolClient.defaultCallTimeout())
                .exceptionally(failure -> ToolResult.error(correlationId, invocation.toolName(),
                        ResearchEngineErrorCode.TRANSPORT_ERROR, String.valueOf(failure.getMessage())))
                .thenApply(result -> new ToolExchange(invocation, result));
    }
}
