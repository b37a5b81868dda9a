package com.github.salilvnair.researchengine.api.controller;

import com.github.salilvnair.researchengine.api.dto.ConversationTurnResponse;
import com.github.salilvnair.researchengine.api.dto.ResearchQueryRequest;
import com.github.salilvnair.researchengine.api.dto.ResearchQueryResponse;
import com.github.salilvnair.researchengine.engine.core.ResearchOrchestrator;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineException;
import com.github.salilvnair.researchengine.engine.history.core.ConversationStore;
import com.github.salilvnair.researchengine.engine.mcp.client.McpClientHealth;
import com.github.salilvnair.researchengine.engine.mcp.client.McpProtocolClient;
import com.github.salilvnair.researchengine.engine.model.Query;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;

@RestController
@RequestMapping("/api/v1/research")
@RequiredArgsConstructor
public class ResearchController {

    private static final int MAX_TURNS = 100;

    private final ResearchOrchestrator orchestrator;
    private final ConversationStore conversationStore;
    private final McpProtocolClient mcpClient;
    private final Clock clock;

    @PostMapping("/query")
    public CompletableFuture<ResearchQueryResponse> query(@RequestBody ResearchQueryRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            throw new ResearchEngineException(ResearchEngineErrorCode.INVALID_REQUEST, "message is required");
        }
        String conversationId = request.getConversationId() == null || request.getConversationId().isBlank()
                ? UUID.randomUUID().toString()
                : request.getConversationId();
        String userId = request.getUserId() == null ? "anonymous" : request.getUserId();

        Query query = new Query(request.getMessage().trim(), userId, conversationId, clock.instant());
        return orchestrator.process(query).thenApply(result -> {
            ResearchQueryResponse res = new ResearchQueryResponse();
            res.setConversationId(conversationId);
            res.setMessage(result.message());
            res.setMetadata(result.metadata());
            res.setSuggestions(result.suggestions());
            return res;
        });
    }

    @GetMapping("/conversations/{conversationId}/turns")
    public List<ConversationTurnResponse> turns(@PathVariable("conversationId") String conversationId,
                                                @RequestParam(name = "limit", defaultValue = "20") int limit) {
        return conversationStore.lastTurns(conversationId, Math.max(1, Math.min(limit, MAX_TURNS)))
                .stream()
                .map(turn -> new ConversationTurnResponse(
                        turn.role().name(),
                        turn.content(),
                        turn.intentType() == null ? null : turn.intentType().code(),
                        turn.parameters(),
                        turn.createdAt()))
                .toList();
    }

    @GetMapping("/mcp/health")
    public McpClientHealth mcpHealth() {
        return mcpClient.health();
    }

    @PostMapping("/mcp/reset")
    public McpClientHealth mcpReset() {
        mcpClient.reset();
        return mcpClient.health();
    }
}
