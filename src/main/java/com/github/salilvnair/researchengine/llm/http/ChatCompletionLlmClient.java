package com.github.salilvnair.researchengine.llm.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.salilvnair.researchengine.config.ResearchEngineLlmConfig;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineErrorCode;
import com.github.salilvnair.researchengine.engine.exception.ResearchEngineException;
import com.github.salilvnair.researchengine.llm.core.LlmClient;
import com.github.salilvnair.researchengine.llm.core.LlmGenerationOptions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * OpenAI style {@code /chat/completions} client.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ChatCompletionLlmClient implements LlmClient {

    private final ResearchEngineLlmConfig config;
    private final ObjectMapper mapper;

    @Override
    public String generate(String prompt, LlmGenerationOptions options) {
        if (config.getBaseUrl() == null || config.getBaseUrl().isBlank()) {
            throw new ResearchEngineException(ResearchEngineErrorCode.GENERATION_FAILURE, "LLM base URL is not configured");
        }
        long startedAt = System.currentTimeMillis();
        try {
            HttpResponse<String> response = executeOnce(requestBody(prompt, options), options.timeout());
            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new ResearchEngineException(ResearchEngineErrorCode.GENERATION_FAILURE,
                        "LLM call failed with status " + status);
            }
            String text = extractContent(response.body());
            log.debug("LLM generation finished model={} latencyMs={} chars={}",
                    config.getModel(), System.currentTimeMillis() - startedAt, text.length());
            return text;
        } catch (HttpTimeoutException timeout) {
            throw new ResearchEngineException(ResearchEngineErrorCode.LLM_TIMEOUT,
                    "LLM call timed out after " + options.timeout().toMillis() + "ms", timeout);
        } catch (IOException io) {
            throw new ResearchEngineException(ResearchEngineErrorCode.GENERATION_FAILURE,
                    "LLM call failed due to IO error: " + io.getMessage(), io);
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new ResearchEngineException(ResearchEngineErrorCode.GENERATION_FAILURE, "LLM call interrupted", interrupted);
        }
    }

    private HttpResponse<String> executeOnce(String body, Duration timeout) throws IOException, InterruptedException {
        HttpClient client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(config.getConnectTimeoutMs()))
                .build();

        HttpRequest.Builder request = HttpRequest.newBuilder()
                .uri(URI.create(config.getBaseUrl()))
                .timeout(timeout)
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .POST(HttpRequest.BodyPublishers.ofString(body));
        if (config.getApiKey() != null && !config.getApiKey().isBlank()) {
            request.header(HttpHeaders.AUTHORIZATION, "Bearer " + config.getApiKey());
        }
        return client.send(request.build(), HttpResponse.BodyHandlers.ofString());
    }

    private String requestBody(String prompt, LlmGenerationOptions options) throws JsonProcessingException {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", config.getModel());
        body.put("max_tokens", options.maxTokens());
        body.put("temperature", options.temperature());
        ArrayNode messages = body.putArray("messages");
        if (config.getSystemPrompt() != null && !config.getSystemPrompt().isBlank()) {
            messages.addObject().put("role", "system").put("content", config.getSystemPrompt());
        }
        messages.addObject().put("role", "user").put("content", prompt);
        return mapper.writeValueAsString(body);
    }

    private String extractContent(String responseBody) throws JsonProcessingException {
        JsonNode root = mapper.readTree(responseBody);
        String content = root.path("choices").path(0).path("message").path("content").asText("");
        if (content.isBlank()) {
            throw new ResearchEngineException(ResearchEngineErrorCode.GENERATION_FAILURE, "LLM returned empty content");
        }
        return content.trim();
    }
}
