package com.causescore.scoring.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.ratelimiter.RateLimiter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat completions over WebClient against an OpenAI-compatible endpoint (OpenRouter by default).
 */
@Component
@Slf4j
public class OpenRouterLlmClient implements LlmClient {

    private final WebClient webClient;
    private final RateLimiter llmRateLimiter;
    private final LlmProperties properties;

    public OpenRouterLlmClient(WebClient.Builder webClientBuilder,
                               @Qualifier("llmRateLimiter") RateLimiter llmRateLimiter,
                               LlmProperties properties) {
        WebClient.Builder builder = webClientBuilder.baseUrl(properties.getBaseUrl());
        if (properties.getApiKey() != null && !properties.getApiKey().isBlank()) {
            builder = builder.defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey());
        }
        this.webClient = builder.build();
        this.llmRateLimiter = llmRateLimiter;
        this.properties = properties;
    }

    @Override
    public String complete(String systemPrompt, String userPrompt, CompletionOptions options) {
        if (!llmRateLimiter.acquirePermission()) {
            throw new LlmException("Local LLM limiter timed out");
        }
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.getModel());
        body.put("messages", List.of(
                Map.of("role", "system", "content", systemPrompt),
                Map.of("role", "user", "content", userPrompt)));
        body.put("temperature", options.temperature());
        body.put("max_tokens", options.maxTokens());
        if (options.jsonMode()) {
            body.put("response_format", Map.of("type", "json_object"));
        }
        long started = System.currentTimeMillis();
        String response;
        try {
            response = webClient.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(body)
                    .retrieve()
                    .bodyToMono(String.class)
                    .timeout(Duration.ofSeconds(properties.getTimeoutSeconds()))
                    .block();
        } catch (WebClientResponseException e) {
            throw new LlmException("LLM call failed with HTTP " + e.getStatusCode().value(), e);
        } catch (RuntimeException e) {
            throw new LlmException("LLM call failed: " + e.getMessage(), e);
        }
        String content = parseContent(response);
        log.debug("LLM completion in {} ms ({} chars)", System.currentTimeMillis() - started, content.length());
        return content;
    }

    static String parseContent(String json) {
        JsonNode root;
        try {
            root = new ObjectMapper().readTree(json == null ? "" : json);
        } catch (Exception e) {
            throw new LlmException("Unparseable LLM response", e);
        }
        JsonNode content = root.path("choices").path(0).path("message").path("content");
        if (!content.isTextual() || content.asText().isBlank()) {
            throw new LlmException("LLM response has no content");
        }
        return content.asText();
    }
}
