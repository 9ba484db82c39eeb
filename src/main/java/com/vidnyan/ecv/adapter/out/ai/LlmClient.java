package com.vidnyan.ecv.adapter.out.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Client for OpenAI-compatible chat-completions endpoints (Groq by default).
 */
@Component
public class LlmClient {

    private static final Logger log = LoggerFactory.getLogger(LlmClient.class);

    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    @Value("${ecv.ai.provider:groq}")
    private String provider;

    @Value("${ecv.ai.api-key:}")
    private String apiKey;

    @Value("${ecv.ai.model:llama-3.3-70b-versatile}")
    private String model;

    @Value("${ecv.ai.endpoint:https://api.groq.com/openai/v1/chat/completions}")
    private String endpoint;

    @Value("${ecv.ai.timeout-seconds:60}")
    private int timeoutSeconds = 60;

    public LlmClient(ObjectMapper objectMapper) {
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(30))
                .build();
        this.objectMapper = objectMapper;
    }

    public boolean isConfigured() {
        return apiKey != null && !apiKey.isBlank();
    }

    /**
     * Send a prompt and return the reply text; empty when no key is configured or the call fails.
     */
    public Optional<String> chat(String systemPrompt, String userPrompt) {
        if (!isConfigured()) {
            log.debug("No API key configured, skipping LLM call");
            return Optional.empty();
        }
        log.debug("LLM Request - Provider: {}, Model: {}", provider, model);

        try {
            return switch (provider.toLowerCase(Locale.ROOT)) {
                case "groq", "openai" -> Optional.of(callChatCompletions(systemPrompt, userPrompt));
                default -> {
                    log.warn("Unknown provider: {}", provider);
                    yield Optional.empty();
                }
            };
        } catch (IOException e) {
            log.error("LLM call failed: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("LLM call interrupted");
            return Optional.empty();
        }
    }

    private String callChatCompletions(String systemPrompt, String userPrompt)
            throws IOException, InterruptedException {
        log.info("Calling {} with model: {}", provider, model);

        Map<String, Object> requestBody = Map.of(
                "model", model,
                "messages", List.of(
                        Map.of("role", "system", "content", systemPrompt),
                        Map.of("role", "user", "content", userPrompt)),
                "temperature", 0.3,
                "max_tokens", 2048);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(endpoint))
                .header("Content-Type", "application/json")
                .header("Authorization", "Bearer " + apiKey)
                .POST(HttpRequest.BodyPublishers.ofString(objectMapper.writeValueAsString(requestBody)))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .build();

        HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        if (response.statusCode() != 200) {
            throw new IOException(provider + " API error: " + response.statusCode());
        }

        JsonNode root = objectMapper.readTree(response.body());
        String content = root.path("choices").path(0).path("message").path("content").asText("");
        log.debug("{} response received: {} chars", provider, content.length());
        return content;
    }
}
