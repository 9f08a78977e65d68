package com.dslforge.core.generation.impl;

import com.dslforge.core.config.ForgeConfig;
import com.dslforge.core.generation.GenerationException;
import com.dslforge.core.generation.GenerationRequest;
import com.dslforge.core.generation.GenerationService;
import com.dslforge.core.generation.ServiceError;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.ConnectException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Generation service backed by a local Ollama server.
 *
 * <p>Posts a non-streaming request to {@code <baseUrl>/api/chat} with the
 * system prompt and user prompt as separate messages, and reads the draft from
 * {@code message.content}.
 *
 * <p>Error mapping:
 * <ul>
 *   <li>HTTP 429 → {@link ServiceError#RATE_LIMITED}</li>
 *   <li>HTTP 5xx, connection failure → {@link ServiceError#UNAVAILABLE}</li>
 *   <li>request timeout → {@link ServiceError#TIMEOUT}</li>
 *   <li>other HTTP errors, unparsable body, missing content → {@link ServiceError#MALFORMED_RESPONSE}</li>
 * </ul>
 */
public class OllamaGenerationService implements GenerationService {

    private static final Logger log = LoggerFactory.getLogger(OllamaGenerationService.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final HttpClient httpClient;
    private String baseUrl = "http://localhost:11434";
    private String model = "llama3.1";
    private double temperature = 0.2;

    public OllamaGenerationService() {
        this(HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build());
    }

    public OllamaGenerationService(HttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public String getId() {
        return "ollama";
    }

    @Override
    public String getDisplayName() {
        return "Ollama";
    }

    @Override
    public void configure(ForgeConfig.GenerationConfig settings) {
        this.baseUrl = settings.baseUrl().endsWith("/")
            ? settings.baseUrl().substring(0, settings.baseUrl().length() - 1)
            : settings.baseUrl();
        this.model = settings.model();
        this.temperature = settings.temperature();
    }

    @Override
    public String generate(GenerationRequest request) throws GenerationException {
        log.info("Requesting draft from Ollama: model={}, promptLength={}", model, request.prompt().length());

        HttpRequest httpRequest = HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/api/chat"))
            .timeout(request.timeout())
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(requestBody(request), StandardCharsets.UTF_8))
            .build();

        long startTime = System.currentTimeMillis();
        HttpResponse<String> response;
        try {
            response = httpClient.send(httpRequest, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (HttpTimeoutException e) {
            throw new GenerationException(ServiceError.TIMEOUT, "Ollama request timed out after " + request.timeout(), null, e);
        } catch (ConnectException e) {
            throw new GenerationException(ServiceError.UNAVAILABLE, "Cannot connect to Ollama at " + baseUrl, null, e);
        } catch (IOException e) {
            throw new GenerationException(ServiceError.UNAVAILABLE, "Ollama request failed: " + e.getMessage(), null, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new GenerationException(ServiceError.TIMEOUT, "Ollama request interrupted", null, e);
        }

        String content = extractContent(response.statusCode(), response.body());
        log.info("Ollama answered in {}ms, responseLength={}", System.currentTimeMillis() - startTime, content.length());
        return content;
    }

    String requestBody(GenerationRequest request) {
        Map<String, Object> body = Map.of(
            "model", model,
            "messages", List.of(
                Map.of("role", "system", "content", request.systemPrompt()),
                Map.of("role", "user", "content", request.prompt())
            ),
            "stream", false,
            "options", Map.of("temperature", temperature)
        );
        try {
            return MAPPER.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize Ollama request", e);
        }
    }

    static String extractContent(int statusCode, String body) throws GenerationException {
        if (statusCode == 429) {
            throw new GenerationException(ServiceError.RATE_LIMITED, "Ollama rate limit reached", body, null);
        }
        if (statusCode >= 500) {
            throw new GenerationException(ServiceError.UNAVAILABLE, "Ollama server error: HTTP " + statusCode, body, null);
        }
        if (statusCode >= 400) {
            throw new GenerationException(ServiceError.MALFORMED_RESPONSE, "Ollama rejected the request: HTTP " + statusCode, body, null);
        }

        JsonNode root;
        try {
            root = MAPPER.readTree(body);
        } catch (JsonProcessingException e) {
            throw new GenerationException(ServiceError.MALFORMED_RESPONSE, "Ollama response is not JSON", body, e);
        }
        JsonNode content = root == null ? null : root.path("message").path("content");
        if (content == null || !content.isTextual() || content.asText().isBlank()) {
            throw new GenerationException(ServiceError.MALFORMED_RESPONSE, "Ollama response has no message content", body, null);
        }
        return content.asText();
    }
}
