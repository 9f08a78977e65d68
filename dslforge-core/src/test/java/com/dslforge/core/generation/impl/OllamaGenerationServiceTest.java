package com.dslforge.core.generation.impl;

import com.dslforge.core.config.ForgeConfig;
import com.dslforge.core.generation.GenerationException;
import com.dslforge.core.generation.GenerationRequest;
import com.dslforge.core.generation.ServiceError;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link OllamaGenerationService}.
 */
class OllamaGenerationServiceTest {

    @Test
    void extractContent_okResponse_returnsMessageContent() throws GenerationException {
        String body = "{\"model\":\"llama3.1\",\"message\":{\"role\":\"assistant\",\"content\":\"CALL f()\"},\"done\":true}";

        assertThat(OllamaGenerationService.extractContent(200, body)).isEqualTo("CALL f()");
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "429 | {}                            | RATE_LIMITED       | Ollama rate limit reached",
        "503 | busy                          | UNAVAILABLE        | Ollama server error: HTTP 503",
        "400 | {\"error\":\"bad\"}           | MALFORMED_RESPONSE | Ollama rejected the request: HTTP 400",
        "200 | <html>                        | MALFORMED_RESPONSE | Ollama response is not JSON",
        "200 | {\"message\":{}}              | MALFORMED_RESPONSE | Ollama response has no message content",
        "200 | {\"message\":{\"content\":\" \"}} | MALFORMED_RESPONSE | Ollama response has no message content"
    })
    void extractContent_errorResponse_mapsToServiceError(int status, String body, ServiceError kind, String message) {
        assertThatThrownBy(() -> OllamaGenerationService.extractContent(status, body))
            .isInstanceOf(GenerationException.class)
            .hasMessage(message)
            .satisfies(thrown -> {
                GenerationException exception = (GenerationException) thrown;
                assertThat(exception.getKind()).isEqualTo(kind);
                assertThat(exception.getRawResponse()).isEqualTo(body);
            });
    }

    @Test
    void requestBody_carriesModelMessagesAndTemperature() throws Exception {
        OllamaGenerationService service = new OllamaGenerationService();
        service.configure(new ForgeConfig.GenerationConfig("ollama", "http://ollama:11434/", "qwen2.5", 0.7));
        GenerationRequest request = new GenerationRequest("system text", "user text", null, Duration.ofSeconds(5));

        JsonNode body = new ObjectMapper().readTree(service.requestBody(request));

        assertThat(body.path("model").asText()).isEqualTo("qwen2.5");
        assertThat(body.path("stream").asBoolean(true)).isFalse();
        assertThat(body.path("options").path("temperature").asDouble()).isEqualTo(0.7);
        assertThat(body.path("messages").get(0).path("role").asText()).isEqualTo("system");
        assertThat(body.path("messages").get(0).path("content").asText()).isEqualTo("system text");
        assertThat(body.path("messages").get(1).path("content").asText()).isEqualTo("user text");
    }

    @Test
    void identity_isOllama() {
        OllamaGenerationService service = new OllamaGenerationService();

        assertThat(service.getId()).isEqualTo("ollama");
        assertThat(service.getDisplayName()).isEqualTo("Ollama");
    }
}
