package com.dslforge.core.generation;

import com.dslforge.core.config.ForgeConfig;
import com.dslforge.core.generation.impl.DisabledGenerationService;
import com.dslforge.core.generation.impl.OllamaGenerationService;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link GenerationServiceFactory}.
 */
class GenerationServiceFactoryTest {

    @Test
    void discover_findsRegisteredServices() {
        List<GenerationService> services = GenerationServiceFactory.discover();

        assertThat(services).extracting(GenerationService::getId).contains("ollama", "none");
    }

    @Test
    void create_defaultProvider_returnsDisabledService() {
        GenerationService service = GenerationServiceFactory.create(ForgeConfig.GenerationConfig.defaults());

        assertThat(service).isInstanceOf(DisabledGenerationService.class);
        assertThatThrownBy(() -> service.generate(new GenerationRequest("", "prompt", null, Duration.ofSeconds(1))))
            .isInstanceOf(GenerationException.class)
            .satisfies(thrown -> assertThat(((GenerationException) thrown).getKind()).isEqualTo(ServiceError.UNAVAILABLE));
    }

    @Test
    void create_providerNameIgnoresCase() {
        GenerationService service = GenerationServiceFactory.create(
            new ForgeConfig.GenerationConfig("Ollama", null, null, null));

        assertThat(service).isInstanceOf(OllamaGenerationService.class);
    }

    @Test
    void create_unknownProvider_throwsIllegalArgument() {
        assertThatThrownBy(() -> GenerationServiceFactory.create(
            new ForgeConfig.GenerationConfig("gpt-9000", null, null, null)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("gpt-9000");
    }

    @Test
    void serviceError_onlyMalformedIsNotRetryable() {
        assertThat(ServiceError.MALFORMED_RESPONSE.isRetryable()).isFalse();
        assertThat(ServiceError.TIMEOUT.isRetryable()).isTrue();
        assertThat(ServiceError.RATE_LIMITED.isRetryable()).isTrue();
    }
}
