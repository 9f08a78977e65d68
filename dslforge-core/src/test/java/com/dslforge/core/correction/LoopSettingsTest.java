package com.dslforge.core.correction;

import com.dslforge.core.config.ForgeConfig;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link LoopSettings}.
 */
class LoopSettingsTest {

    @Test
    void defaults_matchConfigurationDefaults() {
        LoopSettings settings = LoopSettings.defaults();

        assertThat(settings.maxAttempts()).isEqualTo(3);
        assertThat(settings.maxRepairRounds()).isEqualTo(3);
        assertThat(settings.generationTimeout()).isEqualTo(Duration.ofSeconds(60));
    }

    @Test
    void from_configuredValues_areCarriedOver() {
        LoopSettings settings = LoopSettings.from(new ForgeConfig.TranspilerConfig(5, 0, 10, "io-isolation"));

        assertThat(settings.maxAttempts()).isEqualTo(5);
        assertThat(settings.maxRepairRounds()).isZero();
        assertThat(settings.generationTimeout()).isEqualTo(Duration.ofSeconds(10));
    }

    @Test
    void constructor_invalidBounds_throw() {
        assertThatThrownBy(() -> new LoopSettings(0, 1, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("maxAttempts");
        assertThatThrownBy(() -> new LoopSettings(1, -1, Duration.ofSeconds(1)))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LoopSettings(1, 1, null))
            .isInstanceOf(NullPointerException.class);
    }
}
