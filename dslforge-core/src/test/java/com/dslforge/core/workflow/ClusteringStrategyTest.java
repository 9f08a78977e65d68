package com.dslforge.core.workflow;

import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.NullSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ClusteringStrategy}.
 */
class ClusteringStrategyTest {

    @ParameterizedTest
    @CsvSource({
        "io-isolation, IO_ISOLATION",
        "IoIsolation,  IO_ISOLATION",
        "IO_ISOLATION, IO_ISOLATION",
        "ControlFlow,  CONTROL_FLOW",
        "control-flow, CONTROL_FLOW",
        "Hybrid,       HYBRID"
    })
    void fromName_knownSpelling_resolves(String name, ClusteringStrategy expected) {
        assertThat(ClusteringStrategy.fromName(name)).contains(expected);
    }

    @ParameterizedTest
    @NullSource
    @ValueSource(strings = {"", "random", "io"})
    void fromName_unknown_returnsEmpty(String name) {
        assertThat(ClusteringStrategy.fromName(name)).isEmpty();
    }
}
