package com.dslforge.core.analysis;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link NameResolutionContext}.
 */
class NameResolutionContextTest {

    @Test
    void allocate_takenBase_returnsNextFreeSuffix() {
        NameResolutionContext context = NameResolutionContext.of(List.of("d", "d_2"));

        assertThat(context.allocate("d")).isEqualTo("d_3");
        assertThat(context.allocate("d")).isEqualTo("d_4");
        assertThat(context.renames()).containsExactly(entry("d_3", "d"), entry("d_4", "d"));
    }

    @Test
    void sanitize_legalName_isReturnedUnchangedWithoutRename() {
        NameResolutionContext context = NameResolutionContext.of(List.of());

        assertThat(context.sanitize("total")).isEqualTo("total");
        assertThat(context.renames()).isEmpty();
    }

    @Test
    void sanitize_illegalName_recordsMappingToOriginal() {
        NameResolutionContext context = NameResolutionContext.of(List.of("95th_pct"));

        assertThat(context.sanitize("95th_pct")).isEqualTo("_95th_pct");
        assertThat(context.renames()).containsEntry("_95th_pct", "95th_pct");
        assertThat(context.isTaken("_95th_pct")).isTrue();
    }

    @Test
    void sanitize_collidingWithExistingVariable_allocatesSuffix() {
        NameResolutionContext context = NameResolutionContext.of(List.of("my_var", "my-var"));

        String sanitized = context.sanitize("my-var");

        assertThat(sanitized).isEqualTo("my_var_2");
        assertThat(context.renames()).containsEntry("my_var_2", "my-var");
    }

    @Test
    void contexts_areIndependent() {
        NameResolutionContext first = NameResolutionContext.of(List.of("d"));
        NameResolutionContext second = NameResolutionContext.of(List.of("d"));

        first.allocate("d");

        assertThat(second.allocate("d")).isEqualTo("d_2");
    }
}
