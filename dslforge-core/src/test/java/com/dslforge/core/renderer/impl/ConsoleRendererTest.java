package com.dslforge.core.renderer.impl;

import com.dslforge.core.renderer.GeneratedFile;
import com.dslforge.core.renderer.GeneratedOutput;
import com.dslforge.core.renderer.RenderContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link ConsoleRenderer}.
 */
class ConsoleRendererTest {

    private ByteArrayOutputStream outputStream;
    private ConsoleRenderer renderer;

    @BeforeEach
    void setUp() {
        outputStream = new ByteArrayOutputStream();
        renderer = new ConsoleRenderer(new PrintStream(outputStream, true, StandardCharsets.UTF_8));
    }

    private String printed() {
        return outputStream.toString(StandardCharsets.UTF_8);
    }

    @Test
    void getId_returnsConsole() {
        assertThat(renderer.getId()).isEqualTo("console");
    }

    @Test
    void render_withColorsDisabled_printsPlainHeaderAndContent() {
        // Given
        GeneratedOutput output = new GeneratedOutput(List.of(
            new GeneratedFile("workflow.py", "print(1)", GeneratedFile.PYTHON),
            new GeneratedFile("workflow.dsl", "CALL f()", GeneratedFile.DSL)));

        // When
        renderer.render(output, new RenderContext(".", Map.of("console.colors", "false")));

        // Then
        assertThat(printed()).isEqualTo(String.join(System.lineSeparator(),
            "# ==== workflow.py ====", "print(1)", "# ==== workflow.dsl ====", "CALL f()", ""));
    }

    @Test
    void render_byDefault_colorsHeaders() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("a.py", "x = 1", GeneratedFile.PYTHON)));

        renderer.render(output, new RenderContext(".", Map.of()));

        assertThat(printed()).startsWith("\u001B[1;36m# ==== a.py ====\u001B[0m");
    }

    @Test
    void render_withHeadersDisabled_printsOnlyContent() {
        GeneratedOutput output = new GeneratedOutput(List.of(new GeneratedFile("a.py", "x = 1", GeneratedFile.PYTHON)));

        renderer.render(output, new RenderContext(".", Map.of("console.headers", "false")));

        assertThat(printed()).isEqualTo("x = 1" + System.lineSeparator());
    }
}
