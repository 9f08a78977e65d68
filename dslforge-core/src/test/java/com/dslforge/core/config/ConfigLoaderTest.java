package com.dslforge.core.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void load_validYaml_returnsConfig() throws IOException {
        Path configFile = tempDir.resolve("dslforge.yaml");
        Files.writeString(configFile, """
            transpiler:
              maxAttempts: 5
              maxRepairRounds: 2
              generationTimeoutSeconds: 30
              strategy: control-flow

            generation:
              provider: ollama
              baseUrl: "http://gpu-box:11434"
              model: "qwen2.5-coder"
              temperature: 0.0

            output:
              directory: "./out"
              fileName: "pipeline.py"

            history:
              enabled: false
              directory: "./logs"
            """);

        ForgeConfig config = ConfigLoader.load(configFile);

        assertThat(config.transpiler().maxAttempts()).isEqualTo(5);
        assertThat(config.transpiler().maxRepairRounds()).isEqualTo(2);
        assertThat(config.transpiler().generationTimeoutSeconds()).isEqualTo(30);
        assertThat(config.transpiler().strategy()).isEqualTo("control-flow");
        assertThat(config.generation().provider()).isEqualTo("ollama");
        assertThat(config.generation().baseUrl()).isEqualTo("http://gpu-box:11434");
        assertThat(config.generation().model()).isEqualTo("qwen2.5-coder");
        assertThat(config.generation().temperature()).isEqualTo(0.0);
        assertThat(config.output().directory()).isEqualTo("./out");
        assertThat(config.output().fileName()).isEqualTo("pipeline.py");
        assertThat(config.history().enabled()).isFalse();
        assertThat(config.history().directory()).isEqualTo("./logs");
    }

    @Test
    void load_partialYaml_fillsInDefaults() throws IOException {
        Path configFile = tempDir.resolve("dslforge.yaml");
        Files.writeString(configFile, """
            transpiler:
              maxAttempts: 4
            unknownSection:
              ignored: true
            """);

        ForgeConfig config = ConfigLoader.load(configFile);

        assertThat(config.transpiler().maxAttempts()).isEqualTo(4);
        assertThat(config.transpiler().maxRepairRounds()).isEqualTo(3);
        assertThat(config.transpiler().strategy()).isEqualTo("hybrid");
        assertThat(config.generation().provider()).isEqualTo("none");
        assertThat(config.output().fileName()).isEqualTo("workflow.py");
        assertThat(config.history().enabled()).isTrue();
    }

    @Test
    void load_outOfRangeValues_fallBackToDefaults() throws IOException {
        Path configFile = tempDir.resolve("dslforge.yaml");
        Files.writeString(configFile, """
            transpiler:
              maxAttempts: 0
              maxRepairRounds: -1
              generationTimeoutSeconds: 0
            """);

        ForgeConfig config = ConfigLoader.load(configFile);

        assertThat(config.transpiler().maxAttempts()).isEqualTo(3);
        assertThat(config.transpiler().maxRepairRounds()).isEqualTo(3);
        assertThat(config.transpiler().generationTimeoutSeconds()).isEqualTo(60);
    }

    @Test
    void load_missingFile_returnsDefaults() {
        ForgeConfig config = ConfigLoader.load(tempDir.resolve("nonexistent.yaml"));

        assertThat(config).isEqualTo(ForgeConfig.defaults());
    }

    @Test
    void load_directory_returnsDefaults() {
        assertThat(ConfigLoader.load(tempDir)).isEqualTo(ForgeConfig.defaults());
    }

    @Test
    void load_emptyFile_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("dslforge.yaml");
        Files.writeString(configFile, "");

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ForgeConfig.defaults());
    }

    @Test
    void load_invalidYaml_returnsDefaults() throws IOException {
        Path configFile = tempDir.resolve("dslforge.yaml");
        Files.writeString(configFile, """
            transpiler:
              maxAttempts: [unclosed
            """);

        assertThat(ConfigLoader.load(configFile)).isEqualTo(ForgeConfig.defaults());
    }
}
