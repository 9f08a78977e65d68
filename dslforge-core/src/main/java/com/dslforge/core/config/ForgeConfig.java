package com.dslforge.core.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Root configuration for DslForge.
 *
 * <p>Loaded from {@code dslforge.yaml}. Every section and every field is
 * optional; missing values fall back to the defaults listed below.
 *
 * <p><b>Example YAML:</b>
 * <pre>{@code
 * transpiler:
 *   maxAttempts: 3
 *   maxRepairRounds: 3
 *   generationTimeoutSeconds: 60
 *   strategy: hybrid
 *
 * generation:
 *   provider: ollama
 *   baseUrl: "http://localhost:11434"
 *   model: "llama3.1"
 *   temperature: 0.2
 *
 * output:
 *   directory: "./generated"
 *   fileName: "workflow.py"
 *
 * history:
 *   enabled: true
 *   directory: "./.dslforge/history"
 * }</pre>
 *
 * @param transpiler self-correction loop settings
 * @param generation generation service settings
 * @param output generated program settings
 * @param history attempt log settings
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ForgeConfig(
    @JsonProperty("transpiler") TranspilerConfig transpiler,
    @JsonProperty("generation") GenerationConfig generation,
    @JsonProperty("output") OutputConfig output,
    @JsonProperty("history") HistoryConfig history
) {
    /**
     * Compact constructor filling in missing sections.
     */
    public ForgeConfig {
        transpiler = transpiler == null ? TranspilerConfig.defaults() : transpiler;
        generation = generation == null ? GenerationConfig.defaults() : generation;
        output = output == null ? OutputConfig.defaults() : output;
        history = history == null ? HistoryConfig.defaults() : history;
    }

    /**
     * Creates the default configuration: three attempts, hybrid clustering,
     * no generation service.
     *
     * @return default configuration
     */
    public static ForgeConfig defaults() {
        return new ForgeConfig(null, null, null, null);
    }

    /**
     * Self-correction loop settings.
     *
     * @param maxAttempts drafts allowed per session, including the initial draft
     * @param maxRepairRounds deterministic repair rounds allowed per draft
     * @param generationTimeoutSeconds timeout for one generation request
     * @param strategy clustering strategy name
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TranspilerConfig(
        @JsonProperty("maxAttempts") Integer maxAttempts,
        @JsonProperty("maxRepairRounds") Integer maxRepairRounds,
        @JsonProperty("generationTimeoutSeconds") Integer generationTimeoutSeconds,
        @JsonProperty("strategy") String strategy
    ) {
        public TranspilerConfig {
            maxAttempts = maxAttempts == null || maxAttempts < 1 ? 3 : maxAttempts;
            maxRepairRounds = maxRepairRounds == null || maxRepairRounds < 0 ? 3 : maxRepairRounds;
            generationTimeoutSeconds = generationTimeoutSeconds == null || generationTimeoutSeconds < 1
                ? 60 : generationTimeoutSeconds;
            strategy = strategy == null || strategy.isBlank() ? "hybrid" : strategy;
        }

        public static TranspilerConfig defaults() {
            return new TranspilerConfig(null, null, null, null);
        }
    }

    /**
     * Generation service settings.
     *
     * @param provider service id, {@code none} disables regeneration
     * @param baseUrl service base URL
     * @param model model name sent to the service
     * @param temperature sampling temperature
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GenerationConfig(
        @JsonProperty("provider") String provider,
        @JsonProperty("baseUrl") String baseUrl,
        @JsonProperty("model") String model,
        @JsonProperty("temperature") Double temperature
    ) {
        public GenerationConfig {
            provider = provider == null || provider.isBlank() ? "none" : provider;
            baseUrl = baseUrl == null || baseUrl.isBlank() ? "http://localhost:11434" : baseUrl;
            model = model == null || model.isBlank() ? "llama3.1" : model;
            temperature = temperature == null ? 0.2 : temperature;
        }

        public static GenerationConfig defaults() {
            return new GenerationConfig(null, null, null, null);
        }
    }

    /**
     * Output configuration.
     *
     * @param directory output directory path
     * @param fileName name of the generated program file
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record OutputConfig(
        @JsonProperty("directory") String directory,
        @JsonProperty("fileName") String fileName
    ) {
        public OutputConfig {
            directory = directory == null || directory.isBlank() ? "./generated" : directory;
            fileName = fileName == null || fileName.isBlank() ? "workflow.py" : fileName;
        }

        public static OutputConfig defaults() {
            return new OutputConfig(null, null);
        }
    }

    /**
     * Attempt log configuration.
     *
     * @param enabled whether attempt logs are written
     * @param directory directory holding one JSON file per session
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record HistoryConfig(
        @JsonProperty("enabled") Boolean enabled,
        @JsonProperty("directory") String directory
    ) {
        public HistoryConfig {
            enabled = enabled == null ? Boolean.TRUE : enabled;
            directory = directory == null || directory.isBlank() ? "./.dslforge/history" : directory;
        }

        public static HistoryConfig defaults() {
            return new HistoryConfig(null, null);
        }
    }
}
