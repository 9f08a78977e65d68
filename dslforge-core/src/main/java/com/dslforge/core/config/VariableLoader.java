package com.dslforge.core.config;

import com.dslforge.core.model.VarType;
import com.dslforge.core.model.Variable;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Loads upstream variables from a YAML or JSON file.
 *
 * <p>The file holds a list of entries, either at the root or under a
 * {@code variables} key. Files ending in {@code .json} are read as JSON,
 * everything else as YAML.
 *
 * <pre>{@code
 * variables:
 *   - name: threshold
 *     type: Integer
 *     value: 90
 *     originText: "at least 90 percent"
 * }</pre>
 *
 * <p>Unlike configuration, variables have no sensible default: a missing or
 * malformed file fails the load.
 */
public final class VariableLoader {

    private static final Logger log = LoggerFactory.getLogger(VariableLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());
    private static final ObjectMapper JSON_MAPPER = new ObjectMapper();

    private VariableLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * One variable entry as written in the file.
     *
     * @param name variable name
     * @param type type name, case-insensitive; Any when absent
     * @param value resolved value
     * @param originText extraction source text
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record VariableEntry(
        @JsonProperty("name") String name,
        @JsonProperty("type") String type,
        @JsonProperty("value") Object value,
        @JsonProperty("originText") String originText
    ) {}

    /**
     * Loads variables from a file.
     *
     * @param path YAML or JSON file
     * @return variables in file order
     * @throws UncheckedIOException if the file cannot be read or parsed
     * @throws IllegalArgumentException if an entry has no name or an unknown type
     */
    public static List<Variable> load(Path path) {
        ObjectMapper mapper = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".json")
            ? JSON_MAPPER : YAML_MAPPER;
        try {
            log.debug("Loading variables from: {}", path);
            JsonNode root = mapper.readTree(Files.readString(path));
            JsonNode list = root != null && root.has("variables") ? root.get("variables") : root;
            if (list == null || list.isNull() || list.isMissingNode()) {
                return List.of();
            }
            if (!list.isArray()) {
                throw new IllegalArgumentException("Expected a list of variables in " + path);
            }
            List<VariableEntry> entries = mapper.convertValue(list, new TypeReference<List<VariableEntry>>() { });
            List<Variable> variables = toVariables(entries);
            log.info("Loaded {} variables from: {}", variables.size(), path);
            return variables;
        } catch (IOException e) {
            log.error("Failed to read variables file: {}. Error: {}", path, e.getMessage());
            throw new UncheckedIOException("Failed to read variables file: " + path, e);
        }
    }

    /**
     * Converts file entries to variables.
     *
     * @param entries entries as read
     * @return variables
     */
    public static List<Variable> toVariables(List<VariableEntry> entries) {
        List<Variable> variables = new ArrayList<>();
        for (VariableEntry entry : entries) {
            if (entry.name() == null || entry.name().isBlank()) {
                throw new IllegalArgumentException("Variable entry without a name");
            }
            VarType type = entry.type() == null
                ? VarType.ANY
                : VarType.fromName(entry.type())
                    .orElseThrow(() -> new IllegalArgumentException(
                        "Unknown type '" + entry.type() + "' for variable " + entry.name()));
            variables.add(new Variable(entry.name(), type, entry.value(), entry.originText()));
        }
        return variables;
    }
}
