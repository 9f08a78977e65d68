package com.dslforge.core.renderer;

import com.dslforge.core.model.TranspileResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Files to be rendered for one session.
 *
 * @param files generated files
 */
public record GeneratedOutput(
    List<GeneratedFile> files
) {
    /**
     * Compact constructor with validation.
     */
    public GeneratedOutput {
        Objects.requireNonNull(files, "files must not be null");
        files = List.copyOf(files);
    }

    /**
     * Builds the output of a successful session: the program under
     * {@code fileName} and the final DSL next to it with a {@code .dsl} extension.
     *
     * @param result successful session result
     * @param fileName program file name, e.g. {@code workflow.py}
     * @return output with both files
     * @throws IllegalArgumentException if the session failed
     */
    public static GeneratedOutput of(TranspileResult result, String fileName) {
        if (!result.isSuccess()) {
            throw new IllegalArgumentException("Session " + result.sessionId() + " failed; nothing to render");
        }
        List<GeneratedFile> files = new ArrayList<>();
        files.add(new GeneratedFile(fileName, result.program(), GeneratedFile.PYTHON));
        int dot = fileName.lastIndexOf('.');
        String base = dot > 0 ? fileName.substring(0, dot) : fileName;
        files.add(new GeneratedFile(base + ".dsl", result.finalDsl(), GeneratedFile.DSL));
        return new GeneratedOutput(files);
    }
}
