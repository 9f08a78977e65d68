package com.dslforge.core.renderer;

import java.util.Objects;

/**
 * A file produced by a transpile session.
 *
 * @param relativePath path relative to the output directory, e.g. {@code workflow.py}
 * @param content file content
 * @param contentType MIME type of the content
 */
public record GeneratedFile(
    String relativePath,
    String content,
    String contentType
) {
    public static final String PYTHON = "text/x-python";
    public static final String DSL = "text/plain";

    /**
     * Compact constructor with validation.
     */
    public GeneratedFile {
        Objects.requireNonNull(relativePath, "relativePath must not be null");
        Objects.requireNonNull(content, "content must not be null");
        if (relativePath.isBlank()) {
            throw new IllegalArgumentException("relativePath must not be blank");
        }
    }
}
