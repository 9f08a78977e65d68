package com.dslforge.core.renderer.impl;

import com.dslforge.core.renderer.GeneratedFile;
import com.dslforge.core.renderer.GeneratedOutput;
import com.dslforge.core.renderer.OutputRenderer;
import com.dslforge.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Writes generated files below the output directory, creating directories as
 * needed and overwriting existing files. A relative path that resolves outside
 * the output directory is rejected.
 */
public class FileSystemRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(FileSystemRenderer.class);

    @Override
    public String getId() {
        return "filesystem";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        Path outputDir = Paths.get(context.outputDirectory()).toAbsolutePath().normalize();
        log.info("Writing {} files to {}", output.files().size(), outputDir);

        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create output directory: " + outputDir, e);
        }

        for (GeneratedFile file : output.files()) {
            Path target = outputDir.resolve(file.relativePath()).normalize();
            if (!target.startsWith(outputDir)) {
                throw new IllegalStateException("Refusing to write outside the output directory: " + file.relativePath());
            }
            try {
                Path parent = target.getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Files.writeString(target, file.content(), StandardCharsets.UTF_8);
                log.debug("Wrote {} ({} chars)", target, file.content().length());
            } catch (IOException e) {
                throw new IllegalStateException("Failed to write file: " + file.relativePath(), e);
            }
        }
    }
}
