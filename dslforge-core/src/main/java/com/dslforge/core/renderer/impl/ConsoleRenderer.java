package com.dslforge.core.renderer.impl;

import com.dslforge.core.renderer.GeneratedFile;
import com.dslforge.core.renderer.GeneratedOutput;
import com.dslforge.core.renderer.OutputRenderer;
import com.dslforge.core.renderer.RenderContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;

/**
 * Prints generated files to a stream, each preceded by a header line.
 *
 * <p><b>Settings:</b>
 * <ul>
 *   <li>{@code console.colors} - ANSI colors for headers (default: "true")</li>
 *   <li>{@code console.headers} - print a header per file (default: "true")</li>
 * </ul>
 */
public class ConsoleRenderer implements OutputRenderer {

    private static final Logger log = LoggerFactory.getLogger(ConsoleRenderer.class);

    private static final String ANSI_RESET = "\u001B[0m";
    private static final String ANSI_BOLD_CYAN = "\u001B[1;36m";

    private final PrintStream out;

    public ConsoleRenderer() {
        this(System.out);
    }

    public ConsoleRenderer(PrintStream out) {
        this.out = out;
    }

    @Override
    public String getId() {
        return "console";
    }

    @Override
    public void render(GeneratedOutput output, RenderContext context) {
        boolean colors = context.isEnabled("console.colors", true);
        boolean headers = context.isEnabled("console.headers", true);
        log.debug("Printing {} files (colors: {}, headers: {})", output.files().size(), colors, headers);

        for (GeneratedFile file : output.files()) {
            if (headers) {
                String header = "# ==== " + file.relativePath() + " ====";
                out.println(colors ? ANSI_BOLD_CYAN + header + ANSI_RESET : header);
            }
            out.println(file.content());
        }
        out.flush();
    }
}
