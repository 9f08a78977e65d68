package com.dslforge.core.correction;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Local fixup pass for raw generation output.
 *
 * <p>Extracts the first fenced code block ({@code ```dsl}, {@code ```python}
 * or a bare fence) when there is one, then keeps only lines that start with a
 * DSL keyword or an assignment target. Comments and prose are dropped;
 * indentation is kept.
 */
public class ResponseSanitizer {

    private static final Pattern FENCED_BLOCK = Pattern.compile("```[A-Za-z]*[ \\t]*\\R(.*?)```", Pattern.DOTALL);
    private static final Pattern LEADING_WORD = Pattern.compile("^([A-Z]+)\\b");
    private static final Set<String> KEYWORDS = Set.of(
        "DEFINE", "CALL", "IF", "ELIF", "ELSE", "ENDIF", "END", "FOR", "ENDFOR", "RETURN"
    );

    /**
     * Cleans a raw response.
     *
     * @param raw raw response text, may be null
     * @return DSL text, or empty when nothing usable remains
     */
    public Optional<String> sanitize(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        String text = raw;
        Matcher fence = FENCED_BLOCK.matcher(raw);
        if (fence.find()) {
            text = fence.group(1);
        }

        List<String> kept = new ArrayList<>();
        for (String line : text.split("\\R")) {
            if (isDslLine(line.trim())) {
                kept.add(line.stripTrailing());
            }
        }
        return kept.isEmpty() ? Optional.empty() : Optional.of(String.join("\n", kept));
    }

    private static boolean isDslLine(String trimmed) {
        if (trimmed.startsWith("{{")) {
            return true;
        }
        Matcher word = LEADING_WORD.matcher(trimmed);
        return word.find() && KEYWORDS.contains(word.group(1));
    }
}
