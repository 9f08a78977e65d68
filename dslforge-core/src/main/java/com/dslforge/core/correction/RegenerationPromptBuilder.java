package com.dslforge.core.correction;

import com.dslforge.core.generation.Diagnostics;
import com.dslforge.core.generation.GenerationRequest;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectSeverity;
import com.dslforge.core.model.Variable;

import java.time.Duration;
import java.util.List;

/**
 * Builds the prompt that asks the generation service for a corrected draft.
 *
 * <p>The system prompt summarizes the DSL syntax and the correction rules. The
 * user prompt carries the requirement, the available variables, the previous
 * draft and its defects grouped by severity.
 */
public class RegenerationPromptBuilder {

    /** Defects listed per severity group; the rest are summarized as a count. */
    public static final int MAX_DEFECTS_PER_GROUP = 10;

    static final String SYSTEM_PROMPT = String.join("\n",
        "You write programs in a line-oriented pseudocode DSL. Output only DSL code.",
        "",
        "Syntax:",
        "  DEFINE {{name}}: Type = value      Types: Integer, Float, String, Boolean, List, Dict, Any",
        "  {{name}} = expression",
        "  {{name}} = CALL function(arg, key=value)",
        "  CALL function(arg)",
        "  IF condition / ELIF condition / ELSE / ENDIF",
        "  FOR {{item}} IN {{items}} / ENDFOR",
        "  RETURN expression",
        "Variables are always written as {{name}}. Conditions may use == != > < >= <= AND OR NOT IN.",
        "",
        "Correction rules:",
        "1. Fix every ERROR listed.",
        "2. Every IF needs a matching ENDIF and every FOR a matching ENDFOR.",
        "3. Every variable must be defined with DEFINE or provided as an input before it is used.",
        "4. Never define the same variable twice.",
        "5. Variable names must be valid identifiers and must not be reserved words.",
        "6. Output the complete corrected program, not only the changed lines.");

    /**
     * Builds a regeneration request.
     *
     * @param request session input
     * @param previousDraft DSL of the previous draft
     * @param defects unresolved defects of the previous draft
     * @param attemptNumber number of the draft being requested
     * @param timeout request timeout
     * @return generation request
     */
    public GenerationRequest build(TranspileRequest request, String previousDraft, List<Defect> defects,
                                   int attemptNumber, Duration timeout) {
        StringBuilder sb = new StringBuilder();
        sb.append("Requirement:\n");
        sb.append(request.requirement().isBlank() ? "(not provided)" : request.requirement()).append("\n\n");

        sb.append("Available variables:\n");
        if (request.variables().isEmpty()) {
            sb.append("  (none)\n");
        }
        for (Variable variable : request.variables()) {
            sb.append("  {{").append(variable.name()).append("}}: ").append(variable.type().getDisplayName());
            if (variable.value() != null) {
                sb.append(" = ").append(variable.value());
            }
            sb.append("\n");
        }

        sb.append("\nPrevious draft:\n").append(previousDraft).append("\n\n");

        long errors = defects.stream().filter(Defect::isFatal).count();
        long warnings = defects.size() - errors;
        sb.append("The previous draft has ").append(errors).append(" errors and ")
            .append(warnings).append(" warnings.\n");
        appendGroup(sb, "ERRORS (must fix)", defects, DefectSeverity.ERROR);
        appendGroup(sb, "WARNINGS (should fix)", defects, DefectSeverity.WARNING);
        sb.append("\nRewrite the complete program so that it has no errors.");

        return new GenerationRequest(SYSTEM_PROMPT, sb.toString(),
            new Diagnostics(defects, previousDraft, attemptNumber), timeout);
    }

    private static void appendGroup(StringBuilder sb, String title, List<Defect> defects, DefectSeverity severity) {
        List<Defect> group = defects.stream().filter(defect -> defect.severity() == severity).toList();
        if (group.isEmpty()) {
            return;
        }
        sb.append("\n").append(title).append(":\n");
        group.stream().limit(MAX_DEFECTS_PER_GROUP)
            .forEach(defect -> sb.append("  - ").append(defect.describe()).append("\n"));
        if (group.size() > MAX_DEFECTS_PER_GROUP) {
            sb.append("  ... and ").append(group.size() - MAX_DEFECTS_PER_GROUP).append(" more\n");
        }
    }
}
