package com.dslforge.core.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of a transpile session.
 *
 * <p>On success {@code modules} are in invocation order and {@code program}
 * holds the complete generated source. On failure both are empty and
 * {@code defects} lists every unresolved defect of the final attempt, ready
 * for display. The attempt log is always present.
 *
 * @param sessionId session identifier
 * @param status terminal status
 * @param modules modules in invocation order, empty on failure
 * @param entryPoint synthesized entry point function, empty on failure
 * @param program complete generated program, empty on failure
 * @param defects remaining defects (warnings only on success)
 * @param attemptsUsed number of drafts consumed
 * @param attemptLog every transition of the loop
 * @param failureReason reason on failure, null on success
 * @param finalDsl DSL text of the last draft, printed from the repaired statements
 */
public record TranspileResult(
    String sessionId,
    TranspileStatus status,
    List<Module> modules,
    String entryPoint,
    String program,
    List<Defect> defects,
    int attemptsUsed,
    List<AttemptRecord> attemptLog,
    FailureReason failureReason,
    String finalDsl
) {
    /**
     * Compact constructor with validation.
     */
    public TranspileResult {
        Objects.requireNonNull(sessionId, "sessionId must not be null");
        Objects.requireNonNull(status, "status must not be null");
        modules = modules == null ? List.of() : List.copyOf(modules);
        entryPoint = entryPoint == null ? "" : entryPoint;
        program = program == null ? "" : program;
        defects = defects == null ? List.of() : List.copyOf(defects);
        attemptLog = attemptLog == null ? List.of() : List.copyOf(attemptLog);
        finalDsl = finalDsl == null ? "" : finalDsl;
        if (status == TranspileStatus.FAILURE) {
            Objects.requireNonNull(failureReason, "failureReason must not be null for a failed session");
        }
    }

    /**
     * Creates a successful result.
     *
     * @param sessionId session identifier
     * @param modules ordered modules
     * @param entryPoint entry point source
     * @param program full program source
     * @param warnings non-fatal defects
     * @param attemptsUsed drafts consumed
     * @param attemptLog attempt log
     * @param finalDsl final DSL text
     * @return success result
     */
    public static TranspileResult success(String sessionId, List<Module> modules, String entryPoint,
                                          String program, List<Defect> warnings, int attemptsUsed,
                                          List<AttemptRecord> attemptLog, String finalDsl) {
        return new TranspileResult(sessionId, TranspileStatus.SUCCESS, modules, entryPoint, program,
            warnings, attemptsUsed, attemptLog, null, finalDsl);
    }

    /**
     * Creates a failed result.
     *
     * @param sessionId session identifier
     * @param reason failure reason
     * @param defects unresolved defects
     * @param attemptsUsed drafts consumed
     * @param attemptLog attempt log
     * @param finalDsl final DSL text
     * @return failure result
     */
    public static TranspileResult failure(String sessionId, FailureReason reason, List<Defect> defects,
                                          int attemptsUsed, List<AttemptRecord> attemptLog, String finalDsl) {
        return new TranspileResult(sessionId, TranspileStatus.FAILURE, List.of(), "", "",
            defects, attemptsUsed, attemptLog, reason, finalDsl);
    }

    /**
     * Whether the session succeeded.
     *
     * @return true on success
     */
    public boolean isSuccess() {
        return status == TranspileStatus.SUCCESS;
    }
}
