package com.dslforge.core.correction;

import com.dslforge.core.analysis.AnalysisResult;
import com.dslforge.core.analysis.SymbolAnalyzer;
import com.dslforge.core.generation.GenerationException;
import com.dslforge.core.generation.GenerationRequest;
import com.dslforge.core.generation.GenerationService;
import com.dslforge.core.generation.ServiceError;
import com.dslforge.core.model.AttemptRecord;
import com.dslforge.core.model.CorrectionAction;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.DefectKind;
import com.dslforge.core.model.FailureReason;
import com.dslforge.core.model.Statement;
import com.dslforge.core.model.TranspileResult;
import com.dslforge.core.model.Variable;
import com.dslforge.core.parser.DslParser;
import com.dslforge.core.parser.DslPrinter;
import com.dslforge.core.parser.ParseResult;
import com.dslforge.core.repair.RepairEngine;
import com.dslforge.core.repair.RepairResult;
import com.dslforge.core.validation.DslValidator;
import com.dslforge.core.workflow.WorkflowPlanner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Bounded state machine that turns a DSL draft into a validated, planned
 * workflow.
 *
 * <pre>
 * PARSING → VALIDATING → DONE(success)
 *              │  ↑
 *              ↓  │
 *           REPAIRING        (deterministic, bounded per draft)
 *              │
 *              ↓
 *         REGENERATING → PARSING   (one attempt per request)
 * </pre>
 *
 * <h2>Budget</h2>
 * <p>An attempt is one draft: the initial draft, or one regeneration request
 * whether or not it succeeded. Repair rounds do not consume attempts; a draft
 * gets at most {@link LoopSettings#maxRepairRounds()} rounds and leaves the
 * repair state as soon as a round fixes nothing. When the budget is spent with
 * fatal defects left, the session fails with
 * {@link FailureReason#BUDGET_EXHAUSTED}.
 *
 * <h2>Service errors</h2>
 * <p>Timeouts, rate limits and unavailability consume the attempt and the loop
 * asks again. A malformed response goes through {@link ResponseSanitizer}; if
 * nothing usable remains the session fails with {@link FailureReason#SERVICE_ERROR}.
 *
 * <p>Every transition appends an {@link AttemptRecord}. Each call to
 * {@link #run(TranspileRequest, TranspileSession)} owns all of its state, so
 * one loop instance can serve concurrent sessions as long as the generation
 * service is thread-safe.
 */
public class SelfCorrectionLoop {

    private static final Logger log = LoggerFactory.getLogger(SelfCorrectionLoop.class);

    private final GenerationService generationService;
    private final LoopSettings settings;
    private final DslParser parser;
    private final DslPrinter printer;
    private final SymbolAnalyzer analyzer;
    private final DslValidator validator;
    private final RepairEngine repairEngine;
    private final WorkflowPlanner planner;
    private final ResponseSanitizer sanitizer;
    private final RegenerationPromptBuilder promptBuilder;

    public SelfCorrectionLoop(GenerationService generationService, LoopSettings settings) {
        this(generationService, settings, new DslParser(), new SymbolAnalyzer(), new DslValidator(),
            new RepairEngine(), new WorkflowPlanner());
    }

    public SelfCorrectionLoop(GenerationService generationService, LoopSettings settings, DslParser parser,
                              SymbolAnalyzer analyzer, DslValidator validator, RepairEngine repairEngine,
                              WorkflowPlanner planner) {
        this.generationService = Objects.requireNonNull(generationService, "generationService must not be null");
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
        this.repairEngine = Objects.requireNonNull(repairEngine, "repairEngine must not be null");
        this.planner = Objects.requireNonNull(planner, "planner must not be null");
        this.printer = new DslPrinter();
        this.sanitizer = new ResponseSanitizer();
        this.promptBuilder = new RegenerationPromptBuilder();
    }

    /**
     * Runs a session that cannot be cancelled from outside.
     *
     * @param request session input
     * @return terminal result
     */
    public TranspileResult run(TranspileRequest request) {
        return run(request, new TranspileSession(request.sessionId()));
    }

    /**
     * Runs a session.
     *
     * @param request session input
     * @param session handle checked for cancellation before every transition
     * @return terminal result, never null
     */
    public TranspileResult run(TranspileRequest request, TranspileSession session) {
        Objects.requireNonNull(request, "request must not be null");
        Objects.requireNonNull(session, "session must not be null");
        log.info("Starting transpile session {} (maxAttempts={}, strategy={})",
            request.sessionId(), settings.maxAttempts(), request.strategy());

        ExecutorService executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "dslforge-generation-" + request.sessionId());
            thread.setDaemon(true);
            return thread;
        });
        try {
            return new Run(request, session, executor).execute();
        } finally {
            executor.shutdownNow();
        }
    }

    /**
     * State of one session.
     */
    private final class Run {
        private final TranspileRequest request;
        private final TranspileSession session;
        private final ExecutorService executor;
        private final List<AttemptRecord> attemptLog = new ArrayList<>();

        private LoopState state = LoopState.PARSING;
        private int attempt = 1;
        private int repairRounds;
        private String draftText;
        private List<Statement> statements = List.of();
        private List<Defect> carried = List.of();
        private List<Defect> defects = List.of();
        private List<Defect> fatal = List.of();
        private List<Variable> upstream;
        private final Map<String, String> inputAliases = new LinkedHashMap<>();
        private TranspileResult result;

        private Run(TranspileRequest request, TranspileSession session, ExecutorService executor) {
            this.request = request;
            this.session = session;
            this.executor = executor;
            this.draftText = request.dslText();
            this.upstream = request.variables();
        }

        TranspileResult execute() {
            while (state != LoopState.DONE) {
                if (session.isCancelled()) {
                    record(CorrectionAction.CANCELLED, fatal.size(), fatal.size(), "cancelled in state " + state);
                    log.warn("Session {} cancelled", request.sessionId());
                    return fail(FailureReason.CANCELLED);
                }
                switch (state) {
                    case PARSING -> parse();
                    case VALIDATING -> validate();
                    case REPAIRING -> repair();
                    case REGENERATING -> regenerate();
                    default -> throw new IllegalStateException("Unexpected state " + state);
                }
            }
            return result;
        }

        private void parse() {
            ParseResult parsed = parser.parse(draftText);
            statements = parsed.statements();
            carried = parsed.carriedDefects();
            repairRounds = 0;
            upstream = request.variables();
            inputAliases.clear();
            int found = (int) parsed.defects().stream().filter(Defect::isFatal).count();
            record(CorrectionAction.PARSED, fatal.size(), found,
                parsed.statements().size() + " top-level statements");
            log.info("Attempt {}: parsed {} statements, {} parse defects", attempt, statements.size(), parsed.defects().size());
            transition(LoopState.VALIDATING);
        }

        private void validate() {
            int before = fatal.size();
            AnalysisResult analysis = analyzer.analyze(statements, upstream);
            defects = validator.validate(statements, analysis, carried);
            fatal = defects.stream().filter(Defect::isFatal).toList();

            if (fatal.isEmpty()) {
                WorkflowPlanner.Plan plan = planner.plan(statements, analysis.callGraph(), request.strategy(),
                    inputAliases, title());
                if (plan.isComplete()) {
                    record(CorrectionAction.VALIDATED, before, 0, "no fatal defects");
                    record(CorrectionAction.SUCCEEDED, 0, 0, plan.modules().size() + " modules");
                    log.info("Session {} succeeded after {} attempts with {} modules",
                        request.sessionId(), attempt, plan.modules().size());
                    result = TranspileResult.success(request.sessionId(), plan.modules(), plan.entryPoint(),
                        plan.program(), defects, attempt, attemptLog, printer.print(statements));
                    transition(LoopState.DONE);
                    return;
                }
                Defect cycle = plan.cycleDefect().get();
                List<Defect> merged = new ArrayList<>(defects);
                merged.add(cycle);
                merged.sort(null);
                defects = List.copyOf(merged);
                fatal = List.of(cycle);
            }

            record(CorrectionAction.VALIDATED, before, fatal.size(), summarize(fatal));
            log.info("Attempt {}: {} fatal defects", attempt, fatal.size());
            if (log.isDebugEnabled()) {
                fatal.forEach(defect -> log.debug("  {}", defect.describe()));
            }

            if (repairRounds < settings.maxRepairRounds() && repairEngine.canRepair(fatal)) {
                transition(LoopState.REPAIRING);
            } else {
                regenerateOrFail();
            }
        }

        private void repair() {
            RepairResult result = repairEngine.repair(statements, fatal, upstream);
            repairRounds++;
            if (!result.madeProgress()) {
                record(CorrectionAction.REPAIR_STALLED, fatal.size(), fatal.size(), "no deterministic fix applied");
                regenerateOrFail();
                return;
            }
            statements = result.statements();
            applyRenames(result.identifierMapping());
            int after = (int) result.remaining().stream().filter(Defect::isFatal).count();
            record(CorrectionAction.REPAIRED, fatal.size(), after, "fixed " + result.fixedKinds().stream()
                .map(DefectKind::getDisplayName).collect(Collectors.joining(", ")));
            transition(LoopState.VALIDATING);
        }

        private void regenerate() {
            attempt++;
            String previousDraft = printer.print(statements);
            GenerationRequest generationRequest = promptBuilder.build(request, previousDraft, defects, attempt,
                settings.generationTimeout());
            log.info("Attempt {}: requesting a new draft from {}", attempt, generationService.getDisplayName());

            try {
                String response = generate(generationRequest);
                Optional<String> cleaned = sanitizer.sanitize(response);
                if (cleaned.isEmpty()) {
                    throw new GenerationException(ServiceError.MALFORMED_RESPONSE,
                        "Response contains no DSL statements", response, null);
                }
                acceptDraft(cleaned.get(), "new draft received");
            } catch (GenerationException e) {
                handleServiceError(e);
            }
        }

        private void handleServiceError(GenerationException e) {
            if (!e.getKind().isRetryable()) {
                Optional<String> rescued = sanitizer.sanitize(e.getRawResponse());
                if (rescued.isPresent()) {
                    log.warn("Attempt {}: malformed response rescued by sanitizer", attempt);
                    acceptDraft(rescued.get(), "malformed response sanitized");
                    return;
                }
                record(CorrectionAction.SERVICE_FAILED, fatal.size(), fatal.size(),
                    e.getKind() + ": " + e.getMessage());
                log.error("Session {} failed: generation service returned an unusable response: {}",
                    request.sessionId(), e.getMessage());
                finish(FailureReason.SERVICE_ERROR);
                return;
            }

            record(CorrectionAction.SERVICE_FAILED, fatal.size(), fatal.size(), e.getKind() + ": " + e.getMessage());
            log.warn("Attempt {}: generation failed with {} ({})", attempt, e.getKind(), e.getMessage());
            regenerateOrFail();
        }

        private String generate(GenerationRequest generationRequest) throws GenerationException {
            Future<String> future = executor.submit(() -> generationService.generate(generationRequest));
            try {
                String response = future.get(settings.generationTimeout().toMillis(), TimeUnit.MILLISECONDS);
                if (response == null) {
                    throw new GenerationException(ServiceError.MALFORMED_RESPONSE, "Service returned no text");
                }
                return response;
            } catch (TimeoutException e) {
                future.cancel(true);
                throw new GenerationException(ServiceError.TIMEOUT,
                    "No response within " + settings.generationTimeout().toSeconds() + "s", null, e);
            } catch (ExecutionException e) {
                if (e.getCause() instanceof GenerationException generationException) {
                    throw generationException;
                }
                throw new GenerationException(ServiceError.UNAVAILABLE,
                    "Generation service failed: " + e.getCause(), null, e.getCause());
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                session.cancel();
                throw new GenerationException(ServiceError.TIMEOUT, "Interrupted while waiting for a draft", null, e);
            }
        }

        private void acceptDraft(String text, String detail) {
            draftText = text;
            record(CorrectionAction.REGENERATED, fatal.size(), fatal.size(), detail);
            transition(LoopState.PARSING);
        }

        private void regenerateOrFail() {
            if (attempt < settings.maxAttempts()) {
                transition(LoopState.REGENERATING);
                return;
            }
            log.error("Session {} failed: attempt budget of {} exhausted with {} fatal defects",
                request.sessionId(), settings.maxAttempts(), fatal.size());
            finish(FailureReason.BUDGET_EXHAUSTED);
        }

        private void finish(FailureReason reason) {
            result = fail(reason);
            transition(LoopState.DONE);
        }

        private TranspileResult fail(FailureReason reason) {
            if (reason != FailureReason.CANCELLED) {
                record(CorrectionAction.FAILED, fatal.size(), fatal.size(), reason.name());
            }
            return TranspileResult.failure(request.sessionId(), reason, defects, attempt, attemptLog,
                printer.print(statements));
        }

        private void applyRenames(Map<String, String> mapping) {
            if (mapping.isEmpty()) {
                return;
            }
            List<Variable> renamed = new ArrayList<>();
            for (Variable variable : upstream) {
                String replacement = null;
                for (Map.Entry<String, String> entry : mapping.entrySet()) {
                    if (entry.getValue().equals(variable.name())) {
                        replacement = entry.getKey();
                    }
                }
                if (replacement == null) {
                    renamed.add(variable);
                    continue;
                }
                String original = inputAliases.getOrDefault(variable.name(), variable.name());
                inputAliases.remove(variable.name());
                inputAliases.put(replacement, original);
                renamed.add(new Variable(replacement, variable.type(), variable.value(), variable.originText()));
                log.debug("Input {} is referenced as {}", original, replacement);
            }
            upstream = List.copyOf(renamed);
        }

        private void transition(LoopState next) {
            log.debug("Session {}: {} -> {}", request.sessionId(), state, next);
            state = next;
        }

        private void record(CorrectionAction action, int before, int after, String detail) {
            attemptLog.add(new AttemptRecord(attempt, action, before, after, detail));
        }

        private String title() {
            String requirement = request.requirement().strip();
            if (requirement.isEmpty()) {
                return "Workflow " + request.sessionId();
            }
            int newline = requirement.indexOf('\n');
            return newline < 0 ? requirement : requirement.substring(0, newline);
        }
    }

    private static String summarize(List<Defect> defects) {
        if (defects.isEmpty()) {
            return "no fatal defects";
        }
        return defects.stream()
            .collect(Collectors.groupingBy(defect -> defect.kind().getDisplayName(), LinkedHashMap::new,
                Collectors.counting()))
            .entrySet().stream()
            .map(entry -> entry.getKey() + "=" + entry.getValue())
            .collect(Collectors.joining(", "));
    }
}
