package com.dslforge.core;

import com.dslforge.core.analysis.AnalysisResult;
import com.dslforge.core.analysis.SymbolAnalyzer;
import com.dslforge.core.config.ForgeConfig;
import com.dslforge.core.correction.LoopSettings;
import com.dslforge.core.correction.SelfCorrectionLoop;
import com.dslforge.core.correction.TranspileRequest;
import com.dslforge.core.correction.TranspileSession;
import com.dslforge.core.generation.GenerationService;
import com.dslforge.core.generation.GenerationServiceFactory;
import com.dslforge.core.model.Defect;
import com.dslforge.core.model.TranspileResult;
import com.dslforge.core.model.Variable;
import com.dslforge.core.parser.DslParser;
import com.dslforge.core.parser.ParseResult;
import com.dslforge.core.repair.RepairEngine;
import com.dslforge.core.repair.RepairResult;
import com.dslforge.core.validation.DslValidator;

import java.util.List;
import java.util.Objects;

/**
 * Entry point to the transpiler pipeline.
 *
 * <p>{@link #transpile(TranspileRequest)} runs a full session (parse, validate,
 * repair, regenerate, synthesize, cluster). {@link #check(String, List)} and
 * {@link #repairOnce(String, List)} expose the deterministic stages on their own.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Transpiler transpiler = Transpiler.fromConfig(ConfigLoader.load(Paths.get("dslforge.yaml")));
 * TranspileResult result = transpiler.transpile(TranspileRequest.of(dsl, variables));
 * if (result.isSuccess()) {
 *     System.out.println(result.program());
 * }
 * }</pre>
 *
 * <p>Instances hold no per-session state; concurrent sessions may share one.
 */
public class Transpiler {

    private final SelfCorrectionLoop loop;
    private final DslParser parser = new DslParser();
    private final SymbolAnalyzer analyzer = new SymbolAnalyzer();
    private final DslValidator validator = new DslValidator();
    private final RepairEngine repairEngine = new RepairEngine();

    public Transpiler(GenerationService generationService, LoopSettings settings) {
        this.loop = new SelfCorrectionLoop(
            Objects.requireNonNull(generationService, "generationService must not be null"),
            Objects.requireNonNull(settings, "settings must not be null"));
    }

    /**
     * Creates a transpiler using the configured generation provider and loop bounds.
     *
     * @param config configuration
     * @return transpiler
     */
    public static Transpiler fromConfig(ForgeConfig config) {
        return new Transpiler(GenerationServiceFactory.create(config.generation()),
            LoopSettings.from(config.transpiler()));
    }

    /**
     * Runs a full session.
     *
     * @param request session input
     * @return terminal result
     */
    public TranspileResult transpile(TranspileRequest request) {
        return loop.run(request);
    }

    /**
     * Runs a full session that can be cancelled through {@code session}.
     *
     * @param request session input
     * @param session cancellation handle
     * @return terminal result
     */
    public TranspileResult transpile(TranspileRequest request, TranspileSession session) {
        return loop.run(request, session);
    }

    /**
     * Parses, analyzes and validates without repairing.
     *
     * @param dslText DSL source
     * @param variables upstream variables
     * @return every defect, sorted by position
     */
    public List<Defect> check(String dslText, List<Variable> variables) {
        ParseResult parsed = parser.parse(dslText);
        AnalysisResult analysis = analyzer.analyze(parsed.statements(), variables);
        return validator.validate(parsed.statements(), analysis, parsed.carriedDefects());
    }

    /**
     * Runs one deterministic repair pass over the defects found by {@link #check(String, List)}.
     *
     * @param dslText DSL source
     * @param variables upstream variables
     * @return repaired statements, fixed kinds and remaining defects
     */
    public RepairResult repairOnce(String dslText, List<Variable> variables) {
        ParseResult parsed = parser.parse(dslText);
        AnalysisResult analysis = analyzer.analyze(parsed.statements(), variables);
        List<Defect> defects = validator.validate(parsed.statements(), analysis, parsed.carriedDefects());
        return repairEngine.repair(parsed.statements(), defects, variables);
    }
}
