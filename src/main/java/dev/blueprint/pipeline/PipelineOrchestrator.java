package dev.blueprint.pipeline;

import dev.blueprint.config.PipelineProperties;
import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.enums.PipelineState;
import dev.blueprint.domain.valueobject.ExecutionContext;
import dev.blueprint.domain.valueobject.FinalArtifact;
import dev.blueprint.domain.valueobject.PhaseResultSet;
import dev.blueprint.domain.valueobject.PipelineOutcome;
import dev.blueprint.domain.valueobject.PipelineRequest;
import dev.blueprint.domain.valueobject.UnitInput;
import dev.blueprint.exception.PipelineConfigurationException;
import dev.blueprint.unit.UnitRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Drives one run through the three phases.
 *
 * <pre>
 *  1. Validate request and registry (configuration errors fail the run before any phase)
 *  2. Phase 1: analysis units in parallel over the original request
 *  3. Phase 2: synthesis unit over request + phase 1 results
 *  4. Phase 3: validation unit over request + phase 1 and 2 results
 *  5. Aggregate whatever exists into the final artifact
 * </pre>
 *
 * <p>Unit failures never move the run to FAILED; the phase executor absorbs them and each
 * later phase sees the failed envelopes as absent data.
 */
@Component
public class PipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(PipelineOrchestrator.class);

    static final Pattern SAFE_EXECUTION_ID = Pattern.compile("[A-Za-z0-9][A-Za-z0-9._-]{0,127}");

    private final UnitRegistry registry;
    private final PhaseExecutor phaseExecutor;
    private final ArtifactAggregator aggregator;
    private final PipelineProperties properties;
    private final MeterRegistry meterRegistry;

    public PipelineOrchestrator(UnitRegistry registry,
                                PhaseExecutor phaseExecutor,
                                ArtifactAggregator aggregator,
                                PipelineProperties properties,
                                MeterRegistry meterRegistry) {
        this.registry = registry;
        this.phaseExecutor = phaseExecutor;
        this.aggregator = aggregator;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Executes the full pipeline. Always returns an outcome; never throws.
     */
    public PipelineOutcome run(PipelineRequest request) {
        String executionId = request.executionId() == null || request.executionId().isBlank()
                ? PipelineRequest.generateExecutionId()
                : request.executionId();
        PipelineRequest effective = request.withExecutionId(executionId);
        PipelineRun run = new PipelineRun(ExecutionContext.start(executionId));
        ExecutionContext context = run.context();

        MDC.put("executionId", executionId);
        Timer.Sample timerSample = Timer.start(meterRegistry);
        PipelineOutcome outcome = null;
        try {
            List<String> problems = validate(effective);
            if (!problems.isEmpty()) {
                problems.forEach(p -> log.error("Execution {} rejected: {}", executionId, p));
                outcome = run.fail(problems);
                return outcome;
            }
            warnAboutUnregisteredUnits(context);

            log.info("Starting pipeline {} for repository {}", executionId, effective.repositoryRoot());

            run.transitionTo(PipelineState.PHASE1_RUNNING);
            PhaseResultSet analysis = phaseExecutor.execute(Phase.ANALYSIS, properties.analysisUnits(),
                    UnitInput.forAnalysis(context, effective), effective.maxParallelUnits(), properties.phaseTimeout());

            run.transitionTo(PipelineState.PHASE2_RUNNING);
            PhaseResultSet synthesis = phaseExecutor.execute(Phase.SYNTHESIS, List.of(properties.synthesisUnit()),
                    UnitInput.forSynthesis(context, effective, analysis), 1, properties.phaseTimeout());

            run.transitionTo(PipelineState.PHASE3_RUNNING);
            PhaseResultSet validation = phaseExecutor.execute(Phase.VALIDATION, List.of(properties.validationUnit()),
                    UnitInput.forValidation(context, effective, analysis, synthesis), 1, properties.phaseTimeout());

            FinalArtifact artifact = aggregator.aggregate(context, analysis, synthesis, validation);
            outcome = run.complete(artifact);
            log.info("Pipeline {} completed in {}s with confidence {}",
                    executionId, outcome.totalElapsedSeconds(), artifact.confidenceScore());
            return outcome;
        } catch (PipelineConfigurationException e) {
            log.error("Pipeline {} failed: {}", executionId, e.getMessage());
            outcome = run.fail(List.of(e.getMessage()));
            return outcome;
        } catch (RuntimeException e) {
            log.error("Pipeline {} failed in state {}: {}", executionId, run.state(), e.getMessage(), e);
            outcome = run.fail(List.of("Pipeline failed in state " + run.state() + ": " + e.getMessage()));
            return outcome;
        } finally {
            timerSample.stop(Timer.builder("blueprint.pipeline.duration")
                    .description("End-to-end pipeline run time")
                    .tag("status", outcome != null ? outcome.status().wireName() : "failed")
                    .register(meterRegistry));
            MDC.remove("executionId");
        }
    }

    /**
     * Produces a failed outcome for input that could not even be turned into a request.
     */
    public PipelineOutcome reject(String executionId, List<String> errors) {
        String id = executionId == null || executionId.isBlank() ? PipelineRequest.generateExecutionId() : executionId;
        return new PipelineRun(ExecutionContext.start(id)).fail(errors);
    }

    public static boolean isSafeExecutionId(String executionId) {
        return executionId != null && SAFE_EXECUTION_ID.matcher(executionId).matches();
    }

    // ── Internal ───────────────────────────────────────────────────

    private List<String> validate(PipelineRequest request) {
        List<String> problems = new ArrayList<>();

        if (registry.isEmpty()) problems.add("Unit registry is empty");

        if (!isSafeExecutionId(request.executionId()))
            problems.add("Invalid execution id: " + request.executionId()
                    + " (letters, digits, '.', '_' and '-' only, at most 128 characters)");

        if (request.maxParallelUnits() < 1)
            problems.add("maxParallelUnits must be at least 1, was " + request.maxParallelUnits());

        String repositoryPath = request.repositoryPath();
        if (repositoryPath == null || repositoryPath.isBlank()) {
            problems.add("Repository path is required");
        } else {
            try {
                Path root = Path.of(repositoryPath);
                if (!Files.exists(root)) problems.add("Repository path does not exist: " + repositoryPath);
                else if (!Files.isDirectory(root)) problems.add("Repository path is not a directory: " + repositoryPath);
            } catch (InvalidPathException e) {
                problems.add("Invalid repository path: " + repositoryPath);
            }
        }

        List<String> patterns = new ArrayList<>(request.includePatterns());
        patterns.addAll(request.excludePatterns());
        for (String pattern : patterns) {
            if (pattern == null || pattern.isBlank()) {
                problems.add("Glob pattern must not be null or blank");
                continue;
            }
            try {
                FileSystems.getDefault().getPathMatcher("glob:" + pattern);
            } catch (IllegalArgumentException e) {
                problems.add("Invalid glob pattern: " + pattern);
            }
        }

        Set<String> seen = new HashSet<>();
        for (String unit : properties.analysisUnits()) {
            if (!seen.add(unit)) problems.add("Analysis unit listed twice: " + unit);
        }
        return problems;
    }

    private void warnAboutUnregisteredUnits(ExecutionContext context) {
        List<String> planned = new ArrayList<>(properties.analysisUnits());
        planned.add(properties.synthesisUnit());
        planned.add(properties.validationUnit());
        for (String unit : planned) {
            if (!registry.isRegistered(unit)) {
                log.warn("Unit {} is not registered; its slot will report a registration failure", unit);
                context.addWarning("Unit " + unit + " is not registered");
            }
        }
    }
}
