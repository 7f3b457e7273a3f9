package dev.blueprint.pipeline;

import dev.blueprint.domain.enums.PipelineState;
import dev.blueprint.domain.enums.RunStatus;
import dev.blueprint.domain.valueobject.ExecutionContext;
import dev.blueprint.domain.valueobject.FinalArtifact;
import dev.blueprint.domain.valueobject.PipelineOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * State holder for one run, owned by the orchestrator thread.
 * Lifecycle: NOT_STARTED → PHASE1_RUNNING → PHASE2_RUNNING → PHASE3_RUNNING → COMPLETED | FAILED
 */
final class PipelineRun {

    private static final Logger log = LoggerFactory.getLogger(PipelineRun.class);

    private final ExecutionContext context;
    private PipelineState state = PipelineState.NOT_STARTED;

    PipelineRun(ExecutionContext context) {
        this.context = context;
    }

    ExecutionContext context() {
        return context;
    }

    PipelineState state() {
        return state;
    }

    void transitionTo(PipelineState next) {
        if (!state.canTransitionTo(next))
            throw new IllegalStateException("Illegal pipeline transition " + state + " → " + next
                    + " for execution " + context.executionId());
        log.debug("Execution {}: {} → {}", context.executionId(), state, next);
        state = next;
    }

    PipelineOutcome complete(FinalArtifact artifact) {
        transitionTo(PipelineState.COMPLETED);
        return new PipelineOutcome(RunStatus.COMPLETED, context.executionId(), elapsedSeconds(),
                context.startedAt(), Instant.now(), state, context.errors(), artifact.warnings(), artifact);
    }

    PipelineOutcome fail(List<String> errors) {
        if (!state.isTerminal()) state = PipelineState.FAILED;
        errors.forEach(context::addError);
        List<String> allErrors = new ArrayList<>(context.errors());
        if (allErrors.isEmpty()) allErrors.add("Pipeline failed");
        return new PipelineOutcome(RunStatus.FAILED, context.executionId(), elapsedSeconds(),
                context.startedAt(), Instant.now(), state, allErrors, context.warnings(), null);
    }

    private double elapsedSeconds() {
        return context.elapsed().toMillis() / 1000.0;
    }
}
