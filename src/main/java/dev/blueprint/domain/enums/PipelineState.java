package dev.blueprint.domain.enums;

import java.util.Set;

/**
 * Lifecycle: NOT_STARTED → PHASE1_RUNNING → PHASE2_RUNNING → PHASE3_RUNNING → COMPLETED.
 * FAILED is reachable from any non-terminal state on a controller-level fault.
 */
public enum PipelineState {
    NOT_STARTED, PHASE1_RUNNING, PHASE2_RUNNING, PHASE3_RUNNING, COMPLETED, FAILED;

    public boolean canTransitionTo(PipelineState next) {
        if (next == FAILED) return !isTerminal();
        return switch (this) {
            case NOT_STARTED -> next == PHASE1_RUNNING;
            case PHASE1_RUNNING -> next == PHASE2_RUNNING;
            case PHASE2_RUNNING -> next == PHASE3_RUNNING;
            case PHASE3_RUNNING -> next == COMPLETED;
            case COMPLETED, FAILED -> false;
        };
    }

    public boolean isTerminal() {
        return Set.of(COMPLETED, FAILED).contains(this);
    }
}
