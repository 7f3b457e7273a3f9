package dev.blueprint.unit;

import dev.blueprint.domain.enums.FailureKind;
import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.valueobject.UnitInput;
import dev.blueprint.domain.valueobject.UnitResult;

import java.time.Duration;

/**
 * Stand-in for a unit that has a slot in the pipeline but no implementation yet.
 * Always fails with {@code "not implemented"}.
 */
public final class NotImplementedUnit implements PipelineUnit {

    public static final String MESSAGE = "not implemented";

    private final String name;
    private final Phase phase;

    public NotImplementedUnit(String name, Phase phase) {
        this.name = name;
        this.phase = phase;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Phase getPhase() {
        return phase;
    }

    @Override
    public UnitResult execute(UnitInput input) {
        return UnitResult.failed(name, input.executionId(), FailureKind.NOT_IMPLEMENTED, MESSAGE, Duration.ZERO);
    }
}
