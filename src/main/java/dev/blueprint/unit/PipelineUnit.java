package dev.blueprint.unit;

import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.valueobject.UnitInput;
import dev.blueprint.domain.valueobject.UnitResult;

/**
 * Contract for every analyzer, synthesizer and validator.
 *
 * <p>Implementations must never let a fault escape {@link #execute}: I/O errors, malformed
 * upstream data and external-service faults all come back as a failed {@link UnitResult}.
 * Cached instances are shared across runs and threads, so implementations keep no
 * unguarded mutable state. Adding a unit = implement this + {@code @Component}.
 */
public interface PipelineUnit {

    String getName();

    Phase getPhase();

    UnitResult execute(UnitInput input);
}
