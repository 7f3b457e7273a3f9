package dev.blueprint.unit;

import dev.blueprint.domain.enums.FailureKind;
import dev.blueprint.domain.valueobject.UnitInput;
import dev.blueprint.domain.valueobject.UnitResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Base class that turns a payload-producing body into a contract-honoring unit:
 * timing is measured and any exception becomes a failed envelope.
 */
public abstract class AbstractPipelineUnit implements PipelineUnit {

    private static final Logger log = LoggerFactory.getLogger(AbstractPipelineUnit.class);

    @Override
    public final UnitResult execute(UnitInput input) {
        Instant start = Instant.now();
        try {
            Map<String, Object> payload = analyze(input);
            return UnitResult.completed(getName(), input.executionId(), payload,
                    Duration.between(start, Instant.now()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return UnitResult.cancelled(getName(), input.executionId(), "Interrupted",
                    Duration.between(start, Instant.now()));
        } catch (Exception e) {
            log.warn("Unit {} failed for execution {}: {}", getName(), input.executionId(), e.getMessage());
            return UnitResult.failed(getName(), input.executionId(), FailureKind.EXECUTION,
                    describe(e), Duration.between(start, Instant.now()));
        }
    }

    /**
     * Computes this unit's payload. Throwing is fine; the caller converts it.
     */
    protected abstract Map<String, Object> analyze(UnitInput input) throws Exception;

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
