package dev.blueprint.domain.valueobject;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Identifies one pipeline run. Identity is immutable; warnings and errors accumulate
 * while the run is in flight and may be appended from unit threads.
 */
public final class ExecutionContext {

    private final String executionId;
    private final Instant startedAt;
    private final List<String> warnings = new CopyOnWriteArrayList<>();
    private final List<String> errors = new CopyOnWriteArrayList<>();

    public ExecutionContext(String executionId, Instant startedAt) {
        if (executionId == null || executionId.isBlank())
            throw new IllegalArgumentException("executionId required");
        this.executionId = executionId;
        this.startedAt = startedAt != null ? startedAt : Instant.now();
    }

    public static ExecutionContext start(String executionId) {
        return new ExecutionContext(executionId, Instant.now());
    }

    public String executionId() {
        return executionId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Duration elapsed() {
        return Duration.between(startedAt, Instant.now());
    }

    public void addWarning(String warning) {
        warnings.add(warning);
    }

    public void addError(String error) {
        errors.add(error);
    }

    public List<String> warnings() {
        return List.copyOf(warnings);
    }

    public List<String> errors() {
        return List.copyOf(errors);
    }

    @Override
    public String toString() {
        return "ExecutionContext[" + executionId + "]";
    }
}
