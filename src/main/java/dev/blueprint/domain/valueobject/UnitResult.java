package dev.blueprint.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.blueprint.domain.enums.FailureKind;
import dev.blueprint.domain.enums.UnitStatus;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The envelope every unit returns, whatever it computes internally.
 *
 * <p>Invariants: {@code FAILED} carries an error message, {@code COMPLETED} never does.
 * Instances are created once per invocation and never mutated afterwards.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record UnitResult(
        @JsonProperty("unit_name") String unitName,
        @JsonProperty("execution_id") String executionId,
        UnitStatus status,
        Instant timestamp,
        @JsonProperty("execution_time_seconds") Double elapsedSeconds,
        @JsonProperty("error_message") String errorMessage,
        Map<String, Object> payload,
        Map<String, Object> metadata
) {
    public static final String FAILURE_KIND = "failure_kind";
    public static final String ATTEMPTS = "attempts";

    public UnitResult {
        if (unitName == null || unitName.isBlank()) throw new IllegalArgumentException("unitName required");
        if (status == null) throw new IllegalArgumentException("status required");
        if (status == UnitStatus.FAILED && (errorMessage == null || errorMessage.isBlank()))
            throw new IllegalArgumentException("failed result for " + unitName + " requires an error message");
        if (status == UnitStatus.COMPLETED && errorMessage != null)
            throw new IllegalArgumentException("completed result for " + unitName + " cannot carry an error");
        if (timestamp == null) timestamp = Instant.now();
        payload = freeze(payload);
        metadata = freeze(metadata);
    }

    public static UnitResult completed(String unitName, String executionId,
                                       Map<String, Object> payload, Duration elapsed) {
        return new UnitResult(unitName, executionId, UnitStatus.COMPLETED, Instant.now(),
                seconds(elapsed), null, payload, Map.of());
    }

    public static UnitResult failed(String unitName, String executionId, FailureKind kind,
                                    String error, Duration elapsed) {
        return new UnitResult(unitName, executionId, UnitStatus.FAILED, Instant.now(),
                seconds(elapsed), describe(error, kind), Map.of(), Map.of(FAILURE_KIND, kind.wireName()));
    }

    public static UnitResult cancelled(String unitName, String executionId, String reason, Duration elapsed) {
        return new UnitResult(unitName, executionId, UnitStatus.CANCELLED, Instant.now(),
                seconds(elapsed), describe(reason, FailureKind.CANCELLED), Map.of(),
                Map.of(FAILURE_KIND, FailureKind.CANCELLED.wireName()));
    }

    /**
     * Synthetic slot for a name the registry cannot resolve. The unit never ran.
     */
    public static UnitResult notRegistered(String unitName, String executionId) {
        return failed(unitName, executionId, FailureKind.REGISTRATION,
                "Unit not registered: " + unitName, Duration.ZERO);
    }

    /**
     * Copy with additional metadata entries. The original is left untouched.
     */
    public UnitResult withMetadata(String key, Object value) {
        Map<String, Object> merged = new LinkedHashMap<>(metadata);
        merged.put(key, value);
        return new UnitResult(unitName, executionId, status, timestamp, elapsedSeconds,
                errorMessage, payload, merged);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == UnitStatus.COMPLETED;
    }

    public Optional<FailureKind> failureKind() {
        Object kind = metadata.get(FAILURE_KIND);
        if (kind == null) return Optional.empty();
        for (FailureKind candidate : FailureKind.values()) {
            if (candidate.wireName().equals(kind.toString())) return Optional.of(candidate);
        }
        return Optional.empty();
    }

    private static Map<String, Object> freeze(Map<String, Object> map) {
        if (map == null || map.isEmpty()) return Map.of();
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    private static Double seconds(Duration elapsed) {
        return elapsed != null ? elapsed.toMillis() / 1000.0 : null;
    }

    private static String describe(String message, FailureKind kind) {
        return message == null || message.isBlank() ? kind.wireName() : message;
    }
}
