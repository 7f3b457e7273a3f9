package dev.blueprint.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.blueprint.domain.enums.PipelineState;
import dev.blueprint.domain.enums.RunStatus;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Machine-readable status of a run. Always carries status, execution id and elapsed time;
 * a failed outcome always carries at least one error and no artifact.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineOutcome(
        RunStatus status,
        @JsonProperty("execution_id") String executionId,
        @JsonProperty("total_elapsed_seconds") double totalElapsedSeconds,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("completed_at") Instant completedAt,
        @JsonIgnore PipelineState finalState,
        List<String> errors,
        List<String> warnings,
        FinalArtifact artifact
) {
    public PipelineOutcome {
        errors = errors != null ? List.copyOf(errors) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        if (status == RunStatus.FAILED && errors.isEmpty())
            throw new IllegalArgumentException("failed outcome requires at least one error");
    }

    /**
     * Copy with one more warning. Status is unchanged.
     */
    public PipelineOutcome withWarning(String warning) {
        List<String> extended = new ArrayList<>(warnings);
        extended.add(warning);
        return new PipelineOutcome(status, executionId, totalElapsedSeconds, startedAt, completedAt,
                finalState, errors, extended, artifact);
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }
}
