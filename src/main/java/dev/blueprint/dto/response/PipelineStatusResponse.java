package dev.blueprint.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.enums.RunStatus;
import dev.blueprint.domain.valueobject.FinalArtifact;
import dev.blueprint.domain.valueobject.PipelineOutcome;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compact status object printed by the command line and returned by {@code POST /pipelines}.
 * The full artifact lives in the persisted run record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PipelineStatusResponse(
        RunStatus status,
        @JsonProperty("execution_id") String executionId,
        @JsonProperty("total_elapsed_seconds") double totalElapsedSeconds,
        List<String> errors,
        List<String> warnings,
        @JsonProperty("document_id") String documentId,
        @JsonProperty("confidence_score") Double confidenceScore,
        @JsonProperty("executive_summary") String executiveSummary,
        Map<String, Map<String, String>> units,
        @JsonProperty("output_path") String outputPath
) {
    public static PipelineStatusResponse from(PipelineOutcome outcome, String outputPath) {
        FinalArtifact artifact = outcome.artifact();
        Map<String, Map<String, String>> units = null;
        if (artifact != null) {
            units = new LinkedHashMap<>();
            for (Phase phase : Phase.values()) {
                Map<String, String> statuses = new LinkedHashMap<>();
                artifact.phaseResults(phase).results()
                        .forEach((name, result) -> statuses.put(name, result.status().wireName()));
                units.put(phase.wireName(), statuses);
            }
        }
        return new PipelineStatusResponse(
                outcome.status(),
                outcome.executionId(),
                outcome.totalElapsedSeconds(),
                outcome.errors(),
                outcome.warnings(),
                artifact != null ? artifact.documentId() : null,
                artifact != null ? artifact.confidenceScore() : null,
                artifact != null ? artifact.executiveSummary() : null,
                units,
                outputPath);
    }
}
