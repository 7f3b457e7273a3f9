package dev.blueprint.dto.request;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * External run request, shared by the REST endpoint and the command line.
 * Unset fields fall back to {@code blueprint.pipeline.*} defaults.
 */
public record PipelineRunRequest(
        @JsonProperty("repository_path") String repositoryPath,
        @JsonProperty("execution_id") String executionId,
        @JsonProperty("include_patterns") List<String> includePatterns,
        @JsonProperty("exclude_patterns") List<String> excludePatterns,
        @JsonProperty("output_format") String outputFormat,
        @JsonProperty("include_diagrams") Boolean includeDiagrams,
        @JsonProperty("max_parallel_units") Integer maxParallelUnits
) {}
