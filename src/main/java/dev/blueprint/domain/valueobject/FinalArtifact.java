package dev.blueprint.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonProperty;
import dev.blueprint.domain.enums.Phase;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal aggregate of one run. Holds references to the three phase result sets
 * rather than copies. Created once by the aggregator and never mutated.
 */
public record FinalArtifact(
        @JsonProperty("document_id") String documentId,
        @JsonProperty("generated_at") Instant generatedAt,
        @JsonProperty("workflow_execution_id") String executionId,
        @JsonProperty("executive_summary") String executiveSummary,
        @JsonProperty("system_overview") String systemOverview,
        @JsonProperty("architecture_diagram") String architectureDiagram,
        @JsonProperty("component_specifications") List<Object> componentSpecifications,
        @JsonProperty("api_documentation") Map<String, Object> apiDocumentation,
        @JsonProperty("data_flow_diagrams") List<Object> dataFlowDiagrams,
        @JsonProperty("code_quality_metrics") Map<String, Object> codeQualityMetrics,
        @JsonProperty("test_strategy") Map<String, Object> testStrategy,
        @JsonProperty("deployment_architecture") String deploymentArchitecture,
        @JsonProperty("operational_requirements") List<Object> operationalRequirements,
        @JsonProperty("documentation_gaps") List<Object> documentationGaps,
        @JsonProperty("validation_questions") List<Object> validationQuestions,
        @JsonProperty("confidence_score") double confidenceScore,
        List<String> warnings,
        @JsonProperty("analysis_results") PhaseResultSet analysisResults,
        @JsonProperty("synthesis_results") PhaseResultSet synthesisResults,
        @JsonProperty("validation_results") PhaseResultSet validationResults
) {
    public FinalArtifact {
        if (confidenceScore < 0.0 || confidenceScore > 1.0)
            throw new IllegalArgumentException("confidenceScore out of range: " + confidenceScore);
        componentSpecifications = copy(componentSpecifications);
        apiDocumentation = copy(apiDocumentation);
        dataFlowDiagrams = copy(dataFlowDiagrams);
        codeQualityMetrics = copy(codeQualityMetrics);
        testStrategy = copy(testStrategy);
        operationalRequirements = copy(operationalRequirements);
        documentationGaps = copy(documentationGaps);
        validationQuestions = copy(validationQuestions);
        warnings = copy(warnings);
    }

    private static <T> List<T> copy(List<T> list) {
        return list == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(list));
    }

    private static Map<String, Object> copy(Map<String, Object> map) {
        return map == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }

    public PhaseResultSet phaseResults(Phase phase) {
        return switch (phase) {
            case ANALYSIS -> analysisResults;
            case SYNTHESIS -> synthesisResults;
            case VALIDATION -> validationResults;
        };
    }
}
