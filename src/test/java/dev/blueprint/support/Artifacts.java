package dev.blueprint.support;

import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.valueobject.FinalArtifact;
import dev.blueprint.domain.valueobject.PhaseResultSet;
import dev.blueprint.domain.valueobject.UnitResult;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Ready-made artifacts for rendering and persistence tests.
 */
public final class Artifacts {

    private Artifacts() {}

    public static FinalArtifact sample(String executionId) {
        PhaseResultSet analysis = PhaseResultSet.builder(Phase.ANALYSIS)
                .record(UnitResult.completed("repository_analyzer", executionId, Map.of("k", 1), Duration.ofMillis(20)))
                .freeze();
        return new FinalArtifact(
                "design_doc_" + executionId + "_20250101_120000",
                Instant.parse("2025-01-01T12:00:00Z"),
                executionId,
                "Analysis phase: 1 of 1 units completed.",
                "Orders <service> & friends.",
                "graph TD\n    m0[\"api (6 files)\"]\n",
                List.of(Map.of("name", "api", "type", "module")),
                Map.of("api_style", "REST", "total_endpoints", 2),
                List.of(Map.of("name", "Request handling", "description", "client -> controller",
                        "mermaid", "sequenceDiagram\n    client->>controller: call\n")),
                Map.of("source_files", 6),
                Map.of("target_coverage", "Maintain current ratio"),
                "The application is packaged as a Docker image.",
                List.of("Centralize logs."),
                List.of(Map.of("type", "undocumented_module", "description", "Module 'worker' is not mentioned")),
                List.of(Map.of("id", "Q1", "question", "Who owns worker?", "priority", "medium")),
                0.72,
                List.of("analysis unit test_analyst failed: boom"),
                analysis,
                PhaseResultSet.empty(Phase.SYNTHESIS),
                PhaseResultSet.empty(Phase.VALIDATION));
    }

    public static FinalArtifact empty(String executionId) {
        return new FinalArtifact("design_doc_" + executionId, Instant.parse("2025-01-01T12:00:00Z"), executionId,
                "", "", "", null, null, null, null, null, "", null, null, null, 0.5, null,
                PhaseResultSet.empty(Phase.ANALYSIS), PhaseResultSet.empty(Phase.SYNTHESIS),
                PhaseResultSet.empty(Phase.VALIDATION));
    }
}
