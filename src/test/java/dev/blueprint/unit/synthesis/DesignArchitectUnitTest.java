package dev.blueprint.unit.synthesis;

import dev.blueprint.config.PipelineProperties;
import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.payload.PayloadKeys.DesignSynthesis;
import dev.blueprint.domain.payload.PayloadView;
import dev.blueprint.domain.valueobject.CodeFile;
import dev.blueprint.domain.valueobject.ExecutionContext;
import dev.blueprint.domain.valueobject.PhaseResultSet;
import dev.blueprint.domain.valueobject.UnitInput;
import dev.blueprint.infrastructure.ai.LlmNarrator;
import dev.blueprint.infrastructure.repository.RepositoryScanner;
import dev.blueprint.support.SampleRepository;
import dev.blueprint.unit.analysis.DevOpsDesignerUnit;
import dev.blueprint.unit.analysis.RepositoryAnalyzerUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SuppressWarnings("unchecked")
class DesignArchitectUnitTest {

    @TempDir
    Path repo;

    private RepositoryScanner scanner;
    private LlmNarrator narrator;
    private DesignArchitectUnit unit;
    private PhaseResultSet analysis;

    @BeforeEach
    void setUp() throws IOException {
        SampleRepository.create(repo);
        scanner = new RepositoryScanner(PipelineProperties.defaults());
        narrator = mock(LlmNarrator.class);
        when(narrator.isAvailable()).thenReturn(false);
        unit = new DesignArchitectUnit(scanner, narrator);

        UnitInput analysisInput = SampleRepository.analysisInput(repo);
        analysis = PhaseResultSet.builder(Phase.ANALYSIS)
                .record(new RepositoryAnalyzerUnit(scanner).execute(analysisInput))
                .record(new DevOpsDesignerUnit(scanner).execute(analysisInput))
                .freeze();
    }

    private PayloadView design(PhaseResultSet upstream, boolean diagrams) {
        UnitInput input = UnitInput.forSynthesis(ExecutionContext.start(SampleRepository.EXECUTION_ID),
                SampleRepository.request(repo, diagrams), upstream);
        return PayloadView.of(unit.execute(input));
    }

    @Nested
    @DisplayName("With analysis results")
    class WithAnalysis {

        @Test
        @DisplayName("Should summarize the system deterministically when no model is configured")
        void deterministicOverview() {
            String overview = design(analysis, true).text(DesignSynthesis.SYSTEM_OVERVIEW);

            assertThat(overview)
                    .contains("is a java codebase of 11 files organized into 4 top-level modules with a layered structure.")
                    .contains("Detected layers: controller, service, repository.")
                    .contains("2 HTTP endpoints are exposed.")
                    .contains("packaged as a Docker image");
            verify(narrator, never()).narrate(anyString());
        }

        @Test
        @DisplayName("Should describe one component per top-level module")
        void components() {
            List<Object> components = design(analysis, true).list(DesignSynthesis.COMPONENT_SPECIFICATIONS);

            assertThat(components).hasSize(4);
            Map<String, Object> api = (Map<String, Object>) components.stream()
                    .filter(c -> "api".equals(((Map<String, Object>) c).get("name")))
                    .findFirst().orElseThrow();
            assertThat(api).containsEntry("type", "module")
                    .containsEntry("language", "java")
                    .containsEntry("files", 6)
                    .containsEntry("responsibilities", List.of("controller", "service", "repository"));
        }

        @Test
        @DisplayName("Should document the discovered HTTP endpoints")
        void apiDocumentation() {
            Map<String, Object> api = design(analysis, true).map(DesignSynthesis.API_DOCUMENTATION);

            assertThat(api).containsEntry("api_style", "REST").containsEntry("total_endpoints", 2);
            assertThat((List<Map<String, Object>>) api.get("endpoints"))
                    .extracting(e -> e.get("method") + " " + e.get("path"))
                    .containsExactly("GET /orders", "POST /orders");
        }

        @Test
        @DisplayName("Should emit mermaid diagrams only when requested")
        void diagramsToggle() {
            PayloadView withDiagrams = design(analysis, true);
            PayloadView withoutDiagrams = design(analysis, false);

            assertThat(withDiagrams.text(DesignSynthesis.ARCHITECTURE_DIAGRAM)).startsWith("graph TD");
            assertThat((Map<String, Object>) withDiagrams.list(DesignSynthesis.DATA_FLOW_DIAGRAMS).get(0))
                    .containsEntry("description", "client -> controller -> service -> repository -> datastore")
                    .containsKey("mermaid");

            assertThat(withoutDiagrams.text(DesignSynthesis.ARCHITECTURE_DIAGRAM)).isEmpty();
            assertThat((Map<String, Object>) withoutDiagrams.list(DesignSynthesis.DATA_FLOW_DIAGRAMS).get(0))
                    .doesNotContainKey("mermaid");
        }

        @Test
        @DisplayName("Should derive layering principles from the detected layers")
        void principles() {
            assertThat(design(analysis, true).list(DesignSynthesis.DESIGN_PRINCIPLES))
                    .contains("Keep dependencies flowing one way: controller -> service -> repository.");
        }
    }

    @Nested
    @DisplayName("Narration")
    class Narration {

        @Test
        @DisplayName("Should use the narrated overview when the model answers")
        void narrated() {
            when(narrator.isAvailable()).thenReturn(true);
            when(narrator.narrate(anyString())).thenReturn(Optional.of("A compact order service."));

            assertThat(design(analysis, true).text(DesignSynthesis.SYSTEM_OVERVIEW)).isEqualTo("A compact order service.");
        }

        @Test
        @DisplayName("Should keep the deterministic overview when narration yields nothing")
        void narrationFallback() {
            when(narrator.isAvailable()).thenReturn(true);
            when(narrator.narrate(anyString())).thenReturn(Optional.empty());

            assertThat(design(analysis, true).text(DesignSynthesis.SYSTEM_OVERVIEW)).contains("java codebase");
        }
    }

    @Test
    @DisplayName("Should still produce every section when upstream analysis is missing")
    void missingUpstream() {
        PayloadView payload = design(PhaseResultSet.empty(Phase.ANALYSIS), true);

        assertThat(payload.isPresent()).isTrue();
        assertThat(payload.text(DesignSynthesis.SYSTEM_OVERVIEW)).isEqualTo(
                "Repository analysis was unavailable, so the system overview is limited. "
                        + "2 HTTP endpoints were found in the source.");
        assertThat(payload.list(DesignSynthesis.COMPONENT_SPECIFICATIONS)).isEmpty();
        assertThat(payload.text(DesignSynthesis.ARCHITECTURE_DIAGRAM)).isEqualTo("graph TD\n    system[\"System\"]\n");
        assertThat(payload.list(DesignSynthesis.DESIGN_PRINCIPLES)).isNotEmpty();
    }

    @Test
    @DisplayName("Should find endpoints in Spring, FastAPI and Express sources but not in tests")
    void endpointPatterns() {
        List<CodeFile> files = List.of(
                new CodeFile("app/api.py", "python", "@app.get(\"/items\")\ndef items(): ...\n", 2, 1),
                new CodeFile("web/server.js", "javascript", "router.delete('/items/:id', handler);\n", 1, 1),
                new CodeFile("svc/ItemController.java", "java", "@PutMapping(value = \"/items\")\n", 1, 1),
                new CodeFile("svc/src/test/ItemControllerTest.java", "java", "@GetMapping(\"/ignored\")\n", 1, 1));

        assertThat(DesignArchitectUnit.endpoints(files))
                .extracting(e -> e.get("method") + " " + e.get("path"))
                .containsExactly("GET /items", "DELETE /items/:id", "PUT /items");
    }
}
