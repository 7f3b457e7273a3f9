package dev.blueprint.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.blueprint.config.AiProperties;
import dev.blueprint.config.PipelineProperties;
import dev.blueprint.config.UnitProperties;
import dev.blueprint.domain.enums.RunStatus;
import dev.blueprint.domain.valueobject.FinalArtifact;
import dev.blueprint.domain.valueobject.PipelineOutcome;
import dev.blueprint.infrastructure.ai.LlmNarrator;
import dev.blueprint.infrastructure.repository.RepositoryScanner;
import dev.blueprint.support.SampleRepository;
import dev.blueprint.unit.PipelineUnit;
import dev.blueprint.unit.UnitRegistry;
import dev.blueprint.unit.analysis.DevOpsDesignerUnit;
import dev.blueprint.unit.analysis.DocumentationSynthesizerUnit;
import dev.blueprint.unit.analysis.RepositoryAnalyzerUnit;
import dev.blueprint.unit.analysis.TestAnalystUnit;
import dev.blueprint.unit.synthesis.DesignArchitectUnit;
import dev.blueprint.unit.validation.QaValidatorUnit;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.ai.chat.model.ChatModel;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the full pipeline with the real units twice over the same repository.
 */
class PipelineDeterminismTest {

    private static final List<String> RESULT_SETS = List.of("analysis_results", "synthesis_results", "validation_results");

    @TempDir
    Path workspace;

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private ExecutorService executorService;
    private PipelineOrchestrator orchestrator;
    private Path repository;

    @BeforeEach
    void setUp() throws IOException {
        repository = SampleRepository.create(workspace.resolve("shop"));
        executorService = Executors.newCachedThreadPool();

        PipelineProperties properties = PipelineProperties.defaults();
        RepositoryScanner scanner = new RepositoryScanner(properties);
        LlmNarrator narrator = new LlmNarrator(new AiProperties(false, null, 0.1, 2048), (ChatModel) null);
        UnitRegistry registry = new UnitRegistry();
        List<PipelineUnit> units = List.of(
                new RepositoryAnalyzerUnit(scanner),
                new DocumentationSynthesizerUnit(scanner),
                new TestAnalystUnit(scanner),
                new DevOpsDesignerUnit(scanner),
                new DesignArchitectUnit(scanner, narrator),
                new QaValidatorUnit());
        units.forEach(unit -> registry.register(unit.getName(), () -> unit));

        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        PhaseExecutor executor = new PhaseExecutor(registry, UnitProperties.defaults(), executorService, meterRegistry);
        orchestrator = new PipelineOrchestrator(registry, executor, new ArtifactAggregator(), properties, meterRegistry);
    }

    @AfterEach
    void tearDown() {
        executorService.shutdownNow();
    }

    @Test
    @DisplayName("Should produce the same artifact apart from ids and timing for identical inputs")
    void identicalArtifacts() {
        PipelineOutcome first = orchestrator.run(SampleRepository.request(repository, true));
        PipelineOutcome second = orchestrator.run(SampleRepository.request(repository, true));

        assertThat(first.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(second.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(first.warnings()).isEqualTo(second.warnings());

        JsonNode firstArtifact = withoutTiming(first.artifact());
        JsonNode secondArtifact = withoutTiming(second.artifact());

        assertThat(firstArtifact.at("/analysis_results/results").size()).isEqualTo(4);
        assertThat(firstArtifact.get("system_overview").asText()).isNotBlank();
        assertThat(secondArtifact).isEqualTo(firstArtifact);
    }

    private JsonNode withoutTiming(FinalArtifact artifact) {
        ObjectNode node = objectMapper.valueToTree(artifact);
        node.remove(List.of("document_id", "generated_at"));
        for (String resultSet : RESULT_SETS) {
            node.path(resultSet).path("results").forEach(result ->
                    ((ObjectNode) result).remove(List.of("timestamp", "execution_time_seconds")));
        }
        return node;
    }
}
