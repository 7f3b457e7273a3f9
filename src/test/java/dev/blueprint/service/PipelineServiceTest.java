package dev.blueprint.service;

import dev.blueprint.config.PipelineProperties;
import dev.blueprint.domain.enums.OutputFormat;
import dev.blueprint.domain.enums.PipelineState;
import dev.blueprint.domain.enums.RunStatus;
import dev.blueprint.domain.valueobject.PipelineOutcome;
import dev.blueprint.domain.valueobject.PipelineRequest;
import dev.blueprint.dto.request.PipelineRunRequest;
import dev.blueprint.dto.response.PipelineStatusResponse;
import dev.blueprint.infrastructure.storage.ArtifactStore;
import dev.blueprint.pipeline.PipelineOrchestrator;
import dev.blueprint.support.Artifacts;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class PipelineServiceTest {

    private PipelineOrchestrator orchestrator;
    private ArtifactStore store;
    private PipelineService service;

    @BeforeEach
    void setUp() {
        orchestrator = mock(PipelineOrchestrator.class);
        store = mock(ArtifactStore.class);
        PipelineProperties properties = new PipelineProperties(null, null, null, 3, null, null, null, null, 0);
        service = new PipelineService(orchestrator, store, properties);
    }

    private static PipelineOutcome completed(String id) {
        return new PipelineOutcome(RunStatus.COMPLETED, id, 0.5, Instant.now(), Instant.now(),
                PipelineState.COMPLETED, List.of(), List.of(), Artifacts.sample(id));
    }

    private static PipelineRunRequest request(String id, String format) {
        return new PipelineRunRequest("/repo", id, null, null, format, null, null);
    }

    @Test
    @DisplayName("Should apply defaults before running")
    void appliesDefaults() throws IOException {
        when(orchestrator.run(any())).thenReturn(completed("exec-1"));
        when(store.save(any(), any())).thenReturn(Path.of("/out/exec-1.json"));

        PipelineStatusResponse response = service.run(request("exec-1", null));

        ArgumentCaptor<PipelineRequest> captor = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(orchestrator).run(captor.capture());
        assertThat(captor.getValue().includeDiagrams()).isTrue();
        assertThat(captor.getValue().maxParallelUnits()).isEqualTo(3);
        assertThat(captor.getValue().outputFormat()).isEqualTo(OutputFormat.MARKDOWN);
        verify(store).save(any(), eq(OutputFormat.MARKDOWN));

        assertThat(response.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(response.outputPath()).isEqualTo(Path.of("/out/exec-1.json").toString());
        assertThat(response.confidenceScore()).isEqualTo(0.72);
        assertThat(response.units()).containsKeys("analysis", "synthesis", "validation");
        assertThat(response.units().get("analysis")).containsEntry("repository_analyzer", "completed");
    }

    @Test
    @DisplayName("Should pass explicit values through")
    void keepsExplicitValues() throws IOException {
        when(orchestrator.run(any())).thenReturn(completed("exec-2"));
        when(store.save(any(), any())).thenReturn(Path.of("/out/exec-2.json"));

        service.run(new PipelineRunRequest("/repo", "exec-2", List.of("**/*.py"), List.of("build/**"),
                "html", false, 7));

        ArgumentCaptor<PipelineRequest> captor = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(orchestrator).run(captor.capture());
        assertThat(captor.getValue().includeDiagrams()).isFalse();
        assertThat(captor.getValue().maxParallelUnits()).isEqualTo(7);
        assertThat(captor.getValue().includePatterns()).containsExactly("**/*.py");
        verify(store).save(any(), eq(OutputFormat.HTML));
    }

    @Test
    @DisplayName("Should hand a null glob entry to the pipeline for validation instead of throwing")
    void nullGlobEntry() {
        when(orchestrator.run(any())).thenReturn(new PipelineOutcome(RunStatus.FAILED, "exec-5", 0.0,
                Instant.now(), Instant.now(), PipelineState.FAILED,
                List.of("Glob pattern must not be null or blank"), List.of(), null));

        PipelineStatusResponse response = service.run(new PipelineRunRequest("/repo", "exec-5",
                Arrays.asList("**/*.java", null), null, null, null, null));

        ArgumentCaptor<PipelineRequest> captor = ArgumentCaptor.forClass(PipelineRequest.class);
        verify(orchestrator).run(captor.capture());
        assertThat(captor.getValue().includePatterns()).containsExactly("**/*.java", null);
        assertThat(response.status()).isEqualTo(RunStatus.FAILED);
        assertThat(response.errors()).containsExactly("Glob pattern must not be null or blank");
    }

    @Test
    @DisplayName("Should reject an unknown output format without running")
    void rejectsUnknownFormat() {
        when(orchestrator.reject(eq("exec-3"), anyList())).thenAnswer(inv -> new PipelineOutcome(
                RunStatus.FAILED, "exec-3", 0.0, Instant.now(), Instant.now(), PipelineState.FAILED,
                inv.getArgument(1), List.of(), null));

        PipelineStatusResponse response = service.run(request("exec-3", "pdf"));

        assertThat(response.status()).isEqualTo(RunStatus.FAILED);
        assertThat(response.errors()).singleElement().asString().startsWith("Unsupported output format: pdf");
        verify(orchestrator, never()).run(any());
    }

    @Test
    @DisplayName("Should keep the status and add a warning when persisting fails")
    void persistenceFailureIsAWarning() throws IOException {
        when(orchestrator.run(any())).thenReturn(completed("exec-4"));
        when(store.save(any(), any())).thenThrow(new IOException("disk full"));

        PipelineStatusResponse response = service.run(request("exec-4", "json"));

        assertThat(response.status()).isEqualTo(RunStatus.COMPLETED);
        assertThat(response.outputPath()).isNull();
        assertThat(response.warnings()).contains("Run could not be persisted: disk full");
    }

    @Test
    @DisplayName("Should not persist a run whose id is unsafe for the filesystem")
    void skipsUnsafeIds() throws IOException {
        when(orchestrator.run(any())).thenReturn(new PipelineOutcome(RunStatus.FAILED, "../x", 0.0,
                Instant.now(), Instant.now(), PipelineState.FAILED, List.of("Invalid execution id: ../x"),
                List.of(), null));

        PipelineStatusResponse response = service.run(request("../x", null));

        assertThat(response.status()).isEqualTo(RunStatus.FAILED);
        assertThat(response.outputPath()).isNull();
        verify(store, never()).save(any(), any());
    }
}
