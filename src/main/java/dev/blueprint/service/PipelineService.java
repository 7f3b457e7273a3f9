package dev.blueprint.service;

import com.fasterxml.jackson.databind.JsonNode;
import dev.blueprint.config.PipelineProperties;
import dev.blueprint.domain.enums.OutputFormat;
import dev.blueprint.domain.valueobject.PipelineOutcome;
import dev.blueprint.domain.valueobject.PipelineRequest;
import dev.blueprint.dto.request.PipelineRunRequest;
import dev.blueprint.dto.response.PipelineStatusResponse;
import dev.blueprint.infrastructure.storage.ArtifactStore;
import dev.blueprint.pipeline.PipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Entry point shared by the REST API and the command line: applies defaults, runs the
 * pipeline and persists the outcome. A persistence failure adds a warning; it never
 * changes the run status.
 */
@Service
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    private final PipelineOrchestrator orchestrator;
    private final ArtifactStore store;
    private final PipelineProperties properties;

    public PipelineService(PipelineOrchestrator orchestrator, ArtifactStore store, PipelineProperties properties) {
        this.orchestrator = orchestrator;
        this.store = store;
        this.properties = properties;
    }

    public PipelineStatusResponse run(PipelineRunRequest runRequest) {
        OutputFormat format;
        try {
            format = OutputFormat.parse(runRequest.outputFormat());
        } catch (IllegalArgumentException e) {
            log.warn("Rejected run request: {}", e.getMessage());
            return reject(runRequest.executionId(), List.of(e.getMessage()));
        }

        PipelineRequest request = new PipelineRequest(
                runRequest.repositoryPath(),
                runRequest.executionId(),
                runRequest.includePatterns(),
                runRequest.excludePatterns(),
                format,
                runRequest.includeDiagrams() == null || runRequest.includeDiagrams(),
                runRequest.maxParallelUnits() != null ? runRequest.maxParallelUnits() : properties.maxParallelUnits());

        PipelineOutcome outcome = orchestrator.run(request);
        if (!PipelineOrchestrator.isSafeExecutionId(outcome.executionId())) {
            return PipelineStatusResponse.from(outcome, null);
        }
        try {
            Path saved = store.save(outcome, format);
            return PipelineStatusResponse.from(outcome, saved.toString());
        } catch (IOException | RuntimeException e) {
            log.error("Could not persist run {}: {}", outcome.executionId(), e.getMessage());
            return PipelineStatusResponse.from(
                    outcome.withWarning("Run could not be persisted: " + e.getMessage()), null);
        }
    }

    /**
     * Failed status for input that never reached the pipeline. Nothing is persisted.
     */
    public PipelineStatusResponse reject(String executionId, List<String> errors) {
        return PipelineStatusResponse.from(orchestrator.reject(executionId, errors), null);
    }

    public Optional<JsonNode> findRun(String executionId) {
        return store.find(executionId);
    }

    public Optional<ArtifactStore.StoredDocument> findDocument(String executionId) {
        return store.findDocument(executionId);
    }
}
