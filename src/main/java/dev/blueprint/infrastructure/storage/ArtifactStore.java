package dev.blueprint.infrastructure.storage;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.blueprint.config.PipelineProperties;
import dev.blueprint.domain.enums.OutputFormat;
import dev.blueprint.domain.valueobject.PipelineOutcome;
import dev.blueprint.infrastructure.render.DocumentRenderer;
import dev.blueprint.pipeline.PipelineOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * Filesystem store for finished runs.
 *
 * <pre>
 *  &lt;output-directory&gt;/&lt;executionId&gt;.json               run record: status, artifact, phase results
 *  &lt;output-directory&gt;/&lt;executionId&gt;.design.&lt;md|json|html&gt; rendered document (completed runs only)
 * </pre>
 *
 * Writes go to a temp file first and are moved into place.
 */
@Component
public class ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(ArtifactStore.class);

    private final Path outputDirectory;
    private final ObjectMapper objectMapper;
    private final DocumentRenderer renderer;

    public ArtifactStore(PipelineProperties properties, ObjectMapper objectMapper, DocumentRenderer renderer) {
        this.outputDirectory = Path.of(properties.outputDirectory()).toAbsolutePath().normalize();
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.renderer = renderer;
    }

    public Path save(PipelineOutcome outcome, OutputFormat format) throws IOException {
        String id = outcome.executionId();
        if (!PipelineOrchestrator.isSafeExecutionId(id))
            throw new IllegalArgumentException("Execution id is not safe for the filesystem: " + id);

        Files.createDirectories(outputDirectory);
        Path record = outputDirectory.resolve(id + ".json");
        write(record, objectMapper.writeValueAsString(outcome));

        if (outcome.artifact() != null) {
            write(documentPath(id, format), renderer.render(outcome.artifact(), format));
        }
        log.info("Saved run {} to {}", id, record);
        return record;
    }

    public Optional<JsonNode> find(String executionId) {
        if (!PipelineOrchestrator.isSafeExecutionId(executionId)) return Optional.empty();
        Path record = outputDirectory.resolve(executionId + ".json");
        if (!Files.isRegularFile(record)) return Optional.empty();
        try {
            return Optional.of(objectMapper.readTree(record.toFile()));
        } catch (IOException e) {
            log.warn("Run record {} is unreadable: {}", record, e.getMessage());
            return Optional.empty();
        }
    }

    public Optional<StoredDocument> findDocument(String executionId) {
        if (!PipelineOrchestrator.isSafeExecutionId(executionId)) return Optional.empty();
        for (OutputFormat format : OutputFormat.values()) {
            Path path = documentPath(executionId, format);
            if (!Files.isRegularFile(path)) continue;
            try {
                return Optional.of(new StoredDocument(format, Files.readString(path, StandardCharsets.UTF_8)));
            } catch (IOException e) {
                log.warn("Document {} is unreadable: {}", path, e.getMessage());
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    public Path outputDirectory() {
        return outputDirectory;
    }

    private Path documentPath(String executionId, OutputFormat format) {
        return outputDirectory.resolve(executionId + ".design." + format.extension());
    }

    private static void write(Path target, String content) throws IOException {
        Path temp = Files.createTempFile(target.getParent(), target.getFileName().toString(), ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }
    }

    public record StoredDocument(OutputFormat format, String content) {}
}
