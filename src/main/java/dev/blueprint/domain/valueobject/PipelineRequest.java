package dev.blueprint.domain.valueobject;

import dev.blueprint.domain.enums.OutputFormat;

import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;

/**
 * Original pipeline input. Handed unchanged to every unit of every phase.
 */
public record PipelineRequest(
        String repositoryPath,
        String executionId,
        List<String> includePatterns,
        List<String> excludePatterns,
        OutputFormat outputFormat,
        boolean includeDiagrams,
        int maxParallelUnits
) {
    private static final DateTimeFormatter EXECUTION_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss_SSS");

    public PipelineRequest {
        includePatterns = copy(includePatterns);
        excludePatterns = copy(excludePatterns);
        if (outputFormat == null) outputFormat = OutputFormat.MARKDOWN;
    }

    // Null entries are kept so validation can report them.
    private static List<String> copy(List<String> patterns) {
        return patterns == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(patterns));
    }

    /**
     * {@code exec_<yyyyMMdd_HHmmss_SSS>_<8 hex>}: local time plus a random suffix, so runs
     * started within the same millisecond still get distinct ids.
     */
    public static String generateExecutionId() {
        return "exec_" + LocalDateTime.now().format(EXECUTION_ID_FORMAT)
                + "_" + UUID.randomUUID().toString().substring(0, 8);
    }

    public PipelineRequest withExecutionId(String id) {
        return new PipelineRequest(repositoryPath, id, includePatterns, excludePatterns,
                outputFormat, includeDiagrams, maxParallelUnits);
    }

    public Path repositoryRoot() {
        return Path.of(repositoryPath).toAbsolutePath().normalize();
    }
}
