package dev.blueprint.config;

import dev.blueprint.domain.payload.PayloadKeys;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.List;

/**
 * Pipeline layout and run defaults. {@code analysisUnits} run in parallel in phase 1;
 * the synthesis and validation units each own a sequential phase.
 */
@ConfigurationProperties(prefix = "blueprint.pipeline")
public record PipelineProperties(List<String> analysisUnits, String synthesisUnit, String validationUnit,
                                 int maxParallelUnits, Duration phaseTimeout, String outputDirectory,
                                 List<String> includePatterns, List<String> excludePatterns,
                                 long maxFileSizeKb) {
    public PipelineProperties {
        if (analysisUnits == null) analysisUnits = List.of(
                PayloadKeys.RepositoryAnalysis.UNIT, PayloadKeys.DocumentationSynthesis.UNIT,
                PayloadKeys.TestAnalysis.UNIT, PayloadKeys.DevOpsDesign.UNIT);
        if (synthesisUnit == null || synthesisUnit.isBlank()) synthesisUnit = PayloadKeys.DesignSynthesis.UNIT;
        if (validationUnit == null || validationUnit.isBlank()) validationUnit = PayloadKeys.Validation.UNIT;
        if (maxParallelUnits <= 0) maxParallelUnits = 4;
        if (phaseTimeout == null) phaseTimeout = Duration.ofHours(1);
        if (outputDirectory == null || outputDirectory.isBlank()) outputDirectory = "./data/outputs";
        if (includePatterns == null) includePatterns = List.of(
                "**/*.py", "**/*.java", "**/*.kt", "**/*.js", "**/*.jsx", "**/*.ts", "**/*.tsx", "**/*.go",
                "**/*.rs", "**/*.md", "**/*.json", "**/*.yaml", "**/*.yml", "**/*.xml", "**/*.properties",
                "**/*.gradle", "**/*.kts", "**/*.toml", "requirements.txt", "go.mod", "Dockerfile", "Jenkinsfile");
        if (excludePatterns == null) excludePatterns = List.of(
                "**/node_modules/**", "**/__pycache__/**", "**/.git/**", "**/venv/**", "**/env/**",
                "**/target/**", "**/build/**");
        if (maxFileSizeKb <= 0) maxFileSizeKb = 10 * 1024;
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(null, null, null, 0, null, null, null, null, 0);
    }
}
