package dev.blueprint.pipeline;

import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.enums.UnitStatus;
import dev.blueprint.domain.payload.PayloadKeys.DesignSynthesis;
import dev.blueprint.domain.payload.PayloadKeys.DevOpsDesign;
import dev.blueprint.domain.payload.PayloadKeys.DocumentationSynthesis;
import dev.blueprint.domain.payload.PayloadKeys.RepositoryAnalysis;
import dev.blueprint.domain.payload.PayloadKeys.TestAnalysis;
import dev.blueprint.domain.payload.PayloadKeys.Validation;
import dev.blueprint.domain.payload.PayloadView;
import dev.blueprint.domain.valueobject.ExecutionContext;
import dev.blueprint.domain.valueobject.FinalArtifact;
import dev.blueprint.domain.valueobject.PhaseResultSet;
import dev.blueprint.domain.valueobject.UnitResult;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Composes the final artifact from whatever the three phases produced.
 *
 * <p>Every field is read from its owning unit only when that unit completed; anything else
 * falls back to an empty default. Nothing here throws on missing or failed input.
 */
@Component
public class ArtifactAggregator {

    /** Confidence used when validation produced no scores. */
    public static final double NEUTRAL_CONFIDENCE = 0.5;

    private static final DateTimeFormatter DOCUMENT_ID_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    public FinalArtifact aggregate(ExecutionContext context, PhaseResultSet analysis,
                                   PhaseResultSet synthesis, PhaseResultSet validation) {
        analysis = analysis != null ? analysis : PhaseResultSet.empty(Phase.ANALYSIS);
        synthesis = synthesis != null ? synthesis : PhaseResultSet.empty(Phase.SYNTHESIS);
        validation = validation != null ? validation : PhaseResultSet.empty(Phase.VALIDATION);

        PayloadView repository = PayloadView.of(analysis.get(RepositoryAnalysis.UNIT));
        PayloadView documentation = PayloadView.of(analysis.get(DocumentationSynthesis.UNIT));
        PayloadView tests = PayloadView.of(analysis.get(TestAnalysis.UNIT));
        PayloadView devops = PayloadView.of(analysis.get(DevOpsDesign.UNIT));
        PayloadView design = PayloadView.of(sole(synthesis));
        PayloadView qa = PayloadView.of(sole(validation));

        double confidence = confidence(qa);

        return new FinalArtifact(
                documentId(context.executionId()),
                Instant.now(),
                context.executionId(),
                executiveSummary(analysis, repository, documentation, design, qa, confidence),
                design.text(DesignSynthesis.SYSTEM_OVERVIEW),
                design.text(DesignSynthesis.ARCHITECTURE_DIAGRAM),
                design.list(DesignSynthesis.COMPONENT_SPECIFICATIONS),
                design.map(DesignSynthesis.API_DOCUMENTATION),
                design.list(DesignSynthesis.DATA_FLOW_DIAGRAMS),
                repository.map(RepositoryAnalysis.CODE_QUALITY_METRICS),
                tests.map(TestAnalysis.PROPOSED_TEST_STRATEGY),
                devops.text(DevOpsDesign.DEPLOYMENT_ARCHITECTURE),
                devops.list(DevOpsDesign.OPERATIONAL_REQUIREMENTS),
                documentation.list(DocumentationSynthesis.MAJOR_DISCREPANCIES),
                qa.list(Validation.CLARIFICATION_QUESTIONS),
                confidence,
                warnings(context, analysis, synthesis, validation),
                analysis,
                synthesis,
                validation);
    }

    /**
     * Mean of the validation unit's confidence scores, each clamped to [0, 1].
     * {@value #NEUTRAL_CONFIDENCE} when there is nothing to average.
     */
    static double confidence(PayloadView validation) {
        Collection<Double> scores = validation.numbers(Validation.CONFIDENCE_SCORES).values();
        if (scores.isEmpty()) return NEUTRAL_CONFIDENCE;
        double mean = scores.stream().mapToDouble(ArtifactAggregator::clamp).average().orElse(NEUTRAL_CONFIDENCE);
        return clamp(mean);
    }

    static String documentId(String executionId) {
        return "design_doc_" + executionId + "_" + LocalDateTime.now().format(DOCUMENT_ID_FORMAT);
    }

    private static String executiveSummary(PhaseResultSet analysis, PayloadView repository,
                                           PayloadView documentation, PayloadView design,
                                           PayloadView qa, double confidence) {
        List<String> parts = new ArrayList<>();
        parts.add(String.format(Locale.ROOT, "Analysis phase: %d of %d units completed.",
                analysis.count(UnitStatus.COMPLETED), analysis.size()));

        if (repository.isPresent()) {
            Object files = repository.map(RepositoryAnalysis.REPO_METADATA).get("total_files");
            parts.add(files instanceof Number n
                    ? String.format(Locale.ROOT, "Repository analysis completed successfully (%d files).", n.longValue())
                    : "Repository analysis completed successfully.");
        }
        documentation.number(DocumentationSynthesis.ACCURACY_SCORE).ifPresent(score ->
                parts.add(String.format(Locale.ROOT, "Documentation accuracy score: %.2f.", score)));

        parts.add(design.isPresent()
                ? "Comprehensive design documentation generated."
                : "Design synthesis did not complete; design sections are empty.");

        if (qa.isPresent()) {
            parts.add(String.format(Locale.ROOT, "Generated %d clarification questions for validation.",
                    qa.list(Validation.CLARIFICATION_QUESTIONS).size()));
        } else {
            parts.add("Validation did not complete.");
        }
        parts.add(String.format(Locale.ROOT, "Overall confidence: %.2f.", confidence));
        return String.join(" ", parts);
    }

    private static List<String> warnings(ExecutionContext context, PhaseResultSet... phases) {
        List<String> warnings = new ArrayList<>(context.warnings());
        for (PhaseResultSet phase : phases) {
            for (UnitResult result : phase.results().values()) {
                if (result.isCompleted()) continue;
                warnings.add(String.format(Locale.ROOT, "%s unit %s %s: %s",
                        phase.phase().wireName(), result.unitName(), result.status().wireName(),
                        result.errorMessage() != null ? result.errorMessage() : "no details"));
            }
        }
        return warnings;
    }

    /**
     * Synthesis and validation phases hold a single unit, whatever its configured name.
     */
    private static Optional<UnitResult> sole(PhaseResultSet phase) {
        return phase.results().values().stream().findFirst();
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
