package dev.blueprint.unit.validation;

import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.enums.UnitStatus;
import dev.blueprint.domain.payload.PayloadKeys.DesignSynthesis;
import dev.blueprint.domain.payload.PayloadKeys.DevOpsDesign;
import dev.blueprint.domain.payload.PayloadKeys.DocumentationSynthesis;
import dev.blueprint.domain.payload.PayloadKeys.RepositoryAnalysis;
import dev.blueprint.domain.payload.PayloadKeys.TestAnalysis;
import dev.blueprint.domain.payload.PayloadKeys.Validation;
import dev.blueprint.domain.payload.PayloadView;
import dev.blueprint.domain.valueobject.PhaseResultSet;
import dev.blueprint.domain.valueobject.UnitInput;
import dev.blueprint.domain.valueobject.UnitResult;
import dev.blueprint.unit.AbstractPipelineUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Phase 3: cross-checks analysis and design, asks clarification questions and scores
 * confidence. Missing or failed upstream entries count as absent data, never as errors.
 *
 * <p>Scores, all in [0, 1]:
 * <ul>
 *   <li>{@code analysis_coverage}: completed analysis units over scheduled ones</li>
 *   <li>{@code design_completeness}: non-empty design sections over expected ones</li>
 *   <li>{@code documentation_accuracy}: copied from the documentation unit, when it completed</li>
 * </ul>
 */
@Component
public class QaValidatorUnit extends AbstractPipelineUnit {

    private static final Logger log = LoggerFactory.getLogger(QaValidatorUnit.class);

    static final int MAX_QUESTIONS = 20;

    @Override
    public String getName() {
        return Validation.UNIT;
    }

    @Override
    public Phase getPhase() {
        return Phase.VALIDATION;
    }

    @Override
    protected Map<String, Object> analyze(UnitInput input) {
        PhaseResultSet analysis = input.upstream(Phase.ANALYSIS);
        PhaseResultSet synthesis = input.upstream(Phase.SYNTHESIS);
        PayloadView repository = PayloadView.of(analysis.get(RepositoryAnalysis.UNIT));
        PayloadView documentation = PayloadView.of(analysis.get(DocumentationSynthesis.UNIT));
        PayloadView tests = PayloadView.of(analysis.get(TestAnalysis.UNIT));
        PayloadView devops = PayloadView.of(analysis.get(DevOpsDesign.UNIT));
        PayloadView design = PayloadView.of(synthesis.results().values().stream().findFirst());

        Questions questions = new Questions();
        for (UnitResult result : analysis.results().values()) {
            if (!result.isCompleted()) {
                questions.add("coverage", "high", "The " + result.unitName() + " analysis did not complete ("
                        + result.errorMessage() + "). Can this area be reviewed manually?");
            }
        }
        if (!design.isPresent()) {
            questions.add("design", "high", "Design synthesis did not complete. Which architectural views matter most for this system?");
        }
        documentationQuestions(documentation, questions);
        testingQuestions(tests, questions);
        devopsQuestions(devops, questions);
        designQuestions(design, repository, questions);

        Map<String, Object> scores = new LinkedHashMap<>();
        scores.put("analysis_coverage", analysis.isEmpty()
                ? 0.0 : round((double) analysis.count(UnitStatus.COMPLETED) / analysis.size()));
        scores.put("design_completeness", designCompleteness(design, input.request().includeDiagrams()));
        documentation.number(DocumentationSynthesis.ACCURACY_SCORE)
                .ifPresent(score -> scores.put("documentation_accuracy", round(Math.max(0.0, Math.min(1.0, score)))));

        log.info("QaValidator generated {} questions", questions.size());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(Validation.CLARIFICATION_QUESTIONS, questions.asList());
        payload.put(Validation.VALIDATION_POINTS, validationPoints(analysis, synthesis));
        payload.put(Validation.CONFIDENCE_SCORES, scores);
        payload.put(Validation.PRIORITY_AREAS, questions.highPriorityCategories());
        payload.put(Validation.CONSISTENCY_CHECK_RESULTS, consistency(repository, design, tests));
        return payload;
    }

    /**
     * Share of the expected design sections that are non-empty. The architecture diagram is
     * expected only when diagrams were requested.
     */
    static double designCompleteness(PayloadView design, boolean diagramsRequested) {
        if (!design.isPresent()) return 0.0;
        int expected = 0;
        int present = 0;
        expected++;
        if (!design.text(DesignSynthesis.SYSTEM_OVERVIEW).isBlank()) present++;
        if (diagramsRequested) {
            expected++;
            if (!design.text(DesignSynthesis.ARCHITECTURE_DIAGRAM).isBlank()) present++;
        }
        expected++;
        if (!design.list(DesignSynthesis.COMPONENT_SPECIFICATIONS).isEmpty()) present++;
        expected++;
        if (hasEndpoints(design)) present++;
        expected++;
        if (!design.list(DesignSynthesis.DATA_FLOW_DIAGRAMS).isEmpty()) present++;
        expected++;
        if (!design.list(DesignSynthesis.DESIGN_PRINCIPLES).isEmpty()) present++;
        return round((double) present / expected);
    }

    private static boolean hasEndpoints(PayloadView design) {
        Object total = design.map(DesignSynthesis.API_DOCUMENTATION).get("total_endpoints");
        return total instanceof Number n && n.intValue() > 0;
    }

    private static void documentationQuestions(PayloadView documentation, Questions questions) {
        if (!documentation.isPresent()) return;
        for (Object discrepancy : documentation.list(DocumentationSynthesis.MAJOR_DISCREPANCIES)) {
            if (!(discrepancy instanceof Map<?, ?> d)) continue;
            if ("missing_readme".equals(d.get("type"))) {
                questions.add("documentation", "high", "What is the purpose of this repository and who are its users?");
            }
        }
        for (Object module : documentation.list(DocumentationSynthesis.UNDOCUMENTED_FEATURES)) {
            questions.add("documentation", "medium", "What does the undocumented module '" + module + "' do, and is it still in use?");
        }
    }

    private static void testingQuestions(PayloadView tests, Questions questions) {
        if (!tests.isPresent()) return;
        for (Object gap : tests.list(TestAnalysis.TESTING_GAPS)) {
            if (!(gap instanceof Map<?, ?> g)) continue;
            Object module = g.get("module");
            questions.add("testing", g.get("priority") != null ? String.valueOf(g.get("priority")) : "medium",
                    "(all)".equals(module)
                            ? "How is correctness verified today without automated tests?"
                            : "How is module '" + module + "' tested, and which behaviors are critical?");
        }
    }

    private static void devopsQuestions(PayloadView devops, Questions questions) {
        if (!devops.isPresent()) return;
        Map<String, Object> infrastructure = devops.map(DevOpsDesign.INFRASTRUCTURE_DESIGN);
        if ("none".equals(infrastructure.get("containerization"))) {
            questions.add("deployment", "medium", "How is the system deployed and configured in production?");
        }
        if ("none".equals(infrastructure.get("ci_cd"))) {
            questions.add("deployment", "low", "Which build and release process produces deployable artifacts?");
        }
    }

    private static void designQuestions(PayloadView design, PayloadView repository, Questions questions) {
        if (!design.isPresent()) return;
        for (Object component : design.list(DesignSynthesis.COMPONENT_SPECIFICATIONS)) {
            if (component instanceof Map<?, ?> c && c.get("responsibilities") instanceof List<?> r && r.isEmpty()
                    && !"(root)".equals(c.get("name"))) {
                questions.add("design", "low", "What responsibility does module '" + c.get("name") + "' own?");
            }
        }
        boolean controllers = repository.list(RepositoryAnalysis.DETECTED_PATTERNS).stream()
                .anyMatch(p -> p instanceof Map<?, ?> m && "controller".equals(m.get("name")));
        if (controllers && !hasEndpoints(design)) {
            questions.add("api", "medium", "Controller-style files exist but no HTTP endpoints were recognized. How is the API exposed?");
        }
    }

    private static List<String> validationPoints(PhaseResultSet analysis, PhaseResultSet synthesis) {
        List<String> points = new ArrayList<>();
        for (PhaseResultSet phase : List.of(analysis, synthesis)) {
            for (UnitResult result : phase.results().values()) {
                points.add(phase.phase().wireName() + "/" + result.unitName() + ": " + result.status().wireName());
            }
        }
        return points;
    }

    private static Map<String, Object> consistency(PayloadView repository, PayloadView design, PayloadView tests) {
        Map<String, Object> results = new LinkedHashMap<>();
        List<String> issues = new ArrayList<>();
        Set<String> modules = repository.map(RepositoryAnalysis.FILE_STRUCTURE).keySet();

        if (repository.isPresent() && design.isPresent()) {
            int components = design.list(DesignSynthesis.COMPONENT_SPECIFICATIONS).size();
            boolean matches = components == modules.size();
            results.put("components_match_modules", matches);
            if (!matches) issues.add("Design lists " + components + " components for " + modules.size() + " modules");
        }
        if (repository.isPresent() && tests.isPresent()) {
            Set<String> unknown = new LinkedHashSet<>();
            for (Object gap : tests.list(TestAnalysis.TESTING_GAPS)) {
                if (gap instanceof Map<?, ?> g && g.get("module") != null && !"(all)".equals(g.get("module"))
                        && !modules.contains(String.valueOf(g.get("module")))) {
                    unknown.add(String.valueOf(g.get("module")));
                }
            }
            results.put("test_gaps_reference_known_modules", unknown.isEmpty());
            unknown.forEach(m -> issues.add("Testing gap refers to unknown module " + m));
        }
        results.put("issues", issues);
        return results;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }

    /**
     * Ordered, de-duplicated and capped question list.
     */
    private static final class Questions {
        private final Map<String, Map<String, Object>> byText = new LinkedHashMap<>();

        void add(String category, String priority, String question) {
            if (byText.size() >= MAX_QUESTIONS || byText.containsKey(question)) return;
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("id", "Q" + (byText.size() + 1));
            entry.put("category", category);
            entry.put("question", question);
            entry.put("priority", priority);
            byText.put(question, entry);
        }

        int size() {
            return byText.size();
        }

        List<Object> asList() {
            return new ArrayList<>(byText.values());
        }

        List<String> highPriorityCategories() {
            return byText.values().stream()
                    .filter(q -> "high".equals(q.get("priority")))
                    .map(q -> String.valueOf(q.get("category")))
                    .distinct()
                    .toList();
        }
    }
}
