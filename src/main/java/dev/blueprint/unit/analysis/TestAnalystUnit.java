package dev.blueprint.unit.analysis;

import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.payload.PayloadKeys.TestAnalysis;
import dev.blueprint.domain.valueobject.CodeFile;
import dev.blueprint.domain.valueobject.UnitInput;
import dev.blueprint.infrastructure.repository.RepositoryScanner;
import dev.blueprint.unit.AbstractPipelineUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeSet;

/**
 * Test inventory: test versus production files per module, detected frameworks,
 * untested modules and a proposed strategy.
 */
@Component
public class TestAnalystUnit extends AbstractPipelineUnit {

    private static final Logger log = LoggerFactory.getLogger(TestAnalystUnit.class);

    /** Framework name to the content markers that reveal it. */
    private static final Map<String, List<String>> FRAMEWORK_MARKERS = new LinkedHashMap<>();

    static {
        FRAMEWORK_MARKERS.put("junit", List.of("org.junit"));
        FRAMEWORK_MARKERS.put("testng", List.of("org.testng"));
        FRAMEWORK_MARKERS.put("mockito", List.of("org.mockito"));
        FRAMEWORK_MARKERS.put("assertj", List.of("org.assertj"));
        FRAMEWORK_MARKERS.put("pytest", List.of("import pytest", "@pytest."));
        FRAMEWORK_MARKERS.put("unittest", List.of("import unittest", "from unittest"));
        FRAMEWORK_MARKERS.put("jest", List.of("from '@testing-library", "jest.", "expect("));
        FRAMEWORK_MARKERS.put("go-testing", List.of("\"testing\""));
    }

    private final RepositoryScanner scanner;

    public TestAnalystUnit(RepositoryScanner scanner) {
        this.scanner = scanner;
    }

    @Override
    public String getName() {
        return TestAnalysis.UNIT;
    }

    @Override
    public Phase getPhase() {
        return Phase.ANALYSIS;
    }

    @Override
    protected Map<String, Object> analyze(UnitInput input) throws IOException {
        List<CodeFile> sources = scanner.scan(input.request()).stream().filter(CodeFile::isSource).toList();
        List<CodeFile> tests = sources.stream().filter(CodeFile::isTestFile).toList();
        List<CodeFile> production = sources.stream().filter(f -> !f.isTestFile()).toList();

        TreeSet<String> productionModules = new TreeSet<>();
        production.forEach(f -> productionModules.add(f.topLevelModule()));
        TreeSet<String> testedModules = new TreeSet<>();
        tests.forEach(f -> testedModules.add(f.topLevelModule()));
        List<String> untested = productionModules.stream().filter(m -> !testedModules.contains(m)).toList();

        List<String> frameworks = detectFrameworks(tests);
        double ratio = production.isEmpty() ? 0.0 : Math.min(1.0, (double) tests.size() / production.size());
        log.info("TestAnalyst found {} test files for {} production files", tests.size(), production.size());

        Map<String, Object> coverage = new LinkedHashMap<>();
        coverage.put("production_files", production.size());
        coverage.put("test_files", tests.size());
        coverage.put("estimated_coverage", RepositoryAnalyzerUnit.round(ratio));
        coverage.put("modules_with_tests", List.copyOf(testedModules));
        coverage.put("modules_without_tests", untested);

        List<Map<String, Object>> gaps = new ArrayList<>();
        if (tests.isEmpty() && !production.isEmpty()) {
            gaps.add(gap("(all)", "Repository has no automated tests", "high"));
        } else {
            untested.forEach(m -> gaps.add(gap(m, "Module '" + m + "' has no test files", "medium")));
        }

        Map<String, Object> quality = new LinkedHashMap<>();
        quality.put("frameworks_detected", frameworks);
        quality.put("assertion_count", tests.stream().mapToInt(TestAnalystUnit::countAssertions).sum());
        quality.put("average_test_file_lines", RepositoryAnalyzerUnit.round(
                tests.stream().mapToInt(CodeFile::lines).average().orElse(0)));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(TestAnalysis.COVERAGE_ANALYSIS, coverage);
        payload.put(TestAnalysis.TESTING_GAPS, gaps);
        payload.put(TestAnalysis.PROPOSED_TEST_STRATEGY, strategy(production, frameworks, untested, ratio));
        payload.put(TestAnalysis.QUALITY_METRICS, quality);
        return payload;
    }

    static List<String> detectFrameworks(List<CodeFile> tests) {
        List<String> found = new ArrayList<>();
        FRAMEWORK_MARKERS.forEach((framework, markers) -> {
            boolean present = tests.stream()
                    .anyMatch(t -> t.content() != null && markers.stream().anyMatch(t.content()::contains));
            if (present) found.add(framework);
        });
        return found;
    }

    private static int countAssertions(CodeFile test) {
        if (test.content() == null) return 0;
        String content = test.content().toLowerCase(Locale.ROOT);
        int count = 0;
        int index = content.indexOf("assert");
        while (index >= 0) {
            count++;
            index = content.indexOf("assert", index + 6);
        }
        return count;
    }

    private static Map<String, Object> strategy(List<CodeFile> production, List<String> frameworks,
                                                List<String> untested, double ratio) {
        String language = RepositoryAnalyzerUnit.primaryLanguage(production);
        Map<String, Object> strategy = new LinkedHashMap<>();
        strategy.put("unit_testing", "Cover business logic in isolation with "
                + (frameworks.isEmpty() ? defaultFramework(language) : String.join(", ", frameworks)) + ".");
        strategy.put("integration_testing", "Exercise module boundaries (persistence, HTTP endpoints, messaging) "
                + "against real or containerized dependencies.");
        strategy.put("end_to_end_testing", "Automate the primary user journeys through the public interface.");
        strategy.put("recommended_frameworks", frameworks.isEmpty() ? List.of(defaultFramework(language)) : frameworks);
        strategy.put("priority_modules", untested);
        strategy.put("target_coverage", ratio < 0.5 ? "Raise test-to-source ratio above 0.5 first" : "Maintain current ratio");
        return strategy;
    }

    static String defaultFramework(String language) {
        return switch (language) {
            case "java", "kotlin" -> "junit";
            case "python" -> "pytest";
            case "javascript", "typescript" -> "jest";
            case "go" -> "go-testing";
            default -> "the language's standard test framework";
        };
    }

    private static Map<String, Object> gap(String module, String description, String priority) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("module", module);
        entry.put("description", description);
        entry.put("priority", priority);
        return entry;
    }
}
