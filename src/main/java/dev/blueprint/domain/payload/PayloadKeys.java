package dev.blueprint.domain.payload;

/**
 * Unit names and the payload keys each downstream consumer reads.
 * Producers may add other keys; consumers rely only on the ones listed here.
 */
public final class PayloadKeys {

    private PayloadKeys() {}

    public static final class RepositoryAnalysis {
        public static final String UNIT = "repository_analyzer";
        public static final String REPO_METADATA = "repo_metadata";
        public static final String ARCHITECTURE_ANALYSIS = "architecture_analysis";
        public static final String CODE_QUALITY_METRICS = "code_quality_metrics";
        public static final String DETECTED_PATTERNS = "detected_patterns";
        public static final String FILE_STRUCTURE = "file_structure";
        public static final String DEPENDENCIES = "dependencies";

        private RepositoryAnalysis() {}
    }

    public static final class DocumentationSynthesis {
        public static final String UNIT = "documentation_synthesizer";
        public static final String ACCURACY_SCORE = "documentation_accuracy_score";
        public static final String MAJOR_DISCREPANCIES = "major_discrepancies";
        public static final String UNDOCUMENTED_FEATURES = "undocumented_features";
        public static final String EXISTING_DOCS_ANALYSIS = "existing_docs_analysis";

        private DocumentationSynthesis() {}
    }

    public static final class TestAnalysis {
        public static final String UNIT = "test_analyst";
        public static final String COVERAGE_ANALYSIS = "test_coverage_analysis";
        public static final String TESTING_GAPS = "testing_gaps";
        public static final String PROPOSED_TEST_STRATEGY = "proposed_test_strategy";
        public static final String QUALITY_METRICS = "test_quality_metrics";

        private TestAnalysis() {}
    }

    public static final class DevOpsDesign {
        public static final String UNIT = "devops_designer";
        public static final String DEPLOYMENT_ARCHITECTURE = "deployment_architecture";
        public static final String INFRASTRUCTURE_DESIGN = "infrastructure_design";
        public static final String OPERATIONAL_REQUIREMENTS = "operational_requirements";
        public static final String MONITORING_STRATEGY = "monitoring_strategy";

        private DevOpsDesign() {}
    }

    public static final class DesignSynthesis {
        public static final String UNIT = "design_architect";
        public static final String SYSTEM_OVERVIEW = "system_overview";
        public static final String ARCHITECTURE_DIAGRAM = "architecture_diagram";
        public static final String COMPONENT_SPECIFICATIONS = "component_specifications";
        public static final String API_DOCUMENTATION = "api_documentation";
        public static final String DATA_FLOW_DIAGRAMS = "data_flow_diagrams";
        public static final String DESIGN_PRINCIPLES = "design_principles";

        private DesignSynthesis() {}
    }

    public static final class Validation {
        public static final String UNIT = "qa_validator";
        public static final String CLARIFICATION_QUESTIONS = "clarification_questions";
        public static final String VALIDATION_POINTS = "validation_points";
        public static final String CONFIDENCE_SCORES = "confidence_scores";
        public static final String PRIORITY_AREAS = "priority_areas";
        public static final String CONSISTENCY_CHECK_RESULTS = "consistency_check_results";

        private Validation() {}
    }
}
