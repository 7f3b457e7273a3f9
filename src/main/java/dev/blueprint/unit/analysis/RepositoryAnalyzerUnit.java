package dev.blueprint.unit.analysis;

import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.payload.PayloadKeys.RepositoryAnalysis;
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
import java.util.TreeMap;

/**
 * Structural overview of the repository: size, languages, top-level modules,
 * quality metrics, naming-convention patterns and build manifests.
 */
@Component
public class RepositoryAnalyzerUnit extends AbstractPipelineUnit {

    private static final Logger log = LoggerFactory.getLogger(RepositoryAnalyzerUnit.class);

    static final int LARGE_FILE_LINES = 500;
    private static final int MAX_EXAMPLES = 3;
    private static final int MAX_LARGE_FILES = 10;

    /** Pattern name to the lower-case file-name fragments that signal it. */
    private static final Map<String, List<String>> NAMING_PATTERNS = new LinkedHashMap<>();

    static {
        NAMING_PATTERNS.put("controller", List.of("controller", "handler", "routes", "router", "views"));
        NAMING_PATTERNS.put("service", List.of("service"));
        NAMING_PATTERNS.put("repository", List.of("repository", "dao", "database"));
        NAMING_PATTERNS.put("model", List.of("model", "entity", "schema", "dto"));
        NAMING_PATTERNS.put("configuration", List.of("config", "settings"));
    }

    private final RepositoryScanner scanner;

    public RepositoryAnalyzerUnit(RepositoryScanner scanner) {
        this.scanner = scanner;
    }

    @Override
    public String getName() {
        return RepositoryAnalysis.UNIT;
    }

    @Override
    public Phase getPhase() {
        return Phase.ANALYSIS;
    }

    @Override
    protected Map<String, Object> analyze(UnitInput input) throws IOException {
        List<CodeFile> files = scanner.scan(input.request());
        log.info("RepositoryAnalyzer analyzing {} files", files.size());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(RepositoryAnalysis.REPO_METADATA, metadata(input, files));
        payload.put(RepositoryAnalysis.ARCHITECTURE_ANALYSIS, architecture(files));
        payload.put(RepositoryAnalysis.CODE_QUALITY_METRICS, qualityMetrics(files));
        payload.put(RepositoryAnalysis.DETECTED_PATTERNS, patterns(files));
        payload.put(RepositoryAnalysis.FILE_STRUCTURE, fileStructure(files));
        payload.put(RepositoryAnalysis.DEPENDENCIES, dependencies(files));
        return payload;
    }

    private static Map<String, Object> metadata(UnitInput input, List<CodeFile> files) {
        Map<String, Integer> languages = new TreeMap<>();
        files.forEach(f -> languages.merge(f.language(), 1, Integer::sum));
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", String.valueOf(input.request().repositoryRoot().getFileName()));
        metadata.put("total_files", files.size());
        metadata.put("total_lines", files.stream().mapToLong(CodeFile::lines).sum());
        metadata.put("languages", languages);
        metadata.put("primary_language", primaryLanguage(files));
        return metadata;
    }

    /**
     * Language with the most source files; ties resolve alphabetically.
     */
    static String primaryLanguage(List<CodeFile> files) {
        Map<String, Integer> counts = new TreeMap<>();
        files.stream().filter(CodeFile::isSource).forEach(f -> counts.merge(f.language(), 1, Integer::sum));
        String best = "unknown";
        int max = 0;
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > max) {
                best = e.getKey();
                max = e.getValue();
            }
        }
        return best;
    }

    private static Map<String, Object> architecture(List<CodeFile> files) {
        Map<String, List<CodeFile>> byModule = new TreeMap<>();
        files.forEach(f -> byModule.computeIfAbsent(f.topLevelModule(), k -> new ArrayList<>()).add(f));

        List<Map<String, Object>> modules = new ArrayList<>();
        byModule.forEach((name, moduleFiles) -> {
            Map<String, Object> module = new LinkedHashMap<>();
            module.put("name", name);
            module.put("files", moduleFiles.size());
            module.put("lines", moduleFiles.stream().mapToLong(CodeFile::lines).sum());
            module.put("primary_language", primaryLanguage(moduleFiles));
            modules.add(module);
        });

        long layers = patterns(files).size();
        String style;
        if (byModule.keySet().stream().filter(m -> !"(root)".equals(m)).count() <= 1) style = "single-module";
        else if (layers >= 3) style = "layered";
        else style = "modular";

        Map<String, Object> architecture = new LinkedHashMap<>();
        architecture.put("architecture_style", style);
        architecture.put("modules", modules);
        architecture.put("entry_points", files.stream()
                .filter(RepositoryAnalyzerUnit::isEntryPoint)
                .map(CodeFile::path)
                .toList());
        return architecture;
    }

    static boolean isEntryPoint(CodeFile file) {
        String name = file.fileName().toLowerCase(Locale.ROOT);
        if (name.equals("main.py") || name.equals("app.py") || name.equals("main.go")
                || name.equals("index.js") || name.equals("index.ts") || name.equals("main.ts")) return true;
        return file.content() != null && "java".equals(file.language())
                && (file.content().contains("public static void main(") || file.content().contains("@SpringBootApplication"));
    }

    private static Map<String, Object> qualityMetrics(List<CodeFile> files) {
        List<CodeFile> sources = files.stream().filter(CodeFile::isSource).toList();
        long testFiles = sources.stream().filter(CodeFile::isTestFile).count();
        long productionFiles = sources.size() - testFiles;

        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("source_files", sources.size());
        metrics.put("test_files", testFiles);
        metrics.put("average_file_lines", round(sources.stream().mapToInt(CodeFile::lines).average().orElse(0)));
        metrics.put("max_file_lines", sources.stream().mapToInt(CodeFile::lines).max().orElse(0));
        metrics.put("large_files", sources.stream()
                .filter(f -> f.lines() > LARGE_FILE_LINES)
                .map(CodeFile::path)
                .limit(MAX_LARGE_FILES)
                .toList());
        metrics.put("test_to_source_ratio", productionFiles == 0 ? 0.0 : round((double) testFiles / productionFiles));
        return metrics;
    }

    static List<Map<String, Object>> patterns(List<CodeFile> files) {
        List<Map<String, Object>> detected = new ArrayList<>();
        NAMING_PATTERNS.forEach((pattern, fragments) -> {
            List<String> matches = files.stream()
                    .filter(f -> f.isSource() && !f.isTestFile())
                    .filter(f -> {
                        String path = f.path().toLowerCase(Locale.ROOT);
                        return fragments.stream().anyMatch(path::contains);
                    })
                    .map(CodeFile::path)
                    .toList();
            if (matches.isEmpty()) return;
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("name", pattern);
            entry.put("occurrences", matches.size());
            entry.put("examples", matches.stream().limit(MAX_EXAMPLES).toList());
            detected.add(entry);
        });
        return detected;
    }

    private static Map<String, Integer> fileStructure(List<CodeFile> files) {
        Map<String, Integer> structure = new TreeMap<>();
        files.forEach(f -> structure.merge(f.topLevelModule(), 1, Integer::sum));
        return structure;
    }

    private static Map<String, Object> dependencies(List<CodeFile> files) {
        List<String> manifests = files.stream().filter(CodeFile::isBuildManifest).map(CodeFile::path).toList();
        List<String> ecosystems = files.stream()
                .filter(CodeFile::isBuildManifest)
                .map(f -> ecosystem(f.fileName()))
                .distinct()
                .sorted()
                .toList();
        Map<String, Object> dependencies = new LinkedHashMap<>();
        dependencies.put("build_manifests", manifests);
        dependencies.put("ecosystems", ecosystems);
        return dependencies;
    }

    static String ecosystem(String manifest) {
        String name = manifest.toLowerCase(Locale.ROOT);
        if (name.equals("pom.xml")) return "maven";
        if (name.startsWith("build.gradle")) return "gradle";
        if (name.equals("package.json")) return "npm";
        if (name.equals("requirements.txt") || name.equals("pyproject.toml") || name.equals("setup.py")) return "python";
        if (name.equals("go.mod")) return "go";
        if (name.equals("cargo.toml")) return "cargo";
        if (name.equals("gemfile")) return "bundler";
        if (name.equals("composer.json")) return "composer";
        return "other";
    }

    static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
