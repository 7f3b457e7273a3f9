package dev.blueprint.domain.valueobject;

import java.util.List;
import java.util.Locale;

/**
 * Immutable representation of one file read from the analyzed repository.
 * {@code path} is relative to the repository root and always uses forward slashes.
 */
public record CodeFile(
        String path,
        String language,
        String content,
        int lines,
        long sizeBytes
) {
    private static final List<String> BUILD_MANIFESTS = List.of(
            "pom.xml", "build.gradle", "build.gradle.kts", "package.json", "requirements.txt",
            "pyproject.toml", "setup.py", "go.mod", "cargo.toml", "gemfile", "composer.json");

    public static String detectLanguage(String path) {
        if (path == null) return "unknown";
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.endsWith(".java")) return "java";
        if (lower.endsWith(".kt")) return "kotlin";
        if (lower.endsWith(".py")) return "python";
        if (lower.endsWith(".js") || lower.endsWith(".jsx")) return "javascript";
        if (lower.endsWith(".ts") || lower.endsWith(".tsx")) return "typescript";
        if (lower.endsWith(".go")) return "go";
        if (lower.endsWith(".rs")) return "rust";
        if (lower.endsWith(".cs")) return "csharp";
        if (lower.endsWith(".php")) return "php";
        if (lower.endsWith(".md")) return "markdown";
        if (lower.endsWith(".xml")) return "xml";
        if (lower.endsWith(".yml") || lower.endsWith(".yaml")) return "yaml";
        if (lower.endsWith(".json")) return "json";
        if (lower.endsWith(".properties")) return "properties";
        if (lower.endsWith(".gradle") || lower.endsWith(".gradle.kts")) return "gradle";
        if (lower.endsWith(".sql")) return "sql";
        return "unknown";
    }

    public String fileName() {
        int slash = path.lastIndexOf('/');
        return slash < 0 ? path : path.substring(slash + 1);
    }

    /**
     * First path segment, or {@code "(root)"} for files directly under the repository root.
     */
    public String topLevelModule() {
        int slash = path.indexOf('/');
        return slash < 0 ? "(root)" : path.substring(0, slash);
    }

    public boolean isSource() {
        return List.of("java", "kotlin", "python", "javascript", "typescript", "go", "rust", "csharp", "php")
                .contains(language);
    }

    public boolean isTestFile() {
        if (!isSource()) return false;
        String lower = path.toLowerCase(Locale.ROOT);
        String name = fileName().toLowerCase(Locale.ROOT);
        return lower.contains("/test/") || lower.contains("/tests/") || lower.startsWith("test/")
                || lower.startsWith("tests/") || name.startsWith("test_") || name.endsWith("_test.py")
                || fileName().endsWith("Test.java") || fileName().endsWith("Tests.java") || fileName().endsWith("IT.java")
                || name.contains(".test.") || name.contains(".spec.") || name.endsWith("_test.go");
    }

    public boolean isDocumentation() {
        return "markdown".equals(language);
    }

    public boolean isBuildManifest() {
        return BUILD_MANIFESTS.contains(fileName().toLowerCase(Locale.ROOT));
    }

    public boolean isConfigFile() {
        return List.of("xml", "yaml", "properties", "gradle", "json").contains(language);
    }
}
