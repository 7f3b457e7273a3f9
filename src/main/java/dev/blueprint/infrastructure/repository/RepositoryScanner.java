package dev.blueprint.infrastructure.repository;

import dev.blueprint.config.PipelineProperties;
import dev.blueprint.domain.valueobject.CodeFile;
import dev.blueprint.domain.valueobject.PipelineRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * Reads the analyzed repository from the local filesystem.
 *
 * <p>Request globs win; an empty list falls back to the configured defaults. A pattern
 * without a slash also matches bare file names, so {@code Dockerfile} works at any depth.
 * Files over the size limit or not valid UTF-8 are skipped. Results are sorted by path.
 */
@Component
public class RepositoryScanner {

    private static final Logger log = LoggerFactory.getLogger(RepositoryScanner.class);

    private final PipelineProperties properties;

    public RepositoryScanner(PipelineProperties properties) {
        this.properties = properties;
    }

    public List<CodeFile> scan(PipelineRequest request) throws IOException {
        Path root = request.repositoryRoot();
        List<Glob> includes = compile(request.includePatterns().isEmpty()
                ? properties.includePatterns() : request.includePatterns());
        List<Glob> excludes = compile(request.excludePatterns().isEmpty()
                ? properties.excludePatterns() : request.excludePatterns());
        long maxBytes = properties.maxFileSizeKb() * 1024;

        List<Path> candidates;
        try (Stream<Path> walk = Files.walk(root)) {
            candidates = walk.filter(Files::isRegularFile)
                    .filter(p -> {
                        String rel = relative(root, p);
                        return matchesAny(includes, rel) && !matchesAny(excludes, rel);
                    })
                    .sorted(Comparator.comparing(p -> relative(root, p)))
                    .toList();
        }

        List<CodeFile> files = new ArrayList<>(candidates.size());
        for (Path path : candidates) {
            String rel = relative(root, path);
            long size = Files.size(path);
            if (size > maxBytes) {
                log.debug("Skipping {} ({} bytes exceeds limit)", rel, size);
                continue;
            }
            String content;
            try {
                content = StandardCharsets.UTF_8.newDecoder()
                        .decode(ByteBuffer.wrap(Files.readAllBytes(path)))
                        .toString();
            } catch (CharacterCodingException e) {
                log.debug("Skipping {}: not UTF-8", rel);
                continue;
            }
            files.add(new CodeFile(rel, CodeFile.detectLanguage(rel), content, countLines(content), size));
        }
        log.debug("Scanned {}: {} files matched", root, files.size());
        return files;
    }

    static int countLines(String content) {
        if (content.isEmpty()) return 0;
        int lines = 1;
        for (int i = 0; i < content.length(); i++) {
            if (content.charAt(i) == '\n' && i < content.length() - 1) lines++;
        }
        return lines;
    }

    private static String relative(Path root, Path path) {
        return root.relativize(path).toString().replace('\\', '/');
    }

    private static List<Glob> compile(List<String> patterns) {
        return patterns.stream()
                .map(p -> new Glob(FileSystems.getDefault().getPathMatcher("glob:" + p), !p.contains("/")))
                .toList();
    }

    private static boolean matchesAny(List<Glob> globs, String rel) {
        Path relPath = Path.of(rel);
        Path dotted = Path.of("./" + rel);
        Path name = relPath.getFileName();
        for (Glob glob : globs) {
            if (glob.matcher().matches(relPath) || glob.matcher().matches(dotted)) return true;
            if (glob.nameOnly() && name != null && glob.matcher().matches(name)) return true;
        }
        return false;
    }

    private record Glob(PathMatcher matcher, boolean nameOnly) {}
}
