package dev.blueprint.unit.analysis;

import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.payload.PayloadKeys.DocumentationSynthesis;
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
 * Compares the repository's markdown documentation against its code layout.
 *
 * <p>Accuracy is the share of source-bearing top-level modules mentioned by name anywhere
 * in the docs. A repository with no such modules scores 1.0 when it has docs, 0.0 otherwise.
 */
@Component
public class DocumentationSynthesizerUnit extends AbstractPipelineUnit {

    private static final Logger log = LoggerFactory.getLogger(DocumentationSynthesizerUnit.class);

    private final RepositoryScanner scanner;

    public DocumentationSynthesizerUnit(RepositoryScanner scanner) {
        this.scanner = scanner;
    }

    @Override
    public String getName() {
        return DocumentationSynthesis.UNIT;
    }

    @Override
    public Phase getPhase() {
        return Phase.ANALYSIS;
    }

    @Override
    protected Map<String, Object> analyze(UnitInput input) throws IOException {
        List<CodeFile> files = scanner.scan(input.request());
        List<CodeFile> docs = files.stream().filter(CodeFile::isDocumentation).toList();
        boolean hasReadme = docs.stream().anyMatch(d -> d.fileName().toLowerCase(Locale.ROOT).startsWith("readme"));
        String corpus = String.join("\n", docs.stream().map(CodeFile::content).toList()).toLowerCase(Locale.ROOT);

        TreeSet<String> modules = new TreeSet<>();
        files.stream()
                .filter(CodeFile::isSource)
                .map(CodeFile::topLevelModule)
                .filter(m -> !"(root)".equals(m))
                .forEach(modules::add);
        List<String> undocumented = modules.stream()
                .filter(m -> !corpus.contains(m.toLowerCase(Locale.ROOT)))
                .toList();

        double accuracy = modules.isEmpty()
                ? (docs.isEmpty() ? 0.0 : 1.0)
                : RepositoryAnalyzerUnit.round((double) (modules.size() - undocumented.size()) / modules.size());
        log.info("DocumentationSynthesizer found {} docs covering {}/{} modules",
                docs.size(), modules.size() - undocumented.size(), modules.size());

        List<Map<String, Object>> discrepancies = new ArrayList<>();
        if (!hasReadme) {
            discrepancies.add(discrepancy("missing_readme", "Repository has no README", "high"));
        }
        for (String module : undocumented) {
            discrepancies.add(discrepancy("undocumented_module",
                    "Module '" + module + "' is not mentioned in any documentation", "medium"));
        }

        Map<String, Object> existing = new LinkedHashMap<>();
        existing.put("documentation_files", docs.stream().map(CodeFile::path).toList());
        existing.put("total_doc_lines", docs.stream().mapToLong(CodeFile::lines).sum());
        existing.put("has_readme", hasReadme);
        existing.put("modules_checked", List.copyOf(modules));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(DocumentationSynthesis.ACCURACY_SCORE, accuracy);
        payload.put(DocumentationSynthesis.MAJOR_DISCREPANCIES, discrepancies);
        payload.put(DocumentationSynthesis.UNDOCUMENTED_FEATURES, undocumented);
        payload.put(DocumentationSynthesis.EXISTING_DOCS_ANALYSIS, existing);
        return payload;
    }

    private static Map<String, Object> discrepancy(String type, String description, String severity) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("type", type);
        entry.put("description", description);
        entry.put("severity", severity);
        return entry;
    }
}
