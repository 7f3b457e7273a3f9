package dev.blueprint.unit.synthesis;

import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.payload.PayloadKeys.DesignSynthesis;
import dev.blueprint.domain.payload.PayloadKeys.DevOpsDesign;
import dev.blueprint.domain.payload.PayloadKeys.RepositoryAnalysis;
import dev.blueprint.domain.payload.PayloadView;
import dev.blueprint.domain.valueobject.CodeFile;
import dev.blueprint.domain.valueobject.UnitInput;
import dev.blueprint.infrastructure.ai.LlmNarrator;
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
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Phase 2: turns the analysis results into design sections.
 *
 * <p>Upstream results that are missing or failed read as empty, so this unit always produces
 * every section. Mermaid diagrams are emitted only when the request asks for diagrams.
 */
@Component
public class DesignArchitectUnit extends AbstractPipelineUnit {

    private static final Logger log = LoggerFactory.getLogger(DesignArchitectUnit.class);

    private static final List<Pattern> ENDPOINT_PATTERNS = List.of(
            // Spring MVC / WebFlux
            Pattern.compile("@(Get|Post|Put|Delete|Patch)Mapping\\(\\s*(?:value\\s*=\\s*|path\\s*=\\s*)?\"([^\"]*)\""),
            // FastAPI / Flask-style decorators
            Pattern.compile("@(?:app|router|bp|api)\\.(get|post|put|delete|patch)\\(\\s*[\"']([^\"']+)[\"']"),
            // Express
            Pattern.compile("(?<![@\\w.])(?:app|router)\\.(get|post|put|delete|patch)\\(\\s*['\"]([^'\"]+)['\"]"));

    private static final List<String> LAYERS = List.of("controller", "service", "repository");

    private final RepositoryScanner scanner;
    private final LlmNarrator narrator;

    public DesignArchitectUnit(RepositoryScanner scanner, LlmNarrator narrator) {
        this.scanner = scanner;
        this.narrator = narrator;
    }

    @Override
    public String getName() {
        return DesignSynthesis.UNIT;
    }

    @Override
    public Phase getPhase() {
        return Phase.SYNTHESIS;
    }

    @Override
    protected Map<String, Object> analyze(UnitInput input) throws IOException {
        PayloadView repository = PayloadView.of(input.upstreamResult(Phase.ANALYSIS, RepositoryAnalysis.UNIT));
        PayloadView devops = PayloadView.of(input.upstreamResult(Phase.ANALYSIS, DevOpsDesign.UNIT));
        if (!repository.isPresent()) {
            log.warn("Repository analysis unavailable; design sections will be sparse");
        }
        boolean diagrams = input.request().includeDiagrams();

        List<Map<String, Object>> modules = modules(repository);
        List<String> layers = detectedLayers(repository);
        List<Map<String, Object>> endpoints = endpoints(scanner.scan(input.request()));

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(DesignSynthesis.SYSTEM_OVERVIEW, overview(repository, devops, modules, layers, endpoints));
        payload.put(DesignSynthesis.ARCHITECTURE_DIAGRAM, diagrams ? architectureDiagram(modules, layers) : "");
        payload.put(DesignSynthesis.COMPONENT_SPECIFICATIONS, components(modules, repository));
        payload.put(DesignSynthesis.API_DOCUMENTATION, apiDocumentation(endpoints));
        payload.put(DesignSynthesis.DATA_FLOW_DIAGRAMS, dataFlows(layers, endpoints, diagrams));
        payload.put(DesignSynthesis.DESIGN_PRINCIPLES, principles(layers, repository));
        return payload;
    }

    // ── Overview ───────────────────────────────────────────────────

    private String overview(PayloadView repository, PayloadView devops, List<Map<String, Object>> modules,
                            List<String> layers, List<Map<String, Object>> endpoints) {
        String deterministic = deterministicOverview(repository, devops, modules, layers, endpoints);
        if (!narrator.isAvailable()) return deterministic;
        return narrator.narrate("""
                Rewrite the following system overview as one clear paragraph of at most 150 words.
                Keep every fact; add none.

                %s""".formatted(deterministic)).orElse(deterministic);
    }

    static String deterministicOverview(PayloadView repository, PayloadView devops, List<Map<String, Object>> modules,
                                        List<String> layers, List<Map<String, Object>> endpoints) {
        if (!repository.isPresent()) {
            return "Repository analysis was unavailable, so the system overview is limited."
                    + (endpoints.isEmpty() ? "" : " " + endpoints.size() + " HTTP endpoints were found in the source.");
        }
        Map<String, Object> metadata = repository.map(RepositoryAnalysis.REPO_METADATA);
        Map<String, Object> architecture = repository.map(RepositoryAnalysis.ARCHITECTURE_ANALYSIS);
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%s is a %s codebase of %s files organized into %d top-level modules",
                metadata.getOrDefault("name", "The repository"),
                metadata.getOrDefault("primary_language", "unknown"),
                metadata.getOrDefault("total_files", 0),
                modules.size()));
        Object style = architecture.get("architecture_style");
        if (style != null) sb.append(" with a ").append(style).append(" structure");
        sb.append('.');
        if (!layers.isEmpty()) sb.append(" Detected layers: ").append(String.join(", ", layers)).append('.');
        if (!endpoints.isEmpty()) sb.append(' ').append(endpoints.size()).append(" HTTP endpoints are exposed.");
        String deployment = devops.text(DevOpsDesign.DEPLOYMENT_ARCHITECTURE);
        if (!deployment.isEmpty()) sb.append(' ').append(deployment);
        return sb.toString();
    }

    // ── Components ─────────────────────────────────────────────────

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> modules(PayloadView repository) {
        List<Map<String, Object>> modules = new ArrayList<>();
        Object raw = repository.map(RepositoryAnalysis.ARCHITECTURE_ANALYSIS).get("modules");
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                if (item instanceof Map<?, ?> m && m.get("name") != null) modules.add((Map<String, Object>) m);
            }
        }
        return modules;
    }

    private static List<String> detectedLayers(PayloadView repository) {
        List<String> names = new ArrayList<>();
        for (Object pattern : repository.list(RepositoryAnalysis.DETECTED_PATTERNS)) {
            if (pattern instanceof Map<?, ?> m && m.get("name") != null) names.add(String.valueOf(m.get("name")));
        }
        return LAYERS.stream().filter(names::contains).toList();
    }

    private static List<Object> components(List<Map<String, Object>> modules, PayloadView repository) {
        List<Object> components = new ArrayList<>();
        for (Map<String, Object> module : modules) {
            String name = String.valueOf(module.get("name"));
            Map<String, Object> spec = new LinkedHashMap<>();
            spec.put("name", name);
            spec.put("type", "(root)".equals(name) ? "root" : "module");
            spec.put("language", module.getOrDefault("primary_language", "unknown"));
            spec.put("files", module.getOrDefault("files", 0));
            spec.put("lines", module.getOrDefault("lines", 0));
            spec.put("responsibilities", responsibilities(name, repository));
            components.add(spec);
        }
        return components;
    }

    /**
     * Pattern names whose example paths fall inside the module.
     */
    private static List<String> responsibilities(String module, PayloadView repository) {
        List<String> responsibilities = new ArrayList<>();
        String prefix = module + "/";
        for (Object pattern : repository.list(RepositoryAnalysis.DETECTED_PATTERNS)) {
            if (!(pattern instanceof Map<?, ?> m) || !(m.get("examples") instanceof List<?> examples)) continue;
            boolean inModule = examples.stream().map(o -> String.valueOf(o))
                    .anyMatch(p -> "(root)".equals(module) ? !p.contains("/") : p.startsWith(prefix));
            if (inModule) responsibilities.add(String.valueOf(m.get("name")));
        }
        return responsibilities;
    }

    // ── API ────────────────────────────────────────────────────────

    static List<Map<String, Object>> endpoints(List<CodeFile> files) {
        List<Map<String, Object>> endpoints = new ArrayList<>();
        for (CodeFile file : files) {
            if (!file.isSource() || file.isTestFile() || file.content() == null) continue;
            for (Pattern pattern : ENDPOINT_PATTERNS) {
                Matcher matcher = pattern.matcher(file.content());
                while (matcher.find()) {
                    Map<String, Object> endpoint = new LinkedHashMap<>();
                    endpoint.put("method", matcher.group(1).toUpperCase(Locale.ROOT));
                    endpoint.put("path", matcher.group(2).isEmpty() ? "/" : matcher.group(2));
                    endpoint.put("source", file.path());
                    endpoints.add(endpoint);
                }
            }
        }
        return endpoints;
    }

    private static Map<String, Object> apiDocumentation(List<Map<String, Object>> endpoints) {
        Map<String, Object> api = new LinkedHashMap<>();
        api.put("api_style", endpoints.isEmpty() ? "none detected" : "REST");
        api.put("total_endpoints", endpoints.size());
        api.put("endpoints", endpoints);
        return api;
    }

    // ── Diagrams ───────────────────────────────────────────────────

    static String architectureDiagram(List<Map<String, Object>> modules, List<String> layers) {
        StringBuilder sb = new StringBuilder("graph TD\n");
        if (modules.isEmpty() && layers.isEmpty()) {
            sb.append("    system[\"System\"]\n");
            return sb.toString();
        }
        for (int i = 0; i < modules.size(); i++) {
            Map<String, Object> module = modules.get(i);
            sb.append(String.format(Locale.ROOT, "    m%d[\"%s (%s files)\"]%n",
                    i, escape(String.valueOf(module.get("name"))), module.getOrDefault("files", 0)));
        }
        for (int i = 0; i < layers.size(); i++) {
            sb.append(String.format(Locale.ROOT, "    l%d{{\"%s layer\"}}%n", i, layers.get(i)));
            if (i > 0) sb.append(String.format(Locale.ROOT, "    l%d --> l%d%n", i - 1, i));
        }
        return sb.toString();
    }

    private static List<Object> dataFlows(List<String> layers, List<Map<String, Object>> endpoints, boolean diagrams) {
        List<Object> flows = new ArrayList<>();
        if (!endpoints.isEmpty() || !layers.isEmpty()) {
            Map<String, Object> request = new LinkedHashMap<>();
            request.put("name", "Request handling");
            List<String> steps = new ArrayList<>();
            steps.add("client");
            steps.addAll(layers);
            if (layers.contains("repository")) steps.add("datastore");
            request.put("description", String.join(" -> ", steps));
            if (diagrams) {
                StringBuilder sb = new StringBuilder("sequenceDiagram\n");
                for (int i = 1; i < steps.size(); i++) {
                    sb.append("    ").append(steps.get(i - 1)).append("->>").append(steps.get(i)).append(": call\n");
                }
                for (int i = steps.size() - 1; i > 0; i--) {
                    sb.append("    ").append(steps.get(i)).append("-->>").append(steps.get(i - 1)).append(": result\n");
                }
                request.put("mermaid", sb.toString());
            }
            flows.add(request);
        }
        return flows;
    }

    private static List<String> principles(List<String> layers, PayloadView repository) {
        List<String> principles = new ArrayList<>();
        if (layers.size() >= 2) principles.add("Keep dependencies flowing one way: " + String.join(" -> ", layers) + ".");
        principles.add("Keep each top-level module cohesive, with an explicit public surface.");
        Object large = repository.map(RepositoryAnalysis.CODE_QUALITY_METRICS).get("large_files");
        if (large instanceof List<?> l && !l.isEmpty()) principles.add("Split oversized files into focused units.");
        principles.add("Isolate external integrations behind interfaces so they can be replaced in tests.");
        return principles;
    }

    private static String escape(String label) {
        return label.replace("\"", "'");
    }
}
