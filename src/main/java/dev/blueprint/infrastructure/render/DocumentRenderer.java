package dev.blueprint.infrastructure.render;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.blueprint.domain.enums.OutputFormat;
import dev.blueprint.domain.valueobject.FinalArtifact;
import org.springframework.stereotype.Component;
import org.springframework.web.util.HtmlUtils;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Renders a {@link FinalArtifact} as markdown, JSON or HTML.
 *
 * <p>Markdown and HTML share one section layout; JSON is the artifact itself, pretty-printed.
 * Empty sections are rendered with a placeholder line rather than omitted.
 */
@Component
public class DocumentRenderer {

    private static final String EMPTY = "_Not available._";

    private final ObjectMapper objectMapper;

    public DocumentRenderer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String render(FinalArtifact artifact, OutputFormat format) {
        return switch (format) {
            case MARKDOWN -> markdown(artifact);
            case JSON -> json(artifact);
            case HTML -> html(artifact);
        };
    }

    public String contentType(OutputFormat format) {
        return switch (format) {
            case MARKDOWN -> "text/markdown";
            case JSON -> "application/json";
            case HTML -> "text/html";
        };
    }

    // ── Markdown ───────────────────────────────────────────────────

    private String markdown(FinalArtifact a) {
        StringBuilder md = new StringBuilder();
        md.append("# Design Document\n\n");
        md.append("- **Document ID:** ").append(a.documentId()).append('\n');
        md.append("- **Execution ID:** ").append(a.executionId()).append('\n');
        md.append("- **Generated:** ").append(a.generatedAt()).append('\n');
        md.append(String.format(Locale.ROOT, "- **Confidence:** %.2f%n%n", a.confidenceScore()));

        section(md, "Executive Summary", a.executiveSummary());
        section(md, "System Overview", a.systemOverview());
        if (!a.architectureDiagram().isEmpty()) {
            md.append("## Architecture Diagram\n\n```mermaid\n").append(a.architectureDiagram().strip()).append("\n```\n\n");
        } else {
            section(md, "Architecture Diagram", "");
        }
        section(md, "Component Specifications", bullets(a.componentSpecifications()));
        section(md, "API Documentation", bullets(a.apiDocumentation()));
        if (!a.dataFlowDiagrams().isEmpty()) {
            md.append("## Data Flow\n\n");
            for (Object flow : a.dataFlowDiagrams()) {
                if (flow instanceof Map<?, ?> map && map.get("mermaid") instanceof String diagram) {
                    md.append("### ").append(map.get("name")).append("\n\n")
                            .append(map.get("description")).append("\n\n")
                            .append("```mermaid\n").append(diagram.strip()).append("\n```\n\n");
                } else {
                    md.append("- ").append(describe(flow)).append("\n\n");
                }
            }
        } else {
            section(md, "Data Flow", "");
        }
        section(md, "Code Quality Metrics", bullets(a.codeQualityMetrics()));
        section(md, "Test Strategy", bullets(a.testStrategy()));
        section(md, "Deployment Architecture", a.deploymentArchitecture());
        section(md, "Operational Requirements", bullets(a.operationalRequirements()));
        section(md, "Documentation Gaps", bullets(a.documentationGaps()));
        section(md, "Validation Questions", bullets(a.validationQuestions()));
        section(md, "Warnings", bullets(a.warnings()));
        return md.toString();
    }

    private static void section(StringBuilder md, String title, String body) {
        md.append("## ").append(title).append("\n\n")
                .append(body == null || body.isBlank() ? EMPTY : body.strip())
                .append("\n\n");
    }

    private static String bullets(List<?> items) {
        StringBuilder sb = new StringBuilder();
        for (Object item : items) sb.append("- ").append(describe(item)).append('\n');
        return sb.toString();
    }

    private static String bullets(Map<String, Object> entries) {
        StringBuilder sb = new StringBuilder();
        entries.forEach((k, v) -> sb.append("- **").append(k).append(":** ").append(describe(v)).append('\n'));
        return sb.toString();
    }

    /**
     * Maps with a {@code question} or {@code name} key read better as that value plus the rest.
     */
    private static String describe(Object item) {
        if (item instanceof Map<?, ?> map) {
            Object headline = map.containsKey("question") ? map.get("question") : map.get("name");
            if (headline != null) {
                StringBuilder sb = new StringBuilder(String.valueOf(headline));
                map.forEach((k, v) -> {
                    if (!"question".equals(k) && !"name".equals(k) && !"mermaid".equals(k))
                        sb.append(" | ").append(k).append(": ").append(v);
                });
                return sb.toString();
            }
        }
        return String.valueOf(item);
    }

    // ── JSON ───────────────────────────────────────────────────────

    private String json(FinalArtifact artifact) {
        try {
            return objectMapper.writeValueAsString(artifact);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize artifact " + artifact.documentId(), e);
        }
    }

    // ── HTML ───────────────────────────────────────────────────────

    private String html(FinalArtifact a) {
        StringBuilder html = new StringBuilder();
        html.append("<!DOCTYPE html>\n<html>\n<head>\n<meta charset=\"utf-8\">\n<title>")
                .append(HtmlUtils.htmlEscape(a.documentId())).append("</title>\n</head>\n<body>\n");
        html.append("<h1>Design Document</h1>\n");
        html.append("<p>Execution <code>").append(HtmlUtils.htmlEscape(a.executionId())).append("</code>, ")
                .append(String.format(Locale.ROOT, "confidence %.2f", a.confidenceScore())).append("</p>\n");

        paragraph(html, "Executive Summary", a.executiveSummary());
        paragraph(html, "System Overview", a.systemOverview());
        preformatted(html, "Architecture Diagram", a.architectureDiagram());
        list(html, "Component Specifications", a.componentSpecifications());
        list(html, "API Documentation", entries(a.apiDocumentation()));
        list(html, "Data Flow", a.dataFlowDiagrams());
        list(html, "Code Quality Metrics", entries(a.codeQualityMetrics()));
        list(html, "Test Strategy", entries(a.testStrategy()));
        paragraph(html, "Deployment Architecture", a.deploymentArchitecture());
        list(html, "Operational Requirements", a.operationalRequirements());
        list(html, "Documentation Gaps", a.documentationGaps());
        list(html, "Validation Questions", a.validationQuestions());
        list(html, "Warnings", a.warnings());
        html.append("</body>\n</html>\n");
        return html.toString();
    }

    private static void paragraph(StringBuilder html, String title, String text) {
        html.append("<h2>").append(title).append("</h2>\n<p>")
                .append(text == null || text.isBlank() ? "Not available." : HtmlUtils.htmlEscape(text))
                .append("</p>\n");
    }

    private static void preformatted(StringBuilder html, String title, String text) {
        if (text == null || text.isBlank()) {
            paragraph(html, title, "");
            return;
        }
        html.append("<h2>").append(title).append("</h2>\n<pre>").append(HtmlUtils.htmlEscape(text)).append("</pre>\n");
    }

    private static void list(StringBuilder html, String title, List<?> items) {
        if (items.isEmpty()) {
            paragraph(html, title, "");
            return;
        }
        html.append("<h2>").append(title).append("</h2>\n<ul>\n");
        for (Object item : items) {
            html.append("<li>").append(HtmlUtils.htmlEscape(describe(item))).append("</li>\n");
        }
        html.append("</ul>\n");
    }

    private static List<String> entries(Map<String, Object> map) {
        return map.entrySet().stream().map(e -> e.getKey() + ": " + describe(e.getValue())).toList();
    }
}
