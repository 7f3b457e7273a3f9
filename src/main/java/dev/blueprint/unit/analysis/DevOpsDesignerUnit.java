package dev.blueprint.unit.analysis;

import dev.blueprint.domain.enums.Phase;
import dev.blueprint.domain.payload.PayloadKeys.DevOpsDesign;
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
import java.util.function.Predicate;

/**
 * Deployment and operations view derived from container, orchestration, CI and
 * monitoring files found in the repository.
 */
@Component
public class DevOpsDesignerUnit extends AbstractPipelineUnit {

    private static final Logger log = LoggerFactory.getLogger(DevOpsDesignerUnit.class);

    private final RepositoryScanner scanner;

    public DevOpsDesignerUnit(RepositoryScanner scanner) {
        this.scanner = scanner;
    }

    @Override
    public String getName() {
        return DevOpsDesign.UNIT;
    }

    @Override
    public Phase getPhase() {
        return Phase.ANALYSIS;
    }

    @Override
    protected Map<String, Object> analyze(UnitInput input) throws IOException {
        List<CodeFile> files = scanner.scan(input.request());

        List<String> dockerfiles = paths(files, f -> f.fileName().toLowerCase(Locale.ROOT).startsWith("dockerfile"));
        List<String> compose = paths(files, f -> {
            String name = f.fileName().toLowerCase(Locale.ROOT);
            return name.startsWith("docker-compose") || name.startsWith("compose.");
        });
        List<String> kubernetes = paths(files, DevOpsDesignerUnit::isKubernetesManifest);
        List<String> ci = paths(files, DevOpsDesignerUnit::isCiDefinition);
        TreeSet<String> monitoring = monitoringSignals(files);
        log.info("DevOpsDesigner found {} container, {} orchestration and {} CI files",
                dockerfiles.size(), compose.size() + kubernetes.size(), ci.size());

        String containerization = dockerfiles.isEmpty() ? "none" : "docker";
        String orchestration = !kubernetes.isEmpty() ? "kubernetes" : !compose.isEmpty() ? "docker-compose" : "none";

        Map<String, Object> infrastructure = new LinkedHashMap<>();
        infrastructure.put("containerization", containerization);
        infrastructure.put("orchestration", orchestration);
        infrastructure.put("ci_cd", ci.isEmpty() ? "none" : ciSystem(ci.get(0)));
        List<String> detected = new ArrayList<>(dockerfiles);
        detected.addAll(compose);
        detected.addAll(kubernetes);
        detected.addAll(ci);
        infrastructure.put("detected_files", detected);

        Map<String, Object> monitoringStrategy = new LinkedHashMap<>();
        monitoringStrategy.put("detected", List.copyOf(monitoring));
        monitoringStrategy.put("logging", "Structured application logs with a correlation id per request or run.");
        monitoringStrategy.put("metrics", monitoring.isEmpty()
                ? "Introduce request latency, error rate and saturation metrics."
                : "Extend the existing " + String.join(", ", monitoring) + " instrumentation to every module.");
        monitoringStrategy.put("health_checks", monitoring.contains("actuator")
                ? "Expose liveness and readiness through the existing health endpoint."
                : "Add liveness and readiness endpoints.");

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put(DevOpsDesign.DEPLOYMENT_ARCHITECTURE, describeDeployment(containerization, orchestration, ci));
        payload.put(DevOpsDesign.INFRASTRUCTURE_DESIGN, infrastructure);
        payload.put(DevOpsDesign.OPERATIONAL_REQUIREMENTS, requirements(dockerfiles, orchestration, ci, monitoring));
        payload.put(DevOpsDesign.MONITORING_STRATEGY, monitoringStrategy);
        return payload;
    }

    static boolean isKubernetesManifest(CodeFile file) {
        if (!"yaml".equals(file.language()) || file.content() == null) return false;
        if (file.fileName().equalsIgnoreCase("Chart.yaml")) return true;
        return file.content().contains("apiVersion:") && file.content().contains("kind:");
    }

    static boolean isCiDefinition(CodeFile file) {
        String path = file.path().toLowerCase(Locale.ROOT);
        return path.startsWith(".github/workflows/") || path.equals(".gitlab-ci.yml")
                || path.equals("jenkinsfile") || path.startsWith(".circleci/") || path.equals("azure-pipelines.yml");
    }

    private static String ciSystem(String path) {
        String lower = path.toLowerCase(Locale.ROOT);
        if (lower.startsWith(".github/")) return "github-actions";
        if (lower.startsWith(".gitlab")) return "gitlab-ci";
        if (lower.equals("jenkinsfile")) return "jenkins";
        if (lower.startsWith(".circleci")) return "circleci";
        return "azure-pipelines";
    }

    private static TreeSet<String> monitoringSignals(List<CodeFile> files) {
        TreeSet<String> signals = new TreeSet<>();
        for (CodeFile file : files) {
            String content = file.content() != null ? file.content().toLowerCase(Locale.ROOT) : "";
            if (content.contains("spring-boot-starter-actuator") || content.contains("management.endpoints"))
                signals.add("actuator");
            if (content.contains("micrometer")) signals.add("micrometer");
            if (content.contains("prometheus")) signals.add("prometheus");
            if (content.contains("opentelemetry")) signals.add("opentelemetry");
            if (content.contains("sentry")) signals.add("sentry");
        }
        return signals;
    }

    private static String describeDeployment(String containerization, String orchestration, List<String> ci) {
        StringBuilder sb = new StringBuilder();
        if ("none".equals(containerization)) {
            sb.append("No container definition found; the application is deployed as a plain process.");
        } else {
            sb.append("The application is packaged as a Docker image");
            sb.append("none".equals(orchestration) ? "." : " and run with " + orchestration + ".");
        }
        sb.append(ci.isEmpty()
                ? " No CI pipeline definition was detected."
                : " Builds run on " + ciSystem(ci.get(0)) + ".");
        return sb.toString();
    }

    private static List<String> requirements(List<String> dockerfiles, String orchestration,
                                             List<String> ci, TreeSet<String> monitoring) {
        List<String> requirements = new ArrayList<>();
        requirements.add("Externalize configuration and secrets from the build artifact.");
        if (dockerfiles.isEmpty()) requirements.add("Provide a container image definition for reproducible deployments.");
        if ("none".equals(orchestration)) requirements.add("Define how instances are started, scaled and restarted.");
        if (ci.isEmpty()) requirements.add("Add a CI pipeline that builds and tests every change.");
        if (monitoring.isEmpty()) requirements.add("Add metrics and health endpoints before production rollout.");
        requirements.add("Centralize logs and keep them for incident analysis.");
        return requirements;
    }

    private static List<String> paths(List<CodeFile> files, Predicate<CodeFile> filter) {
        return files.stream().filter(filter).map(CodeFile::path).toList();
    }
}
