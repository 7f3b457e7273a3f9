package dev.blueprint.unit.analysis;

import dev.blueprint.config.PipelineProperties;
import dev.blueprint.domain.payload.PayloadKeys.DevOpsDesign;
import dev.blueprint.domain.payload.PayloadView;
import dev.blueprint.domain.valueobject.CodeFile;
import dev.blueprint.infrastructure.repository.RepositoryScanner;
import dev.blueprint.support.SampleRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DevOpsDesignerUnitTest {

    @TempDir
    Path repo;

    private DevOpsDesignerUnit unit;

    @BeforeEach
    void setUp() {
        unit = new DevOpsDesignerUnit(new RepositoryScanner(PipelineProperties.defaults()));
    }

    private PayloadView analyze() {
        return PayloadView.of(unit.execute(SampleRepository.analysisInput(repo)));
    }

    @Test
    @DisplayName("Should describe a containerized repository with CI and actuator")
    void containerized() throws IOException {
        SampleRepository.create(repo);

        PayloadView payload = analyze();

        assertThat(payload.text(DevOpsDesign.DEPLOYMENT_ARCHITECTURE)).isEqualTo(
                "The application is packaged as a Docker image and run with docker-compose. Builds run on github-actions.");
        assertThat(payload.map(DevOpsDesign.INFRASTRUCTURE_DESIGN))
                .containsEntry("containerization", "docker")
                .containsEntry("orchestration", "docker-compose")
                .containsEntry("ci_cd", "github-actions")
                .containsEntry("detected_files", List.of("Dockerfile", "docker-compose.yml", ".github/workflows/build.yml"));
        Map<String, Object> monitoring = payload.map(DevOpsDesign.MONITORING_STRATEGY);
        assertThat(monitoring).containsEntry("detected", List.of("actuator"));
        assertThat((String) monitoring.get("health_checks")).contains("existing health endpoint");
        assertThat(payload.list(DevOpsDesign.OPERATIONAL_REQUIREMENTS))
                .doesNotContain("Provide a container image definition for reproducible deployments.")
                .contains("Externalize configuration and secrets from the build artifact.");
    }

    @Test
    @DisplayName("Should recommend containers, CI and monitoring for a bare repository")
    void bareRepository() throws IOException {
        SampleRepository.write(repo, "src/main.py", "print('hi')\n");

        PayloadView payload = analyze();

        assertThat(payload.text(DevOpsDesign.DEPLOYMENT_ARCHITECTURE))
                .startsWith("No container definition found")
                .endsWith("No CI pipeline definition was detected.");
        assertThat(payload.map(DevOpsDesign.INFRASTRUCTURE_DESIGN))
                .containsEntry("containerization", "none")
                .containsEntry("orchestration", "none")
                .containsEntry("ci_cd", "none");
        assertThat(payload.list(DevOpsDesign.OPERATIONAL_REQUIREMENTS)).contains(
                "Provide a container image definition for reproducible deployments.",
                "Add a CI pipeline that builds and tests every change.",
                "Add metrics and health endpoints before production rollout.");
    }

    @Test
    @DisplayName("Should prefer kubernetes over compose as orchestration")
    void kubernetes() throws IOException {
        SampleRepository.create(repo);
        SampleRepository.write(repo, "deploy/app.yaml", "apiVersion: apps/v1\nkind: Deployment\n");

        assertThat(analyze().map(DevOpsDesign.INFRASTRUCTURE_DESIGN)).containsEntry("orchestration", "kubernetes");
    }

    @Test
    @DisplayName("Should recognize Kubernetes manifests and CI definitions")
    void classifiers() {
        CodeFile manifest = new CodeFile("k8s/svc.yml", "yaml", "apiVersion: v1\nkind: Service\n", 2, 10);
        CodeFile config = new CodeFile("src/application.yml", "yaml", "server:\n  port: 8080\n", 2, 10);

        assertThat(DevOpsDesignerUnit.isKubernetesManifest(manifest)).isTrue();
        assertThat(DevOpsDesignerUnit.isKubernetesManifest(config)).isFalse();
        assertThat(DevOpsDesignerUnit.isCiDefinition(new CodeFile(".gitlab-ci.yml", "yaml", "", 0, 0))).isTrue();
        assertThat(DevOpsDesignerUnit.isCiDefinition(new CodeFile("Jenkinsfile", "unknown", "", 0, 0))).isTrue();
        assertThat(DevOpsDesignerUnit.isCiDefinition(config)).isFalse();
    }
}
