package dev.blueprint;

import dev.blueprint.cli.PipelineCommandLineRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Blueprint: turns a source repository into a design document.
 *
 * <p>Architecture overview:
 * <pre>
 * CLI / POST /pipelines → PipelineService → PipelineOrchestrator
 *   → phase 1: PhaseExecutor → [repository, documentation, tests, devops] (parallel)
 *   → phase 2: design_architect
 *   → phase 3: qa_validator
 *   → ArtifactAggregator → ArtifactStore (&lt;id&gt;.json + rendered document)
 * </pre>
 *
 * <p>With {@code --repo} on the command line the application runs one pipeline without a
 * web server and exits with the run's exit code; otherwise it serves the REST API.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class BlueprintApplication {

    public static void main(String[] args) {
        SpringApplication application = new SpringApplication(BlueprintApplication.class);
        if (PipelineCommandLineRunner.isCliInvocation(args)) {
            application.setWebApplicationType(WebApplicationType.NONE);
            System.exit(SpringApplication.exit(application.run(args)));
        }
        application.run(args);
    }
}
