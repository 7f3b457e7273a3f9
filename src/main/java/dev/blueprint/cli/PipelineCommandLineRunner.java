package dev.blueprint.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import dev.blueprint.dto.request.PipelineRunRequest;
import dev.blueprint.dto.response.PipelineStatusResponse;
import dev.blueprint.service.PipelineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.List;

/**
 * Command-line surface:
 * <pre>
 *   --repo=&lt;path&gt; [--execution-id=ID] [--include=GLOB]... [--exclude=GLOB]...
 *   [--format=markdown|json|html] [--no-diagrams] [--max-parallel=N]
 * </pre>
 * Prints the status object as JSON on stdout. Exit code 0 when the run completed,
 * even with failed units; 1 when it failed. Does nothing unless {@code --repo} is given.
 */
@Component
public class PipelineCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PipelineCommandLineRunner.class);

    static final String REPO = "repo";

    private final PipelineService pipelineService;
    private final ObjectMapper objectMapper;
    private final PrintStream out;
    private volatile int exitCode = 0;

    public PipelineCommandLineRunner(PipelineService pipelineService, ObjectMapper objectMapper) {
        this(pipelineService, objectMapper, System.out);
    }

    PipelineCommandLineRunner(PipelineService pipelineService, ObjectMapper objectMapper, PrintStream out) {
        this.pipelineService = pipelineService;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.out = out;
    }

    public static boolean isCliInvocation(String... args) {
        return Arrays.stream(args).anyMatch(a -> a.equals("--" + REPO) || a.startsWith("--" + REPO + "="));
    }

    @Override
    public void run(ApplicationArguments args) throws JsonProcessingException {
        if (!args.containsOption(REPO)) return;

        String executionId = single(args, "execution-id");
        Integer maxParallel = null;
        String rawMaxParallel = single(args, "max-parallel");
        if (rawMaxParallel != null) {
            try {
                maxParallel = Integer.valueOf(rawMaxParallel.trim());
            } catch (NumberFormatException e) {
                finish(pipelineService.reject(executionId,
                        List.of("--max-parallel must be an integer, was " + rawMaxParallel)));
                return;
            }
        }

        PipelineRunRequest request = new PipelineRunRequest(
                single(args, REPO),
                executionId,
                args.getOptionValues("include"),
                args.getOptionValues("exclude"),
                single(args, "format"),
                !args.containsOption("no-diagrams"),
                maxParallel);
        finish(pipelineService.run(request));
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    private void finish(PipelineStatusResponse response) throws JsonProcessingException {
        exitCode = response.status().exitCode();
        out.println(objectMapper.writeValueAsString(response));
        log.info("Run {} finished with status {}", response.executionId(), response.status().wireName());
    }

    private static String single(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        return values == null || values.isEmpty() ? null : values.get(values.size() - 1);
    }
}
