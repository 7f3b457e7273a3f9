package dev.blueprint.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.blueprint.domain.enums.RunStatus;
import dev.blueprint.dto.request.PipelineRunRequest;
import dev.blueprint.dto.response.PipelineStatusResponse;
import dev.blueprint.service.PipelineService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class PipelineCommandLineRunnerTest {

    private PipelineService service;
    private ByteArrayOutputStream stdout;
    private PipelineCommandLineRunner runner;

    @BeforeEach
    void setUp() {
        service = mock(PipelineService.class);
        stdout = new ByteArrayOutputStream();
        runner = new PipelineCommandLineRunner(service, new ObjectMapper(),
                new PrintStream(stdout, true, StandardCharsets.UTF_8));
    }

    private static PipelineStatusResponse response(RunStatus status, List<String> errors) {
        return new PipelineStatusResponse(status, "exec-cli", 0.2, errors, List.of(), null, null, null, null, null);
    }

    private String printed() {
        return stdout.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Should do nothing without --repo")
    void idleWithoutRepo() throws Exception {
        runner.run(new DefaultApplicationArguments("--server.port=0"));

        verifyNoInteractions(service);
        assertThat(printed()).isEmpty();
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("Should map every option onto the run request")
    void mapsOptions() throws Exception {
        when(service.run(any())).thenReturn(response(RunStatus.COMPLETED, List.of()));

        runner.run(new DefaultApplicationArguments("--repo=/src/shop", "--execution-id=exec-cli",
                "--include=**/*.java", "--include=**/*.md", "--exclude=target/**", "--format=html",
                "--no-diagrams", "--max-parallel=2"));

        ArgumentCaptor<PipelineRunRequest> captor = ArgumentCaptor.forClass(PipelineRunRequest.class);
        verify(service).run(captor.capture());
        PipelineRunRequest request = captor.getValue();
        assertThat(request.repositoryPath()).isEqualTo("/src/shop");
        assertThat(request.executionId()).isEqualTo("exec-cli");
        assertThat(request.includePatterns()).containsExactly("**/*.java", "**/*.md");
        assertThat(request.excludePatterns()).containsExactly("target/**");
        assertThat(request.outputFormat()).isEqualTo("html");
        assertThat(request.includeDiagrams()).isFalse();
        assertThat(request.maxParallelUnits()).isEqualTo(2);

        assertThat(printed()).contains("\"status\" : \"completed\"").contains("\"execution_id\" : \"exec-cli\"");
        assertThat(runner.getExitCode()).isZero();
    }

    @Test
    @DisplayName("Should leave unset options to the service defaults")
    void unsetOptions() throws Exception {
        when(service.run(any())).thenReturn(response(RunStatus.COMPLETED, List.of()));

        runner.run(new DefaultApplicationArguments("--repo=/src/shop"));

        ArgumentCaptor<PipelineRunRequest> captor = ArgumentCaptor.forClass(PipelineRunRequest.class);
        verify(service).run(captor.capture());
        assertThat(captor.getValue().includePatterns()).isNull();
        assertThat(captor.getValue().outputFormat()).isNull();
        assertThat(captor.getValue().includeDiagrams()).isTrue();
        assertThat(captor.getValue().maxParallelUnits()).isNull();
    }

    @Test
    @DisplayName("Should exit with 1 when the run failed")
    void failedRunExitCode() throws Exception {
        when(service.run(any())).thenReturn(response(RunStatus.FAILED, List.of("Repository path does not exist: /nope")));

        runner.run(new DefaultApplicationArguments("--repo=/nope"));

        assertThat(runner.getExitCode()).isEqualTo(1);
        assertThat(printed()).contains("Repository path does not exist: /nope");
    }

    @Test
    @DisplayName("Should reject a non-numeric --max-parallel without running")
    void badMaxParallel() throws Exception {
        when(service.reject(eq("exec-cli"), anyList()))
                .thenReturn(response(RunStatus.FAILED, List.of("--max-parallel must be an integer, was lots")));

        runner.run(new DefaultApplicationArguments("--repo=/src/shop", "--execution-id=exec-cli", "--max-parallel=lots"));

        verify(service).reject("exec-cli", List.of("--max-parallel must be an integer, was lots"));
        verify(service, never()).run(any());
        assertThat(runner.getExitCode()).isEqualTo(1);
    }

    @Test
    @DisplayName("Should recognise a command-line invocation by the --repo option")
    void detectsCliInvocation() {
        assertThat(PipelineCommandLineRunner.isCliInvocation("--repo=/src")).isTrue();
        assertThat(PipelineCommandLineRunner.isCliInvocation("--repo")).isTrue();
        assertThat(PipelineCommandLineRunner.isCliInvocation("--repository=/src")).isFalse();
        assertThat(PipelineCommandLineRunner.isCliInvocation("--server.port=9000")).isFalse();
        assertThat(PipelineCommandLineRunner.isCliInvocation()).isFalse();
    }
}
