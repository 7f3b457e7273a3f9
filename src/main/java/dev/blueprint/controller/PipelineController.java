package dev.blueprint.controller;

import com.fasterxml.jackson.databind.JsonNode;
import dev.blueprint.domain.enums.RunStatus;
import dev.blueprint.dto.request.PipelineRunRequest;
import dev.blueprint.dto.response.PipelineStatusResponse;
import dev.blueprint.infrastructure.render.DocumentRenderer;
import dev.blueprint.service.PipelineService;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/pipelines")
public class PipelineController {
    private final PipelineService pipelineService;
    private final DocumentRenderer renderer;

    public PipelineController(PipelineService pipelineService, DocumentRenderer renderer) {
        this.pipelineService = pipelineService;
        this.renderer = renderer;
    }

    /** Runs synchronously. 200 when the run completed (even with failed units), 422 when it failed. */
    @PostMapping
    public ResponseEntity<PipelineStatusResponse> run(@RequestBody PipelineRunRequest request) {
        PipelineStatusResponse response = pipelineService.run(request);
        HttpStatus status = response.status() == RunStatus.COMPLETED ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
        return ResponseEntity.status(status).body(response);
    }

    @GetMapping("/{executionId}")
    public ResponseEntity<JsonNode> getRun(@PathVariable String executionId) {
        return pipelineService.findRun(executionId).map(ResponseEntity::ok).orElse(ResponseEntity.notFound().build());
    }

    @GetMapping("/{executionId}/document")
    public ResponseEntity<String> getDocument(@PathVariable String executionId) {
        return pipelineService.findDocument(executionId)
                .map(doc -> ResponseEntity.ok()
                        .contentType(MediaType.parseMediaType(renderer.contentType(doc.format())))
                        .body(doc.content()))
                .orElse(ResponseEntity.notFound().build());
    }
}
