package com.company.guardian.controller;

import com.company.guardian.domain.ExecutionRecord;
import com.company.guardian.dto.request.CompleteExecutionRequest;
import com.company.guardian.dto.request.StartExecutionRequest;
import com.company.guardian.dto.response.ExecutionResponse;
import com.company.guardian.service.ExecutionIngestionService;
import io.micrometer.core.instrument.MeterRegistry;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.net.URI;

@RestController
@RequestMapping("/api/v1/executions")
@Tag(name = "Execution Ingestion", description = "APIs for job runners to report run starts and completions")
@RequiredArgsConstructor
@Slf4j
public class ExecutionIngestionController {

    private final ExecutionIngestionService ingestionService;
    private final MeterRegistry meterRegistry;

    @PostMapping
    @Operation(summary = "Report a run start", description = "Called by the job runner when a run starts")
    public ResponseEntity<ExecutionResponse> startExecution(@Valid @RequestBody StartExecutionRequest request) {
        log.info("Start request for {}/{} (run: {})", request.getNamespace(), request.getName(), request.getRunName());

        meterRegistry.counter("api.executions.start.requests").increment();

        ExecutionRecord execution = ingestionService.startExecution(request);

        return ResponseEntity
                .created(URI.create("/api/v1/executions/" + execution.getId()))
                .body(toResponse(execution));
    }

    @PostMapping("/{executionId}/complete")
    @Operation(summary = "Report a run completion", description = "Called by the job runner when a run finishes")
    public ResponseEntity<ExecutionResponse> completeExecution(
            @PathVariable long executionId,
            @Valid @RequestBody CompleteExecutionRequest request) {

        log.info("Complete request for execution {} (succeeded: {})", executionId, request.getSucceeded());

        meterRegistry.counter("api.executions.complete.requests",
                "succeeded", String.valueOf(request.getSucceeded())
        ).increment();

        ExecutionRecord execution = ingestionService.completeExecution(executionId, request);

        return ResponseEntity.ok(toResponse(execution));
    }

    static ExecutionResponse toResponse(ExecutionRecord execution) {
        String status;
        if (execution.isRunning()) {
            status = "RUNNING";
        } else {
            status = execution.isSuccessful() ? "SUCCEEDED" : "FAILED";
        }
        return ExecutionResponse.builder()
                .id(execution.getId())
                .namespace(execution.getWorkload().getNamespace())
                .name(execution.getWorkload().getName())
                .runName(execution.getRunName())
                .status(status)
                .startTime(execution.getStartTime())
                .completionTime(execution.getCompletionTime())
                .durationMs(execution.getDuration() != null ? execution.getDuration().toMillis() : null)
                .exitCode(execution.getExitCode())
                .reason(execution.getReason())
                .build();
    }
}
