package com.company.guardian.service;

import com.company.guardian.domain.ExecutionRecord;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.dto.request.CompleteExecutionRequest;
import com.company.guardian.dto.request.StartExecutionRequest;
import com.company.guardian.event.ExecutionCompletedEvent;
import com.company.guardian.event.ExecutionStartedEvent;
import com.company.guardian.exception.ExecutionNotFoundException;
import com.company.guardian.repository.ExecutionStore;
import com.company.guardian.workload.InMemoryTrackedWorkloadProvider;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Service
@Slf4j
@RequiredArgsConstructor
public class ExecutionIngestionService {

    private final ExecutionStore store;
    private final InMemoryTrackedWorkloadProvider workloadProvider;
    private final ApplicationEventPublisher eventPublisher;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @Transactional
    public ExecutionRecord startExecution(StartExecutionRequest request) {
        WorkloadRef workload = WorkloadRef.of(request.getNamespace(), request.getName());
        Instant startTime = request.getStartTime() != null ? request.getStartTime() : clock.instant();

        if (request.getRunName() != null) {
            Optional<ExecutionRecord> existing = store.getExecutions(workload, startTime).stream()
                    .filter(e -> request.getRunName().equals(e.getRunName()))
                    .findFirst();
            if (existing.isPresent()) {
                log.info("Duplicate start request for run {} of {}", request.getRunName(), workload);
                meterRegistry.counter("guardian.executions.start.duplicate").increment();
                return existing.get();
            }
        }

        ExecutionRecord execution = store.startExecution(ExecutionRecord.builder()
                .workload(workload)
                .runName(request.getRunName())
                .startTime(startTime)
                .build());

        eventPublisher.publishEvent(new ExecutionStartedEvent(execution));

        meterRegistry.counter("guardian.executions.started",
                "namespace", workload.getNamespace()
        ).increment();

        log.info("Execution {} started for {} (run: {})", execution.getId(), workload, execution.getRunName());
        return execution;
    }

    @Transactional
    public ExecutionRecord completeExecution(long executionId, CompleteExecutionRequest request) {
        ExecutionRecord execution = store.findExecution(executionId)
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));

        if (!execution.isRunning()) {
            log.info("Execution {} already completed", executionId);
            meterRegistry.counter("guardian.executions.complete.duplicate").increment();
            return execution;
        }

        Instant completionTime = request.getCompletionTime() != null ? request.getCompletionTime() : clock.instant();
        boolean succeeded = Boolean.TRUE.equals(request.getSucceeded());

        ExecutionRecord completed = store.completeExecution(executionId, completionTime, succeeded,
                        request.getExitCode(), request.getReason())
                .orElseThrow(() -> new ExecutionNotFoundException(executionId));

        if (completed.isSuccessful()) {
            workloadProvider.recordSuccess(completed.getWorkload(), completed.getCompletionTime());
        }

        meterRegistry.counter("guardian.executions.completed",
                "namespace", completed.getWorkload().getNamespace(),
                "succeeded", String.valueOf(completed.isSuccessful())
        ).increment();

        eventPublisher.publishEvent(new ExecutionCompletedEvent(completed));

        log.info("Execution {} of {} completed (succeeded: {}, duration: {})",
                executionId, completed.getWorkload(), completed.isSuccessful(), completed.getDuration());
        return completed;
    }
}
