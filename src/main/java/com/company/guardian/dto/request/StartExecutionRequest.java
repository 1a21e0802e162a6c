package com.company.guardian.dto.request;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Reported by the job runner when a run starts.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class StartExecutionRequest {
    @NotBlank(message = "Namespace is required")
    private String namespace;

    @NotBlank(message = "Workload name is required")
    private String name;

    // Runner-side identifier, used to detect duplicate start reports
    private String runName;

    // Defaults to the time the request is received
    private Instant startTime;
}
