package com.company.guardian.dto.response;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExecutionResponse {
    private Long id;
    private String namespace;
    private String name;
    private String runName;
    private String status;
    private Instant startTime;
    private Instant completionTime;
    private Long durationMs;
    private Integer exitCode;
    private String reason;
}
