package com.company.guardian.dto.request;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CompleteExecutionRequest {
    @NotNull(message = "Succeeded flag is required")
    private Boolean succeeded;

    private Instant completionTime;
    private Integer exitCode;
    private String reason;
}
