package com.company.guardian.dto.request;

import com.company.guardian.domain.ActiveAlert;
import com.company.guardian.domain.monitor.MonitorConfig;
import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterWorkloadRequest {
    @NotBlank(message = "Namespace is required")
    private String namespace;

    @NotBlank(message = "Workload name is required")
    private String name;

    @NotBlank(message = "Schedule is required")
    private String schedule;

    private String timezone;
    private boolean suspended;
    private Instant createdAt;
    private Instant lastSuccessfulTime;

    private String monitorName;
    private MonitorConfig monitor;

    @Builder.Default
    private List<ActiveAlert> activeAlerts = new ArrayList<>();
}
