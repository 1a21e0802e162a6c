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
public class ChannelStatusResponse {
    private String name;
    private String type;
    private boolean healthy;
    private long alertsSentTotal;
    private long alertsFailedTotal;
    private int consecutiveFailures;
    private Instant lastAlertTime;
    private Instant lastFailedTime;
    private String lastFailedError;
}
