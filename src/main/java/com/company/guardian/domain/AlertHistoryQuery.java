package com.company.guardian.domain;

import com.company.guardian.domain.enums.AlertType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AlertHistoryQuery {
    private String namespace;
    private String name;
    private AlertType type;
    private Instant since;
    private boolean unresolvedOnly;

    @Builder.Default
    private int limit = 100;
}
