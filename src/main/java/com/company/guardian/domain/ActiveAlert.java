package com.company.guardian.domain;

import com.company.guardian.domain.enums.AlertType;
import com.company.guardian.domain.enums.Severity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ActiveAlert {
    private AlertType type;
    private Severity severity;
    private String message;
    private Instant since;
}
