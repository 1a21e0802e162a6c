package com.company.guardian.analysis;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SlaViolation {
    ViolationType type;
    String message;
    double current;
    double threshold;
}
