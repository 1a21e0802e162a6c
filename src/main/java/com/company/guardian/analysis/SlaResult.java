package com.company.guardian.analysis;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SlaResult {
    boolean passed;
    double successRate;
    double minRequired;
    @Singular
    List<SlaViolation> violations;

    public static SlaResult passing() {
        return SlaResult.builder().passed(true).build();
    }
}
