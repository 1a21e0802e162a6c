package com.company.guardian.analysis;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class RegressionResult {
    boolean detected;
    Duration baselineP95;
    Duration currentP95;
    double percentageIncrease;
    double threshold;
    String message;
}
