package com.company.guardian.alerting;

import lombok.Value;

@Value
public class SuppressionCheck {
    boolean suppressed;
    String reason;

    public static SuppressionCheck notSuppressed() {
        return new SuppressionCheck(false, null);
    }

    public static SuppressionCheck suppressed(String reason) {
        return new SuppressionCheck(true, reason);
    }
}
