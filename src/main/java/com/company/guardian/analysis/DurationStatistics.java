package com.company.guardian.analysis;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

/**
 * Order statistics over run durations.
 *
 * <p>Percentiles use nearest rank on durations sorted ascending: {@code rank = ceil(p/100 * n)},
 * clamped to [1, n], value is the element at {@code rank - 1}. Equal inputs always give equal
 * results regardless of input order.
 */
public final class DurationStatistics {

    private DurationStatistics() {
    }

    public static Duration percentile(Collection<Duration> durations, double percentile) {
        if (durations == null || durations.isEmpty()) {
            throw new IllegalArgumentException("no durations");
        }
        if (percentile <= 0 || percentile > 100) {
            throw new IllegalArgumentException("percentile must be in (0, 100]: " + percentile);
        }
        List<Duration> sorted = new ArrayList<>(durations);
        Collections.sort(sorted);
        return sorted.get(rankIndex(sorted.size(), percentile));
    }

    public static Duration average(Collection<Duration> durations) {
        if (durations == null || durations.isEmpty()) {
            return Duration.ZERO;
        }
        long totalNanos = 0;
        for (Duration d : durations) {
            totalNanos += d.toNanos();
        }
        return Duration.ofNanos(totalNanos / durations.size());
    }

    static int rankIndex(int n, double percentile) {
        int rank = (int) Math.ceil(percentile / 100.0 * n);
        return Math.min(Math.max(rank, 1), n) - 1;
    }
}
