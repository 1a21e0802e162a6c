package com.company.guardian.analysis;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DurationStatisticsTest {

    private static List<Duration> seconds(int from, int to) {
        List<Duration> durations = new ArrayList<>();
        for (int i = from; i <= to; i++) {
            durations.add(Duration.ofSeconds(i));
        }
        return durations;
    }

    @Test
    void nearestRankOverOneToTen() {
        List<Duration> durations = seconds(1, 10);

        assertThat(DurationStatistics.percentile(durations, 50)).isEqualTo(Duration.ofSeconds(5));
        assertThat(DurationStatistics.percentile(durations, 95)).isEqualTo(Duration.ofSeconds(10));
        assertThat(DurationStatistics.percentile(durations, 99)).isEqualTo(Duration.ofSeconds(10));
        assertThat(DurationStatistics.percentile(durations, 10)).isEqualTo(Duration.ofSeconds(1));
    }

    @Test
    void singleValueIsEveryPercentile() {
        List<Duration> one = List.of(Duration.ofMinutes(3));

        assertThat(DurationStatistics.percentile(one, 1)).isEqualTo(Duration.ofMinutes(3));
        assertThat(DurationStatistics.percentile(one, 100)).isEqualTo(Duration.ofMinutes(3));
    }

    @Test
    void inputOrderDoesNotMatter() {
        List<Duration> shuffled = seconds(1, 100);
        Collections.shuffle(shuffled, new Random(42));

        assertThat(DurationStatistics.percentile(shuffled, 95)).isEqualTo(Duration.ofSeconds(95));
        assertThat(DurationStatistics.percentile(shuffled, 50)).isEqualTo(Duration.ofSeconds(50));
    }

    @Test
    void emptyInputIsRejected() {
        assertThatThrownBy(() -> DurationStatistics.percentile(List.of(), 95))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DurationStatistics.percentile(seconds(1, 3), 0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void averageOfDurations() {
        assertThat(DurationStatistics.average(seconds(1, 10))).isEqualTo(Duration.ofMillis(5500));
        assertThat(DurationStatistics.average(List.of())).isEqualTo(Duration.ZERO);
    }
}
