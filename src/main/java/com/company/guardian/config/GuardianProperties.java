package com.company.guardian.config;

import com.company.guardian.alerting.channel.ChannelDefinition;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Engine settings bound from {@code guardian.*}.
 */
@Data
@Component
@Validated
@ConfigurationProperties(prefix = "guardian")
public class GuardianProperties {

    @Valid
    private Scheduler scheduler = new Scheduler();

    @Valid
    private RateLimits rateLimits = new RateLimits();

    @Valid
    private HistoryRetention historyRetention = new HistoryRetention();

    private LeaderElection leaderElection = new LeaderElection();

    @Valid
    private List<ChannelDefinition> channels = new ArrayList<>();

    @Data
    public static class Scheduler {
        @NotNull
        private Duration deadManInterval = Duration.ofMinutes(1);
        @NotNull
        private Duration slaRecalculationInterval = Duration.ofMinutes(5);
        @NotNull
        private Duration stuckCheckInterval = Duration.ofMinutes(1);
        @NotNull
        private Duration pruneInterval = Duration.ofHours(1);

        // No evaluation before this has elapsed after start
        @NotNull
        private Duration startupGracePeriod = Duration.ZERO;

        @Min(4)
        private int poolSize = 4;
    }

    @Data
    public static class RateLimits {
        @Min(1)
        private int maxAlertsPerMinute = 50;
        @Min(1)
        private int globalBurst = 10;
        @Min(1)
        private int defaultChannelBurst = 10;
        @Min(1)
        private int defaultChannelMaxPerHour = 100;
    }

    @Data
    public static class HistoryRetention {
        @Min(1)
        private int defaultDays = 30;
    }

    @Data
    public static class LeaderElection {
        private boolean enabled = false;
        // Lock region shared by all replicas of one deployment
        @NotNull
        private String region = "workload-guardian";
        // A lock not refreshed within this time is taken over by another replica
        @NotNull
        private Duration lockTimeToLive = Duration.ofSeconds(10);
        @NotNull
        private Duration heartBeat = Duration.ofMillis(500);
    }
}
