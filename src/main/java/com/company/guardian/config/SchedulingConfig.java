package com.company.guardian.config;

import com.company.guardian.scheduled.LeadershipGate;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;

@Configuration
public class SchedulingConfig {

    public static final String EVENT_EXECUTOR = "guardianEventExecutor";

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Shared by the coordinators, the dispatcher's delay timers and its hourly cleanup. Each
     * coordinator holds its own task, so the pool must be at least as large as their number.
     */
    @Bean(name = "guardianTaskScheduler")
    @Primary
    public ThreadPoolTaskScheduler guardianTaskScheduler(GuardianProperties properties, Clock clock) {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(properties.getScheduler().getPoolSize());
        scheduler.setThreadNamePrefix("guardian-");
        scheduler.setClock(clock);
        scheduler.setRemoveOnCancelPolicy(true);
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    /**
     * Runs {@code @Async} event listeners, keeping channel I/O off request threads and out of the
     * coordinators' pool.
     */
    @Bean(name = EVENT_EXECUTOR)
    public ThreadPoolTaskExecutor guardianEventExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(1000);
        executor.setThreadNamePrefix("guardian-events-");
        return executor;
    }

    @Bean
    public LeadershipGate leadershipGate(GuardianProperties properties) {
        return new LeadershipGate(!properties.getLeaderElection().isEnabled());
    }
}
