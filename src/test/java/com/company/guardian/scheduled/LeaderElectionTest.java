package com.company.guardian.scheduled;

import com.company.guardian.alerting.AlertDispatcher;
import com.company.guardian.analysis.RegressionResult;
import com.company.guardian.analysis.SlaAnalyzer;
import com.company.guardian.analysis.SlaResult;
import com.company.guardian.config.GuardianProperties;
import com.company.guardian.config.LeaderElectionConfig;
import com.company.guardian.domain.ExecutionMetrics;
import com.company.guardian.domain.TrackedWorkload;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.domain.monitor.AlertingConfig;
import com.company.guardian.domain.monitor.MonitorConfig;
import com.company.guardian.domain.monitor.SlaConfig;
import com.company.guardian.repository.ExecutionStore;
import com.company.guardian.schedule.MaintenanceWindowEvaluator;
import com.company.guardian.workload.InMemoryTrackedWorkloadProvider;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Import;
import org.springframework.integration.support.leader.LockRegistryLeaderInitiator;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseBuilder;
import org.springframework.jdbc.datasource.embedded.EmbeddedDatabaseType;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@SpringJUnitConfig(LeaderElectionTest.Config.class)
@TestPropertySource(properties = "guardian.leader-election.enabled=true")
class LeaderElectionTest {

    private static final WorkloadRef REF = WorkloadRef.of("etl", "hourly-sync");

    @Autowired
    private LeadershipGate leadershipGate;

    @Autowired
    private SlaAnalyzer slaAnalyzer;

    @Autowired
    private LockRegistryLeaderInitiator leaderInitiator;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    private static void await(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(20);
        }
    }

    @Test
    void slaRecalculationRunsOnceLeadershipIsAcquired() throws InterruptedException {
        await(leadershipGate::isLeader);

        assertThat(leadershipGate.isLeader()).isTrue();
        assertThat(jdbcTemplate.queryForObject("SELECT COUNT(*) FROM INT_LOCK WHERE REGION = 'workload-guardian'",
                Integer.class)).isEqualTo(1);
        verify(slaAnalyzer, timeout(5000).atLeastOnce()).getMetrics(eq(REF), anyInt());
    }

    @Test
    @DirtiesContext
    void stoppingTheInitiatorClosesTheGate() throws InterruptedException {
        await(leadershipGate::isLeader);
        assertThat(leadershipGate.isLeader()).isTrue();

        leaderInitiator.stop();
        await(() -> !leadershipGate.isLeader());

        assertThat(leadershipGate.isLeader()).isFalse();
    }

    @Test
    void noLockIsTakenWhenElectionIsDisabled() {
        new ApplicationContextRunner()
                .withUserConfiguration(LeaderElectionConfig.class)
                .run(context -> assertThat(context).doesNotHaveBean(LockRegistryLeaderInitiator.class));
    }

    @Configuration
    @Import(LeaderElectionConfig.class)
    static class Config {

        @Bean
        DataSource dataSource() {
            return new EmbeddedDatabaseBuilder()
                    .generateUniqueName(true)
                    .setType(EmbeddedDatabaseType.H2)
                    .addScript("schema.sql")
                    .build();
        }

        @Bean
        PlatformTransactionManager transactionManager(DataSource dataSource) {
            return new DataSourceTransactionManager(dataSource);
        }

        @Bean
        JdbcTemplate jdbcTemplate(DataSource dataSource) {
            return new JdbcTemplate(dataSource);
        }

        @Bean
        GuardianProperties guardianProperties() {
            GuardianProperties properties = new GuardianProperties();
            properties.getLeaderElection().setEnabled(true);
            properties.getScheduler().setSlaRecalculationInterval(Duration.ofMillis(100));
            return properties;
        }

        @Bean
        LeadershipGate leadershipGate() {
            return new LeadershipGate(false);
        }

        @Bean
        ThreadPoolTaskScheduler taskScheduler() {
            ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
            scheduler.setPoolSize(2);
            scheduler.setThreadNamePrefix("leader-test-");
            return scheduler;
        }

        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }

        @Bean
        SlaAnalyzer slaAnalyzer() {
            SlaAnalyzer analyzer = mock(SlaAnalyzer.class);
            when(analyzer.getMetrics(any(), anyInt()))
                    .thenReturn(ExecutionMetrics.builder().windowDays(7).totalRuns(10).successfulRuns(10).successRate(100.0).build());
            when(analyzer.checkSla(any(), any())).thenReturn(SlaResult.passing());
            when(analyzer.checkDurationRegression(any(), any())).thenReturn(RegressionResult.builder().detected(false).build());
            return analyzer;
        }

        @Bean
        InMemoryTrackedWorkloadProvider workloadProvider() {
            InMemoryTrackedWorkloadProvider provider = new InMemoryTrackedWorkloadProvider();
            provider.register(TrackedWorkload.builder()
                    .ref(REF)
                    .schedule("@hourly")
                    .createdAt(Instant.now().minus(Duration.ofDays(20)))
                    .monitor(MonitorConfig.builder()
                            .sla(SlaConfig.builder().minSuccessRate(95.0).build())
                            .alerting(AlertingConfig.builder().build())
                            .build())
                    .build());
            return provider;
        }

        @Bean
        SlaRecalculationScheduler slaRecalculationScheduler(InMemoryTrackedWorkloadProvider provider,
                                                            SlaAnalyzer analyzer,
                                                            LeadershipGate leadershipGate,
                                                            GuardianProperties properties,
                                                            ThreadPoolTaskScheduler taskScheduler,
                                                            MeterRegistry meterRegistry) {
            Clock clock = Clock.systemUTC();
            return new SlaRecalculationScheduler(provider, analyzer, new MaintenanceWindowEvaluator(),
                    new WorkloadAlerts(mock(AlertDispatcher.class), mock(ExecutionStore.class), meterRegistry, clock),
                    leadershipGate, properties, clock, taskScheduler, meterRegistry);
        }
    }
}
