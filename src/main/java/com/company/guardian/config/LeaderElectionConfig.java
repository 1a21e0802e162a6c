package com.company.guardian.config;

import com.company.guardian.scheduled.LeadershipCandidate;
import com.company.guardian.scheduled.LeadershipGate;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.integration.jdbc.lock.DefaultLockRepository;
import org.springframework.integration.jdbc.lock.JdbcLockRegistry;
import org.springframework.integration.support.leader.LockRegistryLeaderInitiator;

import javax.sql.DataSource;

/**
 * Leader election over the shared database. One replica at a time holds the
 * {@code INT_LOCK} row for {@link LeadershipCandidate#ROLE} and runs the leader-only coordinators.
 */
@Configuration
@Slf4j
@ConditionalOnProperty(prefix = "guardian.leader-election", name = "enabled", havingValue = "true")
public class LeaderElectionConfig {

    @Bean
    public DefaultLockRepository leaderLockRepository(DataSource dataSource, GuardianProperties properties) {
        GuardianProperties.LeaderElection leaderElection = properties.getLeaderElection();
        DefaultLockRepository repository = new DefaultLockRepository(dataSource);
        repository.setRegion(leaderElection.getRegion());
        repository.setTimeToLive((int) leaderElection.getLockTimeToLive().toMillis());
        return repository;
    }

    @Bean
    public JdbcLockRegistry leaderLockRegistry(DefaultLockRepository leaderLockRepository) {
        return new JdbcLockRegistry(leaderLockRepository);
    }

    @Bean
    public LockRegistryLeaderInitiator leaderInitiator(JdbcLockRegistry leaderLockRegistry,
                                                       LeadershipGate leadershipGate,
                                                       GuardianProperties properties) {
        LockRegistryLeaderInitiator initiator =
                new LockRegistryLeaderInitiator(leaderLockRegistry, new LeadershipCandidate(leadershipGate));
        initiator.setHeartBeatMillis(properties.getLeaderElection().getHeartBeat().toMillis());
        log.info("Leader election enabled in region {}", properties.getLeaderElection().getRegion());
        return initiator;
    }
}
