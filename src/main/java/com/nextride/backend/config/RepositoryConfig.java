package com.nextride.backend.config;

import com.nextride.backend.repository.AlertRepository;
import com.nextride.backend.repository.RealtimeRepository;
import com.nextride.backend.repository.StaticDataRepository;
import com.nextride.backend.repository.SubscriptionRepository;
import com.nextride.backend.repository.jdbc.JdbcAlertRepository;
import com.nextride.backend.repository.jdbc.JdbcRealtimeRepository;
import com.nextride.backend.repository.jdbc.JdbcStaticDataRepository;
import com.nextride.backend.repository.jdbc.JdbcSubscriptionRepository;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Configuration for repository beans.
 * All repositories share the single pooled DataSource behind the
 * auto-configured NamedParameterJdbcTemplate.
 */
@Configuration
public class RepositoryConfig {

    @Bean
    public RealtimeRepository realtimeRepository(NamedParameterJdbcTemplate jdbc,
            TransactionTemplate transactionTemplate) {
        return new JdbcRealtimeRepository(jdbc, transactionTemplate);
    }

    @Bean
    public AlertRepository alertRepository(NamedParameterJdbcTemplate jdbc,
            TransactionTemplate transactionTemplate) {
        return new JdbcAlertRepository(jdbc, transactionTemplate);
    }

    @Bean
    public SubscriptionRepository subscriptionRepository(NamedParameterJdbcTemplate jdbc) {
        return new JdbcSubscriptionRepository(jdbc);
    }

    @Bean
    public StaticDataRepository staticDataRepository(NamedParameterJdbcTemplate jdbc) {
        return new JdbcStaticDataRepository(jdbc);
    }
}
