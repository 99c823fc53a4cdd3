package com.cidery.ledger.infrastructure.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.orm.jpa.HibernatePropertiesCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Hibernate settings for the ledger store.
 * Timestamps are written in UTC so period boundaries compare consistently,
 * and inserts are ordered so multi-entry operations batch well.
 */
@Configuration
public class JpaConfig {

    private static final Logger log = LoggerFactory.getLogger(JpaConfig.class);

    @Bean
    public HibernatePropertiesCustomizer hibernatePropertiesCustomizer() {
        return (Map<String, Object> hibernateProperties) -> {
            log.info("Configuring Hibernate for PostgreSQL with UTC timestamps");
            hibernateProperties.put("hibernate.dialect", "org.hibernate.dialect.PostgreSQLDialect");
            hibernateProperties.put("hibernate.jdbc.time_zone", "UTC");
            hibernateProperties.put("hibernate.order_inserts", "true");
            hibernateProperties.put("hibernate.jdbc.batch_size", "50");
        };
    }
}
