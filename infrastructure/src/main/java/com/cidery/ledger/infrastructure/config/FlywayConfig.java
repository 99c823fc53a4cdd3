package com.cidery.ledger.infrastructure.config;

import org.flywaydb.core.api.configuration.FluentConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.flyway.FlywayConfigurationCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Flyway configuration. Migrations live in a per-vendor directory under
 * db/migration and always run before Hibernate validates the schema.
 */
@Configuration
public class FlywayConfig {

    private static final Logger log = LoggerFactory.getLogger(FlywayConfig.class);

    @Value("${ledger.database.type:postgresql}")
    private String databaseType;

    @Bean
    public FlywayConfigurationCustomizer ledgerFlywayCustomizer() {
        return (FluentConfiguration configuration) -> {
            String location = "classpath:db/migration/" + databaseType.toLowerCase();
            log.info("Configuring Flyway migrations from {}", location);
            configuration.locations(location)
                    .baselineOnMigrate(true)
                    .validateOnMigrate(true);
        };
    }
}
