package com.cidery.ledger.application.config;

import com.cidery.ledger.domain.messaging.MessageProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;

/**
 * Messaging configuration
 * Selects the MessageProducer implementation from application.yml:
 *   ledger:
 *     messaging:
 *       type: kafka  # or none
 *
 * Or use environment variables:
 *   LEDGER_MESSAGING_TYPE=none
 */
@Configuration
public class MessagingConfig {

    private static final Logger log = LoggerFactory.getLogger(MessagingConfig.class);

    @Value("${ledger.messaging.type:kafka}")
    private String messagingType;

    @Bean
    @Primary
    public MessageProducer messageProducer(
            @Qualifier("kafkaMessageProducer") MessageProducer kafkaProducer,
            @Qualifier("loggingMessageProducer") MessageProducer loggingProducer) {

        String type = messagingType.toLowerCase();
        return switch (type) {
            case "kafka" -> kafkaProducer;
            case "none", "log" -> {
                log.info("Ledger events will be logged, not published");
                yield loggingProducer;
            }
            default -> throw new IllegalStateException("Unsupported ledger.messaging.type: " + messagingType);
        };
    }
}
