package com.cidery.ledger.infrastructure.messaging.logging;

import com.cidery.ledger.domain.messaging.MessageProducer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Producer used when no broker is configured (ledger.messaging.type=none).
 * Messages are only logged.
 */
@Component("loggingMessageProducer")
public class LoggingMessageProducer implements MessageProducer {

    private static final Logger log = LoggerFactory.getLogger(LoggingMessageProducer.class);

    @Override
    public void send(String topic, String key, Object message) {
        log.info("Message for topic {} (key {}): {}", topic, key, message);
    }
}
