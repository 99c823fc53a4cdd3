package com.cidery.ledger.infrastructure.messaging.kafka;

import com.cidery.ledger.domain.messaging.MessageProducer;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;

/**
 * Kafka implementation of MessageProducer.
 * The current correlation id travels as a record header.
 */
@Component("kafkaMessageProducer")
public class KafkaMessageProducer implements MessageProducer {

    private static final Logger log = LoggerFactory.getLogger(KafkaMessageProducer.class);
    private static final String CORRELATION_ID_HEADER = "correlation-id";

    private final KafkaTemplate<String, Object> kafkaTemplate;

    public KafkaMessageProducer(KafkaTemplate<String, Object> kafkaTemplate) {
        this.kafkaTemplate = kafkaTemplate;
    }

    @Override
    public void send(String topic, String key, Object message) {
        try {
            ProducerRecord<String, Object> record = key != null
                    ? new ProducerRecord<>(topic, key, message)
                    : new ProducerRecord<>(topic, message);

            String correlationId = MDC.get("correlationId");
            if (correlationId != null) {
                record.headers().add(CORRELATION_ID_HEADER, correlationId.getBytes(StandardCharsets.UTF_8));
            }

            kafkaTemplate.send(record);
            log.debug("Sent message to topic: {}, key: {}", topic, key);
        } catch (Exception e) {
            log.error("Failed to send message to topic: {}", topic, e);
            throw new RuntimeException("Failed to send message to Kafka", e);
        }
    }
}
