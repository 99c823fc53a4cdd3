package com.cidery.ledger.domain.messaging;

/**
 * Abstraction for message producers.
 * Allows switching between Kafka and a log-only producer.
 */
public interface MessageProducer {

    /**
     * Send a message to a topic
     * @param topic The topic name
     * @param key The message key (for partitioning/ordering)
     * @param message The message payload
     */
    void send(String topic, String key, Object message);

    /**
     * Send a message without a key
     */
    default void send(String topic, Object message) {
        send(topic, null, message);
    }
}
