package com.cidery.ledger.application.service;

import com.cidery.ledger.domain.event.LedgerEvent;
import com.cidery.ledger.domain.messaging.MessageProducer;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Publishes a ledger event once the command's transaction has committed.
 * A publishing failure is logged and counted; the ledger change stays committed.
 */
@Service
public class LedgerEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(LedgerEventPublisher.class);

    private final MessageProducer messageProducer;
    private final CircuitBreaker circuitBreaker;
    private final MetricsService metricsService;

    @Value("${ledger.topics.ledger-events:ledger-events}")
    private String ledgerEventsTopic;

    public LedgerEventPublisher(MessageProducer messageProducer,
                                @Qualifier("eventPublishingCircuitBreaker") CircuitBreaker circuitBreaker,
                                MetricsService metricsService) {
        this.messageProducer = messageProducer;
        this.circuitBreaker = circuitBreaker;
        this.metricsService = metricsService;
    }

    public void publishAfterCommit(LedgerOperation operation) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            publish(operation.toEvent());
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                publish(operation.toEvent());
            }
        });
    }

    void publish(LedgerEvent event) {
        try {
            circuitBreaker.executeRunnable(() ->
                    messageProducer.send(ledgerEventsTopic, event.getOperationId().toString(), event));
            metricsService.incrementEventPublished();
            log.debug("Published ledger event {} for operation {}", event.getOperation(), event.getOperationId());
        } catch (Exception e) {
            metricsService.incrementEventPublishFailure();
            log.error("Failed to publish ledger event for operation {} ({}): {}",
                    event.getOperationId(), event.getOperation(), e.getMessage(), e);
        }
    }
}
