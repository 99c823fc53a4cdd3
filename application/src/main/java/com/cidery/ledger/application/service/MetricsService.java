package com.cidery.ledger.application.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

/**
 * Service for recording ledger metrics
 */
@Service
public class MetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter invariantViolationsCounter;
    private final Counter conflictRetriesCounter;
    private final Counter auditEntriesCounter;
    private final Counter eventsPublishedCounter;
    private final Counter eventPublishFailuresCounter;

    public MetricsService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.invariantViolationsCounter = Counter.builder("ledger.invariant.violations")
                .description("Batches whose projection disagreed with the transaction log")
                .register(meterRegistry);

        this.conflictRetriesCounter = Counter.builder("ledger.conflicts.retried")
                .description("Ledger commands retried after a concurrent modification")
                .register(meterRegistry);

        this.auditEntriesCounter = Counter.builder("ledger.audit.entries")
                .description("Audit log entries written")
                .register(meterRegistry);

        this.eventsPublishedCounter = Counter.builder("ledger.events.published")
                .description("Ledger events handed to the message producer")
                .register(meterRegistry);

        this.eventPublishFailuresCounter = Counter.builder("ledger.events.failed")
                .description("Ledger events that could not be published")
                .register(meterRegistry);
    }

    public void incrementOperation(String operation) {
        meterRegistry.counter("ledger.operations", "operation", operation).increment();
    }

    public void incrementRejected(String operation, String code) {
        meterRegistry.counter("ledger.operations.rejected", "operation", operation, "code", code).increment();
    }

    public void incrementWarning(String type) {
        meterRegistry.counter("ledger.warnings", "type", type).increment();
    }

    public void incrementInvariantViolation() {
        invariantViolationsCounter.increment();
    }

    public void incrementConflictRetry() {
        conflictRetriesCounter.increment();
    }

    public void incrementAuditEntry() {
        auditEntriesCounter.increment();
    }

    public void incrementEventPublished() {
        eventsPublishedCounter.increment();
    }

    public void incrementEventPublishFailure() {
        eventPublishFailuresCounter.increment();
    }

    public void recordCommandTime(Timer.Sample sample, String operation, String outcome) {
        sample.stop(Timer.builder("ledger.command.time")
                .description("Ledger command processing time")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(meterRegistry));
    }

    public Timer.Sample startTimer() {
        return Timer.start(meterRegistry);
    }
}
