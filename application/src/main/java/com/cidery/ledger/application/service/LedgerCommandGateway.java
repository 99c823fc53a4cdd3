package com.cidery.ledger.application.service;

import com.cidery.ledger.domain.command.AssignBatchCommand;
import com.cidery.ledger.domain.command.BlendOperation;
import com.cidery.ledger.domain.command.ChangeBatchStatusCommand;
import com.cidery.ledger.domain.command.ChangeVesselStatusCommand;
import com.cidery.ledger.domain.command.ReconcilePeriodCommand;
import com.cidery.ledger.domain.command.RecordFillCommand;
import com.cidery.ledger.domain.command.RecordLossCommand;
import com.cidery.ledger.domain.command.RecordRemovalCommand;
import com.cidery.ledger.domain.command.RegisterBatchCommand;
import com.cidery.ledger.domain.command.RegisterVesselCommand;
import com.cidery.ledger.domain.command.SplitBatchCommand;
import com.cidery.ledger.domain.command.TransferVolumeCommand;
import com.cidery.ledger.domain.command.VolumeAdjustmentCommand;
import com.cidery.ledger.domain.exception.ConcurrentLedgerModificationException;
import com.cidery.ledger.domain.exception.LedgerException;
import com.cidery.ledger.domain.model.Batch;
import com.cidery.ledger.domain.model.BlendResult;
import com.cidery.ledger.domain.model.LedgerResult;
import com.cidery.ledger.domain.model.ReconciliationSnapshot;
import com.cidery.ledger.domain.model.Vessel;
import io.github.resilience4j.retry.Retry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.ConcurrencyFailureException;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.function.Supplier;

/**
 * Entry point for every ledger command.
 *
 * Each call runs the command in its own transaction, retries it a bounded number of
 * times when it lost a race with a concurrent command, and records its outcome.
 * Not transactional itself, so commit-time failures reach the retry.
 */
@Service
public class LedgerCommandGateway {

    private static final Logger log = LoggerFactory.getLogger(LedgerCommandGateway.class);

    private static final List<String> RACE_CONSTRAINTS =
            List.of("uk_transaction_entries_batch_seq", "uk_occupancies_active_vessel");

    private final LedgerService ledgerService;
    private final BlendingService blendingService;
    private final ReconciliationService reconciliationService;
    private final CorrelationIdService correlationIdService;
    private final MetricsService metricsService;
    private final Retry ledgerRetry;

    public LedgerCommandGateway(LedgerService ledgerService,
                                BlendingService blendingService,
                                ReconciliationService reconciliationService,
                                CorrelationIdService correlationIdService,
                                MetricsService metricsService,
                                @Qualifier("ledgerRetry") Retry ledgerRetry) {
        this.ledgerService = ledgerService;
        this.blendingService = blendingService;
        this.reconciliationService = reconciliationService;
        this.correlationIdService = correlationIdService;
        this.metricsService = metricsService;
        this.ledgerRetry = ledgerRetry;
        this.ledgerRetry.getEventPublisher().onRetry(event -> {
            metricsService.incrementConflictRetry();
            log.warn("Retrying ledger command after conflict (attempt {}): {}",
                    event.getNumberOfRetryAttempts(), event.getLastThrowable().getMessage());
        });
    }

    public LedgerResult<Vessel> registerVessel(RegisterVesselCommand command) {
        return execute("REGISTER_VESSEL", () -> ledgerService.registerVessel(command));
    }

    public LedgerResult<Batch> registerBatch(RegisterBatchCommand command) {
        return execute("REGISTER_BATCH", () -> ledgerService.registerBatch(command));
    }

    public LedgerResult<Batch> assignBatchToVessel(AssignBatchCommand command) {
        return execute("ASSIGN", () -> ledgerService.assign(command));
    }

    public LedgerResult<Batch> recordFill(RecordFillCommand command) {
        return execute("FILL", () -> ledgerService.recordFill(command));
    }

    public LedgerResult<Batch> transferVolume(TransferVolumeCommand command) {
        return execute("TRANSFER", () -> ledgerService.transfer(command));
    }

    public LedgerResult<Batch> recordVolumeAdjustment(VolumeAdjustmentCommand command) {
        return execute("ADJUST", () -> ledgerService.adjust(command));
    }

    public LedgerResult<Batch> recordLoss(RecordLossCommand command) {
        return execute("LOSS", () -> ledgerService.recordLoss(command));
    }

    public LedgerResult<Batch> recordRemoval(RecordRemovalCommand command) {
        return execute("REMOVAL", () -> ledgerService.recordRemoval(command));
    }

    public LedgerResult<Batch> splitBatch(SplitBatchCommand command) {
        return execute("SPLIT", () -> ledgerService.split(command));
    }

    public LedgerResult<Vessel> changeVesselStatus(ChangeVesselStatusCommand command) {
        return execute("VESSEL_STATUS", () -> ledgerService.changeVesselStatus(command));
    }

    public LedgerResult<Batch> changeBatchStatus(ChangeBatchStatusCommand command) {
        return execute("BATCH_STATUS", () -> ledgerService.changeBatchStatus(command));
    }

    public LedgerResult<BlendResult> createBlend(BlendOperation command) {
        return execute("BLEND", () -> blendingService.applyBlend(command));
    }

    public LedgerResult<ReconciliationSnapshot> reconcilePeriod(ReconcilePeriodCommand command) {
        return execute("RECONCILE", () -> reconciliationService.reconcile(command));
    }

    private <T> LedgerResult<T> execute(String operation, Supplier<LedgerResult<T>> command) {
        correlationIdService.getOrCreateCorrelationId();
        correlationIdService.setCausationId(operation);
        Timer.Sample sample = metricsService.startTimer();
        try {
            LedgerResult<T> result = Retry.decorateSupplier(ledgerRetry, () -> translate(command)).get();
            metricsService.incrementOperation(operation);
            result.getWarnings().forEach(warning -> metricsService.incrementWarning(warning.getType().name()));
            metricsService.recordCommandTime(sample, operation, "success");
            return result;
        } catch (LedgerException e) {
            metricsService.incrementRejected(operation, e.getCode());
            metricsService.recordCommandTime(sample, operation, "rejected");
            log.warn("Ledger command {} rejected [{}]: {}", operation, e.getCode(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            metricsService.incrementRejected(operation, "UNEXPECTED");
            metricsService.recordCommandTime(sample, operation, "failed");
            log.error("Ledger command {} failed", operation, e);
            throw e;
        } finally {
            correlationIdService.clearCausationId();
        }
    }

    /**
     * Concurrent writers are detected by the version columns and by the unique constraints
     * on entry sequence and active occupancy, at flush or commit. Both surface as a
     * retryable conflict. Any other integrity violation propagates unchanged.
     */
    private static <T> T translate(Supplier<T> command) {
        try {
            return command.get();
        } catch (ConcurrencyFailureException e) {
            throw conflict(e);
        } catch (DataIntegrityViolationException e) {
            if (isRaceConstraint(e)) {
                throw conflict(e);
            }
            throw e;
        }
    }

    private static boolean isRaceConstraint(DataIntegrityViolationException e) {
        String message = e.getMostSpecificCause().getMessage();
        return message != null && RACE_CONSTRAINTS.stream().anyMatch(message::contains);
    }

    private static ConcurrentLedgerModificationException conflict(DataAccessException e) {
        return new ConcurrentLedgerModificationException(
                "Ledger record was modified concurrently: " + e.getMostSpecificCause().getMessage(), e);
    }
}
