package com.cidery.ledger.application.service;

import com.cidery.ledger.application.config.ResiliencyConfig;
import com.cidery.ledger.domain.command.RecordLossCommand;
import com.cidery.ledger.domain.command.TransferVolumeCommand;
import com.cidery.ledger.domain.exception.ConcurrentLedgerModificationException;
import com.cidery.ledger.domain.exception.InsufficientVolumeException;
import com.cidery.ledger.domain.model.Batch;
import com.cidery.ledger.domain.model.LedgerResult;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.orm.ObjectOptimisticLockingFailureException;

import java.math.BigDecimal;
import java.sql.SQLException;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

/**
 * Retry and outcome handling around ledger commands
 */
@ExtendWith(MockitoExtension.class)
class LedgerCommandGatewayTest {

    @Mock
    private LedgerService ledgerService;
    @Mock
    private BlendingService blendingService;
    @Mock
    private ReconciliationService reconciliationService;

    private SimpleMeterRegistry meterRegistry;
    private LedgerCommandGateway gateway;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        Retry retry = new ResiliencyConfig().ledgerRetry(RetryRegistry.ofDefaults(), 3, 1);
        gateway = new LedgerCommandGateway(ledgerService, blendingService, reconciliationService,
                new CorrelationIdService(), new MetricsService(meterRegistry), retry);
    }

    @Test
    void testOptimisticLockFailureRetried() {
        LedgerResult<Batch> ok = LedgerResult.of(Batch.builder().id("B1").build());
        when(ledgerService.transfer(any()))
                .thenThrow(new ObjectOptimisticLockingFailureException(Batch.class, "B1"))
                .thenReturn(ok);

        LedgerResult<Batch> result = gateway.transferVolume(TransferVolumeCommand.builder().batchId("B1").build());

        assertSame(ok, result);
        verify(ledgerService, times(2)).transfer(any());
    }

    @Test
    void testPersistentConflictSurfacesAfterMaxAttempts() {
        when(ledgerService.transfer(any())).thenThrow(new ObjectOptimisticLockingFailureException(Batch.class, "B1"));

        ConcurrentLedgerModificationException e = assertThrows(ConcurrentLedgerModificationException.class,
                () -> gateway.transferVolume(TransferVolumeCommand.builder().batchId("B1").build()));

        assertTrue(e.isRetryable());
        verify(ledgerService, times(3)).transfer(any());
    }

    @Test
    void testStaleExpectedVersionNotRetried() {
        when(ledgerService.transfer(any()))
                .thenThrow(new ConcurrentLedgerModificationException("Batch", "B1", 2L, 3L));

        assertThrows(ConcurrentLedgerModificationException.class,
                () -> gateway.transferVolume(TransferVolumeCommand.builder().batchId("B1").expectedVersion(2L).build()));

        verify(ledgerService, times(1)).transfer(any());
    }

    @Test
    void testValidationFailureNotRetriedAndCounted() {
        when(ledgerService.recordLoss(any()))
                .thenThrow(new InsufficientVolumeException("B1", "T1", new BigDecimal("50"), new BigDecimal("10")));

        assertThrows(InsufficientVolumeException.class,
                () -> gateway.recordLoss(RecordLossCommand.builder().batchId("B1").build()));

        verify(ledgerService, times(1)).recordLoss(any());
        assertEquals(1, meterRegistry.find("ledger.operations.rejected").counters().size());
    }

    @Test
    void testDuplicateEntrySequenceRetried() {
        LedgerResult<Batch> ok = LedgerResult.of(Batch.builder().id("B1").build());
        when(ledgerService.recordLoss(any()))
                .thenThrow(integrityViolation("duplicate key value violates unique constraint "
                        + "\"uk_transaction_entries_batch_seq\""))
                .thenReturn(ok);

        assertSame(ok, gateway.recordLoss(RecordLossCommand.builder().batchId("B1").build()));
        verify(ledgerService, times(2)).recordLoss(any());
    }

    @Test
    void testSecondActiveOccupancyRetried() {
        when(ledgerService.transfer(any())).thenThrow(integrityViolation(
                "duplicate key value violates unique constraint \"uk_occupancies_active_vessel\""));

        assertThrows(ConcurrentLedgerModificationException.class,
                () -> gateway.transferVolume(TransferVolumeCommand.builder().batchId("B1").build()));

        verify(ledgerService, times(3)).transfer(any());
    }

    @Test
    void testOtherIntegrityViolationPropagatesUnchanged() {
        DataIntegrityViolationException violation = integrityViolation(
                "null value in column \"vessel_id\" of relation \"transaction_entries\" violates not-null constraint");
        when(ledgerService.recordLoss(any())).thenThrow(violation);

        DataIntegrityViolationException e = assertThrows(DataIntegrityViolationException.class,
                () -> gateway.recordLoss(RecordLossCommand.builder().batchId("B1").build()));

        assertSame(violation, e);
        verify(ledgerService, times(1)).recordLoss(any());
        assertEquals(1.0, meterRegistry.get("ledger.operations.rejected").tag("code", "UNEXPECTED").counter().count());
    }

    private static DataIntegrityViolationException integrityViolation(String message) {
        return new DataIntegrityViolationException("could not execute statement", new SQLException(message, "23505"));
    }
}
