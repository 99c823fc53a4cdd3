package com.cidery.ledger.application.service;

import com.cidery.ledger.application.config.JacksonConfig;
import com.cidery.ledger.domain.command.ReconcilePeriodCommand;
import com.cidery.ledger.domain.enums.BatchStatus;
import com.cidery.ledger.domain.enums.PeriodType;
import com.cidery.ledger.domain.enums.TaxClass;
import com.cidery.ledger.domain.enums.TransactionType;
import com.cidery.ledger.domain.enums.WarningType;
import com.cidery.ledger.domain.exception.LedgerValidationException;
import com.cidery.ledger.domain.model.LedgerResult;
import com.cidery.ledger.domain.model.ReconciliationSnapshot;
import com.cidery.ledger.domain.model.ReportingPeriod;
import com.cidery.ledger.domain.model.TaxClassLine;
import com.cidery.ledger.infrastructure.persistence.entity.BatchEntity;
import com.cidery.ledger.infrastructure.persistence.entity.ReconciliationSnapshotEntity;
import com.cidery.ledger.infrastructure.persistence.repository.BatchRepository;
import com.cidery.ledger.infrastructure.persistence.repository.ReconciliationSnapshotRepository;
import com.cidery.ledger.infrastructure.persistence.repository.TransactionEntryRepository.BatchMovement;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ReconciliationServiceTest {

    private static final OffsetDateTime MARCH = OffsetDateTime.of(2024, 3, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    private static final OffsetDateTime APRIL = OffsetDateTime.of(2024, 4, 1, 0, 0, 0, 0, ZoneOffset.UTC);

    @Mock
    private TransactionLogService transactionLog;
    @Mock
    private BatchRepository batchRepository;
    @Mock
    private ReconciliationSnapshotRepository snapshotRepository;

    private ObjectMapper objectMapper;
    private ReconciliationService reconciliationService;
    private BatchEntity cider;

    @BeforeEach
    void setUp() {
        objectMapper = new JacksonConfig().objectMapper();
        reconciliationService = new ReconciliationService(transactionLog, batchRepository, snapshotRepository,
                objectMapper, new MetricsService(new SimpleMeterRegistry()), new BigDecimal("0.1"), "UTC");
        cider = BatchEntity.builder()
                .id("C1")
                .name("Dabinett 2023")
                .status(BatchStatus.AGING)
                .abvPct(new BigDecimal("6.50"))
                .build();
    }

    private static BatchMovement movement(String batchId, TransactionType type, String increases, String decreases) {
        return new BatchMovement() {
            @Override
            public String getBatchId() {
                return batchId;
            }

            @Override
            public TransactionType getType() {
                return type;
            }

            @Override
            public BigDecimal getIncreases() {
                return new BigDecimal(increases);
            }

            @Override
            public BigDecimal getDecreases() {
                return new BigDecimal(decreases);
            }
        };
    }

    private void stubSave() {
        when(snapshotRepository.save(any(ReconciliationSnapshotEntity.class))).thenAnswer(invocation -> {
            ReconciliationSnapshotEntity entity = invocation.getArgument(0);
            entity.setId(UUID.randomUUID());
            return entity;
        });
    }

    private void stubCiderMonth(String closingLiters) {
        when(transactionLog.sumBefore(MARCH)).thenReturn(Map.of("C1", new BigDecimal("1000")));
        when(transactionLog.sumBefore(APRIL)).thenReturn(Map.of("C1", new BigDecimal(closingLiters)));
        when(transactionLog.movementsBetween(MARCH, APRIL)).thenReturn(List.of(
                movement("C1", TransactionType.FILL, "500", "0"),
                movement("C1", TransactionType.TRANSFER, "100", "-100"),
                movement("C1", TransactionType.LOSS, "0", "-20"),
                movement("C1", TransactionType.REMOVAL, "0", "-300")));
        when(batchRepository.findAllByIdIn(anyCollection())).thenReturn(List.of(cider));
    }

    private static TaxClassLine line(ReconciliationSnapshot snapshot, TaxClass taxClass) {
        return snapshot.getLines().stream()
                .filter(line -> line.getTaxClass() == taxClass)
                .findFirst()
                .orElseThrow();
    }

    @Test
    void testBalancedMonth() {
        stubCiderMonth("1180");
        stubSave();

        LedgerResult<ReconciliationSnapshot> result = reconciliationService.reconcile(ReconcilePeriodCommand.builder()
                .period(ReportingPeriod.monthly(2024, 3))
                .actorId("bookkeeper")
                .build());

        ReconciliationSnapshot snapshot = result.getValue();
        assertTrue(snapshot.isBalanced());
        assertFalse(result.hasWarnings());
        assertNotNull(snapshot.getId());
        assertEquals(TaxClass.values().length, snapshot.getLines().size());

        TaxClassLine hardCider = line(snapshot, TaxClass.HARD_CIDER);
        assertEquals(new BigDecimal("264.172"), hardCider.getOpeningGallons());
        assertEquals(0, hardCider.getVariance().signum());
        assertNull(hardCider.getClosingProofGallons());
        assertEquals(0, hardCider.getLossGallons().compareTo(new BigDecimal("5.283")));
    }

    @Test
    void testUnbalancedMonthRaisesWarning() {
        stubCiderMonth("1150");
        stubSave();

        LedgerResult<ReconciliationSnapshot> result = reconciliationService.reconcile(ReconcilePeriodCommand.builder()
                .period(ReportingPeriod.monthly(2024, 3))
                .build());

        assertFalse(result.getValue().isBalanced());
        assertEquals(1, result.getWarnings().size());
        assertEquals(WarningType.RECONCILIATION_UNBALANCED, result.getWarnings().get(0).getType());
        assertEquals(TaxClass.HARD_CIDER, result.getWarnings().get(0).getDetails().get("taxClass"));
        assertFalse(line(result.getValue(), TaxClass.HARD_CIDER).isBalanced());
    }

    @Test
    void testReportedClosingOutsideToleranceIsDiscrepancy() {
        stubCiderMonth("1180");
        stubSave();
        Map<TaxClass, BigDecimal> opening = new EnumMap<>(TaxClass.class);
        opening.put(TaxClass.HARD_CIDER, new BigDecimal("264.2"));
        Map<TaxClass, BigDecimal> closing = new EnumMap<>(TaxClass.class);
        closing.put(TaxClass.HARD_CIDER, new BigDecimal("300"));

        LedgerResult<ReconciliationSnapshot> result = reconciliationService.reconcile(ReconcilePeriodCommand.builder()
                .period(ReportingPeriod.monthly(2024, 3))
                .reportedOpeningGallons(opening)
                .reportedClosingGallons(closing)
                .build());

        assertEquals(1, result.getWarnings().size());
        assertEquals(WarningType.RECONCILIATION_DISCREPANCY, result.getWarnings().get(0).getType());
        assertEquals("closing", result.getWarnings().get(0).getDetails().get("balance"));
        assertFalse(result.getValue().isBalanced());
    }

    @Test
    void testSpiritsCarryProofGallons() {
        BatchEntity brandy = BatchEntity.builder()
                .id("AB1")
                .name("Apple brandy")
                .status(BatchStatus.AGING)
                .abvPct(new BigDecimal("60.00"))
                .build();
        when(transactionLog.sumBefore(MARCH)).thenReturn(Map.of());
        when(transactionLog.sumBefore(APRIL)).thenReturn(Map.of("AB1", new BigDecimal("100")));
        when(transactionLog.movementsBetween(MARCH, APRIL)).thenReturn(List.of(
                movement("AB1", TransactionType.FILL, "100", "0")));
        when(batchRepository.findAllByIdIn(anyCollection())).thenReturn(List.of(brandy));
        stubSave();

        ReconciliationSnapshot snapshot = reconciliationService.reconcile(ReconcilePeriodCommand.builder()
                .period(ReportingPeriod.monthly(2024, 3))
                .build()).getValue();

        TaxClassLine spirits = line(snapshot, TaxClass.APPLE_BRANDY);
        assertTrue(spirits.isBalanced());
        assertTrue(spirits.getClosingProofGallons().signum() > 0);
        assertEquals(0, line(snapshot, TaxClass.HARD_CIDER).getClosingGallons().signum());
    }

    @Test
    void testExplicitTaxClassOverridesAbv() {
        cider.setTaxClass(TaxClass.WINE_UNDER_16);
        stubCiderMonth("1180");
        stubSave();

        ReconciliationSnapshot snapshot = reconciliationService.reconcile(ReconcilePeriodCommand.builder()
                .period(ReportingPeriod.monthly(2024, 3))
                .build()).getValue();

        assertEquals(new BigDecimal("264.172"), line(snapshot, TaxClass.WINE_UNDER_16).getOpeningGallons());
        assertEquals(0, line(snapshot, TaxClass.HARD_CIDER).getOpeningGallons().signum());
    }

    @Test
    void testNegativeToleranceRejected() {
        LedgerValidationException e = assertThrows(LedgerValidationException.class,
                () -> reconciliationService.reconcile(ReconcilePeriodCommand.builder()
                        .period(ReportingPeriod.monthly(2024, 3))
                        .toleranceGallons(new BigDecimal("-1"))
                        .build()));

        assertEquals("INVALID_TOLERANCE", e.getCode());
        verifyNoInteractions(snapshotRepository);
    }

    @Test
    void testStoredSnapshotReadBack() throws Exception {
        stubCiderMonth("1180");
        stubSave();
        ReconciliationSnapshot stored = reconciliationService.reconcile(ReconcilePeriodCommand.builder()
                .period(ReportingPeriod.monthly(2024, 3))
                .build()).getValue();
        ArgumentCaptor<ReconciliationSnapshotEntity> captor = ArgumentCaptor.forClass(ReconciliationSnapshotEntity.class);
        verify(snapshotRepository).save(captor.capture());
        when(snapshotRepository.findFirstByPeriodTypeAndPeriodYearAndPeriodNumberOrderByGeneratedAtDesc(
                PeriodType.MONTHLY, 2024, 3)).thenReturn(Optional.of(captor.getValue()));

        Optional<ReconciliationSnapshot> read = reconciliationService.getReconciliationSnapshot(
                ReportingPeriod.monthly(2024, 3));

        assertTrue(read.isPresent());
        assertEquals(stored.getId(), read.get().getId());
        assertEquals(ReportingPeriod.monthly(2024, 3), read.get().getPeriod());
        assertEquals(stored.getLines().size(), read.get().getLines().size());
    }
}
