package com.cidery.ledger.application.service;

import com.cidery.ledger.domain.command.ReconcilePeriodCommand;
import com.cidery.ledger.domain.enums.TaxClass;
import com.cidery.ledger.domain.enums.WarningType;
import com.cidery.ledger.domain.exception.LedgerValidationException;
import com.cidery.ledger.domain.model.LedgerResult;
import com.cidery.ledger.domain.model.LedgerWarning;
import com.cidery.ledger.domain.model.ReconciliationSnapshot;
import com.cidery.ledger.domain.model.ReportingPeriod;
import com.cidery.ledger.domain.model.TaxClassLine;
import com.cidery.ledger.domain.units.UnitConverter;
import com.cidery.ledger.domain.units.VolumeUnit;
import com.cidery.ledger.infrastructure.persistence.entity.BatchEntity;
import com.cidery.ledger.infrastructure.persistence.entity.ReconciliationSnapshotEntity;
import com.cidery.ledger.infrastructure.persistence.repository.BatchRepository;
import com.cidery.ledger.infrastructure.persistence.repository.ReconciliationSnapshotRepository;
import com.cidery.ledger.infrastructure.persistence.repository.TransactionEntryRepository.BatchMovement;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Rolls the transaction log up into per-tax-class wine gallon balances for a reporting
 * period and compares them with the balances the caller reported.
 *
 * Nothing in the ledger is corrected here; discrepancies come back as warnings and
 * are fixed through volume adjustments.
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);

    private final TransactionLogService transactionLog;
    private final BatchRepository batchRepository;
    private final ReconciliationSnapshotRepository snapshotRepository;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;
    private final BigDecimal defaultTolerance;
    private final ZoneId zone;

    public ReconciliationService(TransactionLogService transactionLog,
                                 BatchRepository batchRepository,
                                 ReconciliationSnapshotRepository snapshotRepository,
                                 ObjectMapper objectMapper,
                                 MetricsService metricsService,
                                 @Value("${ledger.reconciliation.tolerance-gallons:0.1}") BigDecimal defaultTolerance,
                                 @Value("${ledger.reconciliation.zone:UTC}") String zone) {
        this.transactionLog = transactionLog;
        this.batchRepository = batchRepository;
        this.snapshotRepository = snapshotRepository;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.defaultTolerance = defaultTolerance;
        this.zone = ZoneId.of(zone);
    }

    @Transactional
    public LedgerResult<ReconciliationSnapshot> reconcile(ReconcilePeriodCommand command) {
        ReportingPeriod period = command.getPeriod();
        if (period == null) {
            throw new LedgerValidationException("MISSING_FIELD", "period is required", Map.of("field", "period"));
        }
        BigDecimal tolerance = command.getToleranceGallons() != null ? command.getToleranceGallons() : defaultTolerance;
        if (tolerance.signum() < 0) {
            throw new LedgerValidationException("INVALID_TOLERANCE", "Tolerance must not be negative",
                    Map.of("toleranceGallons", tolerance));
        }
        OffsetDateTime start = period.startDate().atStartOfDay(zone).toOffsetDateTime();
        OffsetDateTime end = period.endDateExclusive().atStartOfDay(zone).toOffsetDateTime();

        Map<String, BigDecimal> opening = transactionLog.sumBefore(start);
        Map<String, BigDecimal> closing = transactionLog.sumBefore(end);
        List<BatchMovement> movements = transactionLog.movementsBetween(start, end);

        Set<String> batchIds = new LinkedHashSet<>(opening.keySet());
        batchIds.addAll(closing.keySet());
        movements.forEach(movement -> batchIds.add(movement.getBatchId()));
        Map<String, BatchEntity> batches = new HashMap<>();
        if (!batchIds.isEmpty()) {
            batchRepository.findAllByIdIn(batchIds).forEach(batch -> batches.put(batch.getId(), batch));
        }

        Map<TaxClass, Accumulator> totals = new EnumMap<>(TaxClass.class);
        for (TaxClass taxClass : TaxClass.values()) {
            totals.put(taxClass, new Accumulator());
        }
        opening.forEach((batchId, liters) -> {
            Accumulator accumulator = totals.get(classOf(batches.get(batchId)));
            accumulator.opening = accumulator.opening.add(liters);
        });
        closing.forEach((batchId, liters) -> {
            BatchEntity batch = batches.get(batchId);
            Accumulator accumulator = totals.get(classOf(batch));
            accumulator.closing = accumulator.closing.add(liters);
            if (batch != null && batch.getAbvPct() != null && liters.signum() > 0 && classOf(batch).isSpirits()) {
                accumulator.closingProofGallons = accumulator.closingProofGallons.add(
                        UnitConverter.proofGallons(liters, VolumeUnit.LITER, batch.getAbvPct()));
            }
        });
        for (BatchMovement movement : movements) {
            totals.get(classOf(batches.get(movement.getBatchId()))).add(movement);
        }

        Map<TaxClass, BigDecimal> reportedOpening = command.getReportedOpeningGallons() != null
                ? command.getReportedOpeningGallons() : Map.of();
        Map<TaxClass, BigDecimal> reportedClosing = command.getReportedClosingGallons() != null
                ? command.getReportedClosingGallons() : Map.of();
        List<TaxClassLine> lines = new ArrayList<>();
        List<LedgerWarning> warnings = new ArrayList<>();
        for (Map.Entry<TaxClass, Accumulator> entry : totals.entrySet()) {
            TaxClassLine line = entry.getValue().toLine(entry.getKey(), tolerance);
            line.setReportedOpeningGallons(reportedOpening.get(entry.getKey()));
            line.setReportedClosingGallons(reportedClosing.get(entry.getKey()));
            lines.add(line);

            if (!line.isBalanced()) {
                warnings.add(warning(WarningType.RECONCILIATION_UNBALANCED, line, "balance",
                        null, line.getVariance(),
                        String.format("%s does not balance for %s: variance %s gal", line.getTaxClass(),
                                period.getLabel(), line.getVariance().toPlainString())));
            }
            compareReported(period, line, "opening", line.getReportedOpeningGallons(), line.getOpeningGallons(),
                    tolerance, warnings);
            compareReported(period, line, "closing", line.getReportedClosingGallons(), line.getClosingGallons(),
                    tolerance, warnings);
        }

        ReconciliationSnapshot snapshot = ReconciliationSnapshot.builder()
                .period(period)
                .generatedAt(OffsetDateTime.now(ZoneOffset.UTC))
                .generatedBy(command.getActorId() != null ? command.getActorId() : LedgerOperation.SYSTEM_ACTOR)
                .toleranceGallons(tolerance)
                .lines(lines)
                .balanced(warnings.isEmpty())
                .discrepancies(warnings)
                .build();
        ReconciliationSnapshotEntity saved = snapshotRepository.save(ReconciliationSnapshotEntity.builder()
                .periodType(period.getType())
                .periodYear(period.getYear())
                .periodNumber(period.getNumber())
                .periodStart(period.startDate())
                .periodEnd(period.endDateExclusive())
                .toleranceGallons(tolerance)
                .balanced(snapshot.isBalanced())
                .snapshotData(writeSnapshot(snapshot))
                .generatedBy(snapshot.getGeneratedBy())
                .generatedAt(snapshot.getGeneratedAt())
                .build());
        snapshot.setId(saved.getId());

        warnings.forEach(warning -> metricsService.incrementWarning(warning.getType().name()));
        log.info("Reconciled {} across {} batches: balanced={}, {} discrepancies", period.getLabel(),
                batchIds.size(), snapshot.isBalanced(), warnings.size());
        return LedgerResult.of(snapshot, warnings);
    }

    /**
     * Latest stored reconciliation of the period.
     */
    @Transactional(readOnly = true)
    public Optional<ReconciliationSnapshot> getReconciliationSnapshot(ReportingPeriod period) {
        return snapshotRepository.findFirstByPeriodTypeAndPeriodYearAndPeriodNumberOrderByGeneratedAtDesc(
                        period.getType(), period.getYear(), period.getNumber())
                .map(this::readSnapshot);
    }

    private static TaxClass classOf(BatchEntity batch) {
        if (batch == null) {
            return TaxClass.HARD_CIDER;
        }
        return batch.getTaxClass() != null ? batch.getTaxClass() : TaxClass.forAbv(batch.getAbvPct());
    }

    private static void compareReported(ReportingPeriod period, TaxClassLine line, String balance,
                                        BigDecimal reported, BigDecimal computed, BigDecimal tolerance,
                                        List<LedgerWarning> warnings) {
        if (reported == null) {
            return;
        }
        BigDecimal variance = reported.subtract(computed);
        if (variance.abs().compareTo(tolerance) > 0) {
            warnings.add(warning(WarningType.RECONCILIATION_DISCREPANCY, line, balance, reported, variance,
                    String.format("Reported %s %s for %s is %s gal, ledger shows %s gal", balance,
                            line.getTaxClass(), period.getLabel(), reported.toPlainString(),
                            computed.toPlainString())));
        }
    }

    private static LedgerWarning warning(WarningType type, TaxClassLine line, String balance, BigDecimal reported,
                                         BigDecimal variance, String message) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("taxClass", line.getTaxClass());
        details.put("balance", balance);
        if (reported != null) {
            details.put("reportedGallons", reported);
        }
        details.put("varianceGallons", variance);
        return LedgerWarning.builder().type(type).message(message).details(details).build();
    }

    private String writeSnapshot(ReconciliationSnapshot snapshot) {
        try {
            return objectMapper.writeValueAsString(snapshot);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize reconciliation of {}", snapshot.getPeriod(), e);
            throw new RuntimeException("Failed to serialize reconciliation snapshot", e);
        }
    }

    private ReconciliationSnapshot readSnapshot(ReconciliationSnapshotEntity entity) {
        try {
            ReconciliationSnapshot snapshot = objectMapper.readValue(entity.getSnapshotData(), ReconciliationSnapshot.class);
            snapshot.setId(entity.getId());
            return snapshot;
        } catch (JsonProcessingException e) {
            log.error("Failed to read reconciliation snapshot {}", entity.getId(), e);
            throw new RuntimeException("Failed to deserialize reconciliation snapshot", e);
        }
    }

    /**
     * Running liter totals of one tax class. TRANSFER entries net to zero within a
     * batch and are left out.
     */
    private static final class Accumulator {
        private BigDecimal opening = BigDecimal.ZERO;
        private BigDecimal produced = BigDecimal.ZERO;
        private BigDecimal blendedIn = BigDecimal.ZERO;
        private BigDecimal adjustmentsIn = BigDecimal.ZERO;
        private BigDecimal removed = BigDecimal.ZERO;
        private BigDecimal blendedOut = BigDecimal.ZERO;
        private BigDecimal loss = BigDecimal.ZERO;
        private BigDecimal adjustmentsOut = BigDecimal.ZERO;
        private BigDecimal closing = BigDecimal.ZERO;
        private BigDecimal closingProofGallons = BigDecimal.ZERO;

        void add(BatchMovement movement) {
            BigDecimal in = movement.getIncreases() == null ? BigDecimal.ZERO : movement.getIncreases();
            BigDecimal out = movement.getDecreases() == null ? BigDecimal.ZERO : movement.getDecreases().negate();
            switch (movement.getType()) {
                case FILL -> {
                    produced = produced.add(in);
                    removed = removed.add(out);
                }
                case BLEND, SPLIT -> {
                    blendedIn = blendedIn.add(in);
                    blendedOut = blendedOut.add(out);
                }
                case ADJUSTMENT -> {
                    adjustmentsIn = adjustmentsIn.add(in);
                    adjustmentsOut = adjustmentsOut.add(out);
                }
                case REMOVAL -> {
                    removed = removed.add(out);
                    produced = produced.add(in);
                }
                case LOSS -> {
                    loss = loss.add(out);
                    produced = produced.add(in);
                }
                case TRANSFER -> {
                    // nets to zero per batch
                }
            }
        }

        TaxClassLine toLine(TaxClass taxClass, BigDecimal tolerance) {
            BigDecimal varianceLiters = opening.add(produced).add(blendedIn).add(adjustmentsIn)
                    .subtract(removed).subtract(blendedOut).subtract(loss).subtract(adjustmentsOut)
                    .subtract(closing);
            BigDecimal variance = UnitConverter.toGallons(varianceLiters);
            return TaxClassLine.builder()
                    .taxClass(taxClass)
                    .openingGallons(UnitConverter.toGallons(opening))
                    .producedGallons(UnitConverter.toGallons(produced))
                    .blendedInGallons(UnitConverter.toGallons(blendedIn))
                    .adjustmentsInGallons(UnitConverter.toGallons(adjustmentsIn))
                    .removedGallons(UnitConverter.toGallons(removed))
                    .blendedOutGallons(UnitConverter.toGallons(blendedOut))
                    .lossGallons(UnitConverter.toGallons(loss))
                    .adjustmentsOutGallons(UnitConverter.toGallons(adjustmentsOut))
                    .closingGallons(UnitConverter.toGallons(closing))
                    .closingProofGallons(taxClass.isSpirits() ? closingProofGallons : null)
                    .variance(variance)
                    .balanced(variance.abs().compareTo(tolerance) <= 0)
                    .build();
        }
    }
}
