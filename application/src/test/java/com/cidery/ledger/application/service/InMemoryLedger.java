package com.cidery.ledger.application.service;

import com.cidery.ledger.application.audit.AuditService;
import com.cidery.ledger.application.config.JacksonConfig;
import com.cidery.ledger.application.statemachine.VesselStateMachine;
import com.cidery.ledger.domain.enums.AuditOperation;
import com.cidery.ledger.infrastructure.persistence.entity.BatchEntity;
import com.cidery.ledger.infrastructure.persistence.entity.OccupancyEntity;
import com.cidery.ledger.infrastructure.persistence.entity.TransactionEntryEntity;
import com.cidery.ledger.infrastructure.persistence.entity.VesselEntity;
import com.cidery.ledger.infrastructure.persistence.repository.BatchRepository;
import com.cidery.ledger.infrastructure.persistence.repository.OccupancyRepository;
import com.cidery.ledger.infrastructure.persistence.repository.TransactionEntryRepository;
import com.cidery.ledger.infrastructure.persistence.repository.VesselRepository;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.mockito.MockSettings;
import org.mockito.quality.Strictness;
import org.springframework.dao.DataIntegrityViolationException;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.function.Predicate;
import java.util.stream.Collectors;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

/**
 * The ledger services wired over repository mocks that keep their rows in memory,
 * for tests that follow several commands through the real store and transaction log.
 */
class InMemoryLedger {

    /**
     * One call to {@link AuditService#record}.
     */
    static class AuditCall {
        final LedgerOperation operation;
        final AuditOperation auditOperation;
        final String table;
        final String recordId;
        final Object before;
        final Object after;

        AuditCall(LedgerOperation operation, AuditOperation auditOperation, String table, String recordId,
                  Object before, Object after) {
            this.operation = operation;
            this.auditOperation = auditOperation;
            this.table = table;
            this.recordId = recordId;
            this.before = before;
            this.after = after;
        }
    }

    final Map<String, VesselEntity> vessels = new TreeMap<>();
    final Map<String, BatchEntity> batches = new TreeMap<>();
    final List<OccupancyEntity> occupancies = new ArrayList<>();
    final List<TransactionEntryEntity> entries = new ArrayList<>();
    final List<AuditCall> audits = new ArrayList<>();
    final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();

    final VesselRepository vesselRepository = mock(VesselRepository.class, mapBacked());
    final BatchRepository batchRepository = mock(BatchRepository.class, mapBacked());
    final OccupancyRepository occupancyRepository = mock(OccupancyRepository.class, mapBacked());
    final TransactionEntryRepository entryRepository = mock(TransactionEntryRepository.class, mapBacked());
    final AuditService auditService = mock(AuditService.class, mapBacked());
    final LedgerEventPublisher eventPublisher = mock(LedgerEventPublisher.class);

    final LedgerMapper mapper = new LedgerMapper(new JacksonConfig().objectMapper());
    final TransactionLogService transactionLog =
            new TransactionLogService(entryRepository, new JacksonConfig().objectMapper(), 100);
    final MetricsService metricsService = new MetricsService(meterRegistry);
    final LedgerStore store = new LedgerStore(vesselRepository, batchRepository, occupancyRepository, transactionLog,
            auditService, mapper, new VesselStateMachine(), eventPublisher, new CorrelationIdService(), metricsService);
    final LedgerService ledgerService = new LedgerService(store, vesselRepository, batchRepository,
            occupancyRepository, transactionLog, mapper, new VesselStateMachine(), new AdjustmentPolicy(BigDecimal.TEN));
    final BlendingService blendingService =
            new BlendingService(store, batchRepository, new BlendCalculator(), mapper);

    InMemoryLedger() {
        stubVessels();
        stubBatches();
        stubOccupancies();
        stubEntries();
        when(auditService.record(any(), any(), anyString(), anyString(), any(), any())).thenAnswer(invocation -> {
            audits.add(new AuditCall(invocation.getArgument(0), invocation.getArgument(1), invocation.getArgument(2),
                    invocation.getArgument(3), invocation.getArgument(4), invocation.getArgument(5)));
            return null;
        });
    }

    private static MockSettings mapBacked() {
        return withSettings().strictness(Strictness.LENIENT);
    }

    private void stubVessels() {
        when(vesselRepository.findForUpdate(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(vessels.get(invocation.<String>getArgument(0))));
        when(vesselRepository.findById(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(vessels.get(invocation.<String>getArgument(0))));
        when(vesselRepository.existsById(anyString()))
                .thenAnswer(invocation -> vessels.containsKey(invocation.<String>getArgument(0)));
        when(vesselRepository.saveAndFlush(any(VesselEntity.class))).thenAnswer(invocation -> {
            VesselEntity vessel = invocation.getArgument(0);
            if (vessel.getVersion() == null) {
                vessel.setVersion(0L);
            }
            vessels.put(vessel.getId(), vessel);
            return vessel;
        });
    }

    private void stubBatches() {
        when(batchRepository.findForUpdate(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(batches.get(invocation.<String>getArgument(0))));
        when(batchRepository.findById(anyString()))
                .thenAnswer(invocation -> Optional.ofNullable(batches.get(invocation.<String>getArgument(0))));
        when(batchRepository.existsById(anyString()))
                .thenAnswer(invocation -> batches.containsKey(invocation.<String>getArgument(0)));
        when(batchRepository.saveAndFlush(any(BatchEntity.class))).thenAnswer(invocation -> {
            BatchEntity batch = invocation.getArgument(0);
            if (batch.getVersion() == null) {
                batch.setVersion(0L);
            }
            batches.put(batch.getId(), batch);
            return batch;
        });
    }

    private void stubOccupancies() {
        when(occupancyRepository.save(any(OccupancyEntity.class))).thenAnswer(invocation -> keep(invocation.getArgument(0)));
        when(occupancyRepository.saveAndFlush(any(OccupancyEntity.class)))
                .thenAnswer(invocation -> keep(invocation.getArgument(0)));
        when(occupancyRepository.findActiveByVesselId(anyString())).thenAnswer(invocation -> occupancies.stream()
                .filter(OccupancyEntity::isActive)
                .filter(o -> o.getVesselId().equals(invocation.getArgument(0)))
                .findFirst());
        when(occupancyRepository.findActiveByBatchId(anyString())).thenAnswer(invocation -> occupancies.stream()
                .filter(OccupancyEntity::isActive)
                .filter(o -> o.getBatchId().equals(invocation.getArgument(0)))
                .collect(Collectors.toList()));
    }

    private OccupancyEntity keep(OccupancyEntity occupancy) {
        if (occupancy.getId() == null) {
            boolean vesselTaken = occupancies.stream()
                    .anyMatch(o -> o.isActive() && o.getVesselId().equals(occupancy.getVesselId()));
            if (vesselTaken) {
                throw new DataIntegrityViolationException("uk_occupancies_active_vessel");
            }
            occupancy.setId(UUID.randomUUID());
            occupancies.add(occupancy);
        }
        return occupancy;
    }

    private void stubEntries() {
        when(entryRepository.saveAndFlush(any(TransactionEntryEntity.class))).thenAnswer(invocation -> {
            TransactionEntryEntity entry = invocation.getArgument(0);
            boolean duplicate = entries.stream().anyMatch(e -> e.getBatchId().equals(entry.getBatchId())
                    && e.getBatchSeq().equals(entry.getBatchSeq()));
            if (duplicate) {
                throw new DataIntegrityViolationException("uk_transaction_entries_batch_seq");
            }
            entry.setId(UUID.randomUUID());
            entries.add(entry);
            return entry;
        });
        when(entryRepository.findMaxSequenceByBatchId(anyString())).thenAnswer(invocation -> entries.stream()
                .filter(e -> e.getBatchId().equals(invocation.getArgument(0)))
                .mapToLong(TransactionEntryEntity::getBatchSeq)
                .max()
                .orElse(0L));
        when(entryRepository.sumDeltaByBatchId(anyString())).thenAnswer(invocation ->
                sum(e -> e.getBatchId().equals(invocation.getArgument(0))));
        when(entryRepository.sumDeltaByBatchIdAndVesselId(anyString(), anyString())).thenAnswer(invocation ->
                sum(e -> e.getBatchId().equals(invocation.getArgument(0))
                        && invocation.getArgument(1).equals(e.getVesselId())));
        when(entryRepository.sumDeltaByVessel(anyString())).thenAnswer(invocation -> {
            Map<String, BigDecimal> byVessel = new TreeMap<>();
            entries.stream()
                    .filter(e -> e.getBatchId().equals(invocation.getArgument(0)) && e.getVesselId() != null)
                    .forEach(e -> byVessel.merge(e.getVesselId(), e.getDeltaLiters(), BigDecimal::add));
            List<TransactionEntryRepository.VesselVolume> rows = new ArrayList<>();
            byVessel.forEach((vesselId, liters) -> rows.add(new TransactionEntryRepository.VesselVolume() {
                @Override
                public String getVesselId() {
                    return vesselId;
                }

                @Override
                public BigDecimal getLiters() {
                    return liters;
                }
            }));
            return rows;
        });
        when(entryRepository.findAllByOperationId(any())).thenAnswer(invocation -> entries.stream()
                .filter(e -> e.getOperationId().equals(invocation.getArgument(0)))
                .collect(Collectors.toList()));
    }

    private BigDecimal sum(Predicate<TransactionEntryEntity> filter) {
        return entries.stream().filter(filter).map(TransactionEntryEntity::getDeltaLiters)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    List<AuditCall> auditsOf(String table, String recordId) {
        return audits.stream()
                .filter(call -> call.table.equals(table) && call.recordId.equals(recordId))
                .collect(Collectors.toList());
    }

    Optional<OccupancyEntity> activeIn(String vesselId) {
        return occupancies.stream().filter(o -> o.isActive() && o.getVesselId().equals(vesselId)).findFirst();
    }
}
