package com.cidery.ledger.application.service;

import com.cidery.ledger.application.audit.AuditService;
import com.cidery.ledger.domain.enums.BatchStatus;
import com.cidery.ledger.domain.enums.VesselStatus;
import com.cidery.ledger.domain.exception.LedgerEntityNotFoundException;
import com.cidery.ledger.domain.model.AuditLogEntry;
import com.cidery.ledger.domain.model.AuditLogFilter;
import com.cidery.ledger.domain.model.AuditRendering;
import com.cidery.ledger.domain.model.Batch;
import com.cidery.ledger.domain.model.Quantity;
import com.cidery.ledger.domain.model.ReconciliationSnapshot;
import com.cidery.ledger.domain.model.ReportingPeriod;
import com.cidery.ledger.domain.model.TransactionEntry;
import com.cidery.ledger.domain.model.Vessel;
import com.cidery.ledger.domain.model.VesselOccupant;
import com.cidery.ledger.infrastructure.persistence.entity.BatchEntity;
import com.cidery.ledger.infrastructure.persistence.entity.VesselEntity;
import com.cidery.ledger.infrastructure.persistence.repository.BatchRepository;
import com.cidery.ledger.infrastructure.persistence.repository.VesselRepository;
import org.springframework.data.domain.Page;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Isolation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Read side of the ledger. Every query runs read-only at read-committed isolation.
 */
@Service
@Transactional(readOnly = true, isolation = Isolation.READ_COMMITTED)
public class LedgerQueryService {

    private final LedgerService ledgerService;
    private final TransactionLogService transactionLog;
    private final AuditService auditService;
    private final ReconciliationService reconciliationService;
    private final VesselRepository vesselRepository;
    private final BatchRepository batchRepository;
    private final LedgerMapper mapper;

    public LedgerQueryService(LedgerService ledgerService,
                              TransactionLogService transactionLog,
                              AuditService auditService,
                              ReconciliationService reconciliationService,
                              VesselRepository vesselRepository,
                              BatchRepository batchRepository,
                              LedgerMapper mapper) {
        this.ledgerService = ledgerService;
        this.transactionLog = transactionLog;
        this.auditService = auditService;
        this.reconciliationService = reconciliationService;
        this.vesselRepository = vesselRepository;
        this.batchRepository = batchRepository;
        this.mapper = mapper;
    }

    public Quantity getCurrentVolume(String batchId) {
        return ledgerService.currentVolume(batchId);
    }

    public Optional<String> getVesselOccupant(String vesselId) {
        return ledgerService.occupant(vesselId);
    }

    public Optional<VesselOccupant> getVesselContents(String vesselId) {
        return ledgerService.vesselContents(vesselId);
    }

    public Vessel getVessel(String vesselId) {
        return vesselRepository.findById(vesselId)
                .map(mapper::toVessel)
                .orElseThrow(() -> new LedgerEntityNotFoundException("Vessel", vesselId));
    }

    public List<Vessel> listVessels(VesselStatus status) {
        List<VesselEntity> vessels = status == null
                ? vesselRepository.findAllByOrderByIdAsc()
                : vesselRepository.findAllByStatusOrderByIdAsc(status);
        return vessels.stream().map(mapper::toVessel).collect(Collectors.toList());
    }

    public Batch getBatch(String batchId) {
        BatchEntity batch = batchRepository.findById(batchId)
                .orElseThrow(() -> new LedgerEntityNotFoundException("Batch", batchId));
        return mapper.toBatch(batch, transactionLog.volumesByVessel(batchId));
    }

    public List<Batch> listBatches(BatchStatus status) {
        List<BatchEntity> batches = status == null
                ? batchRepository.findAll()
                : batchRepository.findAllByStatusOrderByIdAsc(status);
        return batches.stream()
                .map(batch -> mapper.toBatch(batch, transactionLog.volumesByVessel(batch.getId())))
                .collect(Collectors.toList());
    }

    public Page<TransactionEntry> getTransactionHistory(String batchId, int page, int size) {
        if (!batchRepository.existsById(batchId)) {
            throw new LedgerEntityNotFoundException("Batch", batchId);
        }
        return transactionLog.history(batchId, page, size);
    }

    public Batch verifyBatchIntegrity(String batchId) {
        return ledgerService.verifyIntegrity(batchId);
    }

    public Page<AuditRendering> getAuditLog(AuditLogFilter filter) {
        return auditService.getAuditLog(filter).map(auditService::render);
    }

    public List<AuditLogEntry> getAuditHistory(String tableName, String recordId) {
        return auditService.history(tableName, recordId);
    }

    /**
     * Recomputes the checksum of a stored audit entry and compares it with the stored one.
     */
    public boolean verifyAuditEntry(UUID entryId) {
        AuditLogEntry entry = auditService.findEntry(entryId)
                .orElseThrow(() -> new LedgerEntityNotFoundException("Audit entry", entryId.toString()));
        return auditService.verifyChecksum(entry);
    }

    public Optional<ReconciliationSnapshot> getReconciliationSnapshot(ReportingPeriod period) {
        return reconciliationService.getReconciliationSnapshot(period);
    }
}
