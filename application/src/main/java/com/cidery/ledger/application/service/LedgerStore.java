package com.cidery.ledger.application.service;

import com.cidery.ledger.application.audit.AuditService;
import com.cidery.ledger.application.statemachine.VesselStateMachine;
import com.cidery.ledger.domain.enums.AuditOperation;
import com.cidery.ledger.domain.enums.TransactionType;
import com.cidery.ledger.domain.enums.VesselStatus;
import com.cidery.ledger.domain.exception.BatchClosedException;
import com.cidery.ledger.domain.exception.CapacityExceededException;
import com.cidery.ledger.domain.exception.ConcurrentLedgerModificationException;
import com.cidery.ledger.domain.exception.InsufficientVolumeException;
import com.cidery.ledger.domain.exception.InvalidStateTransitionException;
import com.cidery.ledger.domain.exception.LedgerEntityNotFoundException;
import com.cidery.ledger.domain.exception.LedgerInvariantViolationException;
import com.cidery.ledger.domain.exception.LedgerValidationException;
import com.cidery.ledger.domain.exception.VesselOccupiedException;
import com.cidery.ledger.domain.exception.VesselUnavailableException;
import com.cidery.ledger.domain.model.Batch;
import com.cidery.ledger.domain.model.Quantity;
import com.cidery.ledger.domain.model.TransactionEntry;
import com.cidery.ledger.domain.model.Vessel;
import com.cidery.ledger.infrastructure.persistence.entity.BatchEntity;
import com.cidery.ledger.infrastructure.persistence.entity.OccupancyEntity;
import com.cidery.ledger.infrastructure.persistence.entity.VesselEntity;
import com.cidery.ledger.infrastructure.persistence.repository.BatchRepository;
import com.cidery.ledger.infrastructure.persistence.repository.OccupancyRepository;
import com.cidery.ledger.infrastructure.persistence.repository.VesselRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.Marker;
import org.slf4j.MarkerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Shared building blocks of the ledger commands: loading records for mutation,
 * the pre-write checks, posting entries against the batch projection, occupancy
 * bookkeeping and audit snapshots.
 *
 * Every method here expects to run inside the caller's transaction.
 */
@Component
public class LedgerStore {

    private static final Logger log = LoggerFactory.getLogger(LedgerStore.class);
    static final Marker LEDGER_INVARIANT = MarkerFactory.getMarker("LEDGER_INVARIANT");

    private final VesselRepository vesselRepository;
    private final BatchRepository batchRepository;
    private final OccupancyRepository occupancyRepository;
    private final TransactionLogService transactionLog;
    private final AuditService auditService;
    private final LedgerMapper mapper;
    private final VesselStateMachine stateMachine;
    private final LedgerEventPublisher eventPublisher;
    private final CorrelationIdService correlationIdService;
    private final MetricsService metricsService;

    public LedgerStore(VesselRepository vesselRepository,
                       BatchRepository batchRepository,
                       OccupancyRepository occupancyRepository,
                       TransactionLogService transactionLog,
                       AuditService auditService,
                       LedgerMapper mapper,
                       VesselStateMachine stateMachine,
                       LedgerEventPublisher eventPublisher,
                       CorrelationIdService correlationIdService,
                       MetricsService metricsService) {
        this.vesselRepository = vesselRepository;
        this.batchRepository = batchRepository;
        this.occupancyRepository = occupancyRepository;
        this.transactionLog = transactionLog;
        this.auditService = auditService;
        this.mapper = mapper;
        this.stateMachine = stateMachine;
        this.eventPublisher = eventPublisher;
        this.correlationIdService = correlationIdService;
        this.metricsService = metricsService;
    }

    /**
     * Start a command. Its event is published when the surrounding transaction commits.
     */
    public LedgerOperation begin(String name, String actorId, String reason) {
        LedgerOperation operation =
                LedgerOperation.start(name, actorId, reason, correlationIdService.getCurrentCorrelationId());
        eventPublisher.publishAfterCommit(operation);
        return operation;
    }

    public VesselEntity loadVesselForUpdate(String vesselId) {
        requireId(vesselId, "vesselId");
        return vesselRepository.findForUpdate(vesselId)
                .orElseThrow(() -> new LedgerEntityNotFoundException("Vessel", vesselId));
    }

    /**
     * Load a batch for mutation, check the caller's expected version and verify the
     * stored projection against the log before anything is written.
     */
    public BatchEntity loadBatchForUpdate(String batchId, Long expectedVersion) {
        requireId(batchId, "batchId");
        BatchEntity batch = batchRepository.findForUpdate(batchId)
                .orElseThrow(() -> new LedgerEntityNotFoundException("Batch", batchId));
        if (expectedVersion != null && !expectedVersion.equals(batch.getVersion())) {
            throw new ConcurrentLedgerModificationException("Batch", batchId, expectedVersion, batch.getVersion());
        }
        verifyProjection(batch);
        return batch;
    }

    public BatchEntity loadOpenBatchForUpdate(String batchId, Long expectedVersion) {
        BatchEntity batch = loadBatchForUpdate(batchId, expectedVersion);
        requireOpen(batch);
        return batch;
    }

    public void requireOpen(BatchEntity batch) {
        if (batch.getStatus().isClosed()) {
            throw new BatchClosedException(batch.getId(), batch.getStatus());
        }
    }

    /**
     * The batch's volume column must equal the sum of its log entries. A mismatch is
     * a data-integrity failure: it is reported and never repaired here.
     */
    public BigDecimal verifyProjection(BatchEntity batch) {
        BigDecimal logged = transactionLog.sumFor(batch.getId());
        if (batch.getCurrentVolumeLiters().compareTo(logged) != 0) {
            metricsService.incrementInvariantViolation();
            log.error(LEDGER_INVARIANT, "Batch {} projection {} L disagrees with transaction log {} L",
                    batch.getId(), batch.getCurrentVolumeLiters().toPlainString(), logged.toPlainString());
            throw new LedgerInvariantViolationException(batch.getId(), batch.getCurrentVolumeLiters(), logged);
        }
        return logged;
    }

    public BigDecimal volumeIn(String batchId, String vesselId) {
        return transactionLog.sumFor(batchId, vesselId);
    }

    public Optional<OccupancyEntity> activeOccupancy(String vesselId) {
        return occupancyRepository.findActiveByVesselId(vesselId);
    }

    /**
     * The vessel the batch is in, when the caller did not name one. Fails when the
     * batch is in no vessel or in several.
     */
    public String resolveSingleVessel(String batchId, String vesselId) {
        if (vesselId != null) {
            return vesselId;
        }
        var occupancies = occupancyRepository.findActiveByBatchId(batchId);
        if (occupancies.isEmpty()) {
            throw new LedgerValidationException("BATCH_NOT_IN_VESSEL",
                    "Batch " + batchId + " is not in any vessel", Map.of("batchId", batchId));
        }
        if (occupancies.size() > 1) {
            throw new LedgerValidationException("VESSEL_REQUIRED",
                    "Batch " + batchId + " spans " + occupancies.size() + " vessels; name the vessel",
                    Map.of("batchId", batchId, "vesselCount", occupancies.size()));
        }
        return occupancies.get(0).getVesselId();
    }

    /**
     * The batch must currently occupy the vessel and hold at least the requested liters there.
     */
    public BigDecimal requireVolumeIn(BatchEntity batch, VesselEntity vessel, BigDecimal requestedLiters) {
        Optional<OccupancyEntity> occupancy = activeOccupancy(vessel.getId());
        if (occupancy.isEmpty() || !occupancy.get().getBatchId().equals(batch.getId())) {
            throw new LedgerValidationException("BATCH_NOT_IN_VESSEL",
                    "Batch " + batch.getId() + " is not in vessel " + vessel.getId(),
                    Map.of("batchId", batch.getId(), "vesselId", vessel.getId()));
        }
        BigDecimal available = volumeIn(batch.getId(), vessel.getId());
        if (requestedLiters.compareTo(available) > 0) {
            throw new InsufficientVolumeException(batch.getId(), vessel.getId(), requestedLiters, available);
        }
        return available;
    }

    /**
     * The vessel can take liquid of this batch: it is empty and available, or already
     * holds the same batch.
     */
    public void requireReceivable(VesselEntity vessel, String batchId) {
        Optional<OccupancyEntity> occupancy = activeOccupancy(vessel.getId());
        if (occupancy.isPresent()) {
            if (!occupancy.get().getBatchId().equals(batchId)) {
                throw new VesselOccupiedException(vessel.getId(), occupancy.get().getBatchId());
            }
            if (vessel.getStatus() != VesselStatus.OCCUPIED) {
                throw new VesselUnavailableException(vessel.getId(), vessel.getStatus());
            }
        } else if (vessel.getStatus() != VesselStatus.AVAILABLE) {
            throw new VesselUnavailableException(vessel.getId(), vessel.getStatus());
        }
    }

    public void requireCapacity(VesselEntity vessel, BigDecimal incomingLiters) {
        BigDecimal contents = contentsOf(vessel.getId());
        BigDecimal available = vessel.getCapacityLiters().subtract(contents);
        if (incomingLiters.compareTo(available) > 0) {
            throw new CapacityExceededException(vessel.getId(), incomingLiters, available);
        }
    }

    public BigDecimal contentsOf(String vesselId) {
        return activeOccupancy(vesselId)
                .map(occupancy -> volumeIn(occupancy.getBatchId(), vesselId))
                .orElse(BigDecimal.ZERO);
    }

    /**
     * Append an entry and move the batch projection by the same delta.
     */
    public TransactionEntry post(LedgerOperation operation, TransactionType type, BatchEntity batch,
                                 EntryDraft draft) {
        draft.setBatchId(batch.getId());
        TransactionEntry entry = transactionLog.append(operation, type, draft);
        batch.setCurrentVolumeLiters(batch.getCurrentVolumeLiters().add(entry.getQuantityDelta().getAmount()));
        operation.touchBatch(batch.getId());
        operation.touchVessel(draft.getVesselId());
        return entry;
    }

    /**
     * Record the batch as the vessel's occupant if it is not already, marking the vessel occupied.
     */
    public void occupy(LedgerOperation operation, VesselEntity vessel, String batchId) {
        Optional<OccupancyEntity> current = activeOccupancy(vessel.getId());
        if (current.isPresent()) {
            return;
        }
        occupancyRepository.save(OccupancyEntity.builder()
                .vesselId(vessel.getId())
                .batchId(batchId)
                .since(operation.getOccurredAt())
                .build());
        applyVesselEvent(operation, vessel, VesselStateMachine.Event.FILL, false);
        log.info("Vessel {} now holds batch {}", vessel.getId(), batchId);
    }

    /**
     * Release the vessel when the batch no longer has liquid in it.
     *
     * @return true when the vessel was released
     */
    public boolean releaseIfDrained(LedgerOperation operation, VesselEntity vessel, String batchId) {
        if (volumeIn(batchId, vessel.getId()).signum() != 0) {
            return false;
        }
        release(operation, vessel, batchId);
        return true;
    }

    public void release(LedgerOperation operation, VesselEntity vessel, String batchId) {
        Optional<OccupancyEntity> occupancy = activeOccupancy(vessel.getId());
        if (occupancy.isEmpty() || !occupancy.get().getBatchId().equals(batchId)) {
            return;
        }
        occupancy.get().setReleasedAt(operation.getOccurredAt());
        occupancyRepository.saveAndFlush(occupancy.get());
        applyVesselEvent(operation, vessel, VesselStateMachine.Event.DRAIN, true);
        log.info("Vessel {} released by batch {}", vessel.getId(), batchId);
    }

    private void applyVesselEvent(LedgerOperation operation, VesselEntity vessel, VesselStateMachine.Event event,
                                  boolean empty) {
        VesselStateMachine.TransitionResult result = stateMachine.transition(vessel.getStatus(), event, empty);
        if (!result.isValid()) {
            throw new InvalidStateTransitionException("Vessel", vessel.getId(), vessel.getStatus().name(),
                    event.name(), result.getErrorMessage());
        }
        if (result.isStateChanged()) {
            Vessel before = snapshot(vessel);
            vessel.setStatus(result.getNewState());
            operation.touchVessel(vessel.getId());
            auditVessel(operation, AuditOperation.UPDATE, before, vessel);
        }
    }

    public Batch snapshot(BatchEntity batch) {
        return mapper.toBatch(batch, transactionLog.volumesByVessel(batch.getId()));
    }

    public Vessel snapshot(VesselEntity vessel) {
        return mapper.toVessel(vessel);
    }

    public Batch auditBatch(LedgerOperation operation, AuditOperation auditOperation, Batch before, BatchEntity after) {
        Batch current = snapshot(after);
        auditService.record(operation, auditOperation, AuditService.TABLE_BATCHES, after.getId(), before, current);
        return current;
    }

    public Vessel auditVessel(LedgerOperation operation, AuditOperation auditOperation, Vessel before,
                              VesselEntity after) {
        Vessel current = snapshot(after);
        auditService.record(operation, auditOperation, AuditService.TABLE_VESSELS, after.getId(), before, current);
        return current;
    }

    public Map<String, BatchEntity> lockBatches(Iterable<String> batchIds) {
        Map<String, BatchEntity> batches = new LinkedHashMap<>();
        for (String batchId : batchIds) {
            batches.computeIfAbsent(batchId, id -> loadOpenBatchForUpdate(id, null));
        }
        return batches;
    }

    public static void requireId(String id, String field) {
        if (id == null || id.isBlank()) {
            throw new LedgerValidationException("MISSING_FIELD", field + " is required", Map.of("field", field));
        }
    }

    /**
     * Liters of a strictly positive volume quantity.
     */
    public static BigDecimal positiveLiters(Quantity quantity, String field) {
        if (quantity == null) {
            throw new LedgerValidationException("MISSING_FIELD", field + " is required", Map.of("field", field));
        }
        BigDecimal liters = quantity.toLiters();
        if (liters.signum() <= 0) {
            throw new LedgerValidationException("INVALID_QUANTITY", field + " must be greater than zero",
                    Map.of("field", field, "liters", liters));
        }
        return liters;
    }
}
