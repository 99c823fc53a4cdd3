package com.cidery.ledger.application.service;

import com.cidery.ledger.application.statemachine.VesselStateMachine;
import com.cidery.ledger.domain.command.AssignBatchCommand;
import com.cidery.ledger.domain.command.ChangeBatchStatusCommand;
import com.cidery.ledger.domain.command.ChangeVesselStatusCommand;
import com.cidery.ledger.domain.command.RecordFillCommand;
import com.cidery.ledger.domain.command.RecordLossCommand;
import com.cidery.ledger.domain.command.RecordRemovalCommand;
import com.cidery.ledger.domain.command.RegisterBatchCommand;
import com.cidery.ledger.domain.command.RegisterVesselCommand;
import com.cidery.ledger.domain.command.SplitBatchCommand;
import com.cidery.ledger.domain.command.TransferVolumeCommand;
import com.cidery.ledger.domain.command.VolumeAdjustmentCommand;
import com.cidery.ledger.domain.enums.AuditOperation;
import com.cidery.ledger.domain.enums.BatchStatus;
import com.cidery.ledger.domain.enums.LossType;
import com.cidery.ledger.domain.enums.SourceType;
import com.cidery.ledger.domain.enums.TransactionType;
import com.cidery.ledger.domain.enums.VesselStatus;
import com.cidery.ledger.domain.exception.BatchClosedException;
import com.cidery.ledger.domain.exception.CapacityExceededException;
import com.cidery.ledger.domain.exception.InvalidStateTransitionException;
import com.cidery.ledger.domain.exception.LedgerEntityNotFoundException;
import com.cidery.ledger.domain.exception.LedgerValidationException;
import com.cidery.ledger.domain.exception.VesselOccupiedException;
import com.cidery.ledger.domain.exception.VesselUnavailableException;
import com.cidery.ledger.domain.model.Batch;
import com.cidery.ledger.domain.model.LedgerResult;
import com.cidery.ledger.domain.model.LedgerWarning;
import com.cidery.ledger.domain.model.Quantity;
import com.cidery.ledger.domain.model.SourceRef;
import com.cidery.ledger.domain.model.Vessel;
import com.cidery.ledger.domain.model.VesselOccupant;
import com.cidery.ledger.domain.model.detail.AdjustmentDetail;
import com.cidery.ledger.domain.model.detail.FillDetail;
import com.cidery.ledger.domain.model.detail.LossDetail;
import com.cidery.ledger.domain.model.detail.RemovalDetail;
import com.cidery.ledger.domain.model.detail.SplitDetail;
import com.cidery.ledger.domain.model.detail.TransferDetail;
import com.cidery.ledger.domain.units.UnitConverter;
import com.cidery.ledger.domain.units.VolumeUnit;
import com.cidery.ledger.infrastructure.persistence.entity.BatchEntity;
import com.cidery.ledger.infrastructure.persistence.entity.OccupancyEntity;
import com.cidery.ledger.infrastructure.persistence.entity.VesselEntity;
import com.cidery.ledger.infrastructure.persistence.repository.BatchRepository;
import com.cidery.ledger.infrastructure.persistence.repository.OccupancyRepository;
import com.cidery.ledger.infrastructure.persistence.repository.VesselRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The vessel-batch ledger: tracks which batch sits in which vessel and every volume
 * movement between them.
 *
 * Each mutating method is one transaction. All checks run before the first write, so a
 * rejected command leaves no entries behind.
 */
@Service
public class LedgerService {

    private static final Logger log = LoggerFactory.getLogger(LedgerService.class);

    private final LedgerStore store;
    private final VesselRepository vesselRepository;
    private final BatchRepository batchRepository;
    private final OccupancyRepository occupancyRepository;
    private final TransactionLogService transactionLog;
    private final LedgerMapper mapper;
    private final VesselStateMachine stateMachine;
    private final AdjustmentPolicy adjustmentPolicy;

    public LedgerService(LedgerStore store,
                         VesselRepository vesselRepository,
                         BatchRepository batchRepository,
                         OccupancyRepository occupancyRepository,
                         TransactionLogService transactionLog,
                         LedgerMapper mapper,
                         VesselStateMachine stateMachine,
                         AdjustmentPolicy adjustmentPolicy) {
        this.store = store;
        this.vesselRepository = vesselRepository;
        this.batchRepository = batchRepository;
        this.occupancyRepository = occupancyRepository;
        this.transactionLog = transactionLog;
        this.mapper = mapper;
        this.stateMachine = stateMachine;
        this.adjustmentPolicy = adjustmentPolicy;
    }

    @Transactional
    public LedgerResult<Vessel> registerVessel(RegisterVesselCommand command) {
        LedgerStore.requireId(command.getVesselId(), "vesselId");
        LedgerStore.requireId(command.getName(), "name");
        BigDecimal capacityLiters = LedgerStore.positiveLiters(command.getCapacity(), "capacity");
        if (vesselRepository.existsById(command.getVesselId())) {
            throw new LedgerValidationException("ALREADY_EXISTS",
                    "Vessel " + command.getVesselId() + " already exists", Map.of("vesselId", command.getVesselId()));
        }

        LedgerOperation operation = store.begin("REGISTER_VESSEL", command.getActorId(), null);
        VesselEntity vessel = vesselRepository.saveAndFlush(VesselEntity.builder()
                .id(command.getVesselId())
                .name(command.getName())
                .capacityLiters(capacityLiters)
                .capacityUnit(command.getCapacity().getUnitSymbol())
                .status(VesselStatus.AVAILABLE)
                .location(command.getLocation())
                .build());
        operation.touchVessel(vessel.getId());

        log.info("Registered vessel {} ({} L)", vessel.getId(), capacityLiters.toPlainString());
        return LedgerResult.of(store.auditVessel(operation, AuditOperation.CREATE, null, vessel));
    }

    @Transactional
    public LedgerResult<Batch> registerBatch(RegisterBatchCommand command) {
        LedgerStore.requireId(command.getBatchId(), "batchId");
        LedgerStore.requireId(command.getName(), "name");
        BatchStatus status = command.getStatus() != null ? command.getStatus() : BatchStatus.FERMENTATION;
        if (status.isClosed()) {
            throw new LedgerValidationException("INVALID_STATUS", "A new batch cannot start " + status,
                    Map.of("status", status));
        }
        requireAbv(command.getAbvPct());
        if (batchRepository.existsById(command.getBatchId())) {
            throw new LedgerValidationException("ALREADY_EXISTS",
                    "Batch " + command.getBatchId() + " already exists", Map.of("batchId", command.getBatchId()));
        }

        LedgerOperation operation = store.begin("REGISTER_BATCH", command.getActorId(), null);
        List<SourceRef> composition = mapper.mergeComposition(
                command.getCompositionSources() != null ? command.getCompositionSources() : new ArrayList<>(),
                new ArrayList<>());
        BatchEntity batch = batchRepository.saveAndFlush(BatchEntity.builder()
                .id(command.getBatchId())
                .name(command.getName())
                .status(status)
                .abvPct(command.getAbvPct())
                .taxClass(command.getTaxClass())
                .currentVolumeLiters(BigDecimal.ZERO.setScale(UnitConverter.VOLUME_SCALE))
                .compositionSources(mapper.writeComposition(composition))
                .build());
        operation.touchBatch(batch.getId());

        log.info("Registered batch {} ({})", batch.getId(), status);
        return LedgerResult.of(store.auditBatch(operation, AuditOperation.CREATE, null, batch));
    }

    /**
     * Put a batch into an empty vessel with its first volume.
     */
    @Transactional
    public LedgerResult<Batch> assign(AssignBatchCommand command) {
        BigDecimal liters = LedgerStore.positiveLiters(command.getQuantity(), "quantity");
        BatchEntity batch = store.loadOpenBatchForUpdate(command.getBatchId(), command.getExpectedVersion());
        VesselEntity vessel = store.loadVesselForUpdate(command.getVesselId());

        Optional<OccupancyEntity> occupant = store.activeOccupancy(vessel.getId());
        if (occupant.isPresent()) {
            throw new VesselOccupiedException(vessel.getId(), occupant.get().getBatchId());
        }
        if (vessel.getStatus() != VesselStatus.AVAILABLE) {
            throw new VesselUnavailableException(vessel.getId(), vessel.getStatus());
        }
        if (liters.compareTo(vessel.getCapacityLiters()) > 0) {
            throw new CapacityExceededException(vessel.getId(), liters, vessel.getCapacityLiters());
        }

        LedgerOperation operation = store.begin("ASSIGN", command.getActorId(), command.getReason());
        Batch before = store.snapshot(batch);
        store.occupy(operation, vessel, batch.getId());
        store.post(operation, TransactionType.FILL, batch, fillDraft(vessel.getId(), liters, batch, command.getSource(), true));
        addSource(batch, command.getSource(), liters);

        log.info("Assigned batch {} to vessel {} with {} L", batch.getId(), vessel.getId(), liters.toPlainString());
        return LedgerResult.of(store.auditBatch(operation, AuditOperation.UPDATE, before, batch));
    }

    /**
     * Add liquid to a batch in a vessel it already occupies.
     */
    @Transactional
    public LedgerResult<Batch> recordFill(RecordFillCommand command) {
        BigDecimal liters = LedgerStore.positiveLiters(command.getQuantity(), "quantity");
        BatchEntity batch = store.loadOpenBatchForUpdate(command.getBatchId(), command.getExpectedVersion());
        VesselEntity vessel = store.loadVesselForUpdate(command.getVesselId());

        Optional<OccupancyEntity> occupant = store.activeOccupancy(vessel.getId());
        if (occupant.isEmpty()) {
            throw new LedgerValidationException("BATCH_NOT_IN_VESSEL",
                    "Batch " + batch.getId() + " is not in vessel " + vessel.getId() + "; assign it first",
                    Map.of("batchId", batch.getId(), "vesselId", vessel.getId()));
        }
        store.requireReceivable(vessel, batch.getId());
        store.requireCapacity(vessel, liters);

        LedgerOperation operation = store.begin("FILL", command.getActorId(), command.getReason());
        Batch before = store.snapshot(batch);
        store.post(operation, TransactionType.FILL, batch, fillDraft(vessel.getId(), liters, batch, command.getSource(), false));
        addSource(batch, command.getSource(), liters);

        log.info("Filled {} L into batch {} in vessel {}", liters.toPlainString(), batch.getId(), vessel.getId());
        return LedgerResult.of(store.auditBatch(operation, AuditOperation.UPDATE, before, batch));
    }

    /**
     * Move volume between vessels. The two TRANSFER entries cancel out; a loss during
     * the move is booked separately against the source vessel.
     */
    @Transactional
    public LedgerResult<Batch> transfer(TransferVolumeCommand command) {
        BigDecimal liters = LedgerStore.positiveLiters(command.getQuantity(), "quantity");
        BigDecimal lossLiters = command.getLoss() == null ? BigDecimal.ZERO : command.getLoss().toLiters();
        if (command.getFromVesselId() != null && command.getFromVesselId().equals(command.getToVesselId())) {
            throw new LedgerValidationException("SAME_VESSEL", "Source and destination vessel are the same",
                    Map.of("vesselId", command.getFromVesselId()));
        }
        BatchEntity batch = store.loadOpenBatchForUpdate(command.getBatchId(), command.getExpectedVersion());
        VesselEntity from = store.loadVesselForUpdate(command.getFromVesselId());
        VesselEntity to = store.loadVesselForUpdate(command.getToVesselId());

        store.requireVolumeIn(batch, from, liters.add(lossLiters));
        store.requireReceivable(to, batch.getId());
        store.requireCapacity(to, liters);

        LedgerOperation operation = store.begin("TRANSFER", command.getActorId(), command.getReason());
        Batch before = store.snapshot(batch);
        TransferDetail detail = TransferDetail.builder()
                .fromVesselId(from.getId())
                .toVesselId(to.getId())
                .build();
        store.post(operation, TransactionType.TRANSFER, batch, EntryDraft.builder()
                .vesselId(from.getId())
                .deltaLiters(liters.negate())
                .abvPct(batch.getAbvPct())
                .reasonCode(TransactionType.TRANSFER.name())
                .detail(detail)
                .build());
        store.occupy(operation, to, batch.getId());
        store.post(operation, TransactionType.TRANSFER, batch, EntryDraft.builder()
                .vesselId(to.getId())
                .deltaLiters(liters)
                .abvPct(batch.getAbvPct())
                .reasonCode(TransactionType.TRANSFER.name())
                .detail(detail)
                .build());
        if (lossLiters.signum() > 0) {
            store.post(operation, TransactionType.LOSS, batch, EntryDraft.builder()
                    .vesselId(from.getId())
                    .deltaLiters(lossLiters.negate())
                    .abvPct(batch.getAbvPct())
                    .reasonCode(LossType.TRANSFER.name())
                    .detail(LossDetail.builder().lossType(LossType.TRANSFER).transferToVesselId(to.getId()).build())
                    .build());
        }
        store.releaseIfDrained(operation, from, batch.getId());

        log.info("Transferred {} L of batch {} from {} to {} (loss {} L)", liters.toPlainString(), batch.getId(),
                from.getId(), to.getId(), lossLiters.toPlainString());
        return LedgerResult.of(store.auditBatch(operation, AuditOperation.UPDATE, before, batch));
    }

    /**
     * Book the difference between a measured and the computed volume of a batch in one vessel.
     */
    @Transactional
    public LedgerResult<Batch> adjust(VolumeAdjustmentCommand command) {
        if (command.getMeasuredVolume() == null) {
            throw new LedgerValidationException("MISSING_FIELD", "measuredVolume is required",
                    Map.of("field", "measuredVolume"));
        }
        BigDecimal measured = command.getMeasuredVolume().toLiters();
        BatchEntity batch = store.loadOpenBatchForUpdate(command.getBatchId(), command.getExpectedVersion());
        String vesselId = store.resolveSingleVessel(batch.getId(), command.getVesselId());
        VesselEntity vessel = store.loadVesselForUpdate(vesselId);
        BigDecimal computed = store.requireVolumeIn(batch, vessel, BigDecimal.ZERO);
        BigDecimal delta = measured.subtract(computed);

        adjustmentPolicy.checkDirection(batch.getId(), command.getAdjustmentType(), delta);
        if (delta.signum() > 0 && measured.compareTo(vessel.getCapacityLiters()) > 0) {
            throw new CapacityExceededException(vessel.getId(), delta,
                    vessel.getCapacityLiters().subtract(computed));
        }
        Optional<LedgerWarning> warning = adjustmentPolicy.largeAdjustment(batch.getId(), computed, delta);

        LedgerOperation operation = store.begin("ADJUST", command.getActorId(), command.getReason());
        Batch before = store.snapshot(batch);
        store.post(operation, TransactionType.ADJUSTMENT, batch, EntryDraft.builder()
                .vesselId(vessel.getId())
                .deltaLiters(delta)
                .abvPct(batch.getAbvPct())
                .reasonCode(command.getAdjustmentType().name())
                .detail(AdjustmentDetail.builder()
                        .adjustmentType(command.getAdjustmentType())
                        .computedLiters(computed)
                        .measuredLiters(measured)
                        .largeAdjustment(warning.isPresent())
                        .build())
                .build());
        store.releaseIfDrained(operation, vessel, batch.getId());

        log.info("Adjusted batch {} in vessel {} by {} L ({})", batch.getId(), vessel.getId(),
                delta.toPlainString(), command.getAdjustmentType());
        Batch after = store.auditBatch(operation, AuditOperation.UPDATE, before, batch);
        return warning.map(w -> LedgerResult.of(after, List.of(w))).orElseGet(() -> LedgerResult.of(after));
    }

    @Transactional
    public LedgerResult<Batch> recordLoss(RecordLossCommand command) {
        BigDecimal liters = LedgerStore.positiveLiters(command.getQuantity(), "quantity");
        LossType lossType = command.getLossType() != null ? command.getLossType() : LossType.OTHER;
        BatchEntity batch = store.loadOpenBatchForUpdate(command.getBatchId(), null);
        VesselEntity vessel = store.loadVesselForUpdate(store.resolveSingleVessel(batch.getId(), command.getVesselId()));
        store.requireVolumeIn(batch, vessel, liters);

        LedgerOperation operation = store.begin("LOSS", command.getActorId(), command.getReason());
        Batch before = store.snapshot(batch);
        store.post(operation, TransactionType.LOSS, batch, EntryDraft.builder()
                .vesselId(vessel.getId())
                .deltaLiters(liters.negate())
                .abvPct(batch.getAbvPct())
                .reasonCode(lossType.name())
                .detail(LossDetail.builder().lossType(lossType).build())
                .build());
        store.releaseIfDrained(operation, vessel, batch.getId());

        log.info("Recorded {} loss of {} L on batch {}", lossType, liters.toPlainString(), batch.getId());
        return LedgerResult.of(store.auditBatch(operation, AuditOperation.UPDATE, before, batch));
    }

    /**
     * Liquid leaving the batch for good: distillation, packaging, tax-paid removal and the like.
     */
    @Transactional
    public LedgerResult<Batch> recordRemoval(RecordRemovalCommand command) {
        BigDecimal liters = LedgerStore.positiveLiters(command.getQuantity(), "quantity");
        if (command.getRemovalType() == null) {
            throw new LedgerValidationException("MISSING_FIELD", "removalType is required",
                    Map.of("field", "removalType"));
        }
        BatchEntity batch = store.loadOpenBatchForUpdate(command.getBatchId(), null);
        VesselEntity vessel = store.loadVesselForUpdate(store.resolveSingleVessel(batch.getId(), command.getVesselId()));
        store.requireVolumeIn(batch, vessel, liters);

        LedgerOperation operation = store.begin("REMOVAL", command.getActorId(), command.getReason());
        Batch before = store.snapshot(batch);
        BigDecimal proofGallons = batch.getAbvPct() == null
                ? null
                : UnitConverter.proofGallons(liters, VolumeUnit.LITER, batch.getAbvPct());
        store.post(operation, TransactionType.REMOVAL, batch, EntryDraft.builder()
                .vesselId(vessel.getId())
                .deltaLiters(liters.negate())
                .abvPct(batch.getAbvPct())
                .reasonCode(command.getRemovalType().name())
                .detail(RemovalDetail.builder()
                        .removalType(command.getRemovalType())
                        .destination(command.getDestination())
                        .proofGallons(proofGallons)
                        .build())
                .build());
        store.releaseIfDrained(operation, vessel, batch.getId());

        log.info("Removed {} L from batch {} for {}", liters.toPlainString(), batch.getId(), command.getRemovalType());
        return LedgerResult.of(store.auditBatch(operation, AuditOperation.UPDATE, before, batch));
    }

    /**
     * Move part of a batch into a new child batch in an empty vessel.
     */
    @Transactional
    public LedgerResult<Batch> split(SplitBatchCommand command) {
        BigDecimal liters = LedgerStore.positiveLiters(command.getQuantity(), "quantity");
        LedgerStore.requireId(command.getNewBatchId(), "newBatchId");
        if (batchRepository.existsById(command.getNewBatchId())) {
            throw new LedgerValidationException("ALREADY_EXISTS",
                    "Batch " + command.getNewBatchId() + " already exists", Map.of("batchId", command.getNewBatchId()));
        }
        if (command.getToVesselId() != null && command.getToVesselId().equals(command.getFromVesselId())) {
            throw new LedgerValidationException("SAME_VESSEL", "A split needs a different destination vessel",
                    Map.of("vesselId", command.getToVesselId()));
        }
        BatchEntity parent = store.loadOpenBatchForUpdate(command.getBatchId(), null);
        VesselEntity from = store.loadVesselForUpdate(store.resolveSingleVessel(parent.getId(), command.getFromVesselId()));
        VesselEntity to = store.loadVesselForUpdate(command.getToVesselId());
        store.requireVolumeIn(parent, from, liters);
        store.requireReceivable(to, command.getNewBatchId());
        store.requireCapacity(to, liters);

        LedgerOperation operation = store.begin("SPLIT", command.getActorId(), command.getReason());
        Batch parentBefore = store.snapshot(parent);
        BatchEntity child = batchRepository.saveAndFlush(BatchEntity.builder()
                .id(command.getNewBatchId())
                .name(command.getNewBatchName() != null ? command.getNewBatchName() : command.getNewBatchId())
                .status(parent.getStatus())
                .abvPct(parent.getAbvPct())
                .taxClass(parent.getTaxClass())
                .currentVolumeLiters(BigDecimal.ZERO.setScale(UnitConverter.VOLUME_SCALE))
                .compositionSources(mapper.writeComposition(List.of(SourceRef.builder()
                        .sourceType(SourceType.BATCH)
                        .sourceId(parent.getId())
                        .volumeLiters(liters)
                        .percentage(BigDecimal.valueOf(100).setScale(UnitConverter.ABV_SCALE))
                        .build())))
                .build());

        SplitDetail detail = SplitDetail.builder()
                .parentBatchId(parent.getId())
                .childBatchId(child.getId())
                .fromVesselId(from.getId())
                .toVesselId(to.getId())
                .build();
        store.post(operation, TransactionType.SPLIT, parent, EntryDraft.builder()
                .vesselId(from.getId())
                .deltaLiters(liters.negate())
                .abvPct(parent.getAbvPct())
                .reasonCode(TransactionType.SPLIT.name())
                .detail(detail)
                .build());
        store.occupy(operation, to, child.getId());
        store.post(operation, TransactionType.SPLIT, child, EntryDraft.builder()
                .vesselId(to.getId())
                .deltaLiters(liters)
                .abvPct(child.getAbvPct())
                .reasonCode(TransactionType.SPLIT.name())
                .detail(detail)
                .build());
        store.releaseIfDrained(operation, from, parent.getId());

        store.auditBatch(operation, AuditOperation.UPDATE, parentBefore, parent);
        log.info("Split {} L of batch {} into new batch {} in vessel {}", liters.toPlainString(), parent.getId(),
                child.getId(), to.getId());
        return LedgerResult.of(store.auditBatch(operation, AuditOperation.CREATE, null, child));
    }

    /**
     * Operator-driven vessel status change. OCCUPIED is only ever reached by putting
     * liquid into the vessel.
     */
    @Transactional
    public LedgerResult<Vessel> changeVesselStatus(ChangeVesselStatusCommand command) {
        if (command.getStatus() == null) {
            throw new LedgerValidationException("MISSING_FIELD", "status is required", Map.of("field", "status"));
        }
        VesselEntity vessel = store.loadVesselForUpdate(command.getVesselId());
        VesselStatus current = vessel.getStatus();
        VesselStatus target = command.getStatus();
        boolean empty = store.activeOccupancy(vessel.getId()).isEmpty();

        if (current == target) {
            throw new InvalidStateTransitionException("Vessel", vessel.getId(), current.name(), target.name(),
                    "vessel is already " + current);
        }
        VesselStateMachine.Event event = stateMachine.eventFor(current, target);
        if (event == null) {
            throw new InvalidStateTransitionException("Vessel", vessel.getId(), current.name(), target.name(),
                    "a vessel becomes OCCUPIED only when liquid is put into it");
        }
        VesselStateMachine.TransitionResult result = stateMachine.transition(current, event, empty);
        if (!result.isValid() || result.getNewState() != target) {
            String reason = result.isValid()
                    ? "vessel would become " + result.getNewState()
                    : result.getErrorMessage();
            throw new InvalidStateTransitionException("Vessel", vessel.getId(), current.name(), target.name(), reason);
        }

        LedgerOperation operation = store.begin("VESSEL_STATUS", command.getActorId(), command.getReason());
        Vessel before = store.snapshot(vessel);
        vessel.setStatus(target);
        operation.touchVessel(vessel.getId());

        log.info("Vessel {} status {} -> {}", vessel.getId(), current, target);
        return LedgerResult.of(store.auditVessel(operation, AuditOperation.UPDATE, before, vessel));
    }

    /**
     * Move a batch through its lifecycle. Closing a batch requires it to be empty.
     */
    @Transactional
    public LedgerResult<Batch> changeBatchStatus(ChangeBatchStatusCommand command) {
        if (command.getStatus() == null) {
            throw new LedgerValidationException("MISSING_FIELD", "status is required", Map.of("field", "status"));
        }
        BatchEntity batch = store.loadBatchForUpdate(command.getBatchId(), null);
        if (batch.getStatus().isClosed()) {
            throw new BatchClosedException(batch.getId(), batch.getStatus());
        }
        BatchStatus target = command.getStatus();
        if (batch.getStatus() == target) {
            throw new InvalidStateTransitionException("Batch", batch.getId(), target.name(), target.name(),
                    "batch is already " + target);
        }
        if (target.isClosed() && batch.getCurrentVolumeLiters().signum() != 0) {
            throw new InvalidStateTransitionException("Batch", batch.getId(), batch.getStatus().name(), target.name(),
                    "batch still holds " + batch.getCurrentVolumeLiters().toPlainString() + " L");
        }

        LedgerOperation operation = store.begin("BATCH_STATUS", command.getActorId(), command.getReason());
        Batch before = store.snapshot(batch);
        if (target.isClosed()) {
            for (OccupancyEntity occupancy : occupancyRepository.findActiveByBatchId(batch.getId())) {
                store.release(operation, store.loadVesselForUpdate(occupancy.getVesselId()), batch.getId());
            }
        }
        batch.setStatus(target);
        operation.touchBatch(batch.getId());

        log.info("Batch {} status {} -> {}", batch.getId(), before.getStatus(), target);
        return LedgerResult.of(store.auditBatch(operation, AuditOperation.UPDATE, before, batch));
    }

    /**
     * Volume of a batch, summed from its log entries.
     */
    @Transactional(readOnly = true)
    public Quantity currentVolume(String batchId) {
        BatchEntity batch = batchRepository.findById(batchId)
                .orElseThrow(() -> new LedgerEntityNotFoundException("Batch", batchId));
        return Quantity.liters(transactionLog.sumFor(batchId), batch.getAbvPct());
    }

    @Transactional(readOnly = true)
    public Optional<String> occupant(String vesselId) {
        requireVessel(vesselId);
        return store.activeOccupancy(vesselId).map(OccupancyEntity::getBatchId);
    }

    @Transactional(readOnly = true)
    public Optional<VesselOccupant> vesselContents(String vesselId) {
        requireVessel(vesselId);
        return store.activeOccupancy(vesselId).map(occupancy -> {
            BatchEntity batch = batchRepository.findById(occupancy.getBatchId())
                    .orElseThrow(() -> new LedgerEntityNotFoundException("Batch", occupancy.getBatchId()));
            return VesselOccupant.builder()
                    .vesselId(vesselId)
                    .batchId(batch.getId())
                    .batchName(batch.getName())
                    .volume(Quantity.liters(store.volumeIn(batch.getId(), vesselId), batch.getAbvPct()))
                    .since(occupancy.getSince())
                    .build();
        });
    }

    /**
     * Check the batch's stored volume against its log.
     *
     * @throws com.cidery.ledger.domain.exception.LedgerInvariantViolationException on mismatch
     */
    @Transactional(readOnly = true)
    public Batch verifyIntegrity(String batchId) {
        BatchEntity batch = batchRepository.findById(batchId)
                .orElseThrow(() -> new LedgerEntityNotFoundException("Batch", batchId));
        store.verifyProjection(batch);
        return store.snapshot(batch);
    }

    private void requireVessel(String vesselId) {
        if (!vesselRepository.existsById(vesselId)) {
            throw new LedgerEntityNotFoundException("Vessel", vesselId);
        }
    }

    private EntryDraft fillDraft(String vesselId, BigDecimal liters, BatchEntity batch, SourceRef source,
                                 boolean assignment) {
        return EntryDraft.builder()
                .vesselId(vesselId)
                .deltaLiters(liters)
                .abvPct(batch.getAbvPct())
                .reasonCode(assignment ? "ASSIGN" : TransactionType.FILL.name())
                .detail(FillDetail.builder()
                        .assignment(assignment)
                        .sourceType(source != null ? source.getSourceType() : null)
                        .sourceId(source != null ? source.getSourceId() : null)
                        .build())
                .build();
    }

    private void addSource(BatchEntity batch, SourceRef source, BigDecimal liters) {
        if (source == null || source.getSourceType() == null) {
            return;
        }
        SourceRef contribution = SourceRef.builder()
                .sourceType(source.getSourceType())
                .sourceId(source.getSourceId())
                .volumeLiters(liters)
                .build();
        List<SourceRef> merged = mapper.mergeComposition(
                mapper.readComposition(batch.getCompositionSources()), List.of(contribution));
        batch.setCompositionSources(mapper.writeComposition(merged));
    }

    private static void requireAbv(BigDecimal abvPct) {
        if (abvPct != null && (abvPct.signum() < 0 || abvPct.compareTo(BigDecimal.valueOf(100)) > 0)) {
            throw new LedgerValidationException("INVALID_ABV", "ABV must be between 0 and 100",
                    Map.of("abvPct", abvPct));
        }
    }
}
