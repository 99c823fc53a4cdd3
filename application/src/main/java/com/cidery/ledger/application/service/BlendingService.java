package com.cidery.ledger.application.service;

import com.cidery.ledger.domain.command.BlendOperation;
import com.cidery.ledger.domain.enums.AuditOperation;
import com.cidery.ledger.domain.enums.BatchStatus;
import com.cidery.ledger.domain.enums.SourceType;
import com.cidery.ledger.domain.enums.TransactionType;
import com.cidery.ledger.domain.exception.EmptyBlendException;
import com.cidery.ledger.domain.exception.LedgerValidationException;
import com.cidery.ledger.domain.exception.VesselOccupiedException;
import com.cidery.ledger.domain.model.Batch;
import com.cidery.ledger.domain.model.BlendCalculation;
import com.cidery.ledger.domain.model.BlendComponent;
import com.cidery.ledger.domain.model.BlendResult;
import com.cidery.ledger.domain.model.LedgerResult;
import com.cidery.ledger.domain.model.Quantity;
import com.cidery.ledger.domain.model.SourceDeduction;
import com.cidery.ledger.domain.model.SourceRef;
import com.cidery.ledger.domain.model.detail.BlendDetail;
import com.cidery.ledger.domain.units.UnitConverter;
import com.cidery.ledger.infrastructure.persistence.entity.BatchEntity;
import com.cidery.ledger.infrastructure.persistence.entity.OccupancyEntity;
import com.cidery.ledger.infrastructure.persistence.entity.VesselEntity;
import com.cidery.ledger.infrastructure.persistence.repository.BatchRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Combines volumes of several batches into one destination batch.
 *
 * Every source and the destination is validated before the first write. Each source
 * gets a negative BLEND entry on its vessel and the destination one positive BLEND
 * entry for the total, so the blend is volume-neutral across the ledger.
 */
@Service
public class BlendingService {

    private static final Logger log = LoggerFactory.getLogger(BlendingService.class);

    private final LedgerStore store;
    private final BatchRepository batchRepository;
    private final BlendCalculator calculator;
    private final LedgerMapper mapper;

    public BlendingService(LedgerStore store,
                           BatchRepository batchRepository,
                           BlendCalculator calculator,
                           LedgerMapper mapper) {
        this.store = store;
        this.batchRepository = batchRepository;
        this.calculator = calculator;
        this.mapper = mapper;
    }

    @Transactional
    public LedgerResult<BlendResult> applyBlend(BlendOperation blend) {
        if (blend.getSources() == null || blend.getSources().isEmpty()) {
            throw new EmptyBlendException();
        }
        LedgerStore.requireId(blend.getDestinationVesselId(), "destinationVesselId");
        String destinationBatchId = blend.getDestinationBatchId();

        // sources
        List<BlendComponent> components = new ArrayList<>();
        Map<String, BigDecimal> requested = new LinkedHashMap<>();
        Set<String> sourceBatchIds = new LinkedHashSet<>();
        for (BlendComponent source : blend.getSources()) {
            LedgerStore.requireId(source.getBatchId(), "sources.batchId");
            BigDecimal liters = LedgerStore.positiveLiters(source.getVolume(), "sources.volume");
            if (source.getBatchId().equals(destinationBatchId)) {
                throw new LedgerValidationException("BLEND_INTO_SOURCE",
                        "Batch " + destinationBatchId + " cannot be both a source and the destination",
                        Map.of("batchId", destinationBatchId));
            }
            String vesselId = store.resolveSingleVessel(source.getBatchId(), source.getFromVesselId());
            requested.merge(source.getBatchId() + "|" + vesselId, liters, BigDecimal::add);
            sourceBatchIds.add(source.getBatchId());
            components.add(BlendComponent.builder()
                    .batchId(source.getBatchId())
                    .fromVesselId(vesselId)
                    .volume(Quantity.liters(liters))
                    .abvPct(source.getAbvPct())
                    .build());
        }

        Map<String, BatchEntity> sources = store.lockBatches(sourceBatchIds);
        Map<String, VesselEntity> vessels = new HashMap<>();
        for (BlendComponent component : components) {
            BatchEntity batch = sources.get(component.getBatchId());
            if (component.getAbvPct() == null) {
                component.setAbvPct(batch.getAbvPct());
            }
            vessels.computeIfAbsent(component.getFromVesselId(), store::loadVesselForUpdate);
        }
        for (Map.Entry<String, BigDecimal> entry : requested.entrySet()) {
            String[] key = entry.getKey().split("\\|", 2);
            store.requireVolumeIn(sources.get(key[0]), vessels.get(key[1]), entry.getValue());
        }

        // destination
        VesselEntity destinationVessel =
                vessels.computeIfAbsent(blend.getDestinationVesselId(), store::loadVesselForUpdate);
        Optional<OccupancyEntity> occupant = store.activeOccupancy(destinationVessel.getId());
        if (occupant.isPresent() && !occupant.get().getBatchId().equals(destinationBatchId)) {
            throw new VesselOccupiedException(destinationVessel.getId(), occupant.get().getBatchId());
        }
        BatchEntity destination = null;
        if (destinationBatchId != null && (occupant.isPresent() || batchRepository.existsById(destinationBatchId))) {
            destination = store.loadOpenBatchForUpdate(destinationBatchId, null);
        }
        String destinationId = destination != null ? destination.getId() : newBatchId(blend);
        store.requireReceivable(destinationVessel, destinationId);

        BlendCalculation calculation = calculator.blend(components);
        store.requireCapacity(destinationVessel, calculation.getTotalLiters());
        BigDecimal resultingAbv = calculation.getWeightedAbv();
        if (destination != null && destination.getCurrentVolumeLiters().signum() > 0) {
            List<BlendComponent> withExisting = new ArrayList<>(components);
            withExisting.add(BlendComponent.builder()
                    .batchId(destination.getId())
                    .volume(Quantity.liters(destination.getCurrentVolumeLiters()))
                    .abvPct(destination.getAbvPct())
                    .build());
            resultingAbv = calculator.blend(withExisting).getWeightedAbv();
        }

        // writes
        LedgerOperation operation = store.begin("BLEND", blend.getActorId(), blend.getReason());
        UUID blendId = UUID.randomUUID();
        Map<String, Batch> before = new LinkedHashMap<>();
        sources.values().forEach(batch -> before.put(batch.getId(), store.snapshot(batch)));
        Batch destinationBefore = destination != null ? store.snapshot(destination) : null;
        BigDecimal preBlendLiters = destination != null ? destination.getCurrentVolumeLiters() : BigDecimal.ZERO;
        List<String> sourceIds = new ArrayList<>(sourceBatchIds);

        for (BlendComponent component : components) {
            BatchEntity batch = sources.get(component.getBatchId());
            store.post(operation, TransactionType.BLEND, batch, EntryDraft.builder()
                    .vesselId(component.getFromVesselId())
                    .deltaLiters(component.getVolume().getAmount().negate())
                    .abvPct(component.getAbvPct())
                    .reasonCode(TransactionType.BLEND.name())
                    .detail(blendDetail(blendId, BlendDetail.Role.SOURCE, destinationId, destinationVessel, sourceIds,
                            resultingAbv))
                    .build());
        }

        List<SourceRef> contributions = calculation.getShares().stream()
                .map(share -> SourceRef.builder()
                        .sourceType(SourceType.BATCH)
                        .sourceId(share.getBatchId())
                        .volumeLiters(share.getVolumeLiters())
                        .percentage(share.getPercentage())
                        .build())
                .collect(Collectors.toList());
        if (destination == null) {
            destination = batchRepository.saveAndFlush(BatchEntity.builder()
                    .id(destinationId)
                    .name(blend.getDestinationBatchName() != null ? blend.getDestinationBatchName() : destinationId)
                    .status(BatchStatus.AGING)
                    .abvPct(resultingAbv)
                    .currentVolumeLiters(BigDecimal.ZERO.setScale(UnitConverter.VOLUME_SCALE))
                    .compositionSources(mapper.writeComposition(mapper.mergeComposition(List.of(), contributions)))
                    .build());
        } else {
            List<SourceRef> existing = mapper.scaleComposition(
                    mapper.readComposition(destination.getCompositionSources()), destination.getId(), preBlendLiters);
            destination.setAbvPct(resultingAbv);
            destination.setCompositionSources(mapper.writeComposition(mapper.mergeComposition(existing, contributions)));
        }
        store.occupy(operation, destinationVessel, destinationId);
        store.post(operation, TransactionType.BLEND, destination, EntryDraft.builder()
                .vesselId(destinationVessel.getId())
                .deltaLiters(calculation.getTotalLiters())
                .abvPct(resultingAbv)
                .reasonCode(TransactionType.BLEND.name())
                .detail(blendDetail(blendId, BlendDetail.Role.DESTINATION, destinationId, destinationVessel, sourceIds,
                        resultingAbv))
                .build());

        List<SourceDeduction> deductions = new ArrayList<>();
        Set<String> released = new LinkedHashSet<>();
        for (String key : requested.keySet()) {
            String[] parts = key.split("\\|", 2);
            if (store.releaseIfDrained(operation, vessels.get(parts[1]), parts[0])) {
                released.add(key);
            }
        }
        for (BlendComponent component : components) {
            String key = component.getBatchId() + "|" + component.getFromVesselId();
            deductions.add(SourceDeduction.builder()
                    .batchId(component.getBatchId())
                    .vesselId(component.getFromVesselId())
                    .deductedLiters(component.getVolume().getAmount())
                    .remainingInVesselLiters(store.volumeIn(component.getBatchId(), component.getFromVesselId()))
                    .vesselReleased(released.contains(key))
                    .build());
        }

        for (BatchEntity batch : sources.values()) {
            store.auditBatch(operation, AuditOperation.UPDATE, before.get(batch.getId()), batch);
        }
        Batch destinationAfter = destinationBefore == null
                ? store.auditBatch(operation, AuditOperation.CREATE, null, destination)
                : store.auditBatch(operation, AuditOperation.UPDATE, destinationBefore, destination);

        log.info("Blend {}: {} L from {} into batch {} in vessel {} at {}% ABV", blendId,
                calculation.getTotalLiters().toPlainString(), sourceIds, destinationId, destinationVessel.getId(),
                resultingAbv.toPlainString());

        return LedgerResult.of(BlendResult.builder()
                .blendId(blendId)
                .destinationBatchId(destinationId)
                .destinationVesselId(destinationVessel.getId())
                .newBatch(destinationBefore == null)
                .totalVolume(Quantity.liters(calculation.getTotalLiters(), resultingAbv))
                .weightedAbv(resultingAbv)
                .sourceDeductions(deductions)
                .compositionSources(destinationAfter.getCompositionSources())
                .build());
    }

    private static BlendDetail blendDetail(UUID blendId, BlendDetail.Role role, String destinationBatchId,
                                           VesselEntity destinationVessel, List<String> sourceBatchIds,
                                           BigDecimal resultingAbv) {
        return BlendDetail.builder()
                .blendId(blendId)
                .role(role)
                .destinationBatchId(destinationBatchId)
                .destinationVesselId(destinationVessel.getId())
                .sourceBatchIds(sourceBatchIds)
                .resultingAbv(resultingAbv)
                .build();
    }

    private String newBatchId(BlendOperation blend) {
        if (blend.getDestinationBatchId() != null) {
            return blend.getDestinationBatchId();
        }
        return "BLEND-" + UUID.randomUUID().toString().substring(0, 8).toUpperCase();
    }
}
