package com.cidery.ledger.application.service;

import com.cidery.ledger.domain.enums.SourceType;
import com.cidery.ledger.domain.model.Batch;
import com.cidery.ledger.domain.model.Quantity;
import com.cidery.ledger.domain.model.SourceRef;
import com.cidery.ledger.domain.model.Vessel;
import com.cidery.ledger.domain.model.VesselPlacement;
import com.cidery.ledger.domain.units.MeasureUnit;
import com.cidery.ledger.domain.units.UnitConverter;
import com.cidery.ledger.domain.units.VolumeUnit;
import com.cidery.ledger.infrastructure.persistence.entity.BatchEntity;
import com.cidery.ledger.infrastructure.persistence.entity.VesselEntity;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Converts between JPA entities and domain objects, and keeps batch composition
 * lists normalized.
 */
@Component
public class LedgerMapper {

    private static final Logger log = LoggerFactory.getLogger(LedgerMapper.class);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private final ObjectMapper objectMapper;

    public LedgerMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Vessel toVessel(VesselEntity entity) {
        MeasureUnit unit = MeasureUnit.fromSymbol(entity.getCapacityUnit());
        Quantity capacity = Quantity.liters(entity.getCapacityLiters());
        if (unit != VolumeUnit.LITER) {
            capacity = capacity.to(unit);
        }
        return Vessel.builder()
                .id(entity.getId())
                .name(entity.getName())
                .capacity(capacity)
                .status(entity.getStatus())
                .location(entity.getLocation())
                .version(entity.getVersion())
                .build();
    }

    public Batch toBatch(BatchEntity entity, Map<String, BigDecimal> litersByVessel) {
        List<VesselPlacement> placements = new ArrayList<>();
        litersByVessel.forEach((vesselId, liters) -> placements.add(new VesselPlacement(vesselId, liters)));

        return Batch.builder()
                .id(entity.getId())
                .name(entity.getName())
                .status(entity.getStatus())
                .abvPct(entity.getAbvPct())
                .taxClass(entity.getTaxClass())
                .currentVolume(Quantity.liters(entity.getCurrentVolumeLiters(), entity.getAbvPct()))
                .compositionSources(readComposition(entity.getCompositionSources()))
                .placements(placements)
                .version(entity.getVersion())
                .build();
    }

    public List<SourceRef> readComposition(String json) {
        if (json == null || json.isBlank()) {
            return new ArrayList<>();
        }
        try {
            return objectMapper.readValue(json, new TypeReference<List<SourceRef>>() {});
        } catch (JsonProcessingException e) {
            log.error("Failed to read batch composition: {}", json, e);
            throw new RuntimeException("Failed to deserialize batch composition", e);
        }
    }

    public String writeComposition(List<SourceRef> sources) {
        try {
            return objectMapper.writeValueAsString(sources == null ? new ArrayList<>() : sources);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize batch composition", e);
            throw new RuntimeException("Failed to serialize batch composition", e);
        }
    }

    /**
     * Merge contributions of the same source and recompute each source's share by volume.
     * Shares are left as given when any source has no volume.
     */
    public List<SourceRef> mergeComposition(List<SourceRef> existing, List<SourceRef> added) {
        Map<String, SourceRef> merged = new LinkedHashMap<>();
        List<SourceRef> all = new ArrayList<>(existing);
        all.addAll(added);
        for (SourceRef source : all) {
            String key = source.getSourceType() + ":" + source.getSourceId();
            SourceRef current = merged.get(key);
            if (current == null) {
                merged.put(key, SourceRef.builder()
                        .sourceType(source.getSourceType())
                        .sourceId(source.getSourceId())
                        .volumeLiters(source.getVolumeLiters())
                        .percentage(source.getPercentage())
                        .build());
            } else if (current.getVolumeLiters() != null && source.getVolumeLiters() != null) {
                current.setVolumeLiters(current.getVolumeLiters().add(source.getVolumeLiters()));
            } else {
                current.setVolumeLiters(null);
            }
        }

        List<SourceRef> result = new ArrayList<>(merged.values());
        boolean volumesKnown = result.stream().map(SourceRef::getVolumeLiters).allMatch(Objects::nonNull);
        BigDecimal total = volumesKnown
                ? result.stream().map(SourceRef::getVolumeLiters).reduce(BigDecimal.ZERO, BigDecimal::add)
                : BigDecimal.ZERO;
        if (total.signum() > 0) {
            for (SourceRef source : result) {
                source.setPercentage(source.getVolumeLiters().multiply(HUNDRED)
                        .divide(total, UnitConverter.ABV_SCALE, RoundingMode.HALF_UP));
            }
        }
        return result;
    }

    /**
     * Restate a batch's composition as volumes that add up to {@code liters}. Known volumes
     * are scaled proportionally, shares are applied when only shares are known, and a
     * composition with neither becomes a single entry for the batch itself.
     */
    public List<SourceRef> scaleComposition(List<SourceRef> composition, String batchId, BigDecimal liters) {
        List<SourceRef> result = new ArrayList<>();
        if (liters == null || liters.signum() <= 0) {
            return result;
        }
        boolean volumesKnown = !composition.isEmpty()
                && composition.stream().map(SourceRef::getVolumeLiters).allMatch(Objects::nonNull);
        BigDecimal volumeTotal = volumesKnown
                ? composition.stream().map(SourceRef::getVolumeLiters).reduce(BigDecimal.ZERO, BigDecimal::add)
                : BigDecimal.ZERO;
        boolean sharesKnown = !composition.isEmpty()
                && composition.stream().map(SourceRef::getPercentage).allMatch(Objects::nonNull);
        BigDecimal shareTotal = sharesKnown
                ? composition.stream().map(SourceRef::getPercentage).reduce(BigDecimal.ZERO, BigDecimal::add)
                : BigDecimal.ZERO;

        if (volumeTotal.signum() > 0) {
            for (SourceRef source : composition) {
                result.add(scaled(source, source.getVolumeLiters().multiply(liters)
                        .divide(volumeTotal, UnitConverter.VOLUME_SCALE, RoundingMode.HALF_UP)));
            }
        } else if (shareTotal.signum() > 0) {
            for (SourceRef source : composition) {
                result.add(scaled(source, source.getPercentage().multiply(liters)
                        .divide(shareTotal, UnitConverter.VOLUME_SCALE, RoundingMode.HALF_UP)));
            }
        } else {
            result.add(SourceRef.builder()
                    .sourceType(SourceType.BATCH)
                    .sourceId(batchId)
                    .volumeLiters(liters.setScale(UnitConverter.VOLUME_SCALE, RoundingMode.HALF_UP))
                    .build());
        }
        return result;
    }

    private static SourceRef scaled(SourceRef source, BigDecimal liters) {
        return SourceRef.builder()
                .sourceType(source.getSourceType())
                .sourceId(source.getSourceId())
                .volumeLiters(liters)
                .build();
    }
}
