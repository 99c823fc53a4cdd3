package com.cidery.ledger.application.service;

import com.cidery.ledger.domain.enums.TransactionType;
import com.cidery.ledger.domain.model.Quantity;
import com.cidery.ledger.domain.model.TransactionEntry;
import com.cidery.ledger.domain.model.detail.EntryDetail;
import com.cidery.ledger.domain.units.UnitConverter;
import com.cidery.ledger.domain.units.VolumeUnit;
import com.cidery.ledger.infrastructure.persistence.entity.TransactionEntryEntity;
import com.cidery.ledger.infrastructure.persistence.repository.TransactionEntryRepository;
import com.cidery.ledger.infrastructure.persistence.repository.TransactionEntryRepository.BatchMovement;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.OffsetDateTime;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Append-only access to the transaction log.
 * Entries are never updated or deleted; corrections are new entries.
 */
@Service
public class TransactionLogService {

    private static final Logger log = LoggerFactory.getLogger(TransactionLogService.class);

    private final TransactionEntryRepository entryRepository;
    private final ObjectMapper objectMapper;
    private final int pageSize;

    public TransactionLogService(TransactionEntryRepository entryRepository,
                                 ObjectMapper objectMapper,
                                 @Value("${ledger.log.page-size:500}") int pageSize) {
        this.entryRepository = entryRepository;
        this.objectMapper = objectMapper;
        this.pageSize = pageSize;
    }

    /**
     * Append one entry with the next sequence number of its batch.
     * The entry is flushed immediately so a competing append for the same batch
     * fails on the (batch_id, batch_seq) constraint inside this transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public TransactionEntry append(LedgerOperation operation, TransactionType type, EntryDraft draft) {
        if (draft.getDetail() != null && draft.getDetail().entryType() != type) {
            throw new IllegalArgumentException(
                    "Detail " + draft.getDetail().entryType() + " does not match entry type " + type);
        }
        BigDecimal delta = draft.getDeltaLiters().setScale(UnitConverter.VOLUME_SCALE, RoundingMode.HALF_UP);
        BigDecimal before = sumFor(draft.getBatchId());
        long sequence = entryRepository.findMaxSequenceByBatchId(draft.getBatchId()) + 1;

        TransactionEntryEntity entity = TransactionEntryEntity.builder()
                .operationId(operation.getOperationId())
                .batchId(draft.getBatchId())
                .vesselId(draft.getVesselId())
                .batchSeq(sequence)
                .type(type)
                .deltaLiters(delta)
                .abvPct(draft.getAbvPct())
                .volumeBeforeLiters(before)
                .volumeAfterLiters(before.add(delta))
                .reasonCode(draft.getReasonCode() != null ? draft.getReasonCode() : type.name())
                .detail(writeDetail(draft.getDetail()))
                .occurredAt(operation.getOccurredAt())
                .actorId(operation.getActorId())
                .correlationId(operation.getCorrelationId())
                .build();

        TransactionEntryEntity saved = entryRepository.saveAndFlush(entity);
        log.debug("Appended {} entry #{} for batch {}: {} L in vessel {}",
                type, sequence, draft.getBatchId(), delta.toPlainString(), draft.getVesselId());
        return toDomain(saved);
    }

    /**
     * Entries of a batch in order, fetched a page at a time. Each call to
     * {@code iterator()} starts again from the first entry.
     */
    public Iterable<TransactionEntry> entriesFor(String batchId) {
        return () -> new Iterator<>() {
            private int nextPage = 0;
            private boolean lastPage = false;
            private Iterator<TransactionEntryEntity> current = Collections.emptyIterator();

            @Override
            public boolean hasNext() {
                while (!current.hasNext() && !lastPage) {
                    Page<TransactionEntryEntity> page =
                            entryRepository.findPageByBatchId(batchId, PageRequest.of(nextPage++, pageSize));
                    current = page.getContent().iterator();
                    lastPage = !page.hasNext();
                }
                return current.hasNext();
            }

            @Override
            public TransactionEntry next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                return toDomain(current.next());
            }
        };
    }

    public Page<TransactionEntry> history(String batchId, int page, int size) {
        return entryRepository.findPageByBatchId(batchId, PageRequest.of(Math.max(page, 0), Math.max(size, 1)))
                .map(this::toDomain);
    }

    public List<TransactionEntry> entriesForOperation(UUID operationId) {
        return entryRepository.findAllByOperationId(operationId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    public BigDecimal sumFor(String batchId) {
        return normalize(entryRepository.sumDeltaByBatchId(batchId));
    }

    public BigDecimal sumFor(String batchId, String vesselId) {
        return normalize(entryRepository.sumDeltaByBatchIdAndVesselId(batchId, vesselId));
    }

    /**
     * Liters of the batch per vessel, leaving out vessels it has fully left.
     */
    public Map<String, BigDecimal> volumesByVessel(String batchId) {
        Map<String, BigDecimal> volumes = new LinkedHashMap<>();
        for (TransactionEntryRepository.VesselVolume row : entryRepository.sumDeltaByVessel(batchId)) {
            BigDecimal liters = normalize(row.getLiters());
            if (liters.signum() != 0) {
                volumes.put(row.getVesselId(), liters);
            }
        }
        return volumes;
    }

    /**
     * Volume of every batch as of an instant, from the log alone.
     */
    public Map<String, BigDecimal> sumBefore(OffsetDateTime instant) {
        Map<String, BigDecimal> volumes = new LinkedHashMap<>();
        for (TransactionEntryRepository.BatchVolume row : entryRepository.sumDeltaByBatchBefore(instant)) {
            volumes.put(row.getBatchId(), normalize(row.getLiters()));
        }
        return volumes;
    }

    public List<BatchMovement> movementsBetween(OffsetDateTime from, OffsetDateTime to) {
        return entryRepository.sumMovementsBetween(from, to);
    }

    TransactionEntry toDomain(TransactionEntryEntity entity) {
        return TransactionEntry.builder()
                .id(entity.getId())
                .operationId(entity.getOperationId())
                .batchId(entity.getBatchId())
                .vesselId(entity.getVesselId())
                .batchSequence(entity.getBatchSeq())
                .type(entity.getType())
                .quantityDelta(Quantity.delta(entity.getDeltaLiters(), VolumeUnit.LITER, entity.getAbvPct()))
                .volumeBeforeLiters(entity.getVolumeBeforeLiters())
                .volumeAfterLiters(entity.getVolumeAfterLiters())
                .reasonCode(entity.getReasonCode())
                .detail(readDetail(entity))
                .occurredAt(entity.getOccurredAt())
                .actorId(entity.getActorId())
                .correlationId(entity.getCorrelationId())
                .build();
    }

    private String writeDetail(EntryDetail detail) {
        if (detail == null) {
            return "{}";
        }
        try {
            return objectMapper.writerFor(EntryDetail.class).writeValueAsString(detail);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize {} entry detail", detail.entryType(), e);
            throw new RuntimeException("Failed to serialize entry detail", e);
        }
    }

    private EntryDetail readDetail(TransactionEntryEntity entity) {
        String json = entity.getDetail();
        if (json == null || json.isBlank() || "{}".equals(json.trim())) {
            return null;
        }
        try {
            return objectMapper.readValue(json, EntryDetail.class);
        } catch (JsonProcessingException e) {
            log.error("Failed to read detail of entry {}", entity.getId(), e);
            throw new RuntimeException("Failed to deserialize entry detail", e);
        }
    }

    private static BigDecimal normalize(BigDecimal liters) {
        return (liters == null ? BigDecimal.ZERO : liters).setScale(UnitConverter.VOLUME_SCALE, RoundingMode.HALF_UP);
    }
}
