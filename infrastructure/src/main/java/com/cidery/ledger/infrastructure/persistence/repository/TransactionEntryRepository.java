package com.cidery.ledger.infrastructure.persistence.repository;

import com.cidery.ledger.domain.enums.TransactionType;
import com.cidery.ledger.infrastructure.persistence.entity.TransactionEntryEntity;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Read and append access to the transaction log. There are no update or delete queries.
 */
@Repository
public interface TransactionEntryRepository extends JpaRepository<TransactionEntryEntity, UUID> {

    @Query("SELECT COALESCE(MAX(e.batchSeq), 0) FROM TransactionEntryEntity e WHERE e.batchId = :batchId")
    long findMaxSequenceByBatchId(@Param("batchId") String batchId);

    @Query("SELECT COALESCE(SUM(e.deltaLiters), 0) FROM TransactionEntryEntity e WHERE e.batchId = :batchId")
    BigDecimal sumDeltaByBatchId(@Param("batchId") String batchId);

    @Query("SELECT COALESCE(SUM(e.deltaLiters), 0) FROM TransactionEntryEntity e " +
           "WHERE e.batchId = :batchId AND e.vesselId = :vesselId")
    BigDecimal sumDeltaByBatchIdAndVesselId(@Param("batchId") String batchId, @Param("vesselId") String vesselId);

    @Query("SELECT e.vesselId AS vesselId, SUM(e.deltaLiters) AS liters FROM TransactionEntryEntity e " +
           "WHERE e.batchId = :batchId AND e.vesselId IS NOT NULL GROUP BY e.vesselId ORDER BY e.vesselId")
    List<VesselVolume> sumDeltaByVessel(@Param("batchId") String batchId);

    @Query("SELECT e FROM TransactionEntryEntity e WHERE e.batchId = :batchId ORDER BY e.occurredAt ASC, e.batchSeq ASC")
    Page<TransactionEntryEntity> findPageByBatchId(@Param("batchId") String batchId, Pageable pageable);

    @Query("SELECT e FROM TransactionEntryEntity e WHERE e.operationId = :operationId ORDER BY e.batchId ASC, e.batchSeq ASC")
    List<TransactionEntryEntity> findAllByOperationId(@Param("operationId") UUID operationId);

    /**
     * Per-batch volume as of an instant, from the log alone.
     */
    @Query("SELECT e.batchId AS batchId, SUM(e.deltaLiters) AS liters FROM TransactionEntryEntity e " +
           "WHERE e.occurredAt < :before GROUP BY e.batchId")
    List<BatchVolume> sumDeltaByBatchBefore(@Param("before") OffsetDateTime before);

    /**
     * Per-batch, per-type increases and decreases within [from, to).
     */
    @Query("SELECT e.batchId AS batchId, e.type AS type, " +
           "SUM(CASE WHEN e.deltaLiters > 0 THEN e.deltaLiters ELSE 0 END) AS increases, " +
           "SUM(CASE WHEN e.deltaLiters < 0 THEN e.deltaLiters ELSE 0 END) AS decreases " +
           "FROM TransactionEntryEntity e WHERE e.occurredAt >= :from AND e.occurredAt < :to " +
           "GROUP BY e.batchId, e.type")
    List<BatchMovement> sumMovementsBetween(@Param("from") OffsetDateTime from, @Param("to") OffsetDateTime to);

    interface VesselVolume {
        String getVesselId();

        BigDecimal getLiters();
    }

    interface BatchVolume {
        String getBatchId();

        BigDecimal getLiters();
    }

    interface BatchMovement {
        String getBatchId();

        TransactionType getType();

        BigDecimal getIncreases();

        BigDecimal getDecreases();
    }
}
