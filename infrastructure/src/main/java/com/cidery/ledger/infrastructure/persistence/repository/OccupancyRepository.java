package com.cidery.ledger.infrastructure.persistence.repository;

import com.cidery.ledger.infrastructure.persistence.entity.OccupancyEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface OccupancyRepository extends JpaRepository<OccupancyEntity, UUID> {

    @Query("SELECT o FROM OccupancyEntity o WHERE o.vesselId = :vesselId AND o.releasedAt IS NULL")
    Optional<OccupancyEntity> findActiveByVesselId(@Param("vesselId") String vesselId);

    @Query("SELECT o FROM OccupancyEntity o WHERE o.batchId = :batchId AND o.releasedAt IS NULL ORDER BY o.since ASC")
    List<OccupancyEntity> findActiveByBatchId(@Param("batchId") String batchId);

    @Query("SELECT o FROM OccupancyEntity o WHERE o.vesselId = :vesselId ORDER BY o.since ASC")
    List<OccupancyEntity> findHistoryByVesselId(@Param("vesselId") String vesselId);
}
