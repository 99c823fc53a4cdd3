package com.cidery.ledger.infrastructure.persistence.repository;

import com.cidery.ledger.domain.enums.PeriodType;
import com.cidery.ledger.infrastructure.persistence.entity.ReconciliationSnapshotEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ReconciliationSnapshotRepository extends JpaRepository<ReconciliationSnapshotEntity, UUID> {

    Optional<ReconciliationSnapshotEntity> findFirstByPeriodTypeAndPeriodYearAndPeriodNumberOrderByGeneratedAtDesc(
            PeriodType periodType, Integer periodYear, Integer periodNumber);

    List<ReconciliationSnapshotEntity> findAllByPeriodTypeAndPeriodYearOrderByPeriodNumberAscGeneratedAtDesc(
            PeriodType periodType, Integer periodYear);
}
