package com.cidery.ledger.infrastructure.persistence.repository;

import com.cidery.ledger.domain.enums.VesselStatus;
import com.cidery.ledger.infrastructure.persistence.entity.VesselEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface VesselRepository extends JpaRepository<VesselEntity, String> {

    /**
     * Load a vessel for mutation. The version is bumped on commit even when no column
     * changes, so a concurrent mutation of the same vessel fails at flush.
     */
    @Lock(LockModeType.OPTIMISTIC_FORCE_INCREMENT)
    @Query("SELECT v FROM VesselEntity v WHERE v.id = :id")
    Optional<VesselEntity> findForUpdate(@Param("id") String id);

    List<VesselEntity> findAllByStatusOrderByIdAsc(VesselStatus status);

    List<VesselEntity> findAllByOrderByIdAsc();
}
