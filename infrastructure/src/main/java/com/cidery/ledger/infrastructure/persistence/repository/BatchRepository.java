package com.cidery.ledger.infrastructure.persistence.repository;

import com.cidery.ledger.domain.enums.BatchStatus;
import com.cidery.ledger.infrastructure.persistence.entity.BatchEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface BatchRepository extends JpaRepository<BatchEntity, String> {

    /**
     * Load a batch for mutation with a forced version increment.
     */
    @Lock(LockModeType.OPTIMISTIC_FORCE_INCREMENT)
    @Query("SELECT b FROM BatchEntity b WHERE b.id = :id")
    Optional<BatchEntity> findForUpdate(@Param("id") String id);

    List<BatchEntity> findAllByIdIn(Collection<String> ids);

    List<BatchEntity> findAllByStatusOrderByIdAsc(BatchStatus status);
}
