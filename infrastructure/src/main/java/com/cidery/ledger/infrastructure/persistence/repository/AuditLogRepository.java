package com.cidery.ledger.infrastructure.persistence.repository;

import com.cidery.ledger.infrastructure.persistence.entity.AuditLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface AuditLogRepository extends JpaRepository<AuditLogEntity, UUID>,
        JpaSpecificationExecutor<AuditLogEntity> {

    @Query("SELECT a FROM AuditLogEntity a WHERE a.tableName = :tableName AND a.recordId = :recordId " +
           "ORDER BY a.changedAt ASC")
    List<AuditLogEntity> findHistory(@Param("tableName") String tableName, @Param("recordId") String recordId);

    @Query("SELECT COUNT(a) FROM AuditLogEntity a WHERE a.tableName = :tableName AND a.recordId = :recordId")
    long countByRecord(@Param("tableName") String tableName, @Param("recordId") String recordId);
}
