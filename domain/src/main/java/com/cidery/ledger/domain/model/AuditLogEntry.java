package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.enums.AuditOperation;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Immutable record of one change to a tracked record.
 * Full snapshots are kept next to the diff so the diff can be re-derived later.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogEntry {

    private UUID id;

    private String tableName;

    private String recordId;

    private AuditOperation operation;

    private JsonNode oldSnapshot;

    private JsonNode newSnapshot;

    @Builder.Default
    private List<FieldDiff> diff = new ArrayList<>();

    private String actor;

    private String reason;

    private String correlationId;

    private OffsetDateTime changedAt;

    private String auditVersion;

    private String checksum;
}
