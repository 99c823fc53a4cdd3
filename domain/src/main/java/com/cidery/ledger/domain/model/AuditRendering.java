package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.enums.AuditOperation;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Read-side view of an audit entry. Creates and restores carry the new snapshot,
 * deletes carry the old snapshot, updates carry only the changed fields.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AuditRendering {

    private UUID entryId;

    private String tableName;

    private String recordId;

    private AuditOperation operation;

    private String actor;

    private String reason;

    private OffsetDateTime changedAt;

    private String summary;

    private JsonNode snapshot;

    private List<FieldDiff> changes;
}
