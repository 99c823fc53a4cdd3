package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.enums.AuditOperation;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

/**
 * Audit log query filter. Null fields do not constrain the result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AuditLogFilter {

    private String tableName;

    private String recordId;

    private AuditOperation operation;

    private String actor;

    private OffsetDateTime from;

    private OffsetDateTime to;

    @Builder.Default
    private int page = 0;

    @Builder.Default
    private int size = 50;
}
