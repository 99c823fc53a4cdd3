package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.enums.TransactionType;
import com.cidery.ledger.domain.model.detail.EntryDetail;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.UUID;

/**
 * One immutable line of the transaction log.
 * Entries written by the same command share an operationId.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransactionEntry {

    private UUID id;

    private UUID operationId;

    private String batchId;

    private String vesselId;

    /**
     * Position of this entry in the batch's log, starting at 1.
     */
    private long batchSequence;

    private TransactionType type;

    /**
     * Signed change in liters.
     */
    private Quantity quantityDelta;

    private BigDecimal volumeBeforeLiters;

    private BigDecimal volumeAfterLiters;

    private String reasonCode;

    private EntryDetail detail;

    private OffsetDateTime occurredAt;

    private String actorId;

    private String correlationId;
}
