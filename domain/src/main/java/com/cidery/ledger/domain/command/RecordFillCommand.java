package com.cidery.ledger.domain.command;

import com.cidery.ledger.domain.model.Quantity;
import com.cidery.ledger.domain.model.SourceRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Top up a vessel already holding the batch.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordFillCommand {

    private String batchId;

    private String vesselId;

    private Quantity quantity;

    private SourceRef source;

    private String reason;

    private Long expectedVersion;

    private String actorId;
}
