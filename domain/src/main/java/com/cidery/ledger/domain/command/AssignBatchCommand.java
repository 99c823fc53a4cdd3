package com.cidery.ledger.domain.command;

import com.cidery.ledger.domain.model.Quantity;
import com.cidery.ledger.domain.model.SourceRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Put a batch into an empty vessel with an initial fill.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AssignBatchCommand {

    private String batchId;

    private String vesselId;

    private Quantity quantity;

    /**
     * Where the liquid came from, if it is new to the ledger.
     */
    private SourceRef source;

    private String reason;

    private Long expectedVersion;

    private String actorId;
}
