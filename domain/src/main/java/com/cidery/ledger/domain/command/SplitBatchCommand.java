package com.cidery.ledger.domain.command;

import com.cidery.ledger.domain.model.Quantity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SplitBatchCommand {

    private String batchId;

    private String fromVesselId;

    private String newBatchId;

    private String newBatchName;

    private String toVesselId;

    private Quantity quantity;

    private String reason;

    private String actorId;
}
