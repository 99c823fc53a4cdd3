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
public class TransferVolumeCommand {

    private String batchId;

    private String fromVesselId;

    private String toVesselId;

    private Quantity quantity;

    /**
     * Liquid lost in the move (lees, hoses). Recorded as a separate loss entry.
     */
    private Quantity loss;

    private String reason;

    private Long expectedVersion;

    private String actorId;
}
