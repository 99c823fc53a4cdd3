package com.cidery.ledger.domain.command;

import com.cidery.ledger.domain.enums.AdjustmentType;
import com.cidery.ledger.domain.model.Quantity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VolumeAdjustmentCommand {

    private String batchId;

    /**
     * Vessel that was measured. Required only when the batch spans several vessels.
     */
    private String vesselId;

    private Quantity measuredVolume;

    private AdjustmentType adjustmentType;

    private String reason;

    private Long expectedVersion;

    private String actorId;
}
