package com.cidery.ledger.domain.command;

import com.cidery.ledger.domain.model.BlendComponent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Combine several source streams into one destination vessel.
 * When {@code destinationBatchId} names the batch already in the destination vessel the
 * blend extends it, otherwise a new batch is created.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlendOperation {

    @Builder.Default
    private List<BlendComponent> sources = new ArrayList<>();

    private String destinationVesselId;

    private String destinationBatchId;

    private String destinationBatchName;

    private String reason;

    private String actorId;
}
