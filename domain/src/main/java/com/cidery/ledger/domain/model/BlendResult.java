package com.cidery.ledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlendResult {

    private UUID blendId;

    private String destinationBatchId;

    private String destinationVesselId;

    private boolean newBatch;

    /**
     * Volume added to the destination by this blend.
     */
    private Quantity totalVolume;

    /**
     * ABV of the destination batch after blending.
     */
    private BigDecimal weightedAbv;

    @Builder.Default
    private List<SourceDeduction> sourceDeductions = new ArrayList<>();

    @Builder.Default
    private List<SourceRef> compositionSources = new ArrayList<>();
}
