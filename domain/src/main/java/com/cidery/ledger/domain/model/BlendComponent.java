package com.cidery.ledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One stream going into a blend. {@code abvPct} may be left null when blending
 * from a batch, in which case the batch's ABV is used.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlendComponent {

    private String batchId;

    private String fromVesselId;

    private Quantity volume;

    private BigDecimal abvPct;
}
