package com.cidery.ledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceDeduction {

    private String batchId;

    private String vesselId;

    private BigDecimal deductedLiters;

    private BigDecimal remainingInVesselLiters;

    private boolean vesselReleased;
}
