package com.cidery.ledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of the blend arithmetic alone, with no ledger effects.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlendCalculation {

    private BigDecimal totalLiters;

    private BigDecimal weightedAbv;

    @Builder.Default
    private List<Share> shares = new ArrayList<>();

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Share {

        private String batchId;

        private BigDecimal volumeLiters;

        private BigDecimal abvPct;

        private BigDecimal percentage;
    }
}
