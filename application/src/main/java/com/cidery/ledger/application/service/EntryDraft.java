package com.cidery.ledger.application.service;

import com.cidery.ledger.domain.model.detail.EntryDetail;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * A transaction entry before it is sequenced and stored.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class EntryDraft {

    private String batchId;

    private String vesselId;

    /**
     * Signed change in liters.
     */
    private BigDecimal deltaLiters;

    private BigDecimal abvPct;

    private String reasonCode;

    private EntryDetail detail;
}
