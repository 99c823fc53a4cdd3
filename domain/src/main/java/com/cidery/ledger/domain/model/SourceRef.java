package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.enums.SourceType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One contributor to a batch: a prior batch, a press run or a purchased lot,
 * with the volume it contributed and its share of the batch in percent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SourceRef {

    private SourceType sourceType;

    private String sourceId;

    private BigDecimal volumeLiters;

    private BigDecimal percentage;
}
