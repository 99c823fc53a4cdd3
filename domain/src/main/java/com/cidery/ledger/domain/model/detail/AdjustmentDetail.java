package com.cidery.ledger.domain.model.detail;

import com.cidery.ledger.domain.enums.AdjustmentType;
import com.cidery.ledger.domain.enums.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AdjustmentDetail implements EntryDetail {

    private AdjustmentType adjustmentType;

    private BigDecimal computedLiters;

    private BigDecimal measuredLiters;

    private boolean largeAdjustment;

    @Override
    public TransactionType entryType() {
        return TransactionType.ADJUSTMENT;
    }
}
