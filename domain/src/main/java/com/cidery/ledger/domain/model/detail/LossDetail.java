package com.cidery.ledger.domain.model.detail;

import com.cidery.ledger.domain.enums.LossType;
import com.cidery.ledger.domain.enums.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LossDetail implements EntryDetail {

    private LossType lossType;

    /**
     * Set when the loss happened during a transfer.
     */
    private String transferToVesselId;

    @Override
    public TransactionType entryType() {
        return TransactionType.LOSS;
    }
}
