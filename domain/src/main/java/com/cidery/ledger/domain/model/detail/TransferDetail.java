package com.cidery.ledger.domain.model.detail;

import com.cidery.ledger.domain.enums.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TransferDetail implements EntryDetail {

    private String fromVesselId;

    private String toVesselId;

    @Override
    public TransactionType entryType() {
        return TransactionType.TRANSFER;
    }
}
