package com.cidery.ledger.domain.model.detail;

import com.cidery.ledger.domain.enums.SourceType;
import com.cidery.ledger.domain.enums.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FillDetail implements EntryDetail {

    /**
     * True when this fill created the vessel occupancy.
     */
    private boolean assignment;

    private SourceType sourceType;

    private String sourceId;

    @Override
    public TransactionType entryType() {
        return TransactionType.FILL;
    }
}
