package com.cidery.ledger.domain.model.detail;

import com.cidery.ledger.domain.enums.RemovalType;
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
public class RemovalDetail implements EntryDetail {

    private RemovalType removalType;

    /**
     * Receiving party, e.g. the distillery.
     */
    private String destination;

    private BigDecimal proofGallons;

    @Override
    public TransactionType entryType() {
        return TransactionType.REMOVAL;
    }
}
