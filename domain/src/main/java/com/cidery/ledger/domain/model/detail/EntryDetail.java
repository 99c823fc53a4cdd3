package com.cidery.ledger.domain.model.detail;

import com.cidery.ledger.domain.enums.TransactionType;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Type-specific payload of a transaction entry. Each variant carries only the fields
 * that make sense for its {@link TransactionType}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = FillDetail.class, name = "FILL"),
        @JsonSubTypes.Type(value = TransferDetail.class, name = "TRANSFER"),
        @JsonSubTypes.Type(value = AdjustmentDetail.class, name = "ADJUSTMENT"),
        @JsonSubTypes.Type(value = BlendDetail.class, name = "BLEND"),
        @JsonSubTypes.Type(value = SplitDetail.class, name = "SPLIT"),
        @JsonSubTypes.Type(value = LossDetail.class, name = "LOSS"),
        @JsonSubTypes.Type(value = RemovalDetail.class, name = "REMOVAL")
})
public interface EntryDetail {

    TransactionType entryType();
}
