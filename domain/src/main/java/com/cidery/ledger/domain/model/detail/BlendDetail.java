package com.cidery.ledger.domain.model.detail;

import com.cidery.ledger.domain.enums.TransactionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BlendDetail implements EntryDetail {

    public enum Role {
        SOURCE,
        DESTINATION
    }

    private UUID blendId;

    private Role role;

    private String destinationBatchId;

    private String destinationVesselId;

    /**
     * Contributing batches. Set on the destination entry only.
     */
    @Builder.Default
    private List<String> sourceBatchIds = new ArrayList<>();

    private BigDecimal resultingAbv;

    @Override
    public TransactionType entryType() {
        return TransactionType.BLEND;
    }
}
