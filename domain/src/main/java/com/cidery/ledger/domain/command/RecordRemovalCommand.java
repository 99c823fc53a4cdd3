package com.cidery.ledger.domain.command;

import com.cidery.ledger.domain.enums.RemovalType;
import com.cidery.ledger.domain.model.Quantity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordRemovalCommand {

    private String batchId;

    private String vesselId;

    private Quantity quantity;

    private RemovalType removalType;

    private String destination;

    private String reason;

    private String actorId;
}
