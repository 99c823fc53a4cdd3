package com.cidery.ledger.domain.command;

import com.cidery.ledger.domain.enums.LossType;
import com.cidery.ledger.domain.model.Quantity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordLossCommand {

    private String batchId;

    private String vesselId;

    private Quantity quantity;

    private LossType lossType;

    private String reason;

    private String actorId;
}
