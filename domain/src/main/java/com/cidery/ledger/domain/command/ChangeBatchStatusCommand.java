package com.cidery.ledger.domain.command;

import com.cidery.ledger.domain.enums.BatchStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeBatchStatusCommand {

    private String batchId;

    private BatchStatus status;

    private String reason;

    private String actorId;
}
