package com.cidery.ledger.domain.command;

import com.cidery.ledger.domain.enums.VesselStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChangeVesselStatusCommand {

    private String vesselId;

    private VesselStatus status;

    private String reason;

    private String actorId;
}
