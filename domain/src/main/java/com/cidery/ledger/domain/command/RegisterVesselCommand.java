package com.cidery.ledger.domain.command;

import com.cidery.ledger.domain.model.Quantity;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterVesselCommand {

    private String vesselId;

    private String name;

    private Quantity capacity;

    private String location;

    private String actorId;
}
