package com.cidery.ledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VesselOccupant {

    private String vesselId;

    private String batchId;

    private String batchName;

    private Quantity volume;

    private OffsetDateTime since;
}
