package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.enums.VesselStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A physical tank or barrel. Which batch it holds is tracked by the ledger's
 * occupancy records, not here.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Vessel {

    private String id;

    private String name;

    private Quantity capacity;

    private VesselStatus status;

    private String location;

    private Long version;
}
