package com.cidery.ledger.domain.exception;

import com.cidery.ledger.domain.enums.VesselStatus;

public class VesselUnavailableException extends LedgerValidationException {

    public VesselUnavailableException(String vesselId, VesselStatus status) {
        super("VESSEL_UNAVAILABLE",
                String.format("Vessel %s is %s and cannot receive liquid", vesselId, status),
                details("vesselId", vesselId, "status", status.name()));
    }
}
