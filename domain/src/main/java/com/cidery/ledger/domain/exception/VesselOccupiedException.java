package com.cidery.ledger.domain.exception;

public class VesselOccupiedException extends LedgerConflictException {

    public VesselOccupiedException(String vesselId, String occupantBatchId) {
        super("VESSEL_OCCUPIED",
                String.format("Vessel %s is occupied by batch %s", vesselId, occupantBatchId),
                details("vesselId", vesselId, "occupantBatchId", occupantBatchId), null);
    }
}
