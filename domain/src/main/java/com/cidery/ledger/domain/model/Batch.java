package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.enums.BatchStatus;
import com.cidery.ledger.domain.enums.TaxClass;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * A tracked quantity of liquid sharing provenance.
 * This is also the snapshot shape written to the audit log for batch records.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Batch {

    private String id;

    private String name;

    private BatchStatus status;

    /**
     * Alcohol by volume, percent. Null until measured or derived from a blend.
     */
    private BigDecimal abvPct;

    /**
     * Explicit excise class. When null the class follows {@link #abvPct}.
     */
    private TaxClass taxClass;

    private Quantity currentVolume;

    @Builder.Default
    private List<SourceRef> compositionSources = new ArrayList<>();

    /**
     * Where the batch currently sits and how much is in each vessel.
     */
    @Builder.Default
    private List<VesselPlacement> placements = new ArrayList<>();

    private Long version;

    public TaxClass effectiveTaxClass() {
        return taxClass != null ? taxClass : TaxClass.forAbv(abvPct);
    }
}
