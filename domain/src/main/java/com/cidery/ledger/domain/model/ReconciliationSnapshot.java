package com.cidery.ledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReconciliationSnapshot {

    private UUID id;

    private ReportingPeriod period;

    private OffsetDateTime generatedAt;

    private String generatedBy;

    private BigDecimal toleranceGallons;

    @Builder.Default
    private List<TaxClassLine> lines = new ArrayList<>();

    private boolean balanced;

    @Builder.Default
    private List<LedgerWarning> discrepancies = new ArrayList<>();
}
