package com.cidery.ledger.domain.command;

import com.cidery.ledger.domain.enums.BatchStatus;
import com.cidery.ledger.domain.enums.TaxClass;
import com.cidery.ledger.domain.model.SourceRef;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RegisterBatchCommand {

    private String batchId;

    private String name;

    @Builder.Default
    private BatchStatus status = BatchStatus.FERMENTATION;

    private BigDecimal abvPct;

    private TaxClass taxClass;

    @Builder.Default
    private List<SourceRef> compositionSources = new ArrayList<>();

    private String actorId;
}
