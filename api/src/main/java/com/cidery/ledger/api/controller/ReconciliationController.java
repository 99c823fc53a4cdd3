package com.cidery.ledger.api.controller;

import com.cidery.ledger.api.service.ActorExtractor;
import com.cidery.ledger.application.service.LedgerCommandGateway;
import com.cidery.ledger.application.service.LedgerQueryService;
import com.cidery.ledger.domain.command.ReconcilePeriodCommand;
import com.cidery.ledger.domain.enums.PeriodType;
import com.cidery.ledger.domain.model.LedgerResult;
import com.cidery.ledger.domain.model.ReconciliationSnapshot;
import com.cidery.ledger.domain.model.ReportingPeriod;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/**
 * Excise period reconciliation
 */
@RestController
@RequestMapping("/api/reconciliation")
public class ReconciliationController {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationController.class);

    private final LedgerCommandGateway commandGateway;
    private final LedgerQueryService queryService;
    private final ActorExtractor actorExtractor;

    public ReconciliationController(LedgerCommandGateway commandGateway,
                                    LedgerQueryService queryService,
                                    ActorExtractor actorExtractor) {
        this.commandGateway = commandGateway;
        this.queryService = queryService;
        this.actorExtractor = actorExtractor;
    }

    @PostMapping
    public ResponseEntity<LedgerResult<ReconciliationSnapshot>> reconcile(@RequestBody ReconcilePeriodCommand command,
                                                                          HttpServletRequest request) {
        command.setActorId(actorExtractor.extract(request));
        LedgerResult<ReconciliationSnapshot> result = commandGateway.reconcilePeriod(command);
        if (!result.getValue().isBalanced()) {
            log.warn("Period {} does not reconcile: {} discrepancies",
                    command.getPeriod(), result.getValue().getDiscrepancies().size());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @GetMapping
    public ResponseEntity<ReconciliationSnapshot> getSnapshot(@RequestParam PeriodType type,
                                                              @RequestParam int year,
                                                              @RequestParam(required = false) Integer number) {
        ReportingPeriod period = ReportingPeriod.of(type, year, number);
        return queryService.getReconciliationSnapshot(period)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.notFound().build());
    }
}
