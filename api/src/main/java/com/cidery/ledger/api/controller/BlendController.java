package com.cidery.ledger.api.controller;

import com.cidery.ledger.api.service.ActorExtractor;
import com.cidery.ledger.application.service.LedgerCommandGateway;
import com.cidery.ledger.domain.command.BlendOperation;
import com.cidery.ledger.domain.model.BlendResult;
import com.cidery.ledger.domain.model.LedgerResult;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/blends")
public class BlendController {

    private static final Logger log = LoggerFactory.getLogger(BlendController.class);

    private final LedgerCommandGateway commandGateway;
    private final ActorExtractor actorExtractor;

    public BlendController(LedgerCommandGateway commandGateway, ActorExtractor actorExtractor) {
        this.commandGateway = commandGateway;
        this.actorExtractor = actorExtractor;
    }

    @PostMapping
    public ResponseEntity<LedgerResult<BlendResult>> createBlend(@RequestBody BlendOperation operation,
                                                                 HttpServletRequest request) {
        operation.setActorId(actorExtractor.extract(request));
        log.info("Blending {} sources into vessel {}",
                operation.getSources() == null ? 0 : operation.getSources().size(),
                operation.getDestinationVesselId());
        return ResponseEntity.status(HttpStatus.CREATED).body(commandGateway.createBlend(operation));
    }
}
