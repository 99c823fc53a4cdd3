package com.cidery.ledger.api.controller;

import com.cidery.ledger.api.service.ActorExtractor;
import com.cidery.ledger.application.service.LedgerCommandGateway;
import com.cidery.ledger.application.service.LedgerQueryService;
import com.cidery.ledger.domain.command.ChangeVesselStatusCommand;
import com.cidery.ledger.domain.command.RegisterVesselCommand;
import com.cidery.ledger.domain.enums.VesselStatus;
import com.cidery.ledger.domain.model.LedgerResult;
import com.cidery.ledger.domain.model.Vessel;
import com.cidery.ledger.domain.model.VesselOccupant;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST controller for vessels
 */
@RestController
@RequestMapping("/api/vessels")
public class VesselController {

    private static final Logger log = LoggerFactory.getLogger(VesselController.class);

    private final LedgerCommandGateway commandGateway;
    private final LedgerQueryService queryService;
    private final ActorExtractor actorExtractor;

    public VesselController(LedgerCommandGateway commandGateway,
                            LedgerQueryService queryService,
                            ActorExtractor actorExtractor) {
        this.commandGateway = commandGateway;
        this.queryService = queryService;
        this.actorExtractor = actorExtractor;
    }

    @PostMapping
    public ResponseEntity<LedgerResult<Vessel>> registerVessel(@RequestBody RegisterVesselCommand command,
                                                               HttpServletRequest request) {
        command.setActorId(actorExtractor.extract(request));
        log.info("Registering vessel {} by {}", command.getVesselId(), command.getActorId());
        return ResponseEntity.status(HttpStatus.CREATED).body(commandGateway.registerVessel(command));
    }

    @GetMapping
    public ResponseEntity<List<Vessel>> listVessels(@RequestParam(required = false) VesselStatus status) {
        return ResponseEntity.ok(queryService.listVessels(status));
    }

    @GetMapping("/{vesselId}")
    public ResponseEntity<Vessel> getVessel(@PathVariable String vesselId) {
        return ResponseEntity.ok(queryService.getVessel(vesselId));
    }

    /**
     * The id of the open batch in the vessel, or null when it is empty.
     */
    @GetMapping("/{vesselId}/occupant")
    public ResponseEntity<Map<String, Object>> getOccupant(@PathVariable String vesselId) {
        Map<String, Object> response = new HashMap<>();
        response.put("vesselId", vesselId);
        response.put("batchId", queryService.getVesselOccupant(vesselId).orElse(null));
        return ResponseEntity.ok(response);
    }

    @GetMapping("/{vesselId}/contents")
    public ResponseEntity<VesselOccupant> getContents(@PathVariable String vesselId) {
        return queryService.getVesselContents(vesselId)
                .map(ResponseEntity::ok)
                .orElse(ResponseEntity.noContent().build());
    }

    @PostMapping("/{vesselId}/status")
    public ResponseEntity<LedgerResult<Vessel>> changeStatus(@PathVariable String vesselId,
                                                             @RequestBody ChangeVesselStatusCommand command,
                                                             HttpServletRequest request) {
        command.setVesselId(vesselId);
        command.setActorId(actorExtractor.extract(request));
        return ResponseEntity.ok(commandGateway.changeVesselStatus(command));
    }
}
