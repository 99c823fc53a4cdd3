package com.cidery.ledger.api.controller;

import com.cidery.ledger.api.service.ActorExtractor;
import com.cidery.ledger.application.service.LedgerCommandGateway;
import com.cidery.ledger.application.service.LedgerQueryService;
import com.cidery.ledger.domain.command.AssignBatchCommand;
import com.cidery.ledger.domain.command.ChangeBatchStatusCommand;
import com.cidery.ledger.domain.command.RecordFillCommand;
import com.cidery.ledger.domain.command.RecordLossCommand;
import com.cidery.ledger.domain.command.RecordRemovalCommand;
import com.cidery.ledger.domain.command.RegisterBatchCommand;
import com.cidery.ledger.domain.command.SplitBatchCommand;
import com.cidery.ledger.domain.command.TransferVolumeCommand;
import com.cidery.ledger.domain.command.VolumeAdjustmentCommand;
import com.cidery.ledger.domain.enums.BatchStatus;
import com.cidery.ledger.domain.model.Batch;
import com.cidery.ledger.domain.model.LedgerResult;
import com.cidery.ledger.domain.model.Quantity;
import com.cidery.ledger.domain.model.TransactionEntry;
import jakarta.servlet.http.HttpServletRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST controller for batches and the volume movements recorded against them.
 * The batch in the path wins over any batch id in the body.
 */
@RestController
@RequestMapping("/api/batches")
public class BatchController {

    private static final Logger log = LoggerFactory.getLogger(BatchController.class);

    private final LedgerCommandGateway commandGateway;
    private final LedgerQueryService queryService;
    private final ActorExtractor actorExtractor;

    public BatchController(LedgerCommandGateway commandGateway,
                           LedgerQueryService queryService,
                           ActorExtractor actorExtractor) {
        this.commandGateway = commandGateway;
        this.queryService = queryService;
        this.actorExtractor = actorExtractor;
    }

    @PostMapping
    public ResponseEntity<LedgerResult<Batch>> registerBatch(@RequestBody RegisterBatchCommand command,
                                                             HttpServletRequest request) {
        command.setActorId(actorExtractor.extract(request));
        log.info("Registering batch {} by {}", command.getBatchId(), command.getActorId());
        return ResponseEntity.status(HttpStatus.CREATED).body(commandGateway.registerBatch(command));
    }

    @GetMapping
    public ResponseEntity<List<Batch>> listBatches(@RequestParam(required = false) BatchStatus status) {
        return ResponseEntity.ok(queryService.listBatches(status));
    }

    @GetMapping("/{batchId}")
    public ResponseEntity<Batch> getBatch(@PathVariable String batchId) {
        return ResponseEntity.ok(queryService.getBatch(batchId));
    }

    @GetMapping("/{batchId}/volume")
    public ResponseEntity<Quantity> getCurrentVolume(@PathVariable String batchId) {
        return ResponseEntity.ok(queryService.getCurrentVolume(batchId));
    }

    @GetMapping("/{batchId}/transactions")
    public ResponseEntity<Map<String, Object>> getTransactions(@PathVariable String batchId,
                                                               @RequestParam(defaultValue = "0") int page,
                                                               @RequestParam(defaultValue = "50") int size) {
        Page<TransactionEntry> entries = queryService.getTransactionHistory(batchId, page, size);
        return ResponseEntity.ok(PageResponse.of(entries));
    }

    /**
     * Replays the transaction log and compares it with the stored projection.
     */
    @GetMapping("/{batchId}/integrity")
    public ResponseEntity<Batch> verifyIntegrity(@PathVariable String batchId) {
        return ResponseEntity.ok(queryService.verifyBatchIntegrity(batchId));
    }

    @PostMapping("/{batchId}/assignments")
    public ResponseEntity<LedgerResult<Batch>> assign(@PathVariable String batchId,
                                                      @RequestBody AssignBatchCommand command,
                                                      HttpServletRequest request) {
        command.setBatchId(batchId);
        command.setActorId(actorExtractor.extract(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(commandGateway.assignBatchToVessel(command));
    }

    @PostMapping("/{batchId}/fills")
    public ResponseEntity<LedgerResult<Batch>> recordFill(@PathVariable String batchId,
                                                          @RequestBody RecordFillCommand command,
                                                          HttpServletRequest request) {
        command.setBatchId(batchId);
        command.setActorId(actorExtractor.extract(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(commandGateway.recordFill(command));
    }

    @PostMapping("/{batchId}/transfers")
    public ResponseEntity<LedgerResult<Batch>> transfer(@PathVariable String batchId,
                                                        @RequestBody TransferVolumeCommand command,
                                                        HttpServletRequest request) {
        command.setBatchId(batchId);
        command.setActorId(actorExtractor.extract(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(commandGateway.transferVolume(command));
    }

    @PostMapping("/{batchId}/adjustments")
    public ResponseEntity<LedgerResult<Batch>> adjust(@PathVariable String batchId,
                                                      @RequestBody VolumeAdjustmentCommand command,
                                                      HttpServletRequest request) {
        command.setBatchId(batchId);
        command.setActorId(actorExtractor.extract(request));
        LedgerResult<Batch> result = commandGateway.recordVolumeAdjustment(command);
        if (result.hasWarnings()) {
            log.warn("Adjustment of batch {} raised warnings: {}", batchId, result.getWarnings());
        }
        return ResponseEntity.status(HttpStatus.CREATED).body(result);
    }

    @PostMapping("/{batchId}/losses")
    public ResponseEntity<LedgerResult<Batch>> recordLoss(@PathVariable String batchId,
                                                          @RequestBody RecordLossCommand command,
                                                          HttpServletRequest request) {
        command.setBatchId(batchId);
        command.setActorId(actorExtractor.extract(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(commandGateway.recordLoss(command));
    }

    @PostMapping("/{batchId}/removals")
    public ResponseEntity<LedgerResult<Batch>> recordRemoval(@PathVariable String batchId,
                                                             @RequestBody RecordRemovalCommand command,
                                                             HttpServletRequest request) {
        command.setBatchId(batchId);
        command.setActorId(actorExtractor.extract(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(commandGateway.recordRemoval(command));
    }

    @PostMapping("/{batchId}/splits")
    public ResponseEntity<LedgerResult<Batch>> split(@PathVariable String batchId,
                                                     @RequestBody SplitBatchCommand command,
                                                     HttpServletRequest request) {
        command.setBatchId(batchId);
        command.setActorId(actorExtractor.extract(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(commandGateway.splitBatch(command));
    }

    @PostMapping("/{batchId}/status")
    public ResponseEntity<LedgerResult<Batch>> changeStatus(@PathVariable String batchId,
                                                            @RequestBody ChangeBatchStatusCommand command,
                                                            HttpServletRequest request) {
        command.setBatchId(batchId);
        command.setActorId(actorExtractor.extract(request));
        return ResponseEntity.ok(commandGateway.changeBatchStatus(command));
    }
}
