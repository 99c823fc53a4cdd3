package com.cidery.ledger.api.controller;

import com.cidery.ledger.application.service.LedgerQueryService;
import com.cidery.ledger.domain.enums.AuditOperation;
import com.cidery.ledger.domain.model.AuditLogEntry;
import com.cidery.ledger.domain.model.AuditLogFilter;
import com.cidery.ledger.domain.model.AuditRendering;
import org.springframework.data.domain.Page;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Read-only access to the audit trail
 */
@RestController
@RequestMapping("/api/audit")
public class AuditController {

    private final LedgerQueryService queryService;

    public AuditController(LedgerQueryService queryService) {
        this.queryService = queryService;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> getAuditLog(
            @RequestParam(required = false) String table,
            @RequestParam(required = false) String recordId,
            @RequestParam(required = false) AuditOperation operation,
            @RequestParam(required = false) String actor,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "50") int size) {
        AuditLogFilter filter = AuditLogFilter.builder()
                .tableName(table)
                .recordId(recordId)
                .operation(operation)
                .actor(actor)
                .from(from)
                .to(to)
                .page(page)
                .size(size)
                .build();
        Page<AuditRendering> entries = queryService.getAuditLog(filter);
        return ResponseEntity.ok(PageResponse.of(entries));
    }

    @GetMapping("/{table}/{recordId}")
    public ResponseEntity<List<AuditLogEntry>> getHistory(@PathVariable String table,
                                                          @PathVariable String recordId) {
        return ResponseEntity.ok(queryService.getAuditHistory(table, recordId));
    }

    @GetMapping("/entries/{entryId}/verify")
    public ResponseEntity<Map<String, Object>> verify(@PathVariable UUID entryId) {
        Map<String, Object> response = new HashMap<>();
        response.put("entryId", entryId);
        response.put("checksumValid", queryService.verifyAuditEntry(entryId));
        return ResponseEntity.ok(response);
    }
}
