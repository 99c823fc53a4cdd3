package com.cidery.ledger.application.service;

import com.cidery.ledger.domain.event.LedgerEvent;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

/**
 * Context of one ledger command: who, when, why, and which records it touched.
 * All entries and audit rows written by the command share its id and timestamp.
 */
public class LedgerOperation {

    public static final String SYSTEM_ACTOR = "system";

    private final UUID operationId;
    private final String name;
    private final String actorId;
    private final String reason;
    private final String correlationId;
    private final OffsetDateTime occurredAt;
    private final Set<String> batchIds = new LinkedHashSet<>();
    private final Set<String> vesselIds = new LinkedHashSet<>();

    private LedgerOperation(String name, String actorId, String reason, String correlationId) {
        this.operationId = UUID.randomUUID();
        this.name = name;
        this.actorId = actorId == null || actorId.isBlank() ? SYSTEM_ACTOR : actorId;
        this.reason = reason;
        this.correlationId = correlationId;
        this.occurredAt = OffsetDateTime.now(ZoneOffset.UTC).truncatedTo(ChronoUnit.MICROS);
    }

    public static LedgerOperation start(String name, String actorId, String reason, String correlationId) {
        return new LedgerOperation(name, actorId, reason, correlationId);
    }

    public void touchBatch(String batchId) {
        batchIds.add(batchId);
    }

    public void touchVessel(String vesselId) {
        if (vesselId != null) {
            vesselIds.add(vesselId);
        }
    }

    public LedgerEvent toEvent() {
        return LedgerEvent.builder()
                .eventId(UUID.randomUUID())
                .operationId(operationId)
                .operation(name)
                .batchIds(new ArrayList<>(batchIds))
                .vesselIds(new ArrayList<>(vesselIds))
                .occurredAt(occurredAt)
                .actorId(actorId)
                .correlationId(correlationId)
                .build();
    }

    public UUID getOperationId() {
        return operationId;
    }

    public String getName() {
        return name;
    }

    public String getActorId() {
        return actorId;
    }

    public String getReason() {
        return reason;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public OffsetDateTime getOccurredAt() {
        return occurredAt;
    }

    public Set<String> getBatchIds() {
        return batchIds;
    }

    public Set<String> getVesselIds() {
        return vesselIds;
    }
}
