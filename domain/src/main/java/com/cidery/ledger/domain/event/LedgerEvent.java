package com.cidery.ledger.domain.event;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Published after a ledger command commits.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerEvent {

    private UUID eventId;

    private UUID operationId;

    /**
     * Command name, e.g. TRANSFER_VOLUME.
     */
    private String operation;

    @Builder.Default
    private List<String> batchIds = new ArrayList<>();

    @Builder.Default
    private List<String> vesselIds = new ArrayList<>();

    private OffsetDateTime occurredAt;

    private String actorId;

    private String correlationId;
}
