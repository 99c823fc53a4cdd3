package com.cidery.ledger.application.audit;

import com.cidery.ledger.application.service.LedgerOperation;
import com.cidery.ledger.application.service.MetricsService;
import com.cidery.ledger.domain.enums.AuditOperation;
import com.cidery.ledger.domain.model.AuditLogEntry;
import com.cidery.ledger.domain.model.AuditLogFilter;
import com.cidery.ledger.domain.model.AuditRendering;
import com.cidery.ledger.domain.model.FieldDiff;
import com.cidery.ledger.infrastructure.persistence.entity.AuditLogEntity;
import com.cidery.ledger.infrastructure.persistence.repository.AuditLogRepository;
import com.cidery.ledger.infrastructure.persistence.repository.AuditLogSpecifications;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Writes and reads the audit trail.
 *
 * Each entry keeps the full old and new snapshots plus the derived diff, with sensitive
 * fields redacted, and is sealed with a SHA-256 checksum over its canonical JSON.
 */
@Service
public class AuditService {

    private static final Logger log = LoggerFactory.getLogger(AuditService.class);

    public static final String TABLE_BATCHES = "batches";
    public static final String TABLE_VESSELS = "vessels";
    public static final String AUDIT_VERSION = "1.0";
    static final String REDACTED = "[REDACTED]";

    private final AuditLogRepository auditLogRepository;
    private final AuditDiffEngine diffEngine;
    private final ObjectMapper objectMapper;
    private final MetricsService metricsService;
    private final Set<String> redactedFields;

    public AuditService(AuditLogRepository auditLogRepository,
                        AuditDiffEngine diffEngine,
                        ObjectMapper objectMapper,
                        MetricsService metricsService,
                        @Value("${ledger.audit.redacted-fields:password,passwordHash,token,secret,apiKey,privateKey}")
                        String[] redactedFields) {
        this.auditLogRepository = auditLogRepository;
        this.diffEngine = diffEngine;
        this.objectMapper = objectMapper;
        this.metricsService = metricsService;
        this.redactedFields = Arrays.stream(redactedFields)
                .map(field -> field.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    /**
     * Record one change. Runs inside the caller's transaction so the audit row commits
     * or rolls back with the change it describes.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public AuditLogEntry record(LedgerOperation operation, AuditOperation auditOperation, String tableName,
                                String recordId, Object oldSnapshot, Object newSnapshot) {
        validateSnapshots(auditOperation, oldSnapshot, newSnapshot);

        JsonNode oldTree = sanitize(diffEngine.toTree(oldSnapshot));
        JsonNode newTree = sanitize(diffEngine.toTree(newSnapshot));
        List<FieldDiff> diff = diffEngine.computeDiff(oldTree, newTree);

        AuditLogEntry entry = AuditLogEntry.builder()
                .tableName(tableName)
                .recordId(recordId)
                .operation(auditOperation)
                .oldSnapshot(oldTree)
                .newSnapshot(newTree)
                .diff(diff)
                .actor(operation.getActorId())
                .reason(operation.getReason())
                .correlationId(operation.getCorrelationId())
                .changedAt(operation.getOccurredAt())
                .auditVersion(AUDIT_VERSION)
                .build();
        entry.setChecksum(computeChecksum(entry));

        AuditLogEntity saved = auditLogRepository.save(toEntity(entry));
        entry.setId(saved.getId());
        metricsService.incrementAuditEntry();

        log.debug("Audited {} {} {} ({} changed fields)", auditOperation, tableName, recordId, diff.size());
        return entry;
    }

    @Transactional(readOnly = true)
    public Page<AuditLogEntry> getAuditLog(AuditLogFilter filter) {
        Specification<AuditLogEntity> spec = Specification
                .where(AuditLogSpecifications.tableName(filter.getTableName()))
                .and(AuditLogSpecifications.recordId(filter.getRecordId()))
                .and(AuditLogSpecifications.operation(filter.getOperation()))
                .and(AuditLogSpecifications.changedBy(filter.getActor()))
                .and(AuditLogSpecifications.changedFrom(filter.getFrom()))
                .and(AuditLogSpecifications.changedBefore(filter.getTo()));

        int size = Math.min(Math.max(filter.getSize(), 1), 500);
        PageRequest page = PageRequest.of(Math.max(filter.getPage(), 0), size,
                Sort.by(Sort.Direction.DESC, "changedAt"));
        return auditLogRepository.findAll(spec, page).map(this::toDomain);
    }

    @Transactional(readOnly = true)
    public List<AuditLogEntry> history(String tableName, String recordId) {
        return auditLogRepository.findHistory(tableName, recordId).stream()
                .map(this::toDomain)
                .collect(Collectors.toList());
    }

    @Transactional(readOnly = true)
    public Optional<AuditLogEntry> findEntry(UUID entryId) {
        return auditLogRepository.findById(entryId).map(this::toDomain);
    }

    /**
     * Read-side view: creates and restores show the new snapshot, deletes the old one,
     * updates only the changed fields with their prior and new values.
     */
    public AuditRendering render(AuditLogEntry entry) {
        AuditRendering.AuditRenderingBuilder view = AuditRendering.builder()
                .entryId(entry.getId())
                .tableName(entry.getTableName())
                .recordId(entry.getRecordId())
                .operation(entry.getOperation())
                .actor(entry.getActor())
                .reason(entry.getReason())
                .changedAt(entry.getChangedAt())
                .summary(summarize(entry));

        return switch (entry.getOperation()) {
            case CREATE, RESTORE -> view.snapshot(entry.getNewSnapshot()).build();
            case DELETE, SOFT_DELETE -> view.snapshot(entry.getOldSnapshot()).build();
            case UPDATE -> view.changes(entry.getDiff()).build();
        };
    }

    public String summarize(AuditLogEntry entry) {
        String record = singular(entry.getTableName()) + " " + entry.getRecordId();
        return switch (entry.getOperation()) {
            case CREATE -> "Created " + record;
            case DELETE -> "Deleted " + record;
            case SOFT_DELETE -> "Archived " + record;
            case RESTORE -> "Restored " + record;
            case UPDATE -> {
                if (entry.getDiff() == null || entry.getDiff().isEmpty()) {
                    yield "Touched " + record + " with no field changes";
                }
                yield "Updated " + record + ": " + entry.getDiff().stream()
                        .map(FieldDiff::getField)
                        .collect(Collectors.joining(", "));
            }
        };
    }

    /**
     * True when the stored checksum still matches the entry's content.
     */
    public boolean verifyChecksum(AuditLogEntry entry) {
        return computeChecksum(entry).equals(entry.getChecksum());
    }

    void validateSnapshots(AuditOperation operation, Object oldSnapshot, Object newSnapshot) {
        boolean hasOld = oldSnapshot != null;
        boolean hasNew = newSnapshot != null;
        boolean valid = switch (operation) {
            case CREATE -> hasNew && !hasOld;
            case UPDATE -> hasOld && hasNew;
            case DELETE, SOFT_DELETE -> hasOld && !hasNew;
            case RESTORE -> hasNew;
        };
        if (!valid) {
            throw new IllegalArgumentException(String.format(
                    "%s audit entry needs %s (old present: %s, new present: %s)",
                    operation, expectedShape(operation), hasOld, hasNew));
        }
    }

    private static String expectedShape(AuditOperation operation) {
        return switch (operation) {
            case CREATE -> "a new snapshot only";
            case UPDATE -> "old and new snapshots";
            case DELETE, SOFT_DELETE -> "an old snapshot only";
            case RESTORE -> "a new snapshot";
        };
    }

    JsonNode sanitize(JsonNode node) {
        if (node == null) {
            return null;
        }
        JsonNode copy = node.deepCopy();
        redact(copy);
        return copy;
    }

    private void redact(JsonNode node) {
        if (node instanceof ObjectNode) {
            ObjectNode object = (ObjectNode) node;
            List<String> names = new ArrayList<>();
            object.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                if (redactedFields.contains(name.toLowerCase(Locale.ROOT))) {
                    object.put(name, REDACTED);
                } else {
                    redact(object.get(name));
                }
            }
        } else if (node instanceof ArrayNode) {
            node.forEach(this::redact);
        }
    }

    String computeChecksum(AuditLogEntry entry) {
        ObjectNode content = JsonNodeFactory.instance.objectNode();
        content.put("tableName", entry.getTableName());
        content.put("recordId", entry.getRecordId());
        content.put("operation", entry.getOperation().name());
        content.set("oldData", entry.getOldSnapshot());
        content.set("newData", entry.getNewSnapshot());
        content.set("diffData", objectMapper.valueToTree(entry.getDiff()));
        content.put("changedBy", entry.getActor());
        content.put("changedAt", entry.getChangedAt().toInstant().toString());
        content.put("auditVersion", entry.getAuditVersion());

        try {
            String canonical = objectMapper.writeValueAsString(canonicalize(content));
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(canonical.getBytes(StandardCharsets.UTF_8)));
        } catch (JsonProcessingException | NoSuchAlgorithmException e) {
            log.error("Failed to compute audit checksum for {} {}", entry.getTableName(), entry.getRecordId(), e);
            throw new RuntimeException("Failed to compute audit checksum", e);
        }
    }

    /**
     * Sorted keys and plain, trailing-zero-free numbers, so the checksum survives a round
     * trip through a JSONB column.
     */
    private static JsonNode canonicalize(JsonNode node) {
        if (node == null || node.isNull()) {
            return JsonNodeFactory.instance.nullNode();
        }
        if (node.isObject()) {
            ObjectNode sorted = JsonNodeFactory.instance.objectNode();
            Set<String> names = new TreeSet<>();
            node.fieldNames().forEachRemaining(names::add);
            for (String name : names) {
                sorted.set(name, canonicalize(node.get(name)));
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = JsonNodeFactory.instance.arrayNode();
            node.forEach(child -> array.add(canonicalize(child)));
            return array;
        }
        if (node.isNumber()) {
            return TextNode.valueOf(node.decimalValue().stripTrailingZeros().toPlainString());
        }
        return node;
    }

    private AuditLogEntity toEntity(AuditLogEntry entry) {
        return AuditLogEntity.builder()
                .tableName(entry.getTableName())
                .recordId(entry.getRecordId())
                .operation(entry.getOperation())
                .oldData(writeJson(entry.getOldSnapshot()))
                .newData(writeJson(entry.getNewSnapshot()))
                .diffData(writeJson(entry.getDiff()))
                .changedBy(entry.getActor())
                .reason(entry.getReason())
                .correlationId(entry.getCorrelationId())
                .changedAt(entry.getChangedAt())
                .auditVersion(entry.getAuditVersion())
                .checksum(entry.getChecksum())
                .build();
    }

    private AuditLogEntry toDomain(AuditLogEntity entity) {
        try {
            return AuditLogEntry.builder()
                    .id(entity.getId())
                    .tableName(entity.getTableName())
                    .recordId(entity.getRecordId())
                    .operation(entity.getOperation())
                    .oldSnapshot(entity.getOldData() != null ? objectMapper.readTree(entity.getOldData()) : null)
                    .newSnapshot(entity.getNewData() != null ? objectMapper.readTree(entity.getNewData()) : null)
                    .diff(objectMapper.readValue(entity.getDiffData(), new TypeReference<List<FieldDiff>>() {}))
                    .actor(entity.getChangedBy())
                    .reason(entity.getReason())
                    .correlationId(entity.getCorrelationId())
                    .changedAt(entity.getChangedAt())
                    .auditVersion(entity.getAuditVersion())
                    .checksum(entity.getChecksum())
                    .build();
        } catch (JsonProcessingException e) {
            log.error("Failed to read audit entry {}", entity.getId(), e);
            throw new RuntimeException("Failed to deserialize audit entry", e);
        }
    }

    private String writeJson(Object value) {
        if (value == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize audit data", e);
            throw new RuntimeException("Failed to serialize audit data", e);
        }
    }

    private static String singular(String tableName) {
        return tableName.endsWith("es") && tableName.startsWith("batch")
                ? tableName.substring(0, tableName.length() - 2)
                : tableName.endsWith("s") ? tableName.substring(0, tableName.length() - 1) : tableName;
    }
}
