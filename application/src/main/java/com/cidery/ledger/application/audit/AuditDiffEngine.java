package com.cidery.ledger.application.audit;

import com.cidery.ledger.domain.enums.DiffKind;
import com.cidery.ledger.domain.model.FieldDiff;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Field-level diff between two snapshots of a record.
 *
 * Snapshots are compared as Jackson trees over the union of their top-level fields.
 * Comparison is structural: nested objects and arrays compare element by element,
 * numbers by value (1.0 equals 1.00) and ISO timestamps by instant. A JSON null counts
 * as an absent field. Bookkeeping fields such as id and version are never reported.
 */
@Component
public class AuditDiffEngine {

    private static final Comparator<JsonNode> VALUE_COMPARATOR = AuditDiffEngine::compareValues;

    private final ObjectMapper objectMapper;
    private final Set<String> ignoredFields;

    public AuditDiffEngine(ObjectMapper objectMapper,
                           @Value("${ledger.audit.ignored-fields:id,version,createdAt,updatedAt}") String[] ignoredFields) {
        this.objectMapper = objectMapper;
        this.ignoredFields = new HashSet<>(Arrays.asList(ignoredFields));
    }

    public List<FieldDiff> computeDiff(Object oldSnapshot, Object newSnapshot) {
        return computeDiff(toTree(oldSnapshot), toTree(newSnapshot));
    }

    public List<FieldDiff> computeDiff(JsonNode oldSnapshot, JsonNode newSnapshot) {
        Set<String> fields = new LinkedHashSet<>();
        collectFieldNames(oldSnapshot, fields);
        collectFieldNames(newSnapshot, fields);

        List<FieldDiff> diffs = new ArrayList<>();
        for (String field : fields) {
            if (ignoredFields.contains(field)) {
                continue;
            }
            JsonNode oldValue = valueOf(oldSnapshot, field);
            JsonNode newValue = valueOf(newSnapshot, field);

            if (oldValue == null && newValue == null) {
                continue;
            }
            if (oldValue == null) {
                diffs.add(diff(field, DiffKind.ADDED, null, newValue));
            } else if (newValue == null) {
                diffs.add(diff(field, DiffKind.REMOVED, oldValue, null));
            } else if (!deepEquals(oldValue, newValue)) {
                diffs.add(diff(field, DiffKind.MODIFIED, oldValue, newValue));
            }
        }
        return diffs;
    }

    public boolean deepEquals(JsonNode a, JsonNode b) {
        if (a == null || b == null) {
            return a == b;
        }
        return a.equals(VALUE_COMPARATOR, b);
    }

    public JsonNode toTree(Object snapshot) {
        if (snapshot == null) {
            return null;
        }
        if (snapshot instanceof JsonNode) {
            return (JsonNode) snapshot;
        }
        return objectMapper.valueToTree(snapshot);
    }

    private static FieldDiff diff(String field, DiffKind kind, JsonNode oldValue, JsonNode newValue) {
        return FieldDiff.builder()
                .field(field)
                .kind(kind)
                .oldValue(oldValue)
                .newValue(newValue)
                .build();
    }

    private static void collectFieldNames(JsonNode snapshot, Set<String> into) {
        if (snapshot instanceof ObjectNode) {
            Iterator<String> names = snapshot.fieldNames();
            names.forEachRemaining(into::add);
        }
    }

    private static JsonNode valueOf(JsonNode snapshot, String field) {
        if (snapshot == null) {
            return null;
        }
        JsonNode value = snapshot.get(field);
        return value == null || value.isNull() || value.isMissingNode() ? null : value;
    }

    private static int compareValues(JsonNode a, JsonNode b) {
        if (a.isNumber() && b.isNumber()) {
            return a.decimalValue().compareTo(b.decimalValue());
        }
        if (a.isTextual() && b.isTextual()) {
            String left = a.textValue();
            String right = b.textValue();
            if (left.equals(right)) {
                return 0;
            }
            Optional<OffsetDateTime> leftTime = parseTimestamp(left);
            Optional<OffsetDateTime> rightTime = parseTimestamp(right);
            if (leftTime.isPresent() && rightTime.isPresent()) {
                return leftTime.get().toInstant().compareTo(rightTime.get().toInstant());
            }
            return left.compareTo(right);
        }
        return a.equals(b) ? 0 : 1;
    }

    private static Optional<OffsetDateTime> parseTimestamp(String text) {
        if (text.length() < 20 || text.charAt(4) != '-' || text.charAt(10) != 'T') {
            return Optional.empty();
        }
        try {
            return Optional.of(OffsetDateTime.parse(text));
        } catch (DateTimeParseException e) {
            return Optional.empty();
        }
    }
}
