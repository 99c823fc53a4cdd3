package com.cidery.ledger.application.audit;

import com.cidery.ledger.application.config.JacksonConfig;
import com.cidery.ledger.domain.enums.DiffKind;
import com.cidery.ledger.domain.model.FieldDiff;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AuditDiffEngineTest {

    private ObjectMapper objectMapper;
    private AuditDiffEngine diffEngine;

    @BeforeEach
    void setUp() {
        objectMapper = new JacksonConfig().objectMapper();
        diffEngine = new AuditDiffEngine(objectMapper, new String[]{"id", "version", "createdAt", "updatedAt"});
    }

    private JsonNode json(String text) throws Exception {
        return objectMapper.readTree(text);
    }

    @Test
    void testReportsAddedRemovedAndModifiedFields() throws Exception {
        List<FieldDiff> diff = diffEngine.computeDiff(
                json("{\"status\":\"FERMENTATION\",\"abvPct\":6.5,\"note\":\"racked\"}"),
                json("{\"status\":\"AGING\",\"abvPct\":6.5,\"location\":\"cellar 2\"}"));

        assertEquals(3, diff.size());
        assertEquals("status", diff.get(0).getField());
        assertEquals(DiffKind.MODIFIED, diff.get(0).getKind());
        assertEquals("AGING", diff.get(0).getNewValue().asText());
        assertEquals(DiffKind.REMOVED, diff.get(1).getKind());
        assertEquals("note", diff.get(1).getField());
        assertEquals(DiffKind.ADDED, diff.get(2).getKind());
        assertEquals("location", diff.get(2).getField());
    }

    @Test
    void testNumbersCompareByValue() throws Exception {
        List<FieldDiff> diff = diffEngine.computeDiff(json("{\"liters\":1.0}"), json("{\"liters\":1.00}"));

        assertTrue(diff.isEmpty());
    }

    @Test
    void testTimestampsCompareByInstant() throws Exception {
        List<FieldDiff> diff = diffEngine.computeDiff(
                json("{\"since\":\"2024-03-01T12:00:00Z\"}"),
                json("{\"since\":\"2024-03-01T13:00:00+01:00\"}"));

        assertTrue(diff.isEmpty());
    }

    @Test
    void testNullCountsAsAbsent() throws Exception {
        assertTrue(diffEngine.computeDiff(json("{\"taxClass\":null}"), json("{}")).isEmpty());
    }

    @Test
    void testNestedChangeReportedOnTopLevelField() throws Exception {
        List<FieldDiff> diff = diffEngine.computeDiff(
                json("{\"placements\":[{\"vesselId\":\"T1\",\"liters\":100}]}"),
                json("{\"placements\":[{\"vesselId\":\"T1\",\"liters\":80}]}"));

        assertEquals(1, diff.size());
        assertEquals("placements", diff.get(0).getField());
        assertEquals(DiffKind.MODIFIED, diff.get(0).getKind());
    }

    @Test
    void testArrayOrderMatters() throws Exception {
        List<FieldDiff> diff = diffEngine.computeDiff(json("{\"tags\":[\"a\",\"b\"]}"), json("{\"tags\":[\"b\",\"a\"]}"));

        assertEquals(1, diff.size());
    }

    @Test
    void testBookkeepingFieldsIgnored() throws Exception {
        List<FieldDiff> diff = diffEngine.computeDiff(
                json("{\"id\":\"B1\",\"version\":1,\"updatedAt\":\"2024-01-01T00:00:00Z\"}"),
                json("{\"id\":\"B1\",\"version\":2,\"updatedAt\":\"2024-02-01T00:00:00Z\"}"));

        assertTrue(diff.isEmpty());
    }

    @Test
    void testCreateDiffListsEveryField() throws Exception {
        List<FieldDiff> diff = diffEngine.computeDiff(null, json("{\"name\":\"Dabinett\",\"status\":\"AGING\"}"));

        assertEquals(2, diff.size());
        assertTrue(diff.stream().allMatch(d -> d.getKind() == DiffKind.ADDED));
    }
}
