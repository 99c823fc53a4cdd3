package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.enums.DiffKind;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FieldDiff {

    private String field;

    private DiffKind kind;

    private JsonNode oldValue;

    private JsonNode newValue;
}
