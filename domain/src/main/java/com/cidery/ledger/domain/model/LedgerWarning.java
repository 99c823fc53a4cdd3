package com.cidery.ledger.domain.model;

import com.cidery.ledger.domain.enums.WarningType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Non-fatal notice returned with a committed result.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LedgerWarning {

    private WarningType type;

    private String message;

    @Builder.Default
    private Map<String, Object> details = new LinkedHashMap<>();
}
