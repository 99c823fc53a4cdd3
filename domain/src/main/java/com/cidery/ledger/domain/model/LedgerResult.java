package com.cidery.ledger.domain.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Value of a successful ledger command plus any warnings it raised.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LedgerResult<T> {

    private T value;

    private List<LedgerWarning> warnings = new ArrayList<>();

    public static <T> LedgerResult<T> of(T value) {
        return new LedgerResult<>(value, new ArrayList<>());
    }

    public static <T> LedgerResult<T> of(T value, List<LedgerWarning> warnings) {
        return new LedgerResult<>(value, new ArrayList<>(warnings));
    }

    public boolean hasWarnings() {
        return warnings != null && !warnings.isEmpty();
    }
}
