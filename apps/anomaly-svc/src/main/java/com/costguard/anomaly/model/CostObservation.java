package com.costguard.anomaly.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One day of billing data: the day's total and the per-contributor breakdown (for example per AWS service).
 * The breakdown need not sum exactly to the total.
 */
public record CostObservation(LocalDate date, double total, Map<String, Double> contributors) {

    public CostObservation {
        contributors = contributors == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(contributors));
    }

    public static CostObservation totalOnly(LocalDate date, double total) {
        return new CostObservation(date, total, Map.of());
    }

    /**
     * True when the contributors explain the day: a non-empty breakdown, or a day with no spend at all.
     * A positive total without a breakdown cannot be attributed.
     */
    public boolean hasBreakdown() {
        return !contributors.isEmpty() || total == 0d;
    }
}
