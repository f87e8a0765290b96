package com.costguard.anomaly.model;

import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AnomalyRecord(
        LocalDate date,
        double total,
        Baseline baseline,
        double zScore,
        Kind kind,
        Severity severity,
        Map<String, Double> contributors
) {

    public AnomalyRecord {
        contributors = contributors == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(contributors));
    }

    public double deviationAmount() {
        return total - baseline.median();
    }

    public double deviationPercent() {
        if (baseline.median() <= 0) {
            return 0d;
        }
        return deviationAmount() / baseline.median() * 100;
    }

    public enum Kind {
        SPIKE,
        DROP
    }

    public enum Severity {
        WARNING,
        CRITICAL
    }
}
