package com.costguard.anomaly.model;

import java.util.List;

public record AnomalyReport(
        AnomalyRecord anomaly,
        List<ContributionDelta> contributions,
        boolean degraded,
        String degradedReason
) {

    public AnomalyReport {
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
    }
}
