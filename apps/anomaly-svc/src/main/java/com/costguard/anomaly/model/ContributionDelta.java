package com.costguard.anomaly.model;

public record ContributionDelta(
        String name,
        double current,
        double previous,
        double delta,
        double deltaPercent
) {
}
