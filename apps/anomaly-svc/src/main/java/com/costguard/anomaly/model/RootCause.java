package com.costguard.anomaly.model;

import java.util.List;

/**
 * Ranked contributor changes for one anomalous day. {@code degraded} is set when the previous day's
 * breakdown could not be obtained and every previous cost was taken as zero.
 */
public record RootCause(List<ContributionDelta> contributions, boolean degraded, String reason) {

    public RootCause {
        contributions = contributions == null ? List.of() : List.copyOf(contributions);
    }

    public static RootCause complete(List<ContributionDelta> contributions) {
        return new RootCause(contributions, false, null);
    }

    public static RootCause degraded(List<ContributionDelta> contributions, String reason) {
        return new RootCause(contributions, true, reason);
    }
}
