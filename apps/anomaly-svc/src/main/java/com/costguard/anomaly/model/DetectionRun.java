package com.costguard.anomaly.model;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of one detection run. A run either completes with a consistent set of reports, or carries zero
 * reports and a status explaining why ({@link Status#FAILED} includes the run-level error).
 * {@code observations} is the analyzed window, kept so a stored run can be re-scored later.
 */
public record DetectionRun(
        String runId,
        Instant detectedAt,
        Status status,
        int daysAnalyzed,
        Baseline baseline,
        int anomalyCount,
        List<AnomalyReport> reports,
        String error,
        List<CostObservation> observations
) {

    public DetectionRun {
        reports = reports == null ? List.of() : List.copyOf(reports);
        observations = observations == null ? List.of() : List.copyOf(observations);
    }

    public boolean hasAnomalies() {
        return !reports.isEmpty();
    }

    public enum Status {
        COMPLETED,
        INSUFFICIENT_HISTORY,
        FAILED
    }
}
