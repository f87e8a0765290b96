package com.costguard.anomaly.analytics;

import com.costguard.anomaly.model.AnomalyRecord;
import com.costguard.anomaly.model.AnomalyReport;
import com.costguard.anomaly.model.Baseline;
import com.costguard.anomaly.model.CostObservation;
import com.costguard.anomaly.model.DetectionRun;
import com.costguard.anomaly.model.RootCause;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import org.springframework.stereotype.Component;

/**
 * Pure composition of detection results. Run ids and timestamps are supplied by the caller.
 */
@Component
public class ReportAssembler {

    public AnomalyReport assemble(AnomalyRecord anomaly, RootCause rootCause) {
        Objects.requireNonNull(anomaly, "anomaly must be provided");
        Objects.requireNonNull(rootCause, "rootCause must be provided");
        return new AnomalyReport(anomaly, rootCause.contributions(), rootCause.degraded(), rootCause.reason());
    }

    public DetectionRun summarize(String runId, Instant detectedAt, List<CostObservation> window, Baseline baseline,
                                  List<AnomalyReport> reports) {
        return new DetectionRun(runId, detectedAt, DetectionRun.Status.COMPLETED, window.size(), baseline,
                reports.size(), reports, null, window);
    }

    public DetectionRun insufficientHistory(String runId, Instant detectedAt, List<CostObservation> window) {
        return new DetectionRun(runId, detectedAt, DetectionRun.Status.INSUFFICIENT_HISTORY, window.size(), null,
                0, List.of(), null, window);
    }

    /**
     * @param window the observations that were fetched, possibly empty when the fetch itself failed
     */
    public DetectionRun failed(String runId, Instant detectedAt, List<CostObservation> window, String error) {
        List<CostObservation> fetched = window == null ? List.of() : window;
        return new DetectionRun(runId, detectedAt, DetectionRun.Status.FAILED, fetched.size(), null,
                0, List.of(), error, fetched);
    }
}
