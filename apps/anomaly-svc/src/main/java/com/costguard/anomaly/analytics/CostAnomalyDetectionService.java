package com.costguard.anomaly.analytics;

import com.costguard.anomaly.billing.PreviousDayCostLookup;
import com.costguard.anomaly.config.CostGuardProperties;
import com.costguard.anomaly.model.AnomalyRecord;
import com.costguard.anomaly.model.AnomalyReport;
import com.costguard.anomaly.model.Baseline;
import com.costguard.anomaly.model.CostObservation;
import com.costguard.anomaly.model.DetectionRun;
import com.costguard.anomaly.model.RootCause;
import jakarta.annotation.PreDestroy;
import java.time.Instant;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs the detection pipeline over a caller supplied window: validate, estimate the baseline, classify,
 * attribute each anomaly to its contributors and assemble the run.
 */
@Service
public class CostAnomalyDetectionService {

    private static final Logger log = LoggerFactory.getLogger(CostAnomalyDetectionService.class);
    private static final int MAX_LOOKUP_THREADS = 4;

    private final BaselineEstimator baselineEstimator;
    private final AnomalyClassifier anomalyClassifier;
    private final RootCauseAnalyzer rootCauseAnalyzer;
    private final ReportAssembler reportAssembler;
    private final PreviousDayCostLookup previousDayCostLookup;
    private final CostGuardProperties.Detection detection;
    private final ExecutorService lookupExecutor;

    public CostAnomalyDetectionService(
            BaselineEstimator baselineEstimator,
            AnomalyClassifier anomalyClassifier,
            RootCauseAnalyzer rootCauseAnalyzer,
            ReportAssembler reportAssembler,
            PreviousDayCostLookup previousDayCostLookup,
            CostGuardProperties properties
    ) {
        this.baselineEstimator = baselineEstimator;
        this.anomalyClassifier = anomalyClassifier;
        this.rootCauseAnalyzer = rootCauseAnalyzer;
        this.reportAssembler = reportAssembler;
        this.previousDayCostLookup = previousDayCostLookup;
        this.detection = properties.detection();
        this.lookupExecutor = properties.lookup().parallel()
                ? Executors.newFixedThreadPool(MAX_LOOKUP_THREADS)
                : null;
    }

    public DetectionRun detect(List<CostObservation> window, String runId, Instant detectedAt) {
        return detect(window, detection.threshold(), runId, detectedAt);
    }

    public DetectionRun detect(List<CostObservation> window, double threshold, String runId, Instant detectedAt) {
        if (!(threshold > 0)) {
            throw new IllegalArgumentException("threshold must be positive");
        }
        validateWindow(window);
        if (window.size() < detection.minObservations()) {
            log.info("anomaly_detection runId={} days={} minObservations={} status=insufficient_history",
                    runId, window.size(), detection.minObservations());
            return reportAssembler.insufficientHistory(runId, detectedAt, window);
        }

        Baseline baseline = baselineEstimator.estimate(window.stream().map(CostObservation::total).toList());
        List<AnomalyRecord> anomalies = anomalyClassifier.classify(window, baseline, threshold);
        log.info("anomaly_detection runId={} days={} median={} mad={} threshold={} anomalies={}",
                runId, window.size(), baseline.median(), baseline.mad(), threshold, anomalies.size());

        Map<LocalDate, CostObservation> byDate = window.stream()
                .collect(Collectors.toMap(CostObservation::date, Function.identity()));
        List<AnomalyReport> reports = rootCauses(anomalies, byDate);
        long degraded = reports.stream().filter(AnomalyReport::degraded).count();
        if (degraded > 0) {
            log.warn("anomaly_detection runId={} degradedRootCauses={}", runId, degraded);
        }
        return reportAssembler.summarize(runId, detectedAt, window, baseline, reports);
    }

    private List<AnomalyReport> rootCauses(List<AnomalyRecord> anomalies, Map<LocalDate, CostObservation> byDate) {
        if (lookupExecutor == null || anomalies.size() < 2) {
            return anomalies.stream()
                    .map(anomaly -> explain(anomaly, byDate))
                    .toList();
        }
        // futures are joined in classification order, so the output matches the sequential path
        List<CompletableFuture<AnomalyReport>> futures = anomalies.stream()
                .map(anomaly -> CompletableFuture.supplyAsync(() -> explain(anomaly, byDate), lookupExecutor))
                .toList();
        return futures.stream()
                .map(CompletableFuture::join)
                .toList();
    }

    private AnomalyReport explain(AnomalyRecord anomaly, Map<LocalDate, CostObservation> byDate) {
        Optional<Map<String, Double>> previous = previousDay(anomaly.date(), byDate);
        RootCause rootCause = rootCauseAnalyzer.analyze(anomaly, previous);
        return reportAssembler.assemble(anomaly, rootCause);
    }

    /**
     * The previous day is taken from the window when it carries a breakdown; days outside the window, or
     * in-window days with a total but no breakdown, go to the billing backend. Empty means the breakdown is
     * unknown and the root cause is reported as degraded.
     */
    private Optional<Map<String, Double>> previousDay(LocalDate anomalyDate, Map<LocalDate, CostObservation> byDate) {
        CostObservation inWindow = byDate.get(anomalyDate.minusDays(1));
        if (inWindow != null && inWindow.hasBreakdown()) {
            return Optional.of(inWindow.contributors());
        }
        return previousDayCostLookup.fetchPreviousDay(anomalyDate);
    }

    static void validateWindow(List<CostObservation> window) {
        if (window == null || window.isEmpty()) {
            throw new InvalidCostWindowException("observation window must contain at least one day");
        }
        Set<LocalDate> seen = new HashSet<>();
        for (CostObservation observation : window) {
            if (observation == null || observation.date() == null) {
                throw new InvalidCostWindowException("observation window contains an entry without a date");
            }
            if (!seen.add(observation.date())) {
                throw new InvalidCostWindowException("duplicate observation for " + observation.date());
            }
            if (!isValidCost(observation.total())) {
                throw new InvalidCostWindowException("invalid total " + observation.total() + " on " + observation.date());
            }
            for (Map.Entry<String, Double> contributor : observation.contributors().entrySet()) {
                if (contributor.getKey() == null || contributor.getValue() == null || !isValidCost(contributor.getValue())) {
                    throw new InvalidCostWindowException("invalid cost for contributor " + contributor.getKey()
                            + " on " + observation.date());
                }
            }
        }
    }

    private static boolean isValidCost(double cost) {
        return Double.isFinite(cost) && cost >= 0;
    }

    @PreDestroy
    void shutdown() {
        if (lookupExecutor != null) {
            lookupExecutor.shutdown();
        }
    }
}
