package com.costguard.anomaly.service;

import com.costguard.anomaly.analytics.CostAnomalyDetectionService;
import com.costguard.anomaly.analytics.InvalidCostWindowException;
import com.costguard.anomaly.analytics.ReportAssembler;
import com.costguard.anomaly.billing.CostDataSource;
import com.costguard.anomaly.billing.CostDataUnavailableException;
import com.costguard.anomaly.config.CostGuardProperties;
import com.costguard.anomaly.model.CostObservation;
import com.costguard.anomaly.model.DetectionRun;
import com.costguard.anomaly.notification.AnomalyNotificationDispatcher;
import com.costguard.anomaly.report.AnomalyReportRepository;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * End-to-end detection run: fetch the rolling window, detect, persist, notify.
 * A run that cannot build a valid baseline is recorded as FAILED with zero anomalies and is never notified.
 */
@Component
public class DetectionRunner {

    private static final Logger log = LoggerFactory.getLogger(DetectionRunner.class);

    private final CostDataSource costDataSource;
    private final CostAnomalyDetectionService detectionService;
    private final ReportAssembler reportAssembler;
    private final AnomalyReportRepository reportRepository;
    private final AnomalyNotificationDispatcher notificationDispatcher;
    private final CostGuardProperties properties;
    private final Clock clock;

    @Autowired
    public DetectionRunner(
            CostDataSource costDataSource,
            CostAnomalyDetectionService detectionService,
            ReportAssembler reportAssembler,
            AnomalyReportRepository reportRepository,
            AnomalyNotificationDispatcher notificationDispatcher,
            CostGuardProperties properties
    ) {
        this(costDataSource, detectionService, reportAssembler, reportRepository, notificationDispatcher, properties, Clock.systemUTC());
    }

    DetectionRunner(
            CostDataSource costDataSource,
            CostAnomalyDetectionService detectionService,
            ReportAssembler reportAssembler,
            AnomalyReportRepository reportRepository,
            AnomalyNotificationDispatcher notificationDispatcher,
            CostGuardProperties properties,
            Clock clock
    ) {
        this.costDataSource = costDataSource;
        this.detectionService = detectionService;
        this.reportAssembler = reportAssembler;
        this.reportRepository = reportRepository;
        this.notificationDispatcher = notificationDispatcher;
        this.properties = properties;
        this.clock = clock;
    }

    @Scheduled(cron = "${costguard.schedule.cron:0 0 6 * * *}", zone = "UTC")
    public void runOnSchedule() {
        if (!properties.schedule().enabled()) {
            log.debug("anomaly_run scheduled trigger ignored; costguard.schedule.enabled=false");
            return;
        }
        runNow("scheduled");
    }

    public DetectionRun runNow(String source) {
        return runForWindowEnding(LocalDate.now(clock), source);
    }

    /**
     * Runs detection over the {@code window-length-days} days before {@code endExclusive}.
     */
    public DetectionRun runForWindowEnding(LocalDate endExclusive, String source) {
        String runId = UUID.randomUUID().toString();
        Instant detectedAt = clock.instant();
        LocalDate start = endExclusive.minusDays(properties.detection().windowLengthDays());
        MDC.put("run_id", runId);
        try {
            log.info("anomaly_run start runId={} source={} windowStart={} windowEnd={}", runId, source, start, endExclusive);
            DetectionRun run = detect(runId, detectedAt, start, endExclusive);
            store(run);
            if (run.status() == DetectionRun.Status.COMPLETED && run.hasAnomalies()) {
                int delivered = notificationDispatcher.dispatch(run);
                log.info("anomaly_run notified runId={} alerts={}", runId, delivered);
            }
            log.info("anomaly_run done runId={} status={} days={} anomalies={}",
                    runId, run.status(), run.daysAnalyzed(), run.anomalyCount());
            return run;
        } finally {
            MDC.remove("run_id");
        }
    }

    private DetectionRun detect(String runId, Instant detectedAt, LocalDate start, LocalDate endExclusive) {
        List<CostObservation> window;
        try {
            window = costDataSource.fetchDailyCosts(start, endExclusive);
        } catch (CostDataUnavailableException ex) {
            log.error("anomaly_run runId={} billing data unavailable", runId, ex);
            return reportAssembler.failed(runId, detectedAt, List.of(), "billing data unavailable: " + ex.getMessage());
        }
        try {
            return detectionService.detect(window, runId, detectedAt);
        } catch (InvalidCostWindowException ex) {
            log.error("anomaly_run runId={} rejected window: {}", runId, ex.getMessage());
            return reportAssembler.failed(runId, detectedAt, window, ex.getMessage());
        }
    }

    private void store(DetectionRun run) {
        try {
            reportRepository.append(run);
        } catch (RuntimeException ex) {
            log.error("anomaly_run runId={} failed to persist run", run.runId(), ex);
        }
    }
}
