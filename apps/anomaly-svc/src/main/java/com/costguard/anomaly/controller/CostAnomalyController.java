package com.costguard.anomaly.controller;

import com.costguard.anomaly.analytics.CostAnomalyDetectionService;
import com.costguard.anomaly.config.CostGuardProperties;
import com.costguard.anomaly.controller.dto.DetectRequestDto;
import com.costguard.anomaly.controller.dto.DetectionRunResponseDto;
import com.costguard.anomaly.model.AnomalyReport;
import com.costguard.anomaly.model.ContributionDelta;
import com.costguard.anomaly.model.CostObservation;
import com.costguard.anomaly.model.DetectionRun;
import com.costguard.anomaly.report.AnomalyReportRepository;
import com.costguard.anomaly.service.DetectionRunner;
import com.costguard.anomaly.web.RequestContextHolder;
import jakarta.validation.Valid;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;
import java.util.stream.IntStream;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/anomalies")
public class CostAnomalyController {

    private final CostAnomalyDetectionService detectionService;
    private final DetectionRunner detectionRunner;
    private final AnomalyReportRepository reportRepository;
    private final CostGuardProperties properties;

    public CostAnomalyController(
            CostAnomalyDetectionService detectionService,
            DetectionRunner detectionRunner,
            AnomalyReportRepository reportRepository,
            CostGuardProperties properties
    ) {
        this.detectionService = detectionService;
        this.detectionRunner = detectionRunner;
        this.reportRepository = reportRepository;
        this.properties = properties;
    }

    /**
     * Scores a caller supplied window. Nothing is persisted or notified.
     */
    @PostMapping("/detect")
    public ResponseEntity<DetectionRunResponseDto> detect(@Valid @RequestBody DetectRequestDto request) {
        List<CostObservation> window = request.observations().stream()
                .map(observation -> new CostObservation(observation.date(), observation.total(), observation.contributors()))
                .toList();
        double threshold = request.threshold() != null ? request.threshold() : properties.detection().threshold();
        DetectionRun run = detectionService.detect(window, threshold, UUID.randomUUID().toString(), Instant.now());
        return ResponseEntity.ok(map(run));
    }

    @PostMapping("/runs")
    public ResponseEntity<DetectionRunResponseDto> triggerRun(
            @RequestParam(value = "endDate", required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate
    ) {
        DetectionRun run = endDate != null
                ? detectionRunner.runForWindowEnding(endDate, "manual")
                : detectionRunner.runNow("manual");
        HttpStatus status = run.status() == DetectionRun.Status.FAILED ? HttpStatus.UNPROCESSABLE_ENTITY : HttpStatus.OK;
        return ResponseEntity.status(status).body(map(run));
    }

    @GetMapping("/runs/latest")
    public ResponseEntity<DetectionRunResponseDto> latestRun() {
        return reportRepository.findLatest()
                .map(run -> ResponseEntity.ok(map(run)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    private DetectionRunResponseDto map(DetectionRun run) {
        DetectionRunResponseDto.Baseline baseline = run.baseline() == null
                ? null
                : new DetectionRunResponseDto.Baseline(scaled(run.baseline().median()), scaled(run.baseline().mad()));
        return new DetectionRunResponseDto(
                run.runId(),
                run.detectedAt(),
                run.status().name(),
                run.daysAnalyzed(),
                baseline,
                run.anomalyCount(),
                run.reports().stream().map(this::mapReport).toList(),
                run.error(),
                RequestContextHolder.traceId().orElse(null)
        );
    }

    private DetectionRunResponseDto.Anomaly mapReport(AnomalyReport report) {
        var anomaly = report.anomaly();
        List<ContributionDelta> contributions = report.contributions();
        return new DetectionRunResponseDto.Anomaly(
                anomaly.date(),
                scaled(anomaly.total()),
                scaled(anomaly.baseline().median()),
                scaled(anomaly.deviationAmount()),
                scaled(anomaly.deviationPercent()),
                scaled(anomaly.zScore()),
                anomaly.kind().name(),
                anomaly.severity().name(),
                report.degraded(),
                report.degradedReason(),
                IntStream.range(0, contributions.size())
                        .mapToObj(i -> mapContribution(i + 1, contributions.get(i)))
                        .toList()
        );
    }

    private DetectionRunResponseDto.Contributor mapContribution(int rank, ContributionDelta contribution) {
        return new DetectionRunResponseDto.Contributor(
                rank,
                contribution.name(),
                scaled(contribution.current()),
                scaled(contribution.previous()),
                scaled(contribution.delta()),
                scaled(contribution.deltaPercent())
        );
    }

    private static BigDecimal scaled(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }
}
