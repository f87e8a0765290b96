package com.costguard.anomaly.controller.dto;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

public record DetectionRunResponseDto(
        String runId,
        Instant detectedAt,
        String status,
        int daysAnalyzed,
        Baseline baseline,
        int anomalyCount,
        List<Anomaly> anomalies,
        String error,
        String traceId
) {
    public record Baseline(BigDecimal median, BigDecimal mad) {
    }

    public record Anomaly(
            LocalDate date,
            BigDecimal total,
            BigDecimal median,
            BigDecimal deviationAmount,
            BigDecimal deviationPercent,
            BigDecimal zScore,
            String kind,
            String severity,
            boolean degraded,
            String degradedReason,
            List<Contributor> topContributors
    ) {
    }

    public record Contributor(
            int rank,
            String name,
            BigDecimal current,
            BigDecimal previous,
            BigDecimal delta,
            BigDecimal deltaPercent
    ) {
    }
}
