package com.costguard.anomaly.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.costguard.anomaly.model.AnomalyRecord;
import com.costguard.anomaly.model.AnomalyReport;
import com.costguard.anomaly.model.Baseline;
import com.costguard.anomaly.model.ContributionDelta;
import com.costguard.anomaly.model.CostObservation;
import com.costguard.anomaly.model.DetectionRun;
import com.costguard.anomaly.model.RootCause;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ReportAssemblerTest {

    private final ReportAssembler assembler = new ReportAssembler();
    private final Instant detectedAt = Instant.parse("2024-04-01T06:00:00Z");

    @Test
    void assemblesReportFromAnomalyAndRootCause() {
        AnomalyRecord anomaly = anomaly();
        ContributionDelta ec2 = new ContributionDelta("EC2", 325d, 65d, 260d, 400d);

        AnomalyReport report = assembler.assemble(anomaly, RootCause.degraded(List.of(ec2), "no previous day"));

        assertThat(report.anomaly()).isSameAs(anomaly);
        assertThat(report.contributions()).containsExactly(ec2);
        assertThat(report.degraded()).isTrue();
        assertThat(report.degradedReason()).isEqualTo("no previous day");
    }

    @Test
    void rejectsMissingAnomaly() {
        assertThatThrownBy(() -> assembler.assemble(null, RootCause.complete(List.of())))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("anomaly");
    }

    @Test
    void summaryCountsReportsAndKeepsInjectedTimestamp() {
        AnomalyReport report = assembler.assemble(anomaly(), RootCause.complete(List.of()));

        DetectionRun run = assembler.summarize("run-1", detectedAt, window(30), new Baseline(101.5d, 3d), List.of(report));

        assertThat(run.status()).isEqualTo(DetectionRun.Status.COMPLETED);
        assertThat(run.anomalyCount()).isEqualTo(1);
        assertThat(run.detectedAt()).isEqualTo(detectedAt);
        assertThat(run.daysAnalyzed()).isEqualTo(30);
        assertThat(run.observations()).hasSize(30).first().extracting(CostObservation::date).isEqualTo(LocalDate.of(2024, 3, 1));
        assertThat(run.error()).isNull();
    }

    @Test
    void failedRunCarriesErrorAndNoAnomalies() {
        DetectionRun run = assembler.failed("run-2", detectedAt, window(12), "negative cost");

        assertThat(run.status()).isEqualTo(DetectionRun.Status.FAILED);
        assertThat(run.anomalyCount()).isZero();
        assertThat(run.reports()).isEmpty();
        assertThat(run.baseline()).isNull();
        assertThat(run.error()).isEqualTo("negative cost");
        assertThat(run.daysAnalyzed()).isEqualTo(12);
    }

    @Test
    void failedFetchHasNoObservations() {
        DetectionRun run = assembler.failed("run-3", detectedAt, null, "billing data unavailable");

        assertThat(run.daysAnalyzed()).isZero();
        assertThat(run.observations()).isEmpty();
    }

    @Test
    void insufficientHistoryKeepsTheShortWindow() {
        DetectionRun run = assembler.insufficientHistory("run-4", detectedAt, window(3));

        assertThat(run.status()).isEqualTo(DetectionRun.Status.INSUFFICIENT_HISTORY);
        assertThat(run.daysAnalyzed()).isEqualTo(3);
        assertThat(run.observations()).hasSize(3);
        assertThat(run.reports()).isEmpty();
    }

    private List<CostObservation> window(int days) {
        List<CostObservation> window = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            window.add(CostObservation.totalOnly(LocalDate.of(2024, 3, 1).plusDays(i), 100d + i));
        }
        return window;
    }

    private AnomalyRecord anomaly() {
        return new AnomalyRecord(LocalDate.of(2024, 3, 26), 487d, new Baseline(101.5d, 3d), 86.67d,
                AnomalyRecord.Kind.SPIKE, AnomalyRecord.Severity.CRITICAL, Map.of("EC2", 325d));
    }
}
