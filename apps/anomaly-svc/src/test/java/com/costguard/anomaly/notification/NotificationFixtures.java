package com.costguard.anomaly.notification;

import com.costguard.anomaly.model.AnomalyRecord;
import com.costguard.anomaly.model.AnomalyReport;
import com.costguard.anomaly.model.Baseline;
import com.costguard.anomaly.model.ContributionDelta;
import com.costguard.anomaly.model.DetectionRun;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

final class NotificationFixtures {

    static final Instant DETECTED_AT = Instant.parse("2024-03-31T06:00:00Z");
    static final Baseline BASELINE = new Baseline(101.5d, 3d);

    private NotificationFixtures() {
    }

    static AnomalyReport spike(AnomalyRecord.Severity severity) {
        AnomalyRecord anomaly = new AnomalyRecord(LocalDate.of(2024, 3, 27), 487d, BASELINE, 86.67d,
                AnomalyRecord.Kind.SPIKE, severity, Map.of("EC2", 325d, "RDS", 162d));
        return new AnomalyReport(anomaly, List.of(
                new ContributionDelta("EC2", 325d, 65d, 260d, 400d),
                new ContributionDelta("RDS", 162d, 36.5d, 125.5d, 343.8356164383562d)
        ), false, null);
    }

    static AnomalyReport degradedDrop() {
        AnomalyRecord anomaly = new AnomalyRecord(LocalDate.of(2024, 3, 12), 60d, BASELINE, -9.33d,
                AnomalyRecord.Kind.DROP, AnomalyRecord.Severity.CRITICAL, Map.of());
        return new AnomalyReport(anomaly, List.of(), true, "previous day costs unavailable");
    }

    static DetectionRun run(AnomalyReport... reports) {
        return new DetectionRun("run-1", DETECTED_AT, DetectionRun.Status.COMPLETED, 30, BASELINE,
                reports.length, List.of(reports), null, List.of());
    }
}
