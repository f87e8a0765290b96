package com.costguard.anomaly.notification;

import com.costguard.anomaly.config.CostGuardProperties;
import com.costguard.anomaly.model.AnomalyRecord;
import com.costguard.anomaly.model.AnomalyReport;
import com.costguard.anomaly.model.ContributionDelta;
import com.costguard.anomaly.model.DetectionRun;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Renders one anomaly report as a plain-text alert: a header describing the day, the ranked contributors and a
 * footer with run-level totals.
 */
@Component
public class AlertMessageRenderer {

    private static final String RULE = "=".repeat(60);

    private final int maxContributors;

    @Autowired
    public AlertMessageRenderer(CostGuardProperties properties) {
        this(properties.notification().topContributors());
    }

    /**
     * @param maxContributors contributor lines per alert; 0 renders all of them
     */
    AlertMessageRenderer(int maxContributors) {
        this.maxContributors = maxContributors;
    }

    public AlertMessage render(AnomalyReport report, DetectionRun run) {
        AnomalyRecord anomaly = report.anomaly();
        String subject = "AWS Cost Anomaly - " + anomaly.severity().name() + " " + anomaly.kind().name()
                + " on " + anomaly.date();
        StringBuilder body = new StringBuilder();
        body.append("AWS Cost Anomaly Alert\n")
                .append(RULE).append('\n')
                .append('\n')
                .append("Date: ").append(anomaly.date()).append('\n')
                .append("Daily Cost: ").append(money(anomaly.total())).append('\n')
                .append("Expected (Median): ").append(money(anomaly.baseline().median())).append('\n')
                .append("Deviation: ").append(signedMoney(anomaly.deviationAmount()))
                .append(" (").append(signedPercent(anomaly.deviationPercent())).append(")\n")
                .append("Z-Score: ").append(String.format(Locale.US, "%.2f", anomaly.zScore())).append('\n')
                .append("Type: ").append(anomaly.kind().name()).append('\n')
                .append("Severity: ").append(anomaly.severity().name()).append('\n');
        if (report.degraded()) {
            body.append("Note: ").append(report.degradedReason()).append('\n');
        }
        appendContributors(body, report.contributions());
        body.append('\n')
                .append("Total Anomalies Detected: ").append(run.anomalyCount()).append('\n')
                .append("Detection Time: ").append(DateTimeFormatter.ISO_INSTANT.format(run.detectedAt())).append('\n');
        return new AlertMessage(subject, body.toString());
    }

    private void appendContributors(StringBuilder body, List<ContributionDelta> contributions) {
        body.append('\n').append("Top Contributors\n");
        if (contributions.isEmpty()) {
            body.append("  (no contributor breakdown available)\n");
            return;
        }
        int shown = maxContributors > 0 ? Math.min(maxContributors, contributions.size()) : contributions.size();
        for (int i = 0; i < shown; i++) {
            ContributionDelta contribution = contributions.get(i);
            body.append(String.format(Locale.US, "%2d. ", i + 1))
                    .append(contribution.name())
                    .append(": ").append(money(contribution.current()))
                    .append(" (previous ").append(money(contribution.previous())).append(") ")
                    .append(signedMoney(contribution.delta()))
                    .append(" (").append(signedPercent(contribution.deltaPercent())).append(")\n");
        }
        if (shown < contributions.size()) {
            body.append("  ... and ").append(contributions.size() - shown).append(" more\n");
        }
    }

    static String money(double amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }

    static String signedMoney(double amount) {
        return (amount < 0 ? "-" : "+") + money(Math.abs(amount));
    }

    static String signedPercent(double percent) {
        return String.format(Locale.US, "%+.1f%%", percent);
    }
}
