package com.costguard.anomaly.notification;

import com.costguard.anomaly.config.CostGuardProperties;
import com.costguard.anomaly.model.AnomalyRecord;
import com.costguard.anomaly.model.AnomalyReport;
import com.costguard.anomaly.model.DetectionRun;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fans every qualifying report of a run out to the enabled notifiers. A failing notifier is logged and skipped;
 * delivery problems never fail the detection run.
 */
@Component
public class AnomalyNotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(AnomalyNotificationDispatcher.class);

    private final List<AnomalyNotifier> notifiers;
    private final AlertMessageRenderer renderer;
    private final AnomalyRecord.Severity minSeverity;

    @Autowired
    public AnomalyNotificationDispatcher(List<AnomalyNotifier> notifiers, AlertMessageRenderer renderer, CostGuardProperties properties) {
        this(notifiers, renderer, properties.notification().minSeverity());
    }

    AnomalyNotificationDispatcher(List<AnomalyNotifier> notifiers, AlertMessageRenderer renderer, AnomalyRecord.Severity minSeverity) {
        this.notifiers = notifiers.stream().filter(AnomalyNotifier::isEnabled).toList();
        this.renderer = renderer;
        this.minSeverity = minSeverity;
    }

    /**
     * @return number of alerts delivered successfully across all notifiers
     */
    public int dispatch(DetectionRun run) {
        if (!run.hasAnomalies()) {
            return 0;
        }
        int delivered = 0;
        for (AnomalyReport report : run.reports()) {
            if (report.anomaly().severity().compareTo(minSeverity) < 0) {
                log.debug("anomaly_alert skipped date={} severity={} minSeverity={}",
                        report.anomaly().date(), report.anomaly().severity(), minSeverity);
                continue;
            }
            AlertMessage message = renderer.render(report, run);
            for (AnomalyNotifier notifier : notifiers) {
                try {
                    notifier.send(message);
                    delivered++;
                } catch (RuntimeException ex) {
                    log.error("anomaly_alert channel={} date={} delivery failed", notifier.name(), report.anomaly().date(), ex);
                }
            }
        }
        return delivered;
    }

    List<String> activeChannels() {
        return notifiers.stream().map(AnomalyNotifier::name).toList();
    }
}
