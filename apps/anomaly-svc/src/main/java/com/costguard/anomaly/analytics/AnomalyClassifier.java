package com.costguard.anomaly.analytics;

import com.costguard.anomaly.config.CostGuardProperties;
import com.costguard.anomaly.model.AnomalyRecord;
import com.costguard.anomaly.model.Baseline;
import com.costguard.anomaly.model.CostObservation;
import java.util.Comparator;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Scores each observation with the modified z-score {@code 0.6745 * (total - median) / mad} and keeps the
 * ones whose magnitude exceeds the threshold. Results are ordered by descending |z|, then ascending date.
 */
@Component
public class AnomalyClassifier {

    static final double MODIFIED_Z_SCALE = 0.6745d;

    private static final Comparator<AnomalyRecord> BY_MAGNITUDE_THEN_DATE =
            Comparator.comparingDouble((AnomalyRecord anomaly) -> Math.abs(anomaly.zScore()))
                    .reversed()
                    .thenComparing(AnomalyRecord::date);

    private final double severityMultiplier;

    @Autowired
    public AnomalyClassifier(CostGuardProperties properties) {
        this(properties.detection().severityMultiplier());
    }

    AnomalyClassifier(double severityMultiplier) {
        this.severityMultiplier = severityMultiplier;
    }

    public List<AnomalyRecord> classify(List<CostObservation> observations, Baseline baseline, double threshold) {
        if (!(baseline.mad() > 0)) {
            throw new BaselineComputationException("baseline MAD must be positive but was " + baseline.mad());
        }
        return observations.stream()
                .map(observation -> score(observation, baseline, threshold))
                .filter(anomaly -> anomaly != null)
                .sorted(BY_MAGNITUDE_THEN_DATE)
                .toList();
    }

    double zScore(double total, Baseline baseline) {
        return MODIFIED_Z_SCALE * (total - baseline.median()) / baseline.mad();
    }

    private AnomalyRecord score(CostObservation observation, Baseline baseline, double threshold) {
        double z = zScore(observation.total(), baseline);
        double magnitude = Math.abs(z);
        if (!(magnitude > threshold)) {
            return null;
        }
        AnomalyRecord.Kind kind = z > 0 ? AnomalyRecord.Kind.SPIKE : AnomalyRecord.Kind.DROP;
        AnomalyRecord.Severity severity = magnitude > severityMultiplier * threshold
                ? AnomalyRecord.Severity.CRITICAL
                : AnomalyRecord.Severity.WARNING;
        return new AnomalyRecord(
                observation.date(),
                observation.total(),
                baseline,
                z,
                kind,
                severity,
                observation.contributors()
        );
    }
}
