package com.costguard.anomaly.analytics;

import com.costguard.anomaly.config.CostGuardProperties;
import com.costguard.anomaly.model.AnomalyRecord;
import com.costguard.anomaly.model.ContributionDelta;
import com.costguard.anomaly.model.RootCause;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Attributes an anomalous day to its contributors by comparing each contributor's cost against the previous
 * day. Contributors missing on one side count as zero there.
 *
 * <p>A contributor with no previous cost but a positive current cost reports the configured sentinel
 * percentage instead of an unbounded ratio.
 */
@Component
public class RootCauseAnalyzer {

    static final String PREVIOUS_DAY_UNAVAILABLE = "previous day breakdown unavailable; previous costs taken as zero";

    private static final Comparator<ContributionDelta> BY_IMPACT_THEN_NAME =
            Comparator.comparingDouble((ContributionDelta contribution) -> Math.abs(contribution.delta()))
                    .reversed()
                    .thenComparing(ContributionDelta::name);

    private final double newContributorSentinel;

    @Autowired
    public RootCauseAnalyzer(CostGuardProperties properties) {
        this(properties.detection().newContributorDeltaPercentSentinel());
    }

    RootCauseAnalyzer(double newContributorSentinel) {
        this.newContributorSentinel = newContributorSentinel;
    }

    public RootCause analyze(AnomalyRecord anomaly, Optional<Map<String, Double>> previous) {
        Map<String, Double> current = anomaly.contributors();
        Map<String, Double> prior = previous.orElse(Map.of());
        TreeSet<String> names = new TreeSet<>(current.keySet());
        names.addAll(prior.keySet());

        List<ContributionDelta> contributions = names.stream()
                .map(name -> delta(name, current.getOrDefault(name, 0d), prior.getOrDefault(name, 0d)))
                .sorted(BY_IMPACT_THEN_NAME)
                .toList();

        if (previous.isEmpty()) {
            return RootCause.degraded(contributions, PREVIOUS_DAY_UNAVAILABLE);
        }
        return RootCause.complete(contributions);
    }

    private ContributionDelta delta(String name, double current, double previous) {
        double delta = current - previous;
        double percent;
        if (previous > 0) {
            percent = delta / previous * 100;
        } else if (current > 0) {
            percent = newContributorSentinel;
        } else {
            percent = 0d;
        }
        return new ContributionDelta(name, current, previous, delta, percent);
    }
}
