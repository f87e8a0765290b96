package com.costguard.anomaly.analytics;

import com.costguard.anomaly.config.CostGuardProperties;
import com.costguard.anomaly.model.Baseline;
import java.util.List;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

@Component
public class BaselineEstimator {

    private final double madFloorEpsilon;

    @Autowired
    public BaselineEstimator(CostGuardProperties properties) {
        this(properties.detection().madFloorEpsilon());
    }

    BaselineEstimator(double madFloorEpsilon) {
        if (!(madFloorEpsilon > 0)) {
            throw new IllegalArgumentException("madFloorEpsilon must be positive");
        }
        this.madFloorEpsilon = madFloorEpsilon;
    }

    public Baseline estimate(List<Double> costs) {
        if (costs == null || costs.isEmpty()) {
            throw new InvalidCostWindowException("cannot estimate a baseline from an empty window");
        }
        double median = median(costs);
        List<Double> deviations = costs.stream()
                .map(cost -> Math.abs(cost - median))
                .toList();
        double mad = median(deviations);
        if (mad == 0d) {
            mad = madFloorEpsilon;
        }
        return new Baseline(median, mad);
    }

    static double median(List<Double> values) {
        List<Double> sorted = values.stream().sorted().toList();
        int n = sorted.size();
        if (n % 2 == 1) {
            return sorted.get(n / 2);
        }
        return (sorted.get(n / 2 - 1) + sorted.get(n / 2)) / 2;
    }

    double madFloorEpsilon() {
        return madFloorEpsilon;
    }
}
