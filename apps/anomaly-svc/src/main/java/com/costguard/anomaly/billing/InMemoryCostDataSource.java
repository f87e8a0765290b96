package com.costguard.anomaly.billing;

import com.costguard.anomaly.model.CostObservation;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

public class InMemoryCostDataSource implements CostDataSource {

    private final Map<LocalDate, CostObservation> storage = new ConcurrentHashMap<>();

    public CostObservation save(CostObservation observation) {
        storage.put(observation.date(), observation);
        return observation;
    }

    public void saveAll(List<CostObservation> observations) {
        observations.forEach(this::save);
    }

    @Override
    public List<CostObservation> fetchDailyCosts(LocalDate startInclusive, LocalDate endExclusive) {
        return storage.values().stream()
                .filter(observation -> !observation.date().isBefore(startInclusive) && observation.date().isBefore(endExclusive))
                .sorted(Comparator.comparing(CostObservation::date))
                .toList();
    }

    @Override
    public Optional<Map<String, Double>> fetchContributors(LocalDate date) {
        return Optional.ofNullable(storage.get(date))
                .filter(CostObservation::hasBreakdown)
                .map(CostObservation::contributors);
    }
}
