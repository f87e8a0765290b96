package com.costguard.anomaly.billing;

import com.costguard.anomaly.model.CostObservation;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public interface CostDataSource {

    /**
     * Daily observations in {@code [startInclusive, endExclusive)}, ordered by date.
     *
     * @throws CostDataUnavailableException when the billing backend cannot be reached
     */
    List<CostObservation> fetchDailyCosts(LocalDate startInclusive, LocalDate endExclusive);

    /**
     * Per-contributor costs for a single day. Empty when the backend has no record for that day, or has a
     * positive total for it but no breakdown.
     *
     * @throws CostDataUnavailableException on transient backend failures; callers may retry
     */
    Optional<Map<String, Double>> fetchContributors(LocalDate date);
}
