package com.costguard.anomaly.billing;

import com.costguard.anomaly.config.CostGuardProperties;
import java.time.Duration;
import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Fetches the per-contributor costs of the day before an anomaly with a bounded retry policy.
 * Exhausted retries resolve to empty instead of failing the caller.
 */
@Component
public class PreviousDayCostLookup {

    private static final Logger log = LoggerFactory.getLogger(PreviousDayCostLookup.class);

    private final CostDataSource costDataSource;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final double backoffMultiplier;
    private final Sleeper sleeper;

    @Autowired
    public PreviousDayCostLookup(CostDataSource costDataSource, CostGuardProperties properties) {
        this(costDataSource, properties.lookup(), Thread::sleep);
    }

    PreviousDayCostLookup(CostDataSource costDataSource, CostGuardProperties.Lookup lookup, Sleeper sleeper) {
        this.costDataSource = costDataSource;
        this.maxAttempts = lookup.maxAttempts();
        this.initialBackoff = lookup.initialBackoff();
        this.backoffMultiplier = lookup.backoffMultiplier();
        this.sleeper = sleeper;
    }

    public Optional<Map<String, Double>> fetchPreviousDay(LocalDate anomalyDate) {
        return fetch(anomalyDate.minusDays(1));
    }

    public Optional<Map<String, Double>> fetch(LocalDate date) {
        long backoffMillis = initialBackoff.toMillis();
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                Optional<Map<String, Double>> result = costDataSource.fetchContributors(date);
                if (result.isEmpty()) {
                    log.warn("previous_day_lookup date={} attempts={} result=no_record", date, attempt);
                }
                return result;
            } catch (CostDataUnavailableException ex) {
                if (attempt == maxAttempts) {
                    log.error("previous_day_lookup date={} attempts={} maxAttempts={} result=unavailable errorMessage={}",
                            date, attempt, maxAttempts, ex.getMessage(), ex);
                    return Optional.empty();
                }
                log.warn("previous_day_lookup date={} attempts={} maxAttempts={} retryInMillis={} errorMessage={}",
                        date, attempt, maxAttempts, backoffMillis, ex.getMessage());
                try {
                    sleeper.sleep(backoffMillis);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    log.warn("previous_day_lookup date={} interrupted during backoff; treating as unavailable", date);
                    return Optional.empty();
                }
                backoffMillis = (long) (backoffMillis * backoffMultiplier);
            } catch (RuntimeException ex) {
                log.error("previous_day_lookup date={} attempts={} result=non_retryable errorMessage={}",
                        date, attempt, ex.getMessage(), ex);
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    @FunctionalInterface
    interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }
}
