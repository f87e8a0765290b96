package com.costguard.anomaly.billing;

import com.costguard.anomaly.model.CostObservation;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.Datapoint;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;
import software.amazon.awssdk.services.cloudwatch.model.Statistic;

/**
 * Reads account-wide daily totals from the CloudWatch {@code AWS/Billing EstimatedCharges} metric.
 * The metric is a running month-to-date total, so each day's cost is the difference between consecutive daily
 * maxima, clamped at zero. There is no per-service breakdown: observations are total-only and
 * {@link #fetchContributors(LocalDate)} is always empty.
 *
 * <p>Billing metrics are only published in us-east-1 and require "Receive Billing Alerts" to be enabled.
 */
public class CloudWatchBillingCostDataSource implements CostDataSource {

    private static final Logger log = LoggerFactory.getLogger(CloudWatchBillingCostDataSource.class);

    static final String NAMESPACE = "AWS/Billing";
    static final String METRIC_NAME = "EstimatedCharges";
    private static final int ONE_DAY_SECONDS = (int) Duration.ofDays(1).toSeconds();

    private final CloudWatchClient client;
    private final String currency;

    public CloudWatchBillingCostDataSource(CloudWatchClient client, String currency) {
        this.client = client;
        this.currency = currency;
    }

    @Override
    public List<CostObservation> fetchDailyCosts(LocalDate startInclusive, LocalDate endExclusive) {
        if (!startInclusive.isBefore(endExclusive)) {
            return List.of();
        }
        // one extra leading day so the first day of the window has a cumulative value to subtract
        LocalDate queryStart = startInclusive.minusDays(1);
        log.info("cloudwatch_billing fetch start={} end={} currency={}", startInclusive, endExclusive, currency);
        GetMetricStatisticsResponse response;
        try {
            response = client.getMetricStatistics(GetMetricStatisticsRequest.builder()
                    .namespace(NAMESPACE)
                    .metricName(METRIC_NAME)
                    .dimensions(Dimension.builder().name("Currency").value(currency).build())
                    .startTime(queryStart.atStartOfDay(ZoneOffset.UTC).toInstant())
                    .endTime(endExclusive.atStartOfDay(ZoneOffset.UTC).toInstant())
                    .period(ONE_DAY_SECONDS)
                    .statistics(Statistic.MAXIMUM)
                    .build());
        } catch (SdkException ex) {
            throw new CostDataUnavailableException("CloudWatch billing metrics unavailable for "
                    + startInclusive + ".." + endExclusive, ex);
        }

        List<Datapoint> datapoints = response.datapoints().stream()
                .filter(datapoint -> datapoint.timestamp() != null && datapoint.maximum() != null)
                .sorted(Comparator.comparing(Datapoint::timestamp))
                .toList();
        List<CostObservation> observations = new ArrayList<>();
        Double previousCumulative = null;
        for (Datapoint datapoint : datapoints) {
            LocalDate day = datapoint.timestamp().atZone(ZoneOffset.UTC).toLocalDate();
            double cumulative = datapoint.maximum();
            double daily = previousCumulative == null ? cumulative : cumulative - previousCumulative;
            previousCumulative = cumulative;
            if (day.isBefore(startInclusive) || !day.isBefore(endExclusive)) {
                continue;
            }
            observations.add(CostObservation.totalOnly(day, cents(Math.max(daily, 0d))));
        }
        log.info("cloudwatch_billing fetched datapoints={} days={}", datapoints.size(), observations.size());
        return observations;
    }

    @Override
    public Optional<Map<String, Double>> fetchContributors(LocalDate date) {
        return Optional.empty();
    }

    private static double cents(double amount) {
        return BigDecimal.valueOf(amount).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
