package com.costguard.anomaly.billing;

import com.costguard.anomaly.config.CostGuardProperties;
import com.costguard.anomaly.model.CostObservation;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;
import software.amazon.awssdk.services.costexplorer.model.DateInterval;
import software.amazon.awssdk.services.costexplorer.model.GetCostAndUsageRequest;
import software.amazon.awssdk.services.costexplorer.model.GetCostAndUsageResponse;
import software.amazon.awssdk.services.costexplorer.model.Granularity;
import software.amazon.awssdk.services.costexplorer.model.Group;
import software.amazon.awssdk.services.costexplorer.model.GroupDefinition;
import software.amazon.awssdk.services.costexplorer.model.GroupDefinitionType;
import software.amazon.awssdk.services.costexplorer.model.MetricValue;
import software.amazon.awssdk.services.costexplorer.model.ResultByTime;

/**
 * Reads daily costs from AWS Cost Explorer, grouped by a dimension (SERVICE by default).
 * Each call to {@code GetCostAndUsage} is billed by AWS, so the window is fetched in one paginated request.
 */
public class CostExplorerCostDataSource implements CostDataSource {

    private static final Logger log = LoggerFactory.getLogger(CostExplorerCostDataSource.class);

    private final CostExplorerClient client;
    private final String metric;
    private final String groupBy;

    public CostExplorerCostDataSource(CostExplorerClient client, CostGuardProperties.Billing billing) {
        this.client = client;
        this.metric = billing.metric();
        this.groupBy = billing.groupBy();
    }

    @Override
    public List<CostObservation> fetchDailyCosts(LocalDate startInclusive, LocalDate endExclusive) {
        if (!startInclusive.isBefore(endExclusive)) {
            return List.of();
        }
        log.info("cost_explorer fetch start={} end={} metric={} groupBy={}", startInclusive, endExclusive, metric, groupBy);
        Map<LocalDate, Map<String, Double>> byDay = new TreeMap<>();
        String nextPageToken = null;
        try {
            do {
                GetCostAndUsageResponse response = client.getCostAndUsage(request(startInclusive, endExclusive, nextPageToken));
                for (ResultByTime result : response.resultsByTime()) {
                    LocalDate day = LocalDate.parse(result.timePeriod().start());
                    Map<String, Double> contributors = byDay.computeIfAbsent(day, d -> new LinkedHashMap<>());
                    for (Group group : result.groups()) {
                        contributors.merge(groupName(group), amountOf(group), Double::sum);
                    }
                }
                nextPageToken = response.nextPageToken();
            } while (nextPageToken != null && !nextPageToken.isBlank());
        } catch (SdkException ex) {
            throw new CostDataUnavailableException("Cost Explorer request failed for " + startInclusive + ".." + endExclusive, ex);
        }
        List<CostObservation> observations = byDay.entrySet().stream()
                .map(entry -> new CostObservation(entry.getKey(), totalOf(entry.getValue()), entry.getValue()))
                .toList();
        log.info("cost_explorer fetched days={}", observations.size());
        return observations;
    }

    @Override
    public Optional<Map<String, Double>> fetchContributors(LocalDate date) {
        return fetchDailyCosts(date, date.plusDays(1)).stream()
                .filter(observation -> observation.date().equals(date))
                .findFirst()
                .filter(CostObservation::hasBreakdown)
                .map(CostObservation::contributors);
    }

    private GetCostAndUsageRequest request(LocalDate startInclusive, LocalDate endExclusive, String nextPageToken) {
        return GetCostAndUsageRequest.builder()
                .timePeriod(DateInterval.builder()
                        .start(startInclusive.toString())
                        .end(endExclusive.toString())
                        .build())
                .granularity(Granularity.DAILY)
                .metrics(metric)
                .groupBy(GroupDefinition.builder()
                        .type(GroupDefinitionType.DIMENSION)
                        .key(groupBy)
                        .build())
                .nextPageToken(nextPageToken)
                .build();
    }

    private String groupName(Group group) {
        return group.keys().isEmpty() ? "Unknown" : String.join("/", group.keys());
    }

    private double amountOf(Group group) {
        MetricValue value = group.metrics().get(metric);
        if (value == null || value.amount() == null) {
            return 0d;
        }
        return cents(Math.max(Double.parseDouble(value.amount()), 0d));
    }

    private double totalOf(Map<String, Double> contributors) {
        return cents(contributors.values().stream().mapToDouble(Double::doubleValue).sum());
    }

    private static double cents(double amount) {
        return BigDecimal.valueOf(amount).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
