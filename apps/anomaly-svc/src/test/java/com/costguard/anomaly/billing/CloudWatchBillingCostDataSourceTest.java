package com.costguard.anomaly.billing;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.costguard.anomaly.model.CostObservation;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.cloudwatch.model.CloudWatchException;
import software.amazon.awssdk.services.cloudwatch.model.Datapoint;
import software.amazon.awssdk.services.cloudwatch.model.Dimension;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsRequest;
import software.amazon.awssdk.services.cloudwatch.model.GetMetricStatisticsResponse;
import software.amazon.awssdk.services.cloudwatch.model.Statistic;

@ExtendWith(MockitoExtension.class)
class CloudWatchBillingCostDataSourceTest {

    @Mock
    private CloudWatchClient client;

    private CloudWatchBillingCostDataSource source;

    @BeforeEach
    void setUp() {
        source = new CloudWatchBillingCostDataSource(client, "USD");
    }

    @Test
    void turnsCumulativeChargesIntoDailyCosts() {
        // returned out of order; the month-to-date total resets on March 1st
        when(client.getMetricStatistics(any(GetMetricStatisticsRequest.class)))
                .thenReturn(GetMetricStatisticsResponse.builder()
                        .datapoints(
                                point("2024-02-29", 1205.5d),
                                point("2024-02-27", 1000d),
                                point("2024-03-02", 190.25d),
                                point("2024-02-28", 1100.004d),
                                point("2024-03-01", 90.25d))
                        .build());

        List<CostObservation> observations = source.fetchDailyCosts(LocalDate.of(2024, 2, 28), LocalDate.of(2024, 3, 3));

        assertThat(observations).extracting(CostObservation::date).containsExactly(
                LocalDate.of(2024, 2, 28), LocalDate.of(2024, 2, 29), LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 2));
        assertThat(observations).extracting(CostObservation::total).containsExactly(100d, 105.5d, 0d, 100d);
        assertThat(observations).allSatisfy(observation -> assertThat(observation.contributors()).isEmpty());
    }

    @Test
    void queriesDailyMaximumOfEstimatedChargesFromTheDayBeforeTheWindow() {
        when(client.getMetricStatistics(any(GetMetricStatisticsRequest.class)))
                .thenReturn(GetMetricStatisticsResponse.builder().build());

        source.fetchDailyCosts(LocalDate.of(2024, 2, 28), LocalDate.of(2024, 3, 3));

        ArgumentCaptor<GetMetricStatisticsRequest> request = ArgumentCaptor.forClass(GetMetricStatisticsRequest.class);
        verify(client).getMetricStatistics(request.capture());
        assertThat(request.getValue().namespace()).isEqualTo("AWS/Billing");
        assertThat(request.getValue().metricName()).isEqualTo("EstimatedCharges");
        assertThat(request.getValue().dimensions())
                .containsExactly(Dimension.builder().name("Currency").value("USD").build());
        assertThat(request.getValue().period()).isEqualTo(86400);
        assertThat(request.getValue().statistics()).containsExactly(Statistic.MAXIMUM);
        assertThat(request.getValue().startTime()).isEqualTo(Instant.parse("2024-02-27T00:00:00Z"));
        assertThat(request.getValue().endTime()).isEqualTo(Instant.parse("2024-03-03T00:00:00Z"));
    }

    @Test
    void firstDatapointWithoutEarlierValueIsTakenAsIs() {
        when(client.getMetricStatistics(any(GetMetricStatisticsRequest.class)))
                .thenReturn(GetMetricStatisticsResponse.builder()
                        .datapoints(point("2024-03-02", 50d), point("2024-03-03", 80d))
                        .build());

        List<CostObservation> observations = source.fetchDailyCosts(LocalDate.of(2024, 3, 2), LocalDate.of(2024, 3, 4));

        assertThat(observations).extracting(CostObservation::total).containsExactly(50d, 30d);
    }

    @Test
    void serviceErrorsSurfaceAsUnavailable() {
        when(client.getMetricStatistics(any(GetMetricStatisticsRequest.class)))
                .thenThrow(CloudWatchException.builder().message("Rate exceeded").statusCode(400).build());

        assertThatThrownBy(() -> source.fetchDailyCosts(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 31)))
                .isInstanceOf(CostDataUnavailableException.class)
                .hasMessageContaining("CloudWatch");
    }

    @Test
    void hasNoPerServiceBreakdown() {
        assertThat(source.fetchContributors(LocalDate.of(2024, 3, 1))).isEmpty();
        assertThat(source.fetchDailyCosts(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 1))).isEmpty();
        verifyNoInteractions(client);
    }

    private static Datapoint point(String day, double maximum) {
        return Datapoint.builder()
                .timestamp(Instant.parse(day + "T00:00:00Z"))
                .maximum(maximum)
                .build();
    }
}
