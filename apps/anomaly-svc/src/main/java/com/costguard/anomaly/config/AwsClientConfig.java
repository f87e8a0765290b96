package com.costguard.anomaly.config;

import com.costguard.anomaly.billing.CloudWatchBillingCostDataSource;
import com.costguard.anomaly.billing.CostDataSource;
import com.costguard.anomaly.billing.CostExplorerCostDataSource;
import com.costguard.anomaly.billing.InMemoryCostDataSource;
import com.costguard.anomaly.notification.SnsAnomalyNotifier;
import com.costguard.anomaly.report.AnomalyReportRepository;
import com.costguard.anomaly.report.InMemoryAnomalyReportRepository;
import com.costguard.anomaly.report.S3AnomalyReportRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.cloudwatch.CloudWatchClient;
import software.amazon.awssdk.services.costexplorer.CostExplorerClient;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.sns.SnsClient;

/**
 * Chooses the billing, storage and SNS collaborators. AWS clients are only built when their feature is
 * configured; otherwise in-memory implementations are used.
 */
@Configuration
public class AwsClientConfig {

    private static final Logger log = LoggerFactory.getLogger(AwsClientConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "costguard.billing", name = "provider", havingValue = "cost-explorer")
    public CostDataSource costExplorerCostDataSource(CostGuardProperties properties) {
        CostGuardProperties.Billing billing = properties.billing();
        log.info("Billing data source: AWS Cost Explorer region={} metric={} groupBy={}",
                billing.region(), billing.metric(), billing.groupBy());
        CostExplorerClient client = CostExplorerClient.builder()
                .region(Region.of(billing.region()))
                .build();
        return new CostExplorerCostDataSource(client, billing);
    }

    @Bean
    @ConditionalOnProperty(prefix = "costguard.billing", name = "provider", havingValue = "cloudwatch")
    public CostDataSource cloudWatchBillingCostDataSource(CostGuardProperties properties) {
        CostGuardProperties.Billing billing = properties.billing();
        log.info("Billing data source: CloudWatch EstimatedCharges region={} currency={} (no per-service breakdown)",
                billing.region(), billing.currency());
        CloudWatchClient client = CloudWatchClient.builder()
                .region(Region.of(billing.region()))
                .build();
        return new CloudWatchBillingCostDataSource(client, billing.currency());
    }

    @Bean
    @ConditionalOnMissingBean(CostDataSource.class)
    public CostDataSource inMemoryCostDataSource() {
        log.warn("Billing data source: in-memory (set costguard.billing.provider to cost-explorer or cloudwatch for AWS billing data)");
        return new InMemoryCostDataSource();
    }

    @Bean
    @ConditionalOnProperty(prefix = "costguard.storage", name = "bucket")
    public AnomalyReportRepository s3AnomalyReportRepository(CostGuardProperties properties, ObjectMapper objectMapper) {
        CostGuardProperties.Storage storage = properties.storage();
        log.info("Anomaly report storage: s3://{}/{}", storage.bucket(), storage.prefix());
        S3Client client = S3Client.builder()
                .region(Region.of(storage.region()))
                .build();
        return new S3AnomalyReportRepository(client, objectMapper, storage);
    }

    @Bean
    @ConditionalOnMissingBean(AnomalyReportRepository.class)
    public AnomalyReportRepository inMemoryAnomalyReportRepository() {
        log.info("Anomaly report storage: in-memory");
        return new InMemoryAnomalyReportRepository();
    }

    @Bean
    @ConditionalOnProperty(prefix = "costguard.notification", name = "sns-topic-arn")
    public SnsAnomalyNotifier snsAnomalyNotifier(CostGuardProperties properties) {
        CostGuardProperties.Notification notification = properties.notification();
        SnsClient client = SnsClient.builder()
                .region(Region.of(notification.region()))
                .build();
        return new SnsAnomalyNotifier(client, notification.snsTopicArn());
    }
}
