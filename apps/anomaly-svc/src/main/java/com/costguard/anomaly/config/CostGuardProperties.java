package com.costguard.anomaly.config;

import com.costguard.anomaly.model.AnomalyRecord;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;

@ConfigurationProperties(prefix = "costguard")
public record CostGuardProperties(
        Detection detection,
        Lookup lookup,
        Billing billing,
        Storage storage,
        Notification notification,
        Schedule schedule
) {

    @ConstructorBinding
    public CostGuardProperties {
        // every section is optional; missing ones fall back to their documented defaults
        if (detection == null) {
            detection = Detection.defaults();
        }
        if (lookup == null) {
            lookup = Lookup.defaults();
        }
        if (billing == null) {
            billing = new Billing(null, null, null, null, null);
        }
        if (storage == null) {
            storage = new Storage(null, null, null);
        }
        if (notification == null) {
            notification = new Notification(null, null, null, null, null);
        }
        if (schedule == null) {
            schedule = new Schedule(null, null);
        }
    }

    public static CostGuardProperties defaults() {
        return new CostGuardProperties(null, null, null, null, null, null);
    }

    public record Detection(
            Double threshold,
            Double severityMultiplier,
            Double madFloorEpsilon,
            Integer windowLengthDays,
            Double newContributorDeltaPercentSentinel,
            Integer minObservations
    ) {
        public static final double DEFAULT_THRESHOLD = 3.0d;
        public static final double DEFAULT_SEVERITY_MULTIPLIER = 1.5d;
        public static final double DEFAULT_MAD_FLOOR_EPSILON = 0.01d;
        public static final int DEFAULT_WINDOW_LENGTH_DAYS = 30;
        public static final double DEFAULT_NEW_CONTRIBUTOR_SENTINEL = 100d;
        public static final int DEFAULT_MIN_OBSERVATIONS = 7;

        public Detection {
            if (threshold == null) threshold = DEFAULT_THRESHOLD;
            if (severityMultiplier == null) severityMultiplier = DEFAULT_SEVERITY_MULTIPLIER;
            if (madFloorEpsilon == null) madFloorEpsilon = DEFAULT_MAD_FLOOR_EPSILON;
            if (windowLengthDays == null) windowLengthDays = DEFAULT_WINDOW_LENGTH_DAYS;
            if (newContributorDeltaPercentSentinel == null) newContributorDeltaPercentSentinel = DEFAULT_NEW_CONTRIBUTOR_SENTINEL;
            if (minObservations == null) minObservations = DEFAULT_MIN_OBSERVATIONS;
            if (!(threshold > 0) || threshold.isInfinite()) {
                throw new IllegalArgumentException("threshold must be positive");
            }
            if (!(severityMultiplier >= 1)) {
                throw new IllegalArgumentException("severityMultiplier must be at least 1");
            }
            if (!(madFloorEpsilon > 0)) {
                throw new IllegalArgumentException("madFloorEpsilon must be positive");
            }
            if (windowLengthDays <= 0) {
                throw new IllegalArgumentException("windowLengthDays must be positive");
            }
            if (newContributorDeltaPercentSentinel.isNaN() || newContributorDeltaPercentSentinel.isInfinite()) {
                throw new IllegalArgumentException("newContributorDeltaPercentSentinel must be finite");
            }
            if (minObservations <= 0) {
                throw new IllegalArgumentException("minObservations must be positive");
            }
        }

        public static Detection defaults() {
            return new Detection(null, null, null, null, null, null);
        }
    }

    public record Lookup(Integer maxAttempts, Duration initialBackoff, Double backoffMultiplier, Boolean parallel) {
        public Lookup {
            if (maxAttempts == null) maxAttempts = 3;
            if (initialBackoff == null) initialBackoff = Duration.ofMillis(200);
            if (backoffMultiplier == null) backoffMultiplier = 2.0d;
            if (parallel == null) parallel = false;
            if (maxAttempts <= 0) {
                throw new IllegalArgumentException("maxAttempts must be positive");
            }
            if (initialBackoff.isNegative()) {
                throw new IllegalArgumentException("initialBackoff must not be negative");
            }
            if (!(backoffMultiplier >= 1)) {
                throw new IllegalArgumentException("backoffMultiplier must be at least 1");
            }
        }

        public static Lookup defaults() {
            return new Lookup(null, null, null, null);
        }
    }

    /**
     * {@code metric} and {@code groupBy} apply to Cost Explorer; {@code currency} selects the CloudWatch
     * {@code EstimatedCharges} series.
     */
    public record Billing(String provider, String region, String metric, String groupBy, String currency) {
        public static final String PROVIDER_IN_MEMORY = "in-memory";
        public static final String PROVIDER_COST_EXPLORER = "cost-explorer";
        public static final String PROVIDER_CLOUDWATCH = "cloudwatch";

        public Billing {
            if (provider == null || provider.isBlank()) provider = PROVIDER_IN_MEMORY;
            if (region == null || region.isBlank()) region = "us-east-1";
            if (metric == null || metric.isBlank()) metric = "UnblendedCost";
            if (groupBy == null || groupBy.isBlank()) groupBy = "SERVICE";
            if (currency == null || currency.isBlank()) currency = "USD";
            provider = provider.toLowerCase();
            if (!provider.equals(PROVIDER_IN_MEMORY) && !provider.equals(PROVIDER_COST_EXPLORER)
                    && !provider.equals(PROVIDER_CLOUDWATCH)) {
                throw new IllegalArgumentException("provider must be one of in-memory, cost-explorer, cloudwatch");
            }
        }
    }

    public record Storage(String bucket, String prefix, String region) {
        public Storage {
            if (prefix == null || prefix.isBlank()) prefix = "cost-anomaly-reports";
            if (region == null || region.isBlank()) region = "us-east-1";
        }

        public boolean hasBucket() {
            return bucket != null && !bucket.isBlank();
        }
    }

    /**
     * {@code topContributors} caps the contributor lines in an alert; 0 lists every contributor.
     */
    public record Notification(
            String snsTopicArn,
            String webhookUrl,
            AnomalyRecord.Severity minSeverity,
            String region,
            Integer topContributors
    ) {
        public static final int DEFAULT_TOP_CONTRIBUTORS = 10;

        public Notification {
            if (minSeverity == null) minSeverity = AnomalyRecord.Severity.WARNING;
            if (region == null || region.isBlank()) region = "us-east-1";
            if (topContributors == null) topContributors = DEFAULT_TOP_CONTRIBUTORS;
            if (topContributors < 0) {
                throw new IllegalArgumentException("topContributors must not be negative");
            }
        }

        public boolean hasWebhook() {
            return webhookUrl != null && !webhookUrl.isBlank();
        }
    }

    public record Schedule(Boolean enabled, String cron) {
        public Schedule {
            if (enabled == null) enabled = false;
            if (cron == null || cron.isBlank()) cron = "0 0 6 * * *";
        }
    }
}
