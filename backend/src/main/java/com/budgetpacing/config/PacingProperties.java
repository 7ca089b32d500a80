package com.budgetpacing.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.math.BigDecimal;
import java.time.Duration;
import java.time.ZoneId;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Pacing engine configuration. Every evaluation reads its thresholds, strategy parameters and
 * step cap from here instead of from flags spread across the services.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app.pacing")
public class PacingProperties {

    @Valid private Monitoring monitoring = new Monitoring();
    @Valid private Policy policy = new Policy();
    @Valid private Approval approval = new Approval();
    @Valid private Commit commit = new Commit();
    @Valid private Alerts alerts = new Alerts();
    @Valid private Outbox outbox = new Outbox();
    @Valid private Endpoint platform = new Endpoint("http://localhost:8081");
    @Valid private Endpoint registry = new Endpoint("http://localhost:8082");
    @Valid private Endpoint spendFeed = new Endpoint("http://localhost:8083");

    @Data
    public static class Monitoring {
        private boolean enabled = true;

        /** Monitoring cycle length */
        @NotNull private Duration interval = Duration.ofHours(2);

        @NotNull private Duration initialDelay = Duration.ofMinutes(1);

        @NotNull private ZoneId zone = ZoneId.of("UTC");

        /** Upper bound for one campaign evaluation, used for the lease TTL and fan-out timeout */
        @NotNull private Duration maxEvaluationDuration = Duration.ofMinutes(10);

        @NotNull private Duration leaseSafetyMargin = Duration.ofMinutes(2);

        @Min(1)
        private int workerThreads = 8;

        /** Width of the timestamp bucket used to deduplicate spend snapshots */
        @NotNull private Duration snapshotBucket = Duration.ofHours(1);

        /** A latest snapshot older than this is stale */
        @NotNull private Duration maxSnapshotAge = Duration.ofHours(2);

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double minSourceConfidence = 0.5;

        private String rolloverCron = "0 5 0 1 * *";

        public Duration leaseTtl() {
            return maxEvaluationDuration.plus(leaseSafetyMargin);
        }
    }

    @Data
    public static class Policy {
        private double lowerBand = 0.85;
        private double upperBand = 1.15;
        private double emergencyRatio = 1.5;

        /** Maximum fractional change of the daily budget per cycle */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double stepCap = 0.30;

        @NotNull private BigDecimal absoluteApprovalThreshold = new BigDecimal("500.00");

        private double baselineDeviationThreshold = 0.50;

        @DecimalMin("0.000001")
        private double ratioEpsilon = 0.01;

        /** Number of cycles, current one included, smoothed by the adaptive strategy */
        @Min(1)
        private int adaptiveWindow = 4;

        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double adaptiveSmoothing = 0.5;

        /** How far the front-loaded strategy lowers the band floor in the first third */
        @DecimalMin("0.0")
        private double frontLoadedTolerance = 0.15;
    }

    @Data
    public static class Approval {
        @NotNull private Duration expiry = Duration.ofHours(24);
        @NotNull private Duration expiryCheckInterval = Duration.ofMinutes(5);
    }

    @Data
    public static class Commit {
        @Min(1)
        private int maxAttempts = 3;

        @NotNull private Duration initialBackoff = Duration.ofSeconds(2);

        @DecimalMin("1.0")
        private double backoffMultiplier = 2.0;

        @NotNull private Duration callTimeout = Duration.ofSeconds(30);

        /** Tries at recording an applied change when the pacing state keeps changing under it */
        @Min(1)
        private int stateUpdateAttempts = 3;
    }

    @Data
    public static class Alerts {
        @Min(1)
        private int zeroSpendHours = 6;

        @Min(1)
        private int outOfBandCycles = 3;

        private double overspendWarning = 0.95;
        private double underspendWarning = 0.70;

        private Slack slack = new Slack();

        @Data
        public static class Slack {
            private boolean enabled = false;
            private String webhookUrl = "";
        }
    }

    @Data
    public static class Outbox {
        @Min(1)
        private int batchSize = 100;

        @Min(1)
        private int maxRetries = 5;

        @NotNull private Duration relayInterval = Duration.ofSeconds(5);

        @Min(1)
        private int retentionDays = 7;
    }

    @Data
    public static class Endpoint {
        @NotBlank private String baseUrl;

        public Endpoint() {}

        public Endpoint(String baseUrl) {
            this.baseUrl = baseUrl;
        }
    }
}
