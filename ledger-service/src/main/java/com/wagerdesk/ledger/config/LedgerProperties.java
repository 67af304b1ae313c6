package com.wagerdesk.ledger.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Ledger job cadence and analysis thresholds.
 *
 * <pre>
 * ledger:
 *   settlement:
 *     enabled: true
 *     initial-delay: 30s
 *     interval: 15m
 *     batch-size: 200
 *   analysis:
 *     enabled: true
 *     initial-delay: 2m
 *     interval: 6h
 *   loss-analysis-confidence: 0.70
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "ledger")
public record LedgerProperties(
    @Valid Settlement settlement,
    @Valid Analysis analysis,
    @DecimalMin("0.0") @DecimalMax("1.0") Double lossAnalysisConfidence
) {
    public LedgerProperties {
        if (settlement == null) settlement = new Settlement(null, null, null, null);
        if (analysis == null) analysis = new Analysis(null, null, null);
        if (lossAnalysisConfidence == null) lossAnalysisConfidence = 0.70;
    }

    public record Settlement(
        Boolean enabled,
        Duration initialDelay,
        Duration interval,
        @Positive @Max(10_000) Integer batchSize
    ) {
        public Settlement {
            if (enabled == null) enabled = true;
            if (initialDelay == null) initialDelay = Duration.ofSeconds(30);
            if (interval == null) interval = Duration.ofMinutes(15);
            if (batchSize == null) batchSize = 200;
        }
    }

    public record Analysis(
        Boolean enabled,
        Duration initialDelay,
        Duration interval
    ) {
        public Analysis {
            if (enabled == null) enabled = true;
            if (initialDelay == null) initialDelay = Duration.ofMinutes(2);
            if (interval == null) interval = Duration.ofHours(6);
        }
    }
}
