package com.meisai.mapping.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Tuning of the match engine and of automatic proposals, bound from {@code meisai.matching.*}.
 */
@Data
@ConfigurationProperties(prefix = "meisai.matching")
public class MatchingProperties {

    /** Proposals below this confidence are dropped. */
    private double acceptanceThreshold = 0.6;

    private int timeToleranceMinutes = 30;
    private double timeMaxConfidence = 0.98;
    private double timeMinConfidence = 0.90;

    /** Absolute amount tolerance in yen; 0 disables it. */
    private int amountAbsoluteTolerance = 100;
    /** Amount tolerance in percent of the statement amount; 0 disables it. */
    private double amountPercentTolerance = 0;
    private double amountMaxConfidence = 0.95;
    private double amountMinConfidence = 0.60;

    private double fuzzyMinSimilarity = 0.70;
    private double fuzzyMaxConfidence = 0.90;

    /** Registered candidates within this many days of the record date are considered. */
    private int candidateDateWindowDays = 1;

    private AutoPropose autoPropose = new AutoPropose();

    @Data
    public static class AutoPropose {
        private boolean enabled = false;
        private String createdBy = "auto-proposal";
    }
}
