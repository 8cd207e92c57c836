package com.callexchange.fraud.risk.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;
import java.util.Map;

/**
 * Live fraud configuration. Immutable: operators replace the whole object, never single fields.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FraudRules {

    public static final String CALL_PLACEMENT = "call_placement";
    public static final String BID_PLACEMENT = "bid_placement";

    /** Applies to actions these rules do not mention. */
    public static final VelocityLimit FALLBACK_VELOCITY_LIMIT = VelocityLimit.builder()
            .action("*")
            .maxCount(100)
            .window(Duration.ofHours(1))
            .build();

    String version;
    Map<String, VelocityLimit> velocityLimits;
    /** Informational tier labels (low/medium/high/critical); not used by the decision itself. */
    Map<String, Double> riskThresholds;
    boolean mlEnabled;
    boolean rulesEnabled;
    double requireMfaScore;
    double autoBlockScore;

    /**
     * Limit for {@code action} under these rules, or {@link #FALLBACK_VELOCITY_LIMIT} when the action is
     * missing or its limit is unusable.
     */
    public VelocityLimit velocityLimitFor(String action) {
        VelocityLimit limit = velocityLimits != null ? velocityLimits.get(action) : null;
        if (limit == null || limit.getWindow() == null || limit.getMaxCount() <= 0) {
            return FALLBACK_VELOCITY_LIMIT;
        }
        return limit;
    }

    public static FraudRules defaults() {
        return FraudRules.builder()
                .version("default")
                .velocityLimits(Map.of(
                        CALL_PLACEMENT, VelocityLimit.builder()
                                .action(CALL_PLACEMENT).maxCount(100).window(Duration.ofHours(1)).build(),
                        BID_PLACEMENT, VelocityLimit.builder()
                                .action(BID_PLACEMENT).maxCount(200).window(Duration.ofHours(1)).build()))
                .riskThresholds(Map.of("low", 0.3, "medium", 0.6, "high", 0.8, "critical", 0.95))
                .mlEnabled(true)
                .rulesEnabled(true)
                .requireMfaScore(0.7)
                .autoBlockScore(0.9)
                .build();
    }
}
