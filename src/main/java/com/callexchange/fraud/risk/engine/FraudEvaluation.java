package com.callexchange.fraud.risk.engine;

import com.callexchange.fraud.risk.domain.EntityKind;
import com.callexchange.fraud.risk.domain.FraudCheckResult;
import com.callexchange.fraud.risk.domain.FraudFlag;
import com.callexchange.fraud.risk.domain.FraudSeverity;
import com.callexchange.fraud.risk.domain.FraudSignalType;
import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Mutable state of a single evaluation. Lives on one thread for the duration of one check and is
 * frozen into a {@link FraudCheckResult} at the end.
 */
@Getter
class FraudEvaluation {

    private final String id = UUID.randomUUID().toString();
    private final String entityId;
    private final EntityKind kind;
    private final Instant timestamp;
    private final List<String> reasons = new ArrayList<>();
    private final List<FraudFlag> flags = new ArrayList<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private final List<String> signalsConsulted = new ArrayList<>();
    private final long startedNanos = System.nanoTime();

    private double riskScore;
    private double confidence;
    private boolean approved = true;
    private boolean requiresMfa;
    private boolean requiresReview;

    FraudEvaluation(String entityId, EntityKind kind, Instant timestamp) {
        this.entityId = entityId;
        this.kind = kind;
        this.timestamp = timestamp;
    }

    /** Raises the aggregate to at least {@code score}; the aggregate never decreases. */
    void raise(double score) {
        riskScore = Math.max(riskScore, clamp(score));
    }

    void flag(FraudSignalType type, FraudSeverity severity, String description, double score,
              Map<String, Object> evidence) {
        double bounded = clamp(score);
        flags.add(FraudFlag.builder()
                .type(type)
                .severity(severity)
                .description(description)
                .score(bounded)
                .evidence(evidence)
                .build());
        raise(bounded);
    }

    void flag(FraudSignalType type, FraudSeverity severity, String description, double score) {
        flag(type, severity, description, score, null);
    }

    void reason(String reason) {
        reasons.add(reason);
    }

    void consulted(String signal) {
        signalsConsulted.add(signal);
    }

    void confidence(double confidence) {
        this.confidence = clamp(confidence);
    }

    void decide(boolean approved, boolean requiresMfa, boolean requiresReview) {
        this.approved = approved;
        this.requiresMfa = requiresMfa;
        this.requiresReview = requiresReview;
    }

    FraudCheckResult toResult() {
        Map<String, Object> meta = new LinkedHashMap<>(metadata);
        meta.put("signalsConsulted", List.copyOf(signalsConsulted));
        meta.put("processingTimeMicros", (System.nanoTime() - startedNanos) / 1_000);
        return FraudCheckResult.builder()
                .id(id)
                .entityId(entityId)
                .entityKind(kind)
                .timestamp(timestamp)
                .approved(approved)
                .riskScore(riskScore)
                .confidence(confidence)
                .reasons(List.copyOf(reasons))
                .flags(List.copyOf(flags))
                .requiresMfa(requiresMfa)
                .requiresReview(requiresReview)
                .metadata(Collections.unmodifiableMap(meta))
                .build();
    }

    static double clamp(double score) {
        if (Double.isNaN(score)) {
            return 0.0;
        }
        return Math.max(0.0, Math.min(1.0, score));
    }
}
