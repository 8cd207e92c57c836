package com.callexchange.fraud.risk.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one fraud evaluation. Created once per check and never modified after it is returned.
 * {@code riskScore} is the maximum of the individual signal scores, never their sum.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FraudCheckResult {

    String id;
    String entityId;
    EntityKind entityKind;
    Instant timestamp;
    boolean approved;
    /** 0.0–1.0; higher = higher risk. */
    double riskScore;
    /** Classifier confidence; 0 when the classifier was not consulted. */
    double confidence;
    List<String> reasons;
    List<FraudFlag> flags;
    boolean requiresMfa;
    boolean requiresReview;
    Map<String, Object> metadata;
}
