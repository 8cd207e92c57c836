package com.callexchange.fraud.risk.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * One triggered signal inside a {@link FraudCheckResult}.
 */
@Value
@Builder
@Jacksonized
public class FraudFlag {

    FraudSignalType type;
    FraudSeverity severity;
    String description;
    /** 0.0–1.0 contribution of this signal. */
    double score;
    /** Optional supporting data (feature weights, matched values). */
    Map<String, Object> evidence;
}
