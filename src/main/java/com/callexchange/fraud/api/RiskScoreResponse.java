package com.callexchange.fraud.api;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class RiskScoreResponse {

    String entityId;
    String entityKind;
    double riskScore;
}
