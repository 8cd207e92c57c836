package com.callexchange.fraud.risk.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;

@Value
@Builder
@Jacksonized
public class RiskScoreEntry {

    double score;
    Instant timestamp;
    String reason;
}
