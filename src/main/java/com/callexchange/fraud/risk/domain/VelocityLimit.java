package com.callexchange.fraud.risk.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Duration;

/**
 * Maximum number of times an action may be performed by one entity inside a sliding window.
 */
@Value
@Builder
@Jacksonized
public class VelocityLimit {

    String action;
    int maxCount;
    Duration window;
}
