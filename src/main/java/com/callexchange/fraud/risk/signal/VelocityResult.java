package com.callexchange.fraud.risk.signal;

import lombok.Builder;
import lombok.Value;

import java.time.Duration;

@Value
@Builder
public class VelocityResult {

    boolean passed;
    /** Actions observed inside the window. */
    int count;
    int limit;
    Duration window;
}
