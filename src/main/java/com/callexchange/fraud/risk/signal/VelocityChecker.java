package com.callexchange.fraud.risk.signal;

import com.callexchange.fraud.risk.domain.VelocityLimit;

/**
 * Rate counters per entity and action. {@link #check} never records; callers record explicitly.
 * The limit is supplied by the caller from the rules snapshot of the evaluation in progress.
 */
public interface VelocityChecker {

    VelocityResult check(String entityId, String action, VelocityLimit limit);

    void record(String entityId, String action, VelocityLimit limit);
}
