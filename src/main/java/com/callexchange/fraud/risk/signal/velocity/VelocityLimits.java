package com.callexchange.fraud.risk.signal.velocity;

import com.callexchange.fraud.risk.domain.VelocityLimit;
import com.callexchange.fraud.risk.signal.VelocityResult;

final class VelocityLimits {

    private VelocityLimits() {
    }

    /** {@code count} excludes the action being checked: with {@code maxCount} prior actions the next one fails. */
    static VelocityResult result(int count, VelocityLimit limit) {
        return VelocityResult.builder()
                .passed(count < limit.getMaxCount())
                .count(count)
                .limit(limit.getMaxCount())
                .window(limit.getWindow())
                .build();
    }
}
