package com.callexchange.fraud.risk.signal.velocity;

import com.callexchange.fraud.risk.domain.VelocityLimit;
import com.callexchange.fraud.risk.signal.VelocityChecker;
import com.callexchange.fraud.risk.signal.VelocityResult;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sliding-window action counters kept in process memory. Timestamps older than the window of the
 * limit being checked are pruned on read.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fraud.velocity.store", havingValue = "memory", matchIfMissing = true)
public class InMemoryVelocityChecker implements VelocityChecker {

    private final Map<String, CopyOnWriteArrayList<Long>> actions = new ConcurrentHashMap<>();

    private final Clock clock;

    @Override
    public VelocityResult check(String entityId, String action, VelocityLimit limit) {
        long cutoff = clock.millis() - limit.getWindow().toMillis();
        List<Long> timestamps = actions.get(key(entityId, action));
        int count = 0;
        if (timestamps != null) {
            timestamps.removeIf(ts -> ts < cutoff);
            count = timestamps.size();
        }
        return VelocityLimits.result(count, limit);
    }

    @Override
    public void record(String entityId, String action, VelocityLimit limit) {
        actions.computeIfAbsent(key(entityId, action), k -> new CopyOnWriteArrayList<>()).add(clock.millis());
    }

    private static String key(String entityId, String action) {
        return action + ":" + entityId;
    }
}
