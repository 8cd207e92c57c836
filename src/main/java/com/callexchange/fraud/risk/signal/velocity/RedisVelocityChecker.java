package com.callexchange.fraud.risk.signal.velocity;

import com.callexchange.fraud.risk.domain.VelocityLimit;
import com.callexchange.fraud.risk.signal.VelocityChecker;
import com.callexchange.fraud.risk.signal.VelocityResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ZSetOperations;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;

/**
 * Sliding-window action counters shared across engine instances through Redis sorted sets
 * (member = unique action id, score = epoch millis).
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "fraud.velocity.store", havingValue = "redis")
public class RedisVelocityChecker implements VelocityChecker {

    static final String KEY_PREFIX = "fraud:velocity:";

    private final StringRedisTemplate redisTemplate;
    private final Clock clock;

    @Override
    public VelocityResult check(String entityId, String action, VelocityLimit limit) {
        String key = key(entityId, action);
        long now = clock.millis();
        ZSetOperations<String, String> zset = redisTemplate.opsForZSet();
        zset.removeRangeByScore(key, 0, now - limit.getWindow().toMillis() - 1);
        Long count = zset.zCard(key);
        log.debug("Velocity {} for {}: {} in {}", action, entityId, count, limit.getWindow());
        return VelocityLimits.result(count != null ? count.intValue() : 0, limit);
    }

    @Override
    public void record(String entityId, String action, VelocityLimit limit) {
        String key = key(entityId, action);
        long now = clock.millis();
        redisTemplate.opsForZSet().add(key, now + ":" + UUID.randomUUID(), now);
        redisTemplate.expire(key, limit.getWindow());
    }

    static String key(String entityId, String action) {
        return KEY_PREFIX + action + ":" + entityId;
    }
}
