package com.callexchange.fraud.risk.engine;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Short-lived copy of the last known smoothed score per entity. Never the authority: an expired or
 * missing entry means "ask the profile store". Guarded by its own lock, independent of the rules lock.
 */
@Slf4j
public class RiskScoreCache {

    private final Map<String, CachedScore> scores = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final Duration ttl;
    private final int maxEntries;
    private final Clock clock;

    public RiskScoreCache(Duration ttl, int maxEntries, Clock clock) {
        this.ttl = ttl;
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * @return the cached score when it was stored less than the TTL ago
     */
    public Optional<Double> getIfFresh(String entityId) {
        Instant now = clock.instant();
        lock.readLock().lock();
        try {
            CachedScore cached = scores.get(entityId);
            if (cached != null && cached.isFresh(now, ttl)) {
                return Optional.of(cached.score);
            }
            return Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    public void put(String entityId, double score) {
        Instant now = clock.instant();
        lock.writeLock().lock();
        try {
            if (scores.size() >= maxEntries && !scores.containsKey(entityId)) {
                evictExpired(now);
            }
            scores.put(entityId, new CachedScore(score, now));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return scores.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    // Caller holds the write lock.
    private void evictExpired(Instant now) {
        int before = scores.size();
        scores.values().removeIf(cached -> !cached.isFresh(now, ttl));
        if (scores.size() >= maxEntries) {
            // Still full of fresh entries; start over rather than grow without bound.
            scores.clear();
        }
        log.debug("Risk score cache eviction: {} -> {} entries", before, scores.size());
    }

    private static final class CachedScore {
        private final double score;
        private final Instant storedAt;

        private CachedScore(double score, Instant storedAt) {
            this.score = score;
            this.storedAt = storedAt;
        }

        private boolean isFresh(Instant now, Duration ttl) {
            return Duration.between(storedAt, now).compareTo(ttl) < 0;
        }
    }
}
