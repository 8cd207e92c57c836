package com.callexchange.fraud.risk.engine;

import com.callexchange.fraud.risk.domain.EntityKind;
import com.callexchange.fraud.risk.domain.RiskProfile;
import com.callexchange.fraud.risk.domain.RiskScoreEntry;
import com.callexchange.fraud.risk.store.RiskProfileStore;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Optional;

/**
 * Keeps each entity's smoothed risk standing: {@code current = α·observed + (1−α)·current}, α = 0.3,
 * with a rolling history of the last 100 observations.
 * <p>
 * Load-modify-save is not serialized per entity; two concurrent updates for the same entity race and
 * the later save wins. Blocking decisions never read the stored profile, so the loss only affects
 * the smoothed signal.
 */
@Slf4j
public class RiskProfileManager {

    static final double ALPHA = 0.3;
    static final int MAX_HISTORY = 100;

    private final RiskProfileStore store;
    private final RiskScoreCache cache;
    private final Clock clock;

    public RiskProfileManager(RiskProfileStore store, RiskScoreCache cache, Clock clock) {
        this.store = store;
        this.cache = cache;
        this.clock = clock;
    }

    /**
     * Smoothed score for the entity: from the cache when fresh, else from the store (refreshing the cache).
     * Empty when no profile exists or the store cannot be reached.
     */
    public Optional<Double> currentScore(String entityId) {
        Optional<Double> cached = cache.getIfFresh(entityId);
        if (cached.isPresent()) {
            return cached;
        }
        if (store == null) {
            return Optional.empty();
        }
        Optional<RiskProfile> profile;
        try {
            profile = store.load(entityId);
        } catch (RuntimeException e) {
            log.warn("Risk profile load failed for entity {}: {}", entityId, e.getMessage());
            return Optional.empty();
        }
        profile.ifPresent(p -> cache.put(entityId, p.getCurrentRiskScore()));
        return profile.map(RiskProfile::getCurrentRiskScore);
    }

    /**
     * Folds a newly observed score into the entity's profile, creating the profile on first sight.
     *
     * @param confirmedFraud also increments the profile's fraud-confirmation count
     * @return the profile as saved, empty when no store is configured
     */
    public Optional<RiskProfile> update(String entityId, EntityKind kind, double observedScore,
                                        String reason, boolean confirmedFraud) {
        if (store == null) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        RiskProfile profile = loadOrCreate(entityId, kind, observedScore);

        profile.setCurrentRiskScore(ALPHA * observedScore + (1 - ALPHA) * profile.getCurrentRiskScore());
        profile.appendHistory(RiskScoreEntry.builder()
                .score(observedScore)
                .timestamp(now)
                .reason(reason)
                .build(), MAX_HISTORY);
        if (confirmedFraud) {
            profile.setFraudCount(profile.getFraudCount() + 1);
        }
        profile.setLastCheckTime(now);

        try {
            store.save(profile);
        } catch (RuntimeException e) {
            log.error("Risk profile save failed for entity {}", entityId, e);
        }
        cache.put(entityId, profile.getCurrentRiskScore());
        log.debug("Risk profile {} updated: observed={}, smoothed={}, history={}",
                entityId, observedScore, profile.getCurrentRiskScore(), profile.getHistory().size());
        return Optional.of(profile);
    }

    private RiskProfile loadOrCreate(String entityId, EntityKind kind, double seedScore) {
        try {
            Optional<RiskProfile> existing = store.load(entityId);
            if (existing.isPresent()) {
                return existing.get();
            }
        } catch (RuntimeException e) {
            log.warn("Risk profile load failed for entity {}, starting a fresh profile: {}", entityId, e.getMessage());
        }
        return RiskProfile.builder()
                .entityId(entityId)
                .entityKind(kind)
                .currentRiskScore(seedScore)
                .history(new ArrayList<>())
                .attributes(new HashMap<>())
                .build();
    }
}
