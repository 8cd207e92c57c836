package com.callexchange.fraud.persistence.service;

import com.callexchange.fraud.persistence.entity.RiskProfileEntity;
import com.callexchange.fraud.persistence.entity.RiskScoreEntryEmbeddable;
import com.callexchange.fraud.persistence.repository.RiskProfileRepository;
import com.callexchange.fraud.risk.domain.RiskProfile;
import com.callexchange.fraud.risk.domain.RiskScoreEntry;
import com.callexchange.fraud.risk.store.RiskProfileStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Optional;

/**
 * Risk profiles in PostgreSQL. A save replaces the whole row, history included (last write wins).
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaRiskProfileStore implements RiskProfileStore {

    private final RiskProfileRepository repository;

    @Override
    @Transactional(readOnly = true)
    public Optional<RiskProfile> load(String entityId) {
        return repository.findById(entityId).map(JpaRiskProfileStore::toDomain);
    }

    @Override
    @Transactional
    public void save(RiskProfile profile) {
        RiskProfileEntity entity = repository.findById(profile.getEntityId())
                .orElseGet(() -> RiskProfileEntity.builder().entityId(profile.getEntityId()).build());
        entity.setEntityKind(profile.getEntityKind());
        entity.setCurrentRiskScore(profile.getCurrentRiskScore());
        entity.setFraudCount(profile.getFraudCount());
        entity.setLastCheckTime(profile.getLastCheckTime());
        entity.getHistory().clear();
        if (profile.getHistory() != null) {
            for (RiskScoreEntry e : profile.getHistory()) {
                entity.getHistory().add(new RiskScoreEntryEmbeddable(e.getScore(), e.getTimestamp(), e.getReason()));
            }
        }
        entity.setAttributes(profile.getAttributes() != null ? new HashMap<>(profile.getAttributes()) : new HashMap<>());
        repository.save(entity);
        log.debug("Saved risk profile: entityId={}, score={}, historySize={}",
                entity.getEntityId(), entity.getCurrentRiskScore(), entity.getHistory().size());
    }

    static RiskProfile toDomain(RiskProfileEntity entity) {
        List<RiskScoreEntry> history = new ArrayList<>();
        for (RiskScoreEntryEmbeddable e : entity.getHistory()) {
            history.add(RiskScoreEntry.builder()
                    .score(e.getScore())
                    .timestamp(e.getRecordedAt())
                    .reason(e.getReason())
                    .build());
        }
        return RiskProfile.builder()
                .entityId(entity.getEntityId())
                .entityKind(entity.getEntityKind())
                .currentRiskScore(entity.getCurrentRiskScore())
                .history(history)
                .fraudCount(entity.getFraudCount())
                .lastCheckTime(entity.getLastCheckTime())
                .attributes(new HashMap<>(entity.getAttributes()))
                .build();
    }
}
