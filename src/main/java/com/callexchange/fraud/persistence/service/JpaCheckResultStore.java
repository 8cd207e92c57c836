package com.callexchange.fraud.persistence.service;

import com.callexchange.fraud.persistence.entity.FraudCheckResultEntity;
import com.callexchange.fraud.persistence.entity.FraudFlagEmbeddable;
import com.callexchange.fraud.persistence.repository.FraudCheckResultRepository;
import com.callexchange.fraud.risk.domain.FraudCheckResult;
import com.callexchange.fraud.risk.domain.FraudFlag;
import com.callexchange.fraud.risk.store.CheckResultStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Persists fraud decisions to PostgreSQL. Failures propagate; the decision service decides how to degrade.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class JpaCheckResultStore implements CheckResultStore {

    private final FraudCheckResultRepository repository;

    @Override
    @Transactional
    public void save(FraudCheckResult result) {
        FraudCheckResultEntity entity = FraudCheckResultEntity.builder()
                .checkId(result.getId())
                .entityId(result.getEntityId())
                .entityKind(result.getEntityKind())
                .checkedAt(result.getTimestamp())
                .approved(result.isApproved())
                .riskScore(result.getRiskScore())
                .confidence(result.getConfidence())
                .requiresMfa(result.isRequiresMfa())
                .requiresReview(result.isRequiresReview())
                .reasons(result.getReasons() != null ? new ArrayList<>(result.getReasons()) : new ArrayList<>())
                .flags(toEmbeddables(result.getFlags()))
                .metadata(result.getMetadata() != null ? new HashMap<>(result.getMetadata()) : new HashMap<>())
                .build();
        repository.save(entity);
        log.debug("Persisted fraud check: checkId={}, entityId={}, approved={}, riskScore={}",
                entity.getCheckId(), entity.getEntityId(), entity.isApproved(), entity.getRiskScore());
    }

    @Override
    @Transactional(readOnly = true)
    public List<FraudCheckResult> history(String entityId, int limit) {
        if (limit <= 0) {
            return List.of();
        }
        return repository.findByEntityIdOrderByCheckedAtDesc(entityId, PageRequest.of(0, limit)).stream()
                .map(JpaCheckResultStore::toDomain)
                .collect(Collectors.toList());
    }

    private static List<FraudFlagEmbeddable> toEmbeddables(List<FraudFlag> flags) {
        List<FraudFlagEmbeddable> out = new ArrayList<>();
        if (flags == null) {
            return out;
        }
        for (FraudFlag flag : flags) {
            out.add(FraudFlagEmbeddable.builder()
                    .type(flag.getType())
                    .severity(flag.getSeverity())
                    .description(flag.getDescription())
                    .score(flag.getScore())
                    .evidence(flag.getEvidence() != null ? new HashMap<>(flag.getEvidence()) : null)
                    .build());
        }
        return out;
    }

    static FraudCheckResult toDomain(FraudCheckResultEntity entity) {
        List<FraudFlag> flags = entity.getFlags().stream()
                .map(f -> FraudFlag.builder()
                        .type(f.getType())
                        .severity(f.getSeverity())
                        .description(f.getDescription())
                        .score(f.getScore())
                        .evidence(f.getEvidence())
                        .build())
                .collect(Collectors.toList());
        return FraudCheckResult.builder()
                .id(entity.getCheckId())
                .entityId(entity.getEntityId())
                .entityKind(entity.getEntityKind())
                .timestamp(entity.getCheckedAt())
                .approved(entity.isApproved())
                .riskScore(entity.getRiskScore())
                .confidence(entity.getConfidence())
                .requiresMfa(entity.isRequiresMfa())
                .requiresReview(entity.isRequiresReview())
                .reasons(new ArrayList<>(entity.getReasons()))
                .flags(flags)
                .metadata(new HashMap<>(entity.getMetadata()))
                .build();
    }
}
