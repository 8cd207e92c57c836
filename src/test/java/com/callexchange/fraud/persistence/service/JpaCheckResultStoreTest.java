package com.callexchange.fraud.persistence.service;

import com.callexchange.fraud.persistence.entity.FraudCheckResultEntity;
import com.callexchange.fraud.persistence.entity.FraudFlagEmbeddable;
import com.callexchange.fraud.persistence.repository.FraudCheckResultRepository;
import com.callexchange.fraud.risk.domain.EntityKind;
import com.callexchange.fraud.risk.domain.FraudCheckResult;
import com.callexchange.fraud.risk.domain.FraudFlag;
import com.callexchange.fraud.risk.domain.FraudSeverity;
import com.callexchange.fraud.risk.domain.FraudSignalType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageRequest;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * Unit tests for JpaCheckResultStore with a mocked repository.
 */
@ExtendWith(MockitoExtension.class)
class JpaCheckResultStoreTest {

    private static final Instant CHECKED_AT = Instant.parse("2026-03-10T12:00:00Z");

    @Mock
    private FraudCheckResultRepository repository;

    private JpaCheckResultStore store;

    @BeforeEach
    void setUp() {
        store = new JpaCheckResultStore(repository);
    }

    @Test
    void saveMapsDecisionToEntity() {
        FraudCheckResult result = FraudCheckResult.builder()
                .id("check-1")
                .entityId("call-1")
                .entityKind(EntityKind.CALL)
                .timestamp(CHECKED_AT)
                .approved(false)
                .riskScore(0.95)
                .confidence(0.8)
                .reasons(List.of("Risk score exceeds auto-block threshold"))
                .flags(List.of(FraudFlag.builder()
                        .type(FraudSignalType.ML_ANOMALY)
                        .severity(FraudSeverity.HIGH)
                        .description("ML model detected anomaly")
                        .score(0.95)
                        .evidence(Map.of("explanations", List.of("unusual destination")))
                        .build()))
                .requiresMfa(true)
                .metadata(Map.of("rulesVersion", "v2"))
                .build();
        ArgumentCaptor<FraudCheckResultEntity> captor = ArgumentCaptor.forClass(FraudCheckResultEntity.class);

        store.save(result);

        verify(repository).save(captor.capture());
        FraudCheckResultEntity entity = captor.getValue();
        assertThat(entity.getCheckId()).isEqualTo("check-1");
        assertThat(entity.getEntityKind()).isEqualTo(EntityKind.CALL);
        assertThat(entity.getCheckedAt()).isEqualTo(CHECKED_AT);
        assertThat(entity.isApproved()).isFalse();
        assertThat(entity.isRequiresMfa()).isTrue();
        assertThat(entity.getReasons()).containsExactly("Risk score exceeds auto-block threshold");
        assertThat(entity.getFlags()).singleElement().satisfies(flag -> {
            assertThat(flag.getType()).isEqualTo(FraudSignalType.ML_ANOMALY);
            assertThat(flag.getEvidence()).containsKey("explanations");
        });
        assertThat(entity.getMetadata()).containsEntry("rulesVersion", "v2");
    }

    @Test
    void saveFailurePropagates() {
        when(repository.save(any())).thenThrow(new IllegalStateException("db down"));

        assertThatThrownBy(() -> store.save(FraudCheckResult.builder().id("check-2").entityId("call-2").build()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void historyIsNewestFirstAndLimited() {
        FraudCheckResultEntity newest = FraudCheckResultEntity.builder()
                .checkId("check-3")
                .entityId("acct-1")
                .entityKind(EntityKind.ACCOUNT)
                .checkedAt(CHECKED_AT)
                .riskScore(0.85)
                .flags(List.of(FraudFlagEmbeddable.builder()
                        .type(FraudSignalType.PATTERN)
                        .severity(FraudSeverity.LOW)
                        .description("Suspicious email domain")
                        .score(0.4)
                        .build()))
                .build();
        FraudCheckResultEntity older = FraudCheckResultEntity.builder()
                .checkId("check-2")
                .entityId("acct-1")
                .entityKind(EntityKind.ACCOUNT)
                .checkedAt(CHECKED_AT.minusSeconds(60))
                .riskScore(0.2)
                .build();
        when(repository.findByEntityIdOrderByCheckedAtDesc("acct-1", PageRequest.of(0, 10)))
                .thenReturn(List.of(newest, older));

        List<FraudCheckResult> history = store.history("acct-1", 10);

        assertThat(history).extracting(FraudCheckResult::getId).containsExactly("check-3", "check-2");
        assertThat(history.get(0).getRiskScore()).isEqualTo(0.85);
        assertThat(history.get(0).getFlags()).extracting(FraudFlag::getDescription)
                .containsExactly("Suspicious email domain");
        assertThat(history.get(1).getFlags()).isEmpty();
    }

    @Test
    void nonPositiveLimitReturnsNothing() {
        assertThat(store.history("acct-1", 0)).isEmpty();
        verifyNoInteractions(repository);
    }
}
