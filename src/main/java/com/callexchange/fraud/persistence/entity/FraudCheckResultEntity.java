package com.callexchange.fraud.persistence.entity;

import com.callexchange.fraud.risk.domain.EntityKind;
import jakarta.persistence.CollectionTable;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.ElementCollection;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.FetchType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Audit row for one fraud decision. Written once, never updated.
 */
@Entity
@Table(name = "fraud_check_results", indexes = {
    @Index(name = "idx_check_entity_id", columnList = "entity_id"),
    @Index(name = "idx_check_checked_at", columnList = "checked_at"),
    @Index(name = "idx_check_approved", columnList = "approved")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FraudCheckResultEntity {

    @Id
    @Column(name = "check_id", nullable = false)
    private String checkId;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_kind", nullable = false)
    private EntityKind entityKind;

    @Column(name = "checked_at", nullable = false, updatable = false)
    private Instant checkedAt;

    @Column(name = "approved", nullable = false)
    private boolean approved;

    @Column(name = "risk_score", nullable = false)
    private double riskScore;

    @Column(name = "confidence", nullable = false)
    private double confidence;

    @Column(name = "requires_mfa", nullable = false)
    private boolean requiresMfa;

    @Column(name = "requires_review", nullable = false)
    private boolean requiresReview;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "fraud_check_reasons", joinColumns = @JoinColumn(name = "check_id"))
    @OrderColumn(name = "position")
    @Column(name = "reason", nullable = false, length = 500)
    @Builder.Default
    private List<String> reasons = new ArrayList<>();

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "fraud_check_flags", joinColumns = @JoinColumn(name = "check_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<FraudFlagEmbeddable> flags = new ArrayList<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> metadata = new HashMap<>();
}
