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
import jakarta.persistence.JoinColumn;
import jakarta.persistence.OrderColumn;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
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
 * Persistent risk profile. History is kept oldest-first and capped by the profile manager.
 */
@Entity
@Table(name = "risk_profiles")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskProfileEntity {

    @Id
    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_kind")
    private EntityKind entityKind;

    @Column(name = "current_risk_score", nullable = false)
    private double currentRiskScore;

    @Column(name = "fraud_count", nullable = false)
    private int fraudCount;

    @Column(name = "last_check_time")
    private Instant lastCheckTime;

    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "risk_profile_history", joinColumns = @JoinColumn(name = "entity_id"))
    @OrderColumn(name = "position")
    @Builder.Default
    private List<RiskScoreEntryEmbeddable> history = new ArrayList<>();

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "attributes", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, Object> attributes = new HashMap<>();

    @Column(name = "updated_at")
    private Instant updatedAt;

    @PrePersist
    @PreUpdate
    protected void onWrite() {
        updatedAt = Instant.now();
    }
}
