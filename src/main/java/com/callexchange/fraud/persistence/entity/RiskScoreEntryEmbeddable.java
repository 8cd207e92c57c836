package com.callexchange.fraud.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RiskScoreEntryEmbeddable {

    @Column(name = "score", nullable = false)
    private double score;

    @Column(name = "recorded_at", nullable = false)
    private Instant recordedAt;

    @Column(name = "reason", length = 500)
    private String reason;
}
