package com.callexchange.fraud.persistence.entity;

import com.callexchange.fraud.risk.domain.FraudSeverity;
import com.callexchange.fraud.risk.domain.FraudSignalType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Embeddable;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Embeddable
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FraudFlagEmbeddable {

    @Enumerated(EnumType.STRING)
    @Column(name = "signal_type", nullable = false)
    private FraudSignalType type;

    @Enumerated(EnumType.STRING)
    @Column(name = "severity", nullable = false)
    private FraudSeverity severity;

    @Column(name = "description", length = 500)
    private String description;

    @Column(name = "score", nullable = false)
    private double score;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "evidence", columnDefinition = "TEXT")
    private Map<String, Object> evidence;
}
