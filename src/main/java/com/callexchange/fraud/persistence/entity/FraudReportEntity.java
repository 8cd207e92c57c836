package com.callexchange.fraud.persistence.entity;

import com.callexchange.fraud.risk.domain.EntityKind;
import com.callexchange.fraud.risk.domain.FraudReport;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

@Entity
@Table(name = "fraud_reports", indexes = {
    @Index(name = "idx_report_entity_id", columnList = "entity_id"),
    @Index(name = "idx_report_status", columnList = "status")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FraudReportEntity {

    @Id
    @Column(name = "report_id", nullable = false)
    private String reportId;

    @Column(name = "entity_id", nullable = false)
    private String entityId;

    @Enumerated(EnumType.STRING)
    @Column(name = "entity_kind")
    private EntityKind entityKind;

    @Column(name = "reported_at", nullable = false)
    private Instant reportedAt;

    @Column(name = "reported_by")
    private String reportedBy;

    @Column(name = "fraud_type")
    private String fraudType;

    @Column(name = "description", columnDefinition = "TEXT")
    private String description;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "evidence", columnDefinition = "TEXT")
    private Map<String, Object> evidence;

    @Column(name = "action_taken")
    private String actionTaken;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false)
    private FraudReport.Status status;
}
