package com.callexchange.fraud.persistence.service;

import com.callexchange.fraud.persistence.entity.FraudReportEntity;
import com.callexchange.fraud.persistence.repository.FraudReportRepository;
import com.callexchange.fraud.risk.domain.FraudReport;
import com.callexchange.fraud.risk.store.FraudReportStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashMap;

@Slf4j
@Service
@RequiredArgsConstructor
public class JpaFraudReportStore implements FraudReportStore {

    private final FraudReportRepository repository;

    @Override
    @Transactional
    public void save(FraudReport report) {
        FraudReportEntity entity = FraudReportEntity.builder()
                .reportId(report.getId())
                .entityId(report.getEntityId())
                .entityKind(report.getEntityKind())
                .reportedAt(report.getReportedAt())
                .reportedBy(report.getReportedBy())
                .fraudType(report.getFraudType())
                .description(report.getDescription())
                .evidence(report.getEvidence() != null ? new HashMap<>(report.getEvidence()) : null)
                .actionTaken(report.getActionTaken())
                .status(report.getStatus())
                .build();
        repository.save(entity);
        log.info("Stored fraud report: reportId={}, entityId={}, type={}",
                entity.getReportId(), entity.getEntityId(), entity.getFraudType());
    }
}
