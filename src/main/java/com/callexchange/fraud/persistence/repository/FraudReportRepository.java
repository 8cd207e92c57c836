package com.callexchange.fraud.persistence.repository;

import com.callexchange.fraud.persistence.entity.FraudReportEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FraudReportRepository extends JpaRepository<FraudReportEntity, String> {
}
