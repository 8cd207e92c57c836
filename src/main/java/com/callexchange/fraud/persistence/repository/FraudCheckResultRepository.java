package com.callexchange.fraud.persistence.repository;

import com.callexchange.fraud.persistence.entity.FraudCheckResultEntity;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for the fraud decision audit log.
 */
@Repository
public interface FraudCheckResultRepository extends JpaRepository<FraudCheckResultEntity, String> {

    List<FraudCheckResultEntity> findByEntityIdOrderByCheckedAtDesc(String entityId, Pageable pageable);
}
