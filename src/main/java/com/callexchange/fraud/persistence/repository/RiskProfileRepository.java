package com.callexchange.fraud.persistence.repository;

import com.callexchange.fraud.persistence.entity.RiskProfileEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface RiskProfileRepository extends JpaRepository<RiskProfileEntity, String> {
}
