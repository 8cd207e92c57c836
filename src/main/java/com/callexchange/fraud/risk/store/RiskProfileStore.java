package com.callexchange.fraud.risk.store;

import com.callexchange.fraud.risk.domain.RiskProfile;

import java.util.Optional;

public interface RiskProfileStore {

    Optional<RiskProfile> load(String entityId);

    void save(RiskProfile profile);
}
