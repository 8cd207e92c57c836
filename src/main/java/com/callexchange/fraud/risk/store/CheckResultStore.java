package com.callexchange.fraud.risk.store;

import com.callexchange.fraud.risk.domain.FraudCheckResult;

import java.util.List;

/**
 * Durable audit log of fraud decisions.
 */
public interface CheckResultStore {

    void save(FraudCheckResult result);

    /**
     * Most recent results for the entity, newest first.
     */
    List<FraudCheckResult> history(String entityId, int limit);
}
