package com.callexchange.fraud.risk.store;

import com.callexchange.fraud.risk.domain.FraudReport;

public interface FraudReportStore {

    void save(FraudReport report);
}
