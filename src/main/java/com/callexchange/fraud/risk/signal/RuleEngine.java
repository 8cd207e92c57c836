package com.callexchange.fraud.risk.signal;

import com.callexchange.fraud.risk.features.FeatureBag;

public interface RuleEngine {

    RuleResult evaluate(FeatureBag features);
}
