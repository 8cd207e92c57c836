package com.callexchange.fraud.risk.signal;

import com.callexchange.fraud.risk.features.FeatureBag;

/**
 * Trained fraud classifier. Training and serving live outside this engine.
 */
public interface ClassifierEngine {

    Prediction predict(FeatureBag features);
}
