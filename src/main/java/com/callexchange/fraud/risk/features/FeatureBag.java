package com.callexchange.fraud.risk.features;

import com.callexchange.fraud.risk.domain.EntityKind;

import java.util.Map;

/**
 * Features derived from one entity for the classifier and rule engine, one permitted implementation
 * per {@link EntityKind}.
 */
public sealed interface FeatureBag permits CallFeatures, BidFeatures, AccountFeatures {

    EntityKind kind();

    /**
     * Flat snake_case view used for rule matching and the classifier request body.
     */
    Map<String, Object> toFeatureMap();
}
