package com.callexchange.fraud.risk.signal.rules;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.Map;

/**
 * Single predicate over one feature, e.g. {@code geographic_risk GTE 0.9}.
 */
@Value
@Builder
@Jacksonized
public class RuleCondition {

    /** Feature name as produced by {@code FeatureBag.toFeatureMap()}. */
    String field;
    ComparisonOperator operator;
    Object value;

    boolean matches(Map<String, Object> features) {
        return operator.test(features.get(field), value);
    }

    public static RuleCondition of(String field, ComparisonOperator operator, Object value) {
        return RuleCondition.builder().field(field).operator(operator).value(value).build();
    }
}
