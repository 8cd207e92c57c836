package com.callexchange.fraud.risk.signal.rules;

import com.callexchange.fraud.risk.domain.EntityKind;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named rule evaluated against a feature bag. Conditions combine with {@link Logic#ALL} (every condition)
 * or {@link Logic#ANY} (at least one).
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FraudRule {

    String id;
    String name;
    String description;
    /** Entity kinds the rule applies to. */
    Set<EntityKind> appliesTo;
    List<RuleCondition> conditions;
    @Builder.Default
    Logic logic = Logic.ALL;
    /** "block", "flag" or "review"; informational. */
    String action;
    /** 0.0–1.0 score contributed when the rule matches. */
    double score;
    @Builder.Default
    boolean enabled = true;

    boolean appliesTo(EntityKind kind) {
        return appliesTo == null || appliesTo.isEmpty() || appliesTo.contains(kind);
    }

    boolean matches(Map<String, Object> features) {
        if (conditions == null || conditions.isEmpty()) {
            return false;
        }
        if (logic == Logic.ANY) {
            return conditions.stream().anyMatch(c -> c.matches(features));
        }
        return conditions.stream().allMatch(c -> c.matches(features));
    }

    public enum Logic {
        ALL, ANY
    }
}
