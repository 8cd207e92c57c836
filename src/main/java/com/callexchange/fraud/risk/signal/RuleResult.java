package com.callexchange.fraud.risk.signal;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class RuleResult {

    private static final RuleResult NO_MATCH = RuleResult.builder()
            .matched(false)
            .matchedRules(List.of())
            .totalScore(0.0)
            .actions(List.of())
            .build();

    boolean matched;
    /** Names of the matched rules, in evaluation order. */
    List<String> matchedRules;
    /** 0.0–1.0; the highest score among the matched rules. */
    double totalScore;
    /** Distinct actions requested by the matched rules (block, flag, review). */
    List<String> actions;

    public static RuleResult noMatch() {
        return NO_MATCH;
    }
}
