package com.callexchange.fraud.risk.signal.rules;

import com.callexchange.fraud.risk.domain.EntityKind;

import java.util.List;
import java.util.Set;

import static com.callexchange.fraud.risk.signal.rules.ComparisonOperator.EQ;
import static com.callexchange.fraud.risk.signal.rules.ComparisonOperator.GT;
import static com.callexchange.fraud.risk.signal.rules.ComparisonOperator.GTE;
import static com.callexchange.fraud.risk.signal.rules.ComparisonOperator.LT;

/**
 * Rules loaded at startup when nothing else is configured.
 */
final class DefaultRuleCatalog {

    private DefaultRuleCatalog() {
    }

    static List<FraudRule> rules() {
        return List.of(
                FraudRule.builder()
                        .id("call-irsf-destination")
                        .name("High-risk destination")
                        .description("Destination prefix commonly used for revenue share fraud")
                        .appliesTo(Set.of(EntityKind.CALL))
                        .conditions(List.of(RuleCondition.of("geographic_risk", GTE, 0.9)))
                        .action("review")
                        .score(0.75)
                        .build(),
                FraudRule.builder()
                        .id("call-missing-cli")
                        .name("Missing caller ID")
                        .description("Call presented without a caller line identity")
                        .appliesTo(Set.of(EntityKind.CALL))
                        .conditions(List.of(RuleCondition.of("has_cli", EQ, false)))
                        .action("flag")
                        .score(0.5)
                        .build(),
                FraudRule.builder()
                        .id("call-night-international")
                        .name("Night-time international call")
                        .appliesTo(Set.of(EntityKind.CALL))
                        .conditions(List.of(
                                RuleCondition.of("is_international", EQ, true),
                                RuleCondition.of("time_of_day", LT, 5)))
                        .action("flag")
                        .score(0.45)
                        .build(),
                FraudRule.builder()
                        .id("bid-new-account-large")
                        .name("Large bid from new account")
                        .appliesTo(Set.of(EntityKind.BID))
                        .conditions(List.of(
                                RuleCondition.of("account_age", LT, 7),
                                RuleCondition.of("bid_amount", GTE, 50)))
                        .action("review")
                        .score(0.55)
                        .build(),
                FraudRule.builder()
                        .id("bid-over-budget")
                        .name("Bid far above buyer maximum")
                        .appliesTo(Set.of(EntityKind.BID))
                        .conditions(List.of(RuleCondition.of("price_deviation", GT, 0.5)))
                        .action("flag")
                        .score(0.5)
                        .build(),
                FraudRule.builder()
                        .id("account-disposable-new")
                        .name("New account on disposable email")
                        .appliesTo(Set.of(EntityKind.ACCOUNT))
                        .conditions(List.of(
                                RuleCondition.of("disposable_email", EQ, true),
                                RuleCondition.of("account_age", LT, 2)))
                        .action("review")
                        .score(0.65)
                        .build());
    }
}
