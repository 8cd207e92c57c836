package com.callexchange.fraud.risk.engine;

import com.callexchange.fraud.risk.domain.FraudRules;

/**
 * Maps the aggregate score to the decision flags. Review is a band strictly below auto-block:
 * a blocked event is not queued for review.
 */
final class ThresholdPolicy {

    static final double REVIEW_SCORE = 0.6;
    static final String AUTO_BLOCK_REASON = "Risk score exceeds auto-block threshold";

    private ThresholdPolicy() {
    }

    static void apply(FraudEvaluation evaluation, FraudRules rules) {
        double score = evaluation.getRiskScore();
        boolean requiresMfa = score >= rules.getRequireMfaScore();
        boolean approved = score < rules.getAutoBlockScore();
        boolean requiresReview = score >= REVIEW_SCORE && score < rules.getAutoBlockScore();
        if (!approved) {
            evaluation.reason(AUTO_BLOCK_REASON);
        }
        evaluation.decide(approved, requiresMfa, requiresReview);
    }
}
