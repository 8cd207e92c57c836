package com.callexchange.fraud.risk.engine;

import com.callexchange.fraud.api.FraudProcessingException;
import com.callexchange.fraud.api.FraudValidationException;
import com.callexchange.fraud.domain.Account;
import com.callexchange.fraud.domain.Bid;
import com.callexchange.fraud.domain.Call;
import com.callexchange.fraud.risk.domain.EntityKind;
import com.callexchange.fraud.risk.domain.FraudCheckResult;
import com.callexchange.fraud.risk.domain.FraudReport;
import com.callexchange.fraud.risk.domain.FraudRules;
import com.callexchange.fraud.risk.domain.FraudSeverity;
import com.callexchange.fraud.risk.domain.FraudSignalType;
import com.callexchange.fraud.risk.domain.VelocityLimit;
import com.callexchange.fraud.risk.features.FeatureBag;
import com.callexchange.fraud.risk.features.FeatureExtractor;
import com.callexchange.fraud.risk.features.FraudPatterns;
import com.callexchange.fraud.risk.messaging.FraudDecisionProducer;
import com.callexchange.fraud.risk.signal.ClassifierEngine;
import com.callexchange.fraud.risk.signal.DenylistChecker;
import com.callexchange.fraud.risk.signal.DenylistMatch;
import com.callexchange.fraud.risk.signal.Prediction;
import com.callexchange.fraud.risk.signal.RuleEngine;
import com.callexchange.fraud.risk.signal.RuleResult;
import com.callexchange.fraud.risk.signal.VelocityChecker;
import com.callexchange.fraud.risk.signal.VelocityResult;
import com.callexchange.fraud.risk.store.CheckResultStore;
import com.callexchange.fraud.risk.store.FraudReportStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Decides whether a call, bid or account event is legitimate, suspicious or must be blocked.
 * <p>
 * Signals are collected in a fixed order: denylist (conclusive, ends the evaluation), velocity,
 * classifier, rule engine. The risk score is the maximum of the individual signal scores. A signal
 * source that is not wired, or that throws, abstains; the evaluation carries on with the others.
 * Only malformed input fails a check.
 */
@Slf4j
@Service
public class FraudDecisionService {

    static final double CALL_VELOCITY_SCORE = 0.8;
    static final double BID_VELOCITY_SCORE = 0.7;
    static final double CALL_ANOMALY_THRESHOLD = 0.7;
    static final double BID_ANOMALY_THRESHOLD = 0.6;
    static final double ACCOUNT_ANOMALY_THRESHOLD = 0.7;
    static final double LOW_QUALITY_BUYER = 50.0;
    static final double HISTORICAL_HIGH_RISK = 0.8;
    static final int HISTORY_WINDOW = 10;
    static final int HISTORY_HIGH_RISK_LIMIT = 2;

    private final FeatureExtractor featureExtractor;
    private final FraudRulesHolder rulesHolder;
    private final RiskProfileManager profileManager;
    private final DenylistChecker denylistChecker;
    private final VelocityChecker velocityChecker;
    private final ClassifierEngine classifierEngine;
    private final RuleEngine ruleEngine;
    private final CheckResultStore checkResultStore;
    private final FraudReportStore reportStore;
    private final FraudDecisionProducer decisionProducer;
    private final Clock clock;

    public FraudDecisionService(FeatureExtractor featureExtractor,
                                FraudRulesHolder rulesHolder,
                                RiskProfileManager profileManager,
                                Clock clock,
                                @Autowired(required = false) DenylistChecker denylistChecker,
                                @Autowired(required = false) VelocityChecker velocityChecker,
                                @Autowired(required = false) ClassifierEngine classifierEngine,
                                @Autowired(required = false) RuleEngine ruleEngine,
                                @Autowired(required = false) CheckResultStore checkResultStore,
                                @Autowired(required = false) FraudReportStore reportStore,
                                @Autowired(required = false) FraudDecisionProducer decisionProducer) {
        this.featureExtractor = featureExtractor;
        this.rulesHolder = rulesHolder;
        this.profileManager = profileManager;
        this.clock = clock;
        this.denylistChecker = denylistChecker;
        this.velocityChecker = velocityChecker;
        this.classifierEngine = classifierEngine;
        this.ruleEngine = ruleEngine;
        this.checkResultStore = checkResultStore;
        this.reportStore = reportStore;
        this.decisionProducer = decisionProducer;
        log.info("Fraud decision service wired: denylist={}, velocity={}, classifier={}, rules={}, checkStore={}, publisher={}",
                denylistChecker != null, velocityChecker != null, classifierEngine != null, ruleEngine != null,
                checkResultStore != null, decisionProducer != null);
    }

    public FraudCheckResult checkCall(Call call) {
        if (call == null) {
            throw new FraudValidationException("INVALID_CALL", "call cannot be null");
        }
        FraudRules rules = rulesHolder.current();
        FraudEvaluation evaluation = start(call.getId(), EntityKind.CALL, rules);

        if (denylisted(evaluation, call.getFromNumber(), "phone", "From number")
                || denylisted(evaluation, call.getToNumber(), "phone", "To number")) {
            return finishShortCircuit(evaluation);
        }

        checkVelocity(evaluation, rules, call.getBuyerId(), FraudRules.CALL_PLACEMENT, CALL_VELOCITY_SCORE, "call");

        FeatureBag features = featureExtractor.extract(call);
        consultClassifier(evaluation, rules, features, CALL_ANOMALY_THRESHOLD, FraudSeverity.HIGH,
                "ML model detected anomaly");
        consultRuleEngine(evaluation, rules, features);

        FraudCheckResult result = finish(evaluation, rules);
        updateProfile(call.getBuyerId(), EntityKind.ACCOUNT, result);
        return result;
    }

    public FraudCheckResult checkBid(Bid bid, Account buyer) {
        if (bid == null) {
            throw new FraudValidationException("INVALID_BID", "bid cannot be null");
        }
        if (buyer == null) {
            throw new FraudValidationException("INVALID_ACCOUNT", "buyer account cannot be null");
        }
        FraudRules rules = rulesHolder.current();
        FraudEvaluation evaluation = start(bid.getId(), EntityKind.BID, rules);

        if (buyer.getQualityScore() < LOW_QUALITY_BUYER) {
            evaluation.flag(FraudSignalType.PATTERN, FraudSeverity.MEDIUM, "Low account quality score", 0.6);
        }
        if (FraudPatterns.isSuspiciousBidAmount(bid.getAmount())) {
            evaluation.flag(FraudSignalType.PATTERN, FraudSeverity.LOW, "Suspicious bid amount pattern", 0.3);
        }

        checkVelocity(evaluation, rules, bid.getBuyerId(), FraudRules.BID_PLACEMENT, BID_VELOCITY_SCORE, "bid");

        FeatureBag features = featureExtractor.extract(bid, buyer);
        consultClassifier(evaluation, rules, features, BID_ANOMALY_THRESHOLD, FraudSeverity.MEDIUM,
                "ML model detected potential fraud");
        consultRuleEngine(evaluation, rules, features);

        FraudCheckResult result = finish(evaluation, rules);
        updateProfile(bid.getBuyerId(), EntityKind.ACCOUNT, result);
        return result;
    }

    public FraudCheckResult checkAccount(Account account) {
        if (account == null) {
            throw new FraudValidationException("INVALID_ACCOUNT", "account cannot be null");
        }
        FraudRules rules = rulesHolder.current();
        FraudEvaluation evaluation = start(account.getId(), EntityKind.ACCOUNT, rules);

        if (denylisted(evaluation, account.getEmail(), "email", "Email")
                || denylisted(evaluation, account.getPhoneNumber(), "phone", "Phone number")) {
            return finishShortCircuit(evaluation);
        }

        if (FraudPatterns.isDisposableEmail(account.getEmail())) {
            evaluation.flag(FraudSignalType.PATTERN, FraudSeverity.LOW, "Suspicious email domain", 0.4);
        }
        if (!FraudPatterns.isValidPhoneFormat(account.getPhoneNumber())) {
            evaluation.flag(FraudSignalType.PATTERN, FraudSeverity.MEDIUM, "Invalid phone number format", 0.5);
        }
        checkHistory(evaluation, account.getId());

        FeatureBag features = featureExtractor.extract(account);
        consultClassifier(evaluation, rules, features, ACCOUNT_ANOMALY_THRESHOLD, FraudSeverity.HIGH,
                "ML model detected anomalous account");
        consultRuleEngine(evaluation, rules, features);

        return finish(evaluation, rules);
    }

    /**
     * Smoothed risk score of an entity, empty when it has never been scored.
     */
    public Optional<Double> getRiskScore(String entityId, EntityKind kind) {
        if (entityId == null || entityId.isBlank()) {
            throw new FraudValidationException("INVALID_ENTITY_ID", "entity id cannot be blank");
        }
        Optional<Double> score = profileManager.currentScore(entityId);
        log.debug("Risk score lookup {} {}: {}", kind, entityId, score.orElse(null));
        return score;
    }

    /**
     * Stores the report and pushes the entity's smoothed score toward 1.0.
     */
    public FraudReport reportFraud(FraudReport report) {
        if (report == null) {
            throw new FraudValidationException("INVALID_REPORT", "fraud report cannot be null");
        }
        if (report.getEntityId() == null || report.getEntityId().isBlank()) {
            throw new FraudValidationException("INVALID_REPORT", "fraud report must name an entity");
        }
        FraudReport stored = report.toBuilder()
                .id(UUID.randomUUID().toString())
                .reportedAt(clock.instant())
                .status(FraudReport.Status.PENDING)
                .build();
        if (reportStore != null) {
            try {
                reportStore.save(stored);
            } catch (RuntimeException e) {
                throw new FraudProcessingException("failed to save fraud report", e);
            }
        }
        profileManager.update(stored.getEntityId(), stored.getEntityKind(), 1.0,
                "fraud report: " + stored.getFraudType(), stored.isConfirmed());
        log.info("Fraud report {} recorded for {} {} (type={})",
                stored.getId(), stored.getEntityKind(), stored.getEntityId(), stored.getFraudType());
        return stored;
    }

    /**
     * Replaces the live rules. Evaluations already running keep the snapshot they started with.
     */
    public void updateRules(FraudRules rules) {
        if (rules == null) {
            throw new FraudValidationException("INVALID_RULES", "rules cannot be null");
        }
        if (outOfRange(rules.getRequireMfaScore()) || outOfRange(rules.getAutoBlockScore())) {
            throw new FraudValidationException("INVALID_RULES", "threshold scores must be within [0,1]");
        }
        rulesHolder.replace(rules);
    }

    public FraudRules currentRules() {
        return rulesHolder.current();
    }

    private FraudEvaluation start(String entityId, EntityKind kind, FraudRules rules) {
        FraudEvaluation evaluation = new FraudEvaluation(entityId, kind, clock.instant());
        evaluation.getMetadata().put("rulesVersion", rules.getVersion());
        return evaluation;
    }

    private boolean denylisted(FraudEvaluation evaluation, String identifier, String kind, String label) {
        if (denylistChecker == null || identifier == null || identifier.isBlank()) {
            return false;
        }
        Optional<DenylistMatch> match = consult("denylist", evaluation,
                () -> denylistChecker.check(identifier, kind));
        if (match.isEmpty() || !match.get().isListed()) {
            return false;
        }
        evaluation.reason(String.format("%s blacklisted: %s", label, match.get().getReason()));
        evaluation.flag(FraudSignalType.BLACKLIST, FraudSeverity.CRITICAL, "Blacklisted " + kind, 1.0,
                Map.of("identifierKind", kind));
        return true;
    }

    private void checkVelocity(FraudEvaluation evaluation, FraudRules rules, String entityId, String action,
                               double score, String noun) {
        if (velocityChecker == null || entityId == null) {
            return;
        }
        VelocityLimit limit = rules.velocityLimitFor(action);
        Optional<VelocityResult> velocity = consult("velocity", evaluation,
                () -> velocityChecker.check(entityId, action, limit));
        velocity.filter(v -> !v.isPassed()).ifPresent(v -> evaluation.flag(
                FraudSignalType.VELOCITY,
                FraudSeverity.HIGH,
                String.format("High %s velocity: %d %ss in %s (limit %d)", noun, v.getCount(), noun, v.getWindow(), v.getLimit()),
                score,
                Map.of("count", v.getCount(), "limit", v.getLimit(), "window", String.valueOf(v.getWindow()))));
        try {
            velocityChecker.record(entityId, action, limit);
        } catch (RuntimeException e) {
            log.warn("Velocity record failed for {} {}: {}", action, entityId, e.getMessage());
        }
    }

    private void consultClassifier(FraudEvaluation evaluation, FraudRules rules, FeatureBag features,
                                   double anomalyThreshold, FraudSeverity severity, String description) {
        if (classifierEngine == null || !rules.isMlEnabled()) {
            return;
        }
        Optional<Prediction> prediction = consult("classifier", evaluation, () -> classifierEngine.predict(features));
        if (prediction.isEmpty()) {
            return;
        }
        Prediction p = prediction.get();
        evaluation.raise(p.getFraudProbability());
        evaluation.confidence(p.getConfidence());
        evaluation.getMetadata().put("mlConfidence", p.getConfidence());
        if (p.getFraudProbability() > anomalyThreshold) {
            Map<String, Object> evidence = new HashMap<>();
            evidence.put("features", p.getFeatureWeights() != null ? p.getFeatureWeights() : Map.of());
            evidence.put("explanations", p.getExplanations() != null ? p.getExplanations() : List.of());
            evaluation.flag(FraudSignalType.ML_ANOMALY, severity, description, p.getFraudProbability(), evidence);
        }
    }

    private void consultRuleEngine(FraudEvaluation evaluation, FraudRules rules, FeatureBag features) {
        if (ruleEngine == null || !rules.isRulesEnabled()) {
            return;
        }
        Optional<RuleResult> ruleResult = consult("rules", evaluation, () -> ruleEngine.evaluate(features));
        if (ruleResult.isEmpty() || !ruleResult.get().isMatched()) {
            return;
        }
        RuleResult r = ruleResult.get();
        List<String> matched = r.getMatchedRules() != null ? r.getMatchedRules() : List.of();
        for (String rule : matched) {
            evaluation.flag(FraudSignalType.PATTERN, FraudSeverity.MEDIUM, "Rule matched: " + rule, r.getTotalScore());
        }
        evaluation.raise(r.getTotalScore());
        evaluation.getMetadata().put("rulesTriggered", List.copyOf(matched));
    }

    private void checkHistory(FraudEvaluation evaluation, String entityId) {
        if (checkResultStore == null || entityId == null) {
            return;
        }
        Optional<List<FraudCheckResult>> history = consult("history", evaluation,
                () -> checkResultStore.history(entityId, HISTORY_WINDOW));
        if (history.isEmpty()) {
            return;
        }
        long highRisk = history.get().stream()
                .filter(past -> past.getRiskScore() > HISTORICAL_HIGH_RISK)
                .count();
        if (highRisk > HISTORY_HIGH_RISK_LIMIT) {
            evaluation.flag(FraudSignalType.PATTERN, FraudSeverity.HIGH,
                    String.format("Historical fraud indicators: %d high-risk events", highRisk), 0.9);
        }
    }

    /**
     * Runs one collaborator call; any exception means the collaborator abstains.
     */
    private <T> Optional<T> consult(String signal, FraudEvaluation evaluation, Supplier<T> call) {
        try {
            T value = call.get();
            if (value != null) {
                evaluation.consulted(signal);
            }
            return Optional.ofNullable(value);
        } catch (RuntimeException e) {
            log.warn("Signal '{}' abstained for {} {}: {}", signal, evaluation.getKind().label(),
                    evaluation.getEntityId(), e.getMessage());
            return Optional.empty();
        }
    }

    private FraudCheckResult finishShortCircuit(FraudEvaluation evaluation) {
        evaluation.decide(false, false, false);
        FraudCheckResult result = persist(evaluation.toResult());
        log.info("Fraud check {} {}: denylisted, blocked", evaluation.getKind().label(), evaluation.getEntityId());
        publish(result);
        return result;
    }

    private FraudCheckResult finish(FraudEvaluation evaluation, FraudRules rules) {
        ThresholdPolicy.apply(evaluation, rules);
        FraudCheckResult result = persist(evaluation.toResult());
        log.debug("Fraud check {} {}: score={}, approved={}, mfa={}, review={}, flags={}",
                result.getEntityKind().label(), result.getEntityId(), result.getRiskScore(), result.isApproved(),
                result.isRequiresMfa(), result.isRequiresReview(), result.getFlags().size());
        publish(result);
        return result;
    }

    /**
     * Best-effort audit write. A failed write does not withhold the decision; the returned result carries
     * {@code auditPersisted=false} so the caller can see the gap.
     */
    private FraudCheckResult persist(FraudCheckResult result) {
        if (checkResultStore == null) {
            return result;
        }
        try {
            checkResultStore.save(result);
            return result;
        } catch (RuntimeException e) {
            log.error("Failed to persist fraud check result {} for {} {}", result.getId(),
                    result.getEntityKind().label(), result.getEntityId(), e);
            Map<String, Object> metadata = new LinkedHashMap<>(result.getMetadata());
            metadata.put("auditPersisted", false);
            return result.toBuilder().metadata(Collections.unmodifiableMap(metadata)).build();
        }
    }

    private void publish(FraudCheckResult result) {
        if (decisionProducer == null || (result.isApproved() && !result.isRequiresReview())) {
            return;
        }
        try {
            decisionProducer.send(result);
        } catch (RuntimeException e) {
            log.warn("Failed to publish fraud decision {}: {}", result.getId(), e.getMessage());
        }
    }

    private void updateProfile(String subjectId, EntityKind subjectKind, FraudCheckResult result) {
        if (subjectId == null) {
            log.debug("No subject for {} {}, risk profile not updated", result.getEntityKind().label(), result.getEntityId());
            return;
        }
        profileManager.update(subjectId, subjectKind, result.getRiskScore(),
                result.getEntityKind().label() + " check " + result.getId(), false);
    }

    private static boolean outOfRange(double score) {
        return Double.isNaN(score) || score < 0.0 || score > 1.0;
    }
}
