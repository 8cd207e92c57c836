package com.callexchange.fraud.risk.signal.rules;

import com.callexchange.fraud.risk.features.FeatureBag;
import com.callexchange.fraud.risk.signal.RuleEngine;
import com.callexchange.fraud.risk.signal.RuleResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Evaluates configured {@link FraudRule}s against the flat feature map of a bag.
 * The total score of a match is the highest score among the matched rules.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "fraud.rule-engine.enabled", havingValue = "true", matchIfMissing = true)
public class FeatureRuleEngine implements RuleEngine {

    private final List<FraudRule> rules = new CopyOnWriteArrayList<>();

    public FeatureRuleEngine() {
        this(DefaultRuleCatalog.rules());
    }

    public FeatureRuleEngine(List<FraudRule> initialRules) {
        initialRules.forEach(this::addRule);
        log.info("Rule engine loaded {} rules", rules.size());
    }

    @Override
    public RuleResult evaluate(FeatureBag features) {
        Map<String, Object> values = features.toFeatureMap();
        List<String> matched = new ArrayList<>();
        Set<String> actions = new LinkedHashSet<>();
        double total = 0.0;
        for (FraudRule rule : rules) {
            if (!rule.isEnabled() || !rule.appliesTo(features.kind())) {
                continue;
            }
            if (rule.matches(values)) {
                matched.add(rule.getName());
                if (rule.getAction() != null) actions.add(rule.getAction());
                total = Math.max(total, rule.getScore());
            }
        }
        if (matched.isEmpty()) {
            return RuleResult.noMatch();
        }
        log.debug("Rules matched for {}: {} (score {})", features.kind(), matched, total);
        return RuleResult.builder()
                .matched(true)
                .matchedRules(List.copyOf(matched))
                .totalScore(total)
                .actions(List.copyOf(actions))
                .build();
    }

    /**
     * Adds a rule, replacing any existing rule with the same id.
     */
    public void addRule(FraudRule rule) {
        Objects.requireNonNull(rule.getId(), "rule id");
        if (rule.getScore() < 0.0 || rule.getScore() > 1.0) {
            throw new IllegalArgumentException("rule score must be within [0,1]: " + rule.getId());
        }
        rules.removeIf(existing -> existing.getId().equals(rule.getId()));
        rules.add(rule);
    }

    public boolean removeRule(String ruleId) {
        return rules.removeIf(existing -> existing.getId().equals(ruleId));
    }

    public List<FraudRule> listRules() {
        return List.copyOf(rules);
    }
}
