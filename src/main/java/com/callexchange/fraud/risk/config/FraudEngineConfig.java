package com.callexchange.fraud.risk.config;

import com.callexchange.fraud.risk.domain.FraudRules;
import com.callexchange.fraud.risk.domain.VelocityLimit;
import com.callexchange.fraud.risk.engine.FraudRulesHolder;
import com.callexchange.fraud.risk.engine.RiskProfileManager;
import com.callexchange.fraud.risk.engine.RiskScoreCache;
import com.callexchange.fraud.risk.store.RiskProfileStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;

/**
 * Wires the decision engine's shared state: the live rules (seeded from {@code fraud.rules.*}),
 * the risk score cache and the profile manager.
 */
@Slf4j
@Configuration
public class FraudEngineConfig {

    @Value("${fraud.rules.version:bootstrap}")
    private String rulesVersion;
    @Value("${fraud.rules.ml-enabled:true}")
    private boolean mlEnabled;
    @Value("${fraud.rules.rules-enabled:true}")
    private boolean rulesEnabled;
    @Value("${fraud.rules.require-mfa-score:0.7}")
    private double requireMfaScore;
    @Value("${fraud.rules.auto-block-score:0.9}")
    private double autoBlockScore;
    @Value("${fraud.rules.velocity.call-placement.max-count:100}")
    private int callPlacementMax;
    @Value("${fraud.rules.velocity.call-placement.window:PT1H}")
    private Duration callPlacementWindow;
    @Value("${fraud.rules.velocity.bid-placement.max-count:200}")
    private int bidPlacementMax;
    @Value("${fraud.rules.velocity.bid-placement.window:PT1H}")
    private Duration bidPlacementWindow;

    @Value("${fraud.risk-cache.ttl:PT5M}")
    private Duration riskCacheTtl;
    @Value("${fraud.risk-cache.max-entries:100000}")
    private int riskCacheMaxEntries;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public FraudRulesHolder fraudRulesHolder() {
        FraudRules rules = FraudRules.defaults().toBuilder()
                .version(rulesVersion)
                .mlEnabled(mlEnabled)
                .rulesEnabled(rulesEnabled)
                .requireMfaScore(requireMfaScore)
                .autoBlockScore(autoBlockScore)
                .velocityLimits(Map.of(
                        FraudRules.CALL_PLACEMENT, VelocityLimit.builder()
                                .action(FraudRules.CALL_PLACEMENT)
                                .maxCount(callPlacementMax)
                                .window(callPlacementWindow)
                                .build(),
                        FraudRules.BID_PLACEMENT, VelocityLimit.builder()
                                .action(FraudRules.BID_PLACEMENT)
                                .maxCount(bidPlacementMax)
                                .window(bidPlacementWindow)
                                .build()))
                .build();
        log.info("Initial fraud rules: version={}, mfa={}, autoBlock={}, ml={}, rules={}",
                rules.getVersion(), rules.getRequireMfaScore(), rules.getAutoBlockScore(),
                rules.isMlEnabled(), rules.isRulesEnabled());
        return new FraudRulesHolder(rules);
    }

    @Bean
    public RiskScoreCache riskScoreCache(Clock clock) {
        return new RiskScoreCache(riskCacheTtl, riskCacheMaxEntries, clock);
    }

    @Bean
    public RiskProfileManager riskProfileManager(ObjectProvider<RiskProfileStore> profileStore,
                                                 RiskScoreCache riskScoreCache, Clock clock) {
        return new RiskProfileManager(profileStore.getIfAvailable(), riskScoreCache, clock);
    }
}
