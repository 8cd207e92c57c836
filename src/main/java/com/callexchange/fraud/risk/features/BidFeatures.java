package com.callexchange.fraud.risk.features;

import com.callexchange.fraud.risk.domain.EntityKind;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class BidFeatures implements FeatureBag {

    double bidAmount;
    /** Buyer quality score scaled to 0.0–1.0. */
    double buyerReputation;
    int timeOfDay;
    int dayOfWeek;
    /** Time between auction start and bid placement. */
    Duration timeToSubmit;
    /** Relative deviation of the bid from the buyer's configured maximum bid (0 when unknown). */
    double priceDeviation;
    Duration accountAge;
    String accountType;
    String accountStatus;
    boolean suspiciousAmount;
    boolean roundAmount;

    @Override
    public EntityKind kind() {
        return EntityKind.BID;
    }

    @Override
    public Map<String, Object> toFeatureMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("bid_amount", bidAmount);
        m.put("buyer_reputation", buyerReputation);
        m.put("time_of_day", timeOfDay);
        m.put("day_of_week", dayOfWeek);
        m.put("time_to_submit", timeToSubmit.getSeconds());
        m.put("price_deviation", priceDeviation);
        m.put("account_age", accountAge.toDays());
        m.put("account_type", accountType);
        m.put("account_status", accountStatus);
        m.put("suspicious_amount", suspiciousAmount);
        m.put("round_amount", roundAmount);
        return m;
    }
}
