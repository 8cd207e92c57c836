package com.callexchange.fraud.risk.features;

import com.callexchange.fraud.risk.domain.EntityKind;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class CallFeatures implements FeatureBag {

    Duration duration;
    double callerReputation;
    double calleeReputation;
    /** Hour of day (0-23, UTC). */
    int timeOfDay;
    /** Day of week (0 = Sunday, 6 = Saturday). */
    int dayOfWeek;
    /** Calls placed by the buyer in the current velocity window, -1 when unknown. */
    int callFrequency;
    /** 0.0–1.0 based on the dialed destination. */
    double geographicRisk;
    double priceDeviation;
    String callType;
    String sourceCountry;
    String destCountry;
    String fromAreaCode;
    String toAreaCode;
    double carrierReputation;
    boolean international;
    boolean hasCli;
    boolean cliValidated;

    @Override
    public EntityKind kind() {
        return EntityKind.CALL;
    }

    @Override
    public Map<String, Object> toFeatureMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("duration", duration.getSeconds());
        m.put("caller_reputation", callerReputation);
        m.put("callee_reputation", calleeReputation);
        m.put("time_of_day", timeOfDay);
        m.put("day_of_week", dayOfWeek);
        m.put("call_frequency", callFrequency);
        m.put("geographic_risk", geographicRisk);
        m.put("price_deviation", priceDeviation);
        m.put("call_type", callType);
        m.put("source_country", sourceCountry);
        m.put("dest_country", destCountry);
        m.put("from_area_code", fromAreaCode);
        m.put("to_area_code", toAreaCode);
        m.put("carrier_reputation", carrierReputation);
        m.put("is_international", international);
        m.put("has_cli", hasCli);
        m.put("cli_validated", cliValidated);
        return m;
    }
}
