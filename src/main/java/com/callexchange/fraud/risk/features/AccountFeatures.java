package com.callexchange.fraud.risk.features;

import com.callexchange.fraud.risk.domain.EntityKind;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class AccountFeatures implements FeatureBag {

    Duration accountAge;
    /** Days since the last login, -1 when the account never logged in. */
    long daysSinceLastLogin;
    String accountType;
    String accountStatus;
    String emailDomain;
    boolean disposableEmail;
    boolean validPhone;
    String phoneCountry;
    double qualityScore;
    /** Share of the consent flags (TCPA, GDPR) that are granted, 0.0–1.0. */
    double complianceScore;
    double balance;

    @Override
    public EntityKind kind() {
        return EntityKind.ACCOUNT;
    }

    @Override
    public Map<String, Object> toFeatureMap() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("account_age", accountAge.toDays());
        m.put("days_since_last_login", daysSinceLastLogin);
        m.put("account_type", accountType);
        m.put("account_status", accountStatus);
        m.put("email_domain", emailDomain);
        m.put("disposable_email", disposableEmail);
        m.put("valid_phone", validPhone);
        m.put("phone_country", phoneCountry);
        m.put("quality_score", qualityScore);
        m.put("compliance_score", complianceScore);
        m.put("balance", balance);
        return m;
    }
}
