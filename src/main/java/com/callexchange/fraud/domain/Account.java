package com.callexchange.fraud.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Buyer or seller account as seen by the fraud engine.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Account {

    String id;
    String email;
    String name;
    AccountType type;
    AccountStatus status;
    String phoneNumber;
    /** 0-100; below 50 is considered low quality. */
    double qualityScore;
    BigDecimal balance;
    BigDecimal maxBidAmount;
    boolean tcpaConsent;
    boolean gdprConsent;
    Instant createdAt;
    Instant lastLoginAt;
}
