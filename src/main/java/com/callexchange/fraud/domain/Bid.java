package com.callexchange.fraud.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A buyer's bid on a seller's call.
 */
@Value
@Builder
@Jacksonized
public class Bid {

    String id;
    String callId;
    String auctionId;
    String buyerId;
    String sellerId;
    /** Amount the buyer is willing to pay per call. */
    BigDecimal amount;
    String currencyCode;
    Instant auctionStartedAt;
    Instant placedAt;
    Instant expiresAt;
}
