package com.callexchange.fraud.domain;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A call routed through the exchange. Only the fields the fraud engine looks at are carried here;
 * the routing service owns the full call lifecycle.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class Call {

    String id;
    /** E.164 caller number, e.g. +14155550100. */
    String fromNumber;
    String toNumber;
    CallDirection direction;
    Instant startTime;
    /** Seconds; null while the call is still in progress. */
    Integer durationSeconds;
    /** Buyer who won the bid, or the originating account. */
    String buyerId;
    String sellerId;
    BigDecimal cost;
    String ipAddress;
}
