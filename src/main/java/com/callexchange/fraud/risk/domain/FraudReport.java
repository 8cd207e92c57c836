package com.callexchange.fraud.risk.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.time.Instant;
import java.util.Map;

/**
 * Report of fraud on an entity, usually filed by an operator after investigation.
 */
@Value
@Builder(toBuilder = true)
@Jacksonized
public class FraudReport {

    public static final String TYPE_CONFIRMED = "confirmed";

    String id;
    String entityId;
    EntityKind entityKind;
    Instant reportedAt;
    String reportedBy;
    /** e.g. "confirmed", "suspected", "chargeback". */
    String fraudType;
    String description;
    Map<String, Object> evidence;
    String actionTaken;
    Status status;

    @JsonIgnore
    public boolean isConfirmed() {
        return TYPE_CONFIRMED.equalsIgnoreCase(fraudType);
    }

    public enum Status {
        PENDING, CONFIRMED, FALSE_POSITIVE
    }
}
