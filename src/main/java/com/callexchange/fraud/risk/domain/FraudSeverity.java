package com.callexchange.fraud.risk.domain;

/**
 * Severity tier of a single flag. Informational; the decision is driven by the numeric score.
 */
public enum FraudSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
