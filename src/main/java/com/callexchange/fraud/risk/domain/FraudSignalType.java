package com.callexchange.fraud.risk.domain;

/**
 * Source of a fraud flag. One flag is raised per triggered signal.
 */
public enum FraudSignalType {
    /** Identifier found on the denylist. Conclusive; ends the evaluation. */
    BLACKLIST,
    /** Too many actions for the entity inside the configured window. */
    VELOCITY,
    /** Classifier probability above the anomaly threshold. */
    ML_ANOMALY,
    /** Rule match or built-in heuristic (email domain, phone format, bid amount, history). */
    PATTERN
}
