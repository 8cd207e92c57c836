package com.callexchange.fraud.risk.signal;

/**
 * Membership query against the platform denylist. The engine only reads from it.
 */
public interface DenylistChecker {

    /**
     * @param identifier     the value to look up, e.g. an E.164 number or an email address
     * @param identifierKind "phone" or "email"
     */
    DenylistMatch check(String identifier, String identifierKind);
}
