package com.callexchange.fraud.risk.signal;

import lombok.Value;

@Value
public class DenylistMatch {

    private static final DenylistMatch CLEAR = new DenylistMatch(false, null);

    boolean listed;
    String reason;

    public static DenylistMatch clear() {
        return CLEAR;
    }

    public static DenylistMatch listed(String reason) {
        return new DenylistMatch(true, reason);
    }
}
