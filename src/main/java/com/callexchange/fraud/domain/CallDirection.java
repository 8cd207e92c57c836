package com.callexchange.fraud.domain;

public enum CallDirection {
    INBOUND,
    OUTBOUND
}
