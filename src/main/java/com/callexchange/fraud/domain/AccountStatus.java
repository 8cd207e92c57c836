package com.callexchange.fraud.domain;

public enum AccountStatus {
    PENDING,
    ACTIVE,
    SUSPENDED,
    BANNED,
    CLOSED
}
