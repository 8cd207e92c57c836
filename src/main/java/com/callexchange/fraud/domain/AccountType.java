package com.callexchange.fraud.domain;

public enum AccountType {
    BUYER,
    SELLER,
    ADMIN
}
