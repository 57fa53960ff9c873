package com.yieldvault.domain.enums;

public enum RequestType {
    DEPOSIT,
    REDEEM
}
