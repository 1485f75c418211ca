package com.premiergroup.ad_autopilot.enums;

public enum BatchStatus {
    PENDING,
    VALIDATED,
    APPLIED,
    PARTIALLY_FAILED,
    REJECTED;

    public boolean isTerminal() {
        return this == APPLIED || this == PARTIALLY_FAILED || this == REJECTED;
    }
}
