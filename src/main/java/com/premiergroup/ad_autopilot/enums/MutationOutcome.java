package com.premiergroup.ad_autopilot.enums;

public enum MutationOutcome {
    SUCCESS,
    FAILED,
    SKIPPED
}
