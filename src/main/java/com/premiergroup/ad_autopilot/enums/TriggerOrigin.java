package com.premiergroup.ad_autopilot.enums;

public enum TriggerOrigin {
    SCHEDULED,
    MANUAL,
    API
}
