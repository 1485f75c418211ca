package com.premiergroup.ad_autopilot.enums;

public enum PlacementStatus {
    IDLE,
    ACTIVE,
    RETIRED
}
