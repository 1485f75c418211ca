package com.premiergroup.ad_autopilot.enums;

public enum MutationType {
    PAUSE_CAMPAIGN,
    RESUME_CAMPAIGN,
    PAUSE_PLACEMENT,
    RESUME_PLACEMENT,
    PAUSE_AD,
    RESUME_AD,
    UPDATE_CAMPAIGN_BUDGET,
    LAUNCH_IN_PLACEMENT,
    RETIRE_PLACEMENT
}
