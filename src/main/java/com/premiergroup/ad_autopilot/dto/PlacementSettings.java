package com.premiergroup.ad_autopilot.dto;

/**
 * Overrides applied when a placement is activated. Null fields keep the
 * values already set on the ad platform.
 */
public record PlacementSettings(Long dailyBudgetMicros, Long cpcBidMicros) {

    public static PlacementSettings none() {
        return new PlacementSettings(null, null);
    }
}
