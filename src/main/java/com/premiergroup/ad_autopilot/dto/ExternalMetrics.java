package com.premiergroup.ad_autopilot.dto;

import java.math.BigDecimal;

/**
 * Raw daily counters for one placement as reported by the ad platform.
 */
public record ExternalMetrics(
        long impressions,
        long clicks,
        long linkClicks,
        long conversions,
        BigDecimal spend
) {

    public static ExternalMetrics zero() {
        return new ExternalMetrics(0, 0, 0, 0, BigDecimal.ZERO);
    }
}
