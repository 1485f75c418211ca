package com.premiergroup.ad_autopilot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.premiergroup.ad_autopilot.enums.ObjectiveType;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Everything a scorer sees for one account and day. Placements without known
 * metrics are absent from {@code placements}; absence means unknown, not zero.
 */
public record ScoringBundle(
        Account account,
        @JsonProperty("as_of_date") LocalDate asOfDate,
        List<PlacementMetrics> placements,
        List<DirectiveSummary> directives,
        @JsonProperty("pool_state") List<PoolState> poolState
) {

    public record Account(Long id, String name) {
    }

    public record PlacementMetrics(
            @JsonProperty("placement_id") String placementId,
            @JsonProperty("directive_id") Long directiveId,
            @JsonProperty("stats_date") LocalDate statsDate,
            long impressions,
            long clicks,
            @JsonProperty("link_clicks") long linkClicks,
            long conversions,
            BigDecimal spend,
            BigDecimal ctr,
            BigDecimal cpm,
            BigDecimal cpl
    ) {
    }

    public record DirectiveSummary(
            Long id,
            String name,
            ObjectiveType objective,
            @JsonProperty("campaign_id") String externalCampaignId,
            @JsonProperty("daily_budget") BigDecimal dailyBudget,
            @JsonProperty("target_cpl") BigDecimal targetCostPerLead,
            @JsonProperty("placement_ids") List<String> placementIds,
            @JsonProperty("creative_refs") List<String> creativeRefs
    ) {
    }

    public record PoolState(
            @JsonProperty("directive_id") Long directiveId,
            @JsonProperty("idle_count") long idleCount,
            @JsonProperty("active_count") long activeCount
    ) {
    }
}
