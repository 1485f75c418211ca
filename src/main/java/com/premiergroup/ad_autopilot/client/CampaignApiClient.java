package com.premiergroup.ad_autopilot.client;

import com.premiergroup.ad_autopilot.dto.AdCreationRequest;
import com.premiergroup.ad_autopilot.dto.ExternalPlacement;
import com.premiergroup.ad_autopilot.dto.PlacementSettings;

import java.util.Optional;

/**
 * Write and lookup operations against the campaign-management platform.
 * Methods that change state return the platform's response payload.
 * Failures surface as {@link com.premiergroup.ad_autopilot.exception.ExternalApiException}.
 * The platform does not deduplicate writes.
 */
public interface CampaignApiClient {

    ExternalPlacement getPlacement(long customerId, String placementId);

    /**
     * Contact endpoint published on the campaign itself, configured on the
     * platform side.
     */
    Optional<String> findProfileEndpoint(long customerId, String campaignId);

    String setCampaignEnabled(long customerId, String campaignId, boolean enabled);

    String setPlacementEnabled(long customerId, String placementId, boolean enabled);

    String setAdEnabled(long customerId, String placementId, String adId, boolean enabled);

    String updateCampaignBudget(long customerId, String campaignId, long amountMicros);

    /**
     * Applies the overrides and enables the placement.
     */
    String activatePlacement(long customerId, String campaignId, String placementId, PlacementSettings settings);

    /**
     * Pauses the placement and every ad inside it.
     */
    String pausePlacementWithChildren(long customerId, String placementId);

    String attachContactEndpoint(long customerId, String placementId, String endpoint);

    String createAd(long customerId, AdCreationRequest request);
}
