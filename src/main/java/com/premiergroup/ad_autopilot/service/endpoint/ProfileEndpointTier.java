package com.premiergroup.ad_autopilot.service.endpoint;

import com.premiergroup.ad_autopilot.client.CampaignApiClient;
import com.premiergroup.ad_autopilot.exception.ExternalApiException;
import com.premiergroup.ad_autopilot.util.ExternalCallGuard;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Endpoint published on the campaign itself on the ad platform. A failed
 * lookup counts as nothing found.
 */
@Component
@Order(2)
@Log4j2
@RequiredArgsConstructor
public class ProfileEndpointTier implements EndpointTier {

    private final CampaignApiClient campaignApi;
    private final ExternalCallGuard guard;

    @Override
    public String name() {
        return "profile";
    }

    @Override
    public Optional<String> resolve(EndpointContext context) {
        if (context.campaignId() == null) {
            return Optional.empty();
        }
        try {
            return guard.call("profile endpoint lookup for campaign " + context.campaignId(),
                    () -> campaignApi.findProfileEndpoint(context.customerId(), context.campaignId()));
        } catch (ExternalApiException e) {
            log.warn("Profile endpoint lookup failed for directive {} ({}): {}",
                    context.directiveId(), e.getErrorCode(), e.getMessage());
            return Optional.empty();
        }
    }
}
