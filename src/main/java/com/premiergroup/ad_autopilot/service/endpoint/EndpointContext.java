package com.premiergroup.ad_autopilot.service.endpoint;

import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.entity.ContactEndpoint;
import com.premiergroup.ad_autopilot.entity.Directive;
import com.premiergroup.ad_autopilot.enums.ObjectiveType;

/**
 * Detached view of what endpoint resolution needs, so tiers never touch lazy entity state.
 *
 * @param directiveEndpoint the directive's own endpoint when it is set and active
 */
public record EndpointContext(
        Long accountId,
        long customerId,
        Long directiveId,
        ObjectiveType objective,
        String campaignId,
        String directiveEndpoint,
        String legacyEndpoint
) {

    public static EndpointContext of(Directive directive, AdAccount account) {
        ContactEndpoint own = directive.getContactEndpoint();
        String directiveEndpoint = own != null && Boolean.TRUE.equals(own.getIsActive()) ? own.getValue() : null;
        return new EndpointContext(
                account.getId(),
                account.getCustomerId(),
                directive.getId(),
                directive.getObjective(),
                directive.getExternalCampaignId(),
                directiveEndpoint,
                account.getLegacyContactEndpoint());
    }
}
