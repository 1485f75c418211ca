package com.premiergroup.ad_autopilot.service.endpoint;

import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.entity.Directive;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Walks the endpoint tiers in order; the first tier with a non-blank value wins.
 * Empty is a valid outcome: the caller leaves the endpoint out entirely.
 */
@Service
@Log4j2
public class EndpointResolver {

    private final List<EndpointTier> tiers;

    public EndpointResolver(List<EndpointTier> tiers) {
        this.tiers = List.copyOf(tiers);
    }

    public Optional<String> resolveEndpoint(Directive directive, AdAccount account) {
        return resolve(EndpointContext.of(directive, account));
    }

    public Optional<String> resolve(EndpointContext context) {
        for (EndpointTier tier : tiers) {
            Optional<String> value = tier.resolve(context)
                    .map(String::trim)
                    .filter(v -> !v.isEmpty());
            if (value.isPresent()) {
                log.debug("Endpoint for directive {} resolved by tier {}", context.directiveId(), tier.name());
                return value;
            }
        }
        log.info("No contact endpoint found for directive {}", context.directiveId());
        return Optional.empty();
    }
}
