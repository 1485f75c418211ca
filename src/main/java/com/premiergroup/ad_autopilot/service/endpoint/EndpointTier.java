package com.premiergroup.ad_autopilot.service.endpoint;

import java.util.Optional;

/**
 * One source in the endpoint fallback cascade. Tiers are ordered with
 * {@link org.springframework.core.annotation.Order}.
 */
public interface EndpointTier {

    String name();

    Optional<String> resolve(EndpointContext context);
}
