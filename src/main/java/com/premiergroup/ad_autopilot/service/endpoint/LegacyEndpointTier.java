package com.premiergroup.ad_autopilot.service.endpoint;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(4)
public class LegacyEndpointTier implements EndpointTier {

    @Override
    public String name() {
        return "legacy";
    }

    @Override
    public Optional<String> resolve(EndpointContext context) {
        return Optional.ofNullable(context.legacyEndpoint());
    }
}
