package com.premiergroup.ad_autopilot.service.endpoint;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(1)
public class DirectiveEndpointTier implements EndpointTier {

    @Override
    public String name() {
        return "directive";
    }

    @Override
    public Optional<String> resolve(EndpointContext context) {
        return Optional.ofNullable(context.directiveEndpoint());
    }
}
