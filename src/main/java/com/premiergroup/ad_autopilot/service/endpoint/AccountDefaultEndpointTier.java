package com.premiergroup.ad_autopilot.service.endpoint;

import com.premiergroup.ad_autopilot.entity.ContactEndpoint;
import com.premiergroup.ad_autopilot.repository.ContactEndpointRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
@Order(3)
@RequiredArgsConstructor
public class AccountDefaultEndpointTier implements EndpointTier {

    private final ContactEndpointRepository endpointRepository;

    @Override
    public String name() {
        return "account-default";
    }

    @Override
    public Optional<String> resolve(EndpointContext context) {
        return endpointRepository.findFirstByAccount_IdAndIsDefaultTrueAndIsActiveTrue(context.accountId())
                .map(ContactEndpoint::getValue);
    }
}
