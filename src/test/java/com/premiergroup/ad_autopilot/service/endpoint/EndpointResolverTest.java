package com.premiergroup.ad_autopilot.service.endpoint;

import com.premiergroup.ad_autopilot.client.CampaignApiClient;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.entity.ContactEndpoint;
import com.premiergroup.ad_autopilot.entity.Directive;
import com.premiergroup.ad_autopilot.enums.ObjectiveType;
import com.premiergroup.ad_autopilot.exception.ExternalTransientException;
import com.premiergroup.ad_autopilot.repository.ContactEndpointRepository;
import com.premiergroup.ad_autopilot.util.ExternalCallGuard;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class EndpointResolverTest {

    @Mock
    private CampaignApiClient campaignApi;

    @Mock
    private ContactEndpointRepository endpointRepository;

    @Mock
    private ExternalCallGuard guard;

    private EndpointResolver resolver;
    private AdAccount account;
    private Directive directive;

    @BeforeEach
    void setUp() {
        lenient().when(guard.call(anyString(), any())).thenAnswer(inv -> ((Supplier<?>) inv.getArgument(1)).get());

        resolver = new EndpointResolver(List.of(
                new DirectiveEndpointTier(),
                new ProfileEndpointTier(campaignApi, guard),
                new AccountDefaultEndpointTier(endpointRepository),
                new LegacyEndpointTier()));

        account = AdAccount.builder().id(1L).name("Acme").customerId(111L).legacyContactEndpoint("Y").build();
        directive = Directive.builder().id(10L).name("Calls").objective(ObjectiveType.CALLS)
                .externalCampaignId("555").build();
    }

    @Test
    void accountDefaultWinsOverLegacyWhenNothingMoreSpecificExists() {
        when(campaignApi.findProfileEndpoint(111L, "555")).thenReturn(Optional.empty());
        when(endpointRepository.findFirstByAccount_IdAndIsDefaultTrueAndIsActiveTrue(1L))
                .thenReturn(Optional.of(ContactEndpoint.builder().value("X").isDefault(true).build()));

        assertThat(resolver.resolveEndpoint(directive, account)).contains("X");
    }

    @Test
    void directiveEndpointShortCircuitsTheCascade() {
        directive.setContactEndpoint(ContactEndpoint.builder().value("+15550001").isActive(true).build());

        assertThat(resolver.resolveEndpoint(directive, account)).contains("+15550001");

        verify(campaignApi, never()).findProfileEndpoint(anyLong(), anyString());
        verify(endpointRepository, never()).findFirstByAccount_IdAndIsDefaultTrueAndIsActiveTrue(any());
    }

    @Test
    void inactiveDirectiveEndpointIsIgnored() {
        directive.setContactEndpoint(ContactEndpoint.builder().value("+15550001").isActive(false).build());
        when(campaignApi.findProfileEndpoint(111L, "555")).thenReturn(Optional.of("+15550002"));

        assertThat(resolver.resolveEndpoint(directive, account)).contains("+15550002");
    }

    @Test
    void failedProfileLookupFallsThroughToNextTier() {
        when(campaignApi.findProfileEndpoint(111L, "555")).thenThrow(new ExternalTransientException("quota"));
        when(endpointRepository.findFirstByAccount_IdAndIsDefaultTrueAndIsActiveTrue(1L)).thenReturn(Optional.empty());

        assertThat(resolver.resolveEndpoint(directive, account)).contains("Y");
    }

    @Test
    void blankValuesDoNotCountAsFound() {
        when(campaignApi.findProfileEndpoint(111L, "555")).thenReturn(Optional.of("  "));
        when(endpointRepository.findFirstByAccount_IdAndIsDefaultTrueAndIsActiveTrue(1L)).thenReturn(Optional.empty());
        account.setLegacyContactEndpoint("");

        assertThat(resolver.resolveEndpoint(directive, account)).isEmpty();
    }

    @Test
    void sameInputsResolveToSameEndpoint() {
        when(campaignApi.findProfileEndpoint(111L, "555")).thenReturn(Optional.of("+15550003"));

        Optional<String> first = resolver.resolveEndpoint(directive, account);
        Optional<String> second = resolver.resolveEndpoint(directive, account);

        assertThat(first).contains("+15550003");
        assertThat(second).isEqualTo(first);
    }
}
