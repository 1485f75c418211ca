package com.premiergroup.ad_autopilot.service.pool;

import com.premiergroup.ad_autopilot.AutopilotIntegrationTest;
import com.premiergroup.ad_autopilot.dto.ExternalPlacement;
import com.premiergroup.ad_autopilot.dto.PlacementSyncResult;
import com.premiergroup.ad_autopilot.dto.PlacementView;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.entity.Directive;
import com.premiergroup.ad_autopilot.entity.Placement;
import com.premiergroup.ad_autopilot.enums.ObjectiveType;
import com.premiergroup.ad_autopilot.enums.PlacementStatus;
import com.premiergroup.ad_autopilot.exception.ExternalRejectedException;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.context.annotation.Primary;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Import(PlacementRegistryServiceTest.FixedClock.class)
class PlacementRegistryServiceTest extends AutopilotIntegrationTest {

    private static final long CUSTOMER = 1234L;
    private static final Instant LINKED_AT = Instant.parse("2024-05-01T09:30:00Z");

    @TestConfiguration
    static class FixedClock {

        @Bean
        @Primary
        Clock fixedClock() {
            return Clock.fixed(LINKED_AT, ZoneOffset.UTC);
        }
    }

    @Autowired
    private PlacementRegistryService registry;

    private AdAccount account;
    private Directive directive;

    @BeforeEach
    void setUp() {
        account = account("Acme", CUSTOMER);
        directive = directive(account, "555", ObjectiveType.MESSAGES);
    }

    @Test
    void linksPausedAdGroupOfTheDirectivesCampaign() {
        when(campaignApi.getPlacement(CUSTOMER, "101"))
                .thenReturn(new ExternalPlacement("101", "Ad group A", "555", "PAUSED"));

        PlacementView view = registry.link(directive.getId(), "101");

        assertThat(view.externalId()).isEqualTo("101");
        assertThat(view.status()).isEqualTo(PlacementStatus.IDLE);
        assertThat(view.usageCount()).isZero();
        assertThat(view.linkedAt()).isEqualTo(LINKED_AT);
        assertThat(registry.list(directive.getId())).extracting(PlacementView::externalId).containsExactly("101");
    }

    @Test
    void refusesAdGroupFromAnotherCampaign() {
        when(campaignApi.getPlacement(CUSTOMER, "101"))
                .thenReturn(new ExternalPlacement("101", "Ad group A", "777", "PAUSED"));

        assertThatThrownBy(() -> registry.link(directive.getId(), "101"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("777");
        assertThat(placementRepository.count()).isZero();
    }

    @Test
    void refusesEnabledAdGroup() {
        when(campaignApi.getPlacement(CUSTOMER, "101"))
                .thenReturn(new ExternalPlacement("101", "Ad group A", "555", "ENABLED"));

        assertThatThrownBy(() -> registry.link(directive.getId(), "101"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("paused");
    }

    @Test
    void refusesPlacementRegisteredElsewhereInTheAccount() {
        Directive other = directive(account, "556", ObjectiveType.MESSAGES);
        idle(other, "101");

        assertThatThrownBy(() -> registry.link(directive.getId(), "101"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already registered");
        verify(campaignApi, never()).getPlacement(anyLong(), anyString());
    }

    @Test
    void unknownDirectiveIsNotFound() {
        assertThatThrownBy(() -> registry.list(-1L)).isInstanceOf(EntityNotFoundException.class);
    }

    @Test
    void activePlacementCannotBeUnlinked() {
        Placement active = placement(directive, "101", PlacementStatus.ACTIVE, 1, null);
        Placement idle = idle(directive, "102");

        assertThatThrownBy(() -> registry.unlink(directive.getId(), active.getId()))
                .isInstanceOf(IllegalStateException.class);

        registry.unlink(directive.getId(), idle.getId());
        assertThat(placementRepository.findById(idle.getId())).isEmpty();
        assertThat(placementRepository.findById(active.getId())).isPresent();
    }

    @Test
    void syncRefreshesObservedStatusAndReportsFailures() {
        idle(directive, "101");
        idle(directive, "102");
        when(campaignApi.getPlacement(CUSTOMER, "101"))
                .thenReturn(new ExternalPlacement("101", "Renamed", "555", "PAUSED"));
        when(campaignApi.getPlacement(CUSTOMER, "102"))
                .thenThrow(new ExternalRejectedException("RESOURCE_NOT_FOUND"));

        PlacementSyncResult result = registry.sync(directive.getId());

        assertThat(result.synced()).containsExactly("101");
        assertThat(result.failed()).containsExactly("102");
        assertThat(placementRepository.findByDirective_IdAndExternalId(directive.getId(), "101"))
                .get()
                .satisfies(p -> {
                    assertThat(p.getName()).isEqualTo("Renamed");
                    assertThat(p.getExternalStatus()).isEqualTo("PAUSED");
                });
    }
}
