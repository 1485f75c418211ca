package com.premiergroup.ad_autopilot.service.endpoint;

import com.premiergroup.ad_autopilot.AutopilotIntegrationTest;
import com.premiergroup.ad_autopilot.dto.ContactEndpointRequest;
import com.premiergroup.ad_autopilot.dto.ContactEndpointView;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import jakarta.persistence.EntityNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContactEndpointServiceTest extends AutopilotIntegrationTest {

    @Autowired
    private ContactEndpointService service;

    private AdAccount account;

    @BeforeEach
    void setUp() {
        account = account("Acme", 1234L);
    }

    @Test
    void newDefaultReplacesThePreviousOne() {
        ContactEndpointView first = service.add(account.getId(), new ContactEndpointRequest("+15550001111", "Main", true));
        ContactEndpointView second = service.add(account.getId(), new ContactEndpointRequest("+15550002222", "Sales", true));

        assertThat(service.list(account.getId()))
                .filteredOn(ContactEndpointView::isDefault)
                .extracting(ContactEndpointView::id)
                .containsExactly(second.id());

        service.markDefault(account.getId(), first.id());

        assertThat(service.list(account.getId()))
                .filteredOn(ContactEndpointView::isDefault)
                .extracting(ContactEndpointView::value)
                .containsExactly("+15550001111");
    }

    @Test
    void duplicateValueIsRefused() {
        service.add(account.getId(), new ContactEndpointRequest("+15550001111", null, false));

        assertThatThrownBy(() -> service.add(account.getId(), new ContactEndpointRequest(" +15550001111 ", null, false)))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void deactivatedEndpointIsNoLongerResolvableAsDefault() {
        ContactEndpointView endpoint = service.add(account.getId(), new ContactEndpointRequest("+15550001111", null, true));

        service.deactivate(account.getId(), endpoint.id());

        assertThat(endpointRepository.findFirstByAccount_IdAndIsDefaultTrueAndIsActiveTrue(account.getId())).isEmpty();
        assertThatThrownBy(() -> service.markDefault(account.getId(), endpoint.id()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void endpointOfAnotherAccountIsNotFound() {
        AdAccount other = account("Globex", 9876L);
        ContactEndpointView foreign = service.add(other.getId(), new ContactEndpointRequest("+15550003333", null, false));

        assertThatThrownBy(() -> service.markDefault(account.getId(), foreign.id()))
                .isInstanceOf(EntityNotFoundException.class);
    }
}
