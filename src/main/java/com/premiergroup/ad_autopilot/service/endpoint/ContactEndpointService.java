package com.premiergroup.ad_autopilot.service.endpoint;

import com.premiergroup.ad_autopilot.dto.ContactEndpointRequest;
import com.premiergroup.ad_autopilot.dto.ContactEndpointView;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.entity.ContactEndpoint;
import com.premiergroup.ad_autopilot.repository.AdAccountRepository;
import com.premiergroup.ad_autopilot.repository.ContactEndpointRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Account-level contact endpoints. An account has at most one default, and
 * marking a new one clears the previous.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class ContactEndpointService {

    private final AdAccountRepository accountRepository;
    private final ContactEndpointRepository endpointRepository;

    @Transactional
    public ContactEndpointView add(Long accountId, ContactEndpointRequest request) {
        AdAccount account = accountRepository.findById(accountId)
                .orElseThrow(() -> new EntityNotFoundException("Account not found: " + accountId));
        String value = request.value().trim();
        if (endpointRepository.existsByAccount_IdAndValue(accountId, value)) {
            throw new IllegalStateException("Endpoint " + value + " already exists for account " + accountId);
        }

        if (request.isDefault()) {
            clearDefault(accountId);
        }
        ContactEndpoint saved = endpointRepository.save(ContactEndpoint.builder()
                .account(account)
                .value(value)
                .label(request.label())
                .isDefault(request.isDefault())
                .build());

        log.info("Added contact endpoint {} to account {}{}", saved.getId(), accountId,
                request.isDefault() ? " as default" : "");
        return ContactEndpointView.of(saved);
    }

    @Transactional(readOnly = true)
    public List<ContactEndpointView> list(Long accountId) {
        return endpointRepository.findByAccount_IdOrderByIdAsc(accountId).stream()
                .map(ContactEndpointView::of)
                .toList();
    }

    @Transactional
    public ContactEndpointView markDefault(Long accountId, Long endpointId) {
        ContactEndpoint endpoint = find(accountId, endpointId);
        if (!Boolean.TRUE.equals(endpoint.getIsActive())) {
            throw new IllegalStateException("Endpoint " + endpointId + " is inactive and cannot be the default");
        }
        clearDefault(accountId);
        endpoint.setIsDefault(true);
        log.info("Endpoint {} is now the default of account {}", endpointId, accountId);
        return ContactEndpointView.of(endpointRepository.save(endpoint));
    }

    /**
     * Soft delete: directives may still reference the row, resolution ignores it.
     */
    @Transactional
    public void deactivate(Long accountId, Long endpointId) {
        ContactEndpoint endpoint = find(accountId, endpointId);
        endpoint.setIsActive(false);
        endpoint.setIsDefault(false);
        endpointRepository.save(endpoint);
        log.info("Deactivated endpoint {} of account {}", endpointId, accountId);
    }

    private void clearDefault(Long accountId) {
        endpointRepository.findByAccount_IdAndIsDefaultTrue(accountId).forEach(previous -> {
            previous.setIsDefault(false);
            endpointRepository.saveAndFlush(previous);
        });
    }

    private ContactEndpoint find(Long accountId, Long endpointId) {
        return endpointRepository.findByIdAndAccount_Id(endpointId, accountId)
                .orElseThrow(() -> new EntityNotFoundException(
                        "Endpoint " + endpointId + " not found for account " + accountId));
    }
}
