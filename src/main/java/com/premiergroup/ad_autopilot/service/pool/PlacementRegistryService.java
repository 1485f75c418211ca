package com.premiergroup.ad_autopilot.service.pool;

import com.premiergroup.ad_autopilot.client.CampaignApiClient;
import com.premiergroup.ad_autopilot.dto.ExternalPlacement;
import com.premiergroup.ad_autopilot.dto.PlacementSyncResult;
import com.premiergroup.ad_autopilot.dto.PlacementView;
import com.premiergroup.ad_autopilot.entity.Directive;
import com.premiergroup.ad_autopilot.entity.Placement;
import com.premiergroup.ad_autopilot.enums.PlacementStatus;
import com.premiergroup.ad_autopilot.exception.ExternalApiException;
import com.premiergroup.ad_autopilot.repository.DirectiveRepository;
import com.premiergroup.ad_autopilot.repository.PlacementRepository;
import com.premiergroup.ad_autopilot.util.ExternalCallGuard;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

/**
 * Registration of manually created placements into a directive's pool.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class PlacementRegistryService {

    private final DirectiveRepository directiveRepository;
    private final PlacementRepository placementRepository;
    private final CampaignApiClient campaignApi;
    private final ExternalCallGuard guard;
    private final Clock clock;

    /**
     * Registers an existing ad group as an Idle placement. It has to sit in the
     * directive's campaign and be paused there.
     */
    @Transactional
    public PlacementView link(Long directiveId, String externalPlacementId) {
        Directive directive = findDirective(directiveId);
        if (directive.getExternalCampaignId() == null) {
            throw new IllegalStateException("Directive " + directiveId + " has no external campaign yet");
        }

        Long accountId = directive.getAccount().getId();
        placementRepository.findFirstByDirective_Account_IdAndExternalId(accountId, externalPlacementId)
                .ifPresent(existing -> {
                    throw new IllegalStateException("Placement " + externalPlacementId + " is already registered");
                });

        long customerId = directive.getAccount().getCustomerId();
        ExternalPlacement external = guard.call("placement lookup " + externalPlacementId,
                () -> campaignApi.getPlacement(customerId, externalPlacementId));

        if (!directive.getExternalCampaignId().equals(external.campaignId())) {
            throw new IllegalArgumentException("Placement " + externalPlacementId + " belongs to campaign "
                    + external.campaignId() + ", not " + directive.getExternalCampaignId());
        }
        if (!external.isPaused()) {
            throw new IllegalStateException("Placement " + externalPlacementId
                    + " must be paused before it is linked, found " + external.status());
        }

        Placement saved = placementRepository.save(Placement.builder()
                .directive(directive)
                .externalId(external.id())
                .name(external.name())
                .externalStatus(external.status())
                .linkedAt(clock.instant())
                .build());

        log.info("Linked placement {} to directive {}", saved.getExternalId(), directiveId);
        return PlacementView.of(saved);
    }

    @Transactional(readOnly = true)
    public List<PlacementView> list(Long directiveId) {
        findDirective(directiveId);
        return placementRepository.findByDirective_IdOrderByStatusAscLinkedAtDesc(directiveId).stream()
                .map(PlacementView::of)
                .toList();
    }

    @Transactional
    public void unlink(Long directiveId, Long placementId) {
        Placement placement = placementRepository.findByIdAndDirective_Id(placementId, directiveId)
                .orElseThrow(() -> new EntityNotFoundException(
                        "Placement " + placementId + " not found in directive " + directiveId));
        if (placement.getStatus() == PlacementStatus.ACTIVE) {
            throw new IllegalStateException("Placement " + placement.getExternalId() + " is active; pause it first");
        }
        placementRepository.delete(placement);
        log.info("Unlinked placement {} from directive {}", placement.getExternalId(), directiveId);
    }

    /**
     * Refreshes name and observed platform status of every registered placement.
     */
    @Transactional
    public PlacementSyncResult sync(Long directiveId) {
        Directive directive = findDirective(directiveId);
        long customerId = directive.getAccount().getCustomerId();

        List<String> synced = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        for (Placement placement : placementRepository.findByDirective_IdOrderByStatusAscLinkedAtDesc(directiveId)) {
            try {
                ExternalPlacement external = guard.call("placement lookup " + placement.getExternalId(),
                        () -> campaignApi.getPlacement(customerId, placement.getExternalId()));
                placement.setName(external.name());
                placement.setExternalStatus(external.status());
                placementRepository.save(placement);
                synced.add(placement.getExternalId());
            } catch (ExternalApiException e) {
                log.warn("Sync of placement {} failed ({}): {}", placement.getExternalId(),
                        e.getErrorCode(), e.getMessage());
                failed.add(placement.getExternalId());
            }
        }
        log.info("Synced {} placements of directive {}, {} failed", synced.size(), directiveId, failed.size());
        return new PlacementSyncResult(synced, failed);
    }

    private Directive findDirective(Long directiveId) {
        return directiveRepository.findById(directiveId)
                .orElseThrow(() -> new EntityNotFoundException("Directive not found: " + directiveId));
    }
}
