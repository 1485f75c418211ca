package com.premiergroup.ad_autopilot.service.pool;

import com.premiergroup.ad_autopilot.client.CampaignApiClient;
import com.premiergroup.ad_autopilot.config.AutopilotProperties;
import com.premiergroup.ad_autopilot.dto.PlacementSettings;
import com.premiergroup.ad_autopilot.dto.ScoringBundle;
import com.premiergroup.ad_autopilot.entity.Placement;
import com.premiergroup.ad_autopilot.enums.PlacementStatus;
import com.premiergroup.ad_autopilot.exception.ExternalTimeoutException;
import com.premiergroup.ad_autopilot.repository.PlacementRepository;
import com.premiergroup.ad_autopilot.util.ExternalCallGuard;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Pre-provisioned placements of a directive, handed out least used first.
 * <p>
 * {@link #acquire} runs under a per-directive lock and reserves the chosen
 * placement with a fresh token. While the launch that holds the token is
 * running in this process the placement is never handed out again, however
 * long activation takes; the lease only frees reservations whose holder is
 * gone. State only moves to Active after the platform accepted the
 * activation and the token still matches.
 */
@Service
@Log4j2
public class PlacementPool {

    private static final int LOCK_STRIPES = 64;

    private final PlacementRepository placementRepository;
    private final CampaignApiClient campaignApi;
    private final ExternalCallGuard guard;
    private final TransactionTemplate tx;
    private final Clock clock;
    private final Duration reservationLease;

    private final ReentrantLock[] directiveLocks = new ReentrantLock[LOCK_STRIPES];

    /** Reservation token by placement id, for launches still running here. */
    private final ConcurrentMap<Long, String> launchesInFlight = new ConcurrentHashMap<>();

    public PlacementPool(PlacementRepository placementRepository,
                         CampaignApiClient campaignApi,
                         ExternalCallGuard guard,
                         PlatformTransactionManager transactionManager,
                         Clock clock,
                         AutopilotProperties properties) {
        this.placementRepository = placementRepository;
        this.campaignApi = campaignApi;
        this.guard = guard;
        this.tx = new TransactionTemplate(transactionManager);
        this.clock = clock;
        this.reservationLease = properties.pool().reservationLease();
        for (int i = 0; i < LOCK_STRIPES; i++) {
            directiveLocks[i] = new ReentrantLock();
        }
    }

    /**
     * Reserves the Idle placement with the lowest usage count, oldest last use
     * breaking ties. Empty when the directive has nothing left to hand out.
     */
    public Optional<Placement> acquire(Long directiveId) {
        ReentrantLock lock = lockFor(directiveId);
        lock.lock();
        try {
            Placement reserved = tx.execute(status -> {
                Instant now = clock.instant();
                return placementRepository.findAllocatable(directiveId, now.minus(reservationLease)).stream()
                        .filter(p -> !launchesInFlight.containsKey(p.getId()))
                        .findFirst()
                        .map(p -> {
                            p.reserve(now, UUID.randomUUID().toString());
                            return placementRepository.saveAndFlush(p);
                        })
                        .orElse(null);
            });
            if (reserved == null) {
                log.warn("Placement pool of directive {} is exhausted", directiveId);
                return Optional.empty();
            }
            launchesInFlight.put(reserved.getId(), reserved.getReservationToken());
            log.info("Reserved placement {} for directive {}", reserved.getExternalId(), directiveId);
            return Optional.of(reserved);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies the settings on the platform, then flips the placement to Active.
     * Refused before any platform call when the reservation was taken over.
     * On failure the placement stays Idle and the error propagates; the
     * reservation is kept after a timeout because the platform may have
     * enabled the placement anyway.
     */
    public String activate(long customerId, String campaignId, Placement placement, PlacementSettings settings) {
        String token = placement.getReservationToken();
        confirmReservation(placement, token);

        String payload;
        try {
            payload = guard.call("activate placement " + placement.getExternalId(),
                    () -> campaignApi.activatePlacement(customerId, campaignId, placement.getExternalId(), settings));
        } catch (ExternalTimeoutException e) {
            launchesInFlight.remove(placement.getId(), token);
            update(placement.getId(), p -> {
                if (p.isReservedBy(token)) {
                    p.setReservedAt(clock.instant());
                }
            });
            log.warn("Activation of placement {} timed out; left reserved until the lease expires",
                    placement.getExternalId());
            throw e;
        } catch (RuntimeException e) {
            release(placement);
            throw e;
        }

        try {
            update(placement.getId(), p -> {
                if (!p.isReservedBy(token)) {
                    throw new IllegalStateException("Placement " + p.getExternalId()
                            + " was reserved by another launch while it was being activated");
                }
                p.markActive();
            });
        } finally {
            launchesInFlight.remove(placement.getId(), token);
        }
        log.info("Placement {} is active", placement.getExternalId());
        return payload;
    }

    public void recordUse(Placement placement) {
        Instant now = clock.instant();
        update(placement.getId(), p -> p.recordUse(now));
    }

    /**
     * Drops a reservation taken by {@link #acquire} without activating.
     */
    public void release(Placement placement) {
        String token = placement.getReservationToken();
        launchesInFlight.remove(placement.getId(), token);
        update(placement.getId(), p -> {
            if (p.isReservedBy(token)) {
                p.clearReservation();
            }
        });
    }

    /**
     * Pauses the placement and its ads on the platform, then returns it to Idle.
     */
    public String deactivate(long customerId, Placement placement) {
        if (placement.getStatus() != PlacementStatus.ACTIVE) {
            throw new IllegalStateException("Placement " + placement.getExternalId() + " is not active");
        }
        String payload = guard.call("pause placement " + placement.getExternalId(),
                () -> campaignApi.pausePlacementWithChildren(customerId, placement.getExternalId()));
        update(placement.getId(), Placement::markIdle);
        log.info("Placement {} returned to the pool", placement.getExternalId());
        return payload;
    }

    /**
     * Pauses the placement and its ads on the platform, then retires it for good.
     */
    public String retire(long customerId, Placement placement) {
        if (placement.getStatus() == PlacementStatus.RETIRED) {
            throw new IllegalStateException("Placement " + placement.getExternalId() + " is already retired");
        }
        String payload = guard.call("retire placement " + placement.getExternalId(),
                () -> campaignApi.pausePlacementWithChildren(customerId, placement.getExternalId()));
        update(placement.getId(), Placement::markRetired);
        log.info("Placement {} retired", placement.getExternalId());
        return payload;
    }

    public ScoringBundle.PoolState poolState(Long directiveId) {
        return new ScoringBundle.PoolState(directiveId,
                placementRepository.countByDirective_IdAndStatus(directiveId, PlacementStatus.IDLE),
                placementRepository.countByDirective_IdAndStatus(directiveId, PlacementStatus.ACTIVE));
    }

    /**
     * Renews the lease of a reservation right before activation, under the
     * same lock {@link #acquire} takes.
     */
    private void confirmReservation(Placement placement, String token) {
        ReentrantLock lock = lockFor(placement.getDirective().getId());
        lock.lock();
        try {
            update(placement.getId(), p -> {
                if (!p.isReservedBy(token)) {
                    throw new IllegalStateException("Reservation of placement " + p.getExternalId()
                            + " is no longer held by this launch");
                }
                p.setReservedAt(clock.instant());
            });
        } catch (IllegalStateException e) {
            launchesInFlight.remove(placement.getId(), token);
            throw e;
        } finally {
            lock.unlock();
        }
    }

    private ReentrantLock lockFor(Long directiveId) {
        return directiveLocks[Math.floorMod(directiveId.hashCode(), LOCK_STRIPES)];
    }

    private void update(Long placementId, Consumer<Placement> change) {
        tx.executeWithoutResult(status -> {
            Placement p = placementRepository.findById(placementId)
                    .orElseThrow(() -> new EntityNotFoundException("Placement not found: " + placementId));
            change.accept(p);
            placementRepository.save(p);
        });
    }
}
