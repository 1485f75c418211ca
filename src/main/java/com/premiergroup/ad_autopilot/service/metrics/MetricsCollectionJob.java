package com.premiergroup.ad_autopilot.service.metrics;

import com.premiergroup.ad_autopilot.client.ExternalMetricsReader;
import com.premiergroup.ad_autopilot.config.AutopilotProperties;
import com.premiergroup.ad_autopilot.dto.ExternalMetrics;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.entity.Placement;
import com.premiergroup.ad_autopilot.enums.PlacementStatus;
import com.premiergroup.ad_autopilot.repository.AdAccountRepository;
import com.premiergroup.ad_autopilot.repository.PlacementRepository;
import com.premiergroup.ad_autopilot.util.ExternalCallGuard;
import lombok.extern.log4j.Log4j2;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Daily pull of yesterday's and today's placement metrics into the store,
 * plus the retention sweep.
 */
@Service
@Log4j2
public class MetricsCollectionJob {

    private final AdAccountRepository accountRepository;
    private final PlacementRepository placementRepository;
    private final ExternalMetricsReader reader;
    private final ExternalCallGuard guard;
    private final MetricsStore store;
    private final Clock clock;
    private final int retentionDays;

    public MetricsCollectionJob(AdAccountRepository accountRepository,
                                PlacementRepository placementRepository,
                                ExternalMetricsReader reader,
                                ExternalCallGuard guard,
                                MetricsStore store,
                                Clock clock,
                                AutopilotProperties properties) {
        this.accountRepository = accountRepository;
        this.placementRepository = placementRepository;
        this.reader = reader;
        this.guard = guard;
        this.store = store;
        this.clock = clock;
        this.retentionDays = properties.metrics().retentionDays();
    }

    @Scheduled(cron = "${autopilot.schedule.metrics-cron:0 30 5 * * *}", zone = "${autopilot.schedule.zone:UTC}")
    public void dailyMetricsSync() {
        LocalDate today = LocalDate.now(clock);
        log.info("Starting scheduled metrics sync for {}", today);

        for (AdAccount account : accountRepository.findByAutopilotEnabledTrue()) {
            try {
                // yesterday first: writing today closes it
                collect(account, today.minusDays(1));
                collect(account, today);
            } catch (Exception ex) {
                log.error("Metrics sync failed for account {}", account.getId(), ex);
            }
        }
        log.info("Completed scheduled metrics sync for {}", today);
    }

    @Scheduled(cron = "${autopilot.schedule.retention-cron:0 0 3 * * SUN}", zone = "${autopilot.schedule.zone:UTC}")
    public void purgeExpiredSnapshots() {
        store.purgeOlderThan(LocalDate.now(clock).minusDays(retentionDays));
    }

    /**
     * Fetches and stores one day for every registered, non-retired placement of the account.
     *
     * @return number of snapshots written
     */
    public int collect(AdAccount account, LocalDate date) {
        List<String> placementIds = placementRepository.findByDirective_Account_Id(account.getId()).stream()
                .filter(p -> p.getStatus() != PlacementStatus.RETIRED)
                .map(Placement::getExternalId)
                .distinct()
                .toList();
        if (placementIds.isEmpty()) {
            return 0;
        }

        Map<String, ExternalMetrics> fetched = guard.call("metrics sync for account " + account.getId(),
                () -> reader.readPlacementMetrics(account.getCustomerId(), placementIds, date));

        Instant now = clock.instant();
        placementIds.forEach(id -> store.upsert(account.getId(), id, date,
                fetched.getOrDefault(id, ExternalMetrics.zero()), now));

        log.info("Stored {} snapshots for account {} on {}", placementIds.size(), account.getId(), date);
        return placementIds.size();
    }
}
