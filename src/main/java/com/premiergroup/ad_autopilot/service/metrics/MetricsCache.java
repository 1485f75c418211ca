package com.premiergroup.ad_autopilot.service.metrics;

import com.premiergroup.ad_autopilot.client.ExternalMetricsReader;
import com.premiergroup.ad_autopilot.config.AutopilotProperties;
import com.premiergroup.ad_autopilot.dto.ExternalMetrics;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.entity.MetricSnapshot;
import com.premiergroup.ad_autopilot.exception.ExternalApiException;
import com.premiergroup.ad_autopilot.repository.AdAccountRepository;
import com.premiergroup.ad_autopilot.util.ExternalCallGuard;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.log4j.Log4j2;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-through cache over {@link MetricsStore}. A stored row is fresh when its
 * day falls within the freshness window ending at the as-of day; staleness is
 * counted in calendar days because the platform's own numbers lag.
 * <p>
 * Misses go to the platform in one call and are written back. A placement the
 * platform has no data for is stored as a zeroed snapshot. When that call
 * fails the missed placements are left out of the result: absent means unknown.
 */
@Service
@Log4j2
public class MetricsCache {

    private final MetricsStore store;
    private final ExternalMetricsReader reader;
    private final ExternalCallGuard guard;
    private final AdAccountRepository accountRepository;
    private final Clock clock;
    private final int freshnessDays;

    public MetricsCache(MetricsStore store,
                        ExternalMetricsReader reader,
                        ExternalCallGuard guard,
                        AdAccountRepository accountRepository,
                        Clock clock,
                        AutopilotProperties properties) {
        this.store = store;
        this.reader = reader;
        this.guard = guard;
        this.accountRepository = accountRepository;
        this.clock = clock;
        this.freshnessDays = properties.metrics().freshnessDays();
    }

    public Map<String, MetricSnapshot> getMetrics(Long accountId, Collection<String> placementIds, LocalDate asOfDate) {
        Set<String> requested = new LinkedHashSet<>(placementIds);
        if (requested.isEmpty()) {
            return Map.of();
        }

        LocalDate oldestAccepted = asOfDate.minusDays(freshnessDays - 1L);
        Map<String, MetricSnapshot> result = new HashMap<>(store.findLatest(accountId, requested, oldestAccepted, asOfDate));

        List<String> misses = requested.stream()
                .filter(id -> !result.containsKey(id))
                .toList();
        if (misses.isEmpty()) {
            log.debug("Metrics cache hit for all {} placements of account {}", requested.size(), accountId);
            return result;
        }

        AdAccount account = accountRepository.findById(accountId)
                .orElseThrow(() -> new EntityNotFoundException("Account not found: " + accountId));

        Map<String, ExternalMetrics> fetched;
        try {
            fetched = guard.call("metrics read for account " + accountId,
                    () -> reader.readPlacementMetrics(account.getCustomerId(), misses, asOfDate));
        } catch (ExternalApiException e) {
            log.warn("Metrics fallback failed for account {} ({} placements, {}): {}",
                    accountId, misses.size(), e.getErrorCode(), e.getMessage());
            return result;
        } catch (RuntimeException e) {
            log.error("Unexpected metrics fallback failure for account {} ({} placements)",
                    accountId, misses.size(), e);
            return result;
        }

        Instant now = clock.instant();
        for (String placementId : misses) {
            ExternalMetrics metrics = fetched.getOrDefault(placementId, ExternalMetrics.zero());
            try {
                result.put(placementId, store.upsert(accountId, placementId, asOfDate, metrics, now));
            } catch (DataAccessException e) {
                log.error("Could not store metrics for placement {} of account {}", placementId, accountId, e);
            }
        }

        log.info("Metrics for account {} on {}: {} cached, {} fetched", accountId, asOfDate,
                requested.size() - misses.size(), misses.size());
        return result;
    }
}
