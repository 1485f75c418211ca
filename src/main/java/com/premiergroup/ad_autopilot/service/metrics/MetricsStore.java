package com.premiergroup.ad_autopilot.service.metrics;

import com.premiergroup.ad_autopilot.dto.ExternalMetrics;
import com.premiergroup.ad_autopilot.entity.MetricSnapshot;
import com.premiergroup.ad_autopilot.repository.MetricSnapshotRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.RoundingMode;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Comparator;
import java.util.Map;
import java.util.Optional;
import java.util.function.BinaryOperator;
import java.util.stream.Collectors;

/**
 * Durable per-placement daily snapshots, keyed by (account, placement, day).
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class MetricsStore {

    private final MetricSnapshotRepository snapshotRepository;

    /**
     * Inserts or refreshes the snapshot for one day. A row whose day is already
     * followed by a later snapshot is left untouched and returned as is.
     */
    @Transactional
    public MetricSnapshot upsert(Long accountId, String placementId, LocalDate date,
                                 ExternalMetrics metrics, Instant fetchedAt) {

        // 1. Check if a snapshot for this date already exists
        Optional<MetricSnapshot> existingOpt =
                snapshotRepository.findByAccountIdAndPlacementIdAndStatsDate(accountId, placementId, date);

        if (existingOpt.isPresent()
                && snapshotRepository.existsByAccountIdAndPlacementIdAndStatsDateAfter(accountId, placementId, date)) {
            log.info("Snapshot {}/{}/{} is closed by a later day; ignoring refresh", accountId, placementId, date);
            return existingOpt.get();
        }

        // 2. If it exists, use it; otherwise create a new one
        MetricSnapshot snapshot = existingOpt.orElseGet(() -> MetricSnapshot.builder()
                .accountId(accountId)
                .placementId(placementId)
                .statsDate(date)
                .build());

        // 3. Populate counters and derived ratios
        snapshot.setImpressions(metrics.impressions());
        snapshot.setClicks(metrics.clicks());
        snapshot.setLinkClicks(metrics.linkClicks());
        snapshot.setConversions(metrics.conversions());
        snapshot.setSpend(metrics.spend().setScale(2, RoundingMode.HALF_UP));
        snapshot.setFetchedAt(fetchedAt);
        snapshot.recomputeDerived();

        return snapshotRepository.save(snapshot);
    }

    /**
     * Most recent snapshot per placement with a day inside {@code [from, to]}.
     */
    @Transactional(readOnly = true)
    public Map<String, MetricSnapshot> findLatest(Long accountId, Collection<String> placementIds,
                                                  LocalDate from, LocalDate to) {
        if (placementIds.isEmpty()) {
            return Map.of();
        }
        return snapshotRepository
                .findByAccountIdAndPlacementIdInAndStatsDateBetween(accountId, placementIds, from, to)
                .stream()
                .collect(Collectors.toMap(
                        MetricSnapshot::getPlacementId,
                        s -> s,
                        BinaryOperator.maxBy(Comparator.comparing(MetricSnapshot::getStatsDate))));
    }

    @Transactional
    public int purgeOlderThan(LocalDate cutoff) {
        int deleted = snapshotRepository.deleteOlderThan(cutoff);
        log.info("Deleted {} metric snapshots dated before {}", deleted, cutoff);
        return deleted;
    }
}
