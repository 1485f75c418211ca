package com.premiergroup.ad_autopilot.client.google;

import com.google.ads.googleads.lib.GoogleAdsClient;
import com.google.ads.googleads.v20.common.Metrics;
import com.google.ads.googleads.v20.services.GoogleAdsRow;
import com.premiergroup.ad_autopilot.client.ExternalMetricsReader;
import com.premiergroup.ad_autopilot.config.AutopilotProperties;
import com.premiergroup.ad_autopilot.dto.ExternalMetrics;
import com.premiergroup.ad_autopilot.exception.ExternalTransientException;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.stream.Collectors;

/**
 * Daily ad group metrics via GAQL. Large id lists are split into chunks that
 * are queried in parallel on the metrics fetch pool; the result is all or nothing.
 */
@Service
@Log4j2
@ConditionalOnProperty(name = "google.ads.enabled", havingValue = "true", matchIfMissing = true)
public class GoogleAdsMetricsReader implements ExternalMetricsReader {

    private static final DateTimeFormatter fmt = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    private final GoogleAdsClient googleAdsClient;
    private final ExecutorService metricsFetchExecutor;
    private final int chunkSize;

    public GoogleAdsMetricsReader(GoogleAdsClient googleAdsClient,
                                  @Qualifier("metricsFetchExecutor") ExecutorService metricsFetchExecutor,
                                  AutopilotProperties properties) {
        this.googleAdsClient = googleAdsClient;
        this.metricsFetchExecutor = metricsFetchExecutor;
        this.chunkSize = properties.metrics().fallbackChunkSize();
    }

    @Override
    public Map<String, ExternalMetrics> readPlacementMetrics(long customerId, Collection<String> placementIds,
                                                             LocalDate date) {
        if (placementIds.isEmpty()) {
            return Map.of();
        }

        List<String> ids = placementIds.stream().distinct().toList();
        List<CompletableFuture<Map<String, ExternalMetrics>>> chunks = new ArrayList<>();
        for (int from = 0; from < ids.size(); from += chunkSize) {
            List<String> chunk = ids.subList(from, Math.min(from + chunkSize, ids.size()));
            chunks.add(CompletableFuture.supplyAsync(
                    () -> readChunk(customerId, chunk, date), metricsFetchExecutor));
        }

        Map<String, ExternalMetrics> result = new HashMap<>();
        try {
            chunks.forEach(f -> result.putAll(f.join()));
        } catch (CompletionException e) {
            chunks.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException re) {
                throw re;
            }
            throw new ExternalTransientException("Metrics read failed for customer " + customerId, e.getCause());
        }

        log.debug("Read metrics for {}/{} ad groups of customer {} on {}",
                result.size(), ids.size(), customerId, date);
        return result;
    }

    private Map<String, ExternalMetrics> readChunk(long customerId, List<String> chunk, LocalDate date) {
        String idList = chunk.stream()
                .map(GaqlSearch::id)
                .map(String::valueOf)
                .collect(Collectors.joining(","));

        String query = String.join(" ", List.of(
                "SELECT ad_group.id, metrics.impressions, metrics.interactions, metrics.clicks,",
                "metrics.conversions, metrics.cost_micros",
                "FROM ad_group",
                "WHERE ad_group.id IN (" + idList + ")",
                "AND segments.date = '" + date.format(fmt) + "'"
        ));

        Map<String, ExternalMetrics> out = new HashMap<>();
        for (GoogleAdsRow row : GaqlSearch.stream(googleAdsClient, customerId, query)) {
            out.merge(String.valueOf(row.getAdGroup().getId()), toMetrics(row.getMetrics()),
                    GoogleAdsMetricsReader::sum);
        }
        return out;
    }

    private static ExternalMetrics toMetrics(Metrics m) {
        BigDecimal spend = BigDecimal.valueOf(m.getCostMicros())
                .divide(BigDecimal.valueOf(1_000_000), 2, RoundingMode.HALF_UP);
        return new ExternalMetrics(
                m.getImpressions(),
                m.getInteractions(),
                m.getClicks(),
                Math.round(m.getConversions()),
                spend);
    }

    private static ExternalMetrics sum(ExternalMetrics a, ExternalMetrics b) {
        return new ExternalMetrics(
                a.impressions() + b.impressions(),
                a.clicks() + b.clicks(),
                a.linkClicks() + b.linkClicks(),
                a.conversions() + b.conversions(),
                a.spend().add(b.spend()));
    }
}
