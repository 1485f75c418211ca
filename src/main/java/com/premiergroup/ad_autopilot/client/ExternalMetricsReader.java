package com.premiergroup.ad_autopilot.client;

import com.premiergroup.ad_autopilot.dto.ExternalMetrics;

import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;

public interface ExternalMetricsReader {

    /**
     * Reads one day of metrics for the given placements in a single logical call.
     * A placement missing from the result had no traffic that day.
     *
     * @throws com.premiergroup.ad_autopilot.exception.ExternalApiException when the read fails
     */
    Map<String, ExternalMetrics> readPlacementMetrics(long customerId, Collection<String> placementIds, LocalDate date);
}
