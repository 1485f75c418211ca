package com.premiergroup.ad_autopilot.service.metrics;

import com.premiergroup.ad_autopilot.AutopilotIntegrationTest;
import com.premiergroup.ad_autopilot.dto.ExternalMetrics;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.entity.Directive;
import com.premiergroup.ad_autopilot.entity.MetricSnapshot;
import com.premiergroup.ad_autopilot.enums.ObjectiveType;
import com.premiergroup.ad_autopilot.enums.PlacementStatus;
import com.premiergroup.ad_autopilot.exception.ExternalRejectedException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Collection;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

class MetricsCollectionJobTest extends AutopilotIntegrationTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 1);

    @Autowired
    private MetricsCollectionJob job;

    @Autowired
    private Clock clock;

    @Test
    void collectsEveryNonRetiredPlacementAndZeroesSilentOnes() {
        AdAccount account = account("Acme", 1234L);
        Directive directive = directive(account, "555", ObjectiveType.WEBSITE_TRAFFIC);
        placement(directive, "101", PlacementStatus.ACTIVE, 1, null);
        idle(directive, "102");
        placement(directive, "103", PlacementStatus.RETIRED, 2, null);
        when(metricsReader.readPlacementMetrics(eq(1234L), anyCollection(), eq(DAY)))
                .thenReturn(Map.of("101", new ExternalMetrics(500, 20, 10, 1, new BigDecimal("12.34"))));

        int stored = job.collect(account, DAY);

        assertThat(stored).isEqualTo(2);
        assertThat(snapshotRepository.findAll())
                .extracting(MetricSnapshot::getPlacementId, MetricSnapshot::getImpressions)
                .containsExactlyInAnyOrder(
                        tuple("101", 500L),
                        tuple("102", 0L));
    }

    @Test
    void accountWithoutPlacementsMakesNoCall() {
        AdAccount account = account("Empty", 1L);

        assertThat(job.collect(account, DAY)).isZero();
        assertThat(snapshotRepository.count()).isZero();
    }

    @Test
    void oneFailingAccountDoesNotStopTheDailySync() {
        AdAccount broken = account("Broken", 1111L);
        idle(directive(broken, "555", ObjectiveType.WEBSITE_TRAFFIC), "101");
        AdAccount healthy = account("Healthy", 2222L);
        idle(directive(healthy, "556", ObjectiveType.WEBSITE_TRAFFIC), "201");

        when(metricsReader.readPlacementMetrics(eq(1111L), anyCollection(), any()))
                .thenThrow(new ExternalRejectedException("CUSTOMER_NOT_ENABLED"));
        when(metricsReader.readPlacementMetrics(eq(2222L), argThat((Collection<String> ids) -> ids.contains("201")),
                any())).thenReturn(Map.of());

        job.dailyMetricsSync();

        LocalDate today = LocalDate.now(clock);
        assertThat(snapshotRepository.findAll())
                .extracting(MetricSnapshot::getStatsDate)
                .containsExactlyInAnyOrder(today.minusDays(1), today);
        assertThat(snapshotRepository.findAll())
                .extracting(MetricSnapshot::getAccountId)
                .containsOnly(healthy.getId());
    }
}
