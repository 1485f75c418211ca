package com.premiergroup.ad_autopilot.service.metrics;

import com.premiergroup.ad_autopilot.dto.ExternalMetrics;
import com.premiergroup.ad_autopilot.entity.MetricSnapshot;
import com.premiergroup.ad_autopilot.repository.MetricSnapshotRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
@Import(MetricsStore.class)
class MetricsStoreTest {

    private static final Long ACCOUNT = 1L;
    private static final LocalDate TODAY = LocalDate.of(2024, 5, 10);
    private static final Instant FETCHED = Instant.parse("2024-05-10T08:00:00Z");

    @Autowired
    private MetricsStore store;

    @Autowired
    private MetricSnapshotRepository repository;

    @Test
    void todaysSnapshotIsRefreshedInPlace() {
        store.upsert(ACCOUNT, "p1", TODAY, metrics(100, 2, "10"), FETCHED);
        MetricSnapshot refreshed = store.upsert(ACCOUNT, "p1", TODAY, metrics(250, 5, "25.5"), FETCHED.plusSeconds(3600));

        assertThat(repository.findAll()).hasSize(1);
        assertThat(refreshed.getImpressions()).isEqualTo(250L);
        assertThat(refreshed.getSpend()).isEqualByComparingTo("25.50");
        assertThat(refreshed.getCpl()).isEqualByComparingTo("5.10");
        assertThat(refreshed.getFetchedAt()).isEqualTo(FETCHED.plusSeconds(3600));
    }

    @Test
    void pastDayIsFrozenOnceALaterDayExists() {
        store.upsert(ACCOUNT, "p1", TODAY.minusDays(1), metrics(100, 1, "10"), FETCHED);
        store.upsert(ACCOUNT, "p1", TODAY, metrics(20, 0, "2"), FETCHED);

        MetricSnapshot yesterday = store.upsert(ACCOUNT, "p1", TODAY.minusDays(1), metrics(999, 9, "99"), FETCHED);

        assertThat(yesterday.getImpressions()).isEqualTo(100L);
        assertThat(repository.findByAccountIdAndPlacementIdAndStatsDate(ACCOUNT, "p1", TODAY.minusDays(1)))
                .get()
                .extracting(MetricSnapshot::getConversions)
                .isEqualTo(1L);
    }

    @Test
    void latestSnapshotWithinWindowWinsPerPlacement() {
        store.upsert(ACCOUNT, "p1", TODAY.minusDays(1), metrics(100, 1, "10"), FETCHED);
        store.upsert(ACCOUNT, "p1", TODAY, metrics(20, 0, "2"), FETCHED);
        store.upsert(ACCOUNT, "p2", TODAY.minusDays(5), metrics(7, 0, "1"), FETCHED);
        store.upsert(2L, "p3", TODAY, metrics(7, 0, "1"), FETCHED);

        Map<String, MetricSnapshot> latest = store.findLatest(ACCOUNT, List.of("p1", "p2", "p3"),
                TODAY.minusDays(1), TODAY);

        assertThat(latest).containsOnlyKeys("p1");
        assertThat(latest.get("p1").getStatsDate()).isEqualTo(TODAY);
    }

    @Test
    void purgeRemovesOnlyRowsBeforeCutoff() {
        store.upsert(ACCOUNT, "p1", TODAY.minusDays(100), metrics(1, 0, "1"), FETCHED);
        store.upsert(ACCOUNT, "p1", TODAY.minusDays(90), metrics(1, 0, "1"), FETCHED);
        store.upsert(ACCOUNT, "p1", TODAY, metrics(1, 0, "1"), FETCHED);

        int deleted = store.purgeOlderThan(TODAY.minusDays(90));

        assertThat(deleted).isEqualTo(1);
        assertThat(repository.findAll())
                .extracting(MetricSnapshot::getStatsDate)
                .containsExactlyInAnyOrder(TODAY.minusDays(90), TODAY);
    }

    private static ExternalMetrics metrics(long impressions, long conversions, String spend) {
        return new ExternalMetrics(impressions, impressions / 10, impressions / 20, conversions, new BigDecimal(spend));
    }
}
