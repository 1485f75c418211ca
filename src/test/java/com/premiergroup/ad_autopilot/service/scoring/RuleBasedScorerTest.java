package com.premiergroup.ad_autopilot.service.scoring;

import com.premiergroup.ad_autopilot.dto.ProposedMutation;
import com.premiergroup.ad_autopilot.dto.ScorerOutput;
import com.premiergroup.ad_autopilot.dto.ScoringBundle;
import com.premiergroup.ad_autopilot.dto.ScoringBundle.DirectiveSummary;
import com.premiergroup.ad_autopilot.dto.ScoringBundle.PlacementMetrics;
import com.premiergroup.ad_autopilot.dto.ScoringBundle.PoolState;
import com.premiergroup.ad_autopilot.enums.MutationType;
import com.premiergroup.ad_autopilot.enums.ObjectiveType;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class RuleBasedScorerTest {

    private static final LocalDate DAY = LocalDate.of(2024, 5, 10);

    private final RuleBasedScorer scorer = new RuleBasedScorer();

    @Test
    void pausesPlacementThatSpentTwiceTheTargetWithoutLeads() {
        ScorerOutput output = scorer.score(bundle(List.of(metrics("p1", 0, "40.00")), 0));

        assertThat(output.mutations()).containsExactly(
                new ProposedMutation(MutationType.PAUSE_PLACEMENT, "p1", null));
    }

    @Test
    void cutsBudgetOncePerCampaignWhenLeadsAreTooExpensive() {
        ScorerOutput output = scorer.score(bundle(List.of(
                metrics("p1", 1, "40.00"),
                metrics("p2", 2, "70.00")), 0));

        assertThat(output.mutations()).hasSize(1);
        ProposedMutation cut = output.mutations().get(0);
        assertThat(cut.type()).isEqualTo(MutationType.UPDATE_CAMPAIGN_BUDGET);
        assertThat(cut.targetRef()).isEqualTo("555");
        assertThat((BigDecimal) cut.params().get("daily_budget")).isEqualByComparingTo("80.00");
    }

    @Test
    void launchesIntoIdlePlacementWhenLeadsAreCheap() {
        ScorerOutput output = scorer.score(bundle(List.of(
                metrics("p1", 4, "20.00"),
                metrics("p2", 5, "10.00")), 2));

        assertThat(output.mutations()).containsExactly(
                new ProposedMutation(MutationType.LAUNCH_IN_PLACEMENT, "11", null));
    }

    @Test
    void noLaunchWithoutIdlePlacements() {
        ScorerOutput output = scorer.score(bundle(List.of(metrics("p1", 4, "20.00")), 0));

        assertThat(output.mutations()).isEmpty();
    }

    @Test
    void placementsWithinTargetAreLeftAlone() {
        ScorerOutput output = scorer.score(bundle(List.of(
                metrics("p1", 1, "20.00"),
                metrics("p2", 0, "5.00")), 3));

        assertThat(output.mutations()).isEmpty();
    }

    private static ScoringBundle bundle(List<PlacementMetrics> placements, long idle) {
        DirectiveSummary directive = new DirectiveSummary(11L, "Spring promo", ObjectiveType.LEAD_FORM, "555",
                new BigDecimal("100.00"), new BigDecimal("20.00"),
                placements.stream().map(PlacementMetrics::placementId).toList(), List.of("901"));
        return new ScoringBundle(new ScoringBundle.Account(1L, "Acme"), DAY, placements, List.of(directive),
                List.of(new PoolState(11L, idle, placements.size())));
    }

    private static PlacementMetrics metrics(String placementId, long conversions, String spend) {
        BigDecimal cost = new BigDecimal(spend);
        BigDecimal cpl = conversions == 0 ? null : cost.divide(BigDecimal.valueOf(conversions), 4,
                RoundingMode.HALF_UP);
        return new PlacementMetrics(placementId, 11L, DAY, 1000, 50, 30, conversions, cost,
                new BigDecimal("3.0000"), new BigDecimal("10.0000"), cpl);
    }
}
