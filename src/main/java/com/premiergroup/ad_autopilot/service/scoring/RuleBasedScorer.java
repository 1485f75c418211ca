package com.premiergroup.ad_autopilot.service.scoring;

import com.premiergroup.ad_autopilot.dto.ProposedMutation;
import com.premiergroup.ad_autopilot.dto.ScorerOutput;
import com.premiergroup.ad_autopilot.dto.ScoringBundle;
import com.premiergroup.ad_autopilot.dto.ScoringBundle.DirectiveSummary;
import com.premiergroup.ad_autopilot.dto.ScoringBundle.PlacementMetrics;
import com.premiergroup.ad_autopilot.dto.ScoringBundle.PoolState;
import com.premiergroup.ad_autopilot.enums.MutationType;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Cost-per-lead rules against each directive's target:
 * <ul>
 *     <li>spend of twice the target without a single lead pauses the placement</li>
 *     <li>CPL above 1.5x target cuts the campaign budget by 20%</li>
 *     <li>CPL at or below 0.7x target launches the creatives into a fresh placement, if one is idle</li>
 * </ul>
 * Placements without metrics are left alone.
 */
@Component
@Log4j2
public class RuleBasedScorer implements Scorer {

    static final BigDecimal PAUSE_SPEND_MULTIPLE = new BigDecimal("2");
    static final BigDecimal BUDGET_CUT_THRESHOLD = new BigDecimal("1.5");
    static final BigDecimal BUDGET_CUT_FACTOR = new BigDecimal("0.8");
    static final BigDecimal SCALE_THRESHOLD = new BigDecimal("0.7");

    @Override
    public String name() {
        return "rules";
    }

    @Override
    public ScorerOutput score(ScoringBundle bundle) {
        Map<Long, DirectiveSummary> directives = bundle.directives().stream()
                .collect(Collectors.toMap(DirectiveSummary::id, Function.identity()));
        Map<Long, PoolState> pools = bundle.poolState().stream()
                .collect(Collectors.toMap(PoolState::directiveId, Function.identity()));

        List<ProposedMutation> mutations = new ArrayList<>();
        Set<String> budgetCut = new HashSet<>();
        Set<Long> launched = new HashSet<>();

        for (PlacementMetrics m : bundle.placements()) {
            DirectiveSummary directive = directives.get(m.directiveId());
            if (directive == null || directive.targetCostPerLead() == null
                    || directive.targetCostPerLead().signum() <= 0) {
                continue;
            }
            BigDecimal target = directive.targetCostPerLead();
            BigDecimal spend = m.spend() == null ? BigDecimal.ZERO : m.spend();

            if (m.conversions() == 0) {
                if (spend.compareTo(target.multiply(PAUSE_SPEND_MULTIPLE)) >= 0) {
                    mutations.add(new ProposedMutation(MutationType.PAUSE_PLACEMENT, m.placementId(), Map.of()));
                }
                continue;
            }

            BigDecimal cpl = m.cpl();
            if (cpl == null) {
                continue;
            }
            if (cpl.compareTo(target.multiply(BUDGET_CUT_THRESHOLD)) > 0) {
                if (directive.dailyBudget() != null && budgetCut.add(directive.externalCampaignId())) {
                    BigDecimal reduced = directive.dailyBudget().multiply(BUDGET_CUT_FACTOR)
                            .setScale(2, RoundingMode.HALF_UP);
                    mutations.add(new ProposedMutation(MutationType.UPDATE_CAMPAIGN_BUDGET,
                            directive.externalCampaignId(), Map.of("daily_budget", reduced)));
                }
            } else if (cpl.compareTo(target.multiply(SCALE_THRESHOLD)) <= 0) {
                PoolState pool = pools.get(directive.id());
                if (pool != null && pool.idleCount() > 0 && launched.add(directive.id())) {
                    mutations.add(new ProposedMutation(MutationType.LAUNCH_IN_PLACEMENT,
                            String.valueOf(directive.id()), Map.of()));
                }
            }
        }

        log.info("Rule scorer proposed {} mutations for account {}", mutations.size(), bundle.account().id());
        return new ScorerOutput(mutations);
    }
}
