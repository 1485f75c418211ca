package com.premiergroup.ad_autopilot.service.loop;

import com.premiergroup.ad_autopilot.config.AutopilotProperties;
import com.premiergroup.ad_autopilot.dto.DispatchRequest;
import com.premiergroup.ad_autopilot.dto.ExecutionReport;
import com.premiergroup.ad_autopilot.dto.ScorerOutput;
import com.premiergroup.ad_autopilot.dto.ScoringBundle;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.entity.Directive;
import com.premiergroup.ad_autopilot.entity.MetricSnapshot;
import com.premiergroup.ad_autopilot.entity.Placement;
import com.premiergroup.ad_autopilot.enums.PlacementStatus;
import com.premiergroup.ad_autopilot.enums.TriggerOrigin;
import com.premiergroup.ad_autopilot.repository.AdAccountRepository;
import com.premiergroup.ad_autopilot.repository.DirectiveRepository;
import com.premiergroup.ad_autopilot.repository.PlacementRepository;
import com.premiergroup.ad_autopilot.service.dispatch.BatchLedger;
import com.premiergroup.ad_autopilot.service.dispatch.DispatchPipeline;
import com.premiergroup.ad_autopilot.service.metrics.MetricsCache;
import com.premiergroup.ad_autopilot.service.pool.PlacementPool;
import com.premiergroup.ad_autopilot.service.scoring.Scorer;
import jakarta.persistence.EntityNotFoundException;
import lombok.RequiredArgsConstructor;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * One pass of the loop for one account: metrics, scoring, dispatch.
 */
@Service
@Log4j2
@RequiredArgsConstructor
public class ControlLoopService {

    private final AdAccountRepository accountRepository;
    private final DirectiveRepository directiveRepository;
    private final PlacementRepository placementRepository;
    private final MetricsCache metricsCache;
    private final PlacementPool placementPool;
    private final Scorer scorer;
    private final DispatchPipeline pipeline;
    private final BatchLedger ledger;
    private final AutopilotProperties properties;
    private final Clock clock;

    public static String scheduledKey(Long accountId, LocalDate date) {
        return "scheduled:" + accountId + ":" + date;
    }

    public ExecutionReport runScheduled(Long accountId) {
        LocalDate today = LocalDate.now(clock);
        return run(accountId, TriggerOrigin.SCHEDULED, null, scheduledKey(accountId, today), today);
    }

    /**
     * Manual re-run. Without an explicit key every call is a new batch.
     */
    public ExecutionReport runManual(Long accountId, Boolean dryRun, String idempotencyKey) {
        LocalDate today = LocalDate.now(clock);
        String key = idempotencyKey == null || idempotencyKey.isBlank()
                ? "manual:" + accountId + ":" + today + ":" + UUID.randomUUID()
                : idempotencyKey;
        return run(accountId, TriggerOrigin.MANUAL, dryRun, key, today);
    }

    /**
     * Dispatches caller-supplied mutations without scoring.
     */
    public ExecutionReport dispatch(DispatchRequest request) {
        AdAccount account = request.accountId() == null ? null
                : accountRepository.findById(request.accountId()).orElse(null);
        return pipeline.dispatch(request, ControlLoopSettings.of(properties, account, request.dryRun()));
    }

    public Optional<ExecutionReport> findReport(String idempotencyKey) {
        return ledger.findReport(idempotencyKey);
    }

    private ExecutionReport run(Long accountId, TriggerOrigin origin, Boolean dryRun, String key, LocalDate asOfDate) {
        AdAccount account = accountRepository.findById(accountId)
                .orElseThrow(() -> new EntityNotFoundException("Account not found: " + accountId));

        // settings are fixed here for the whole pass
        ControlLoopSettings settings = ControlLoopSettings.of(properties, account, dryRun);

        Optional<ExecutionReport> done = ledger.findReport(key);
        if (done.isPresent() && !accountId.equals(done.get().accountId())) {
            throw new IllegalStateException("Idempotency key " + key + " belongs to another account");
        }
        if (done.isPresent() && done.get().status().isTerminal()) {
            log.info("Account {} already ran under {}; returning stored report", accountId, key);
            return done.get();
        }

        ScoringBundle bundle = buildBundle(account, asOfDate);
        ScorerOutput output = scorer.score(bundle);
        log.info("Scorer {} proposed {} mutations for account {} on {}", scorer.name(),
                output.mutations().size(), accountId, asOfDate);

        return pipeline.dispatch(
                new DispatchRequest(key, accountId, origin, settings.dryRun(), output.mutations()), settings);
    }

    ScoringBundle buildBundle(AdAccount account, LocalDate asOfDate) {
        List<Directive> directives = directiveRepository.findByAccount_IdAndIsActiveTrue(account.getId());

        List<ScoringBundle.DirectiveSummary> summaries = new ArrayList<>();
        List<ScoringBundle.PoolState> pools = new ArrayList<>();
        Map<String, Long> activePlacements = new HashMap<>();

        for (Directive directive : directives) {
            List<Placement> placements = placementRepository.findByDirective_IdOrderByStatusAscLinkedAtDesc(directive.getId());
            placements.stream()
                    .filter(p -> p.getStatus() == PlacementStatus.ACTIVE)
                    .forEach(p -> activePlacements.put(p.getExternalId(), directive.getId()));

            summaries.add(new ScoringBundle.DirectiveSummary(
                    directive.getId(),
                    directive.getName(),
                    directive.getObjective(),
                    directive.getExternalCampaignId(),
                    directive.getDailyBudget(),
                    directive.getTargetCostPerLead(),
                    placements.stream()
                            .filter(p -> p.getStatus() != PlacementStatus.RETIRED)
                            .map(Placement::getExternalId)
                            .toList(),
                    List.copyOf(directive.getCreativeRefs())));
            pools.add(placementPool.poolState(directive.getId()));
        }

        Map<String, MetricSnapshot> metrics = metricsCache.getMetrics(account.getId(), activePlacements.keySet(), asOfDate);

        List<ScoringBundle.PlacementMetrics> placementMetrics = metrics.values().stream()
                .sorted((a, b) -> a.getPlacementId().compareTo(b.getPlacementId()))
                .map(s -> new ScoringBundle.PlacementMetrics(
                        s.getPlacementId(),
                        activePlacements.get(s.getPlacementId()),
                        s.getStatsDate(),
                        nz(s.getImpressions()),
                        nz(s.getClicks()),
                        nz(s.getLinkClicks()),
                        nz(s.getConversions()),
                        s.getSpend(),
                        s.getCtr(),
                        s.getCpm(),
                        s.getCpl()))
                .toList();

        return new ScoringBundle(new ScoringBundle.Account(account.getId(), account.getName()), asOfDate,
                placementMetrics, summaries, pools);
    }

    private static long nz(Long value) {
        return value == null ? 0 : value;
    }
}
