package com.premiergroup.ad_autopilot.service.dispatch;

import com.premiergroup.ad_autopilot.dto.DispatchRequest;
import com.premiergroup.ad_autopilot.dto.ExecutionReport;
import com.premiergroup.ad_autopilot.dto.ProposedMutation;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.entity.MutationResult;
import com.premiergroup.ad_autopilot.enums.BatchStatus;
import com.premiergroup.ad_autopilot.enums.ErrorCode;
import com.premiergroup.ad_autopilot.enums.MutationOutcome;
import com.premiergroup.ad_autopilot.enums.TriggerOrigin;
import com.premiergroup.ad_autopilot.exception.BatchInProgressException;
import com.premiergroup.ad_autopilot.exception.MutationValidationException;
import com.premiergroup.ad_autopilot.repository.AdAccountRepository;
import com.premiergroup.ad_autopilot.service.loop.ControlLoopSettings;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;

/**
 * Applies a batch of proposed mutations exactly once per idempotency key.
 * <p>
 * The key is claimed with a unique insert before anything else happens to the
 * batch. Whoever loses that insert waits for the winner's terminal report
 * instead of running the mutations again. Mutations on the same target run in
 * batch order; independent targets run in parallel on the dispatch pool.
 */
@Service
@Log4j2
public class DispatchPipeline {

    private static final Duration REPLAY_POLL_INTERVAL = Duration.ofMillis(200);

    private final BatchLedger ledger;
    private final MutationValidator validator;
    private final MutationExecutor executor;
    private final AdAccountRepository accountRepository;
    private final ExecutorService dispatchExecutor;
    private final ReportNotifier notifier;
    private final Clock clock;

    public DispatchPipeline(BatchLedger ledger,
                            MutationValidator validator,
                            MutationExecutor executor,
                            AdAccountRepository accountRepository,
                            @Qualifier("dispatchExecutor") ExecutorService dispatchExecutor,
                            ReportNotifier notifier,
                            Clock clock) {
        this.ledger = ledger;
        this.validator = validator;
        this.executor = executor;
        this.accountRepository = accountRepository;
        this.dispatchExecutor = dispatchExecutor;
        this.notifier = notifier;
        this.clock = clock;
    }

    public ExecutionReport dispatch(DispatchRequest request, ControlLoopSettings settings) {
        TriggerOrigin origin = request.origin() == null ? TriggerOrigin.API : request.origin();

        // 1. envelope: without a usable key or account there is nothing to store the outcome under
        Optional<String> envelopeError = checkEnvelope(request);
        if (envelopeError.isPresent()) {
            log.warn("Rejected dispatch request {}: {}", request.idempotencyKey(), envelopeError.get());
            return unpersistedRejection(request, origin, settings.dryRun(), envelopeError.get());
        }
        String key = request.idempotencyKey();
        AdAccount account = accountRepository.findById(request.accountId()).orElseThrow();

        // 2. idempotency claim
        Optional<ExecutionReport> existing = ledger.findReport(key);
        if (existing.isPresent()) {
            return replay(key, request.accountId(), existing.get(), settings.replayWait(), null);
        }
        Long batchId;
        try {
            batchId = ledger.claim(key, account.getId(), origin, settings.dryRun(), request.mutations());
        } catch (DataAccessException e) {
            // a concurrent claim shows up as a unique violation or, before it commits, as a write conflict
            log.info("Batch {} could not be claimed ({}); waiting for the competing claim", key,
                    e.getClass().getSimpleName());
            return replay(key, request.accountId(), null, settings.replayWait(), e);
        }
        log.info("Dispatching batch {} for account {}: {} mutations, origin {}{}", key, account.getId(),
                request.mutations().size(), origin, settings.dryRun() ? ", dry run" : "");

        // 3. nothing to do is a valid outcome
        if (request.mutations().isEmpty()) {
            return finish(batchId, key, BatchStatus.APPLIED, List.of());
        }

        // 4. per-mutation validation and resource resolution
        List<MutationResult> results = new ArrayList<>();
        List<PreparedMutation> prepared = new ArrayList<>();
        for (int i = 0; i < request.mutations().size(); i++) {
            ProposedMutation mutation = request.mutations().get(i);
            try {
                prepared.add(validator.prepare(i, mutation, account, settings));
            } catch (MutationValidationException e) {
                log.warn("Mutation #{} of batch {} skipped ({}): {}", i, key, e.getErrorCode(), e.getMessage());
                results.add(skipped(i, mutation, e.getErrorCode(), e.getMessage()));
            } catch (RuntimeException e) {
                log.error("Unexpected failure validating mutation #{} of batch {}", i, key, e);
                results.add(skipped(i, mutation, ErrorCode.UNKNOWN, e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }

        if (prepared.isEmpty()) {
            return finish(batchId, key, BatchStatus.REJECTED, results);
        }
        ledger.markValidated(batchId);

        // 5. execution
        results.addAll(execute(prepared, account.getCustomerId(), settings.dryRun()));
        results.sort(Comparator.comparing(MutationResult::getMutationIndex));

        boolean allSucceeded = results.stream().allMatch(r -> r.getOutcome() == MutationOutcome.SUCCESS);
        return finish(batchId, key, allSucceeded ? BatchStatus.APPLIED : BatchStatus.PARTIALLY_FAILED, results);
    }

    /**
     * Persists the terminal state and answers with the stored report, the same one a replay gets.
     */
    private ExecutionReport finish(Long batchId, String key, BatchStatus status, List<MutationResult> results) {
        ledger.complete(batchId, status, results);
        ExecutionReport report = ledger.findReport(key).orElseThrow();
        try {
            notifier.notify(report);
        } catch (RuntimeException e) {
            log.error("Report notification failed for batch {}", key, e);
        }
        return report;
    }

    private List<MutationResult> execute(List<PreparedMutation> prepared, long customerId, boolean dryRun) {
        Map<String, List<PreparedMutation>> byTarget = new LinkedHashMap<>();
        prepared.forEach(m -> byTarget.computeIfAbsent(m.targetKey(), k -> new ArrayList<>()).add(m));

        List<CompletableFuture<List<MutationResult>>> groups = byTarget.values().stream()
                .map(group -> CompletableFuture.supplyAsync(() -> group.stream()
                        .map(m -> executor.execute(m, customerId, dryRun))
                        .toList(), dispatchExecutor))
                .toList();

        List<MutationResult> results = new ArrayList<>();
        groups.forEach(g -> results.addAll(g.join()));
        return results;
    }

    /**
     * Returns the stored report of a key, polling while another caller is still executing it.
     * When no batch ever appears under the key, {@code claimFailure} is rethrown.
     */
    private ExecutionReport replay(String key, Long accountId, ExecutionReport known, Duration wait,
                                   DataAccessException claimFailure) {
        Instant deadline = clock.instant().plus(wait);
        ExecutionReport report = known;
        while (report == null || !report.status().isTerminal()) {
            if (!clock.instant().isBefore(deadline)) {
                if (report == null && claimFailure != null) {
                    throw claimFailure;
                }
                throw new BatchInProgressException(key);
            }
            try {
                Thread.sleep(REPLAY_POLL_INTERVAL.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BatchInProgressException(key);
            }
            report = ledger.findReport(key).orElse(null);
        }
        if (!report.accountId().equals(accountId)) {
            throw new IllegalStateException("Idempotency key " + key + " belongs to another account");
        }
        log.info("Replay of batch {} returns stored {} report", key, report.status());
        return report;
    }

    private Optional<String> checkEnvelope(DispatchRequest request) {
        if (request.idempotencyKey() == null || request.idempotencyKey().isBlank()) {
            return Optional.of("idempotency key is missing");
        }
        if (request.accountId() == null) {
            return Optional.of("account id is missing");
        }
        if (request.mutations() == null) {
            return Optional.of("mutation list is missing");
        }
        if (!accountRepository.existsById(request.accountId())) {
            return Optional.of("account " + request.accountId() + " does not exist");
        }
        return Optional.empty();
    }

    private ExecutionReport unpersistedRejection(DispatchRequest request, TriggerOrigin origin, boolean dryRun,
                                                 String reason) {
        Instant now = clock.instant().truncatedTo(ChronoUnit.MILLIS);
        return new ExecutionReport(null, request.idempotencyKey(), request.accountId(), BatchStatus.REJECTED,
                origin, dryRun, List.of(), "Batch rejected: " + reason, now, now);
    }

    private static MutationResult skipped(int index, ProposedMutation mutation, ErrorCode code, String message) {
        return MutationResult.builder()
                .mutationIndex(index)
                .mutationType(mutation == null ? null : mutation.type())
                .targetRef(mutation == null ? null : mutation.targetRef())
                .outcome(MutationOutcome.SKIPPED)
                .errorCode(code)
                .errorMessage(MutationExecutor.truncate(message))
                .build();
    }
}
