package com.premiergroup.ad_autopilot.service.dispatch;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.ad_autopilot.dto.ExecutionReport;
import com.premiergroup.ad_autopilot.dto.ProposedMutation;
import com.premiergroup.ad_autopilot.entity.DispatchBatch;
import com.premiergroup.ad_autopilot.entity.MutationResult;
import com.premiergroup.ad_autopilot.enums.BatchStatus;
import com.premiergroup.ad_autopilot.enums.TriggerOrigin;
import com.premiergroup.ad_autopilot.repository.DispatchBatchRepository;
import jakarta.persistence.EntityNotFoundException;
import lombok.extern.log4j.Log4j2;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Durable record of dispatch batches. Each write runs in its own transaction
 * so the idempotency claim is visible to concurrent callers as soon as it returns.
 */
@Service
@Log4j2
public class BatchLedger {

    private final DispatchBatchRepository batchRepository;
    private final ObjectMapper objectMapper;
    private final TransactionTemplate tx;
    private final TransactionTemplate readTx;
    private final Clock clock;

    public BatchLedger(DispatchBatchRepository batchRepository,
                       ObjectMapper objectMapper,
                       PlatformTransactionManager transactionManager,
                       Clock clock) {
        this.batchRepository = batchRepository;
        this.objectMapper = objectMapper;
        this.tx = new TransactionTemplate(transactionManager);
        this.tx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readTx = new TransactionTemplate(transactionManager);
        this.readTx.setReadOnly(true);
        this.clock = clock;
    }

    /**
     * Inserts a Pending batch under the key.
     *
     * @throws org.springframework.dao.DataAccessException when the key is already taken or being claimed
     */
    public Long claim(String idempotencyKey, Long accountId, TriggerOrigin origin, boolean dryRun,
                      List<ProposedMutation> mutations) {
        DispatchBatch batch = DispatchBatch.builder()
                .idempotencyKey(idempotencyKey)
                .accountId(accountId)
                .status(BatchStatus.PENDING)
                .origin(origin)
                .dryRun(dryRun)
                .mutationCount(mutations.size())
                .requestJson(toJson(mutations))
                .createdAt(now())
                .build();
        return tx.execute(status -> batchRepository.saveAndFlush(batch).getId());
    }

    public void markValidated(Long batchId) {
        tx.executeWithoutResult(status -> {
            DispatchBatch batch = find(batchId);
            batch.setStatus(BatchStatus.VALIDATED);
            batchRepository.save(batch);
        });
    }

    /**
     * Stores the results and the terminal status in one transaction.
     */
    public void complete(Long batchId, BatchStatus status, List<MutationResult> results) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        tx.executeWithoutResult(s -> {
            DispatchBatch batch = find(batchId);
            results.forEach(batch::addResult);
            batch.setStatus(status);
            batch.setSummary(ReportSummaryFormatter.format(batch.getIdempotencyKey(), batch.getAccountId(),
                    status, Boolean.TRUE.equals(batch.getDryRun()), results));
            batch.setCompletedAt(now());
            batchRepository.save(batch);
        });
        log.info("Batch {} completed with status {} ({} results)", batchId, status, results.size());
    }

    public Optional<ExecutionReport> findReport(String idempotencyKey) {
        return readTx.execute(status -> batchRepository.findByIdempotencyKey(idempotencyKey)
                .map(BatchLedger::toReport));
    }

    Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MILLIS);
    }

    static ExecutionReport toReport(DispatchBatch batch) {
        List<ExecutionReport.MutationReport> results = batch.getResults().stream()
                .map(r -> new ExecutionReport.MutationReport(
                        r.getMutationIndex(),
                        r.getMutationType(),
                        r.getTargetRef(),
                        r.getOutcome(),
                        r.getErrorCode(),
                        r.getErrorMessage(),
                        r.getResponsePayload()))
                .toList();

        return new ExecutionReport(
                batch.getId(),
                batch.getIdempotencyKey(),
                batch.getAccountId(),
                batch.getStatus(),
                batch.getOrigin(),
                Boolean.TRUE.equals(batch.getDryRun()),
                results,
                batch.getSummary(),
                batch.getCreatedAt(),
                batch.getCompletedAt());
    }

    private DispatchBatch find(Long batchId) {
        return batchRepository.findById(batchId)
                .orElseThrow(() -> new EntityNotFoundException("Dispatch batch not found: " + batchId));
    }

    private String toJson(List<ProposedMutation> mutations) {
        try {
            return objectMapper.writeValueAsString(mutations);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize proposed mutations for audit: {}", e.getMessage());
            return null;
        }
    }
}
