package com.premiergroup.ad_autopilot.dto;

import com.premiergroup.ad_autopilot.enums.BatchStatus;
import com.premiergroup.ad_autopilot.enums.ErrorCode;
import com.premiergroup.ad_autopilot.enums.MutationOutcome;
import com.premiergroup.ad_autopilot.enums.MutationType;
import com.premiergroup.ad_autopilot.enums.TriggerOrigin;

import java.time.Instant;
import java.util.List;

public record ExecutionReport(
        Long batchId,
        String idempotencyKey,
        Long accountId,
        BatchStatus status,
        TriggerOrigin origin,
        boolean dryRun,
        List<MutationReport> results,
        String summary,
        Instant createdAt,
        Instant completedAt
) {

    public ExecutionReport {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public long count(MutationOutcome outcome) {
        return results.stream().filter(r -> r.outcome() == outcome).count();
    }

    public record MutationReport(
            int index,
            MutationType type,
            String targetRef,
            MutationOutcome outcome,
            ErrorCode errorCode,
            String errorMessage,
            String responsePayload
    ) {
    }
}
