package com.premiergroup.ad_autopilot.service.dispatch;

import com.premiergroup.ad_autopilot.entity.MutationResult;
import com.premiergroup.ad_autopilot.enums.BatchStatus;
import com.premiergroup.ad_autopilot.enums.ErrorCode;
import com.premiergroup.ad_autopilot.enums.MutationOutcome;

import java.util.List;

/**
 * Human-readable summary stored with every terminal batch.
 */
final class ReportSummaryFormatter {

    private ReportSummaryFormatter() {
    }

    static String format(String idempotencyKey, Long accountId, BatchStatus status, boolean dryRun,
                         List<MutationResult> results) {
        StringBuilder sb = new StringBuilder()
                .append("Batch ").append(idempotencyKey)
                .append(" for account ").append(accountId)
                .append(": ").append(status);
        if (dryRun) {
            sb.append(" (dry run)");
        }

        if (results.isEmpty()) {
            return sb.append(". No action needed.").toString();
        }

        sb.append(". ")
                .append(count(results, MutationOutcome.SUCCESS)).append(" succeeded, ")
                .append(count(results, MutationOutcome.FAILED)).append(" failed, ")
                .append(count(results, MutationOutcome.SKIPPED)).append(" skipped.");

        for (MutationResult r : results) {
            if (r.getOutcome() == MutationOutcome.SUCCESS) {
                continue;
            }
            sb.append('\n').append("- #").append(r.getMutationIndex())
                    .append(' ').append(r.getMutationType())
                    .append(' ').append(r.getTargetRef())
                    .append(": ").append(r.getOutcome())
                    .append(' ').append(r.getErrorCode());
            if (r.getErrorCode() == ErrorCode.TIMEOUT) {
                sb.append(" (verify on the platform)");
            }
            if (r.getErrorMessage() != null) {
                sb.append(" - ").append(r.getErrorMessage());
            }
        }
        return sb.toString();
    }

    private static long count(List<MutationResult> results, MutationOutcome outcome) {
        return results.stream().filter(r -> r.getOutcome() == outcome).count();
    }
}
