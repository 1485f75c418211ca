package com.premiergroup.ad_autopilot.dto;

import com.premiergroup.ad_autopilot.enums.TriggerOrigin;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * A batch of proposed mutations. {@code dryRun} overrides the account setting when present.
 */
public record DispatchRequest(
        @NotBlank String idempotencyKey,
        @NotNull Long accountId,
        TriggerOrigin origin,
        Boolean dryRun,
        @NotNull List<ProposedMutation> mutations
) {
}
