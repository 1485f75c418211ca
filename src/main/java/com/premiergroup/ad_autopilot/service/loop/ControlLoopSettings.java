package com.premiergroup.ad_autopilot.service.loop;

import com.premiergroup.ad_autopilot.config.AutopilotProperties;
import com.premiergroup.ad_autopilot.entity.AdAccount;

import java.math.BigDecimal;
import java.time.Duration;

/**
 * Settings for one control-loop invocation, fixed when the run starts and
 * handed down explicitly.
 *
 * @param dryRun         validate and log mutations without calling the platform
 * @param maxDailyBudget upper bound for any budget a mutation may set
 * @param replayWait     how long a concurrent replay waits for the running batch
 */
public record ControlLoopSettings(
        boolean dryRun,
        BigDecimal maxDailyBudget,
        Duration replayWait
) {

    /**
     * Dry run comes from the override when given, otherwise from the global
     * switch or the account flag.
     */
    public static ControlLoopSettings of(AutopilotProperties properties, AdAccount account, Boolean dryRunOverride) {
        AutopilotProperties.Dispatch dispatch = properties.dispatch();
        boolean dryRun = dryRunOverride != null
                ? dryRunOverride
                : dispatch.dryRun() || (account != null && Boolean.TRUE.equals(account.getDryRun()));
        return new ControlLoopSettings(dryRun, dispatch.maxDailyBudget(), dispatch.replayWait());
    }
}
