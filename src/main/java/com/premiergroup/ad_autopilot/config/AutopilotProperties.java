package com.premiergroup.ad_autopilot.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

/**
 * Control-loop settings bound from {@code autopilot.*}.
 */
@ConfigurationProperties("autopilot")
public record AutopilotProperties(
        @DefaultValue Schedule schedule,
        @DefaultValue Metrics metrics,
        @DefaultValue Pool pool,
        @DefaultValue Dispatch dispatch,
        @DefaultValue Scorer scorer,
        @DefaultValue Web web
) {

    public record Schedule(
            @DefaultValue("0 0 6 * * *") String controlLoopCron,
            @DefaultValue("0 30 5 * * *") String metricsCron,
            @DefaultValue("0 0 3 * * SUN") String retentionCron,
            @DefaultValue("UTC") String zone,
            @DefaultValue("4") int accountParallelism
    ) {}

    public record Metrics(
            /* calendar days a cached row stays acceptable, counting the as-of day */
            @DefaultValue("2") int freshnessDays,
            @DefaultValue("4") int fallbackConcurrency,
            @DefaultValue("100") int fallbackChunkSize,
            @DefaultValue("90") int retentionDays
    ) {}

    public record Pool(
            @DefaultValue("10m") Duration reservationLease
    ) {}

    public record Dispatch(
            @DefaultValue("false") boolean dryRun,
            @DefaultValue("4") int maxParallelTargets,
            @DefaultValue("8") int maxConcurrentCalls,
            @DefaultValue("30s") Duration externalCallTimeout,
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("500ms") Duration initialBackoff,
            @DefaultValue("2.0") double backoffMultiplier,
            @DefaultValue("5s") Duration maxBackoff,
            @DefaultValue("60s") Duration replayWait,
            @DefaultValue("1000") BigDecimal maxDailyBudget
    ) {}

    public record Scorer(
            @DefaultValue("rules") String type,
            @DefaultValue Llm llm
    ) {}

    public record Llm(
            @DefaultValue("https://api.openai.com/v1") String baseUrl,
            String apiKey,
            @DefaultValue("gpt-4o-mini") String model,
            @DefaultValue("60s") Duration timeout
    ) {}

    public record Web(
            @DefaultValue("http://localhost:4200") List<String> allowedOrigins
    ) {}
}
