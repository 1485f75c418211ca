package com.premiergroup.ad_autopilot.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Bounded pools. Each one caps a different kind of fan-out so that external
 * rate limits hold no matter how many accounts run at once.
 */
@Configuration(proxyBeanMethods = false)
@EnableConfigurationProperties(AutopilotProperties.class)
public class ExecutorConfig {

    @Bean(destroyMethod = "shutdown")
    public ExecutorService controlLoopExecutor(AutopilotProperties properties) {
        return Executors.newFixedThreadPool(properties.schedule().accountParallelism(),
                new CustomizableThreadFactory("control-loop-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService dispatchExecutor(AutopilotProperties properties) {
        return Executors.newFixedThreadPool(properties.dispatch().maxParallelTargets(),
                new CustomizableThreadFactory("dispatch-"));
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService externalCallExecutor(AutopilotProperties properties) {
        return Executors.newFixedThreadPool(properties.dispatch().maxConcurrentCalls(),
                new CustomizableThreadFactory("external-call-"));
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService metricsFetchExecutor(AutopilotProperties properties) {
        return Executors.newFixedThreadPool(properties.metrics().fallbackConcurrency(),
                new CustomizableThreadFactory("metrics-fetch-"));
    }
}
