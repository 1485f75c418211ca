package com.premiergroup.ad_autopilot.util;

import com.premiergroup.ad_autopilot.config.AutopilotProperties;
import com.premiergroup.ad_autopilot.exception.ExternalTimeoutException;
import com.premiergroup.ad_autopilot.exception.ExternalTransientException;
import lombok.extern.log4j.Log4j2;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Supplier;

/**
 * Wraps every call to the ad platform: caps concurrent calls, bounds each
 * call with a timeout and retries transient failures with exponential backoff.
 * Timeouts are not retried.
 */
@Component
@Log4j2
public class ExternalCallGuard {

    private final Semaphore permits;
    private final RetryTemplate retryTemplate;
    private final ExecutorService executor;
    private final Duration timeout;

    public ExternalCallGuard(AutopilotProperties properties,
                             @Qualifier("externalCallExecutor") ExecutorService executor) {
        AutopilotProperties.Dispatch dispatch = properties.dispatch();
        this.permits = new Semaphore(dispatch.maxConcurrentCalls(), true);
        this.executor = executor;
        this.timeout = dispatch.externalCallTimeout();
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(dispatch.maxAttempts())
                .exponentialBackoff(dispatch.initialBackoff().toMillis(), dispatch.backoffMultiplier(),
                        dispatch.maxBackoff().toMillis())
                .retryOn(ExternalTransientException.class)
                .build();
    }

    public <T> T call(String operation, Supplier<T> call) {
        return retryTemplate.execute(ctx -> {
            if (ctx.getRetryCount() > 0) {
                log.warn("Retrying {} (attempt {}) after: {}", operation, ctx.getRetryCount() + 1,
                        ctx.getLastThrowable() == null ? "?" : ctx.getLastThrowable().getMessage());
            }
            return callOnce(operation, call);
        });
    }

    public void run(String operation, Runnable call) {
        call(operation, () -> {
            call.run();
            return null;
        });
    }

    private <T> T callOnce(String operation, Supplier<T> call) {
        try {
            permits.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalTransientException("Interrupted before " + operation, e);
        }
        Future<T> future = null;
        try {
            Callable<T> task = call::get;
            future = executor.submit(task);
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new ExternalTimeoutException(operation + " did not complete within " + timeout.toMillis() + "ms", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(operation + " failed", cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new ExternalTransientException("Interrupted while waiting for " + operation, e);
        } finally {
            permits.release();
        }
    }
}
