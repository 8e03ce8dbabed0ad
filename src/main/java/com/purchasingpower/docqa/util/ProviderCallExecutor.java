package com.purchasingpower.docqa.util;

import com.purchasingpower.docqa.config.GlobalRetryConfig;
import com.purchasingpower.docqa.exception.ProviderException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.Exceptions;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a blocking provider call with a per-attempt timeout and bounded
 * exponential-backoff retries, configured by {@link GlobalRetryConfig}.
 *
 * Only transient failures are retried. Whatever happens, the caller gets back
 * either the value or a {@link ProviderException} carrying the attempt count.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ProviderCallExecutor {

    private final GlobalRetryConfig retryConfig;

    public <T> T execute(String providerName, String operation, Callable<T> call) {
        int maxAttempts = Math.max(1, retryConfig.getMaxAttempts());
        AtomicInteger attempts = new AtomicInteger();

        Retry retrySpec = Retry.backoff(maxAttempts - 1L, Duration.ofMillis(retryConfig.getBackoffMs()))
                .maxBackoff(Duration.ofMillis(Math.max(retryConfig.getBackoffMs(), retryConfig.getMaxBackoffMs())))
                .jitter(0)
                .filter(ProviderCallExecutor::isRetryable)
                .doBeforeRetry(signal -> log.warn("⚠️ {} {} failed (attempt {}/{}), retrying: {}",
                        providerName, operation, signal.totalRetries() + 1, maxAttempts,
                        signal.failure().getMessage()));

        try {
            return Mono.fromCallable(() -> {
                        attempts.incrementAndGet();
                        return call.call();
                    })
                    .subscribeOn(Schedulers.boundedElastic())
                    .timeout(Duration.ofMillis(retryConfig.getAttemptTimeoutMs()))
                    .retryWhen(retrySpec)
                    .block();
        } catch (RuntimeException e) {
            Throwable failure = Exceptions.isRetryExhausted(e) && e.getCause() != null
                    ? e.getCause()
                    : Exceptions.unwrap(e);
            ProviderException providerFailure = ProviderException.from(providerName, operation, failure)
                    .afterAttempts(attempts.get());
            log.error("❌ {} {} gave up after {} attempt(s): {}",
                    providerName, operation, attempts.get(), failure.getMessage());
            throw providerFailure;
        }
    }

    static boolean isRetryable(Throwable error) {
        if (error instanceof ProviderException providerException) {
            return providerException.isTransientFailure();
        }
        return error instanceof TimeoutException;
    }
}
