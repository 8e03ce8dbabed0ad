package com.purchasingpower.docqa.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Global retry configuration for embedding and generation provider calls.
 *
 * <p>Every call to an external model provider goes through
 * {@link com.purchasingpower.docqa.util.ProviderCallExecutor}, which applies these
 * settings: a bounded number of attempts, exponential backoff between them and a
 * timeout on each individual attempt.
 *
 * <p>Properties are loaded from the {@code app.retry} namespace in application.yml.
 * Example configuration:
 * <pre>
 * app:
 *   retry:
 *     max-attempts: 3
 *     backoff-ms: 500
 *     max-backoff-ms: 5000
 *     attempt-timeout-ms: 60000
 * </pre>
 *
 * <p><b>Exponential Backoff Calculation:</b>
 * For retry N (starting at 0), the delay is:
 * <pre>
 *   delay = min(backoff-ms * 2^N, max-backoff-ms)
 * </pre>
 * Example with defaults: 0.5s, 1s, then capped at 5s
 *
 * @since 1.0.0
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class GlobalRetryConfig {

    /**
     * Provider calls one question run can make: query embedding, generation and
     * the general-knowledge fallback generation.
     */
    public static final int PROVIDER_CALLS_PER_RUN = 3;

    /**
     * Total number of attempts, including the first one.
     * Range: 1-10
     * Default: 3
     */
    private int maxAttempts = 3;

    /**
     * Delay in milliseconds before the first retry.
     * Default: 500
     */
    private long backoffMs = 500;

    /**
     * Upper bound for the delay between two attempts.
     * Default: 5000
     */
    private long maxBackoffMs = 5000;

    /**
     * Timeout for a single attempt. A timed-out attempt counts as a transient failure.
     * Default: 60000
     */
    private long attemptTimeoutMs = 60000;

    /**
     * Longest time one provider call may take: every attempt timing out plus the backoff between attempts.
     */
    public long callBudgetMs() {
        int attempts = Math.max(1, maxAttempts);
        long total = attempts * attemptTimeoutMs;
        long delay = backoffMs;
        for (int retry = 1; retry < attempts; retry++) {
            total += Math.min(delay, Math.max(backoffMs, maxBackoffMs));
            delay *= 2;
        }
        return total;
    }

    /**
     * Longest time one question run may spend in provider calls.
     */
    public long runBudgetMs() {
        return PROVIDER_CALLS_PER_RUN * callBudgetMs();
    }
}
