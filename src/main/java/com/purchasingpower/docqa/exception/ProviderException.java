package com.purchasingpower.docqa.exception;

import lombok.Getter;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.util.concurrent.TimeoutException;

/**
 * Failure reported by an embedding or generation provider.
 *
 * {@code transientFailure} marks errors worth retrying (timeouts, connection
 * errors, 429 and 5xx responses).
 */
@Getter
public class ProviderException extends RuntimeException {

    private final String providerName;
    private final boolean transientFailure;
    private final int attempts;

    public ProviderException(String providerName, String message, boolean transientFailure, Throwable cause) {
        this(providerName, message, transientFailure, 1, cause);
    }

    private ProviderException(String providerName, String message, boolean transientFailure, int attempts, Throwable cause) {
        super(message, cause);
        this.providerName = providerName;
        this.transientFailure = transientFailure;
        this.attempts = attempts;
    }

    public ProviderException(String providerName, String message, boolean transientFailure) {
        this(providerName, message, transientFailure, null);
    }

    /**
     * Translate a low-level client failure into a ProviderException, classifying
     * whether another attempt can help.
     */
    public static ProviderException from(String providerName, String operation, Throwable error) {
        if (error instanceof ProviderException providerException) {
            return providerException;
        }
        if (error instanceof WebClientResponseException webEx) {
            boolean retryable = webEx.getStatusCode().is5xxServerError() || webEx.getStatusCode().value() == 429;
            return new ProviderException(providerName,
                    operation + " failed with HTTP " + webEx.getStatusCode().value(), retryable, error);
        }
        boolean retryable = error instanceof WebClientRequestException
                || error instanceof TimeoutException
                || error instanceof IOException
                || error.getCause() instanceof IOException
                || error.getCause() instanceof TimeoutException;
        return new ProviderException(providerName,
                operation + " failed: " + error.getMessage(), retryable, error);
    }

    /**
     * Copy of this failure recording how many attempts were made before giving up.
     */
    public ProviderException afterAttempts(int attemptCount) {
        return new ProviderException(providerName, getMessage() + " (after " + attemptCount + " attempt(s))",
                transientFailure, attemptCount, getCause() != null ? getCause() : this);
    }
}
