package com.purchasingpower.docqa.configuration;

import jakarta.validation.constraints.Min;
import lombok.Data;

@Data
public class ConcurrencyProperties {

    @Min(1)
    private int corePoolSize = 8;

    @Min(1)
    private int maxPoolSize = 32;

    @Min(0)
    private int queueCapacity = 200;

    /**
     * How long a finished run may wait for earlier runs of the same conversation to commit.
     * Raised at runtime to the provider retry budget of one run when set lower.
     */
    @Min(1)
    private long commitWaitTimeoutMs = 120000;

    /**
     * Async timeout of a chat request. Raised at runtime to one run's retry budget
     * plus the commit wait when set lower.
     */
    @Min(1)
    private long requestTimeoutMs = 300000;
}
