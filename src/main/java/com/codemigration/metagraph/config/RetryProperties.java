package com.codemigration.metagraph.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Retry policy for transient failures of pipeline stages.
 *
 * <p>For attempt N (starting at 0) the delay before the next attempt is
 * <pre>
 *   delay = min(backoff-ms * (multiplier ^ N), max-backoff-ms)
 * </pre>
 */
@ConfigurationProperties(prefix = "app.retry")
@Data
public class RetryProperties {

    /**
     * Total attempts, including the first one.
     */
    private int maxAttempts = 3;

    private long backoffMs = 1000;

    private long maxBackoffMs = 10_000;

    private double multiplier = 2.0;

    public long delayForAttempt(int attempt) {
        double delay = backoffMs * Math.pow(multiplier, attempt);
        return (long) Math.min(delay, maxBackoffMs);
    }
}
