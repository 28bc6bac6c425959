package com.codemigration.metagraph.pipeline;

import com.codemigration.metagraph.config.RetryProperties;
import com.codemigration.metagraph.exception.MigrationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Runs an operation, retrying retryable {@link MigrationException}s with exponential backoff.
 * Anything else, and the last retryable failure once attempts run out, propagates.
 */
@Slf4j
@Component
public class RetryExecutor {

    @FunctionalInterface
    public interface Sleeper {
        void sleep(long millis) throws InterruptedException;
    }

    private final RetryProperties properties;
    private final Sleeper sleeper;

    @Autowired
    public RetryExecutor(RetryProperties properties) {
        this(properties, Thread::sleep);
    }

    public RetryExecutor(RetryProperties properties, Sleeper sleeper) {
        this.properties = properties;
        this.sleeper = sleeper;
    }

    public <T> T execute(String operation, Supplier<T> action) {
        int maxAttempts = Math.max(1, properties.getMaxAttempts());
        for (int attempt = 0; ; attempt++) {
            try {
                return action.get();
            } catch (MigrationException e) {
                if (!e.isRetryable() || attempt + 1 >= maxAttempts) {
                    if (e.isRetryable()) {
                        log.error("{} failed after {} attempts: {}", operation, attempt + 1, e.getMessage());
                    }
                    throw e;
                }
                long delay = properties.delayForAttempt(attempt);
                log.warn("{} failed (attempt {}/{}), retrying in {}ms: {}", operation, attempt + 1, maxAttempts,
                    delay, e.getMessage());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException interrupted) {
                    Thread.currentThread().interrupt();
                    e.addSuppressed(interrupted);
                    throw e;
                }
            }
        }
    }

    public void run(String operation, Runnable action) {
        execute(operation, () -> {
            action.run();
            return null;
        });
    }
}
