package com.codemigration.metagraph.pipeline;

import com.codemigration.metagraph.config.RetryProperties;
import com.codemigration.metagraph.exception.ConstraintViolationException;
import com.codemigration.metagraph.exception.TransientStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Retry Executor Tests")
class RetryExecutorTest {

    private final List<Long> sleeps = new ArrayList<>();
    private RetryProperties properties;
    private RetryExecutor executor;

    @BeforeEach
    void setUp() {
        properties = new RetryProperties();
        executor = new RetryExecutor(properties, sleeps::add);
    }

    @Test
    @DisplayName("Should retry transient failures with exponential backoff")
    void testTransientFailure_ShouldRetry() {
        AtomicInteger calls = new AtomicInteger();

        String result = executor.execute("write", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientStoreException("connection reset");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(3, calls.get());
        assertEquals(List.of(1000L, 2000L), sleeps);
    }

    @Test
    @DisplayName("Should give up after the configured attempts")
    void testTransientFailure_ShouldStopAfterMaxAttempts() {
        AtomicInteger calls = new AtomicInteger();

        TransientStoreException error = assertThrows(TransientStoreException.class,
            () -> executor.run("write", () -> {
                calls.incrementAndGet();
                throw new TransientStoreException("down");
            }));

        assertEquals("down", error.getMessage());
        assertEquals(3, calls.get());
        assertEquals(2, sleeps.size(), "No sleep after the last attempt");
    }

    @Test
    @DisplayName("Should not retry non-retryable or foreign exceptions")
    void testNonRetryable_ShouldPropagateImmediately() {
        AtomicInteger calls = new AtomicInteger();

        assertThrows(ConstraintViolationException.class, () -> executor.run("write", () -> {
            calls.incrementAndGet();
            throw new ConstraintViolationException("dangling edge");
        }));
        assertThrows(IllegalStateException.class, () -> executor.run("write", () -> {
            calls.incrementAndGet();
            throw new IllegalStateException("bug");
        }));

        assertEquals(2, calls.get());
        assertTrue(sleeps.isEmpty());
    }

    @Test
    @DisplayName("Should cap the backoff delay")
    void testDelayForAttempt_ShouldBeCapped() {
        properties.setMaxBackoffMs(5000);

        assertEquals(1000, properties.delayForAttempt(0));
        assertEquals(4000, properties.delayForAttempt(2));
        assertEquals(5000, properties.delayForAttempt(5));
    }
}
