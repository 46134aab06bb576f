package com.williamcallahan.webingest.support;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;

/**
 * Verifies bounded retry of transient store failures.
 */
class RetrySupportTest {

    @Test
    void retriesTransientFailuresUntilSuccess() {
        AtomicInteger attempts = new AtomicInteger();

        String result = RetrySupport.executeWithRetry(() -> {
            if (attempts.incrementAndGet() < 3) {
                throw new DuplicateKeyException("E11000 duplicate key error");
            }
            return "stored";
        }, "upsert", 3, Duration.ZERO, StoreErrorClassifier::isTransientStoreError);

        assertEquals("stored", result);
        assertEquals(3, attempts.get());
    }

    @Test
    void rethrowsLastFailureWhenAttemptsAreExhausted() {
        AtomicInteger attempts = new AtomicInteger();
        DataAccessResourceFailureException failure = new DataAccessResourceFailureException("connection refused");

        DataAccessResourceFailureException thrown = assertThrows(DataAccessResourceFailureException.class,
            () -> RetrySupport.executeWithRetry(() -> {
                attempts.incrementAndGet();
                throw failure;
            }, "upsert", 2, Duration.ZERO, StoreErrorClassifier::isTransientStoreError));

        assertSame(failure, thrown);
        assertEquals(2, attempts.get());
    }

    @Test
    void doesNotRetryNonTransientFailures() {
        AtomicInteger attempts = new AtomicInteger();

        assertThrows(IllegalArgumentException.class, () -> RetrySupport.executeWithRetry(() -> {
            attempts.incrementAndGet();
            throw new IllegalArgumentException("document too large");
        }, "upsert", 5, Duration.ZERO, StoreErrorClassifier::isTransientStoreError));

        assertEquals(1, attempts.get());
    }

    @Test
    void rejectsNonPositiveAttemptCount() {
        assertThrows(IllegalArgumentException.class, () -> RetrySupport.executeWithRetry(
            () -> "never", "upsert", 0, Duration.ZERO, error -> true));
    }
}
