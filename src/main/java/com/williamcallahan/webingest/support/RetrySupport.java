package com.williamcallahan.webingest.support;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Bounded exponential backoff for idempotent store operations.
 *
 * <p>Only failures accepted by the supplied predicate are retried; anything else is
 * rethrown on the attempt that raised it.</p>
 */
public final class RetrySupport {

    private static final Logger log = LoggerFactory.getLogger(RetrySupport.class);

    /** Backoff multiplier between attempts. */
    public static final double DEFAULT_MULTIPLIER = 2.0;
    /** Upper bound for a single wait. */
    public static final Duration MAX_BACKOFF = Duration.ofSeconds(30);

    private RetrySupport() {}

    /**
     * Executes an operation, retrying failures the predicate classifies as transient.
     *
     * @param operation idempotent operation to execute
     * @param operationName name for logging purposes
     * @param maxAttempts maximum number of attempts, at least 1
     * @param initialBackoff wait before the second attempt
     * @param retryable decides whether a failure is worth another attempt
     * @param <T> return type
     * @return the result of the first successful attempt
     * @throws RuntimeException the last failure when attempts are exhausted or the failure is not retryable
     */
    public static <T> T executeWithRetry(
            Supplier<T> operation,
            String operationName,
            int maxAttempts,
            Duration initialBackoff,
            Predicate<Throwable> retryable) {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(retryable, "retryable");
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }

        RuntimeException lastException = null;
        Duration currentBackoff = initialBackoff == null ? Duration.ZERO : initialBackoff;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return operation.get();
            } catch (RuntimeException exception) {
                lastException = exception;

                if (!retryable.test(exception)) {
                    log.debug("{} failed with non-transient error on attempt {}/{}, not retrying",
                        operationName, attempt, maxAttempts);
                    throw exception;
                }

                if (attempt < maxAttempts) {
                    log.warn("{} failed with transient error on attempt {}/{}, retrying in {}ms",
                        operationName, attempt, maxAttempts, currentBackoff.toMillis());
                    sleep(currentBackoff);
                    long nextBackoffMillis = (long) (currentBackoff.toMillis() * DEFAULT_MULTIPLIER);
                    currentBackoff = Duration.ofMillis(Math.min(nextBackoffMillis, MAX_BACKOFF.toMillis()));
                } else {
                    log.error("{} failed after {} attempts, giving up", operationName, maxAttempts);
                }
            }
        }

        throw lastException;
    }

    private static void sleep(Duration backoff) {
        if (backoff.isZero() || backoff.isNegative()) {
            return;
        }
        try {
            Thread.sleep(backoff.toMillis());
        } catch (InterruptedException interrupted) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Retry interrupted", interrupted);
        }
    }
}
