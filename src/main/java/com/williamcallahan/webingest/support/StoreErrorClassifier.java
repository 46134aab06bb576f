package com.williamcallahan.webingest.support;

import com.mongodb.MongoSocketException;
import com.mongodb.MongoTimeoutException;
import java.util.Locale;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.TransientDataAccessException;

/**
 * Classifies store failures by walking the exception chain.
 *
 * <p>Connectivity failures mean the store cannot be reached at all. Transient failures
 * are worth another attempt because the upsert is idempotent by key: connectivity
 * hiccups, transient data access errors, and the duplicate-key race two concurrent
 * first inserts of the same hash can hit.</p>
 */
public final class StoreErrorClassifier {
    private StoreErrorClassifier() {}

    /**
     * Returns true when the failure indicates the store is unreachable.
     *
     * @param error failure raised by a store call
     * @return true for connection, socket and server-selection timeout failures
     */
    public static boolean isConnectivityError(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof DataAccessResourceFailureException
                    || current instanceof MongoSocketException
                    || current instanceof MongoTimeoutException) {
                return true;
            }
            String message = current.getMessage();
            String lowerMessage = message == null ? "" : message.toLowerCase(Locale.ROOT);
            if (lowerMessage.contains("connection refused") || lowerMessage.contains("timed out")) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Returns true when retrying the same idempotent operation may succeed.
     *
     * @param error failure raised by a store call
     * @return true for connectivity, transient and duplicate-key failures
     */
    public static boolean isTransientStoreError(Throwable error) {
        if (isConnectivityError(error)) {
            return true;
        }
        Throwable current = error;
        while (current != null) {
            if (current instanceof TransientDataAccessException || current instanceof DuplicateKeyException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }
}
