package com.williamcallahan.webingest.store;

/**
 * Signals that the content store cannot be reached or prepared.
 *
 * <p>This failure is fatal for an ingestion run: records already upserted stay stored,
 * and the process exits with a non-zero status.</p>
 */
public class StoreUnavailableException extends RuntimeException {

    /**
     * Creates an exception with a human-readable message.
     *
     * @param message explanation of the store failure
     */
    public StoreUnavailableException(String message) {
        super(message);
    }

    /**
     * Creates an exception with a message and the original cause.
     *
     * @param message explanation of the store failure
     * @param cause underlying driver or data access exception
     */
    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
