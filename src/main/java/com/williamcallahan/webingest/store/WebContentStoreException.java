package com.williamcallahan.webingest.store;

/**
 * Signals that the store refused a single record, for example because the document is too large.
 *
 * <p>The run continues; the record is counted as unusable.</p>
 */
public class WebContentStoreException extends RuntimeException {

    /**
     * Creates an exception with a message and the original cause.
     *
     * @param message explanation including the record hash
     * @param cause underlying driver or data access exception
     */
    public WebContentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
