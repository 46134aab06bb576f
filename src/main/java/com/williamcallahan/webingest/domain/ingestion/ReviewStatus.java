package com.williamcallahan.webingest.domain.ingestion;

import java.util.Locale;

/**
 * Editorial review state. Ingestion only ever sets {@link #PENDING}, and only on first insert.
 */
public enum ReviewStatus {
    PENDING,
    APPROVED,
    REJECTED;

    /**
     * Stored representation, lowercase to match the existing collection.
     */
    public String storedValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a stored value, treating unknown or missing values as pending.
     */
    public static ReviewStatus fromStoredValue(String storedValue) {
        if (storedValue == null) {
            return PENDING;
        }
        for (ReviewStatus status : values()) {
            if (status.storedValue().equals(storedValue)) {
                return status;
            }
        }
        return PENDING;
    }
}
