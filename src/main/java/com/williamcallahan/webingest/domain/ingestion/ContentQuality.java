package com.williamcallahan.webingest.domain.ingestion;

import java.util.List;
import java.util.Objects;

/**
 * Quality gate verdict stored alongside each record.
 *
 * @param hasTitle true when a non-blank title was supplied
 * @param hasDescription true when a non-blank description was supplied
 * @param minWordsMet true when the body reached the configured word floor
 * @param checks ordered failure reasons, empty when the record is accepted
 */
public record ContentQuality(boolean hasTitle, boolean hasDescription, boolean minWordsMet, List<String> checks) {

    public ContentQuality {
        Objects.requireNonNull(checks, "checks");
        checks = List.copyOf(checks);
    }

    /**
     * Placeholder carried by candidates that have not been gated yet.
     */
    public static ContentQuality ungated() {
        return new ContentQuality(false, false, false, List.of());
    }

    /**
     * Returns true when no check failed.
     */
    public boolean accepted() {
        return checks.isEmpty();
    }
}
