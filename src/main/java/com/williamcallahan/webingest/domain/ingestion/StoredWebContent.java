package com.williamcallahan.webingest.domain.ingestion;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical web content record keyed by its content-addressed {@code hash}.
 *
 * <p>Candidates produced by the transformer carry no timestamps; the store assigns
 * {@code createdAt} on first insert and {@code updatedAt} on every write.</p>
 *
 * @param hash content-addressed identity
 * @param title optional title
 * @param description optional summary
 * @param text body text, never blank
 * @param canonicalUrl normalized source URL, null when no URL was supplied
 * @param source optional producer label
 * @param lang optional language tag
 * @param readingMinutes estimated or supplied reading time, always positive
 * @param quality quality gate verdict
 * @param reviewStatus editorial state, pending until a reviewer changes it
 * @param metadata free-form metadata, never null
 * @param createdAt first persistence time, null for candidates
 * @param updatedAt latest persistence time, null for candidates
 */
public record StoredWebContent(
        String hash,
        String title,
        String description,
        String text,
        String canonicalUrl,
        String source,
        String lang,
        int readingMinutes,
        ContentQuality quality,
        ReviewStatus reviewStatus,
        Map<String, Object> metadata,
        Instant createdAt,
        Instant updatedAt) {

    public StoredWebContent {
        if (hash == null || hash.isBlank()) {
            throw new IllegalArgumentException("hash is required");
        }
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("text is required");
        }
        if (readingMinutes <= 0) {
            throw new IllegalArgumentException("readingMinutes must be positive");
        }
        Objects.requireNonNull(quality, "quality");
        reviewStatus = reviewStatus == null ? ReviewStatus.PENDING : reviewStatus;
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    /**
     * Returns a copy carrying the given quality verdict.
     */
    public StoredWebContent withQuality(ContentQuality gatedQuality) {
        return new StoredWebContent(hash, title, description, text, canonicalUrl, source, lang,
                readingMinutes, gatedQuality, reviewStatus, metadata, createdAt, updatedAt);
    }

    /**
     * Returns a copy carrying store-assigned timestamps and review state.
     */
    public StoredWebContent withStoreState(ReviewStatus storedReviewStatus, Instant created, Instant updated) {
        return new StoredWebContent(hash, title, description, text, canonicalUrl, source, lang,
                readingMinutes, quality, storedReviewStatus, metadata, created, updated);
    }
}
