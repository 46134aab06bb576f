package com.williamcallahan.webingest.domain.ingestion;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Map;

/**
 * Untrusted web content record as it arrives on one input line.
 *
 * <p>No invariants are enforced here; {@code WebContentTransformer} decides whether the
 * record is usable.</p>
 *
 * @param text body text (required downstream, may be null or blank here)
 * @param title optional title
 * @param description optional summary
 * @param url optional source URL, canonicalized downstream
 * @param source optional producer label
 * @param hash optional caller-supplied identity
 * @param lang optional language tag
 * @param readingMinutes optional reading time
 * @param metadata optional free-form metadata object
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawWebContent(
        String text,
        String title,
        String description,
        String url,
        String source,
        String hash,
        String lang,
        Integer readingMinutes,
        Map<String, Object> metadata) {

    /**
     * Creates a record with only text and URL, the minimum that yields a computed identity.
     */
    public static RawWebContent of(String text, String url) {
        return new RawWebContent(text, null, null, url, null, null, null, null, null);
    }
}
