package com.williamcallahan.webingest.service.ingestion;

import com.williamcallahan.webingest.domain.ingestion.ContentQuality;
import com.williamcallahan.webingest.domain.ingestion.RawWebContent;
import com.williamcallahan.webingest.domain.ingestion.ReviewStatus;
import com.williamcallahan.webingest.domain.ingestion.StoredWebContent;
import com.williamcallahan.webingest.service.ContentHasher;
import com.williamcallahan.webingest.support.TextStatistics;
import java.util.Objects;
import org.springframework.stereotype.Service;

/**
 * Builds canonical, not yet persisted records from raw input.
 */
@Service
public class WebContentTransformer {
    static final String MISSING_TEXT = "missing_text";

    private final ContentHasher contentHasher;
    private final UrlCanonicalizer urlCanonicalizer;
    private final ReadingTimeEstimator readingTimeEstimator;

    public WebContentTransformer(ContentHasher contentHasher,
                                 UrlCanonicalizer urlCanonicalizer,
                                 ReadingTimeEstimator readingTimeEstimator) {
        this.contentHasher = Objects.requireNonNull(contentHasher, "contentHasher");
        this.urlCanonicalizer = Objects.requireNonNull(urlCanonicalizer, "urlCanonicalizer");
        this.readingTimeEstimator = Objects.requireNonNull(readingTimeEstimator, "readingTimeEstimator");
    }

    /**
     * Transforms a raw record into a candidate, or reports it unusable when it has no text.
     *
     * <p>A supplied non-blank hash is trusted as-is. Otherwise the hash is derived from the
     * canonical URL and the exact body text.</p>
     *
     * @param raw parsed input record
     * @return candidate carrying an ungated quality placeholder, or an unusable result
     */
    public TransformResult transform(RawWebContent raw) {
        Objects.requireNonNull(raw, "raw");
        String text = raw.text();
        if (text == null || text.isBlank()) {
            return TransformResult.unusable(MISSING_TEXT);
        }

        String canonicalUrl = urlCanonicalizer.canonicalize(raw.url());
        String suppliedHash = raw.hash();
        String hash = suppliedHash != null && !suppliedHash.isBlank()
            ? suppliedHash
            : contentHasher.contentHash(canonicalUrl, text);

        StoredWebContent candidate = new StoredWebContent(
            hash,
            TextStatistics.trimToNull(raw.title()),
            TextStatistics.trimToNull(raw.description()),
            text,
            canonicalUrl,
            TextStatistics.trimToNull(raw.source()),
            TextStatistics.trimToNull(raw.lang()),
            readingTimeEstimator.readingMinutes(raw.readingMinutes(), text),
            ContentQuality.ungated(),
            ReviewStatus.PENDING,
            raw.metadata(),
            null,
            null
        );
        return TransformResult.candidate(candidate);
    }
}
