package com.williamcallahan.webingest.service.ingestion;

import com.williamcallahan.webingest.config.AppProperties;
import com.williamcallahan.webingest.domain.ingestion.ContentQuality;
import com.williamcallahan.webingest.domain.ingestion.StoredWebContent;
import com.williamcallahan.webingest.support.TextStatistics;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;
import org.springframework.stereotype.Service;

/**
 * Evaluates candidates before persistence so placeholder pages, symbol soup and
 * repeated filler never reach the store.
 *
 * <p>Every check runs on every record in a fixed order; the verdict lists all failures,
 * which keeps the reasons reproducible for the same input.</p>
 */
@Service
public class WebContentQualityGate {

    static final String TEXT_TOO_SHORT = "text_too_short";
    static final String TEXT_TOO_LONG = "text_too_long";
    static final String LOW_ALPHA_RATIO = "low_alpha_ratio";
    static final String REPETITIVE_TEXT = "repetitive_text";
    static final String PLACEHOLDER_TEXT = "placeholder_text";
    static final String INVALID_CANONICAL_URL = "invalid_canonical_url";
    static final String INVALID_LANG = "invalid_lang";

    private static final String GUARD_LOADING_TOKEN = "loading";
    private static final String GUARD_PAGE_TOKEN = "page";
    private static final String GUARD_ENABLE_JS_TOKEN = "enable javascript";
    private static final String GUARD_LOREM_TOKEN = "lorem ipsum";
    private static final int PLACEHOLDER_MAX_WORDS = 50;

    private static final Pattern LANGUAGE_TAG = Pattern.compile("[A-Za-z]{2,3}(-[A-Za-z0-9]{2,8})*");

    private final AppProperties.Quality thresholds;
    private final UrlCanonicalizer urlCanonicalizer;

    public WebContentQualityGate(AppProperties appProperties, UrlCanonicalizer urlCanonicalizer) {
        this.thresholds = Objects.requireNonNull(appProperties, "appProperties").getQuality();
        this.urlCanonicalizer = Objects.requireNonNull(urlCanonicalizer, "urlCanonicalizer");
    }

    /**
     * Evaluates a candidate and returns its quality verdict.
     *
     * @param candidate transformed record
     * @return verdict whose {@code checks} are empty exactly when the record is accepted
     */
    public ContentQuality evaluate(StoredWebContent candidate) {
        Objects.requireNonNull(candidate, "candidate");
        String text = candidate.text();
        TextStatistics stats = TextStatistics.of(text);
        List<String> failures = new ArrayList<>();

        boolean minWordsMet = stats.wordCount() >= thresholds.getMinWords();
        if (!minWordsMet) {
            failures.add(TEXT_TOO_SHORT);
        }
        if (text.length() > thresholds.getMaxTextLength()) {
            failures.add(TEXT_TOO_LONG);
        }
        if (stats.alphaRatio() < thresholds.getMinAlphaRatio()) {
            failures.add(LOW_ALPHA_RATIO);
        }
        if (stats.wordCount() >= thresholds.getRepetitionMinWords()
                && stats.distinctWordRatio() < thresholds.getMinDistinctWordRatio()) {
            failures.add(REPETITIVE_TEXT);
        }
        if (looksLikePlaceholder(text, stats.wordCount())) {
            failures.add(PLACEHOLDER_TEXT);
        }
        if (candidate.canonicalUrl() != null && !urlCanonicalizer.isWebUrl(candidate.canonicalUrl())) {
            failures.add(INVALID_CANONICAL_URL);
        }
        if (candidate.lang() != null && !LANGUAGE_TAG.matcher(candidate.lang()).matches()) {
            failures.add(INVALID_LANG);
        }

        return new ContentQuality(candidate.title() != null, candidate.description() != null, minWordsMet, failures);
    }

    private static boolean looksLikePlaceholder(String text, int wordCount) {
        String lowered = TextStatistics.toLowerAscii(text);
        // Loading-screen detection applies to short bodies only.
        boolean hasLoadingPage = wordCount < PLACEHOLDER_MAX_WORDS
            && lowered.contains(GUARD_LOADING_TOKEN) && lowered.contains(GUARD_PAGE_TOKEN);
        return hasLoadingPage || lowered.contains(GUARD_ENABLE_JS_TOKEN) || lowered.contains(GUARD_LOREM_TOKEN);
    }
}
