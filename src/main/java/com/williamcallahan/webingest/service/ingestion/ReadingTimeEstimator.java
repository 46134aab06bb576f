package com.williamcallahan.webingest.service.ingestion;

import com.williamcallahan.webingest.support.TextStatistics;
import org.springframework.stereotype.Component;

/**
 * Estimates reading time as {@code max(1, ceil(words / 200))} minutes.
 */
@Component
public class ReadingTimeEstimator {
    static final int WORDS_PER_MINUTE = 200;

    /**
     * Returns the supplied value when positive, otherwise an estimate from the body.
     *
     * @param suppliedMinutes caller-supplied minutes, may be null
     * @param text body text
     * @return reading time in whole minutes, at least 1
     */
    public int readingMinutes(Integer suppliedMinutes, String text) {
        if (suppliedMinutes != null && suppliedMinutes > 0) {
            return suppliedMinutes;
        }
        return estimate(text);
    }

    int estimate(String text) {
        int wordCount = TextStatistics.of(text).wordCount();
        int minutes = (wordCount + WORDS_PER_MINUTE - 1) / WORDS_PER_MINUTE;
        return Math.max(1, minutes);
    }
}
