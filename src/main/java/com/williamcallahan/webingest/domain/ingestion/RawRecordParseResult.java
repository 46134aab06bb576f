package com.williamcallahan.webingest.domain.ingestion;

import java.util.Objects;

/**
 * Result of parsing one non-blank input line.
 */
public sealed interface RawRecordParseResult
        permits RawRecordParseResult.Parsed, RawRecordParseResult.Malformed {

    /**
     * 1-based physical line number in the input stream.
     */
    int lineNumber();

    static RawRecordParseResult parsed(int lineNumber, RawWebContent record) {
        return new Parsed(lineNumber, record);
    }

    static RawRecordParseResult malformed(int lineNumber, String reason) {
        return new Malformed(lineNumber, reason);
    }

    record Parsed(int lineNumber, RawWebContent record) implements RawRecordParseResult {
        public Parsed {
            Objects.requireNonNull(record, "record");
        }
    }

    record Malformed(int lineNumber, String reason) implements RawRecordParseResult {
        public Malformed {
            reason = reason == null || reason.isBlank() ? "malformed line" : reason;
        }
    }
}
