package com.williamcallahan.webingest.domain.ingestion;

import java.util.List;
import java.util.Objects;

/**
 * Terminal outcome of one input record.
 */
public sealed interface RecordOutcome
        permits RecordOutcome.Accepted, RecordOutcome.Rejected, RecordOutcome.Unusable {

    /** Phase label for lines that were not valid JSON objects. */
    String PHASE_PARSE = "parse";
    /** Phase label for records missing required content. */
    String PHASE_TRANSFORM = "transform";
    /** Phase label for records the store refused. */
    String PHASE_STORE = "store";
    /** Phase label for records that hit an unexpected processing error. */
    String PHASE_UNEXPECTED = "unexpected";

    static RecordOutcome accepted(String hash, UpsertResult upsertResult) {
        return new Accepted(hash, upsertResult);
    }

    static RecordOutcome rejected(String hash, List<String> reasons) {
        return new Rejected(hash, reasons);
    }

    static RecordOutcome unusable(int lineNumber, String phase, String reason) {
        return new Unusable(lineNumber, phase, reason);
    }

    record Accepted(String hash, UpsertResult upsertResult) implements RecordOutcome {
        public Accepted {
            Objects.requireNonNull(hash, "hash");
            Objects.requireNonNull(upsertResult, "upsertResult");
        }
    }

    record Rejected(String hash, List<String> reasons) implements RecordOutcome {
        public Rejected {
            Objects.requireNonNull(hash, "hash");
            if (reasons == null || reasons.isEmpty()) {
                throw new IllegalArgumentException("A rejection needs at least one reason");
            }
            reasons = List.copyOf(reasons);
        }
    }

    record Unusable(int lineNumber, String phase, String reason) implements RecordOutcome {
        public Unusable {
            if (phase == null || phase.isBlank()) {
                throw new IllegalArgumentException("Failure phase is required");
            }
            Objects.requireNonNull(reason, "reason");
        }
    }
}
