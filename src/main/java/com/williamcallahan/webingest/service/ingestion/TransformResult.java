package com.williamcallahan.webingest.service.ingestion;

import com.williamcallahan.webingest.domain.ingestion.StoredWebContent;
import java.util.Objects;

/**
 * Outcome of turning a raw record into a storable candidate.
 */
public sealed interface TransformResult permits TransformResult.Candidate, TransformResult.Unusable {

    static TransformResult candidate(StoredWebContent record) {
        return new Candidate(record);
    }

    static TransformResult unusable(String reason) {
        return new Unusable(reason);
    }

    record Candidate(StoredWebContent record) implements TransformResult {
        public Candidate {
            Objects.requireNonNull(record, "record");
        }
    }

    record Unusable(String reason) implements TransformResult {
        public Unusable {
            Objects.requireNonNull(reason, "reason");
        }
    }
}
