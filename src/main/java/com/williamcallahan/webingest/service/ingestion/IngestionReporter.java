package com.williamcallahan.webingest.service.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.webingest.domain.ingestion.IngestionRunSummary;
import com.williamcallahan.webingest.domain.ingestion.RecordOutcome;
import com.williamcallahan.webingest.domain.ingestion.UpsertResult;
import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Counts terminal outcomes for one run and writes one diagnostic line per quality rejection.
 *
 * <p>Safe for concurrent use by pipeline workers.</p>
 */
public class IngestionReporter {
    private static final Logger log = LoggerFactory.getLogger(IngestionReporter.class);

    private final ObjectMapper objectMapper;
    private final PrintStream diagnostics;

    private final AtomicInteger inserted = new AtomicInteger();
    private final AtomicInteger updated = new AtomicInteger();
    private final AtomicInteger rejected = new AtomicInteger();
    private final AtomicInteger unusable = new AtomicInteger();
    private final AtomicBoolean cancelled = new AtomicBoolean();

    /**
     * Creates a reporter for one run.
     *
     * @param objectMapper JSON writer for diagnostics and the summary
     * @param diagnostics channel for rejection lines, kept apart from the summary output
     */
    public IngestionReporter(ObjectMapper objectMapper, PrintStream diagnostics) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
    }

    /**
     * Records one terminal outcome.
     */
    public void record(RecordOutcome outcome) {
        Objects.requireNonNull(outcome, "outcome");
        if (outcome instanceof RecordOutcome.Accepted accepted) {
            if (accepted.upsertResult() == UpsertResult.INSERTED) {
                inserted.incrementAndGet();
            } else {
                updated.incrementAndGet();
            }
            log.debug("Stored {} ({})", accepted.hash(), accepted.upsertResult());
        } else if (outcome instanceof RecordOutcome.Rejected rejection) {
            rejected.incrementAndGet();
            log.warn("Skipped {} after quality checks: {}", rejection.hash(), rejection.reasons());
            writeDiagnostic(rejection);
        } else if (outcome instanceof RecordOutcome.Unusable failure) {
            unusable.incrementAndGet();
            log.warn("Skipped line {} during {}: {}", failure.lineNumber(), failure.phase(), failure.reason());
        }
    }

    /**
     * Marks the run as stopped before the input was exhausted.
     */
    public void markCancelled() {
        cancelled.set(true);
    }

    /**
     * Returns the counts recorded so far.
     */
    public IngestionRunSummary summary() {
        return new IngestionRunSummary(
            inserted.get(), updated.get(), rejected.get(), unusable.get(), cancelled.get());
    }

    /**
     * Renders the single summary object printed at the end of a run.
     *
     * @return {@code {"upserts":n}}
     */
    public String summaryJson() {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("upserts", summary().upserts());
        return toJson(summary);
    }

    private void writeDiagnostic(RecordOutcome.Rejected rejection) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("skipped", true);
        line.put("hash", rejection.hash());
        line.put("reasons", rejection.reasons());
        diagnostics.println(toJson(line));
    }

    private String toJson(Map<String, Object> payload) {
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize report payload", e);
        }
    }
}
