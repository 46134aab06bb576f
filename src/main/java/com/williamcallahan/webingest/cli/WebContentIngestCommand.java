package com.williamcallahan.webingest.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.webingest.domain.ingestion.IngestionRunSummary;
import com.williamcallahan.webingest.service.ingestion.IngestionReporter;
import com.williamcallahan.webingest.service.ingestion.WebContentIngestionPipeline;
import jakarta.annotation.PreDestroy;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Reads NDJSON web content from stdin, stores accepted records, and prints
 * {@code {"upserts": n}} on stdout once the run completes.
 *
 * <p>Rejection diagnostics go to stderr together with the logs, so stdout carries only the
 * summary. A store that cannot be reached fails the run, which the application turns into
 * a non-zero exit status.</p>
 */
@Component
@ConditionalOnProperty(name = "app.ingest.run-on-startup", havingValue = "true", matchIfMissing = true)
public class WebContentIngestCommand implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(WebContentIngestCommand.class);

    private final WebContentIngestionPipeline pipeline;
    private final ObjectMapper objectMapper;

    public WebContentIngestCommand(WebContentIngestionPipeline pipeline, ObjectMapper objectMapper) {
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    @Override
    public void run(String... args) {
        execute(System.in, System.out, System.err);
    }

    /**
     * Runs one ingestion over the given channels.
     *
     * @param input NDJSON records
     * @param output receives the single summary line
     * @param diagnostics receives one line per quality rejection
     * @return the run summary
     */
    public IngestionRunSummary execute(InputStream input, PrintStream output, PrintStream diagnostics) {
        IngestionReporter reporter = new IngestionReporter(objectMapper, diagnostics);
        IngestionRunSummary summary = pipeline.ingest(input, reporter);
        output.println(reporter.summaryJson());
        output.flush();
        if (summary.cancelled()) {
            log.warn("Run was cancelled before the input was exhausted; {} records stored", summary.upserts());
        }
        return summary;
    }

    @PreDestroy
    public void stopIntake() {
        pipeline.cancel();
    }
}
