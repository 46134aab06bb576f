package com.williamcallahan.webingest.service.ingestion;

import com.williamcallahan.webingest.config.AppProperties;
import com.williamcallahan.webingest.domain.ingestion.ContentQuality;
import com.williamcallahan.webingest.domain.ingestion.IngestionRunSummary;
import com.williamcallahan.webingest.domain.ingestion.RawRecordParseResult;
import com.williamcallahan.webingest.domain.ingestion.RecordOutcome;
import com.williamcallahan.webingest.domain.ingestion.StoredWebContent;
import com.williamcallahan.webingest.domain.ingestion.UpsertResult;
import com.williamcallahan.webingest.store.StoreUnavailableException;
import com.williamcallahan.webingest.store.WebContentStore;
import com.williamcallahan.webingest.store.WebContentStoreException;
import java.io.InputStream;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Runs NDJSON input through transform, quality gate and idempotent upsert.
 *
 * <p>Per-record failures become {@link RecordOutcome} values and never stop the run. A
 * {@link StoreUnavailableException} stops intake and propagates to the caller; upserts
 * that completed before it stay stored.</p>
 */
@Service
public class WebContentIngestionPipeline {
    private static final Logger log = LoggerFactory.getLogger(WebContentIngestionPipeline.class);

    private static final int IN_FLIGHT_PER_WORKER = 2;
    private static final long TERMINATION_POLL_SECONDS = 30;

    private final NdjsonRecordReader reader;
    private final WebContentTransformer transformer;
    private final WebContentQualityGate qualityGate;
    private final WebContentStore store;
    private final int workers;
    private final AtomicReference<AtomicBoolean> activeRunCancellation = new AtomicReference<>();

    public WebContentIngestionPipeline(NdjsonRecordReader reader,
                                       WebContentTransformer transformer,
                                       WebContentQualityGate qualityGate,
                                       WebContentStore store,
                                       AppProperties appProperties) {
        this.reader = Objects.requireNonNull(reader, "reader");
        this.transformer = Objects.requireNonNull(transformer, "transformer");
        this.qualityGate = Objects.requireNonNull(qualityGate, "qualityGate");
        this.store = Objects.requireNonNull(store, "store");
        this.workers = Objects.requireNonNull(appProperties, "appProperties").getIngest().getWorkers();
    }

    /**
     * Prepares the store and ingests every line of the input.
     *
     * @param input NDJSON stream, closed when the run ends
     * @param reporter collects outcomes for this run
     * @return final counts
     * @throws StoreUnavailableException when the store cannot be prepared or becomes unreachable
     */
    public IngestionRunSummary ingest(InputStream input, IngestionReporter reporter) {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(reporter, "reporter");

        store.ensureIndexes();

        long startTime = System.currentTimeMillis();
        log.info("Ingestion run starting (workers={})", workers);

        AtomicBoolean runCancelled = new AtomicBoolean();
        activeRunCancellation.set(runCancelled);
        try (Stream<RawRecordParseResult> parseResults = reader.read(input)) {
            Iterator<RawRecordParseResult> pending = parseResults.iterator();
            if (workers <= 1) {
                ingestSequentially(pending, reporter, runCancelled);
            } else {
                ingestConcurrently(pending, reporter, runCancelled);
            }
        } finally {
            activeRunCancellation.compareAndSet(runCancelled, null);
        }

        IngestionRunSummary summary = reporter.summary();
        log.info("Ingestion run {} in {}ms: {} records, inserted={}, updated={}, rejected={}, unusable={}",
            summary.cancelled() ? "cancelled" : "complete",
            System.currentTimeMillis() - startTime,
            summary.total(), summary.inserted(), summary.updated(), summary.rejected(), summary.unusable());
        return summary;
    }

    /**
     * Requests that the run in progress stop intake at the next record boundary.
     * Has no effect when no run is active; later runs start uncancelled.
     */
    public void cancel() {
        AtomicBoolean runCancelled = activeRunCancellation.get();
        if (runCancelled != null) {
            runCancelled.set(true);
        }
    }

    /**
     * Carries one parse result to its terminal outcome.
     *
     * @param parseResult parsed or malformed line
     * @return terminal outcome
     * @throws StoreUnavailableException when the store is unreachable
     */
    public RecordOutcome process(RawRecordParseResult parseResult) {
        Objects.requireNonNull(parseResult, "parseResult");
        int lineNumber = parseResult.lineNumber();
        if (parseResult instanceof RawRecordParseResult.Malformed malformed) {
            return RecordOutcome.unusable(lineNumber, RecordOutcome.PHASE_PARSE, malformed.reason());
        }
        RawRecordParseResult.Parsed parsed = (RawRecordParseResult.Parsed) parseResult;

        TransformResult transformResult = transformer.transform(parsed.record());
        if (transformResult instanceof TransformResult.Unusable unusable) {
            return RecordOutcome.unusable(lineNumber, RecordOutcome.PHASE_TRANSFORM, unusable.reason());
        }
        StoredWebContent candidate = ((TransformResult.Candidate) transformResult).record();

        ContentQuality quality = qualityGate.evaluate(candidate);
        if (!quality.accepted()) {
            return RecordOutcome.rejected(candidate.hash(), quality.checks());
        }

        try {
            UpsertResult upsertResult = store.upsert(candidate.withQuality(quality));
            return RecordOutcome.accepted(candidate.hash(), upsertResult);
        } catch (WebContentStoreException e) {
            return RecordOutcome.unusable(lineNumber, RecordOutcome.PHASE_STORE, e.getMessage());
        }
    }

    private void ingestSequentially(Iterator<RawRecordParseResult> pending,
                                    IngestionReporter reporter,
                                    AtomicBoolean runCancelled) {
        while (pending.hasNext()) {
            if (isCancelled(runCancelled)) {
                reporter.markCancelled();
                return;
            }
            reporter.record(processGuarded(pending.next()));
        }
    }

    private void ingestConcurrently(Iterator<RawRecordParseResult> pending,
                                    IngestionReporter reporter,
                                    AtomicBoolean runCancelled) {
        ExecutorService workerPool = Executors.newFixedThreadPool(workers, workerThreadFactory());
        Semaphore inFlight = new Semaphore(workers * IN_FLIGHT_PER_WORKER);
        AtomicReference<StoreUnavailableException> fatal = new AtomicReference<>();

        try {
            while (fatal.get() == null && pending.hasNext()) {
                if (isCancelled(runCancelled)) {
                    reporter.markCancelled();
                    break;
                }
                RawRecordParseResult next = pending.next();
                inFlight.acquire();
                workerPool.execute(() -> {
                    try {
                        if (fatal.get() == null) {
                            reporter.record(processGuarded(next));
                        }
                    } catch (StoreUnavailableException e) {
                        fatal.compareAndSet(null, e);
                    } finally {
                        inFlight.release();
                    }
                });
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            reporter.markCancelled();
        } finally {
            awaitWorkers(workerPool, reporter);
        }

        StoreUnavailableException fatalError = fatal.get();
        if (fatalError != null) {
            throw fatalError;
        }
    }

    private RecordOutcome processGuarded(RawRecordParseResult parseResult) {
        try {
            return process(parseResult);
        } catch (StoreUnavailableException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("Unexpected failure on line {}", parseResult.lineNumber(), e);
            return RecordOutcome.unusable(parseResult.lineNumber(), RecordOutcome.PHASE_UNEXPECTED,
                e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private void awaitWorkers(ExecutorService workerPool, IngestionReporter reporter) {
        workerPool.shutdown();
        try {
            while (!workerPool.awaitTermination(TERMINATION_POLL_SECONDS, TimeUnit.SECONDS)) {
                log.info("Waiting for in-flight records to finish");
            }
        } catch (InterruptedException e) {
            workerPool.shutdownNow();
            Thread.currentThread().interrupt();
            reporter.markCancelled();
        }
    }

    private static boolean isCancelled(AtomicBoolean runCancelled) {
        return runCancelled.get() || Thread.currentThread().isInterrupted();
    }

    private static ThreadFactory workerThreadFactory() {
        AtomicInteger threadIndex = new AtomicInteger();
        return runnable -> {
            Thread worker = new Thread(runnable, "ingest-worker-" + threadIndex.incrementAndGet());
            worker.setDaemon(true);
            return worker;
        };
    }
}
