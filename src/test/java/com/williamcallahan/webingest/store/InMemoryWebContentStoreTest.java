package com.williamcallahan.webingest.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.williamcallahan.webingest.domain.ingestion.ContentQuality;
import com.williamcallahan.webingest.domain.ingestion.ReviewStatus;
import com.williamcallahan.webingest.domain.ingestion.StoredWebContent;
import com.williamcallahan.webingest.domain.ingestion.UpsertResult;
import com.williamcallahan.webingest.support.TickingClock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

/**
 * Verifies per-key upsert semantics of the process-local store.
 */
class InMemoryWebContentStoreTest {

    private final InMemoryWebContentStore store = new InMemoryWebContentStore(TickingClock.startingAtEpoch());

    @Test
    void firstUpsertInsertsAndSecondUpdates() {
        assertEquals(UpsertResult.INSERTED, store.upsert(record("h1", "Title A")));
        assertEquals(UpsertResult.UPDATED, store.upsert(record("h1", "Title B")));

        assertEquals(1, store.count());
        assertEquals("Title B", store.findByHash("h1").orElseThrow().title());
    }

    @Test
    void createdAtIsKeptAndUpdatedAtAdvances() {
        store.upsert(record("h1", "Title A"));
        StoredWebContent inserted = store.findByHash("h1").orElseThrow();
        store.upsert(record("h1", "Title B"));
        StoredWebContent updated = store.findByHash("h1").orElseThrow();

        assertEquals(inserted.createdAt(), inserted.updatedAt());
        assertEquals(inserted.createdAt(), updated.createdAt());
        assertTrue(updated.updatedAt().isAfter(inserted.updatedAt()));
    }

    @Test
    void reviewStatusIsAssignedOnInsertAndNeverOverwritten() {
        StoredWebContent approvedByCaller = record("h1", "Title").withStoreState(ReviewStatus.APPROVED, null, null);

        store.upsert(approvedByCaller);
        store.upsert(approvedByCaller);

        assertEquals(ReviewStatus.PENDING, store.findByHash("h1").orElseThrow().reviewStatus());
    }

    @Test
    void findsRecordsByCanonicalUrl() {
        store.upsert(record("h1", "One"));
        store.upsert(record("h2", "Two"));

        List<StoredWebContent> matches = store.findByCanonicalUrl("https://example.com/page");

        assertEquals(List.of("h1", "h2"), matches.stream().map(StoredWebContent::hash).toList());
        assertTrue(store.findByCanonicalUrl("https://example.com/other").isEmpty());
    }

    @Test
    void concurrentUpsertsOfOneHashLeaveOneRow() throws Exception {
        int writers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(8);
        List<Callable<UpsertResult>> tasks = new ArrayList<>();
        for (int index = 0; index < writers; index++) {
            String title = "Title " + index;
            tasks.add(() -> store.upsert(record("shared", title)));
        }

        List<UpsertResult> results = new ArrayList<>();
        try {
            for (Future<UpsertResult> future : pool.invokeAll(tasks)) {
                results.add(future.get());
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, store.count());
        assertEquals(1, results.stream().filter(UpsertResult.INSERTED::equals).count());
        assertEquals(writers - 1, results.stream().filter(UpsertResult.UPDATED::equals).count());
        assertEquals(Instant.parse("2025-01-01T00:00:00Z"), store.findByHash("shared").orElseThrow().createdAt());
    }

    private static StoredWebContent record(String hash, String title) {
        return new StoredWebContent(hash, title, null, "body text", "https://example.com/page", null, "en", 1,
            new ContentQuality(true, false, true, List.of()), null, Map.of(), null, null);
    }
}
