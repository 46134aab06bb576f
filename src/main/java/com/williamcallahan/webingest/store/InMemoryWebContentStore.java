package com.williamcallahan.webingest.store;

import com.williamcallahan.webingest.domain.ingestion.ReviewStatus;
import com.williamcallahan.webingest.domain.ingestion.StoredWebContent;
import com.williamcallahan.webingest.domain.ingestion.UpsertResult;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local store with the same per-key upsert semantics as the MongoDB store.
 * Used for dry runs ({@code app.store.type=memory}) and tests; contents vanish with the JVM.
 */
public class InMemoryWebContentStore implements WebContentStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryWebContentStore.class);

    private final ConcurrentHashMap<String, StoredWebContent> records = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryWebContentStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void ensureIndexes() {
        log.info("Using in-memory web content store (nothing is persisted beyond this process)");
    }

    @Override
    public UpsertResult upsert(StoredWebContent record) {
        Objects.requireNonNull(record, "record");
        AtomicReference<UpsertResult> outcome = new AtomicReference<>();
        // compute() holds the bin lock for this key, so concurrent upserts of one hash serialize here.
        records.compute(record.hash(), (hash, existing) -> {
            Instant now = clock.instant();
            if (existing == null) {
                outcome.set(UpsertResult.INSERTED);
                return record.withStoreState(ReviewStatus.PENDING, now, now);
            }
            outcome.set(UpsertResult.UPDATED);
            return record.withStoreState(existing.reviewStatus(), existing.createdAt(), now);
        });
        return outcome.get();
    }

    @Override
    public Optional<StoredWebContent> findByHash(String hash) {
        return Optional.ofNullable(records.get(hash));
    }

    @Override
    public List<StoredWebContent> findByCanonicalUrl(String canonicalUrl) {
        return records.values().stream()
            .filter(record -> Objects.equals(record.canonicalUrl(), canonicalUrl))
            .sorted(Comparator.comparing(StoredWebContent::createdAt))
            .toList();
    }

    @Override
    public long count() {
        return records.size();
    }
}
