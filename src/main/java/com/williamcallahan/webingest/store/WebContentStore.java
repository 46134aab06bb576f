package com.williamcallahan.webingest.store;

import com.williamcallahan.webingest.domain.ingestion.StoredWebContent;
import com.williamcallahan.webingest.domain.ingestion.UpsertResult;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of accepted web content, keyed by content hash.
 *
 * <p>Implementations must make {@link #upsert} atomic per hash: concurrent upserts of the
 * same hash converge to one row, the last successful write wins on mutable fields, and
 * {@code createdAt} keeps the value of the first insert.</p>
 */
public interface WebContentStore {

    /**
     * Establishes the unique hash index and the lookup indexes. Must run before the first upsert.
     *
     * @throws StoreUnavailableException when the store cannot be reached or indexed
     */
    void ensureIndexes();

    /**
     * Inserts the record, or overwrites the mutable fields of the existing row with the same hash.
     *
     * <p>Sets {@code updatedAt} to now on every call; sets {@code createdAt} and the pending
     * review status only when the row is created.</p>
     *
     * @param record gated record; timestamps on it are ignored
     * @return whether the row was created or refreshed
     * @throws StoreUnavailableException when the store is unreachable after retries
     * @throws WebContentStoreException when the store refuses this record
     */
    UpsertResult upsert(StoredWebContent record);

    /**
     * Looks up a stored record by identity.
     */
    Optional<StoredWebContent> findByHash(String hash);

    /**
     * Lists stored records sharing a canonical URL.
     */
    List<StoredWebContent> findByCanonicalUrl(String canonicalUrl);

    /**
     * Returns the number of stored records.
     */
    long count();
}
