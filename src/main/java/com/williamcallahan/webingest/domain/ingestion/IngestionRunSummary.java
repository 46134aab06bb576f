package com.williamcallahan.webingest.domain.ingestion;

/**
 * Aggregate counts for one ingestion run.
 *
 * @param inserted records stored for the first time
 * @param updated records that refreshed an existing row
 * @param rejected records that failed the quality gate
 * @param unusable malformed lines, records without text, and records the store refused
 * @param cancelled true when intake stopped before the input was exhausted
 */
public record IngestionRunSummary(int inserted, int updated, int rejected, int unusable, boolean cancelled) {

    /**
     * Records successfully stored, inserts and updates alike.
     */
    public int upserts() {
        return inserted + updated;
    }

    /**
     * Records that reached any terminal outcome.
     */
    public int total() {
        return upserts() + rejected + unusable;
    }
}
