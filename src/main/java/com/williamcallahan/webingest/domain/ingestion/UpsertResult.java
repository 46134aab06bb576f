package com.williamcallahan.webingest.domain.ingestion;

/**
 * Whether an upsert created the row or refreshed an existing one.
 */
public enum UpsertResult {
    INSERTED,
    UPDATED
}
