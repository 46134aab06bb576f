package com.williamcallahan.webingest.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.mongodb.client.result.UpdateResult;
import com.williamcallahan.webingest.config.AppProperties;
import com.williamcallahan.webingest.domain.ingestion.ContentQuality;
import com.williamcallahan.webingest.domain.ingestion.ReviewStatus;
import com.williamcallahan.webingest.domain.ingestion.StoredWebContent;
import com.williamcallahan.webingest.domain.ingestion.UpsertResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Date;
import java.util.List;
import java.util.Map;
import org.bson.BsonObjectId;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.dao.InvalidDataAccessApiUsageException;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.index.IndexDefinition;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.data.mongodb.core.query.UpdateDefinition;

/**
 * Verifies the single-operation upsert document and failure classification against a mocked template.
 */
class MongoWebContentStoreTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final String COLLECTION = "web_content";

    private MongoOperations mongoOperations;
    private MongoWebContentStore store;

    @BeforeEach
    void setUp() {
        mongoOperations = mock(MongoOperations.class);
        AppProperties appProperties = new AppProperties();
        appProperties.getStore().setInitialBackoff(Duration.ZERO);
        store = new MongoWebContentStore(mongoOperations, appProperties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void upsertSetsMutableFieldsAndGuardsInsertOnlyFields() {
        Update update = MongoWebContentStore.buildUpsert(record(), Date.from(NOW));
        Document updateObject = update.getUpdateObject();

        Document set = updateObject.get("$set", Document.class);
        Document setOnInsert = updateObject.get("$setOnInsert", Document.class);
        assertEquals("Title", set.get(MongoWebContentStore.FIELD_TITLE));
        assertEquals(Date.from(NOW), set.get(MongoWebContentStore.FIELD_UPDATED_AT));
        assertEquals(3, set.get(MongoWebContentStore.FIELD_READING_MINUTES));
        assertEquals(List.of("checked"), set.get(MongoWebContentStore.FIELD_QUALITY, Document.class).get("checks"));
        assertEquals(Date.from(NOW), setOnInsert.get(MongoWebContentStore.FIELD_CREATED_AT));
        assertEquals("pending", setOnInsert.get(MongoWebContentStore.FIELD_REVIEW_STATUS));
        assertEquals(2, setOnInsert.size());
        assertNull(set.get(MongoWebContentStore.FIELD_CREATED_AT));
        assertNull(set.get(MongoWebContentStore.FIELD_REVIEW_STATUS));
    }

    @Test
    void upsertedIdMeansInserted() {
        UpdateResult inserted = mock(UpdateResult.class);
        when(inserted.getUpsertedId()).thenReturn(new BsonObjectId());
        when(mongoOperations.upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION))).thenReturn(inserted);

        assertEquals(UpsertResult.INSERTED, store.upsert(record()));
    }

    @Test
    void matchedDocumentMeansUpdated() {
        UpdateResult matched = mock(UpdateResult.class);
        when(mongoOperations.upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION))).thenReturn(matched);

        assertEquals(UpsertResult.UPDATED, store.upsert(record()));
    }

    @Test
    void duplicateKeyRaceIsRetried() {
        UpdateResult matched = mock(UpdateResult.class);
        when(mongoOperations.upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION)))
            .thenThrow(new DuplicateKeyException("E11000 duplicate key"))
            .thenReturn(matched);

        assertEquals(UpsertResult.UPDATED, store.upsert(record()));
        verify(mongoOperations, times(2)).upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION));
    }

    @Test
    void persistentConnectivityFailureIsFatal() {
        when(mongoOperations.upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION)))
            .thenThrow(new DataAccessResourceFailureException("Connection refused"));

        assertThrows(StoreUnavailableException.class, () -> store.upsert(record()));
        verify(mongoOperations, times(3)).upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION));
    }

    @Test
    void otherFailuresAreRecordScoped() {
        when(mongoOperations.upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION)))
            .thenThrow(new InvalidDataAccessApiUsageException("document too large"));

        WebContentStoreException failure = assertThrows(WebContentStoreException.class, () -> store.upsert(record()));
        assertInstanceOf(InvalidDataAccessApiUsageException.class, failure.getCause());
        verify(mongoOperations, times(1)).upsert(any(Query.class), any(UpdateDefinition.class), eq(COLLECTION));
    }

    @Test
    void ensureIndexesCreatesThreeIndexes() {
        IndexOperations indexOperations = mock(IndexOperations.class);
        when(mongoOperations.indexOps(COLLECTION)).thenReturn(indexOperations);

        store.ensureIndexes();

        ArgumentCaptor<IndexDefinition> indexes = ArgumentCaptor.forClass(IndexDefinition.class);
        verify(indexOperations, times(3)).ensureIndex(indexes.capture());
        IndexDefinition hashIndex = indexes.getAllValues().get(0);
        assertEquals(Boolean.TRUE, hashIndex.getIndexOptions().get("unique"));
        assertEquals(Boolean.TRUE, indexes.getAllValues().get(1).getIndexOptions().get("sparse"));
        assertEquals(-1, indexes.getAllValues().get(2).getIndexKeys().get(MongoWebContentStore.FIELD_CREATED_AT));
    }

    @Test
    void ensureIndexesFailureIsFatal() {
        IndexOperations indexOperations = mock(IndexOperations.class);
        when(mongoOperations.indexOps(COLLECTION)).thenReturn(indexOperations);
        when(indexOperations.ensureIndex(any(IndexDefinition.class)))
            .thenThrow(new DataAccessResourceFailureException("Timed out after 5000 ms"));

        assertThrows(StoreUnavailableException.class, store::ensureIndexes);
    }

    @Test
    void findByCanonicalUrlOrdersByCreation() {
        when(mongoOperations.find(any(Query.class), eq(Document.class), eq(COLLECTION))).thenReturn(List.of());

        store.findByCanonicalUrl("https://example.com/");

        ArgumentCaptor<Query> query = ArgumentCaptor.forClass(Query.class);
        verify(mongoOperations).find(query.capture(), eq(Document.class), eq(COLLECTION));
        assertEquals("https://example.com/",
            query.getValue().getQueryObject().get(MongoWebContentStore.FIELD_CANONICAL_URL));
        assertEquals(new Document(MongoWebContentStore.FIELD_CREATED_AT, 1), query.getValue().getSortObject());
    }

    @Test
    void readsStoredDocumentBack() {
        Document stored = new Document()
            .append(MongoWebContentStore.FIELD_HASH, "h1")
            .append(MongoWebContentStore.FIELD_TEXT, "body text")
            .append(MongoWebContentStore.FIELD_CANONICAL_URL, "https://example.com/")
            .append(MongoWebContentStore.FIELD_READING_MINUTES, 2)
            .append(MongoWebContentStore.FIELD_REVIEW_STATUS, "approved")
            .append(MongoWebContentStore.FIELD_QUALITY, new Document("hasTitle", true).append("checks", List.of()))
            .append(MongoWebContentStore.FIELD_CREATED_AT, Date.from(NOW))
            .append(MongoWebContentStore.FIELD_UPDATED_AT, Date.from(NOW.plusSeconds(60)));

        StoredWebContent record = MongoWebContentStore.fromDocument(stored);

        assertEquals("h1", record.hash());
        assertEquals(2, record.readingMinutes());
        assertEquals(ReviewStatus.APPROVED, record.reviewStatus());
        assertTrue(record.quality().hasTitle());
        assertEquals(NOW, record.createdAt());
        assertEquals(NOW.plusSeconds(60), record.updatedAt());
    }

    private static StoredWebContent record() {
        return new StoredWebContent("a".repeat(64), "Title", null, "body text", "https://example.com/", null, "en", 3,
            new ContentQuality(true, false, true, List.of("checked")), ReviewStatus.PENDING,
            Map.of("topic", "rag"), null, null);
    }
}
