package com.williamcallahan.webingest.store;

import com.mongodb.client.result.UpdateResult;
import com.williamcallahan.webingest.config.AppProperties;
import com.williamcallahan.webingest.domain.ingestion.ContentQuality;
import com.williamcallahan.webingest.domain.ingestion.ReviewStatus;
import com.williamcallahan.webingest.domain.ingestion.StoredWebContent;
import com.williamcallahan.webingest.domain.ingestion.UpsertResult;
import com.williamcallahan.webingest.support.RetrySupport;
import com.williamcallahan.webingest.support.StoreErrorClassifier;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoOperations;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

/**
 * MongoDB-backed store. Each upsert is one server-side update with {@code upsert=true},
 * guarded by a unique index on {@code hash}, so there is no read-then-write window.
 */
public class MongoWebContentStore implements WebContentStore {
    private static final Logger log = LoggerFactory.getLogger(MongoWebContentStore.class);

    static final String FIELD_HASH = "hash";
    static final String FIELD_TITLE = "title";
    static final String FIELD_DESCRIPTION = "description";
    static final String FIELD_TEXT = "text";
    static final String FIELD_CANONICAL_URL = "canonicalUrl";
    static final String FIELD_SOURCE = "source";
    static final String FIELD_LANG = "lang";
    static final String FIELD_READING_MINUTES = "readingMinutes";
    static final String FIELD_QUALITY = "quality";
    static final String FIELD_METADATA = "metadata";
    static final String FIELD_REVIEW_STATUS = "reviewStatus";
    static final String FIELD_CREATED_AT = "createdAt";
    static final String FIELD_UPDATED_AT = "updatedAt";

    private static final String QUALITY_HAS_TITLE = "hasTitle";
    private static final String QUALITY_HAS_DESCRIPTION = "hasDescription";
    private static final String QUALITY_MIN_WORDS_MET = "minWordsMet";
    private static final String QUALITY_CHECKS = "checks";
    private static final int LOG_HASH_PREFIX_LENGTH = 12;

    private final MongoOperations mongoOperations;
    private final String collection;
    private final int maxAttempts;
    private final Duration initialBackoff;
    private final Clock clock;

    public MongoWebContentStore(MongoOperations mongoOperations, AppProperties appProperties, Clock clock) {
        this.mongoOperations = Objects.requireNonNull(mongoOperations, "mongoOperations");
        AppProperties.Store storeProperties = Objects.requireNonNull(appProperties, "appProperties").getStore();
        this.collection = storeProperties.getCollection();
        this.maxAttempts = storeProperties.getMaxAttempts();
        this.initialBackoff = storeProperties.getInitialBackoff();
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public void ensureIndexes() {
        try {
            IndexOperations indexOps = mongoOperations.indexOps(collection);
            indexOps.ensureIndex(new Index().on(FIELD_HASH, Sort.Direction.ASC).unique());
            indexOps.ensureIndex(new Index().on(FIELD_CANONICAL_URL, Sort.Direction.ASC).sparse());
            indexOps.ensureIndex(new Index().on(FIELD_CREATED_AT, Sort.Direction.DESC));
            log.info("[MONGO] Ensured indexes on '{}' (hash unique, canonicalUrl sparse, createdAt desc)", collection);
        } catch (RuntimeException e) {
            throw new StoreUnavailableException("Unable to ensure indexes on collection '" + collection + "'", e);
        }
    }

    @Override
    public UpsertResult upsert(StoredWebContent record) {
        Objects.requireNonNull(record, "record");
        Query byHash = Query.query(Criteria.where(FIELD_HASH).is(record.hash()));
        Update update = buildUpsert(record, Date.from(clock.instant()));
        String operationName = "Upsert " + shortHash(record.hash());

        UpdateResult result;
        try {
            result = RetrySupport.executeWithRetry(
                () -> mongoOperations.upsert(byHash, update, collection),
                operationName,
                maxAttempts,
                initialBackoff,
                StoreErrorClassifier::isTransientStoreError);
        } catch (RuntimeException e) {
            if (StoreErrorClassifier.isConnectivityError(e)) {
                throw new StoreUnavailableException("Content store unreachable during " + operationName, e);
            }
            throw new WebContentStoreException("Store refused record " + record.hash(), e);
        }

        UpsertResult outcome = result.getUpsertedId() != null ? UpsertResult.INSERTED : UpsertResult.UPDATED;
        log.debug("[MONGO] {} -> {}", operationName, outcome);
        return outcome;
    }

    @Override
    public Optional<StoredWebContent> findByHash(String hash) {
        Document document = mongoOperations.findOne(
            Query.query(Criteria.where(FIELD_HASH).is(hash)), Document.class, collection);
        return Optional.ofNullable(document).map(MongoWebContentStore::fromDocument);
    }

    @Override
    public List<StoredWebContent> findByCanonicalUrl(String canonicalUrl) {
        return mongoOperations.find(
                Query.query(Criteria.where(FIELD_CANONICAL_URL).is(canonicalUrl))
                    .with(Sort.by(Sort.Direction.ASC, FIELD_CREATED_AT)),
                Document.class, collection)
            .stream()
            .map(MongoWebContentStore::fromDocument)
            .toList();
    }

    @Override
    public long count() {
        return mongoOperations.count(new Query(), collection);
    }

    static Update buildUpsert(StoredWebContent record, Date now) {
        ContentQuality quality = record.quality();
        Document qualityDocument = new Document()
            .append(QUALITY_HAS_TITLE, quality.hasTitle())
            .append(QUALITY_HAS_DESCRIPTION, quality.hasDescription())
            .append(QUALITY_MIN_WORDS_MET, quality.minWordsMet())
            .append(QUALITY_CHECKS, quality.checks());

        return new Update()
            .set(FIELD_TITLE, record.title())
            .set(FIELD_DESCRIPTION, record.description())
            .set(FIELD_TEXT, record.text())
            .set(FIELD_CANONICAL_URL, record.canonicalUrl())
            .set(FIELD_SOURCE, record.source())
            .set(FIELD_LANG, record.lang())
            .set(FIELD_READING_MINUTES, record.readingMinutes())
            .set(FIELD_QUALITY, qualityDocument)
            .set(FIELD_METADATA, new Document(record.metadata()))
            .set(FIELD_UPDATED_AT, now)
            .setOnInsert(FIELD_CREATED_AT, now)
            .setOnInsert(FIELD_REVIEW_STATUS, ReviewStatus.PENDING.storedValue());
    }

    static StoredWebContent fromDocument(Document document) {
        Document qualityDocument = document.get(FIELD_QUALITY, Document.class);
        ContentQuality quality = qualityDocument == null
            ? ContentQuality.ungated()
            : new ContentQuality(
                qualityDocument.getBoolean(QUALITY_HAS_TITLE, false),
                qualityDocument.getBoolean(QUALITY_HAS_DESCRIPTION, false),
                qualityDocument.getBoolean(QUALITY_MIN_WORDS_MET, false),
                qualityDocument.getList(QUALITY_CHECKS, String.class, List.of()));

        Number readingMinutes = document.get(FIELD_READING_MINUTES, Number.class);
        Document metadata = document.get(FIELD_METADATA, Document.class);

        return new StoredWebContent(
            document.getString(FIELD_HASH),
            document.getString(FIELD_TITLE),
            document.getString(FIELD_DESCRIPTION),
            document.getString(FIELD_TEXT),
            document.getString(FIELD_CANONICAL_URL),
            document.getString(FIELD_SOURCE),
            document.getString(FIELD_LANG),
            readingMinutes == null ? 1 : Math.max(1, readingMinutes.intValue()),
            quality,
            ReviewStatus.fromStoredValue(document.getString(FIELD_REVIEW_STATUS)),
            metadata == null ? Map.of() : metadata,
            toInstant(document.getDate(FIELD_CREATED_AT)),
            toInstant(document.getDate(FIELD_UPDATED_AT)));
    }

    private static Instant toInstant(Date date) {
        return date == null ? null : date.toInstant();
    }

    private static String shortHash(String hash) {
        return hash.length() <= LOG_HASH_PREFIX_LENGTH ? hash : hash.substring(0, LOG_HASH_PREFIX_LENGTH);
    }
}
