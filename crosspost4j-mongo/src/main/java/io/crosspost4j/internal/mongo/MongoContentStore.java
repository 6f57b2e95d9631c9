package io.crosspost4j.internal.mongo;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.crosspost4j.ContentStore;
import io.crosspost4j.core.ContentRecord;
import io.crosspost4j.core.ContentStatus;
import io.crosspost4j.core.ContentUpdate;
import io.crosspost4j.core.MetricSnapshot;
import io.crosspost4j.core.PlatformOutcome;
import com.mongodb.client.result.UpdateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * MongoDB persistence layer for content records and metric snapshots.
 *
 * <p>Updates are partial: only the fields carried by a {@link ContentUpdate} are written, plus
 * {@code updatedAt}. Per-platform results are stored as plain sub-documents.
 */
public class MongoContentStore implements ContentStore {
    private static final Logger log = LoggerFactory.getLogger(MongoContentStore.class);

    private static final TypeReference<Map<String, Object>> RAW_RESULTS = new TypeReference<>() {
    };
    private static final TypeReference<LinkedHashMap<String, PlatformOutcome>> OUTCOMES = new TypeReference<>() {
    };

    private final MongoTemplate mongoTemplate;
    private final ObjectMapper objectMapper;

    public MongoContentStore(MongoTemplate mongoTemplate, ObjectMapper objectMapper) {
        this.mongoTemplate = Objects.requireNonNull(mongoTemplate, "mongoTemplate must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    /**
     * Persist a new record, typically a draft or an already scheduled post.
     *
     * @throws org.springframework.dao.DuplicateKeyException if the id is taken
     */
    public void insert(ContentRecord record) {
        Objects.requireNonNull(record, "record must not be null");
        Instant now = Instant.now();
        ContentDocument doc = toDocument(record);
        doc.setCreatedAt(now);
        doc.setUpdatedAt(now);
        mongoTemplate.insert(doc);
    }

    @Override
    public List<ContentRecord> findByStatusAndDueTimeBetween(ContentStatus status, Instant from, Instant to) {
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(from, "from must not be null");
        Objects.requireNonNull(to, "to must not be null");

        Query q = new Query(
                Criteria.where("status").is(status)
                        .and("dueTime").gte(from).lte(to)
        );
        q.with(Sort.by(Sort.Order.asc("dueTime")));
        return toRecords(mongoTemplate.find(q, ContentDocument.class));
    }

    @Override
    public List<ContentRecord> findByStatus(ContentStatus status) {
        Objects.requireNonNull(status, "status must not be null");
        Query q = new Query(Criteria.where("status").is(status));
        return toRecords(mongoTemplate.find(q, ContentDocument.class));
    }

    @Override
    public Optional<ContentRecord> findById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        ContentDocument doc = mongoTemplate.findById(id, ContentDocument.class);
        return Optional.ofNullable(doc).map(this::toRecord);
    }

    @Override
    public void update(String id, ContentUpdate update) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(update, "update must not be null");

        UpdateResult r = mongoTemplate.updateFirst(
                new Query(Criteria.where("_id").is(id)), toUpdate(update), ContentDocument.class);
        if (r.getMatchedCount() == 0) {
            log.warn("Content update matched nothing id={} update={}", id, update);
        }
    }

    /**
     * The status guard is part of the update filter, so the check and the write happen in one
     * server-side operation.
     */
    @Override
    public boolean updateIfStatus(String id, Set<ContentStatus> expected, ContentUpdate update) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(expected, "expected must not be null");
        Objects.requireNonNull(update, "update must not be null");
        if (expected.isEmpty()) {
            return false;
        }

        Query q = new Query(Criteria.where("_id").is(id).and("status").in(expected));
        UpdateResult r = mongoTemplate.updateFirst(q, toUpdate(update), ContentDocument.class);
        if (r.getMatchedCount() == 0) {
            log.debug("Conditional content update skipped id={} expected={}", id, expected);
            return false;
        }
        return true;
    }

    @Override
    public void appendMetric(String id, String platform, MetricSnapshot snapshot) {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(platform, "platform must not be null");
        Objects.requireNonNull(snapshot, "snapshot must not be null");

        MetricSnapshotDocument doc = new MetricSnapshotDocument();
        doc.setContentId(id);
        doc.setPlatform(platform);
        doc.setValues(snapshot.values());
        doc.setCollectedAt(snapshot.collectedAt());
        mongoTemplate.insert(doc);
    }

    /**
     * Every stored snapshot of {@code id}, grouped by platform, oldest first.
     */
    @Override
    public Map<String, List<MetricSnapshot>> findMetrics(String id) {
        Objects.requireNonNull(id, "id must not be null");
        Query q = new Query(Criteria.where("contentId").is(id));
        q.with(Sort.by(Sort.Order.asc("collectedAt")));

        Map<String, List<MetricSnapshot>> out = new LinkedHashMap<>();
        for (MetricSnapshotDocument d : mongoTemplate.find(q, MetricSnapshotDocument.class)) {
            out.computeIfAbsent(d.getPlatform(), p -> new ArrayList<>())
                    .add(new MetricSnapshot(d.getPlatform(), d.getValues(), d.getCollectedAt()));
        }
        return out;
    }

    /**
     * Hard delete a record and its snapshots.
     *
     * @return deleted record count (0 or 1)
     */
    public long deleteById(String id) {
        Objects.requireNonNull(id, "id must not be null");
        mongoTemplate.remove(new Query(Criteria.where("contentId").is(id)), MetricSnapshotDocument.class);
        return mongoTemplate.remove(new Query(Criteria.where("_id").is(id)), ContentDocument.class)
                .getDeletedCount();
    }

    private Update toUpdate(ContentUpdate update) {
        Update u = new Update().set("updatedAt", Instant.now());
        if (update.status() != null) {
            u.set("status", update.status());
        }
        if (update.dueTime() != null) {
            u.set("dueTime", update.dueTime());
        }
        if (update.publishedTime() != null) {
            u.set("publishedTime", update.publishedTime());
        }
        if (update.results() != null) {
            u.set("results", objectMapper.convertValue(update.results(), RAW_RESULTS));
        }
        return u;
    }

    private ContentDocument toDocument(ContentRecord record) {
        ContentDocument doc = new ContentDocument();
        doc.setId(record.id());
        doc.setText(record.text());
        doc.setMedia(record.media());
        doc.setPlatforms(new ArrayList<>(record.platforms()));
        doc.setStatus(record.status());
        doc.setDueTime(record.dueTime());
        doc.setPublishedTime(record.publishedTime());
        if (!record.results().isEmpty()) {
            doc.setResults(objectMapper.convertValue(record.results(), RAW_RESULTS));
        }
        return doc;
    }

    /**
     * Reverse of {@link #toDocument(ContentRecord)}.
     */
    ContentRecord toRecord(ContentDocument doc) {
        Map<String, PlatformOutcome> results = doc.getResults() == null
                ? null
                : objectMapper.convertValue(doc.getResults(), OUTCOMES);

        return new ContentRecord(
                doc.getId(),
                doc.getText(),
                doc.getMedia(),
                doc.getPlatforms() == null ? null : new LinkedHashSet<>(doc.getPlatforms()),
                doc.getStatus(),
                doc.getDueTime(),
                doc.getPublishedTime(),
                results
        );
    }

    private List<ContentRecord> toRecords(List<ContentDocument> docs) {
        List<ContentRecord> out = new ArrayList<>(docs.size());
        for (ContentDocument d : docs) {
            if (d != null) {
                out.add(toRecord(d));
            }
        }
        return out;
    }
}
