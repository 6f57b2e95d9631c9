package io.crosspost4j.config;

import io.crosspost4j.internal.mongo.ContentDocument;
import io.crosspost4j.internal.mongo.MetricSnapshotDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.index.Index;

/**
 * MongoDB index definitions for the content store.
 *
 * <p><b>Important:</b> indexes are <b>NOT</b> created at startup unless
 * {@code crosspost.ensure-indexes-on-startup=true}. In production they usually come from DB
 * migrations or ops scripts.
 *
 * <h3>Required indexes</h3>
 * <ul>
 *   <li><b>idx_status_dueTime</b> on {@code content_records}: { status: 1, dueTime: 1 }
 *       <br/>Used by the recovery sweep and startup reconciliation.</li>
 *   <li><b>idx_metrics_content</b> on {@code metric_snapshots}: { contentId: 1, collectedAt: 1 }
 *       <br/>Used by statistics lookups.</li>
 * </ul>
 *
 * <h3>Example mongosh script</h3>
 * <pre>
 * db.content_records.createIndex({ status: 1, dueTime: 1 }, { name: "idx_status_dueTime" });
 * db.metric_snapshots.createIndex({ contentId: 1, collectedAt: 1 }, { name: "idx_metrics_content" });
 * </pre>
 */
public class ContentMongoIndexConfig {
    private static final Logger log = LoggerFactory.getLogger(ContentMongoIndexConfig.class);

    public static final String IDX_STATUS_DUE_TIME = "idx_status_dueTime";
    public static final String IDX_METRICS_CONTENT = "idx_metrics_content";

    private final MongoTemplate mongoTemplate;

    public ContentMongoIndexConfig(MongoTemplate mongoTemplate) {
        this.mongoTemplate = mongoTemplate;
    }

    /**
     * Create the required indexes. Existing indexes with the same definition are left alone.
     */
    public void ensureIndexes() {
        mongoTemplate.indexOps(ContentDocument.class).ensureIndex(statusDueTimeIndex());
        mongoTemplate.indexOps(MetricSnapshotDocument.class).ensureIndex(metricsContentIndex());
        log.info("Content store indexes ensured names={}, {}", IDX_STATUS_DUE_TIME, IDX_METRICS_CONTENT);
    }

    /**
     * Keys: status ASC, dueTime ASC
     */
    public static Index statusDueTimeIndex() {
        return new Index()
                .on("status", Sort.Direction.ASC)
                .on("dueTime", Sort.Direction.ASC)
                .named(IDX_STATUS_DUE_TIME);
    }

    /**
     * Keys: contentId ASC, collectedAt ASC
     */
    public static Index metricsContentIndex() {
        return new Index()
                .on("contentId", Sort.Direction.ASC)
                .on("collectedAt", Sort.Direction.ASC)
                .named(IDX_METRICS_CONTENT);
    }
}
