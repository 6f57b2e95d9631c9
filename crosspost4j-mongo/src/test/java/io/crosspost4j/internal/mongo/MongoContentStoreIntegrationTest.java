package io.crosspost4j.internal.mongo;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.mongodb.client.MongoClients;
import io.crosspost4j.ContentScheduler;
import io.crosspost4j.config.EngineProperties;
import io.crosspost4j.core.ContentRecord;
import io.crosspost4j.core.ContentStatus;
import io.crosspost4j.core.ContentUpdate;
import io.crosspost4j.core.MetricSnapshot;
import io.crosspost4j.core.PlatformOutcome;
import io.crosspost4j.internal.DefaultContentScheduler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.testcontainers.containers.MongoDBContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Testcontainers(disabledWithoutDocker = true)
class MongoContentStoreIntegrationTest {

    @Container
    static final MongoDBContainer MONGO = new MongoDBContainer("mongo:7.0");

    private static final Instant T0 = Instant.parse("2026-02-01T09:00:00Z");

    private MongoTemplate mongoTemplate;
    private MongoContentStore store;

    @BeforeEach
    void setUp() {
        mongoTemplate = new MongoTemplate(MongoClients.create(MONGO.getReplicaSetUrl()), "crosspost4j_test");
        mongoTemplate.dropCollection(ContentDocument.class);
        mongoTemplate.dropCollection(MetricSnapshotDocument.class);
        store = new MongoContentStore(mongoTemplate, new ObjectMapper());
    }

    @AfterEach
    void tearDown() {
        mongoTemplate.dropCollection(ContentDocument.class);
        mongoTemplate.dropCollection(MetricSnapshotDocument.class);
    }

    @Test
    void insertedRecordShouldReadBackUnchanged() {
        Map<String, PlatformOutcome> results = new LinkedHashMap<>();
        results.put("mastodon", PlatformOutcome.success("109876"));
        results.put("bluesky", PlatformOutcome.failure("rate limited"));
        store.insert(new ContentRecord("p1", "hello", List.of("img/1.png"),
                new LinkedHashSet<>(List.of("mastodon", "bluesky")),
                ContentStatus.PUBLISHED, T0, T0.plusSeconds(3), results));

        Optional<ContentRecord> found = store.findById("p1");

        assertTrue(found.isPresent());
        ContentRecord r = found.get();
        assertEquals("hello", r.text());
        assertEquals(List.of("img/1.png"), r.media());
        assertEquals(List.of("mastodon", "bluesky"), List.copyOf(r.platforms()));
        assertEquals(ContentStatus.PUBLISHED, r.status());
        assertEquals(T0, r.dueTime());
        assertEquals(T0.plusSeconds(3), r.publishedTime());
        assertEquals(results, r.results());
        assertEquals(List.of("mastodon"), List.copyOf(r.successfulPlatforms()));
    }

    @Test
    void findByIdShouldBeEmptyForUnknownId() {
        assertFalse(store.findById("missing").isPresent());
    }

    @Test
    void dueWindowQueryShouldBeInclusiveAndOrdered() {
        store.insert(scheduled("late", T0.plusSeconds(60)));
        store.insert(scheduled("early", T0));
        store.insert(scheduled("outside", T0.plusSeconds(61)));
        store.insert(draft("draft"));

        List<ContentRecord> due = store.findByStatusAndDueTimeBetween(
                ContentStatus.SCHEDULED, T0, T0.plusSeconds(60));

        assertEquals(List.of("early", "late"), due.stream().map(ContentRecord::id).toList());
        assertEquals(3, store.findByStatus(ContentStatus.SCHEDULED).size());
        assertEquals(1, store.findByStatus(ContentStatus.DRAFT).size());
    }

    @Test
    void updateShouldOnlyTouchGivenFields() {
        store.insert(scheduled("u1", T0));
        ContentDocument before = mongoTemplate.findById("u1", ContentDocument.class);
        assertNotNull(before);

        store.update("u1", ContentUpdate.status(ContentStatus.PUBLISHING));

        ContentDocument after = mongoTemplate.findById("u1", ContentDocument.class);
        assertNotNull(after);
        assertEquals(ContentStatus.PUBLISHING, after.getStatus());
        assertEquals(T0, after.getDueTime());
        assertNull(after.getPublishedTime());
        assertNull(after.getResults());
        assertEquals(before.getCreatedAt(), after.getCreatedAt());
        assertFalse(after.getUpdatedAt().isBefore(before.getUpdatedAt()));
    }

    @Test
    void updateShouldWriteResultsAndStatusTogether() {
        store.insert(scheduled("u2", T0));

        store.update("u2", ContentUpdate.builder()
                .status(ContentStatus.PUBLISHED)
                .publishedTime(T0.plusSeconds(1))
                .results(Map.of("mastodon", PlatformOutcome.success("42")))
                .build());

        ContentRecord r = store.findById("u2").orElseThrow();
        assertEquals(ContentStatus.PUBLISHED, r.status());
        assertEquals(T0.plusSeconds(1), r.publishedTime());
        assertEquals("42", r.results().get("mastodon").postRef());
    }

    @Test
    void conditionalUpdateShouldOnlyWriteWhileStatusMatches() {
        store.insert(scheduled("c1", T0));
        Set<ContentStatus> scheduledOnly = Set.of(ContentStatus.SCHEDULED);

        assertTrue(store.updateIfStatus("c1", scheduledOnly, ContentUpdate.status(ContentStatus.PUBLISHING)));
        assertEquals(ContentStatus.PUBLISHING, store.findById("c1").orElseThrow().status());

        // a second claim loses
        assertFalse(store.updateIfStatus("c1", scheduledOnly, ContentUpdate.status(ContentStatus.PUBLISHING)));

        store.update("c1", ContentUpdate.status(ContentStatus.PUBLISHED));
        assertFalse(store.updateIfStatus("c1", ContentStatus.reschedulable(), ContentUpdate.builder()
                .status(ContentStatus.SCHEDULED)
                .dueTime(T0.plusSeconds(3600))
                .build()));

        ContentRecord r = store.findById("c1").orElseThrow();
        assertEquals(ContentStatus.PUBLISHED, r.status());
        assertEquals(T0, r.dueTime());
        assertFalse(store.updateIfStatus("ghost", scheduledOnly, ContentUpdate.status(ContentStatus.PUBLISHING)));
        assertNull(mongoTemplate.findById("ghost", ContentDocument.class));
    }

    @Test
    void updateOfUnknownIdShouldNotCreateDocument() {
        store.update("ghost", ContentUpdate.status(ContentStatus.FAILED));

        assertNull(mongoTemplate.findById("ghost", ContentDocument.class));
    }

    @Test
    void metricsShouldBeGroupedByPlatformOldestFirst() {
        store.appendMetric("m1", "mastodon", snapshot("mastodon", 20, T0.plusSeconds(120)));
        store.appendMetric("m1", "mastodon", snapshot("mastodon", 10, T0));
        store.appendMetric("m1", "bluesky", snapshot("bluesky", 5, T0.plusSeconds(60)));
        store.appendMetric("other", "mastodon", snapshot("mastodon", 99, T0));

        Map<String, List<MetricSnapshot>> metrics = store.findMetrics("m1");

        assertEquals(2, metrics.size());
        List<MetricSnapshot> mastodon = metrics.get("mastodon");
        assertEquals(2, mastodon.size());
        assertEquals(10L, mastodon.get(0).values().get("views"));
        assertEquals(20L, mastodon.get(1).values().get("views"));
        assertEquals(T0.plusSeconds(120), mastodon.get(1).collectedAt());
        assertEquals(1, metrics.get("bluesky").size());
    }

    @Test
    void deleteByIdShouldRemoveRecordAndMetrics() {
        store.insert(scheduled("d1", T0));
        store.appendMetric("d1", "mastodon", snapshot("mastodon", 1, T0));

        assertEquals(1, store.deleteById("d1"));
        assertTrue(store.findById("d1").isEmpty());
        assertTrue(store.findMetrics("d1").isEmpty());
    }

    @Test
    void schedulerShouldPublishMissedPostAfterRestart() throws Exception {
        Instant missed = Instant.now().minus(Duration.ofMinutes(5)).truncatedTo(ChronoUnit.MILLIS);
        store.insert(new ContentRecord("restart-1", "we are back", List.of(),
                new LinkedHashSet<>(List.of("mastodon", "bluesky")),
                ContentStatus.SCHEDULED, missed, null, null));

        EngineProperties props = new EngineProperties();
        props.setMaxConcurrency(2);
        props.setSweepInterval(Duration.ofMinutes(10));
        props.setShutdownTimeout(Duration.ofSeconds(2));

        ContentScheduler scheduler = new DefaultContentScheduler(
                props,
                store,
                (text, media, platforms) -> Map.of(
                        "mastodon", PlatformOutcome.success("m-1"),
                        "bluesky", PlatformOutcome.failure("invalid session")
                ),
                (entityId, platform) -> snapshot(platform, 7, Instant.now()),
                Clock.systemUTC()
        );
        scheduler.start();

        boolean published = waitUntil(8, TimeUnit.SECONDS, () -> store.findById("restart-1")
                .map(r -> r.status() == ContentStatus.PUBLISHED)
                .orElse(false));
        boolean tracked = waitUntil(5, TimeUnit.SECONDS,
                () -> !store.findMetrics("restart-1").isEmpty());

        scheduler.stop();

        assertTrue(published);
        assertTrue(tracked);
        ContentRecord r = store.findById("restart-1").orElseThrow();
        assertNotNull(r.publishedTime());
        assertFalse(r.results().get("bluesky").success());
        assertEquals(List.of("mastodon"), List.copyOf(store.findMetrics("restart-1").keySet()));
    }

    private static ContentRecord scheduled(String id, Instant due) {
        return new ContentRecord(id, "text " + id, List.of(), new LinkedHashSet<>(List.of("mastodon")),
                ContentStatus.SCHEDULED, due, null, null);
    }

    private static ContentRecord draft(String id) {
        return new ContentRecord(id, "draft " + id, List.of(), new LinkedHashSet<>(List.of("mastodon")),
                ContentStatus.DRAFT, null, null, null);
    }

    private static MetricSnapshot snapshot(String platform, long views, Instant at) {
        return new MetricSnapshot(platform, Map.of("views", views), at);
    }

    private static boolean waitUntil(long timeout, TimeUnit unit, BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + unit.toNanos(timeout);
        while (System.nanoTime() < deadline) {
            if (condition.getAsBoolean()) {
                return true;
            }
            Thread.sleep(100);
        }
        return false;
    }
}
