package io.crosspost4j.core;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ContentUpdateTest {

    @Test
    void emptyUpdateShouldBeRejected() {
        assertThatThrownBy(() -> ContentUpdate.builder().build())
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("at least one field");
    }

    @Test
    void resultsShouldBeCopied() {
        Map<String, PlatformOutcome> results = new HashMap<>();
        results.put("vk", PlatformOutcome.success("vk-1"));

        ContentUpdate update = ContentUpdate.builder().results(results).build();
        results.put("telegram", PlatformOutcome.failure("down"));

        assertThat(update.results()).containsOnlyKeys("vk");
        assertThat(update.status()).isNull();
    }

    @Test
    void successfulPlatformsShouldFollowResultOrder() {
        Map<String, PlatformOutcome> results = new LinkedHashMap<>();
        results.put("telegram", PlatformOutcome.success("tg-1"));
        results.put("vk", PlatformOutcome.failure("captcha"));
        results.put("site", PlatformOutcome.success("site-1"));

        ContentRecord record = new ContentRecord("c1", "t", List.of(),
                new LinkedHashSet<>(List.of("telegram", "vk", "site")),
                ContentStatus.PUBLISHED, null, Instant.EPOCH, results);

        assertThat(record.successfulPlatforms()).containsExactly("telegram", "site");
    }

    @Test
    void failureWithoutMessageShouldStillCarryError() {
        assertThat(PlatformOutcome.failure(null).error()).isEqualTo("unknown error");
        assertThat(PlatformOutcome.success("p").success()).isTrue();
    }

    @Test
    void publishingAndPublishedAreNeverReschedulable() {
        assertThat(ContentStatus.reschedulable())
                .containsExactlyInAnyOrder(ContentStatus.DRAFT, ContentStatus.SCHEDULED, ContentStatus.FAILED);
    }
}
