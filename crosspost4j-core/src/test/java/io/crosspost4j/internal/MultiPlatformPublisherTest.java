package io.crosspost4j.internal;

import io.crosspost4j.PlatformPublisher;
import io.crosspost4j.core.PlatformOutcome;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class MultiPlatformPublisherTest {

    @Test
    void eachPlatformShouldGetItsOwnOutcome() {
        MultiPlatformPublisher publisher = new MultiPlatformPublisher(List.of(
                platform("A", "a-ref"),
                failing("B", new IllegalStateException("rate limited"))
        ));

        Map<String, PlatformOutcome> outcomes =
                publisher.publish("hi", List.of(), new LinkedHashSet<>(List.of("A", "B", "C")));

        assertThat(outcomes).containsOnlyKeys("A", "B", "C");
        assertThat(outcomes.get("A")).isEqualTo(PlatformOutcome.success("a-ref"));
        assertThat(outcomes.get("B").error()).isEqualTo("rate limited");
        assertThat(outcomes.get("C").success()).isFalse();
        assertThat(outcomes.get("C").error()).contains("no publisher registered");
    }

    @Test
    void exceptionWithoutMessageShouldUseTypeName() {
        MultiPlatformPublisher publisher = new MultiPlatformPublisher(List.of(
                failing("A", new NullPointerException())
        ));

        Map<String, PlatformOutcome> outcomes = publisher.publish("hi", List.of(), new LinkedHashSet<>(List.of("A")));

        assertThat(outcomes.get("A").error()).isEqualTo("NullPointerException");
    }

    @Test
    void duplicatePlatformShouldBeRejected() {
        assertThatThrownBy(() -> new MultiPlatformPublisher(List.of(platform("A", "1"), platform("A", "2"))))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Duplicate PlatformPublisher for platform: A");
    }

    @Test
    void platformsShouldListRegisteredPublishers() {
        MultiPlatformPublisher publisher = new MultiPlatformPublisher(List.of(platform("A", "1"), platform("B", "2")));

        assertThat(publisher.platforms()).containsExactlyInAnyOrder("A", "B");
    }

    private static PlatformPublisher platform(String name, String ref) {
        return new PlatformPublisher() {
            @Override
            public String platform() {
                return name;
            }

            @Override
            public String publish(String text, List<String> media) {
                return ref;
            }
        };
    }

    private static PlatformPublisher failing(String name, RuntimeException error) {
        return new PlatformPublisher() {
            @Override
            public String platform() {
                return name;
            }

            @Override
            public String publish(String text, List<String> media) {
                throw error;
            }
        };
    }
}
