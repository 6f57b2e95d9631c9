package io.crosspost4j.utils;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AgeBucketTrackingPolicyTest {

    private final AgeBucketTrackingPolicy policy = new AgeBucketTrackingPolicy();

    @Test
    void freshContentShouldUseBaseInterval() {
        assertThat(policy.nextDelay(Duration.ZERO)).isEqualTo(Duration.ofHours(1));
        assertThat(policy.nextDelay(Duration.ofHours(5))).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void oneDayBoundaryShouldBeStrict() {
        assertThat(policy.nextDelay(Duration.ofHours(24))).isEqualTo(Duration.ofHours(1));
        assertThat(policy.nextDelay(Duration.ofHours(24).plusSeconds(1))).isEqualTo(Duration.ofHours(3));
        assertThat(policy.nextDelay(Duration.ofHours(24).plusMinutes(1))).isEqualTo(Duration.ofHours(3));
    }

    @Test
    void threeDayBoundaryShouldBeStrict() {
        assertThat(policy.nextDelay(Duration.ofDays(3))).isEqualTo(Duration.ofHours(3));
        assertThat(policy.nextDelay(Duration.ofDays(3).plusSeconds(1))).isEqualTo(Duration.ofHours(6));
    }

    @Test
    void sevenDayBoundaryShouldBeStrict() {
        assertThat(policy.nextDelay(Duration.ofDays(7))).isEqualTo(Duration.ofHours(6));
        assertThat(policy.nextDelay(Duration.ofDays(7).plusSeconds(1))).isEqualTo(Duration.ofHours(12));
        assertThat(policy.nextDelay(Duration.ofDays(40))).isEqualTo(Duration.ofHours(12));
    }

    @Test
    void negativeOrUnknownAgeShouldCountAsFresh() {
        assertThat(policy.nextDelay(Duration.ofMinutes(-5))).isEqualTo(Duration.ofHours(1));
        assertThat(policy.nextDelay(null)).isEqualTo(Duration.ofHours(1));
    }

    @Test
    void coldRequiresBothCyclesAndAge() {
        Duration old = Duration.ofDays(7).plusSeconds(1);

        assertThat(policy.isCold(31, old)).isTrue();
        assertThat(policy.isCold(30, old)).isFalse();
        assertThat(policy.isCold(31, Duration.ofDays(7))).isFalse();
        assertThat(policy.isCold(500, Duration.ofDays(2))).isFalse();
    }

    @Test
    void customBaseIntervalShouldApplyToFreshBucketOnly() {
        AgeBucketTrackingPolicy custom = new AgeBucketTrackingPolicy(Duration.ofMinutes(15), 30, Duration.ofDays(7));

        assertThat(custom.nextDelay(Duration.ofHours(2))).isEqualTo(Duration.ofMinutes(15));
        assertThat(custom.nextDelay(Duration.ofDays(2))).isEqualTo(Duration.ofHours(3));
    }

    @Test
    void nonPositiveBaseIntervalShouldBeRejected() {
        assertThatThrownBy(() -> new AgeBucketTrackingPolicy(Duration.ZERO, 30, Duration.ofDays(7)))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
