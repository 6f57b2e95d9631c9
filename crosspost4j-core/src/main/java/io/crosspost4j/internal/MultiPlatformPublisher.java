package io.crosspost4j.internal;

import io.crosspost4j.PlatformPublisher;
import io.crosspost4j.Publisher;
import io.crosspost4j.core.PlatformOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link Publisher} that fans out to one {@link PlatformPublisher} per platform.
 *
 * <p>Platforms are attempted one after another and independently: an exception, or a platform
 * nobody publishes to, becomes a failed outcome for that platform only.
 */
public class MultiPlatformPublisher implements Publisher {
    private static final Logger log = LoggerFactory.getLogger(MultiPlatformPublisher.class);

    private final Map<String, PlatformPublisher> publishersByPlatform;

    public MultiPlatformPublisher(List<PlatformPublisher> publishers) {
        this.publishersByPlatform = publishers.stream()
                .collect(Collectors.toUnmodifiableMap(
                        PlatformPublisher::platform,
                        Function.identity(),
                        (a, b) -> {
                            throw new IllegalStateException("Duplicate PlatformPublisher for platform: " + a.platform());
                        }
                ));
    }

    @Override
    public Map<String, PlatformOutcome> publish(String text, List<String> media, Set<String> platforms) {
        Map<String, PlatformOutcome> outcomes = new LinkedHashMap<>();
        for (String platform : platforms) {
            PlatformPublisher target = publishersByPlatform.get(platform);
            if (target == null) {
                log.warn("No PlatformPublisher registered for platform={}", platform);
                outcomes.put(platform, PlatformOutcome.failure("no publisher registered for platform " + platform));
                continue;
            }
            try {
                String postRef = target.publish(text, media);
                outcomes.put(platform, PlatformOutcome.success(postRef));
            } catch (Exception e) {
                log.warn("Publishing to platform={} failed msg={}", platform, e.getMessage(), e);
                outcomes.put(platform, PlatformOutcome.failure(
                        e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            }
        }
        return outcomes;
    }

    public Set<String> platforms() {
        return publishersByPlatform.keySet();
    }
}
