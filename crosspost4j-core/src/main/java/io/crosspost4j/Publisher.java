package io.crosspost4j;

import io.crosspost4j.core.PlatformOutcome;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Publishes one piece of content to several platforms.
 *
 * <p>A failure on one platform must not abort the others; it is reported as a failed
 * {@link PlatformOutcome}. Throwing means the whole attempt failed.
 */
public interface Publisher {

    Map<String, PlatformOutcome> publish(String text, List<String> media, Set<String> platforms) throws Exception;
}
