package io.crosspost4j.core;

/**
 * Result of publishing to a single platform.
 *
 * postRef : platform-side reference of the created post (success only)
 * error   : failure description (failure only)
 */
public record PlatformOutcome(
        boolean success,
        String postRef,
        String error
) {

    public static PlatformOutcome success(String postRef) {
        return new PlatformOutcome(true, postRef, null);
    }

    public static PlatformOutcome failure(String error) {
        return new PlatformOutcome(false, null, error == null ? "unknown error" : error);
    }
}
