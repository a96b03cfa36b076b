package io.github.jbellis.mdident.config;

/**
 * What decoding does when a persisted node id no longer matches the id recomputed from the node's
 * content.
 */
public enum DriftPolicy {
    /** Log a warning and continue with the recomputed id. */
    WARN,
    /** Abort decoding with an {@code IdentityDriftException}. */
    FAIL
}
