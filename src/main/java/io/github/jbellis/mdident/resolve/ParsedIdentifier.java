package io.github.jbellis.mdident.resolve;

import io.github.jbellis.mdident.identity.NodeId;

/**
 * Outcome of reading an identifier string, before any document is consulted.
 */
public sealed interface ParsedIdentifier {
    String raw();

    /** A canonical content-derived id. */
    record Stable(String raw, NodeId id) implements ParsedIdentifier {
    }

    /** A zero-based index into the top-level nodes of a document. */
    record Positional(String raw, long index) implements ParsedIdentifier {
    }

    /** The legacy heading form {@code h<level>-<ordinal>}: the ordinal-th heading of that level. */
    record LegacyHeading(String raw, int level, long ordinal) implements ParsedIdentifier {
    }

    /** Not an identifier in the requested mode. */
    record Rejected(String raw, String reason) implements ParsedIdentifier {
    }
}
