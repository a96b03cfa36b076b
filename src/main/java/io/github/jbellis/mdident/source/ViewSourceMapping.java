package io.github.jbellis.mdident.source;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.Objects;

/**
 * Provenance of one block-level node: where its text sat in the source when the document was
 * parsed. Established once and never updated, so after edits a mapping may describe text that no
 * longer exists.
 */
public record ViewSourceMapping(NodeId nodeId, SourceSpan span) {
    public ViewSourceMapping {
        Objects.requireNonNull(nodeId, "nodeId");
        Objects.requireNonNull(span, "span");
    }

    public ViewSourceMapping withNodeId(NodeId newId) {
        return new ViewSourceMapping(newId, span);
    }
}
