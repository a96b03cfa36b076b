package io.github.jbellis.mdident.json;

import io.github.jbellis.mdident.identity.NodeId;
import io.github.jbellis.mdident.node.NodeKind;

/**
 * A persisted id that differs from the id recomputed from the same node's content, typically
 * because the document was written by a different version of the canonicalization rules.
 *
 * @param location JSON path of the node, e.g. {@code nodes[2].items[0]}
 */
public record IdentityDrift(String location, NodeKind kind, NodeId persisted, NodeId recomputed) {
    @Override
    public String toString() {
        return kind.tag() + " at " + location + ": persisted " + persisted + ", recomputed " + recomputed;
    }
}
