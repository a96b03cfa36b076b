package io.github.jbellis.mdident.node;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.List;
import java.util.Map;

/**
 * GFM table as rows of cell text, header row first. The alignment row is not kept.
 */
public record Table(List<List<String>> rows, Map<String, Object> metadata, NodeId id) implements Node {
    public Table {
        rows = rows.stream().map(List::copyOf).toList();
        metadata = Metadata.copyOf(metadata);
    }

    public static Table draft(List<List<String>> rows) {
        return new Table(rows, Map.of(), null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.TABLE;
    }

    @Override
    public Table withId(NodeId newId) {
        return new Table(rows, metadata, newId);
    }

    @Override
    public Table withMetadata(Map<String, ?> newMetadata) {
        return new Table(rows, Metadata.copyOf(newMetadata), id);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitTable(this);
    }
}
