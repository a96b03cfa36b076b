package io.github.jbellis.mdident.node;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.List;
import java.util.Map;

public record ListItem(List<Node> children, Map<String, Object> metadata, NodeId id) implements Node {
    public ListItem {
        children = List.copyOf(children);
        metadata = Metadata.copyOf(metadata);
    }

    public static ListItem draft(List<? extends Node> children) {
        return new ListItem(List.copyOf(children), Map.of(), null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST_ITEM;
    }

    @Override
    public ListItem withChildren(List<? extends Node> newChildren) {
        return new ListItem(List.copyOf(newChildren), metadata, null);
    }

    @Override
    public ListItem withId(NodeId newId) {
        return new ListItem(children, metadata, newId);
    }

    @Override
    public ListItem withMetadata(Map<String, ?> newMetadata) {
        return new ListItem(children, Metadata.copyOf(newMetadata), id);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitListItem(this);
    }
}
