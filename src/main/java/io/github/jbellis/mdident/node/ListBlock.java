package io.github.jbellis.mdident.node;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.List;
import java.util.Map;

/**
 * Bullet or ordered list. Whether the list is ordered, and its start number, are presentation
 * and do not take part in the canonical form.
 */
public record ListBlock(boolean ordered, int start, List<ListItem> items, Map<String, Object> metadata, NodeId id)
        implements Node {
    public ListBlock {
        items = List.copyOf(items);
        if (start < 0) {
            throw new IllegalArgumentException("List start number must not be negative: " + start);
        }
        metadata = Metadata.copyOf(metadata);
    }

    public static ListBlock draft(boolean ordered, List<ListItem> items) {
        return new ListBlock(ordered, 1, items, Map.of(), null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.LIST;
    }

    public ListBlock toOrdered() {
        return new ListBlock(true, start, items, metadata, id);
    }

    public ListBlock toUnordered() {
        return new ListBlock(false, start, items, metadata, id);
    }

    @Override
    public List<ListItem> children() {
        return items;
    }

    @Override
    public ListBlock withChildren(List<? extends Node> children) {
        var newItems = children.stream()
                .map(child -> {
                    if (!(child instanceof ListItem item)) {
                        throw new IllegalArgumentException("A list can only contain list items, got " + child.kind().tag());
                    }
                    return item;
                })
                .toList();
        return new ListBlock(ordered, start, newItems, metadata, null);
    }

    @Override
    public ListBlock withId(NodeId newId) {
        return new ListBlock(ordered, start, items, metadata, newId);
    }

    @Override
    public ListBlock withMetadata(Map<String, ?> newMetadata) {
        return new ListBlock(ordered, start, items, Metadata.copyOf(newMetadata), id);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitList(this);
    }
}
