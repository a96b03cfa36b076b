package io.github.jbellis.mdident.node;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.List;
import java.util.Map;

public record BlockQuote(List<Node> children, Map<String, Object> metadata, NodeId id) implements Node {
    public BlockQuote {
        children = List.copyOf(children);
        metadata = Metadata.copyOf(metadata);
    }

    public static BlockQuote draft(List<? extends Node> children) {
        return new BlockQuote(List.copyOf(children), Map.of(), null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.BLOCK_QUOTE;
    }

    @Override
    public BlockQuote withChildren(List<? extends Node> newChildren) {
        return new BlockQuote(List.copyOf(newChildren), metadata, null);
    }

    @Override
    public BlockQuote withId(NodeId newId) {
        return new BlockQuote(children, metadata, newId);
    }

    @Override
    public BlockQuote withMetadata(Map<String, ?> newMetadata) {
        return new BlockQuote(children, Metadata.copyOf(newMetadata), id);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitBlockQuote(this);
    }
}
