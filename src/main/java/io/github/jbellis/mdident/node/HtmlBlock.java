package io.github.jbellis.mdident.node;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.Map;
import java.util.Objects;

/**
 * Raw HTML block, kept verbatim.
 */
public record HtmlBlock(String html, Map<String, Object> metadata, NodeId id) implements Node {
    public HtmlBlock {
        Objects.requireNonNull(html, "html");
        metadata = Metadata.copyOf(metadata);
    }

    public static HtmlBlock draft(String html) {
        return new HtmlBlock(html, Map.of(), null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HTML_BLOCK;
    }

    @Override
    public HtmlBlock withId(NodeId newId) {
        return new HtmlBlock(html, metadata, newId);
    }

    @Override
    public HtmlBlock withMetadata(Map<String, ?> newMetadata) {
        return new HtmlBlock(html, Metadata.copyOf(newMetadata), id);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitHtmlBlock(this);
    }
}
