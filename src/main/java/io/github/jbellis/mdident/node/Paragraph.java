package io.github.jbellis.mdident.node;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.Map;
import java.util.Objects;

/**
 * Paragraph holding its inline markdown source (emphasis, links and inline code stay as source
 * text; they have no identity of their own).
 */
public record Paragraph(String text, Map<String, Object> metadata, NodeId id) implements Node {
    public Paragraph {
        Objects.requireNonNull(text, "text");
        metadata = Metadata.copyOf(metadata);
    }

    public static Paragraph draft(String text) {
        return new Paragraph(text, Map.of(), null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.PARAGRAPH;
    }

    @Override
    public Paragraph withId(NodeId newId) {
        return new Paragraph(text, metadata, newId);
    }

    @Override
    public Paragraph withMetadata(Map<String, ?> newMetadata) {
        return new Paragraph(text, Metadata.copyOf(newMetadata), id);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitParagraph(this);
    }
}
