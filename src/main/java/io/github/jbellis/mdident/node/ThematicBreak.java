package io.github.jbellis.mdident.node;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.Map;

/**
 * Horizontal rule. Carries no text, so every thematic break canonicalizes identically and gets
 * the fallback hint.
 */
public record ThematicBreak(Map<String, Object> metadata, NodeId id) implements Node {
    public ThematicBreak {
        metadata = Metadata.copyOf(metadata);
    }

    public static ThematicBreak draft() {
        return new ThematicBreak(Map.of(), null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.THEMATIC_BREAK;
    }

    @Override
    public ThematicBreak withId(NodeId newId) {
        return new ThematicBreak(metadata, newId);
    }

    @Override
    public ThematicBreak withMetadata(Map<String, ?> newMetadata) {
        return new ThematicBreak(Metadata.copyOf(newMetadata), id);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitThematicBreak(this);
    }
}
