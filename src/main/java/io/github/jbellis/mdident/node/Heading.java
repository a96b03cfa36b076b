package io.github.jbellis.mdident.node;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.Map;
import java.util.Objects;

/**
 * ATX or Setext heading. The level is presentation: it is excluded from the canonical form, so
 * promoting or demoting a heading keeps its id.
 */
public record Heading(int level, String text, Map<String, Object> metadata, NodeId id) implements Node {
    public static final int MIN_LEVEL = 1;
    public static final int MAX_LEVEL = 6;

    public Heading {
        if (level < MIN_LEVEL || level > MAX_LEVEL) {
            throw new IllegalArgumentException("Heading level must be between 1 and 6, got " + level);
        }
        Objects.requireNonNull(text, "text");
        metadata = Metadata.copyOf(metadata);
    }

    public static Heading draft(int level, String text) {
        return new Heading(level, text, Map.of(), null);
    }

    @Override
    public NodeKind kind() {
        return NodeKind.HEADING;
    }

    /**
     * h3 becomes h2; an h1 is returned unchanged in level.
     */
    public Heading promote() {
        return withLevel(level - 1);
    }

    /**
     * h2 becomes h3; an h6 is returned unchanged in level.
     */
    public Heading demote() {
        return withLevel(level + 1);
    }

    /**
     * Sets the level, clamped to 1..6.
     */
    public Heading withLevel(int newLevel) {
        int clamped = Math.max(MIN_LEVEL, Math.min(MAX_LEVEL, newLevel));
        return new Heading(clamped, text, metadata, id);
    }

    @Override
    public Heading withId(NodeId newId) {
        return new Heading(level, text, metadata, newId);
    }

    @Override
    public Heading withMetadata(Map<String, ?> newMetadata) {
        return new Heading(level, text, Metadata.copyOf(newMetadata), id);
    }

    @Override
    public <R> R accept(NodeVisitor<R> visitor) {
        return visitor.visitHeading(this);
    }
}
