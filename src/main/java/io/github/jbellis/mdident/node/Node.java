package io.github.jbellis.mdident.node;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.List;
import java.util.Map;

/**
 * An immutable block-level node of a markdown document.
 *
 * Every node carries an attached {@link NodeId}. A node built directly by a parser or an editor
 * starts out as a <em>draft</em> whose id is {@code null}; it receives its id when it passes
 * through {@link io.github.jbellis.mdident.identity.IdentityCache#identify(Node)}. Documents only
 * ever hold identified nodes.
 *
 * Changing a node always means constructing a new one. The {@code with*} methods on the records
 * are structure-preserving and carry the current id forward; content changes go through
 * {@link io.github.jbellis.mdident.identity.NodeEditor}, which regenerates it.
 */
public sealed interface Node
        permits Heading, Paragraph, CodeBlock, ListBlock, ListItem, BlockQuote, ThematicBreak, HtmlBlock, Table {

    NodeKind kind();

    /**
     * @return the attached id, or {@code null} for a draft node
     */
    NodeId id();

    Map<String, Object> metadata();

    /**
     * Returns a copy of this node with the given id attached. Passing {@code null} turns the copy
     * back into a draft.
     */
    Node withId(NodeId id);

    /**
     * Returns a copy of this node with its metadata replaced. The id is kept.
     */
    Node withMetadata(Map<String, ?> metadata);

    /**
     * Child nodes in document order; empty for leaf kinds.
     */
    default List<? extends Node> children() {
        return List.of();
    }

    /**
     * Returns a draft copy of this container with its children replaced. The children are content,
     * so the copy never carries the old id; pass it through
     * {@link io.github.jbellis.mdident.identity.IdentityCache#identify(Node)} to attach a new one.
     *
     * @throws UnsupportedOperationException for leaf kinds
     */
    default Node withChildren(List<? extends Node> children) {
        throw new UnsupportedOperationException(kind().tag() + " nodes have no children");
    }

    <R> R accept(NodeVisitor<R> visitor);

    default boolean isIdentified() {
        return id() != null;
    }

    /**
     * @throws IllegalStateException if this node is still a draft
     */
    default NodeId requireId() {
        var id = id();
        if (id == null) {
            throw new IllegalStateException("Draft " + kind().tag() + " node has no id yet");
        }
        return id;
    }
}
