package io.github.jbellis.mdident.resolve;

import io.github.jbellis.mdident.node.Node;

import java.util.List;
import java.util.Optional;

/**
 * Result of resolving an identifier against a document. Not finding a node is an ordinary outcome,
 * not an exception.
 */
public sealed interface Lookup {

    /**
     * @param node the resolved node
     * @param ancestors its enclosing nodes, outermost first; empty for a top-level node
     * @param path child indexes from the top level down to the node; edits go through this path,
     *             since duplicate content means the node's id may also match an earlier node
     */
    record Found(Node node, List<Node> ancestors, List<Integer> path) implements Lookup {
        public Found {
            ancestors = List.copyOf(ancestors);
            path = List.copyOf(path);
            if (path.size() != ancestors.size() + 1) {
                throw new IllegalArgumentException("Path of length " + path.size() + " does not match "
                                                   + ancestors.size() + " ancestors");
            }
        }
    }

    record NotFound(String identifier) implements Lookup {
    }

    record Malformed(String identifier, String reason) implements Lookup {
    }

    default boolean isFound() {
        return this instanceof Found;
    }

    default Optional<Node> toOptional() {
        return this instanceof Found found ? Optional.of(found.node()) : Optional.empty();
    }
}
