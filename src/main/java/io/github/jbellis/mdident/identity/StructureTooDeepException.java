package io.github.jbellis.mdident.identity;

import java.util.List;

/**
 * Raised when a node tree nests deeper than the configured limit. The path lists the kinds (or
 * parser block names) from the root down to the node where the limit was hit.
 */
public class StructureTooDeepException extends IllegalStateException {
    private final int depth;
    private final int limit;
    private final List<String> path;

    public StructureTooDeepException(int depth, int limit, List<String> path) {
        super("Structure too deep: depth " + depth + " exceeds limit " + limit + " at " + String.join(" > ", path));
        this.depth = depth;
        this.limit = limit;
        this.path = List.copyOf(path);
    }

    public int depth() {
        return depth;
    }

    public int limit() {
        return limit;
    }

    public List<String> path() {
        return path;
    }
}
