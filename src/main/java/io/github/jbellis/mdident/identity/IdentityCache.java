package io.github.jbellis.mdident.identity;

import io.github.jbellis.mdident.node.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

/**
 * Memoizes node ids by node <em>instance</em> for the lifetime of one document.
 *
 * Keys are compared with {@code ==}, not {@code equals}: two equal records are still two entries.
 * The key is therefore meaningless outside this process, and the cache is deliberately not
 * serializable. A decoded or copied document always starts with a fresh cache and recomputes;
 * only {@link NodeId} values are stable across runs.
 *
 * Instances made with the constructor are not thread-safe. Use {@link #synchronizedCache} when one
 * cache must be shared between threads, or give each worker its own.
 */
public final class IdentityCache {
    private static final Logger logger = LogManager.getLogger(IdentityCache.class);

    private final NodeIdentity identity;
    private final Map<Node, NodeId> entries;

    public IdentityCache(NodeIdentity identity) {
        this(identity, new IdentityHashMap<>());
    }

    private IdentityCache(NodeIdentity identity, Map<Node, NodeId> entries) {
        this.identity = identity;
        this.entries = entries;
    }

    public static IdentityCache synchronizedCache(NodeIdentity identity) {
        return new IdentityCache(identity, Collections.synchronizedMap(new IdentityHashMap<>()));
    }

    public NodeIdentity identity() {
        return identity;
    }

    /**
     * Returns the id for this node instance, computing and storing it on the first call.
     */
    public NodeId getOrCompute(Node node) {
        return entries.computeIfAbsent(node, identity::compute);
    }

    public boolean contains(Node node) {
        return entries.containsKey(node);
    }

    public int size() {
        return entries.size();
    }

    /**
     * Attaches ids to every draft node in the tree rooted at {@code node}.
     *
     * Leaf nodes that already carry an id keep it. A container whose children had to be identified
     * is rebuilt as a draft and gets a new id derived from the identified children, whatever id it
     * carried before. A container that is itself a draft is identified after its children. The
     * returned instance is registered in the cache.
     *
     * @throws StructureTooDeepException if the tree nests deeper than the canonicalizer allows
     */
    public Node identify(Node node) {
        return identify(node, new ArrayDeque<>());
    }

    private Node identify(Node node, Deque<String> path) {
        path.addLast(node.kind().tag());
        try {
            int limit = identity.canonicalizer().maxDepth();
            if (path.size() > limit) {
                throw new StructureTooDeepException(path.size(), limit, new ArrayList<>(path));
            }
            Node rebuilt = node;
            List<? extends Node> children = node.children();
            if (!children.isEmpty()) {
                var identifiedChildren = new ArrayList<Node>(children.size());
                boolean changed = false;
                for (Node child : children) {
                    Node identifiedChild = identify(child, path);
                    changed |= identifiedChild != child;
                    identifiedChildren.add(identifiedChild);
                }
                if (changed) {
                    rebuilt = node.withChildren(identifiedChildren).withId(null);
                }
            }
            if (rebuilt.isIdentified()) {
                return rebuilt;
            }
            NodeId id = getOrCompute(rebuilt);
            Node identified = rebuilt.withId(id);
            entries.put(identified, id);
            logger.debug("Identified {} node as {}", node.kind().tag(), id.toDisplayString());
            return identified;
        } finally {
            path.removeLast();
        }
    }
}
