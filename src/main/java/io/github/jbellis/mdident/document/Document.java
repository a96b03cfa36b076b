package io.github.jbellis.mdident.document;

import io.github.jbellis.mdident.config.IdentitySettings;
import io.github.jbellis.mdident.identity.Canonicalizer;
import io.github.jbellis.mdident.identity.IdentityCache;
import io.github.jbellis.mdident.identity.NodeEditor;
import io.github.jbellis.mdident.identity.NodeId;
import io.github.jbellis.mdident.identity.NodeIdentity;
import io.github.jbellis.mdident.node.Node;
import io.github.jbellis.mdident.resolve.CompatibilityResolver;
import io.github.jbellis.mdident.resolve.Lookup;
import io.github.jbellis.mdident.resolve.ResolverMode;
import io.github.jbellis.mdident.source.SourceMap;
import io.github.jbellis.mdident.source.SourceSpan;
import io.github.jbellis.mdident.source.ViewSourceMapping;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * An immutable, identified markdown document.
 *
 * A document owns its top-level nodes, the view-source mappings recorded when it was parsed, and
 * an {@link IdentityCache} that no other document shares. Every operation that changes content
 * returns a new document with a fresh cache; the mappings are carried over as they are, so they
 * keep describing the source the document was parsed from.
 */
public final class Document {
    private static final Logger logger = LogManager.getLogger(Document.class);

    public static final String FORMAT_VERSION = "1.0";

    private final List<Node> nodes;
    private final SourceMap sourceMap;
    private final String version;
    private final IdentitySettings settings;
    private final IdentityCache cache;

    private Document(List<Node> nodes, SourceMap sourceMap, String version, IdentitySettings settings, IdentityCache cache) {
        this.nodes = List.copyOf(nodes);
        this.sourceMap = Objects.requireNonNull(sourceMap, "sourceMap");
        this.version = Objects.requireNonNull(version, "version");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.cache = cache;
        for (Node node : this.nodes) {
            requireIdentified(node);
        }
    }

    /**
     * Builds a document from draft (or already identified) nodes, attaching ids to every draft.
     */
    public static Document identify(List<? extends Node> nodes, SourceMap sourceMap, IdentitySettings settings) {
        var cache = newCache(settings);
        var identified = nodes.stream().map(cache::identify).toList();
        logger.debug("Identified document with {} top-level nodes", identified.size());
        return new Document(identified, sourceMap, FORMAT_VERSION, settings, cache);
    }

    public static Document of(Node... nodes) {
        return identify(Arrays.asList(nodes), SourceMap.empty(), IdentitySettings.defaults());
    }

    /**
     * Wraps nodes that were identified through {@code cache}, which becomes the document's own.
     *
     * @throws IllegalArgumentException if any node in the tree is still a draft
     */
    public static Document fromIdentified(List<? extends Node> nodes, SourceMap sourceMap, String version,
                                          IdentitySettings settings, IdentityCache cache) {
        return new Document(List.copyOf(nodes), sourceMap, version, settings, cache);
    }

    public static IdentityCache newCache(IdentitySettings settings) {
        return new IdentityCache(new NodeIdentity(new Canonicalizer(settings.maxDepth())));
    }

    private static void requireIdentified(Node node) {
        if (!node.isIdentified()) {
            throw new IllegalArgumentException("Document contains a draft " + node.kind().tag() + " node");
        }
        for (Node child : node.children()) {
            requireIdentified(child);
        }
    }

    public List<Node> nodes() {
        return nodes;
    }

    public int size() {
        return nodes.size();
    }

    public Node get(int index) {
        return nodes.get(index);
    }

    public SourceMap sourceMap() {
        return sourceMap;
    }

    public List<ViewSourceMapping> viewMappings() {
        return sourceMap.mappings();
    }

    public String version() {
        return version;
    }

    public IdentitySettings settings() {
        return settings;
    }

    public ResolverMode resolverMode() {
        return settings.resolverMode();
    }

    /**
     * Every node in the tree, parents before their children.
     */
    public List<Node> allNodes() {
        var result = new ArrayList<Node>();
        for (Node node : nodes) {
            collect(node, result);
        }
        return result;
    }

    private static void collect(Node node, List<Node> result) {
        result.add(node);
        for (Node child : node.children()) {
            collect(child, result);
        }
    }

    /**
     * The first node in pre-order carrying {@code id}. Identical content yields identical ids, so
     * a later duplicate is only reachable by position.
     */
    public Optional<Node> findById(NodeId id) {
        return indexPathOf(id).map(this::nodeAt);
    }

    /**
     * The enclosing nodes of the node with {@code id}, outermost first; empty list for a top-level
     * node and empty result when no node has the id.
     */
    public Optional<List<Node>> pathTo(NodeId id) {
        return indexPathOf(id).map(path -> {
            var along = nodesAlong(path);
            return List.copyOf(along.subList(0, along.size() - 1));
        });
    }

    /**
     * Child indexes from the top level down to the first node in pre-order carrying {@code id}.
     * {@code [2]} is the third top-level node, {@code [2, 0]} its first child.
     */
    public Optional<List<Integer>> indexPathOf(NodeId id) {
        var path = new ArrayList<Integer>();
        for (int i = 0; i < nodes.size(); i++) {
            path.add(i);
            if (locate(nodes.get(i), id, path)) {
                return Optional.of(List.copyOf(path));
            }
            path.remove(path.size() - 1);
        }
        return Optional.empty();
    }

    /**
     * The nodes along an index path, outermost first; the last element is the node at the path.
     *
     * @throws IllegalArgumentException if the path is empty or leaves the tree
     */
    public List<Node> nodesAlong(List<Integer> path) {
        if (path.isEmpty()) {
            throw new IllegalArgumentException("Index path is empty");
        }
        var along = new ArrayList<Node>(path.size());
        List<? extends Node> level = nodes;
        for (int index : path) {
            if (index < 0 || index >= level.size()) {
                throw new IllegalArgumentException("Index path " + path + " leaves the document tree");
            }
            Node node = level.get(index);
            along.add(node);
            level = node.children();
        }
        return List.copyOf(along);
    }

    public Optional<SourceSpan> findSourcePosition(NodeId id) {
        return sourceMap.findSourcePosition(id);
    }

    /**
     * The span of the node with {@code id} or, when it has none, of its nearest mapped ancestor.
     */
    public Optional<SourceSpan> findSourcePositionOrAncestor(NodeId id) {
        var direct = sourceMap.findSourcePosition(id);
        if (direct.isPresent()) {
            return direct;
        }
        var ancestors = pathTo(id).orElse(List.of());
        for (int i = ancestors.size() - 1; i >= 0; i--) {
            var span = sourceMap.findSourcePosition(ancestors.get(i).requireId());
            if (span.isPresent()) {
                return span;
            }
        }
        return Optional.empty();
    }

    /**
     * The innermost mapped node whose span contains the position. Lines are 1-based, columns
     * 0-based. Among nested nodes with equal spans, such as a one-item list and its item, the
     * deepest one wins.
     */
    public Optional<Node> findNodeAt(int line, int column) {
        List<Integer> innermost = null;
        for (ViewSourceMapping mapping : sourceMap.mappings()) {
            if (mapping.span().contains(line, column)) {
                var path = indexPathOf(mapping.nodeId());
                if (path.isPresent() && (innermost == null || path.get().size() >= innermost.size())) {
                    innermost = path.get();
                }
            }
        }
        return Optional.ofNullable(innermost).map(this::nodeAt);
    }

    public Lookup findNode(String identifier) {
        return findNode(identifier, settings.resolverMode());
    }

    public Lookup findNode(String identifier, ResolverMode mode) {
        return CompatibilityResolver.findNode(this, identifier, mode);
    }

    public Document withResolverMode(ResolverMode mode) {
        return new Document(nodes, sourceMap, version, settings.withResolverMode(mode), newCache(settings));
    }

    /**
     * The content-derived id of {@code node}, memoized per instance in this document's cache.
     */
    public NodeId identityOf(Node node) {
        return cache.getOrCompute(node);
    }

    /**
     * An editor whose results are identified through this document's cache. Edited nodes are
     * placed into a new document with {@link #replaceNode}.
     */
    public NodeEditor editor() {
        return new NodeEditor(cache);
    }

    /**
     * Returns a document in which the first node carrying {@code target} is replaced. When several
     * nodes share the id, use {@link #replaceAt} with the path of the one to change.
     *
     * @return empty if no node carries {@code target}
     */
    public Optional<Document> replaceNode(NodeId target, Node replacement) {
        return indexPathOf(target).map(path -> replaceAt(path, replacement));
    }

    /**
     * Returns a document in which the node at {@code path} is replaced.
     *
     * A draft replacement is identified; an identified one keeps its id. Every ancestor of the
     * replaced node has changed content and is re-identified. All other nodes keep their ids.
     *
     * @throws IllegalArgumentException if the path is empty or leaves the tree
     */
    public Document replaceAt(List<Integer> path, Node replacement) {
        Objects.requireNonNull(replacement, "replacement");
        nodesAlong(path);
        var newCache = newCache(settings);
        var newNodes = new ArrayList<>(nodes);
        newNodes.set(path.get(0), rebuild(nodes.get(path.get(0)), path, 1, replacement, newCache));
        logger.debug("Replaced node at {}", path);
        return new Document(newNodes, sourceMap, version, settings, newCache);
    }

    private static Node rebuild(Node current, List<Integer> path, int depth, Node replacement, IdentityCache cache) {
        if (depth == path.size()) {
            return cache.identify(replacement);
        }
        var children = new ArrayList<Node>(current.children());
        int index = path.get(depth);
        children.set(index, rebuild(children.get(index), path, depth + 1, replacement, cache));
        return cache.identify(current.withChildren(children));
    }

    private Node nodeAt(List<Integer> path) {
        Node node = nodes.get(path.get(0));
        for (int i = 1; i < path.size(); i++) {
            node = node.children().get(path.get(i));
        }
        return node;
    }

    private static boolean locate(Node node, NodeId id, List<Integer> path) {
        if (id.equals(node.id())) {
            return true;
        }
        var children = node.children();
        for (int i = 0; i < children.size(); i++) {
            path.add(i);
            if (locate(children.get(i), id, path)) {
                return true;
            }
            path.remove(path.size() - 1);
        }
        return false;
    }

    @Override
    public String toString() {
        return "Document[version=" + version + ", nodes=" + nodes.size() + ", mappings=" + sourceMap.size() + "]";
    }
}
