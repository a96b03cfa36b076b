package io.github.jbellis.mdident.identity;

import io.github.jbellis.mdident.node.Node;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * The uncached identity pipeline: canonicalize, hint, hash.
 *
 * Pure and stateless apart from its {@link Canonicalizer}; safe to share between threads and
 * documents. Memoization lives in {@link IdentityCache}.
 */
public class NodeIdentity {
    private static final Logger logger = LogManager.getLogger(NodeIdentity.class);

    private final Canonicalizer canonicalizer;

    public NodeIdentity() {
        this(new Canonicalizer());
    }

    public NodeIdentity(Canonicalizer canonicalizer) {
        this.canonicalizer = canonicalizer;
    }

    public Canonicalizer canonicalizer() {
        return canonicalizer;
    }

    /**
     * Computes the id a node's content deserves. Any id already attached to the node is ignored.
     */
    public NodeId compute(Node node) {
        byte[] canonical = canonicalizer.canonicalize(node);
        NodeId id = NodeId.derive(canonical, node.kind(), Hints.of(node));
        logger.debug("Derived id {} from {} canonical bytes", id.toDisplayString(), canonical.length);
        return id;
    }
}
