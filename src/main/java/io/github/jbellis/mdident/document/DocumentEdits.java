package io.github.jbellis.mdident.document;

import io.github.jbellis.mdident.identity.NodeId;
import io.github.jbellis.mdident.node.Heading;
import io.github.jbellis.mdident.node.Node;
import io.github.jbellis.mdident.node.Paragraph;
import io.github.jbellis.mdident.resolve.Lookup;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;
import java.util.function.UnaryOperator;

/**
 * Document-level edits addressed by identifier. Identifiers are resolved with the document's
 * resolver mode, so legacy positional ids work on documents in compatibility mode.
 *
 * A heading level change keeps the heading's id; a text edit always gives the edited node a new
 * one. The edit lands on the node the identifier resolved to, even when an earlier node has the
 * same content, and every ancestor is re-identified by {@link Document#replaceAt}.
 */
public final class DocumentEdits {
    private static final Logger logger = LogManager.getLogger(DocumentEdits.class);

    private DocumentEdits() {
    }

    public static OperationResult promote(Document document, String identifier) {
        return changeHeading(document, identifier, Heading::promote);
    }

    public static OperationResult demote(Document document, String identifier) {
        return changeHeading(document, identifier, Heading::demote);
    }

    public static OperationResult editText(Document document, String identifier, String text) {
        var lookup = document.findNode(identifier);
        if (!(lookup instanceof Lookup.Found found)) {
            return notFound(lookup, identifier);
        }
        Node target = found.node();
        if (!(target instanceof Heading) && !(target instanceof Paragraph)) {
            return OperationResult.failure("Node " + identifier + " has no editable text");
        }
        Node edited = document.editor().replaceText(target, text);
        return apply(document, found, edited);
    }

    private static OperationResult changeHeading(Document document, String identifier, UnaryOperator<Heading> change) {
        var lookup = document.findNode(identifier);
        if (!(lookup instanceof Lookup.Found found)) {
            return notFound(lookup, identifier);
        }
        if (!(found.node() instanceof Heading heading)) {
            return OperationResult.failure("Node " + identifier + " is not a heading");
        }
        Heading changed = change.apply(heading);
        if (changed.level() == heading.level()) {
            // already at the boundary; nothing to do
            return OperationResult.success(document, List.of());
        }
        return apply(document, found, changed);
    }

    /**
     * Replaces the node at the resolved path. The modified ids are the edited node's id followed
     * by the new ids of its re-identified ancestors, innermost first.
     */
    private static OperationResult apply(Document document, Lookup.Found found, Node replacement) {
        Document updated = document.replaceAt(found.path(), replacement);
        var along = updated.nodesAlong(found.path());
        var modified = new ArrayList<NodeId>(along.size());
        for (int i = along.size() - 1; i >= 0; i--) {
            modified.add(along.get(i).requireId());
        }
        logger.debug("Edited {} node {} -> {}", found.node().kind().tag(), found.node().id(), modified.get(0));
        return OperationResult.success(updated, List.copyOf(modified));
    }

    private static OperationResult notFound(Lookup lookup, String identifier) {
        if (lookup instanceof Lookup.Malformed malformed) {
            return OperationResult.failure("Invalid node id " + identifier + ": " + malformed.reason());
        }
        return OperationResult.failure("Node not found: " + identifier);
    }
}
