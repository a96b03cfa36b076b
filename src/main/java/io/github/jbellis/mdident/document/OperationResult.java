package io.github.jbellis.mdident.document;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.List;
import java.util.Optional;

/**
 * Outcome of a document-level operation. A failed result carries an error message and no
 * document.
 *
 * @param modifiedIds ids of the changed nodes as they are in the new document: the edited node,
 *                    then its re-identified ancestors, innermost first
 */
public record OperationResult(boolean success, Document document, List<NodeId> modifiedIds, String error) {
    public OperationResult {
        modifiedIds = List.copyOf(modifiedIds);
    }

    public static OperationResult success(Document document, List<NodeId> modifiedIds) {
        return new OperationResult(true, document, modifiedIds, null);
    }

    public static OperationResult failure(String error) {
        return new OperationResult(false, null, List.of(), error);
    }

    public Optional<Document> documentOpt() {
        return Optional.ofNullable(document);
    }
}
