package io.github.jbellis.mdident.json;

import io.github.jbellis.mdident.document.Document;

import java.util.List;

/**
 * A decoded document together with every identity drift noticed while decoding it.
 */
public record DecodedDocument(Document document, List<IdentityDrift> drifts) {
    public DecodedDocument {
        drifts = List.copyOf(drifts);
    }

    public boolean hasDrift() {
        return !drifts.isEmpty();
    }
}
