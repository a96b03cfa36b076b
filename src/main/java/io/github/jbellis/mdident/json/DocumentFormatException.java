package io.github.jbellis.mdident.json;

import java.io.IOException;

/**
 * Persisted document JSON that cannot be turned back into a document.
 */
public class DocumentFormatException extends IOException {
    public DocumentFormatException(String message) {
        super(message);
    }

    public DocumentFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
