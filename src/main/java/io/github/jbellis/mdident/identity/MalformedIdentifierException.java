package io.github.jbellis.mdident.identity;

/**
 * Thrown when a string that should be a canonical {@link NodeId} is not one. Carries the raw input
 * so diagnostics can show exactly what the caller sent.
 */
public class MalformedIdentifierException extends IllegalArgumentException {
    private final String rawIdentifier;

    public MalformedIdentifierException(String rawIdentifier, String reason) {
        super("Malformed node identifier '" + rawIdentifier + "': " + reason);
        this.rawIdentifier = rawIdentifier;
    }

    public String rawIdentifier() {
        return rawIdentifier;
    }
}
