package io.github.jbellis.mdident.resolve;

import java.util.Locale;
import java.util.Optional;

/**
 * How identifier strings are interpreted when looking up nodes.
 */
public enum ResolverMode {
    /** Only canonical 16-character ids are accepted. */
    STRICT,
    /** Canonical ids first, then legacy positional identifiers. */
    COMPATIBILITY;

    /**
     * Case-insensitive lookup by name; {@code "compat"} is accepted as a short form.
     */
    public static Optional<ResolverMode> fromString(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        return switch (raw.trim().toLowerCase(Locale.ROOT)) {
            case "strict" -> Optional.of(STRICT);
            case "compatibility", "compat" -> Optional.of(COMPATIBILITY);
            default -> Optional.empty();
        };
    }
}
