package io.github.jbellis.mdident.identity;

import com.google.common.hash.HashCode;
import com.google.common.hash.Hashing;
import com.google.common.io.BaseEncoding;
import io.github.jbellis.mdident.node.NodeKind;

import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Stable, content-derived identifier of a node.
 *
 * The canonical form is 16 characters of lowercase base32 (alphabet {@code a-z2-7}) taken from the
 * SHA-256 digest of the node's kind discriminant and canonical bytes. Equality, hashing and
 * ordering use the canonical form only; the kind and hint are carried for display and are absent
 * on ids obtained through {@link #parse(String)}.
 *
 * {@link #toString()} returns the canonical form, so {@code parse(id.toString())} round-trips.
 */
public final class NodeId implements Comparable<NodeId> {
    public static final int LENGTH = 16;
    public static final int SHORT_LENGTH = 8;

    private static final Pattern CANONICAL = Pattern.compile("[a-z2-7]{" + LENGTH + "}");
    private static final BaseEncoding BASE32 = BaseEncoding.base32().lowerCase().omitPadding();

    private final String value;
    private final NodeKind kind;
    private final String hint;

    private NodeId(String value, NodeKind kind, String hint) {
        this.value = value;
        this.kind = kind;
        this.hint = hint;
    }

    /**
     * Derives the id of a node from its canonical bytes.
     *
     * @param canonical the output of {@link Canonicalizer#canonicalize}
     * @param kind the node's kind, hashed ahead of the canonical bytes
     * @param hint the display hint; never consulted for equality
     */
    public static NodeId derive(byte[] canonical, NodeKind kind, String hint) {
        HashCode hash = Hashing.sha256().newHasher()
                .putString(kind.tag(), StandardCharsets.UTF_8)
                .putByte((byte) 0)
                .putBytes(canonical)
                .hash();
        String encoded = BASE32.encode(hash.asBytes()).substring(0, LENGTH);
        return new NodeId(encoded, kind, hint);
    }

    /**
     * Parses a canonical identifier. No normalization is applied: surrounding whitespace or
     * upper-case letters are rejected.
     *
     * @throws MalformedIdentifierException if {@code raw} is not exactly 16 base32 characters
     */
    public static NodeId parse(String raw) {
        var reason = rejectionReason(raw);
        if (reason.isPresent()) {
            throw new MalformedIdentifierException(String.valueOf(raw), reason.get());
        }
        return new NodeId(raw, null, null);
    }

    /**
     * Why {@code raw} is not a canonical identifier, or empty when it is one.
     */
    public static Optional<String> rejectionReason(String raw) {
        if (raw == null) {
            return Optional.of("identifier is null");
        }
        if (raw.length() != LENGTH) {
            return Optional.of("expected " + LENGTH + " characters, got " + raw.length());
        }
        if (!CANONICAL.matcher(raw).matches()) {
            return Optional.of("only characters a-z and 2-7 are allowed");
        }
        return Optional.empty();
    }

    /**
     * Like {@link #parse(String)} but reports failure as an empty result instead of throwing.
     */
    public static Optional<NodeId> tryParse(String raw) {
        if (!isWellFormed(raw)) {
            return Optional.empty();
        }
        return Optional.of(new NodeId(raw, null, null));
    }

    public static boolean isWellFormed(String raw) {
        return raw != null && CANONICAL.matcher(raw).matches();
    }

    public String value() {
        return value;
    }

    /**
     * First eight characters, for display only. Lossy: never use it as a lookup key.
     */
    public String toShortString() {
        return value.substring(0, SHORT_LENGTH);
    }

    public Optional<NodeKind> kind() {
        return Optional.ofNullable(kind);
    }

    public Optional<String> hint() {
        return Optional.ofNullable(hint);
    }

    /**
     * {@code kind:hint:id} when kind and hint are known, otherwise the canonical form.
     */
    public String toDisplayString() {
        if (kind == null || hint == null) {
            return value;
        }
        return kind.tag() + ":" + hint + ":" + value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NodeId other)) return false;
        return value.equals(other.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public int compareTo(NodeId other) {
        return value.compareTo(other.value);
    }

    @Override
    public String toString() {
        return value;
    }
}
