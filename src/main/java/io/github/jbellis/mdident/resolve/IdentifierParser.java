package io.github.jbellis.mdident.resolve;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Two-stage identifier parsing. The stable form is always tried first; only a structured
 * rejection of it lets {@link ResolverMode#COMPATIBILITY} fall through to the legacy positional
 * forms. {@link ResolverMode#STRICT} never coerces a failed stable parse into a positional one.
 */
public final class IdentifierParser {
    private static final Pattern POSITIONAL = Pattern.compile("0|[1-9][0-9]*");
    private static final Pattern LEGACY_HEADING = Pattern.compile("h([1-6])-(0|[1-9][0-9]*)");
    private static final int MAX_DIGITS = 18;

    private IdentifierParser() {
    }

    public static ParsedIdentifier parse(String raw, ResolverMode mode) {
        if (raw == null || raw.isEmpty()) {
            return new ParsedIdentifier.Rejected(String.valueOf(raw), "identifier is empty");
        }
        var stable = NodeId.tryParse(raw);
        if (stable.isPresent()) {
            return new ParsedIdentifier.Stable(raw, stable.get());
        }
        if (mode == ResolverMode.STRICT) {
            return new ParsedIdentifier.Rejected(raw, NodeId.rejectionReason(raw).orElseThrow());
        }

        if (POSITIONAL.matcher(raw).matches()) {
            if (raw.length() > MAX_DIGITS) {
                return new ParsedIdentifier.Rejected(raw, "positional index is too large");
            }
            return new ParsedIdentifier.Positional(raw, Long.parseLong(raw));
        }
        Matcher heading = LEGACY_HEADING.matcher(raw);
        if (heading.matches()) {
            if (heading.group(2).length() > MAX_DIGITS) {
                return new ParsedIdentifier.Rejected(raw, "heading ordinal is too large");
            }
            return new ParsedIdentifier.LegacyHeading(raw, Integer.parseInt(heading.group(1)), Long.parseLong(heading.group(2)));
        }
        return new ParsedIdentifier.Rejected(raw, "neither a stable id nor a legacy positional identifier");
    }
}
