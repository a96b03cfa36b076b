package io.github.jbellis.mdident.resolve;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IdentifierParserTest {
    private static final String STABLE = "abcdefghijklmnop";

    @Test
    void stableIdsParseInBothModes() {
        for (ResolverMode mode : ResolverMode.values()) {
            var parsed = IdentifierParser.parse(STABLE, mode);
            var stable = assertInstanceOf(ParsedIdentifier.Stable.class, parsed);
            assertEquals(STABLE, stable.id().toString());
        }
    }

    @Test
    void strictNeverFallsBackToPositional() {
        var parsed = IdentifierParser.parse("2", ResolverMode.STRICT);

        var rejected = assertInstanceOf(ParsedIdentifier.Rejected.class, parsed);
        assertEquals("2", rejected.raw());
        assertTrue(rejected.reason().contains("expected 16 characters"));
        assertInstanceOf(ParsedIdentifier.Rejected.class, IdentifierParser.parse("h1-0", ResolverMode.STRICT));
    }

    @Test
    void strictRejectionCarriesTheStableFormReason() {
        var parsed = IdentifierParser.parse("ABCDEFGHIJKLMNOP", ResolverMode.STRICT);

        var rejected = assertInstanceOf(ParsedIdentifier.Rejected.class, parsed);
        assertEquals("only characters a-z and 2-7 are allowed", rejected.reason());
    }

    @Test
    void compatibilityAcceptsPositionalIndexes() {
        var parsed = IdentifierParser.parse("2", ResolverMode.COMPATIBILITY);

        assertEquals(2L, assertInstanceOf(ParsedIdentifier.Positional.class, parsed).index());
    }

    @Test
    void compatibilityAcceptsLegacyHeadingIds() {
        var parsed = IdentifierParser.parse("h3-1", ResolverMode.COMPATIBILITY);

        var heading = assertInstanceOf(ParsedIdentifier.LegacyHeading.class, parsed);
        assertEquals(3, heading.level());
        assertEquals(1L, heading.ordinal());
    }

    @Test
    void compatibilityRejectsEverythingElse() {
        for (String raw : new String[]{"-1", "01", " 2", "h7-0", "h1-", "node-3", "ABCDEFGHIJKLMNOP", ""}) {
            assertInstanceOf(ParsedIdentifier.Rejected.class, IdentifierParser.parse(raw, ResolverMode.COMPATIBILITY), raw);
        }
        assertInstanceOf(ParsedIdentifier.Rejected.class, IdentifierParser.parse(null, ResolverMode.COMPATIBILITY));
    }

    @Test
    void hugeIndexesAreRejectedInsteadOfOverflowing() {
        var parsed = IdentifierParser.parse("99999999999999999999999", ResolverMode.COMPATIBILITY);

        assertInstanceOf(ParsedIdentifier.Rejected.class, parsed);
    }

    @Test
    void modeNamesAreLenient() {
        assertEquals(ResolverMode.COMPATIBILITY, ResolverMode.fromString(" Compat ").orElseThrow());
        assertEquals(ResolverMode.STRICT, ResolverMode.fromString("STRICT").orElseThrow());
        assertTrue(ResolverMode.fromString("loose").isEmpty());
    }
}
