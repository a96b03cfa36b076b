package io.github.jbellis.mdident.resolve;

import io.github.jbellis.mdident.document.Document;
import io.github.jbellis.mdident.node.BlockQuote;
import io.github.jbellis.mdident.node.CodeBlock;
import io.github.jbellis.mdident.node.Heading;
import io.github.jbellis.mdident.node.Paragraph;
import io.github.jbellis.mdident.node.ThematicBreak;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for identifier resolution in strict and compatibility modes.
 */
class CompatibilityResolverTest {
    private Document document;

    @BeforeEach
    void setUp() {
        document = Document.of(
                Heading.draft(1, "Guide"),
                Paragraph.draft("Intro"),
                Heading.draft(2, "Setup"),
                BlockQuote.draft(List.of(Paragraph.draft("Quoted"))),
                Heading.draft(2, "Usage"));
    }

    @Test
    void positionalIdentifierInCompatibilityMode() {
        var lookup = CompatibilityResolver.findNode(document, "2", ResolverMode.COMPATIBILITY);

        var found = assertInstanceOf(Lookup.Found.class, lookup);
        assertSame(document.get(2), found.node());
        assertTrue(found.ancestors().isEmpty());
        assertEquals(List.of(2), found.path());
    }

    @Test
    void legacyHeadingIdCarriesItsTopLevelPosition() {
        var lookup = CompatibilityResolver.findNode(document, "h2-1", ResolverMode.COMPATIBILITY);

        var found = assertInstanceOf(Lookup.Found.class, lookup);
        assertSame(document.get(4), found.node());
        assertEquals(List.of(4), found.path());
    }

    @Test
    void foundRejectsAPathThatDoesNotMatchItsAncestors() {
        var node = document.get(0);

        assertThrows(IllegalArgumentException.class, () -> new Lookup.Found(node, List.of(), List.of(0, 1)));
    }

    @Test
    void positionalIdentifierInStrictModeIsNotResolved() {
        var lookup = CompatibilityResolver.findNode(document, "2", ResolverMode.STRICT);

        assertFalse(lookup.isFound());
        assertInstanceOf(Lookup.Malformed.class, lookup);
        assertTrue(lookup.toOptional().isEmpty());
    }

    @Test
    void outOfRangePositionIsNotFound() {
        var lookup = CompatibilityResolver.findNode(document, "5", ResolverMode.COMPATIBILITY);

        assertEquals(new Lookup.NotFound("5"), lookup);
    }

    @Test
    void legacyHeadingIdsCountPerLevel() {
        var second = CompatibilityResolver.findNode(document, "h2-1", ResolverMode.COMPATIBILITY);
        var missing = CompatibilityResolver.findNode(document, "h2-2", ResolverMode.COMPATIBILITY);

        assertEquals("Usage", ((Heading) second.toOptional().orElseThrow()).text());
        assertInstanceOf(Lookup.NotFound.class, missing);
    }

    @Test
    void stableIdsResolveInBothModes() {
        var quoted = document.get(3).children().get(0);

        for (ResolverMode mode : ResolverMode.values()) {
            var lookup = CompatibilityResolver.findNode(document, quoted.requireId().toString(), mode);
            var found = assertInstanceOf(Lookup.Found.class, lookup);
            assertSame(quoted, found.node());
            assertEquals(List.of(document.get(3)), found.ancestors());
            assertEquals(List.of(3, 0), found.path());
        }
    }

    @Test
    void wellFormedButUnknownIdIsNotFound() {
        var lookup = CompatibilityResolver.findNode(document, "aaaaaaaaaaaaaaaa", ResolverMode.STRICT);

        assertEquals(new Lookup.NotFound("aaaaaaaaaaaaaaaa"), lookup);
    }

    @Test
    void garbageIsMalformedInBothModes() {
        for (ResolverMode mode : ResolverMode.values()) {
            var lookup = CompatibilityResolver.findNode(document, "not an id", mode);
            var malformed = assertInstanceOf(Lookup.Malformed.class, lookup);
            assertEquals("not an id", malformed.identifier());
        }
    }

    @Test
    void documentModeIsUsedByDefault() {
        assertFalse(document.findNode("0").isFound());

        var compat = document.withResolverMode(ResolverMode.COMPATIBILITY);

        assertTrue(compat.findNode("0").isFound());
        assertEquals(ResolverMode.COMPATIBILITY, compat.resolverMode());
        assertTrue(document.findNode("4", ResolverMode.COMPATIBILITY).isFound());
    }

    @Test
    void everyKindIsAddressableByPosition() {
        var doc = Document.of(CodeBlock.draft("sh", "ls"), ThematicBreak.draft());
        assertTrue(doc.findNode("1", ResolverMode.COMPATIBILITY).isFound());
    }
}
