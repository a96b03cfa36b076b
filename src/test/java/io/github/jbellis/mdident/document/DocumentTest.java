package io.github.jbellis.mdident.document;

import io.github.jbellis.mdident.config.IdentitySettings;
import io.github.jbellis.mdident.identity.NodeId;
import io.github.jbellis.mdident.identity.NodeIdentity;
import io.github.jbellis.mdident.node.BlockQuote;
import io.github.jbellis.mdident.node.Heading;
import io.github.jbellis.mdident.node.ListBlock;
import io.github.jbellis.mdident.node.ListItem;
import io.github.jbellis.mdident.node.Node;
import io.github.jbellis.mdident.node.Paragraph;
import io.github.jbellis.mdident.source.SourceMap;
import io.github.jbellis.mdident.source.SourceSpan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for document queries and node replacement.
 */
class DocumentTest {
    private Document document;
    private Heading title;
    private BlockQuote quote;
    private Paragraph quoted;
    private Paragraph other;

    @BeforeEach
    void setUp() {
        document = Document.of(
                Heading.draft(1, "Intro"),
                BlockQuote.draft(List.of(Paragraph.draft("quoted"), Paragraph.draft("other"))));
        title = (Heading) document.get(0);
        quote = (BlockQuote) document.get(1);
        quoted = (Paragraph) quote.children().get(0);
        other = (Paragraph) quote.children().get(1);
    }

    @Test
    void allNodesIsPreOrder() {
        assertEquals(List.of(title, quote, quoted, other), document.allNodes());
        assertEquals(2, document.size());
        assertEquals(Document.FORMAT_VERSION, document.version());
    }

    @Test
    void findByIdAndPath() {
        assertSame(quoted, document.findById(quoted.requireId()).orElseThrow());
        assertEquals(List.of(quote), document.pathTo(quoted.requireId()).orElseThrow());
        assertEquals(List.of(), document.pathTo(title.requireId()).orElseThrow());
        assertTrue(document.findById(NodeId.parse("zzzzzzzzzzzzzzzz")).isEmpty());
    }

    @Test
    void draftsAreRejected() {
        var drafts = List.<Node>of(Paragraph.draft("draft"));

        assertThrows(IllegalArgumentException.class, () ->
                Document.fromIdentified(drafts, SourceMap.empty(), Document.FORMAT_VERSION,
                                        IdentitySettings.defaults(), Document.newCache(IdentitySettings.defaults())));
    }

    @Test
    void replaceNodeReidentifiesAncestorsOnly() {
        var edited = document.editor().replaceText(quoted, "changed");

        var updated = document.replaceNode(quoted.requireId(), edited).orElseThrow();

        var newQuote = (BlockQuote) updated.get(1);
        assertEquals(title.id(), updated.get(0).id());
        assertNotEquals(quote.id(), newQuote.id());
        assertEquals(edited.id(), newQuote.children().get(0).id());
        assertEquals(other.id(), newQuote.children().get(1).id());
        assertEquals(updated.identityOf(newQuote.withId(null)), newQuote.id());
        // the original is untouched
        assertSame(quoted, document.findById(quoted.requireId()).orElseThrow());
    }

    @Test
    void replaceNodeWithStructuralChangeKeepsIds() {
        var updated = document.replaceNode(title.requireId(), title.demote()).orElseThrow();

        var heading = (Heading) updated.get(0);
        assertEquals(2, heading.level());
        assertEquals(title.id(), heading.id());
        assertEquals(quote.id(), updated.get(1).id());
    }

    @Test
    void replaceNodeIdentifiesDraftReplacements() {
        var updated = document.replaceNode(other.requireId(), Paragraph.draft("fresh")).orElseThrow();

        assertTrue(updated.allNodes().stream().allMatch(Node::isIdentified));
    }

    @Test
    void replaceMissingNodeIsEmpty() {
        assertTrue(document.replaceNode(NodeId.parse("zzzzzzzzzzzzzzzz"), Paragraph.draft("x")).isEmpty());
    }

    @Test
    void identityOfUsesTheDocumentCache() {
        var loose = Paragraph.draft("quoted");

        assertEquals(quoted.id(), document.identityOf(loose));
        assertEquals(quoted.id(), document.identityOf(quoted));
    }

    @Test
    void duplicateContentSharesAnId() {
        var doc = Document.of(Paragraph.draft("same"), Paragraph.draft("same"));

        assertEquals(doc.get(0).id(), doc.get(1).id());
        assertSame(doc.get(0), doc.findById(doc.get(0).requireId()).orElseThrow());
    }

    @Test
    void replaceAtTargetsTheGivenDuplicate() {
        var doc = Document.of(Paragraph.draft("same"), Paragraph.draft("same"));

        var updated = doc.replaceAt(List.of(1), Paragraph.draft("second"));

        assertEquals("same", ((Paragraph) updated.get(0)).text());
        assertEquals("second", ((Paragraph) updated.get(1)).text());
        assertEquals(List.of(0), doc.indexPathOf(doc.get(1).requireId()).orElseThrow());
    }

    @Test
    void indexPathsWalkTheTree() {
        assertEquals(List.of(1, 1), document.indexPathOf(other.requireId()).orElseThrow());
        assertEquals(List.of(quote, other), document.nodesAlong(List.of(1, 1)));
        assertThrows(IllegalArgumentException.class, () -> document.nodesAlong(List.of(1, 2)));
        assertThrows(IllegalArgumentException.class, () -> document.replaceAt(List.of(), Paragraph.draft("x")));
    }

    @Test
    void containerWithNewChildrenIsReidentified() {
        var changed = Document.of(quote.withChildren(List.of(Paragraph.draft("b"))));

        var rebuilt = changed.get(0);
        assertNotEquals(quote.id(), rebuilt.id());
        assertEquals(new NodeIdentity().compute(rebuilt), rebuilt.id());
    }

    @Test
    void sourcePositionsFallBackToAncestors() {
        var list = ListBlock.draft(false, List.of(ListItem.draft(List.of(Paragraph.draft("item")))));
        var cache = Document.newCache(IdentitySettings.defaults());
        var identified = (ListBlock) cache.identify(list);
        var item = identified.items().get(0);
        var paragraph = item.children().get(0);
        var listSpan = new SourceSpan(0, 6, 1, 0, 1, 6);
        var itemSpan = new SourceSpan(0, 6, 1, 0, 1, 6);
        var map = SourceMap.builder()
                .record(identified.requireId(), listSpan)
                .record(item.requireId(), itemSpan)
                .build();
        var doc = Document.fromIdentified(List.of(identified), map, Document.FORMAT_VERSION,
                                          IdentitySettings.defaults(), cache);

        assertTrue(doc.findSourcePosition(paragraph.requireId()).isEmpty());
        assertEquals(itemSpan, doc.findSourcePositionOrAncestor(paragraph.requireId()).orElseThrow());
        assertEquals(listSpan, doc.findSourcePositionOrAncestor(identified.requireId()).orElseThrow());
        assertSame(item, doc.findNodeAt(1, 3).orElseThrow());
        assertTrue(doc.findNodeAt(2, 0).isEmpty());
    }

    @Test
    void mappingsAreCarriedForwardUnchanged() {
        var span = SourceSpan.ofLines(1, 0, 1, 7);
        var titleId = document.identityOf(Heading.draft(1, "Title"));
        var doc = Document.identify(List.of(Heading.draft(1, "Title")),
                                    SourceMap.builder().record(titleId, span).build(),
                                    IdentitySettings.defaults());
        var heading = (Heading) doc.get(0);

        var edited = doc.replaceNode(heading.requireId(), doc.editor().replaceText(heading, "Renamed")).orElseThrow();

        assertEquals(span, doc.findSourcePosition(heading.requireId()).orElseThrow());
        assertEquals(doc.viewMappings(), edited.viewMappings());
        assertTrue(edited.findSourcePosition(edited.get(0).requireId()).isEmpty());
    }
}
