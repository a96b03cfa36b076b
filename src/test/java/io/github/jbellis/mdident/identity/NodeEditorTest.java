package io.github.jbellis.mdident.identity;

import io.github.jbellis.mdident.node.BlockQuote;
import io.github.jbellis.mdident.node.CodeBlock;
import io.github.jbellis.mdident.node.Heading;
import io.github.jbellis.mdident.node.HtmlBlock;
import io.github.jbellis.mdident.node.ListBlock;
import io.github.jbellis.mdident.node.ListItem;
import io.github.jbellis.mdident.node.Node;
import io.github.jbellis.mdident.node.Paragraph;
import io.github.jbellis.mdident.node.ThematicBreak;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests that content edits always go back through the identity pipeline.
 */
class NodeEditorTest {
    private int canonicalizations;
    private IdentityCache cache;
    private NodeEditor editor;

    @BeforeEach
    void setUp() {
        canonicalizations = 0;
        var counting = new Canonicalizer() {
            @Override
            public byte[] canonicalize(Node node) {
                canonicalizations++;
                return super.canonicalize(node);
            }
        };
        cache = new IdentityCache(new NodeIdentity(counting));
        editor = new NodeEditor(cache);
    }

    @Test
    void identicalReplacementTextIsStillRegenerated() {
        var heading = (Heading) cache.identify(Heading.draft(2, "Unchanged"));
        int before = canonicalizations;

        var edited = editor.replaceText(heading, "Unchanged");

        assertNotSame(heading, edited);
        assertEquals(before + 1, canonicalizations);
        assertEquals(heading.id(), edited.id());
        assertEquals(2, edited.level());
    }

    @Test
    void changedTextChangesTheId() {
        var paragraph = (Paragraph) cache.identify(Paragraph.draft("before").withMetadata(Map.of("k", "v")));

        var edited = editor.replaceText(paragraph, "after");

        assertNotEquals(paragraph.id(), edited.id());
        assertEquals("after", edited.text());
        assertEquals(Map.of("k", "v"), edited.metadata());
    }

    @Test
    void whitespaceOnlyEditsKeepTheSameContentId() {
        var paragraph = (Paragraph) cache.identify(Paragraph.draft("one two"));

        var edited = editor.replaceText(paragraph, "one   two ");

        assertEquals(paragraph.id(), edited.id());
    }

    @Test
    void codeAndLanguageEditsChangeTheId() {
        var code = (CodeBlock) cache.identify(CodeBlock.draft("python", "print(1)"));

        assertNotEquals(code.id(), editor.replaceCode(code, "print(2)").id());
        var relabeled = editor.replaceLanguage(code, "python3");
        assertNotEquals(code.id(), relabeled.id());
        assertEquals("print(1)", relabeled.code());
    }

    @Test
    void htmlEditChangesTheId() {
        var html = (HtmlBlock) cache.identify(HtmlBlock.draft("<p>a</p>"));

        assertNotEquals(html.id(), editor.replaceHtml(html, "<p>b</p>").id());
    }

    @Test
    void replacingChildrenRegeneratesContainer() {
        var item = (ListItem) cache.identify(ListItem.draft(List.of(Paragraph.draft("old"))));
        var quote = (BlockQuote) cache.identify(BlockQuote.draft(List.of(Paragraph.draft("old"))));

        var newItem = editor.replaceChildren(item, List.of(Paragraph.draft("new")));
        var newQuote = editor.replaceChildren(quote, List.of(ThematicBreak.draft()));

        assertNotEquals(item.id(), newItem.id());
        assertTrue(newItem.children().get(0).isIdentified());
        assertNotEquals(quote.id(), newQuote.id());
    }

    @Test
    void replacingItemsKeepsListPresentation() {
        var list = (ListBlock) cache.identify(new ListBlock(true, 3,
                List.of(ListItem.draft(List.of(Paragraph.draft("a")))), Map.of(), null));

        var edited = editor.replaceItems(list, List.of(ListItem.draft(List.of(Paragraph.draft("b")))));

        assertTrue(edited.ordered());
        assertEquals(3, edited.start());
        assertNotEquals(list.id(), edited.id());
    }

    @Test
    void untypedTextEditKeepsTheNodeKind() {
        Node heading = cache.identify(Heading.draft(3, "Typed"));
        Node paragraph = cache.identify(Paragraph.draft("Typed"));

        var editedHeading = assertInstanceOf(Heading.class, editor.replaceText(heading, "Retyped"));
        var editedParagraph = assertInstanceOf(Paragraph.class, editor.replaceText(paragraph, "Retyped"));

        assertEquals(3, editedHeading.level());
        assertEquals(cache.identity().compute(editedParagraph), editedParagraph.id());
    }

    @Test
    void replaceTextRejectsTextlessKinds() {
        var rule = cache.identify(ThematicBreak.draft());

        assertThrows(IllegalArgumentException.class, () -> editor.replaceText(rule, "text"));
    }
}
