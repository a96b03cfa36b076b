package io.github.jbellis.mdident.identity;

import io.github.jbellis.mdident.node.BlockQuote;
import io.github.jbellis.mdident.node.CodeBlock;
import io.github.jbellis.mdident.node.Heading;
import io.github.jbellis.mdident.node.HtmlBlock;
import io.github.jbellis.mdident.node.ListBlock;
import io.github.jbellis.mdident.node.ListItem;
import io.github.jbellis.mdident.node.Paragraph;
import io.github.jbellis.mdident.node.Table;
import io.github.jbellis.mdident.node.ThematicBreak;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HintsTest {

    @Test
    void slugCollapsesSeparatorsAndTrims() {
        assertEquals("hello-world", Hints.slugify("  Hello\tWorld!!  "));
        assertEquals("a-b-c", Hints.slugify("a -- b __ c"));
    }

    @Test
    void slugKeepsUnicodeLetters() {
        assertEquals("caf\u00e9-\u00fcn\u00efcode", Hints.slugify("Cafe\u0301 \u00dcn\u00efcode"));
    }

    @Test
    void slugIsTruncatedWithoutTrailingHyphen() {
        String slug = Hints.slugify("abcdefghijklmnopqrstuvwxyz abcdef ghijkl");

        assertTrue(slug.length() <= Hints.MAX_LENGTH);
        assertFalse(slug.endsWith("-"));
        assertEquals("abcdefghijklmnopqrstuvwxyz-abcde", slug);
    }

    @Test
    void textlessKindsFallBackToTheirTag() {
        assertEquals("list", Hints.of(ListBlock.draft(false, List.of())));
        assertEquals("listitem", Hints.of(ListItem.draft(List.of())));
        assertEquals("blockquote", Hints.of(BlockQuote.draft(List.of())));
        assertEquals("thematicbreak", Hints.of(ThematicBreak.draft()));
        assertEquals("paragraph", Hints.of(Paragraph.draft("!!!")));
        assertEquals("heading", Hints.of(Heading.draft(1, "")));
    }

    @Test
    void codeBlockHintIsTheLanguage() {
        assertEquals("python", Hints.of(CodeBlock.draft("Python", "print()")));
        assertEquals("codeblock", Hints.of(CodeBlock.draft(null, "print()")));
    }

    @Test
    void paragraphHintUsesAnExcerpt() {
        var text = "word ".repeat(30);
        var hint = Hints.of(Paragraph.draft(text));

        assertTrue(hint.startsWith("word-word"));
        assertTrue(hint.length() <= Hints.MAX_LENGTH);
    }

    @Test
    void htmlHintUsesVisibleText() {
        assertEquals("hello-there", Hints.of(HtmlBlock.draft("<div class=\"note\"><p>Hello <b>there</b></p></div>")));
        assertEquals("htmlblock", Hints.of(HtmlBlock.draft("<div></div>")));
    }

    @Test
    void tableHintUsesTheHeaderRow() {
        assertEquals("name-value", Hints.of(Table.draft(List.of(List.of("Name", "Value"), List.of("a", "1")))));
    }

    @Test
    void idsCarryTheHint() {
        var id = new NodeIdentity().compute(Heading.draft(2, "Getting Started"));

        assertEquals("getting-started", id.hint().orElseThrow());
        assertTrue(id.toDisplayString().startsWith("heading:getting-started:"));
    }
}
