package io.github.jbellis.mdident.identity;

import io.github.jbellis.mdident.node.BlockQuote;
import io.github.jbellis.mdident.node.CodeBlock;
import io.github.jbellis.mdident.node.Heading;
import io.github.jbellis.mdident.node.HtmlBlock;
import io.github.jbellis.mdident.node.ListBlock;
import io.github.jbellis.mdident.node.ListItem;
import io.github.jbellis.mdident.node.Node;
import io.github.jbellis.mdident.node.NodeVisitor;
import io.github.jbellis.mdident.node.Paragraph;
import io.github.jbellis.mdident.node.Table;
import io.github.jbellis.mdident.node.ThematicBreak;
import org.jsoup.Jsoup;

import java.text.Normalizer;
import java.util.Locale;

/**
 * Human-readable hints attached to node ids for debugging.
 *
 * A hint is a slug of the node's original (not canonicalized) text: NFC-normalized, lower-cased,
 * every run of characters that are not letters or digits replaced by a single hyphen, no leading
 * or trailing hyphen, at most {@value #MAX_LENGTH} characters. Nodes without text, or whose text
 * slugs to nothing, get their kind tag as a fixed fallback.
 */
public final class Hints {
    public static final int MAX_LENGTH = 32;
    static final int PARAGRAPH_EXCERPT = 50;

    private static final NodeVisitor<String> SOURCE_TEXT = new SourceText();

    private Hints() {
    }

    public static String of(Node node) {
        String slug = slugify(node.accept(SOURCE_TEXT));
        return slug.isEmpty() ? node.kind().tag() : slug;
    }

    public static String slugify(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        String normalized = Normalizer.normalize(text, Normalizer.Form.NFC).toLowerCase(Locale.ROOT);
        var sb = new StringBuilder();
        boolean pendingHyphen = false;
        for (int i = 0; i < normalized.length(); ) {
            int cp = normalized.codePointAt(i);
            i += Character.charCount(cp);
            if (Character.isLetterOrDigit(cp)) {
                if (pendingHyphen) {
                    sb.append('-');
                    pendingHyphen = false;
                }
                sb.appendCodePoint(cp);
                if (sb.length() >= MAX_LENGTH) {
                    break;
                }
            } else if (sb.length() > 0) {
                pendingHyphen = true;
            }
        }
        return truncate(sb);
    }

    private static String truncate(StringBuilder sb) {
        int end = Math.min(sb.length(), MAX_LENGTH);
        if (end < sb.length() && Character.isHighSurrogate(sb.charAt(end - 1))) {
            end--;
        }
        while (end > 0 && sb.charAt(end - 1) == '-') {
            end--;
        }
        return sb.substring(0, end);
    }

    private static String excerpt(String text, int maxChars) {
        if (text.length() <= maxChars) {
            return text;
        }
        int end = maxChars;
        if (Character.isHighSurrogate(text.charAt(end - 1))) {
            end--;
        }
        return text.substring(0, end);
    }

    private static final class SourceText implements NodeVisitor<String> {
        @Override
        public String visitHeading(Heading heading) {
            return heading.text();
        }

        @Override
        public String visitParagraph(Paragraph paragraph) {
            return excerpt(paragraph.text(), PARAGRAPH_EXCERPT);
        }

        @Override
        public String visitCodeBlock(CodeBlock codeBlock) {
            return codeBlock.language();
        }

        @Override
        public String visitList(ListBlock list) {
            return "";
        }

        @Override
        public String visitListItem(ListItem item) {
            return "";
        }

        @Override
        public String visitBlockQuote(BlockQuote blockQuote) {
            return "";
        }

        @Override
        public String visitThematicBreak(ThematicBreak thematicBreak) {
            return "";
        }

        @Override
        public String visitHtmlBlock(HtmlBlock htmlBlock) {
            return Jsoup.parseBodyFragment(htmlBlock.html()).text();
        }

        @Override
        public String visitTable(Table table) {
            return table.rows().isEmpty() ? "" : String.join(" ", table.rows().get(0));
        }
    }
}
