package io.github.jbellis.mdident.identity;

import com.google.common.io.ByteArrayDataOutput;
import com.google.common.io.ByteStreams;
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

import java.nio.charset.StandardCharsets;
import java.text.Normalizer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Converts a node's semantically relevant content into the byte sequence that gets hashed.
 *
 * <p>Layout of a canonical form:
 * <pre>
 *   text(kind tag)
 *   fields, in the fixed order below
 *
 *   heading        text(text)
 *   paragraph      text(text)
 *   codeblock      text(language) code(code)
 *   list           children(items)
 *   listitem       children(children)
 *   blockquote     children(children)
 *   thematicbreak  (nothing)
 *   htmlblock      text(html)
 *   table          int(rows) { int(cells) { text(cell) } }
 * </pre>
 * A text field is a marker byte, {@code 0} for the empty sentinel or {@code 1} followed by a
 * four-byte length and the UTF-8 bytes. Children are a four-byte count followed by each child's
 * canonical form, itself length-prefixed, so concatenation is never ambiguous.
 *
 * <p>Heading level, list ordering, list start number, metadata and ids are not part of the form.
 *
 * <p>Text is NFC-normalized, tabs become four spaces, whitespace runs collapse to one space and the
 * ends are stripped. Code keeps its interior whitespace; only line endings are unified and
 * trailing whitespace dropped.
 */
public class Canonicalizer {
    public static final int DEFAULT_MAX_DEPTH = 64;

    static final byte EMPTY = 0;
    static final byte PRESENT = 1;

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern TRAILING_WHITESPACE = Pattern.compile("\\s+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final String TAB_AS_SPACES = "    ";

    private final int maxDepth;

    public Canonicalizer() {
        this(DEFAULT_MAX_DEPTH);
    }

    public Canonicalizer(int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be positive, got " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    /**
     * @throws StructureTooDeepException if the node nests more than {@link #maxDepth()} levels
     */
    public byte[] canonicalize(Node node) {
        return canonicalize(node, new ArrayDeque<>());
    }

    private byte[] canonicalize(Node node, Deque<String> path) {
        path.addLast(node.kind().tag());
        try {
            if (path.size() > maxDepth) {
                throw new StructureTooDeepException(path.size(), maxDepth, new ArrayList<>(path));
            }
            ByteArrayDataOutput out = ByteStreams.newDataOutput();
            writeText(out, node.kind().tag());
            node.accept(new FieldWriter(out, path));
            return out.toByteArray();
        } finally {
            path.removeLast();
        }
    }

    public static String normalizeText(String text) {
        if (text == null) {
            return "";
        }
        String nfc = Normalizer.normalize(text, Normalizer.Form.NFC).replace("\t", TAB_AS_SPACES);
        return WHITESPACE.matcher(nfc).replaceAll(" ").strip();
    }

    public static String normalizeCode(String code) {
        String nfc = Normalizer.normalize(code, Normalizer.Form.NFC)
                .replace("\r\n", "\n")
                .replace('\r', '\n');
        return TRAILING_WHITESPACE.matcher(nfc).replaceAll("");
    }

    private static void writeText(ByteArrayDataOutput out, String value) {
        if (value.isEmpty()) {
            out.writeByte(EMPTY);
            return;
        }
        byte[] bytes = value.getBytes(StandardCharsets.UTF_8);
        out.writeByte(PRESENT);
        out.writeInt(bytes.length);
        out.write(bytes);
    }

    private final class FieldWriter implements NodeVisitor<Void> {
        private final ByteArrayDataOutput out;
        private final Deque<String> path;

        FieldWriter(ByteArrayDataOutput out, Deque<String> path) {
            this.out = out;
            this.path = path;
        }

        private void writeChildren(List<? extends Node> children) {
            out.writeInt(children.size());
            for (Node child : children) {
                byte[] bytes = canonicalize(child, path);
                out.writeInt(bytes.length);
                out.write(bytes);
            }
        }

        @Override
        public Void visitHeading(Heading heading) {
            writeText(out, normalizeText(heading.text()));
            return null;
        }

        @Override
        public Void visitParagraph(Paragraph paragraph) {
            writeText(out, normalizeText(paragraph.text()));
            return null;
        }

        @Override
        public Void visitCodeBlock(CodeBlock codeBlock) {
            writeText(out, normalizeText(codeBlock.language()));
            writeText(out, normalizeCode(codeBlock.code()));
            return null;
        }

        @Override
        public Void visitList(ListBlock list) {
            writeChildren(list.items());
            return null;
        }

        @Override
        public Void visitListItem(ListItem item) {
            writeChildren(item.children());
            return null;
        }

        @Override
        public Void visitBlockQuote(BlockQuote blockQuote) {
            writeChildren(blockQuote.children());
            return null;
        }

        @Override
        public Void visitThematicBreak(ThematicBreak thematicBreak) {
            return null;
        }

        @Override
        public Void visitHtmlBlock(HtmlBlock htmlBlock) {
            writeText(out, normalizeText(htmlBlock.html()));
            return null;
        }

        @Override
        public Void visitTable(Table table) {
            out.writeInt(table.rows().size());
            for (List<String> row : table.rows()) {
                out.writeInt(row.size());
                for (String cell : row) {
                    writeText(out, normalizeText(cell));
                }
            }
            return null;
        }
    }
}
