package io.github.jbellis.mdident.node;

import java.util.Arrays;
import java.util.Optional;

/**
 * Structural kinds of markdown blocks.
 *
 * The {@link #tag()} is the discriminant written at the head of every canonical form and doubles
 * as the fallback hint for nodes without text. The {@link #jsonType()} is the {@code type} value
 * used by the JSON document format.
 */
public enum NodeKind {
    HEADING("heading", "heading"),
    PARAGRAPH("paragraph", "paragraph"),
    CODE_BLOCK("codeblock", "code_block"),
    LIST("list", "list"),
    LIST_ITEM("listitem", "list_item"),
    BLOCK_QUOTE("blockquote", "block_quote"),
    THEMATIC_BREAK("thematicbreak", "thematic_break"),
    HTML_BLOCK("htmlblock", "html_block"),
    TABLE("table", "table");

    private final String tag;
    private final String jsonType;

    NodeKind(String tag, String jsonType) {
        this.tag = tag;
        this.jsonType = jsonType;
    }

    public String tag() {
        return tag;
    }

    public String jsonType() {
        return jsonType;
    }

    public static Optional<NodeKind> fromJsonType(String jsonType) {
        return Arrays.stream(values())
                .filter(k -> k.jsonType.equals(jsonType))
                .findFirst();
    }
}
