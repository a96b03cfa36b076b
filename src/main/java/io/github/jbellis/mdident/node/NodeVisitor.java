package io.github.jbellis.mdident.node;

/**
 * One method per {@link NodeKind}. Adding a kind adds a method here, so every visitor in the
 * code base stops compiling until it handles the new kind.
 */
public interface NodeVisitor<R> {
    R visitHeading(Heading heading);

    R visitParagraph(Paragraph paragraph);

    R visitCodeBlock(CodeBlock codeBlock);

    R visitList(ListBlock list);

    R visitListItem(ListItem item);

    R visitBlockQuote(BlockQuote blockQuote);

    R visitThematicBreak(ThematicBreak thematicBreak);

    R visitHtmlBlock(HtmlBlock htmlBlock);

    R visitTable(Table table);
}
