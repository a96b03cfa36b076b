package io.github.jbellis.mdident.identity;

import io.github.jbellis.mdident.node.BlockQuote;
import io.github.jbellis.mdident.node.CodeBlock;
import io.github.jbellis.mdident.node.Heading;
import io.github.jbellis.mdident.node.HtmlBlock;
import io.github.jbellis.mdident.node.ListBlock;
import io.github.jbellis.mdident.node.ListItem;
import io.github.jbellis.mdident.node.Node;
import io.github.jbellis.mdident.node.Paragraph;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Content-replacing edits. Every method here builds a draft and sends it back through the identity
 * pipeline, so the result always has a freshly computed id, even when the new content is
 * byte-identical to the old. Structure-preserving changes (heading level, list ordering,
 * metadata) live on the node records and keep the id.
 */
public class NodeEditor {
    private static final Logger logger = LogManager.getLogger(NodeEditor.class);

    private final IdentityCache cache;

    public NodeEditor(IdentityCache cache) {
        this.cache = cache;
    }

    public Heading replaceText(Heading heading, String text) {
        return (Heading) regenerate(heading, new Heading(heading.level(), text, heading.metadata(), null));
    }

    public Paragraph replaceText(Paragraph paragraph, String text) {
        return (Paragraph) regenerate(paragraph, new Paragraph(text, paragraph.metadata(), null));
    }

    /**
     * Replaces the text of a heading or paragraph.
     *
     * @throws IllegalArgumentException for node kinds without replaceable text
     */
    public Node replaceText(Node node, String text) {
        if (node instanceof Heading heading) {
            return replaceText(heading, text);
        }
        if (node instanceof Paragraph paragraph) {
            return replaceText(paragraph, text);
        }
        throw new IllegalArgumentException("Cannot replace text of a " + node.kind().tag() + " node");
    }

    public CodeBlock replaceCode(CodeBlock codeBlock, String code) {
        return (CodeBlock) regenerate(codeBlock, new CodeBlock(codeBlock.language(), code, codeBlock.metadata(), null));
    }

    public CodeBlock replaceLanguage(CodeBlock codeBlock, String language) {
        return (CodeBlock) regenerate(codeBlock, new CodeBlock(language, codeBlock.code(), codeBlock.metadata(), null));
    }

    public HtmlBlock replaceHtml(HtmlBlock htmlBlock, String html) {
        return (HtmlBlock) regenerate(htmlBlock, new HtmlBlock(html, htmlBlock.metadata(), null));
    }

    public ListBlock replaceItems(ListBlock list, List<ListItem> items) {
        return (ListBlock) regenerate(list, new ListBlock(list.ordered(), list.start(), items, list.metadata(), null));
    }

    public ListItem replaceChildren(ListItem item, List<? extends Node> children) {
        return (ListItem) regenerate(item, new ListItem(List.copyOf(children), item.metadata(), null));
    }

    public BlockQuote replaceChildren(BlockQuote blockQuote, List<? extends Node> children) {
        return (BlockQuote) regenerate(blockQuote, new BlockQuote(List.copyOf(children), blockQuote.metadata(), null));
    }

    private Node regenerate(Node original, Node draft) {
        Node identified = cache.identify(draft);
        logger.debug("Content edit on {} node: {} -> {}", original.kind().tag(), original.id(), identified.id());
        return identified;
    }
}
