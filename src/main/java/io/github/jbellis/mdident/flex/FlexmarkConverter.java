package io.github.jbellis.mdident.flex;

import com.vladsch.flexmark.ast.BulletList;
import com.vladsch.flexmark.ast.FencedCodeBlock;
import com.vladsch.flexmark.ast.HtmlCommentBlock;
import com.vladsch.flexmark.ast.IndentedCodeBlock;
import com.vladsch.flexmark.ast.OrderedList;
import com.vladsch.flexmark.ast.Reference;
import com.vladsch.flexmark.ext.tables.TableBlock;
import com.vladsch.flexmark.ext.tables.TableBody;
import com.vladsch.flexmark.ext.tables.TableCell;
import com.vladsch.flexmark.ext.tables.TableHead;
import com.vladsch.flexmark.ext.tables.TableRow;
import com.vladsch.flexmark.util.ast.BlankLine;
import com.vladsch.flexmark.util.sequence.BasedSequence;
import io.github.jbellis.mdident.config.IdentitySettings;
import io.github.jbellis.mdident.document.Document;
import io.github.jbellis.mdident.identity.IdentityCache;
import io.github.jbellis.mdident.identity.StructureTooDeepException;
import io.github.jbellis.mdident.node.BlockQuote;
import io.github.jbellis.mdident.node.CodeBlock;
import io.github.jbellis.mdident.node.Heading;
import io.github.jbellis.mdident.node.HtmlBlock;
import io.github.jbellis.mdident.node.ListBlock;
import io.github.jbellis.mdident.node.ListItem;
import io.github.jbellis.mdident.node.Node;
import io.github.jbellis.mdident.node.Paragraph;
import io.github.jbellis.mdident.node.Table;
import io.github.jbellis.mdident.node.ThematicBreak;
import io.github.jbellis.mdident.source.LineIndex;
import io.github.jbellis.mdident.source.SourceMap;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Turns one flexmark AST into an identified {@link Document}.
 *
 * Conversion is bottom-up: children are converted and identified before their container, so each
 * block's id is known when its span is recorded. Inline content stays as markdown source text on
 * its block; only blocks get mappings. Flexmark blocks without a counterpart here are dropped.
 *
 * Flexmark's AST classes share simple names with the node records, so they are referenced fully
 * qualified where the two meet.
 */
class FlexmarkConverter {
    private static final Logger logger = LogManager.getLogger(FlexmarkConverter.class);

    private final IdentitySettings settings;
    private final LineIndex lines;
    private final IdentityCache cache;
    private final SourceMap.Builder sourceMap = SourceMap.builder();
    private final Deque<String> path = new ArrayDeque<>();

    FlexmarkConverter(String source, IdentitySettings settings) {
        this.settings = settings;
        this.lines = new LineIndex(source);
        this.cache = Document.newCache(settings);
    }

    Document convert(com.vladsch.flexmark.util.ast.Document flexDocument) {
        var nodes = convertChildren(flexDocument);
        return Document.fromIdentified(nodes, sourceMap.build(), Document.FORMAT_VERSION, settings, cache);
    }

    private List<Node> convertChildren(com.vladsch.flexmark.util.ast.Node parent) {
        var result = new ArrayList<Node>();
        for (var child : parent.getChildren()) {
            var converted = convertBlock(child);
            if (converted != null) {
                result.add(converted);
            }
        }
        return result;
    }

    /**
     * @return the identified node, or null when the block is not represented
     */
    private Node convertBlock(com.vladsch.flexmark.util.ast.Node block) {
        String kind = block.getClass().getSimpleName();
        path.addLast(kind);
        try {
            if (path.size() > settings.maxDepth()) {
                throw new StructureTooDeepException(path.size(), settings.maxDepth(), new ArrayList<>(path));
            }
            // children are converted inside toDraft; the container's mapping goes ahead of theirs
            int slot = sourceMap.size();
            Node draft = toDraft(block);
            if (draft == null) {
                return null;
            }
            Node identified = cache.identify(draft);
            var span = lines.spanOf(block.getStartOffset(), block.getEndOffset());
            sourceMap.recordAt(slot, identified.requireId(), span);
            logger.debug("Converted {} at {}:{} to {}", kind, span.startLine(), span.startColumn(),
                         identified.requireId().toDisplayString());
            return identified;
        } finally {
            path.removeLast();
        }
    }

    private Node toDraft(com.vladsch.flexmark.util.ast.Node block) {
        if (block instanceof com.vladsch.flexmark.ast.Heading heading) {
            return Heading.draft(heading.getLevel(), heading.getText().toString().strip());
        }
        if (block instanceof com.vladsch.flexmark.ast.Paragraph paragraph) {
            return Paragraph.draft(paragraph.getContentChars().toString().strip());
        }
        if (block instanceof FencedCodeBlock fenced) {
            String info = fenced.getInfo().toString().strip();
            String language = info.isEmpty() ? null : info.split("\\s+", 2)[0];
            return CodeBlock.draft(language, codeText(fenced.getContentLines()));
        }
        if (block instanceof IndentedCodeBlock indented) {
            return CodeBlock.draft(null, codeText(indented.getContentLines()));
        }
        if (block instanceof BulletList list) {
            return ListBlock.draft(false, convertItems(list));
        }
        if (block instanceof OrderedList list) {
            return new ListBlock(true, list.getStartNumber(), convertItems(list), Map.of(), null);
        }
        if (block instanceof com.vladsch.flexmark.ast.ListItem) {
            return ListItem.draft(convertChildren(block));
        }
        if (block instanceof com.vladsch.flexmark.ast.BlockQuote) {
            return BlockQuote.draft(convertChildren(block));
        }
        if (block instanceof com.vladsch.flexmark.ast.ThematicBreak) {
            return ThematicBreak.draft();
        }
        if (block instanceof com.vladsch.flexmark.ast.HtmlBlock html) {
            return HtmlBlock.draft(html.getChars().toString().stripTrailing());
        }
        if (block instanceof TableBlock table) {
            return Table.draft(tableRows(table));
        }
        if (block instanceof Reference || block instanceof HtmlCommentBlock || block instanceof BlankLine) {
            logger.debug("Skipping {} at offset {}", block.getClass().getSimpleName(), block.getStartOffset());
        } else {
            logger.warn("Skipping unsupported block {} at offset {}", block.getClass().getSimpleName(), block.getStartOffset());
        }
        return null;
    }

    private List<ListItem> convertItems(com.vladsch.flexmark.ast.ListBlock list) {
        var items = new ArrayList<ListItem>();
        for (Node converted : convertChildren(list)) {
            if (converted instanceof ListItem item) {
                items.add(item);
            }
        }
        return items;
    }

    private static String codeText(List<BasedSequence> contentLines) {
        return contentLines.stream()
                .map(line -> line.trimEOL().toString())
                .collect(Collectors.joining("\n"));
    }

    private static List<List<String>> tableRows(TableBlock table) {
        var rows = new ArrayList<List<String>>();
        for (var section : table.getChildren()) {
            // the separator row carries alignment only
            if (!(section instanceof TableHead) && !(section instanceof TableBody)) {
                continue;
            }
            for (var row : section.getChildren()) {
                if (!(row instanceof TableRow)) {
                    continue;
                }
                var cells = new ArrayList<String>();
                for (var cell : row.getChildren()) {
                    if (cell instanceof TableCell tableCell) {
                        cells.add(tableCell.getText().toString().strip());
                    }
                }
                rows.add(cells);
            }
        }
        return rows;
    }
}
