package io.github.jbellis.mdident.flex;

import com.vladsch.flexmark.ext.tables.TablesExtension;
import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.MutableDataSet;
import io.github.jbellis.mdident.config.IdentitySettings;
import io.github.jbellis.mdident.document.Document;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Parses markdown into an identified {@link Document} with view-source mappings.
 *
 * Instances are reusable and, like flexmark's {@link Parser}, safe to share between threads; each
 * call produces a document with its own identity cache.
 */
public class MarkdownIdentityParser {
    private static final Logger logger = LogManager.getLogger(MarkdownIdentityParser.class);

    private final Parser parser;

    /**
     * Uses the settings from {@code mdident.properties}, or the defaults.
     */
    public MarkdownIdentityParser() {
        this(new MutableDataSet());
    }

    public MarkdownIdentityParser(IdentitySettings settings) {
        this(new MutableDataSet().set(IdentityExtension.SETTINGS, settings));
    }

    private MarkdownIdentityParser(MutableDataSet options) {
        options.set(Parser.EXTENSIONS, Arrays.asList(
                TablesExtension.create(),
                IdentityExtension.create()
        ));
        this.parser = Parser.builder(options).build();
    }

    public Document parse(String markdown) {
        var flexDocument = parser.parse(markdown);
        var settings = IdentityExtension.SETTINGS.get(flexDocument);
        var document = new FlexmarkConverter(markdown, settings).convert(flexDocument);
        logger.debug("Parsed {} characters into {}", markdown.length(), document);
        return document;
    }
}
