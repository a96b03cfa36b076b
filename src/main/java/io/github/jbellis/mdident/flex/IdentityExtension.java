package io.github.jbellis.mdident.flex;

import com.vladsch.flexmark.parser.Parser;
import com.vladsch.flexmark.util.data.DataKey;
import com.vladsch.flexmark.util.data.MutableDataHolder;
import io.github.jbellis.mdident.config.IdentitySettings;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Flexmark extension carrying the identity settings through the parser options.
 *
 * The settings end up on every parsed flexmark document (documents are data holders for the
 * options they were parsed with), which is where {@link FlexmarkConverter} reads them from.
 */
public class IdentityExtension implements Parser.ParserExtension {
    private static final Logger logger = LogManager.getLogger(IdentityExtension.class);

    /**
     * DataKey for storing/retrieving the identity settings from Flexmark's parser context.
     */
    public static final DataKey<IdentitySettings> SETTINGS = new DataKey<>("IDENTITY_SETTINGS", IdentitySettings.defaults());

    public IdentityExtension() {
        logger.debug("Initializing IdentityExtension");
    }

    /**
     * Extension factory method.
     */
    public static IdentityExtension create() {
        return new IdentityExtension();
    }

    /**
     * Settings passed explicitly win; otherwise they come from {@code mdident.properties}.
     */
    @Override
    public void parserOptions(MutableDataHolder options) {
        if (!options.contains(SETTINGS)) {
            options.set(SETTINGS, IdentitySettings.load());
        }
    }

    @Override
    public void extend(Parser.Builder parserBuilder) {
        // no custom block parsers; identity is attached after parsing
    }
}
