package io.github.jbellis.mdident.resolve;

import io.github.jbellis.mdident.document.Document;
import io.github.jbellis.mdident.node.Heading;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Resolves identifier strings against a document.
 *
 * Stable ids are looked up anywhere in the tree. Legacy positional identifiers, accepted only in
 * {@link ResolverMode#COMPATIBILITY}, address top-level nodes: {@code "2"} is the third top-level
 * node and {@code "h2-0"} the first top-level level-2 heading.
 */
public final class CompatibilityResolver {
    private static final Logger logger = LogManager.getLogger(CompatibilityResolver.class);

    private CompatibilityResolver() {
    }

    public static Lookup findNode(Document document, String identifier, ResolverMode mode) {
        ParsedIdentifier parsed = IdentifierParser.parse(identifier, mode);
        Lookup result;
        if (parsed instanceof ParsedIdentifier.Stable stable) {
            result = document.indexPathOf(stable.id())
                    .<Lookup>map(path -> found(document, path))
                    .orElseGet(() -> new Lookup.NotFound(identifier));
        } else if (parsed instanceof ParsedIdentifier.Positional positional) {
            result = positional.index() < document.size()
                    ? found(document, List.of((int) positional.index()))
                    : new Lookup.NotFound(identifier);
        } else if (parsed instanceof ParsedIdentifier.LegacyHeading heading) {
            result = findHeading(document, heading.level(), heading.ordinal(), identifier);
        } else {
            var rejected = (ParsedIdentifier.Rejected) parsed;
            result = new Lookup.Malformed(identifier, rejected.reason());
        }
        logger.debug("Resolved '{}' in {} mode: {}", identifier, mode, result.getClass().getSimpleName());
        return result;
    }

    private static Lookup findHeading(Document document, int level, long ordinal, String identifier) {
        long seen = 0;
        for (int i = 0; i < document.size(); i++) {
            if (document.get(i) instanceof Heading heading && heading.level() == level) {
                if (seen == ordinal) {
                    return found(document, List.of(i));
                }
                seen++;
            }
        }
        return new Lookup.NotFound(identifier);
    }

    private static Lookup.Found found(Document document, List<Integer> path) {
        var along = document.nodesAlong(path);
        return new Lookup.Found(along.get(along.size() - 1), along.subList(0, along.size() - 1), path);
    }
}
