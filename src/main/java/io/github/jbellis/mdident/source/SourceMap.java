package io.github.jbellis.mdident.source;

import io.github.jbellis.mdident.identity.NodeId;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The ordered view-source mappings of one document, in document order.
 *
 * Built once with a {@link Builder} at parse (or decode) time and immutable afterwards. Lookups
 * are by full {@link NodeId}; a missing mapping is an ordinary outcome reported as
 * {@link Optional#empty()}. When identical content appears twice, both nodes share an id and the
 * first mapping in document order answers {@link #findSourcePosition}; {@link #findAll} returns
 * every one.
 *
 * This class never walks up to an enclosing block: for a node without a mapping, callers go to
 * its nearest mapped ancestor themselves (see
 * {@code Document#findSourcePositionOrAncestor}).
 */
public final class SourceMap {
    private static final SourceMap EMPTY = new SourceMap(List.of());

    private static final Comparator<ViewSourceMapping> DOCUMENT_ORDER = Comparator
            .comparingInt((ViewSourceMapping m) -> m.span().startLine())
            .thenComparingInt(m -> m.span().startColumn())
            .thenComparing(Comparator.comparingInt((ViewSourceMapping m) -> m.span().endLine()).reversed())
            .thenComparing(Comparator.comparingInt((ViewSourceMapping m) -> m.span().endColumn()).reversed());

    private final List<ViewSourceMapping> mappings;
    private final Map<NodeId, ViewSourceMapping> firstById;

    private SourceMap(List<ViewSourceMapping> mappings) {
        this.mappings = List.copyOf(mappings);
        var index = new LinkedHashMap<NodeId, ViewSourceMapping>();
        for (ViewSourceMapping mapping : this.mappings) {
            index.putIfAbsent(mapping.nodeId(), mapping);
        }
        this.firstById = index;
    }

    public static SourceMap empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<ViewSourceMapping> mappings() {
        return mappings;
    }

    public int size() {
        return mappings.size();
    }

    public boolean isEmpty() {
        return mappings.isEmpty();
    }

    public Optional<SourceSpan> findSourcePosition(NodeId nodeId) {
        return Optional.ofNullable(firstById.get(nodeId)).map(ViewSourceMapping::span);
    }

    public List<SourceSpan> findAll(NodeId nodeId) {
        return mappings.stream()
                .filter(m -> m.nodeId().equals(nodeId))
                .map(ViewSourceMapping::span)
                .toList();
    }

    /**
     * Returns a copy whose mappings for the keys of {@code replacements} point at the mapped ids
     * instead. Used when decoding finds that a persisted id no longer matches its content.
     */
    public SourceMap rekey(Map<NodeId, NodeId> replacements) {
        if (replacements.isEmpty()) {
            return this;
        }
        return new SourceMap(mappings.stream()
                .map(m -> replacements.containsKey(m.nodeId()) ? m.withNodeId(replacements.get(m.nodeId())) : m)
                .toList());
    }

    public static final class Builder {
        private final List<ViewSourceMapping> mappings = new ArrayList<>();

        private Builder() {
        }

        public Builder record(NodeId nodeId, SourceSpan span) {
            mappings.add(new ViewSourceMapping(nodeId, span));
            return this;
        }

        /**
         * Inserts a mapping at {@code position} among those recorded so far. A converter that
         * identifies children before their container takes {@link #size()} before converting the
         * children and records the container there afterwards.
         */
        public Builder recordAt(int position, NodeId nodeId, SourceSpan span) {
            mappings.add(position, new ViewSourceMapping(nodeId, span));
            return this;
        }

        public int size() {
            return mappings.size();
        }

        /**
         * Builds the map with mappings sorted into document order. The sort is stable: mappings
         * with equal spans keep the order they were recorded in, so an enclosing block must be
         * recorded before the blocks it contains.
         */
        public SourceMap build() {
            if (mappings.isEmpty()) {
                return EMPTY;
            }
            var sorted = new ArrayList<>(mappings);
            sorted.sort(DOCUMENT_ORDER);
            return new SourceMap(sorted);
        }
    }
}
