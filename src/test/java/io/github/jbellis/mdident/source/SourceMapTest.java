package io.github.jbellis.mdident.source;

import io.github.jbellis.mdident.identity.NodeId;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SourceMapTest {
    private static final NodeId HEADING = NodeId.parse("aaaaaaaaaaaaaaaa");
    private static final NodeId LIST = NodeId.parse("bbbbbbbbbbbbbbbb");
    private static final NodeId ITEM = NodeId.parse("cccccccccccccccc");
    private static final NodeId UNMAPPED = NodeId.parse("dddddddddddddddd");

    @Test
    void findsRecordedSpans() {
        var map = SourceMap.builder()
                .record(HEADING, new SourceSpan(0, 7, 1, 0, 1, 7))
                .build();

        assertEquals(new SourceSpan(0, 7, 1, 0, 1, 7), map.findSourcePosition(HEADING).orElseThrow());
    }

    @Test
    void missingMappingIsEmptyNotAnError() {
        assertTrue(SourceMap.empty().findSourcePosition(UNMAPPED).isEmpty());
        assertTrue(SourceMap.builder().record(HEADING, SourceSpan.ofLines(1, 0, 1, 1)).build()
                           .findSourcePosition(UNMAPPED).isEmpty());
    }

    @Test
    void mappingsAreInDocumentOrderWithContainersFirst() {
        var map = SourceMap.builder()
                .record(ITEM, SourceSpan.ofLines(3, 0, 3, 5))
                .record(LIST, SourceSpan.ofLines(3, 0, 4, 5))
                .record(HEADING, SourceSpan.ofLines(1, 0, 1, 7))
                .build();

        assertEquals(List.of(HEADING, LIST, ITEM), map.mappings().stream().map(ViewSourceMapping::nodeId).toList());
    }

    @Test
    void equalSpansKeepTheContainerFirst() {
        var span = SourceSpan.ofLines(1, 0, 1, 3);
        var builder = SourceMap.builder();
        int slot = builder.size();
        builder.record(ITEM, span);
        builder.recordAt(slot, LIST, span);

        var map = builder.build();

        assertEquals(List.of(LIST, ITEM), map.mappings().stream().map(ViewSourceMapping::nodeId).toList());
    }

    @Test
    void duplicateIdsResolveToTheFirstOccurrence() {
        var first = SourceSpan.ofLines(1, 0, 1, 4);
        var second = SourceSpan.ofLines(5, 0, 5, 4);
        var map = SourceMap.builder()
                .record(HEADING, second)
                .record(HEADING, first)
                .build();

        assertEquals(first, map.findSourcePosition(HEADING).orElseThrow());
        assertEquals(List.of(first, second), map.findAll(HEADING));
    }

    @Test
    void rekeyMovesMappingsToNewIds() {
        var span = SourceSpan.ofLines(1, 0, 1, 7);
        var map = SourceMap.builder().record(HEADING, span).build();

        var rekeyed = map.rekey(Map.of(HEADING, UNMAPPED));

        assertTrue(rekeyed.findSourcePosition(HEADING).isEmpty());
        assertEquals(span, rekeyed.findSourcePosition(UNMAPPED).orElseThrow());
        assertSame(map, map.rekey(Map.of()));
    }

    @Test
    void mappingsAreImmutable() {
        var map = SourceMap.builder().record(HEADING, SourceSpan.ofLines(1, 0, 1, 1)).build();

        assertThrows(UnsupportedOperationException.class, () -> map.mappings().clear());
    }
}
