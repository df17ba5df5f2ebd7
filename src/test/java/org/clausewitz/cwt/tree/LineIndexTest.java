package org.clausewitz.cwt.tree;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LineIndexTest {
    private static final String TEXT = "farm = {\n    cost = 5\n}\n";

    @Test
    void mapsOffsetsToLinesAndColumns() {
        var index = LineIndex.of(TEXT);

        assertEquals(4, index.lineCount());
        assertEquals(SourceLocation.at(1, 1, 0), index.locationOf(0));
        assertEquals(SourceLocation.at(2, 5, 13), index.locationOf(13));
        assertEquals(SourceLocation.at(3, 1, 22), index.locationOf(22));
    }

    @Test
    void mapsLinesAndColumnsToOffsets() {
        var index = LineIndex.of(TEXT);

        assertEquals(13, index.offsetOf(2, 5));
        assertEquals(0, index.offsetOf(0, 7));
        assertEquals(TEXT.length(), index.offsetOf(99, 1));
        assertEquals(TEXT.length(), index.offsetOf(4, 50));
    }

    @Test
    void clampsOutOfRangeOffsets() {
        var index = LineIndex.of("ab");

        assertEquals(SourceLocation.at(1, 3, 2), index.locationOf(10));
        assertEquals(SourceLocation.at(1, 1, 0), index.locationOf(-4));
    }

    @Test
    void foldedNamesAreInterned() {
        assertSame(Names.folded("Farm"), Names.folded("FARM"));
        assertEquals("farm", Names.folded("fArM"));
    }
}
