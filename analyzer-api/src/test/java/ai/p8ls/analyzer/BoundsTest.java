package ai.p8ls.analyzer;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class BoundsTest {

    private static Bounds bounds(int line, int startCol, int startIdx, int endLine, int endCol, int endIdx) {
        return new Bounds(
                new SourcePosition(line, startCol, startIdx, null), new SourcePosition(endLine, endCol, endIdx, null));
    }

    @Test
    void testContainsIsInclusiveOfEndColumn() {
        var b = bounds(1, 9, 9, 1, 15, 15);
        assertTrue(b.contains(1, 9));
        assertTrue(b.contains(1, 15));
        assertFalse(b.contains(1, 8));
        assertFalse(b.contains(1, 16));
        assertFalse(b.contains(2, 10));
    }

    @Test
    void testContainsAcrossLines() {
        var b = bounds(1, 4, 4, 3, 3, 30);
        assertTrue(b.contains(2, 0));
        assertTrue(b.contains(2, 200));
        assertFalse(b.contains(3, 4));
    }

    @Test
    void testCompare() {
        var node = bounds(2, 0, 10, 2, 5, 15);
        assertEquals(Bounds.Placement.BEFORE, Bounds.compare(bounds(1, 0, 0, 1, 4, 4), node));
        assertEquals(Bounds.Placement.CONTAINS, Bounds.compare(bounds(2, 2, 12, 2, 3, 13), node));
        assertEquals(Bounds.Placement.AFTER, Bounds.compare(bounds(2, 6, 16, 2, 9, 19), node));
    }
}
