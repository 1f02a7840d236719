package com.suitemender.core.source;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

class LineRangeTest {

    @Test
    void testInclusiveFactoryIsHalfOpenInternally() {
        LineRange range = LineRange.inclusive(10, 20);

        assertEquals(10, range.getStart());
        assertEquals(21, range.getEndExclusive());
        assertEquals(20, range.getLastLine());
        assertEquals(11, range.length());
    }

    @Test
    void testContainsLine() {
        LineRange range = LineRange.of(3, 6);

        assertFalse(range.contains(2));
        assertTrue(range.contains(3));
        assertTrue(range.contains(5));
        assertFalse(range.contains(6), "end is exclusive");
    }

    @Test
    void testContainsRangeAndOverlaps() {
        LineRange outer = LineRange.inclusive(1, 30);
        LineRange inner = LineRange.inclusive(5, 9);
        LineRange after = LineRange.inclusive(31, 40);

        assertTrue(outer.contains(inner));
        assertFalse(inner.contains(outer));
        assertTrue(outer.overlaps(inner));
        assertFalse(outer.overlaps(after), "adjacent ranges do not overlap");
    }

    @Test
    void testIntersectReturnsSortedLinesInside() {
        LineRange range = LineRange.inclusive(10, 20);

        SortedSet<Integer> hit = range.intersect(List.of(25, 14, 3, 16, 15, 20));

        assertEquals(List.of(14, 15, 16, 20), List.copyOf(hit));
    }

    @Test
    void testIndexesAreZeroBased() {
        LineRange range = LineRange.inclusive(4, 7);

        assertEquals(3, range.startIndex());
        assertEquals(7, range.endIndex());
    }

    @Test
    void testRejectsInvalidBounds() {
        assertThrows(IllegalArgumentException.class, () -> LineRange.of(0, 3));
        assertThrows(IllegalArgumentException.class, () -> LineRange.of(5, 4));
    }
}
