package com.suitemender.core.source;

import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * LineRange: half-open interval of 1-based source lines: [start, endExclusive).
 *
 * Shared by the indexer (symbol extents), the gap mapper (range ∩ uncovered lines)
 * and the patch engine (splice boundaries). All three reason about the same
 * interval type so inclusive/exclusive conversions happen in exactly one place.
 */
public final class LineRange {

    private final int start;
    private final int endExclusive;

    private LineRange(int start, int endExclusive) {
        if (start < 1) {
            throw new IllegalArgumentException("Line numbers are 1-based, got start=" + start);
        }
        if (endExclusive < start) {
            throw new IllegalArgumentException(
                    "Range end " + endExclusive + " precedes start " + start);
        }
        this.start        = start;
        this.endExclusive = endExclusive;
    }

    /** Half-open factory: [start, endExclusive). */
    public static LineRange of(int start, int endExclusive) {
        return new LineRange(start, endExclusive);
    }

    /** Inclusive factory: [firstLine, lastLine]. */
    public static LineRange inclusive(int firstLine, int lastLine) {
        return new LineRange(firstLine, lastLine + 1);
    }

    public int getStart()        { return start; }
    public int getEndExclusive() { return endExclusive; }
    public int getLastLine()     { return endExclusive - 1; }
    public int length()          { return endExclusive - start; }
    public boolean isEmpty()     { return endExclusive == start; }

    public boolean contains(int line) {
        return line >= start && line < endExclusive;
    }

    /** True when {@code other} lies entirely inside this range. */
    public boolean contains(LineRange other) {
        return other.start >= start && other.endExclusive <= endExclusive;
    }

    public boolean overlaps(LineRange other) {
        return start < other.endExclusive && other.start < endExclusive;
    }

    /** Lines of {@code lines} that fall inside this range, sorted ascending. */
    public SortedSet<Integer> intersect(Collection<Integer> lines) {
        SortedSet<Integer> result = new TreeSet<>();
        for (Integer line : lines) {
            if (line != null && contains(line)) {
                result.add(line);
            }
        }
        return result;
    }

    /** Zero-based index of the first line, for slicing a {@code List<String>} of lines. */
    public int startIndex() { return start - 1; }

    /** Zero-based exclusive end index, for slicing a {@code List<String>} of lines. */
    public int endIndex()   { return endExclusive - 1; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LineRange)) return false;
        LineRange that = (LineRange) o;
        return start == that.start && endExclusive == that.endExclusive;
    }

    @Override
    public int hashCode() {
        return 31 * start + endExclusive;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + endExclusive + ")";
    }
}
