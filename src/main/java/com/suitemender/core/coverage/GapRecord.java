package com.suitemender.core.coverage;

import com.suitemender.core.source.Symbol;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * A symbol together with the lines inside it that no test executed.
 * Never constructed with an empty line set.
 */
public final class GapRecord {

    private final Symbol             symbol;
    private final SortedSet<Integer> uncoveredLines;

    public GapRecord(Symbol symbol, SortedSet<Integer> uncoveredLines) {
        if (uncoveredLines.isEmpty()) {
            throw new IllegalArgumentException("GapRecord for " + symbol.getName() + " has no uncovered lines");
        }
        this.symbol         = symbol;
        this.uncoveredLines = Collections.unmodifiableSortedSet(new TreeSet<>(uncoveredLines));
    }

    public Symbol             getSymbol()         { return symbol; }
    public SortedSet<Integer> getUncoveredLines() { return uncoveredLines; }

    /** Compact rendering of the uncovered lines: {14, 15, 16, 20} → "14-16, 20". */
    public String describeLines() {
        List<String> parts = new ArrayList<>();
        Integer runStart = null;
        Integer previous = null;
        for (int line : uncoveredLines) {
            if (runStart == null) {
                runStart = line;
            } else if (line != previous + 1) {
                parts.add(run(runStart, previous));
                runStart = line;
            }
            previous = line;
        }
        parts.add(run(runStart, previous));
        return String.join(", ", parts);
    }

    private static String run(int start, int end) {
        return start == end ? String.valueOf(start) : start + "-" + end;
    }

    @Override
    public String toString() {
        return symbol.getKey() + " uncovered [" + describeLines() + "]";
    }
}
