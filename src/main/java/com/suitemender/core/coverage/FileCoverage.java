package com.suitemender.core.coverage;

import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * Line hits for one file. A line reported with hits == 0 is uncovered; a line
 * reported as hit anywhere in the report is covered.
 */
public final class FileCoverage {

    private final String             path;
    private final SortedSet<Integer> covered   = new TreeSet<>();
    private final SortedSet<Integer> uncovered = new TreeSet<>();

    public FileCoverage(String path) {
        this.path = path;
    }

    void record(int line, long hits) {
        if (hits > 0) {
            covered.add(line);
            uncovered.remove(line);
        } else if (!covered.contains(line)) {
            uncovered.add(line);
        }
    }

    public String             getPath()           { return path; }
    public SortedSet<Integer> getCoveredLines()   { return Collections.unmodifiableSortedSet(covered); }
    public SortedSet<Integer> getUncoveredLines() { return Collections.unmodifiableSortedSet(uncovered); }

    public int measuredLines() {
        return covered.size() + uncovered.size();
    }

    public double lineRate() {
        int total = measuredLines();
        return total == 0 ? 1.0 : (double) covered.size() / total;
    }

    @Override
    public String toString() {
        return "FileCoverage{" + path + ", covered=" + covered.size() + ", uncovered=" + uncovered.size() + "}";
    }
}
