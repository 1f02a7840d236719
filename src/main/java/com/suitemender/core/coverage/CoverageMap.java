package com.suitemender.core.coverage;

import java.util.*;

/**
 * Per-file coverage plus the report's overall line rate.
 *
 * coverage.py may name files relative to a source root ("main.py" for
 * "app/main.py"), so lookups fall back to matching on whole path segments from
 * the end, longest match winning.
 */
public final class CoverageMap {

    private final Map<String, FileCoverage> files;
    private final double                    overallLineRate;

    public CoverageMap(Map<String, FileCoverage> files, double overallLineRate) {
        this.files           = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        this.overallLineRate = overallLineRate;
    }

    public static CoverageMap empty() {
        return new CoverageMap(Map.of(), 0.0);
    }

    public Map<String, FileCoverage> getFiles()           { return files; }
    public double                    getOverallLineRate() { return overallLineRate; }

    public Optional<FileCoverage> forPath(String indexPath) {
        String wanted = normalize(indexPath);
        FileCoverage exact = files.get(wanted);
        if (exact != null) return Optional.of(exact);

        FileCoverage best = null;
        int bestLength = -1;
        for (Map.Entry<String, FileCoverage> entry : files.entrySet()) {
            String reported = entry.getKey();
            if (segmentSuffix(wanted, reported) || segmentSuffix(reported, wanted)) {
                int length = Math.min(reported.length(), wanted.length());
                if (length > bestLength) {
                    best = entry.getValue();
                    bestLength = length;
                }
            }
        }
        return Optional.ofNullable(best);
    }

    static String normalize(String path) {
        String p = path.replace('\\', '/');
        while (p.startsWith("./")) p = p.substring(2);
        return p;
    }

    /** True when {@code suffix} equals the trailing path segments of {@code path}. */
    private static boolean segmentSuffix(String path, String suffix) {
        return path.endsWith("/" + suffix);
    }

    @Override
    public String toString() {
        return String.format("CoverageMap{files=%d, lineRate=%.1f%%}", files.size(), overallLineRate * 100);
    }
}
