package com.suitemender.core.source;

import java.util.Set;
import java.util.function.Predicate;

/**
 * Decides which root-relative paths are indexed as program source.
 *
 * Tests, virtual environments, caches, build output and hidden directories are
 * never program code; the server entry scripts are boilerplate not worth
 * targeting.
 */
public final class SourceExclusions implements Predicate<String> {

    private static final Set<String> EXCLUDED_SEGMENTS = Set.of(
            "tests", "test", "venv", "env", "node_modules", "__pycache__",
            "build", "dist", "htmlcov", "site-packages"
    );

    private static final Set<String> EXCLUDED_FILES = Set.of("wsgi.py", "asgi.py", "manage.py");

    private static final SourceExclusions DEFAULT = new SourceExclusions(Set.of());

    private final Set<String> extraSegments;

    private SourceExclusions(Set<String> extraSegments) {
        this.extraSegments = extraSegments;
    }

    public static SourceExclusions defaults() {
        return DEFAULT;
    }

    /** Defaults plus additional directory names to skip (for example a configured tests directory). */
    public static SourceExclusions withExtraSegments(Set<String> segments) {
        return new SourceExclusions(Set.copyOf(segments));
    }

    /** True when the path should be indexed. */
    @Override
    public boolean test(String relativePath) {
        return !isExcluded(relativePath);
    }

    public boolean isExcluded(String relativePath) {
        String[] segments = relativePath.replace('\\', '/').split("/");
        String fileName = segments[segments.length - 1];
        if (EXCLUDED_FILES.contains(fileName)) return true;
        if (isTestModule(fileName)) return true;

        for (int i = 0; i < segments.length - 1; i++) {
            String segment = segments[i];
            if (segment.startsWith(".")
                    || EXCLUDED_SEGMENTS.contains(segment)
                    || extraSegments.contains(segment)
                    || segment.startsWith("test_")
                    || segment.endsWith("_test")) {
                return true;
            }
        }
        return false;
    }

    private static boolean isTestModule(String fileName) {
        String stem = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;
        return stem.startsWith("test_") || stem.endsWith("_test") || stem.equals("conftest");
    }
}
