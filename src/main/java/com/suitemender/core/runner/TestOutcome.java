package com.suitemender.core.runner;

import java.util.Locale;

/**
 * Outcome of one test node as pytest-json-report records it.
 */
public enum TestOutcome {

    PASSED,
    FAILED,

    /** Failed outside the test body (fixture setup or teardown). */
    ERROR,

    SKIPPED,
    XFAILED,
    XPASSED,
    UNKNOWN;

    public static TestOutcome fromReport(String outcome) {
        if (outcome == null) return UNKNOWN;
        return switch (outcome.toLowerCase(Locale.ROOT)) {
            case "passed"  -> PASSED;
            case "failed"  -> FAILED;
            case "error"   -> ERROR;
            case "skipped" -> SKIPPED;
            case "xfailed" -> XFAILED;
            case "xpassed" -> XPASSED;
            default        -> UNKNOWN;
        };
    }

    public boolean isFailure() {
        return this == FAILED || this == ERROR;
    }
}
