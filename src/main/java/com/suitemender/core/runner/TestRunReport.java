package com.suitemender.core.runner;

import java.util.List;

/**
 * Parsed result of one pytest invocation.
 *
 * statusDetail carries the runner's own words for a non-COMPLETED status
 * (collection traceback, timeout notice) so it can be reported verbatim.
 */
public final class TestRunReport {

    private final RunStatus         status;
    private final int               exitCode;
    private final int               collected;
    private final int               passed;
    private final List<TestFailure> failures;
    private final String            statusDetail;

    private TestRunReport(RunStatus status, int exitCode, int collected, int passed,
                          List<TestFailure> failures, String statusDetail) {
        this.status       = status;
        this.exitCode     = exitCode;
        this.collected    = collected;
        this.passed       = passed;
        this.failures     = List.copyOf(failures);
        this.statusDetail = statusDetail != null ? statusDetail : "";
    }

    public static TestRunReport completed(int exitCode, int collected, int passed, List<TestFailure> failures) {
        return new TestRunReport(RunStatus.COMPLETED, exitCode, collected, passed, failures, "");
    }

    public static TestRunReport notRunnable(RunStatus status, int exitCode, String detail) {
        if (status == RunStatus.COMPLETED) {
            throw new IllegalArgumentException("notRunnable requires a non-COMPLETED status");
        }
        return new TestRunReport(status, exitCode, 0, 0, List.of(), detail);
    }

    public RunStatus         getStatus()       { return status; }
    public int               getExitCode()     { return exitCode; }
    public int               getCollected()    { return collected; }
    public int               getPassed()       { return passed; }
    public List<TestFailure> getFailures()     { return failures; }
    public String            getStatusDetail() { return statusDetail; }

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    public boolean allPassed() {
        return isCompleted() && failures.isEmpty();
    }

    public String getSummary() {
        if (!isCompleted()) {
            return status + (statusDetail.isEmpty() ? "" : ": " + firstLine(statusDetail));
        }
        return collected + " collected, " + passed + " passed, " + failures.size() + " failed";
    }

    private static String firstLine(String text) {
        int nl = text.indexOf('\n');
        return nl == -1 ? text : text.substring(0, nl);
    }

    @Override
    public String toString() {
        return "TestRunReport{" + getSummary() + "}";
    }
}
