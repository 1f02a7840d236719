package com.suitemender.core.runner;

/**
 * Exit code and merged stdout/stderr of one subprocess.
 *
 * exitCode -1 means the process timed out, -2 that it could not be started.
 */
public class ProcessResult {

    public static final int TIMED_OUT   = -1;
    public static final int NOT_STARTED = -2;

    private final int    exitCode;
    private final String output;
    private final long   elapsedTimeMs;

    public ProcessResult(int exitCode, String output, long elapsedTimeMs) {
        this.exitCode      = exitCode;
        this.output        = output != null ? output : "";
        this.elapsedTimeMs = elapsedTimeMs;
    }

    public int getExitCode() {
        return exitCode;
    }

    public String getOutput() {
        return output;
    }

    public long getElapsedTimeMs() {
        return elapsedTimeMs;
    }

    public boolean timedOut() {
        return exitCode == TIMED_OUT;
    }

    public static ProcessResult notStarted(String errorMessage) {
        return new ProcessResult(NOT_STARTED, errorMessage, 0);
    }

    @Override
    public String toString() {
        return String.format(
            "ProcessResult{exitCode=%d, outputLen=%d, elapsedMs=%d}",
            exitCode,
            output.length(),
            elapsedTimeMs
        );
    }
}
