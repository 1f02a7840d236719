package com.suitemender.core.runner;

/**
 * Whether a test run produced results the repair loop can act on.
 * Anything but COMPLETED aborts the current round.
 */
public enum RunStatus {

    /** Tests were collected and executed; failures, if any, are listed. */
    COMPLETED,

    /** pytest could not import or collect at least one test module. */
    COLLECTION_ERROR,

    /** Collection succeeded but found no tests. */
    NO_TESTS_COLLECTED,

    /** The runner itself failed: timeout, crash, usage error, missing report. */
    RUNNER_ERROR
}
