package com.suitemender.core.runner;

/**
 * Runs the project's tests and reports the outcome. Implementations block until
 * the run finishes or times out; a timeout is a RUNNER_ERROR report, never an
 * exception.
 */
public interface TestRunner {

    /** Runs the whole configured test directory. */
    TestRunReport runSuite();

    /** Runs a single test node, e.g. "tests/test_api.py::TestUsers::test_create". */
    TestRunReport runNode(String nodeId);
}
