package com.suitemender.core.context;

import com.suitemender.core.runner.TestFailure;

/**
 * Everything known about one failing test before it is classified: the failure
 * itself, the failing test's own source and the program code it depends on.
 *
 * testCode is empty when the test definition could not be located (for example
 * the test file no longer parses far enough to find it).
 */
public final class FailureContext {

    private final TestFailure   failure;
    private final String        testCode;
    private final String        testImports;
    private final ContextBundle bundle;

    public FailureContext(TestFailure failure, String testCode, String testImports, ContextBundle bundle) {
        this.failure     = failure;
        this.testCode    = testCode != null ? testCode : "";
        this.testImports = testImports != null ? testImports : "";
        this.bundle      = bundle;
    }

    public TestFailure   getFailure()     { return failure; }
    public String        getTestCode()    { return testCode; }
    /** Import lines of the test module, one per line. */
    public String        getTestImports() { return testImports; }
    public ContextBundle getBundle()      { return bundle; }

    public boolean hasTestCode() {
        return !testCode.isEmpty();
    }

    @Override
    public String toString() {
        return "FailureContext{" + failure.getNodeId() + ", " + bundle + "}";
    }
}
