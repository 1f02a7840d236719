package com.suitemender.core.runner;

import java.util.Objects;

/**
 * TestFailure: one failed or errored test node, reduced to what the classifier
 * and patch engine need.
 *
 * testName has any parametrization suffix removed ("test_add[1-2]" → "test_add")
 * so it names the definition to patch. nodeId is kept verbatim for re-running.
 */
public final class TestFailure {

    private final String  testFile;
    private final String  testName;
    private final String  enclosingClass;
    private final String  exceptionKind;
    private final String  message;
    private final String  rawTrace;
    private final Integer lineNumber;
    private final String  nodeId;

    public TestFailure(String testFile, String testName, String enclosingClass,
                       String exceptionKind, String message, String rawTrace,
                       Integer lineNumber, String nodeId) {
        this.testFile       = testFile;
        this.testName       = testName;
        this.enclosingClass = enclosingClass;
        this.exceptionKind  = exceptionKind != null ? exceptionKind : "Unknown";
        this.message        = message != null ? message : "";
        this.rawTrace       = rawTrace != null ? rawTrace : "";
        this.lineNumber     = lineNumber;
        this.nodeId         = nodeId;
    }

    public String  getTestFile()       { return testFile; }
    public String  getTestName()       { return testName; }
    public String  getEnclosingClass() { return enclosingClass; }
    public String  getExceptionKind()  { return exceptionKind; }
    public String  getMessage()        { return message; }
    public String  getRawTrace()       { return rawTrace; }
    public Integer getLineNumber()     { return lineNumber; }
    public String  getNodeId()         { return nodeId; }

    /** Identity used when counting unique failures across rounds. */
    public String identity() {
        return testFile + "::" + testName;
    }

    /** "NameError: name 'User' is not defined" */
    public String headline() {
        return message.isEmpty() ? exceptionKind : exceptionKind + ": " + message;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TestFailure)) return false;
        TestFailure that = (TestFailure) o;
        return Objects.equals(nodeId, that.nodeId)
                && Objects.equals(exceptionKind, that.exceptionKind)
                && Objects.equals(message, that.message);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodeId, exceptionKind, message);
    }

    @Override
    public String toString() {
        return nodeId + " → " + headline();
    }
}
