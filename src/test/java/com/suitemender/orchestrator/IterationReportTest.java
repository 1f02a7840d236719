package com.suitemender.orchestrator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.suitemender.core.classifier.ClassificationResult;
import com.suitemender.core.patch.FixResult;
import com.suitemender.core.patch.PatchOutcome;
import com.suitemender.core.runner.TestFailure;
import com.suitemender.core.source.SymbolKey;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class IterationReportTest {

    private static final TestFailure FLAKY = new TestFailure("tests/test_a.py", "test_one", null,
            "NameError", "name 'x' is not defined", "", 2, "tests/test_a.py::test_one");
    private static final TestFailure PARAM = new TestFailure("tests/test_a.py", "test_two", null,
            "AssertionError", "assert 1 == 2", "", 5, "tests/test_a.py::test_two[1]");
    private static final TestFailure PARAM_OTHER = new TestFailure("tests/test_a.py", "test_two", null,
            "AssertionError", "assert 3 == 2", "", 5, "tests/test_a.py::test_two[3]");

    private static ClassificationResult mistake() {
        return ClassificationResult.testMistake("test error", null, 0.9, ClassificationResult.Source.RULE);
    }

    private static FixResult result(TestFailure failure, boolean success) {
        SymbolKey key = new SymbolKey(failure.getTestFile(), failure.getTestName());
        PatchOutcome outcome = success
                ? PatchOutcome.validated(key, "patched")
                : PatchOutcome.rolledBack(key, "test still fails after patch", "1 failed");
        return new FixResult(outcome, success ? 1 : 3);
    }

    @Test
    void testCountsLatestRecordPerTest() {
        IterationReport report = new IterationReport();
        report.startIteration();
        report.record(new FixRecord(1, FLAKY, mistake(), result(FLAKY, false)));
        report.record(new FixRecord(1, PARAM, mistake(), result(PARAM, false)));
        report.record(new FixRecord(1, PARAM_OTHER, mistake(), result(PARAM_OTHER, false)));
        report.startIteration();
        report.record(new FixRecord(2, FLAKY, mistake(), result(FLAKY, true)));

        assertEquals(2, report.getIterations());
        assertEquals(2, report.getTotalFailures());
        assertEquals(2, report.getTestMistakes());
        assertEquals(1, report.getSuccessfulFixes());
        assertEquals(1, report.getFailedFixes());
        assertEquals(4, report.getFixHistory().size());
    }

    @Test
    void testSerializesSnakeCaseFieldsInOrder() throws Exception {
        IterationReport report = new IterationReport();
        report.startIteration();
        report.record(new FixRecord(1, FLAKY,
                ClassificationResult.codeDefect("bug", 0.7, ClassificationResult.Source.MODEL), null));
        report.abort("cancelled");

        String json = new ObjectMapper().writeValueAsString(report);
        JsonNode root = new ObjectMapper().readTree(json);

        assertTrue(json.startsWith("{\"iterations\":1,\"total_failures\":1,"));
        assertEquals(1, root.get("code_defects").asInt());
        assertTrue(root.get("aborted").asBoolean());
        assertEquals("cancelled", root.get("abort_reason").asText());
        assertEquals("tests/test_a.py::test_one", root.get("code_defects_for_review").get(0).asText());

        JsonNode record = root.get("fix_history").get(0);
        assertEquals("code_defect", record.get("classification").asText());
        assertEquals("model", record.get("source").asText());
        assertEquals("NameError: name 'x' is not defined", record.get("error").asText());
        assertFalse(record.has("applied"));
    }
}
