package com.suitemender.orchestrator;

import com.suitemender.core.classifier.ClassificationResult;
import com.suitemender.core.classifier.FailureClassifier;
import com.suitemender.core.context.ContextBundle;
import com.suitemender.core.context.ContextExtractor;
import com.suitemender.core.context.FailureContext;
import com.suitemender.core.patch.FixResult;
import com.suitemender.core.patch.PatchOutcome;
import com.suitemender.core.patch.TestFixer;
import com.suitemender.core.runner.RunStatus;
import com.suitemender.core.runner.TestFailure;
import com.suitemender.core.runner.TestRunReport;
import com.suitemender.core.runner.TestRunner;
import com.suitemender.core.source.SymbolIndex;
import com.suitemender.core.source.SymbolIndexer;
import com.suitemender.core.source.SymbolKey;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

class RepairOrchestratorTest {

    private TestRunner        runner;
    private SymbolIndexer     indexer;
    private ContextExtractor  extractor;
    private FailureClassifier classifier;
    private TestFixer         fixer;
    private ReportWriter      reportWriter;

    private final TestFailure nameError = failure("test_create_user", "NameError", "name 'User' is not defined");
    private final TestFailure divide    = failure("test_divide", "ZeroDivisionError", "division by zero");

    @BeforeEach
    void setUp() {
        runner       = mock(TestRunner.class);
        indexer      = mock(SymbolIndexer.class);
        extractor    = mock(ContextExtractor.class);
        classifier   = mock(FailureClassifier.class);
        fixer        = mock(TestFixer.class);
        reportWriter = mock(ReportWriter.class);

        when(indexer.index()).thenReturn(SymbolIndex.empty());
        when(extractor.forFailure(any(), any())).thenAnswer(inv ->
                new FailureContext(inv.getArgument(0), "", "", ContextBundle.empty(List.of())));
    }

    private RepairOrchestrator orchestrator(int maxIterations) {
        return new RepairOrchestrator(runner, indexer, extractor, classifier, fixer, reportWriter, maxIterations);
    }

    private static TestFailure failure(String name, String kind, String message) {
        return new TestFailure("tests/test_app.py", name, null, kind, message, "", 3, "tests/test_app.py::" + name);
    }

    private static FixResult fixed(TestFailure failure) {
        return new FixResult(PatchOutcome.validated(new SymbolKey(failure.getTestFile(), failure.getTestName()), "patched"), 1);
    }

    @Test
    void testCollectionErrorAbortsWithRunnerTextVerbatim() {
        String detail = "ERROR collecting tests/test_app.py\nE   ModuleNotFoundError: No module named 'requests'";
        when(runner.runSuite()).thenReturn(TestRunReport.notRunnable(RunStatus.COLLECTION_ERROR, 2, detail));

        IterationReport report = orchestrator(3).run();

        assertTrue(report.isAborted());
        assertEquals("COLLECTION_ERROR: " + detail, report.getAbortReason());
        assertEquals(0, report.getTotalFailures());
        verifyNoInteractions(classifier, fixer);
        verify(reportWriter).write(report);
    }

    @Test
    void testPassingSuiteStopsAfterOneRound() {
        when(runner.runSuite()).thenReturn(TestRunReport.completed(0, 5, 5, List.of()));

        IterationReport report = orchestrator(3).run();

        assertFalse(report.isAborted());
        assertEquals(1, report.getIterations());
        assertEquals(0, report.getTotalFailures());
        verifyNoInteractions(indexer);
    }

    @Test
    void testFixesTestMistakeAndLeavesCodeDefectForReview() {
        when(runner.runSuite())
                .thenReturn(TestRunReport.completed(1, 5, 3, List.of(nameError, divide)))
                .thenReturn(TestRunReport.completed(1, 5, 4, List.of(divide)));
        when(classifier.classify(any())).thenAnswer(inv -> {
            FailureContext context = inv.getArgument(0);
            return context.getFailure().equals(nameError)
                    ? ClassificationResult.testMistake("User not imported", null, 0.95, ClassificationResult.Source.RULE)
                    : ClassificationResult.codeDefect("divide() does not guard zero", 0.8, ClassificationResult.Source.MODEL);
        });
        when(fixer.fix(any(), any())).thenReturn(fixed(nameError));

        IterationReport report = orchestrator(3).run();

        // round 2 fixes nothing, so the loop stops there
        assertEquals(2, report.getIterations());
        assertEquals(2, report.getTotalFailures());
        assertEquals(1, report.getTestMistakes());
        assertEquals(1, report.getCodeDefects());
        assertEquals(1, report.getSuccessfulFixes());
        assertEquals(0, report.getFailedFixes());
        assertEquals(List.of("tests/test_app.py::test_divide"), report.getCodeDefectsForReview());
        assertEquals(3, report.getFixHistory().size());
        verify(fixer, times(1)).fix(any(), any());
    }

    @Test
    void testStopsAtMaxIterations() {
        when(runner.runSuite()).thenReturn(TestRunReport.completed(1, 1, 0, List.of(nameError)));
        when(classifier.classify(any())).thenReturn(
                ClassificationResult.testMistake("flaky name", null, 0.9, ClassificationResult.Source.RULE));
        when(fixer.fix(any(), any())).thenReturn(fixed(nameError));

        IterationReport report = orchestrator(2).run();

        assertEquals(2, report.getIterations());
        assertEquals(1, report.getTotalFailures());
        verify(runner, times(2)).runSuite();
    }

    @Test
    void testFailuresHandledInRunnerOrder() {
        when(runner.runSuite()).thenReturn(TestRunReport.completed(1, 2, 0, List.of(divide, nameError)));
        when(classifier.classify(any())).thenReturn(
                ClassificationResult.unknown("undecided", ClassificationResult.Source.MODEL));

        IterationReport report = orchestrator(3).run();

        assertEquals("test_divide", report.getFixHistory().get(0).getTestName());
        assertEquals("test_create_user", report.getFixHistory().get(1).getTestName());
        assertEquals(2, report.getUndetermined());
        verifyNoInteractions(fixer);
    }
}
