package com.suitemender.orchestrator;

import com.suitemender.core.classifier.ClassificationResult;
import com.suitemender.core.classifier.FailureClassifier;
import com.suitemender.core.context.ContextExtractor;
import com.suitemender.core.context.FailureContext;
import com.suitemender.core.patch.FixResult;
import com.suitemender.core.patch.TestFixer;
import com.suitemender.core.runner.TestFailure;
import com.suitemender.core.runner.TestRunReport;
import com.suitemender.core.runner.TestRunner;
import com.suitemender.core.source.SymbolIndex;
import com.suitemender.core.source.SymbolIndexer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * RepairOrchestrator: top-level controller for the failing-test repair loop.
 *
 * Round flow:  RUN SUITE → INDEX → (per failure) CONTEXT → CLASSIFY → FIX
 *
 * Terminates when:
 *   - the run is not fixable (collection error, no tests, runner crash): aborted, reason verbatim
 *   - the suite passes
 *   - a round produces zero successful fixes
 *   - max-iterations rounds have run
 *
 * Failures are handled strictly in runner order, one patch at a time.
 * Cancellation takes effect at the next round boundary.
 */
@Component
public class RepairOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(RepairOrchestrator.class);

    private final TestRunner        testRunner;
    private final SymbolIndexer     indexer;
    private final ContextExtractor  contextExtractor;
    private final FailureClassifier classifier;
    private final TestFixer         fixer;
    private final ReportWriter      reportWriter;
    private final int               maxIterations;

    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public RepairOrchestrator(
            TestRunner        testRunner,
            SymbolIndexer     indexer,
            ContextExtractor  contextExtractor,
            FailureClassifier classifier,
            TestFixer         fixer,
            ReportWriter      reportWriter,
            @Value("${suitemender.repair.max-iterations:3}") int maxIterations
    ) {
        this.testRunner       = testRunner;
        this.indexer          = indexer;
        this.contextExtractor = contextExtractor;
        this.classifier       = classifier;
        this.fixer            = fixer;
        this.reportWriter     = reportWriter;
        this.maxIterations    = Math.max(1, maxIterations);
    }

    // =========================================================================
    // MAIN ENTRY POINT
    // =========================================================================

    public IterationReport run() {
        log.info("========== SUITEMENDER REPAIR START ==========");
        long startTime = System.currentTimeMillis();
        cancelRequested.set(false);

        IterationReport report = new IterationReport();

        for (int iteration = 1; iteration <= maxIterations; iteration++) {

            if (cancelRequested.get()) {
                log.warn("[Repair] Cancelled before round {}", iteration);
                report.abort("cancelled");
                break;
            }

            report.startIteration();
            log.info("[Repair] ===== Round {}/{} =====", iteration, maxIterations);

            TestRunReport run = testRunner.runSuite();
            log.info("[Repair] Suite: {}", run.getSummary());

            // -----------------------------------------------------------------
            // NOT FIXABLE: report the runner's condition as-is
            // -----------------------------------------------------------------
            if (!run.isCompleted()) {
                String reason = run.getStatus() + ": " + run.getStatusDetail();
                log.error("[Repair] Aborting: {}", reason);
                report.abort(reason);
                break;
            }

            if (run.getFailures().isEmpty()) {
                log.info("[Repair] No failing tests");
                break;
            }

            SymbolIndex index = indexer.index();
            int fixedThisRound = processFailures(iteration, run, index, report);

            log.info("[Repair] Round {}: {} failure(s), {} fixed", iteration, run.getFailures().size(), fixedThisRound);
            if (fixedThisRound == 0) {
                log.info("[Repair] No progress this round; stopping");
                break;
            }
        }

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("========== SUITEMENDER REPAIR END ({} ms) ==========", elapsed);
        log.info("[Repair] {}", report.summary());

        reportWriter.write(report);
        return report;
    }

    public void cancel() {
        cancelRequested.set(true);
    }

    // =========================================================================
    // PER-FAILURE PIPELINE
    // =========================================================================

    private int processFailures(int iteration, TestRunReport run, SymbolIndex index, IterationReport report) {
        int fixed = 0;
        int position = 0;

        for (TestFailure failure : run.getFailures()) {
            position++;
            log.info("[Repair] Failure {}/{}: {}", position, run.getFailures().size(), failure.headline());

            FailureContext context = contextExtractor.forFailure(failure, index);
            ClassificationResult classification = classifier.classify(context);
            log.info("[Repair] {} → {}", failure.getNodeId(), classification);

            FixResult fix = null;
            if (classification.isTestMistake()) {
                fix = fixer.fix(context, classification);
                if (fix.isSuccess()) fixed++;
            } else if (classification.isCodeDefect()) {
                log.info("[Repair] Left for review (program defect): {}", failure.getNodeId());
            }

            report.record(new FixRecord(iteration, failure, classification, fix));
        }
        return fixed;
    }
}
