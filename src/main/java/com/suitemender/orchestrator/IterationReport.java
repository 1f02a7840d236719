package com.suitemender.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.suitemender.core.classifier.ClassificationResult.Kind;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * IterationReport: append-only record of a repair run.
 *
 * Counts are taken over unique (file, test) pairs, each represented by its
 * latest FixRecord, so a test that fails in several rounds counts once.
 * fix_history keeps every record in the order failures were processed.
 */
@JsonPropertyOrder({"iterations", "total_failures", "test_mistakes", "code_defects", "undetermined",
        "successful_fixes", "failed_fixes", "aborted", "abort_reason", "code_defects_for_review", "fix_history"})
public final class IterationReport {

    private final List<FixRecord> fixHistory = new ArrayList<>();
    private int     iterations;
    private boolean aborted;
    private String  abortReason;

    public void startIteration() {
        iterations++;
    }

    public void record(FixRecord record) {
        fixHistory.add(record);
    }

    public void abort(String reason) {
        this.aborted     = true;
        this.abortReason = reason;
    }

    @JsonProperty("iterations")
    public int getIterations() {
        return iterations;
    }

    @JsonProperty("total_failures")
    public int getTotalFailures() {
        return latestPerTest().size();
    }

    @JsonProperty("test_mistakes")
    public int getTestMistakes() {
        return countLatest(Kind.TEST_MISTAKE);
    }

    @JsonProperty("code_defects")
    public int getCodeDefects() {
        return countLatest(Kind.CODE_DEFECT);
    }

    @JsonProperty("undetermined")
    public int getUndetermined() {
        return countLatest(Kind.UNKNOWN);
    }

    @JsonProperty("successful_fixes")
    public int getSuccessfulFixes() {
        return (int) latestPerTest().stream()
                .filter(r -> r.kind() == Kind.TEST_MISTAKE && r.fixSucceeded())
                .count();
    }

    @JsonProperty("failed_fixes")
    public int getFailedFixes() {
        return getTestMistakes() - getSuccessfulFixes();
    }

    @JsonProperty("aborted")
    public boolean isAborted() {
        return aborted;
    }

    @JsonProperty("abort_reason")
    public String getAbortReason() {
        return abortReason;
    }

    /** Node ids of failures judged to be defects in the program under test. */
    @JsonProperty("code_defects_for_review")
    public List<String> getCodeDefectsForReview() {
        return latestPerTest().stream()
                .filter(r -> r.kind() == Kind.CODE_DEFECT)
                .map(FixRecord::getNodeId)
                .collect(Collectors.toList());
    }

    @JsonProperty("fix_history")
    public List<FixRecord> getFixHistory() {
        return Collections.unmodifiableList(fixHistory);
    }

    private Collection<FixRecord> latestPerTest() {
        Map<String, FixRecord> latest = new LinkedHashMap<>();
        for (FixRecord record : fixHistory) {
            latest.put(record.identity(), record);
        }
        return latest.values();
    }

    private int countLatest(Kind kind) {
        return (int) latestPerTest().stream().filter(r -> r.kind() == kind).count();
    }

    public String summary() {
        return String.format("iterations=%d failures=%d mistakes=%d (fixed %d, not fixed %d) defects=%d undetermined=%d%s",
                iterations, getTotalFailures(), getTestMistakes(), getSuccessfulFixes(), getFailedFixes(),
                getCodeDefects(), getUndetermined(), aborted ? " ABORTED: " + abortReason : "");
    }
}
