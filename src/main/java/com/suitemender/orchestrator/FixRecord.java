package com.suitemender.orchestrator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.suitemender.core.classifier.ClassificationResult;
import com.suitemender.core.patch.FixResult;
import com.suitemender.core.patch.PatchOutcome;
import com.suitemender.core.runner.TestFailure;

/**
 * One fix-history entry: what a single failure was judged to be in one round,
 * and what happened when a fix was attempted.
 */
@JsonPropertyOrder({"iteration", "test_file", "test_name", "node_id", "error", "classification",
        "source", "confidence", "reason", "attempts", "applied", "validated", "patch_reason"})
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FixRecord {

    private final int                  iteration;
    private final TestFailure          failure;
    private final ClassificationResult classification;
    private final int                  attempts;
    private final PatchOutcome         outcome;

    public FixRecord(int iteration, TestFailure failure, ClassificationResult classification, FixResult fix) {
        this.iteration      = iteration;
        this.failure        = failure;
        this.classification = classification;
        this.attempts       = fix != null ? fix.getAttempts() : 0;
        this.outcome        = fix != null ? fix.getOutcome() : null;
    }

    @JsonProperty("iteration")  public int    getIteration() { return iteration; }
    @JsonProperty("test_file")  public String getTestFile()  { return failure.getTestFile(); }
    @JsonProperty("test_name")  public String getTestName()  { return failure.getTestName(); }
    @JsonProperty("node_id")    public String getNodeId()    { return failure.getNodeId(); }
    @JsonProperty("error")      public String getError()     { return failure.headline(); }
    @JsonProperty("reason")     public String getReason()    { return classification.getReason(); }
    @JsonProperty("attempts")   public int    getAttempts()  { return attempts; }

    @JsonProperty("classification")
    public String getClassification() {
        return classification.getKind().name().toLowerCase();
    }

    @JsonProperty("source")
    public String getSource() {
        return classification.getSource().name().toLowerCase();
    }

    @JsonProperty("confidence")
    public double getConfidence() {
        return classification.getConfidence();
    }

    @JsonProperty("applied")
    public Boolean getApplied() {
        return outcome != null ? outcome.isApplied() : null;
    }

    @JsonProperty("validated")
    public Boolean getValidated() {
        return outcome != null ? outcome.isValidated() : null;
    }

    @JsonProperty("patch_reason")
    public String getPatchReason() {
        return outcome != null ? outcome.getReason() : null;
    }

    /** (file, test) pair used to count unique failures across rounds. */
    public String identity() {
        return failure.identity();
    }

    public ClassificationResult.Kind kind() {
        return classification.getKind();
    }

    public boolean fixSucceeded() {
        return outcome != null && outcome.isSuccess();
    }

    @Override
    public String toString() {
        return "FixRecord{#" + iteration + " " + failure.getNodeId() + " → " + classification.getKind()
                + (outcome != null ? ", fixed=" + outcome.isSuccess() : "") + "}";
    }
}
