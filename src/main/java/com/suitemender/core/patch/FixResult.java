package com.suitemender.core.patch;

/**
 * Result of the bounded fix loop for one failure. outcome is null when no
 * attempt produced code to patch.
 */
public final class FixResult {

    private final PatchOutcome outcome;
    private final int          attempts;

    public FixResult(PatchOutcome outcome, int attempts) {
        this.outcome  = outcome;
        this.attempts = attempts;
    }

    public PatchOutcome getOutcome()  { return outcome; }
    public int          getAttempts() { return attempts; }

    public boolean isSuccess() {
        return outcome != null && outcome.isSuccess();
    }

    @Override
    public String toString() {
        return "FixResult{attempts=" + attempts + ", outcome=" + outcome + "}";
    }
}
