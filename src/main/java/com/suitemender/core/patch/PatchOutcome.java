package com.suitemender.core.patch;

import com.suitemender.core.source.SymbolKey;

/**
 * PatchOutcome: what happened when a replacement was offered for one definition.
 *
 *   applied=false                  nothing was written (target missing, bad input)
 *   applied=true,  validated=false written, then rolled back to the exact prior bytes
 *   applied=true,  validated=true  the file now holds the replacement
 *
 * feedback carries runner or parser output explaining a rollback, for the
 * next fix attempt.
 */
public final class PatchOutcome {

    private final SymbolKey target;
    private final boolean   applied;
    private final boolean   validated;
    private final String    reason;
    private final String    feedback;

    private PatchOutcome(SymbolKey target, boolean applied, boolean validated, String reason, String feedback) {
        this.target    = target;
        this.applied   = applied;
        this.validated = validated;
        this.reason    = reason != null ? reason : "";
        this.feedback  = feedback != null ? feedback : "";
    }

    public static PatchOutcome notApplied(SymbolKey target, String reason) {
        return new PatchOutcome(target, false, false, reason, null);
    }

    public static PatchOutcome rolledBack(SymbolKey target, String reason, String feedback) {
        return new PatchOutcome(target, true, false, reason, feedback);
    }

    public static PatchOutcome validated(SymbolKey target, String reason) {
        return new PatchOutcome(target, true, true, reason, null);
    }

    public SymbolKey getTarget()    { return target; }
    public boolean   isApplied()    { return applied; }
    public boolean   isValidated()  { return validated; }
    public String    getReason()    { return reason; }
    public String    getFeedback()  { return feedback; }

    public boolean isSuccess() {
        return applied && validated;
    }

    @Override
    public String toString() {
        return "PatchOutcome{" + target + ", applied=" + applied + ", validated=" + validated + ", " + reason + "}";
    }
}
