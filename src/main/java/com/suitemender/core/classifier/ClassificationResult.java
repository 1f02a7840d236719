package com.suitemender.core.classifier;

import java.util.Optional;

/**
 * ClassificationResult: verdict on one failing test.
 *
 * Exactly one of three kinds. Only TEST_MISTAKE may carry fixedCode, and only
 * TEST_MISTAKE ever leads to a patch. Confidence is clamped to [0, 1].
 */
public final class ClassificationResult {

    public enum Kind {
        /** The test is wrong; it may be rewritten. */
        TEST_MISTAKE,
        /** The program under test is wrong; needs human review, never auto-fixed. */
        CODE_DEFECT,
        /** Could not decide. */
        UNKNOWN
    }

    public enum Source {
        RULE,
        MODEL
    }

    private final Kind   kind;
    private final String reason;
    private final String fixedCode;
    private final double confidence;
    private final Source source;

    private ClassificationResult(Kind kind, String reason, String fixedCode, double confidence, Source source) {
        this.kind       = kind;
        this.reason     = reason != null ? reason : "";
        this.fixedCode  = fixedCode;
        this.confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
        this.source     = source;
    }

    // ================================================================
    // Factories
    // ================================================================

    public static ClassificationResult testMistake(String reason, String fixedCode, double confidence, Source source) {
        String code = fixedCode == null || fixedCode.isBlank() ? null : fixedCode;
        return new ClassificationResult(Kind.TEST_MISTAKE, reason, code, confidence, source);
    }

    public static ClassificationResult codeDefect(String reason, double confidence, Source source) {
        return new ClassificationResult(Kind.CODE_DEFECT, reason, null, confidence, source);
    }

    public static ClassificationResult unknown(String reason, Source source) {
        return new ClassificationResult(Kind.UNKNOWN, reason, null, 0.0, source);
    }

    // ================================================================
    // Accessors
    // ================================================================

    public Kind             getKind()       { return kind; }
    public String           getReason()     { return reason; }
    public Optional<String> getFixedCode()  { return Optional.ofNullable(fixedCode); }
    public double           getConfidence() { return confidence; }
    public Source           getSource()     { return source; }

    public boolean isTestMistake() { return kind == Kind.TEST_MISTAKE; }
    public boolean isCodeDefect()  { return kind == Kind.CODE_DEFECT; }

    @Override
    public String toString() {
        return String.format("%s[%s, %.2f]: %s", kind, source, confidence, reason);
    }
}
