package com.suitemender.core.classifier;

import com.suitemender.core.runner.TestFailure;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic first stage of classification.
 *
 * Ordered test-mistake signatures are matched against
 * "kind message trace"; the first match is a TEST_MISTAKE at confidence 1.0.
 * No match means the stage is inconclusive and the model decides.
 *
 * Code-defect signatures never decide anything here. They only produce a hint
 * that is passed on to the model stage.
 */
@Component
public class RuleClassifier {

    private static final Logger log = LoggerFactory.getLogger(RuleClassifier.class);

    static final List<FailureSignature> TEST_MISTAKE_SIGNATURES = List.of(
            new FailureSignature("wrong-import-name",
                    "cannot import name", "Wrong import in test"),
            new FailureSignature("missing-import",
                    "ImportError|ModuleNotFoundError", "Missing or wrong import in test"),
            new FailureSignature("undefined-name",
                    "NameError.*name .* is not defined", "Undefined name in test"),
            new FailureSignature("fixture-not-found",
                    "fixture '[^']*' not found|fixture .* doesn't exist", "Missing or misspelled fixture"),
            new FailureSignature("mock-misconfiguration",
                    "AttributeError.*(Mock|MagicMock)", "Incorrect mock usage"),
            new FailureSignature("assert-on-uninitialized-mock",
                    "\\bassert None\\b|Mock.*not called|Expected '[^']*' to (have been|be) called",
                    "Assertion on an unconfigured mock or None value"),
            new FailureSignature("async-mismatch",
                    "was never awaited|cannot be called from a running event loop"
                            + "|async def functions are not natively supported",
                    "Async handling mismatch in test"),
            new FailureSignature("call-arity",
                    "TypeError.*(takes \\d+ positional arguments? but \\d+|missing \\d+ required positional argument"
                            + "|got an unexpected keyword argument)",
                    "Wrong call arguments in test")
    );

    static final List<FailureSignature> CODE_DEFECT_HINTS = List.of(
            new FailureSignature("zero-division",    "ZeroDivisionError",           "division by zero in program code"),
            new FailureSignature("recursion",        "RecursionError",              "unbounded recursion in program code"),
            new FailureSignature("index-range",      "IndexError.*out of range",    "index out of range in program code"),
            new FailureSignature("invalid-literal",  "ValueError.*invalid literal", "invalid value conversion in program code")
    );

    private static final Set<String> SYNTAX_KINDS = Set.of("SyntaxError", "IndentationError", "TabError");

    //   tests/test_api.py:42: NameError
    private static final Pattern FRAME_LOCATION = Pattern.compile("^([^\\s:]+\\.py):(\\d+):", Pattern.MULTILINE);

    private static final Set<String> TEST_SIDE_KINDS =
            Set.of("AttributeError", "TypeError", "NameError", "ImportError");

    public Optional<ClassificationResult> classify(TestFailure failure) {
        String text = failureText(failure);

        for (FailureSignature signature : TEST_MISTAKE_SIGNATURES) {
            if (signature.matches(text)) {
                log.info("[RuleClassifier] {} matched '{}'", failure.getNodeId(), signature.getName());
                return Optional.of(ClassificationResult.testMistake(
                        signature.getReason() + ": " + failure.headline(),
                        null, 1.0, ClassificationResult.Source.RULE));
            }
        }

        if (isSyntaxErrorInTestFile(failure)) {
            log.info("[RuleClassifier] {} has a syntax error in its own file", failure.getNodeId());
            return Optional.of(ClassificationResult.testMistake(
                    "Syntax error in test file: " + failure.headline(),
                    null, 1.0, ClassificationResult.Source.RULE));
        }

        if (TEST_SIDE_KINDS.contains(failure.getExceptionKind()) && raisedInTestFile(failure)) {
            log.info("[RuleClassifier] {} raised {} inside the test itself",
                    failure.getNodeId(), failure.getExceptionKind());
            return Optional.of(ClassificationResult.testMistake(
                    failure.getExceptionKind() + " raised in test code: " + failure.getMessage(),
                    null, 0.9, ClassificationResult.Source.RULE));
        }

        log.debug("[RuleClassifier] {} inconclusive", failure.getNodeId());
        return Optional.empty();
    }

    /** Reason of the first matching code-defect signature, if any. */
    public Optional<String> codeDefectHint(TestFailure failure) {
        String text = failureText(failure);
        return CODE_DEFECT_HINTS.stream()
                .filter(s -> s.matches(text))
                .map(FailureSignature::getReason)
                .findFirst();
    }

    private static String failureText(TestFailure failure) {
        return failure.getExceptionKind() + " " + failure.getMessage() + " " + failure.getRawTrace();
    }

    private static boolean isSyntaxErrorInTestFile(TestFailure failure) {
        if (!SYNTAX_KINDS.contains(failure.getExceptionKind())) return false;
        String file = failure.getTestFile();
        String baseName = file.substring(file.lastIndexOf('/') + 1);
        return failure.getRawTrace().contains(baseName) || failure.getMessage().contains(baseName);
    }

    /** True when the deepest frame location in the trace is the test file itself. */
    private static boolean raisedInTestFile(TestFailure failure) {
        Matcher m = FRAME_LOCATION.matcher(failure.getRawTrace());
        String last = null;
        while (m.find()) last = m.group(1);
        return last != null && last.equals(failure.getTestFile());
    }
}
