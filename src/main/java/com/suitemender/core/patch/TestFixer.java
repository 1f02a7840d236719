package com.suitemender.core.patch;

import com.suitemender.core.classifier.ClassificationResult;
import com.suitemender.core.context.FailureContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * TestFixer: drives request → patch for one TEST_MISTAKE failure.
 *
 * Attempt 1 uses the classifier's fixed_code when it supplied one, otherwise
 * asks the FIXER model. Each later attempt carries the previous code and the
 * reason it was rejected. Stops at the first validated patch.
 */
@Service
public class TestFixer {

    private static final Logger log = LoggerFactory.getLogger(TestFixer.class);

    private final FixRequester  fixRequester;
    private final SymbolPatcher patcher;
    private final int           maxAttempts;

    public TestFixer(
            FixRequester fixRequester,
            SymbolPatcher patcher,
            @Value("${suitemender.repair.max-fix-attempts:3}") int maxAttempts
    ) {
        this.fixRequester = fixRequester;
        this.patcher      = patcher;
        this.maxAttempts  = Math.max(1, maxAttempts);
    }

    public FixResult fix(FailureContext context, ClassificationResult classification) {
        String nodeId = context.getFailure().getNodeId();

        String previousCode     = null;
        String feedback         = null;
        PatchOutcome lastOutcome = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {

            Optional<String> code = (attempt == 1 && classification.getFixedCode().isPresent())
                    ? classification.getFixedCode()
                    : fixRequester.requestFix(context, classification.getReason(), previousCode, feedback);

            if (code.isEmpty()) {
                log.warn("[Fixer] Attempt {}/{} for {}: no code returned", attempt, maxAttempts, nodeId);
                feedback = "No code block was returned.";
                continue;
            }

            lastOutcome = patcher.patchTest(context.getFailure(), code.get());
            log.info("[Fixer] Attempt {}/{} for {}: {}", attempt, maxAttempts, nodeId, lastOutcome);

            if (lastOutcome.isSuccess()) {
                return new FixResult(lastOutcome, attempt);
            }
            if (!lastOutcome.isApplied()) {
                // file or definition cannot be patched at all; another replacement changes nothing
                return new FixResult(lastOutcome, attempt);
            }

            previousCode = code.get();
            feedback = lastOutcome.getFeedback().isEmpty() ? lastOutcome.getReason() : lastOutcome.getFeedback();
        }

        log.warn("[Fixer] Gave up on {} after {} attempts", nodeId, maxAttempts);
        return new FixResult(lastOutcome, maxAttempts);
    }
}
