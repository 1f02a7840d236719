package com.suitemender.core.patch;

import com.suitemender.core.context.FailureContext;
import com.suitemender.core.runner.TestFailure;
import com.suitemender.llm.LLMClient;
import com.suitemender.llm.ModelCallException;
import com.suitemender.llm.ModelOutput;
import com.suitemender.llm.ModelRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Asks the FIXER model for a corrected test definition.
 */
@Component
public class FixRequester {

    private static final Logger log = LoggerFactory.getLogger(FixRequester.class);

    static final int MAX_FEEDBACK_CHARS = 2000;

    private final LLMClient llmClient;
    private final int       maxContextChars;

    public FixRequester(
            LLMClient llmClient,
            @Value("${suitemender.context.max-chars:120000}") int maxContextChars
    ) {
        this.llmClient       = llmClient;
        this.maxContextChars = maxContextChars;
    }

    /**
     * @param previousAttempt code from the last rejected attempt, or null on the first
     * @param feedback        why it was rejected (runner or parser output), or null
     * @return the extracted replacement, empty when the model gave nothing usable
     */
    public Optional<String> requestFix(FailureContext context, String reason,
                                       String previousAttempt, String feedback) {
        String prompt = buildPrompt(context, reason, previousAttempt, feedback);
        String response;
        try {
            response = llmClient.generate(ModelRole.FIXER, prompt);
        } catch (ModelCallException e) {
            log.error("[FixRequester] Model call failed for {}: {}",
                    context.getFailure().getNodeId(), e.getMessage());
            return Optional.empty();
        }

        String code = ModelOutput.extractCode(response);
        if (code.isBlank()) {
            log.warn("[FixRequester] Empty fix for {}", context.getFailure().getNodeId());
            return Optional.empty();
        }
        return Optional.of(code);
    }

    String buildPrompt(FailureContext context, String reason, String previousAttempt, String feedback) {
        TestFailure failure = context.getFailure();
        StringBuilder sb = new StringBuilder();

        sb.append("FAILING TEST: ").append(failure.getNodeId()).append("\n");
        sb.append("ERROR: ").append(failure.headline()).append("\n");
        if (reason != null && !reason.isEmpty()) {
            sb.append("DIAGNOSIS: ").append(reason).append("\n");
        }

        if (!context.getTestImports().isEmpty()) {
            sb.append("\n## Test module imports\n```python\n").append(context.getTestImports()).append("\n```\n");
        }
        if (context.hasTestCode()) {
            sb.append("\n## Current test\n```python\n").append(context.getTestCode()).append("\n```\n");
        }

        String code = context.getBundle().render(maxContextChars);
        if (!code.isEmpty()) {
            sb.append("\n## Program code\n").append(code);
        }

        if (previousAttempt != null && !previousAttempt.isBlank()) {
            sb.append("\n## Previous fix attempt\n```python\n").append(previousAttempt).append("\n```\n");
            if (feedback != null && !feedback.isBlank()) {
                String clipped = feedback.length() <= MAX_FEEDBACK_CHARS
                        ? feedback : feedback.substring(0, MAX_FEEDBACK_CHARS);
                sb.append("\n## Why it was rejected\n```\n").append(clipped).append("\n```\n");
            }
            sb.append("\nThe previous fix attempt failed. Try a different approach.\n");
        }

        sb.append("\nReturn the corrected `").append(failure.getTestName())
          .append("` definition in a single ```python block.\n");
        return sb.toString();
    }
}
