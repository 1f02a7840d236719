package com.suitemender.core.classifier;

import com.suitemender.core.context.FailureContext;
import com.suitemender.core.runner.TestFailure;
import com.suitemender.llm.LLMClient;
import com.suitemender.llm.ModelCallException;
import com.suitemender.llm.ModelRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Model-backed second stage, used only when the rules are inconclusive.
 */
@Component
public class ModelClassifier {

    private static final Logger log = LoggerFactory.getLogger(ModelClassifier.class);

    private static final int MAX_TRACE_CHARS = 4000;

    private final LLMClient           llmClient;
    private final ModelResponseParser responseParser;
    private final int                 maxContextChars;

    public ModelClassifier(
            LLMClient llmClient,
            ModelResponseParser responseParser,
            @Value("${suitemender.context.max-chars:120000}") int maxContextChars
    ) {
        this.llmClient       = llmClient;
        this.responseParser  = responseParser;
        this.maxContextChars = maxContextChars;
    }

    public ClassificationResult classify(FailureContext context, String hint) {
        String prompt = buildPrompt(context, hint);
        try {
            String response = llmClient.generate(ModelRole.CLASSIFIER, prompt);
            ClassificationResult result = responseParser.parse(response);
            log.info("[ModelClassifier] {} → {}", context.getFailure().getNodeId(), result);
            return result;
        } catch (ModelCallException e) {
            log.error("[ModelClassifier] Model call failed for {}: {}", context.getFailure().getNodeId(), e.getMessage());
            return ClassificationResult.unknown("model call failed: " + e.getMessage(), ClassificationResult.Source.MODEL);
        }
    }

    String buildPrompt(FailureContext context, String hint) {
        TestFailure failure = context.getFailure();
        StringBuilder sb = new StringBuilder();

        sb.append("FAILING TEST: ").append(failure.getNodeId()).append("\n");
        sb.append("EXCEPTION: ").append(failure.getExceptionKind()).append("\n");
        sb.append("MESSAGE: ").append(failure.getMessage()).append("\n");
        if (failure.getLineNumber() != null) {
            sb.append("LINE: ").append(failure.getLineNumber()).append("\n");
        }
        if (hint != null && !hint.isEmpty()) {
            sb.append("NOTE: the error signature suggests ").append(hint)
              .append("; confirm against the code before deciding.\n");
        }

        sb.append("\n## Traceback\n```\n").append(tail(failure.getRawTrace(), MAX_TRACE_CHARS)).append("\n```\n");

        if (!context.getTestImports().isEmpty()) {
            sb.append("\n## Test module imports\n```python\n").append(context.getTestImports()).append("\n```\n");
        }
        if (context.hasTestCode()) {
            sb.append("\n## Failing test\n```python\n").append(context.getTestCode()).append("\n```\n");
        }

        String code = context.getBundle().render(maxContextChars);
        sb.append("\n## Program code\n");
        sb.append(code.isEmpty() ? "(no program code could be resolved)\n" : code);

        sb.append("\nClassify this failure. Respond with the JSON object only.\n");
        return sb.toString();
    }

    private static String tail(String text, int max) {
        return text.length() <= max ? text : "..." + text.substring(text.length() - max);
    }
}
