package com.suitemender.core.classifier;

import com.suitemender.core.context.FailureContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * FailureClassifier: two-stage verdict per failure.
 *
 *   RECEIVED → RULE_CHECKED → DONE                  (a rule matched)
 *   RECEIVED → RULE_CHECKED → MODEL_CHECKED → DONE  (rules inconclusive)
 *
 * The model is never consulted once a rule has matched.
 */
@Service
public class FailureClassifier {

    private static final Logger log = LoggerFactory.getLogger(FailureClassifier.class);

    public enum Stage {
        RECEIVED,
        RULE_CHECKED,
        MODEL_CHECKED,
        DONE
    }

    private final RuleClassifier  ruleClassifier;
    private final ModelClassifier modelClassifier;

    public FailureClassifier(RuleClassifier ruleClassifier, ModelClassifier modelClassifier) {
        this.ruleClassifier  = ruleClassifier;
        this.modelClassifier = modelClassifier;
    }

    public ClassificationResult classify(FailureContext context) {
        String nodeId = context.getFailure().getNodeId();
        Stage stage = Stage.RECEIVED;

        Optional<ClassificationResult> ruled = ruleClassifier.classify(context.getFailure());
        stage = advance(nodeId, stage, Stage.RULE_CHECKED);

        if (ruled.isPresent()) {
            advance(nodeId, stage, Stage.DONE);
            return ruled.get();
        }

        String hint = ruleClassifier.codeDefectHint(context.getFailure()).orElse(null);
        ClassificationResult modelled = modelClassifier.classify(context, hint);
        stage = advance(nodeId, stage, Stage.MODEL_CHECKED);

        advance(nodeId, stage, Stage.DONE);
        return modelled;
    }

    private static Stage advance(String nodeId, Stage from, Stage to) {
        log.debug("[Classifier] {}: {} → {}", nodeId, from, to);
        return to;
    }
}
