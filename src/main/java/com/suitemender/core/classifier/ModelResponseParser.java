package com.suitemender.core.classifier;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.suitemender.llm.ModelOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Validates classifier output into a {@link ClassificationResult}.
 *
 * Expected shape:
 *   {"classification": "test_mistake" | "code_defect", "reason": "...",
 *    "fixed_code": "..." | null, "confidence": 0.0-1.0}
 *
 * Anything that does not fit (no JSON, unknown classification) becomes
 * UNKNOWN. A malformed answer is never read as CODE_DEFECT.
 */
@Component
public class ModelResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ModelResponseParser.class);

    private static final double DEFAULT_CONFIDENCE = 0.5;

    private final ObjectMapper objectMapper;

    public ModelResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ClassificationResult parse(String response) {
        Optional<String> json = ModelOutput.extractJsonObject(response);
        if (json.isEmpty()) {
            log.warn("[ModelParser] No JSON object in model response ({} chars)", response == null ? 0 : response.length());
            return unknown("model response contained no JSON object");
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json.get());
        } catch (JsonProcessingException e) {
            log.warn("[ModelParser] Malformed JSON: {}", e.getOriginalMessage());
            return unknown("model response was malformed JSON");
        }
        if (root == null || !root.isObject()) {
            return unknown("model response was not a JSON object");
        }

        String classification = root.path("classification").asText("")
                .trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        String reason     = root.path("reason").asText("");
        double confidence = readConfidence(root.path("confidence"));

        return switch (classification) {
            case "test_mistake", "test_error", "test_bug" -> {
                String fixedCode = root.path("fixed_code").isTextual()
                        ? ModelOutput.extractCode(root.path("fixed_code").asText())
                        : null;
                yield ClassificationResult.testMistake(reason, fixedCode, confidence, ClassificationResult.Source.MODEL);
            }
            case "code_defect", "code_bug", "code_error" ->
                    ClassificationResult.codeDefect(reason, confidence, ClassificationResult.Source.MODEL);
            case "unknown", "undetermined", "uncertain" ->
                    ClassificationResult.unknown(reason.isEmpty() ? "model could not decide" : reason,
                            ClassificationResult.Source.MODEL);
            default -> {
                log.warn("[ModelParser] Unrecognized classification '{}'", classification);
                yield unknown("unrecognized classification '" + classification + "'");
            }
        };
    }

    private static double readConfidence(JsonNode node) {
        double value;
        if (node.isNumber()) {
            value = node.asDouble();
        } else if (node.isTextual()) {
            try {
                value = Double.parseDouble(node.asText().trim());
            } catch (NumberFormatException e) {
                return DEFAULT_CONFIDENCE;
            }
        } else {
            return DEFAULT_CONFIDENCE;
        }
        // Double.parseDouble accepts "NaN" and "Infinity"
        return Double.isFinite(value) ? value : DEFAULT_CONFIDENCE;
    }

    private static ClassificationResult unknown(String reason) {
        return ClassificationResult.unknown(reason, ClassificationResult.Source.MODEL);
    }
}
