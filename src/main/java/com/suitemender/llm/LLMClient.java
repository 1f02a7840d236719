package com.suitemender.llm;

/**
 * LLMClient: single interface for all model interactions.
 *
 * Implementations own the role → system prompt mapping (see {@link SystemPrompts})
 * and the transport. They throw {@link ModelCallException} when no usable text
 * comes back; they never return null.
 */
public interface LLMClient {

    /**
     * Primary generation method.
     *
     * @param role        what the call is for; selects the system prompt
     * @param userPrompt  task-specific prompt body
     * @param temperature sampling temperature (0.0 = deterministic)
     * @return raw model text, empty string on empty model output
     */
    String generateWithRole(ModelRole role, String userPrompt, double temperature);

    /** Generates with the canonical temperature for the role. */
    default String generate(ModelRole role, String userPrompt) {
        return generateWithRole(role, userPrompt, getTemperatureForRole(role));
    }

    /**
     * CLASSIFIER 0.0 (a verdict, not prose)
     * FIXER      0.1
     * GENERATOR  0.3
     */
    default double getTemperatureForRole(ModelRole role) {
        return switch (role) {
            case CLASSIFIER -> 0.0;
            case FIXER      -> 0.1;
            case GENERATOR  -> 0.3;
        };
    }
}
