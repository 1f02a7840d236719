package com.suitemender.llm;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scripted client for the mock profile and tests.
 *
 * Queued responses are served per role in order; an empty queue falls back to
 * a fixed reply that keeps the pipeline moving without changing anything
 * (an undecided classification, an empty code block).
 */
@Component
@Profile("mock")
public class MockLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(MockLLMClient.class);

    private final Map<ModelRole, Deque<String>> scripted = new EnumMap<>(ModelRole.class);
    private final List<String>                  prompts  = Collections.synchronizedList(new ArrayList<>());

    @Override
    public synchronized String generateWithRole(ModelRole role, String userPrompt, double temperature) {
        prompts.add(userPrompt);
        Deque<String> queue = scripted.get(role);
        if (queue != null && !queue.isEmpty()) {
            return queue.poll();
        }
        log.debug("[MockLLM] No scripted response for {}, using fallback", role);
        return switch (role) {
            case CLASSIFIER -> """
                    {"classification": "undetermined", "reason": "mock client has no verdict", "confidence": 0.0}
                    """;
            case FIXER, GENERATOR -> "```python\n```";
        };
    }

    public synchronized MockLLMClient enqueue(ModelRole role, String response) {
        scripted.computeIfAbsent(role, r -> new ArrayDeque<>()).add(response);
        return this;
    }

    public List<String> getPrompts() {
        return List.copyOf(prompts);
    }

    public synchronized void reset() {
        scripted.clear();
        prompts.clear();
    }
}
