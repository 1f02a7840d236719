package com.suitemender.llm;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeoutException;

/**
 * GeminiLLMClient: hosted backend, active under the gemini profile.
 *
 * 429, 503, I/O errors and timeouts are retried up to MAX_RETRIES times with
 * exponential backoff plus jitter; anything else fails the call at once.
 */
@Component
@Profile("gemini")
public class GeminiLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(GeminiLLMClient.class);

    private static final int  MAX_RETRIES     = 3;
    private static final long BASE_BACKOFF_MS = 500;
    private static final long MAX_JITTER_MS   = 250;

    private final WebClient webClient;
    private final String    apiKey;
    private final String    model;
    private final Duration  timeout;
    private final Random    jitterRandom = new Random();

    public GeminiLLMClient(
            WebClient.Builder builder,
            @Value("${gemini.api.key}") String apiKey,
            @Value("${gemini.api.model:gemini-1.5-flash}") String model,
            @Value("${gemini.api.base-url:https://generativelanguage.googleapis.com/v1beta}") String baseUrl,
            @Value("${gemini.api.timeout-seconds:60}") int timeoutSeconds
    ) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("gemini profile is active but gemini.api.key is empty");
        }
        this.webClient = builder.baseUrl(baseUrl).build();
        this.apiKey    = apiKey;
        this.model     = model;
        this.timeout   = Duration.ofSeconds(timeoutSeconds);

        log.info("[Gemini] model={} baseUrl={}", model, baseUrl);
    }

    // =========================================================================
    // LLMClient contract
    // =========================================================================

    @Override
    public String generateWithRole(ModelRole role, String userPrompt, double temperature) {
        log.debug("[Gemini] role={} temperature={} promptLen={}", role, temperature, userPrompt.length());

        Map<String, Object> body = requestBody(SystemPrompts.forRole(role), userPrompt, temperature);

        for (int attempt = 1; ; attempt++) {
            try {
                JsonNode response = post(body);
                if (attempt > 1) {
                    log.info("[Gemini] Succeeded after {} retries", attempt - 1);
                }
                return extractText(response);

            } catch (ModelCallException e) {
                throw e;
            } catch (RuntimeException e) {
                if (!isRetryable(e) || attempt > MAX_RETRIES) {
                    log.error("[Gemini] Giving up after {} attempt(s): {}", attempt, rootMessage(e));
                    throw new ModelCallException("Gemini call failed: " + rootMessage(e), e);
                }
                long backoff = computeBackoff(attempt);
                log.warn("[Gemini] Attempt {} failed ({}); retrying in {} ms", attempt, rootMessage(e), backoff);
                sleep(backoff);
            }
        }
    }

    // =========================================================================
    // HTTP
    // =========================================================================

    private static Map<String, Object> requestBody(String system, String prompt, double temperature) {
        return Map.of(
                "systemInstruction", Map.of("parts", List.of(Map.of("text", system))),
                "contents", List.of(Map.of(
                        "role", "user",
                        "parts", List.of(Map.of("text", prompt)))),
                "generationConfig", Map.of("temperature", temperature));
    }

    private JsonNode post(Map<String, Object> body) {
        return webClient.post()
                .uri(uri -> uri.path("/models/{model}:generateContent").queryParam("key", apiKey).build(model))
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON)
                .bodyValue(body)
                .retrieve()
                .bodyToMono(JsonNode.class)
                .timeout(timeout)
                .block();
    }

    /** candidates[0].content.parts[*].text, concatenated. */
    private static String extractText(JsonNode response) {
        if (response == null) {
            throw new ModelCallException("Gemini returned an empty body");
        }
        JsonNode parts = response.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            String reason = response.path("candidates").path(0).path("finishReason").asText("no candidates");
            throw new ModelCallException("Gemini response has no text parts (" + reason + ")");
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode part : parts) {
            text.append(part.path("text").asText(""));
        }
        return text.toString();
    }

    // =========================================================================
    // Retry
    // =========================================================================

    private static boolean isRetryable(RuntimeException e) {
        return e instanceof WebClientResponseException.ServiceUnavailable
            || e instanceof WebClientResponseException.TooManyRequests
            || e.getCause() instanceof IOException
            || e.getCause() instanceof TimeoutException;
    }

    private long computeBackoff(int attempt) {
        return BASE_BACKOFF_MS * (1L << (attempt - 1)) + jitterRandom.nextLong(MAX_JITTER_MS + 1);
    }

    private static void sleep(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ModelCallException("Interrupted during Gemini retry backoff", ie);
        }
    }

    private static String rootMessage(Throwable t) {
        Throwable cause = t;
        while (cause.getCause() != null) {
            cause = cause.getCause();
        }
        return cause.getMessage();
    }
}
