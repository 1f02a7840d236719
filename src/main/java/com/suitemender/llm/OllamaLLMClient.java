package com.suitemender.llm;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Profile;
import org.springframework.http.*;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.HashMap;
import java.util.Map;

/**
 * OllamaLLMClient: default LLMClient backed by a local Ollama server.
 *
 * Active unless the gemini or mock profile is selected.
 */
@Component
@Profile("!gemini & !mock")
public class OllamaLLMClient implements LLMClient {

    private static final Logger log = LoggerFactory.getLogger(OllamaLLMClient.class);

    private final String       baseUrl;
    private final String       model;
    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public OllamaLLMClient(
            ObjectMapper objectMapper,
            @Value("${ollama.base-url:http://localhost:11434}") String baseUrl,
            @Value("${ollama.model:llama3:8b}") String model,
            @Value("${ollama.timeout-seconds:180}") int timeoutSeconds
    ) {
        this.objectMapper = objectMapper;
        this.baseUrl      = baseUrl;
        this.model        = model;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(10_000);
        requestFactory.setReadTimeout(timeoutSeconds * 1000);
        this.restTemplate = new RestTemplate(requestFactory);

        log.info("[Ollama] model={} baseUrl={}", model, baseUrl);
    }

    // =========================================================================
    // LLMClient contract
    // =========================================================================

    @Override
    public String generateWithRole(ModelRole role, String userPrompt, double temperature) {
        log.debug("[Ollama] role={} temperature={} promptLen={}", role, temperature, userPrompt.length());
        return callOllama(SystemPrompts.forRole(role), userPrompt, temperature, role == ModelRole.CLASSIFIER);
    }

    // =========================================================================
    // HTTP client
    // =========================================================================

    private String callOllama(String system, String prompt, double temperature, boolean jsonFormat) {
        String url = baseUrl + "/api/generate";

        Map<String, Object> body = new HashMap<>();
        body.put("model",   model);
        body.put("system",  system);
        body.put("prompt",  prompt);
        body.put("stream",  false);
        body.put("options", Map.of("temperature", temperature));
        if (jsonFormat) {
            body.put("format", "json");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);

        try {
            ResponseEntity<String> response =
                    restTemplate.postForEntity(url, new HttpEntity<>(body, headers), String.class);

            JsonNode root = objectMapper.readTree(response.getBody() != null ? response.getBody() : "{}");

            String result = root.has("response") ? root.get("response").asText() : "";
            log.debug("[Ollama] responseLen={}", result.length());
            return result;

        } catch (RestClientException e) {
            log.error("[Ollama] Call failed: {}", e.getMessage());
            throw new ModelCallException("Ollama call failed: " + e.getMessage(), e);
        } catch (JsonProcessingException e) {
            log.error("[Ollama] Unreadable response envelope: {}", e.getOriginalMessage());
            throw new ModelCallException("Ollama returned a malformed envelope", e);
        }
    }
}
