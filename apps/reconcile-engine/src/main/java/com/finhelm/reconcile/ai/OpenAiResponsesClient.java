package com.finhelm.reconcile.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.finhelm.reconcile.config.ReconcileProperties;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

/**
 * Thin client for the OpenAI Responses API. Every failure is reported as an empty result so
 * callers can fall back to deterministic output.
 */
@Component
public class OpenAiResponsesClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiResponsesClient.class);
    private static final int DEFAULT_MAX_TOKENS = 400;
    private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(2);

    private final ReconcileProperties properties;
    private final RestClient restClient;

    public record Message(String role, String content) {}

    public record OpenAiResponsesRequest(String model, List<Message> input, Integer max_output_tokens) {}

    public OpenAiResponsesClient(ReconcileProperties properties) {
        this.properties = properties;

        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        int readTimeoutMs = properties.ai().timeoutMs();
        requestFactory.setConnectTimeout(CONNECT_TIMEOUT);
        requestFactory.setReadTimeout(Duration.ofMillis(readTimeoutMs));

        this.restClient = RestClient.builder().requestFactory(requestFactory).build();
        log.info("AI HTTP client configured: model={}, readTimeoutMs={}, credentials={}",
                properties.ai().model(), readTimeoutMs, hasCredentials());
    }

    public boolean hasCredentials() {
        return properties.ai().hasApiKey();
    }

    public Optional<String> generateText(List<Message> inputMessages, Integer maxOutputTokens) {
        if (!hasCredentials()) {
            return Optional.empty();
        }
        int maxTokens = Optional.ofNullable(maxOutputTokens).filter(v -> v > 0).orElse(DEFAULT_MAX_TOKENS);
        OpenAiResponsesRequest requestBody = new OpenAiResponsesRequest(properties.ai().model(), inputMessages, maxTokens);

        try {
            JsonNode response = restClient.post()
                    .uri(properties.ai().endpoint())
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(headers -> headers.setBearerAuth(properties.ai().apiKey()))
                    .body(requestBody)
                    .retrieve()
                    .body(JsonNode.class);
            if (response == null) {
                return Optional.empty();
            }
            String text = extractText(response.get("output"));
            if (text == null || text.isBlank()) {
                text = extractText(response);
            }
            return Optional.ofNullable(text).filter(s -> !s.isBlank());
        } catch (RestClientResponseException ex) {
            log.warn("OpenAI Responses call failed (status {}): {}", ex.getStatusCode(), ex.getMessage());
        } catch (Exception ex) {
            log.warn("OpenAI Responses call failed: {}", ex.getMessage());
        }
        return Optional.empty();
    }

    private String extractText(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                String nested = extractText(item);
                if (nested != null && !nested.isBlank()) {
                    return nested;
                }
            }
            return null;
        }
        for (String field : List.of("output_text", "content", "text")) {
            JsonNode child = node.get(field);
            if (child != null) {
                String nested = extractText(child);
                if (nested != null && !nested.isBlank()) {
                    return nested;
                }
            }
        }
        return null;
    }
}
