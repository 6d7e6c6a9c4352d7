package com.codeforge.orchestrator.llm;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin wrapper around the Anthropic Messages API.
 *
 * Raw HttpClient instead of an SDK: the endpoint is a single POST, and the
 * request on the wire is exactly what gets logged when something goes wrong.
 */
public class ClaudeClient implements TextGenerationClient {

    /**
     * The subset of the API response we care about.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record MessagesResponse(List<ContentBlock> content) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record ContentBlock(String type, String text) {}

        String firstText() {
            if (content == null) {
                throw new ExternalServiceException("Response has no content", false, null);
            }
            return content.stream()
                    .filter(b -> "text".equals(b.type()))
                    .map(ContentBlock::text)
                    .findFirst()
                    .orElseThrow(() -> new ExternalServiceException("No text block in response", false, null));
        }
    }

    static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    private static final String API_VER    = "2023-06-01";
    private static final int    MAX_TOKENS = 8192;

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final URI          endpoint;

    public ClaudeClient(String apiKey, String baseUrl, ObjectMapper objectMapper) {
        this.apiKey   = apiKey;
        this.json     = objectMapper;
        this.endpoint = URI.create(stripSlash(baseUrl == null || baseUrl.isBlank() ? DEFAULT_BASE_URL : baseUrl)
                + "/v1/messages");
        this.http     = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    /**
     * Send a conversation to Claude and return the assistant's text reply.
     */
    @Override
    public String complete(String model, List<Message> messages, String systemPrompt) {
        String requestBody = requestBody(model, messages, systemPrompt);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(endpoint)
                .header("content-type",      "application/json")
                .header("x-api-key",         apiKey == null ? "" : apiKey)
                .header("anthropic-version", API_VER)
                .POST(HttpRequest.BodyPublishers.ofString(requestBody))
                .build();

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExternalServiceException("Claude API unreachable: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Interrupted calling Claude API", false, e);
        }

        if (response.statusCode() != 200) {
            throw new ExternalServiceException(response.statusCode(), response.body());
        }
        try {
            return json.readValue(response.body(), MessagesResponse.class).firstText();
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException("Unreadable Claude API response: " + e.getOriginalMessage(), false, e);
        }
    }

    String requestBody(String model, List<Message> messages, String systemPrompt) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",      model);
        body.put("max_tokens", MAX_TOKENS);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            body.put("system", systemPrompt);
        }
        body.put("messages",   messages);
        try {
            return json.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise request", e);
        }
    }

    static String stripSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
