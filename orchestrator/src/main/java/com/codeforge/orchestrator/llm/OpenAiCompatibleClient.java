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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat-completions client for OpenAI and for services that speak the same
 * wire format (Groq). The system prompt is sent as the first message.
 */
public class OpenAiCompatibleClient implements TextGenerationClient {

    @JsonIgnoreProperties(ignoreUnknown = true)
    record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        record Choice(Message message) {}

        String firstText() {
            if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
                throw new ExternalServiceException("No choices in response", false, null);
            }
            return choices.get(0).message().content();
        }
    }

    private final HttpClient   http;
    private final ObjectMapper json;
    private final String       apiKey;
    private final URI          endpoint;
    private final String       label;

    public OpenAiCompatibleClient(String label, String apiKey, String baseUrl, ObjectMapper objectMapper) {
        this.label    = label;
        this.apiKey   = apiKey;
        this.json     = objectMapper;
        this.endpoint = URI.create(ClaudeClient.stripSlash(baseUrl) + "/chat/completions");
        this.http     = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public String complete(String model, List<Message> messages, String systemPrompt) {
        List<Message> all = new ArrayList<>(messages.size() + 1);
        if (systemPrompt != null && !systemPrompt.isBlank()) {
            all.add(new Message("system", systemPrompt));
        }
        all.addAll(messages);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",    model);
        body.put("messages", all);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .header("content-type",  "application/json")
                    .header("authorization", "Bearer " + (apiKey == null ? "" : apiKey))
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)))
                    .build();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise request", e);
        }

        HttpResponse<String> response;
        try {
            response = http.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ExternalServiceException(label + " API unreachable: " + e.getMessage(), true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalServiceException("Interrupted calling " + label + " API", false, e);
        }

        if (response.statusCode() != 200) {
            throw new ExternalServiceException(response.statusCode(), response.body());
        }
        try {
            return json.readValue(response.body(), ChatResponse.class).firstText();
        } catch (JsonProcessingException e) {
            throw new ExternalServiceException("Unreadable " + label + " API response: " + e.getOriginalMessage(), false, e);
        }
    }
}
