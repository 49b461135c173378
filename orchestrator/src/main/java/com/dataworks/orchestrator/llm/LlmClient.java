package com.dataworks.orchestrator.llm;

import com.dataworks.orchestrator.config.OrchestratorProperties;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

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
 * Thin wrapper around an OpenAI-compatible chat-completions endpoint.
 *
 * The base URL may point at a proxy; the bearer token is only sent when one
 * is configured.
 */
@Component
public class LlmClient {

    // -------------------------------------------------------------------------
    // Data records
    // -------------------------------------------------------------------------

    /** role is "system", "user" or "assistant". */
    public record Message(String role, String content) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ChatResponse(List<Choice> choices) {
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Choice(Message message) {}

        public String firstContent() {
            if (choices == null) {
                throw new IllegalStateException("No choices in response");
            }
            return choices.stream()
                    .map(Choice::message)
                    .filter(m -> m != null && m.content() != null)
                    .map(Message::content)
                    .findFirst()
                    .orElseThrow(() -> new IllegalStateException("No message content in response"));
        }
    }

    // -------------------------------------------------------------------------
    // Fields
    // -------------------------------------------------------------------------

    private final HttpClient   http;
    private final ObjectMapper json;
    private final URI          endpoint;
    private final OrchestratorProperties.Llm settings;

    public LlmClient(OrchestratorProperties properties, ObjectMapper objectMapper) {
        this.settings = properties.getLlm();
        this.json     = objectMapper;
        this.endpoint = completionsUri(settings.getBaseUrl());
        this.http     = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    static URI completionsUri(String baseUrl) {
        String base = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        return URI.create(base + "chat/completions");
    }

    public String model() {
        return settings.getModel();
    }

    // -------------------------------------------------------------------------
    // Public API
    // -------------------------------------------------------------------------

    /**
     * Send a conversation and return the assistant's text reply.
     *
     * @throws LlmApiException on a non-2xx status, a transport failure or an
     *                         unreadable response body
     */
    public String complete(List<Message> messages) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model",       settings.getModel());
        body.put("temperature", settings.getTemperature());
        body.put("messages",    messages);

        HttpRequest.Builder request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(endpoint)
                    .timeout(settings.getRequestTimeout())
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(json.writeValueAsString(body)));
        } catch (JsonProcessingException e) {
            throw new LlmApiException("Could not encode chat request", e);
        }
        if (settings.hasApiKey()) {
            request.header("Authorization", "Bearer " + settings.getApiKey());
        }

        HttpResponse<String> response;
        try {
            response = http.send(request.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new LlmApiException("LLM request to " + endpoint + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new LlmApiException("LLM request interrupted", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            throw new LlmApiException(response.statusCode(), response.body());
        }
        try {
            return json.readValue(response.body(), ChatResponse.class).firstContent();
        } catch (JsonProcessingException | IllegalStateException e) {
            throw new LlmApiException("Unreadable LLM response: " + e.getMessage(), e);
        }
    }
}
