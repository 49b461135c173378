package com.dataworks.orchestrator.llm;

/**
 * The chat-completions endpoint failed. {@code statusCode} is 0 when no HTTP
 * response was received.
 */
public class LlmApiException extends RuntimeException {

    private final int statusCode;

    public LlmApiException(int statusCode, String body) {
        super("LLM API error %d: %s".formatted(statusCode, body));
        this.statusCode = statusCode;
    }

    public LlmApiException(String message, Throwable cause) {
        super(message, cause);
        this.statusCode = 0;
    }

    public int statusCode() { return statusCode; }
}
