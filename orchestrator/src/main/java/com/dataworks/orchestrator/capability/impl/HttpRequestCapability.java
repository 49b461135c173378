package com.dataworks.orchestrator.capability.impl;

import com.dataworks.orchestrator.capability.*;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Generic HTTP call. The response body is returned (clipped) or, with
 * {@code save_to}, written into the workspace. Non-2xx statuses are failures
 * that still carry the response payload.
 */
@Component
public class HttpRequestCapability implements Capability {

    private static final Set<String> METHODS = Set.of("GET", "POST", "PUT", "PATCH", "HEAD");

    private static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
            "http_request", "1.0.0",
            "Make an HTTP request (GET, POST, PUT, PATCH, HEAD; DELETE is refused). "
                    + "Returns {status, content_type, body}; with save_to the body is written to that workspace file.",
            ArgumentSchema.of(
                    ArgumentSpec.required("url", ArgumentType.STRING, "absolute http or https url"),
                    ArgumentSpec.optional("method", ArgumentType.STRING, "HTTP method (default GET)"),
                    ArgumentSpec.optional("headers", ArgumentType.OBJECT, "request headers as a JSON object"),
                    ArgumentSpec.optional("body", ArgumentType.STRING, "request body"),
                    ArgumentSpec.optional("save_to", ArgumentType.PATH, "workspace file to save the response body to")),
            SideEffectClass.NETWORK);

    private final HttpClient http;

    public HttpRequestCapability() {
        this(WebFetch.newClient());
    }

    HttpRequestCapability(HttpClient http) {
        this.http = http;
    }

    @Override public CapabilityDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public CapabilityResult invoke(Map<String, Object> arguments, CapabilityContext ctx) {
        URI uri       = WebFetch.parseUrl(CapabilityArgs.string(arguments, "url"));
        String method = CapabilityArgs.string(arguments, "method", "GET").trim().toUpperCase(Locale.ROOT);
        String body   = CapabilityArgs.string(arguments, "body", null);
        String saveTo = CapabilityArgs.string(arguments, "save_to", null);

        if (method.equals("DELETE")) {
            throw new CapabilityException(CapabilityException.Kind.POLICY_VIOLATION, "DELETE requests are not permitted");
        }
        if (!METHODS.contains(method)) {
            throw new CapabilityException(CapabilityException.Kind.INVALID_ARGUMENT, "unsupported method: " + method);
        }

        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .method(method, body == null
                        ? HttpRequest.BodyPublishers.noBody()
                        : HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8));
        try {
            CapabilityArgs.object(arguments, "headers")
                    .forEach((name, value) -> builder.header(name, String.valueOf(value)));
        } catch (IllegalArgumentException e) {
            // restricted (Host, Content-Length...) or malformed header
            throw new CapabilityException(CapabilityException.Kind.INVALID_ARGUMENT,
                    "invalid header: " + e.getMessage(), e);
        }

        HttpResponse<byte[]> response;
        try {
            response = http.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new CapabilityException(CapabilityException.Kind.EXECUTION_ERROR,
                    "request to " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            throw WebFetch.interrupted(uri, e);
        }

        int status = response.statusCode();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("status", status);
        payload.put("content_type", response.headers().firstValue("Content-Type").orElse(null));

        byte[] data = response.body() == null ? new byte[0] : response.body();
        boolean ok = status >= 200 && status < 300;
        if (ok && saveTo != null) {
            String saved = WebFetch.save(ctx, saveTo, data);
            payload.put("saved_to", saved);
            payload.put("bytes", data.length);
        } else {
            payload.put("body", ctx.clip(new String(data, StandardCharsets.UTF_8)));
        }
        return ok ? CapabilityResult.ok(payload) : new CapabilityResult(false, payload, "HTTP " + status);
    }
}
