package com.dataworks.orchestrator.capability.impl;

import com.dataworks.orchestrator.capability.CapabilityContext;
import com.dataworks.orchestrator.capability.CapabilityException;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Shared pieces of the network capabilities: URL checks, the HTTP client and
 * saving a response body into the workspace.
 */
final class WebFetch {

    private WebFetch() {}

    static HttpClient newClient() {
        return HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    /** Parses {@code raw} and accepts only absolute http(s) URLs. */
    static URI parseUrl(String raw) {
        URI uri;
        try {
            uri = new URI(raw.trim());
        } catch (URISyntaxException e) {
            throw new CapabilityException(CapabilityException.Kind.INVALID_ARGUMENT, "invalid url: " + raw, e);
        }
        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))
                || uri.getHost() == null) {
            throw new CapabilityException(CapabilityException.Kind.INVALID_ARGUMENT,
                    "only absolute http and https urls are supported: " + raw);
        }
        return uri;
    }

    /** Writes {@code data} to a sandboxed path and returns its workspace-relative name. */
    static String save(CapabilityContext ctx, String rawPath, byte[] data) {
        Path target = ctx.sandbox().resolve(rawPath);
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            Files.write(target, data);
        } catch (IOException e) {
            throw new CapabilityException(CapabilityException.Kind.EXECUTION_ERROR,
                    "could not save to " + rawPath + ": " + e.getMessage(), e);
        }
        return ctx.sandbox().relativize(target);
    }

    static CapabilityException interrupted(URI uri, InterruptedException e) {
        Thread.currentThread().interrupt();
        return new CapabilityException(CapabilityException.Kind.TIMEOUT, "request interrupted: " + uri, e);
    }
}
