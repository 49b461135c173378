package com.dataworks.orchestrator.capability.impl;

import com.dataworks.orchestrator.capability.*;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Selector;
import org.springframework.stereotype.Component;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fetches an HTML page and extracts the text of the elements matching a CSS
 * selector (jsoup syntax).
 */
@Component
public class ScrapeWebpageCapability implements Capability {

    private static final CapabilityDescriptor DESCRIPTOR = new CapabilityDescriptor(
            "scrape_webpage", "1.0.0",
            "Fetch a web page and return {title, matches}: the text of each element matching a CSS selector. "
                    + "With save_to the matched text is also written to that workspace file, one match per line.",
            ArgumentSchema.of(
                    ArgumentSpec.required("url", ArgumentType.STRING, "absolute http or https url"),
                    ArgumentSpec.optional("selector", ArgumentType.STRING, "CSS selector (default: body)"),
                    ArgumentSpec.optional("save_to", ArgumentType.PATH, "workspace file to save the extracted text to")),
            SideEffectClass.NETWORK);

    private static final Pattern CHARSET = Pattern.compile("(?i)charset=([^;]+)");

    private final HttpClient http;

    public ScrapeWebpageCapability() {
        this(WebFetch.newClient());
    }

    ScrapeWebpageCapability(HttpClient http) {
        this.http = http;
    }

    @Override public CapabilityDescriptor descriptor() { return DESCRIPTOR; }

    @Override
    public CapabilityResult invoke(Map<String, Object> arguments, CapabilityContext ctx) {
        URI uri         = WebFetch.parseUrl(CapabilityArgs.string(arguments, "url"));
        String selector = CapabilityArgs.string(arguments, "selector", "body");
        String saveTo   = CapabilityArgs.string(arguments, "save_to", null);

        HttpResponse<byte[]> response;
        try {
            response = http.send(HttpRequest.newBuilder(uri).GET().build(),
                    HttpResponse.BodyHandlers.ofByteArray());
        } catch (IOException e) {
            throw new CapabilityException(CapabilityException.Kind.EXECUTION_ERROR,
                    "request to " + uri + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            throw WebFetch.interrupted(uri, e);
        }
        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            return CapabilityResult.failure("HTTP " + response.statusCode());
        }

        Document doc;
        try {
            doc = Jsoup.parse(new ByteArrayInputStream(response.body()), charsetOf(response), uri.toString());
        } catch (IOException e) {
            throw new CapabilityException(CapabilityException.Kind.EXECUTION_ERROR,
                    "could not parse " + uri + ": " + e.getMessage(), e);
        }
        List<String> matches;
        try {
            matches = doc.select(selector).stream()
                    .map(Element::text)
                    .filter(text -> !text.isBlank())
                    .map(ctx::clip)
                    .toList();
        } catch (Selector.SelectorParseException e) {
            throw new CapabilityException(CapabilityException.Kind.INVALID_ARGUMENT,
                    "invalid selector: " + selector, e);
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("title", doc.title());
        payload.put("matches", matches);
        if (saveTo != null) {
            byte[] data = String.join("\n", matches).getBytes(StandardCharsets.UTF_8);
            payload.put("saved_to", WebFetch.save(ctx, saveTo, data));
        }
        return CapabilityResult.ok(payload);
    }

    /** Charset named in Content-Type, or null to let jsoup sniff the BOM and meta tags. */
    static String charsetOf(HttpResponse<?> response) {
        return response.headers().firstValue("Content-Type")
                .map(CHARSET::matcher)
                .filter(Matcher::find)
                .map(m -> m.group(1).replace("\"", "").trim())
                .filter(ScrapeWebpageCapability::isKnownCharset)
                .orElse(null);
    }

    private static boolean isKnownCharset(String name) {
        try {
            return Charset.isSupported(name);
        } catch (IllegalCharsetNameException e) {
            return false;
        }
    }
}
