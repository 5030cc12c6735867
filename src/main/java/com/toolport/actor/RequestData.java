package com.toolport.actor;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Transport-neutral view of one request. Header names are lower-cased.
 * Hosts hand over the raw body; {@code bodyJson} stays null until
 * {@link #parseBody()} runs, and is null afterwards when there was no body.
 */
public record RequestData(
    String path,
    String method,
    Map<String, String> headers,
    Map<String, String> query,
    String body,
    JsonNode bodyJson
) {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    public RequestData {
        method = method.toUpperCase(Locale.ROOT);
        var lowered = new LinkedHashMap<String, String>();
        if (headers != null) {
            headers.forEach((k, v) -> {
                if (k != null && v != null) lowered.putIfAbsent(k.toLowerCase(Locale.ROOT), v);
            });
        }
        headers = Map.copyOf(lowered);
        query = query != null ? Map.copyOf(query) : Map.of();
    }

    public static RequestData of(String path, String method, Map<String, String> headers,
                                 Map<String, String> query, String body) {
        return new RequestData(path, method, headers, query, body, null);
    }

    /** Returns a copy with the body parsed as JSON, rejecting malformed JSON with a 400. */
    public RequestData parseBody() {
        if (body == null || body.isBlank()) {
            return this;
        }
        try {
            return new RequestData(path, method, headers, query, body, MAPPER.readTree(body));
        } catch (JsonProcessingException e) {
            throw new ActorException(400, "Malformed JSON body", e);
        }
    }

    public String header(String name) {
        return headers.get(name.toLowerCase(Locale.ROOT));
    }

    public String queryParam(String name) {
        return query.get(name);
    }

    public static Map<String, String> parseQuery(String rawQuery) {
        var params = new LinkedHashMap<String, String>();
        if (rawQuery == null || rawQuery.isEmpty()) {
            return params;
        }
        for (var pair : rawQuery.split("&")) {
            if (pair.isEmpty()) continue;
            var eq = pair.indexOf('=');
            var key = eq >= 0 ? pair.substring(0, eq) : pair;
            var value = eq >= 0 ? pair.substring(eq + 1) : "";
            params.putIfAbsent(URLDecoder.decode(key, StandardCharsets.UTF_8),
                    URLDecoder.decode(value, StandardCharsets.UTF_8));
        }
        return params;
    }
}
