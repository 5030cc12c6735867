package com.toolport.tools;

import java.util.Map;

/**
 * Per-invocation context. A tool method receives it by declaring a parameter
 * of this type; it never appears in the tool's input schema.
 */
public record ToolContext(
    String invocationId,
    String authorizationToken,
    Map<String, String> secrets
) {

    public ToolContext {
        secrets = secrets != null ? Map.copyOf(secrets) : Map.of();
    }

    public static ToolContext empty(String invocationId) {
        return new ToolContext(invocationId, null, Map.of());
    }

    public String authTokenOrEmpty() {
        return authorizationToken != null ? authorizationToken : "";
    }

    public String secret(String key) {
        var value = secrets.get(key);
        if (value == null) {
            throw new IllegalArgumentException("Secret " + key + " not found in context.");
        }
        return value;
    }
}
