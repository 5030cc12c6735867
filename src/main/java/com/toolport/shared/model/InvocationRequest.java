package com.toolport.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.toolport.tools.ToolContext;

import java.util.HashMap;

/** Body of {@code POST <base>/tools/invoke}. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvocationRequest(
    @JsonProperty("tool") ToolReference tool,
    @JsonProperty("invocation_id") String invocationId,
    @JsonProperty("inputs") JsonNode inputs,
    @JsonProperty("context") InvocationContext context
) {

    public InvocationRequest {
        invocationId = invocationId != null ? invocationId : "";
    }

    /** Context handed to the tool; null secret values are dropped. */
    public ToolContext toolContext() {
        if (context == null) {
            return ToolContext.empty(invocationId);
        }
        var token = context.authorization() != null ? context.authorization().token() : null;
        var secrets = new HashMap<String, String>();
        if (context.secrets() != null) {
            context.secrets().forEach((k, v) -> {
                if (k != null && v != null) secrets.put(k, v);
            });
        }
        return new ToolContext(invocationId, token, secrets);
    }
}
