package com.toolport.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

/**
 * Exactly one of {@code value} and {@code error} is set. A successful call
 * without a value carries {@link NullNode}, so {@code "value": null} still
 * appears on the wire.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolCallOutput(
    @JsonProperty("value") JsonNode value,
    @JsonProperty("error") ToolCallError error
) {

    public static ToolCallOutput ofValue(JsonNode value) {
        return new ToolCallOutput(value != null ? value : NullNode.getInstance(), null);
    }

    public static ToolCallOutput ofError(ToolCallError error) {
        return new ToolCallOutput(null, error);
    }
}
