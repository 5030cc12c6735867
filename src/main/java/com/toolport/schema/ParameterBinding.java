package com.toolport.schema;

import com.fasterxml.jackson.databind.JsonNode;

import java.lang.reflect.Type;

/**
 * How one declared method parameter is filled at invocation time. Not part of
 * the wire contract.
 *
 * @param wireName        input key, or null for the injected context
 * @param nativeType      declared type with any {@code Optional} removed
 * @param optionalWrapper whether the method expects an {@code Optional}
 * @param defaultValue    wire form of the declared default, or null
 */
public record ParameterBinding(
    String wireName,
    Type nativeType,
    boolean optionalWrapper,
    JsonNode defaultValue,
    boolean required
) {

    public static ParameterBinding context() {
        return new ParameterBinding(null, null, false, null, false);
    }

    public boolean isContext() {
        return wireName == null;
    }
}
