package com.toolport.schema;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ValueSchema(
    @JsonProperty("val_type") WireType valType,
    @JsonProperty("enum") List<String> enumValues
) {

    public ValueSchema {
        enumValues = enumValues != null ? List.copyOf(enumValues) : null;
    }

    public static ValueSchema of(WireType type) {
        return new ValueSchema(type, null);
    }
}
