package com.toolport.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record OutputSpec(
    @JsonProperty("description") String description,
    @JsonProperty("available_modes") List<OutputMode> availableModes,
    @JsonProperty("value_schema") ValueSchema valueSchema
) {

    public OutputSpec {
        availableModes = List.copyOf(availableModes);
    }

    public boolean allows(OutputMode mode) {
        return availableModes.contains(mode);
    }
}
