package com.toolport.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ToolInputs(@JsonProperty("parameters") List<InputParameter> parameters) {

    public ToolInputs {
        parameters = List.copyOf(parameters);
    }
}
