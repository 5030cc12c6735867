package com.toolport.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

public record InputParameter(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("required") boolean required,
    @JsonProperty("inferrable") boolean inferrable,
    @JsonProperty("value_schema") ValueSchema valueSchema
) {}
