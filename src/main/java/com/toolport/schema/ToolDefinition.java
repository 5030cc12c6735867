package com.toolport.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Wire contract of one tool. Built once at registration and never changed. */
public record ToolDefinition(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("version") String version,
    @JsonProperty("toolkit") String toolkit,
    @JsonProperty("inputs") ToolInputs inputs,
    @JsonProperty("output") OutputSpec output,
    @JsonProperty("requirements") ToolRequirements requirements
) {

    @JsonIgnore
    public String fullyQualifiedName() {
        return toolkit + "." + name;
    }

    @JsonIgnore
    public AuthRequirement authRequirement() {
        return requirements != null ? requirements.authorization() : null;
    }
}
