package com.toolport.catalog;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ToolSummary(
    @JsonProperty("name") String name,
    @JsonProperty("description") String description,
    @JsonProperty("version") String version,
    @JsonProperty("endpoint") String endpoint
) {}
