package com.toolport.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ToolRequirements(@JsonProperty("authorization") AuthRequirement authorization) {

    public static final ToolRequirements NONE = new ToolRequirements(null);
}
