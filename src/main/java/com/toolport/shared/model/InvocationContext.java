package com.toolport.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InvocationContext(
    @JsonProperty("authorization") AuthorizationContext authorization,
    @JsonProperty("secrets") Map<String, String> secrets
) {}
