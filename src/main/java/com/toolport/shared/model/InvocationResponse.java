package com.toolport.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param duration   milliseconds spent inside the tool
 * @param finishedAt ISO-8601 instant
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InvocationResponse(
    @JsonProperty("invocation_id") String invocationId,
    @JsonProperty("duration") double duration,
    @JsonProperty("finished_at") String finishedAt,
    @JsonProperty("success") boolean success,
    @JsonProperty("output") ToolCallOutput output
) {}
