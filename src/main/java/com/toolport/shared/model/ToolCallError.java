package com.toolport.shared.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ToolCallError(
    @JsonProperty("message") String message,
    @JsonProperty("developer_message") String developerMessage,
    @JsonProperty("can_retry") boolean canRetry,
    @JsonProperty("additional_prompt_content") String additionalPromptContent,
    @JsonProperty("retry_after_ms") Long retryAfterMs
) {}
