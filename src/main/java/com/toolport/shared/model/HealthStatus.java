package com.toolport.shared.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealthStatus(
    @JsonProperty("status") String status,
    @JsonProperty("tool_count") int toolCount
) {

    public static HealthStatus ok(int toolCount) {
        return new HealthStatus("ok", toolCount);
    }
}
