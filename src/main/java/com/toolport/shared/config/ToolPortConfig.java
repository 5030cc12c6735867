package com.toolport.shared.config;

public record ToolPortConfig(
    ActorConfig actor,
    ExecutorConfig executor
) {
    public static ToolPortConfig defaults() {
        return new ToolPortConfig(ActorConfig.defaults(), ExecutorConfig.defaults());
    }
}
