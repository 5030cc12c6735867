package com.toolport.shared.config;

import java.time.Duration;

/** @param timeoutMs per-invocation limit, 0 for none */
public record ExecutorConfig(long timeoutMs, int threads) {

    public static ExecutorConfig defaults() {
        return new ExecutorConfig(0, 16);
    }

    public Duration timeout() {
        return Duration.ofMillis(Math.max(0, timeoutMs));
    }
}
