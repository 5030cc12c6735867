package com.toolport.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.util.concurrent.TimeUnit;

public class ToolMetrics {

    public static final String SUCCESS = "success";
    public static final String ERROR = "error";
    public static final String RETRY = "retry";

    private final MeterRegistry registry;

    public ToolMetrics() {
        this(new SimpleMeterRegistry());
    }

    public ToolMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public MeterRegistry registry() { return registry; }

    public Counter invocations(String tool, String outcome) {
        return Counter.builder("toolport.tool.invocations")
                .tag("tool", tool)
                .tag("outcome", outcome)
                .register(registry);
    }

    public Timer duration(String tool) {
        return Timer.builder("toolport.tool.duration")
                .tag("tool", tool)
                .register(registry);
    }

    public void record(String tool, String outcome, long elapsedNanos) {
        invocations(tool, outcome).increment();
        duration(tool).record(elapsedNanos, TimeUnit.NANOSECONDS);
    }
}
