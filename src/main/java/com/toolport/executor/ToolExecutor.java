package com.toolport.executor;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.NullNode;
import com.toolport.catalog.MaterializedTool;
import com.toolport.errors.RetryableToolException;
import com.toolport.errors.ToolInputException;
import com.toolport.errors.ToolOutputException;
import com.toolport.errors.ToolRuntimeException;
import com.toolport.observability.ToolMetrics;
import com.toolport.schema.OutputMode;
import com.toolport.schema.WireType;
import com.toolport.shared.model.InvocationResponse;
import com.toolport.shared.model.ToolCallError;
import com.toolport.shared.model.ToolCallOutput;
import com.toolport.tools.ToolContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.InvocationTargetException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one materialized tool against raw wire inputs. The returned future
 * always completes normally: every failure becomes an error envelope.
 * With a timeout configured, tools run on a pool owned by this executor.
 */
public class ToolExecutor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ToolExecutor.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.ACCEPT_FLOAT_AS_INT);

    private final ToolMetrics metrics;
    private final Clock clock;
    private final Duration timeout;
    private final ExecutorService pool;

    public ToolExecutor() {
        this(new ToolMetrics(), Clock.systemUTC(), Duration.ZERO);
    }

    /** @param timeout zero or negative for no limit */
    public ToolExecutor(ToolMetrics metrics, Clock clock, Duration timeout) {
        this.metrics = metrics;
        this.clock = clock;
        this.timeout = timeout != null ? timeout : Duration.ZERO;
        this.pool = limited() ? Executors.newCachedThreadPool(workerThreads()) : null;
    }

    public CompletableFuture<InvocationResponse> run(MaterializedTool tool, JsonNode inputs, ToolContext context) {
        var ctx = context != null ? context : ToolContext.empty("");
        Object[] args;
        try {
            args = bindInputs(tool, inputs, ctx);
        } catch (ToolRuntimeException e) {
            return CompletableFuture.completedFuture(failure(tool, ctx, e, 0));
        }

        long start = System.nanoTime();
        CompletableFuture<Object> result;
        if (pool != null) {
            result = CompletableFuture.supplyAsync(() -> invoke(tool, args), pool)
                    .thenCompose(f -> f)
                    .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } else {
            result = invoke(tool, args);
        }
        return result.handle((value, error) -> {
            long elapsed = System.nanoTime() - start;
            if (error != null) {
                return failure(tool, ctx, unwrap(error), elapsed);
            }
            try {
                var node = serializeOutput(tool, value);
                metrics.record(tool.fullyQualifiedName(), ToolMetrics.SUCCESS, elapsed);
                return new InvocationResponse(ctx.invocationId(), millis(elapsed), finishedAt(), true,
                        ToolCallOutput.ofValue(node));
            } catch (RuntimeException e) {
                return failure(tool, ctx, e, elapsed);
            }
        });
    }

    Object[] bindInputs(MaterializedTool tool, JsonNode inputs, ToolContext ctx) {
        if (inputs == null || inputs.isNull() || inputs.isMissingNode()) {
            inputs = MAPPER.createObjectNode();
        }
        if (!inputs.isObject()) {
            throw new ToolInputException("Inputs for tool " + tool.name() + " must be an object",
                    "Got " + inputs.getNodeType());
        }

        var bindings = tool.bindings();
        var args = new Object[bindings.size()];
        for (int i = 0; i < bindings.size(); i++) {
            var b = bindings.get(i);
            if (b.isContext()) {
                args[i] = ctx;
                continue;
            }

            var value = inputs.get(b.wireName());
            if (value == null || value.isNull()) {
                if (b.defaultValue() != null) {
                    value = b.defaultValue();
                } else if (b.optionalWrapper()) {
                    args[i] = Optional.empty();
                    continue;
                } else {
                    throw new ToolInputException("Missing required input '" + b.wireName() + "'",
                            "Tool " + tool.fullyQualifiedName() + " was called without '" + b.wireName() + "'");
                }
            }

            Object converted;
            try {
                converted = MAPPER.convertValue(value, MAPPER.constructType(b.nativeType()));
            } catch (IllegalArgumentException e) {
                throw new ToolInputException("Invalid value for input '" + b.wireName() + "'",
                        e.getMessage(), e);
            }
            args[i] = b.optionalWrapper() ? Optional.ofNullable(converted) : converted;
        }
        return args;
    }

    private CompletableFuture<Object> invoke(MaterializedTool tool, Object[] args) {
        Object returned;
        try {
            returned = tool.method().invoke(tool.target(), args);
        } catch (InvocationTargetException e) {
            return CompletableFuture.failedFuture(e.getCause() != null ? e.getCause() : e);
        } catch (IllegalAccessException | IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }

        if (CompletionStage.class.isAssignableFrom(tool.method().getReturnType())) {
            if (returned == null) {
                return CompletableFuture.failedFuture(new ToolOutputException(
                        "Tool " + tool.name() + " returned no result",
                        tool.method() + " returned a null future"));
            }
            return ((CompletionStage<?>) returned).toCompletableFuture().thenApply(v -> (Object) v);
        }
        return CompletableFuture.completedFuture(returned);
    }

    JsonNode serializeOutput(MaterializedTool tool, Object value) {
        var output = tool.definition().output();
        if (value instanceof Optional<?> opt) {
            value = opt.orElse(null);
        }
        if (output.valueSchema() == null) {
            return NullNode.getInstance();
        }
        var type = output.valueSchema().valType();
        if (value == null) {
            if (output.allows(OutputMode.NULL)) {
                return NullNode.getInstance();
            }
            throw new ToolOutputException("Tool " + tool.name() + " returned no value",
                    "Declared output type " + type.wireName() + " is not nullable");
        }

        JsonNode node;
        try {
            node = MAPPER.valueToTree(value);
        } catch (IllegalArgumentException e) {
            throw new ToolOutputException("Tool " + tool.name() + " returned a value that could not be serialized",
                    e.getMessage(), e);
        }
        if (!matches(type, node)) {
            throw new ToolOutputException("Tool " + tool.name() + " returned a value of the wrong type",
                    "Expected " + type.wireName() + ", got " + node.getNodeType());
        }
        return node;
    }

    private static boolean matches(WireType type, JsonNode node) {
        return switch (type) {
            case STRING -> node.isTextual();
            case INTEGER -> node.isIntegralNumber();
            case FLOAT -> node.isNumber();
            case BOOLEAN -> node.isBoolean();
            case JSON -> true;
        };
    }

    private InvocationResponse failure(MaterializedTool tool, ToolContext ctx, Throwable error, long elapsedNanos) {
        ToolCallError callError;
        String outcome;
        if (error instanceof RetryableToolException e) {
            callError = new ToolCallError(e.getMessage(), e.developerMessage(), true,
                    e.additionalPromptContent(), e.retryAfterMs());
            outcome = ToolMetrics.RETRY;
            log.debug("Tool {} asked for a retry: {}", tool.fullyQualifiedName(), e.getMessage());
        } else if (error instanceof ToolRuntimeException e) {
            callError = new ToolCallError(e.getMessage(), e.developerMessage(), e.canRetry(), null, null);
            outcome = e.canRetry() ? ToolMetrics.RETRY : ToolMetrics.ERROR;
            log.debug("Tool {} failed: {}", tool.fullyQualifiedName(), e.getMessage());
        } else {
            var developerMessage = error instanceof TimeoutException
                    ? "Tool did not complete within " + timeout.toMillis() + "ms"
                    : error.toString();
            callError = new ToolCallError("Error in execution of tool '" + tool.name() + "'",
                    developerMessage, false, null, null);
            outcome = ToolMetrics.ERROR;
            log.warn("Tool {} failed unexpectedly", tool.fullyQualifiedName(), error);
        }
        metrics.record(tool.fullyQualifiedName(), outcome, elapsedNanos);
        return new InvocationResponse(ctx.invocationId(), millis(elapsedNanos), finishedAt(), false,
                ToolCallOutput.ofError(callError));
    }

    @Override
    public void close() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private boolean limited() {
        return !timeout.isZero() && !timeout.isNegative();
    }

    private static ThreadFactory workerThreads() {
        var counter = new AtomicInteger();
        return r -> {
            var t = new Thread(r, "tool-worker-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    private static Throwable unwrap(Throwable error) {
        var current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private String finishedAt() {
        return Instant.now(clock).toString();
    }

    private static double millis(long nanos) {
        return nanos / 1_000_000.0;
    }
}
