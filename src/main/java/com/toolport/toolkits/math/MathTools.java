package com.toolport.toolkits.math;

import com.toolport.errors.ToolExecutionException;
import com.toolport.tools.Param;
import com.toolport.tools.Tool;
import com.toolport.tools.Toolkit;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/** Sample toolkit served by the bundled application. */
public final class MathTools {

    public static final String NAME = "Math";
    public static final String VERSION = "0.1.0";

    private MathTools() {}

    public static Toolkit toolkit() {
        return Toolkit.scan(NAME, VERSION, MathTools.class);
    }

    @Tool(description = "Add two numbers together", returns = "The sum of the two numbers")
    public static long add(@Param("The first number") long a,
                           @Param("The second number") long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw overflow("add", e);
        }
    }

    @Tool(description = "Subtract b from a", returns = "The difference")
    public static long subtract(@Param("The number to subtract from") long a,
                                @Param("The number to subtract") long b) {
        try {
            return Math.subtractExact(a, b);
        } catch (ArithmeticException e) {
            throw overflow("subtract", e);
        }
    }

    @Tool(description = "Multiply two numbers together", returns = "The product of the two numbers")
    public static long multiply(@Param("The first number") long a,
                                @Param("The second number") long b) {
        try {
            return Math.multiplyExact(a, b);
        } catch (ArithmeticException e) {
            throw overflow("multiply", e);
        }
    }

    private static ToolExecutionException overflow(String operation, ArithmeticException e) {
        return new ToolExecutionException("The result is too large", operation + " overflowed a 64-bit integer", e);
    }

    @Tool(description = "Divide a by b", returns = "The quotient")
    public static double divide(@Param("The dividend") double a,
                                @Param("The divisor") double b) {
        if (b == 0) {
            throw new ToolExecutionException("Cannot divide by zero", "divide called with b = 0");
        }
        return a / b;
    }

    @Tool(description = "Get the square root of a number", returns = "The square root")
    public static CompletableFuture<Double> sqrtAsync(@Param("The number to take the square root of") double a) {
        if (a < 0) {
            return CompletableFuture.failedFuture(
                    new ToolExecutionException("Cannot take the square root of a negative number"));
        }
        return CompletableFuture.supplyAsync(() -> Math.sqrt(a));
    }

    @Tool(description = "Sum a list of numbers", returns = "The sum of the numbers")
    public static long sum(@Param("The numbers to sum") List<Long> numbers) {
        return numbers.stream().mapToLong(Long::longValue).sum();
    }

    @Tool(description = "Round a number to a given number of decimal places", returns = "The rounded number")
    public static double round(@Param("The number to round") double value,
                               @Param(value = "Number of decimal places", defaultValue = "0") int digits) {
        return BigDecimal.valueOf(value).setScale(digits, RoundingMode.HALF_UP).doubleValue();
    }
}
