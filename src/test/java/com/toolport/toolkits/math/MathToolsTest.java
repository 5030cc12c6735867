package com.toolport.toolkits.math;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolport.catalog.ToolCatalog;
import com.toolport.catalog.ToolSummary;
import com.toolport.executor.ToolExecutor;
import com.toolport.schema.InputParameter;
import com.toolport.shared.model.InvocationResponse;
import com.toolport.tools.ToolContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class MathToolsTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ToolCatalog catalog;
    private ToolExecutor executor;

    @BeforeEach
    void setUp() {
        catalog = new ToolCatalog();
        catalog.addToolkit(MathTools.toolkit());
        executor = new ToolExecutor();
    }

    private InvocationResponse call(String tool, String inputs) throws Exception {
        return executor.run(catalog.get(tool), MAPPER.readTree(inputs), ToolContext.empty("m-1")).join();
    }

    @Test
    void exposesEveryTool() {
        assertThat(catalog.list()).extracting(ToolSummary::name).containsExactlyInAnyOrder(
                "Add", "Subtract", "Multiply", "Divide", "SqrtAsync", "Sum", "Round");
    }

    @Test
    void adds() throws Exception {
        var response = call("Add", "{\"a\": 2, \"b\": 3}");
        assertTrue(response.success());
        assertEquals(5, response.output().value().asLong());
    }

    @Test
    void overflowIsAToolError() throws Exception {
        var sum = call("Add", "{\"a\": 9223372036854775807, \"b\": 1}");
        assertFalse(sum.success());
        assertEquals("The result is too large", sum.output().error().message());
        assertEquals("add overflowed a 64-bit integer", sum.output().error().developerMessage());
        assertFalse(sum.output().error().canRetry());

        assertFalse(call("Subtract", "{\"a\": -9223372036854775808, \"b\": 1}").success());
        assertFalse(call("Multiply", "{\"a\": 4611686018427387904, \"b\": 2}").success());
    }

    @Test
    void divisionByZeroIsAToolError() throws Exception {
        var response = call("Divide", "{\"a\": 1, \"b\": 0}");
        assertFalse(response.success());
        assertEquals("Cannot divide by zero", response.output().error().message());
        assertFalse(response.output().error().canRetry());
    }

    @Test
    void squareRootRunsAsynchronously() throws Exception {
        assertEquals(3.0, call("SqrtAsync", "{\"a\": 9}").output().value().asDouble());
        assertFalse(call("SqrtAsync", "{\"a\": -1}").success());
    }

    @Test
    void sumsAList() throws Exception {
        assertEquals(10, call("Sum", "{\"numbers\": [1, 2, 3, 4]}").output().value().asLong());
        assertFalse(call("Sum", "{\"numbers\": \"1,2\"}").success());
    }

    @Test
    void roundsWithDefaultDigits() throws Exception {
        assertEquals(3.0, call("Round", "{\"value\": 2.6}").output().value().asDouble());
        assertEquals(2.57, call("Round", "{\"value\": 2.567, \"digits\": 2}").output().value().asDouble());
    }

    @Test
    void roundKeepsDigitsOptional() {
        var parameters = catalog.get("Round").definition().inputs().parameters();
        assertEquals(List.of(true, false), parameters.stream().map(InputParameter::required).toList());
    }
}
