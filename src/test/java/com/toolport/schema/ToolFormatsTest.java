package com.toolport.schema;

import com.toolport.catalog.ToolCatalog;
import com.toolport.toolkits.math.MathTools;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToolFormatsTest {

    private ToolCatalog catalog;

    @BeforeEach
    void setUp() {
        catalog = new ToolCatalog();
        catalog.addToolkit(MathTools.toolkit());
    }

    @Test
    void rendersOpenAiFunction() {
        var fn = ToolFormats.toOpenAiFunction(catalog.get("Add").definition());
        assertEquals("function", fn.get("type").asText());
        var function = fn.get("function");
        assertEquals("Math_Add", function.get("name").asText());
        assertEquals("Add two numbers together", function.get("description").asText());

        var parameters = function.get("parameters");
        assertEquals("object", parameters.get("type").asText());
        assertEquals("integer", parameters.at("/properties/a/type").asText());
        assertEquals("The first number", parameters.at("/properties/a/description").asText());
        assertEquals(2, parameters.get("required").size());
        assertFalse(parameters.get("additionalProperties").asBoolean());
    }

    @Test
    void defaultedParametersAreNotRequired() {
        var fn = ToolFormats.toOpenAiFunction(catalog.get("Round").definition());
        var required = fn.at("/function/parameters/required");
        assertEquals(1, required.size());
        assertEquals("value", required.get(0).asText());
        assertEquals("number", fn.at("/function/parameters/properties/value/type").asText());
    }

    @Test
    void jsonParametersHaveNoType() {
        var fn = ToolFormats.toOpenAiFunction(catalog.get("Sum").definition());
        var numbers = fn.at("/function/parameters/properties/numbers");
        assertFalse(numbers.has("type"));
        assertEquals("The numbers to sum", numbers.get("description").asText());
    }
}
