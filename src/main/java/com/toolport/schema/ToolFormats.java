package com.toolport.schema;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Renders a {@link ToolDefinition} in third-party function-calling formats. */
public final class ToolFormats {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ToolFormats() {}

    /**
     * OpenAI function-calling form. The function name joins toolkit and tool
     * with an underscore since dots are not allowed there.
     */
    public static ObjectNode toOpenAiFunction(ToolDefinition definition) {
        var properties = MAPPER.createObjectNode();
        var required = MAPPER.createArrayNode();
        for (var p : definition.inputs().parameters()) {
            var property = properties.putObject(p.name());
            var jsonType = jsonSchemaType(p.valueSchema().valType());
            if (jsonType != null) {
                property.put("type", jsonType);
            }
            property.put("description", p.description());
            if (p.valueSchema().enumValues() != null) {
                var values = property.putArray("enum");
                p.valueSchema().enumValues().forEach(values::add);
            }
            if (p.required()) {
                required.add(p.name());
            }
        }

        var root = MAPPER.createObjectNode();
        root.put("type", "function");
        var function = root.putObject("function");
        function.put("name", definition.toolkit() + "_" + definition.name());
        function.put("description", definition.description());
        var parameters = function.putObject("parameters");
        parameters.put("type", "object");
        parameters.set("properties", properties);
        parameters.set("required", required);
        parameters.put("additionalProperties", false);
        return root;
    }

    // json values have no single JSON Schema type
    private static String jsonSchemaType(WireType type) {
        return switch (type) {
            case STRING -> "string";
            case INTEGER -> "integer";
            case FLOAT -> "number";
            case BOOLEAN -> "boolean";
            case JSON -> null;
        };
    }
}
