package com.toolport.schema;

import java.util.List;

/** Everything inferred from one tool method. */
public record ToolSchema(
    List<InputParameter> inputs,
    OutputSpec output,
    AuthRequirement authRequirement,
    List<ParameterBinding> bindings
) {

    public ToolSchema {
        inputs = List.copyOf(inputs);
        bindings = List.copyOf(bindings);
    }
}
