package com.toolport.catalog;

import com.toolport.schema.ParameterBinding;
import com.toolport.schema.ToolDefinition;
import com.toolport.tools.ToolSpec;

import java.lang.reflect.Method;
import java.util.List;

/**
 * A registered tool: the callable, its wire contract, and how wire inputs map
 * onto its parameters.
 */
public record MaterializedTool(
    ToolSpec spec,
    ToolDefinition definition,
    List<ParameterBinding> bindings,
    ToolMeta meta
) {

    public MaterializedTool {
        bindings = List.copyOf(bindings);
    }

    public String name() {
        return definition.name();
    }

    public String version() {
        return definition.version();
    }

    public String fullyQualifiedName() {
        return definition.fullyQualifiedName();
    }

    public Object target() {
        return spec.target();
    }

    public Method method() {
        return spec.method();
    }
}
