package com.toolport.errors;

import java.lang.reflect.Type;

public class UnsupportedParameterTypeException extends ToolDefinitionException {

    private final transient Type type;

    public UnsupportedParameterTypeException(Type type) {
        super("Unsupported parameter type: " + type.getTypeName());
        this.type = type;
    }

    public Type type() {
        return type;
    }
}
