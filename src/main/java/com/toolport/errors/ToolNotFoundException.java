package com.toolport.errors;

public class ToolNotFoundException extends RuntimeException {

    public ToolNotFoundException(String name, String version) {
        super(version == null
                ? "Tool " + name + " not found"
                : "Tool " + name + " version " + version + " not found");
    }
}
