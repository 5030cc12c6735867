package com.toolport.tools;

import java.util.ArrayList;
import java.util.List;

/**
 * A named, versioned collection of tools registered together. Every tool in
 * the kit carries the kit's version.
 */
public record Toolkit(
    String name,
    String version,
    String description,
    List<ToolSpec> tools
) {

    public static final String DEFAULT_VERSION = "default";

    public Toolkit {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Toolkit name cannot be empty");
        }
        version = version == null || version.isBlank() ? DEFAULT_VERSION : version;
        tools = List.copyOf(tools);
    }

    /** Builds a toolkit from every {@link Tool} method found on the targets. */
    public static Toolkit scan(String name, String version, Object... targets) {
        var tools = new ArrayList<ToolSpec>();
        for (var target : targets) {
            tools.addAll(ToolSpec.scan(target));
        }
        return new Toolkit(name, version, null, tools);
    }
}
