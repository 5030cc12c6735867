package com.toolport.catalog;

import com.toolport.errors.ToolDefinitionException;
import com.toolport.errors.ToolNotFoundException;
import com.toolport.schema.SchemaInference;
import com.toolport.schema.ToolDefinition;
import com.toolport.schema.ToolInputs;
import com.toolport.schema.ToolRequirements;
import com.toolport.tools.ToolSpec;
import com.toolport.tools.Toolkit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Method;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of materialized tools keyed by (name, version). Filled during
 * startup and only read afterwards.
 */
public class ToolCatalog implements Iterable<MaterializedTool> {

    private static final Logger log = LoggerFactory.getLogger(ToolCatalog.class);

    public static final String DEFAULT_TOOLKIT = "Tools";

    private final Map<ToolKey, MaterializedTool> tools = new LinkedHashMap<>();
    // name -> version -> tool; insertion order doubles as registration recency
    private final Map<String, LinkedHashMap<String, MaterializedTool>> byName = new HashMap<>();
    private final Clock clock;

    public ToolCatalog() {
        this(Clock.systemUTC());
    }

    public ToolCatalog(Clock clock) {
        this.clock = clock;
    }

    public MaterializedTool addTool(ToolSpec spec) {
        return addTool(spec, DEFAULT_TOOLKIT);
    }

    public MaterializedTool addTool(ToolSpec spec, String toolkitName) {
        return register(spec, toolkitName, Toolkit.DEFAULT_VERSION);
    }

    public MaterializedTool addTool(Object target, Method method) {
        return addTool(ToolSpec.of(target, method));
    }

    public MaterializedTool addTool(Object target, Method method, String toolkitName) {
        return addTool(ToolSpec.of(target, method), toolkitName);
    }

    public void addToolkit(Toolkit toolkit) {
        for (var spec : toolkit.tools()) {
            register(spec, toolkit.name(), toolkit.version());
        }
        log.info("Registered toolkit {} {} ({} tools)", toolkit.name(), toolkit.version(), toolkit.tools().size());
    }

    private synchronized MaterializedTool register(ToolSpec spec, String toolkit, String version) {
        var name = spec.name();
        if (name == null || name.isBlank()) {
            throw new ToolDefinitionException("Tool name cannot be empty: " + spec.method());
        }
        if (name.contains(".")) {
            throw new ToolDefinitionException("Tool name cannot contain '.': " + name);
        }
        if (spec.description() == null || spec.description().isBlank()) {
            throw new ToolDefinitionException("Tool " + name + " is missing a description");
        }
        if (toolkit == null || toolkit.isBlank()) {
            toolkit = DEFAULT_TOOLKIT;
        }

        var schema = SchemaInference.infer(spec);
        var definition = new ToolDefinition(
                name,
                spec.description(),
                version,
                toolkit,
                new ToolInputs(schema.inputs()),
                schema.output(),
                schema.authRequirement() != null
                        ? new ToolRequirements(schema.authRequirement())
                        : ToolRequirements.NONE);

        var key = new ToolKey(name, version);
        var now = Instant.now(clock);
        var added = now;
        var existing = tools.get(key);
        if (existing != null) {
            if (!existing.definition().toolkit().equals(toolkit)) {
                throw new ToolDefinitionException("Tool " + name + " version " + version
                        + " is already registered by toolkit " + existing.definition().toolkit());
            }
            log.warn("Overwriting tool {} version {}", definition.fullyQualifiedName(), version);
            added = existing.meta().dateAdded();
            tools.remove(key);
        }

        var tool = new MaterializedTool(spec, definition, schema.bindings(),
                new ToolMeta(toolkit, spec.declaringClass().getName(), added, now));
        tools.put(key, tool);
        var versions = byName.computeIfAbsent(name, n -> new LinkedHashMap<>());
        versions.remove(version);
        versions.put(version, tool);
        log.debug("Registered tool {} version {}", definition.fullyQualifiedName(), version);
        return tool;
    }

    /**
     * Looks a tool up by plain or {@code Toolkit.Tool} name. Without a version
     * the only registered version wins, then {@code default}, then the most
     * recently registered one.
     */
    public synchronized Optional<MaterializedTool> find(String name, String version) {
        if (name == null || name.isBlank()) {
            return Optional.empty();
        }
        String toolkit = null;
        var dot = name.lastIndexOf('.');
        if (dot >= 0) {
            toolkit = name.substring(0, dot);
            name = name.substring(dot + 1);
        }

        var versions = byName.get(name);
        if (versions == null) {
            return Optional.empty();
        }
        if (version != null && !version.isBlank()) {
            var tool = versions.get(version);
            return tool != null && (toolkit == null || tool.definition().toolkit().equals(toolkit))
                    ? Optional.of(tool)
                    : Optional.empty();
        }

        var candidates = new ArrayList<MaterializedTool>();
        for (var tool : versions.values()) {
            if (toolkit == null || tool.definition().toolkit().equals(toolkit)) {
                candidates.add(tool);
            }
        }
        if (candidates.size() <= 1) {
            return candidates.stream().findFirst();
        }
        return candidates.stream()
                .filter(t -> Toolkit.DEFAULT_VERSION.equals(t.version()))
                .findFirst()
                .or(() -> Optional.of(candidates.get(candidates.size() - 1)));
    }

    public MaterializedTool get(String name) {
        return get(name, null);
    }

    public MaterializedTool get(String name, String version) {
        return find(name, version).orElseThrow(() -> new ToolNotFoundException(name, version));
    }

    public boolean contains(String name) {
        return find(name, null).isPresent();
    }

    public synchronized int size() {
        return tools.size();
    }

    @Override
    public synchronized Iterator<MaterializedTool> iterator() {
        return List.copyOf(tools.values()).iterator();
    }

    public synchronized List<ToolSummary> list() {
        return tools.values().stream()
                .map(t -> new ToolSummary(
                        t.name(),
                        t.definition().description(),
                        t.version(),
                        "/tool/" + t.definition().toolkit() + "/" + t.name()))
                .toList();
    }

    public synchronized List<ToolDefinition> definitions() {
        return tools.values().stream().map(MaterializedTool::definition).toList();
    }

    private record ToolKey(String name, String version) {}
}
