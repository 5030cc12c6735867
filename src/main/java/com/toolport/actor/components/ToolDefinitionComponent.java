package com.toolport.actor.components;

import com.toolport.actor.ActorComponent;
import com.toolport.actor.ActorException;
import com.toolport.actor.ActorResponse;
import com.toolport.actor.RequestData;
import com.toolport.actor.Router;
import com.toolport.actor.ToolActor;
import com.toolport.schema.ToolFormats;

/**
 * {@code GET /tools/definition?name=&version=&format=}. Format is
 * {@code toolport} (default) or {@code openai}.
 */
public class ToolDefinitionComponent implements ActorComponent {

    private final ToolActor actor;

    public ToolDefinitionComponent(ToolActor actor) {
        this.actor = actor;
    }

    @Override
    public void register(Router router) {
        router.addRoute("GET", "/tools/definition", this, actor.catalogRequiresAuth());
    }

    @Override
    public ActorResponse handle(RequestData request) {
        var name = request.queryParam("name");
        if (name == null || name.isBlank()) {
            throw new ActorException(400, "Query parameter 'name' is required");
        }
        var version = request.queryParam("version");
        var tool = actor.catalog().find(name, version)
                .orElseThrow(() -> new ActorException(404, "Tool " + name + " not found"));

        var format = request.queryParam("format");
        if (format == null || format.isBlank() || "toolport".equalsIgnoreCase(format)) {
            return ActorResponse.ok(tool.definition());
        }
        if ("openai".equalsIgnoreCase(format)) {
            return ActorResponse.ok(ToolFormats.toOpenAiFunction(tool.definition()));
        }
        throw new ActorException(400, "Unknown format: " + format);
    }
}
