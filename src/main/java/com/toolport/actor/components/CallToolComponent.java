package com.toolport.actor.components;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.toolport.actor.ActorComponent;
import com.toolport.actor.ActorException;
import com.toolport.actor.ActorResponse;
import com.toolport.actor.RequestData;
import com.toolport.actor.Router;
import com.toolport.actor.ToolActor;
import com.toolport.errors.ToolNotFoundException;
import com.toolport.shared.model.InvocationRequest;

/**
 * {@code POST /tools/invoke}. Tool failures come back as 200 with
 * {@code success: false}; only a bad envelope or an unknown tool changes the
 * status.
 */
public class CallToolComponent implements ActorComponent {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ToolActor actor;

    public CallToolComponent(ToolActor actor) {
        this.actor = actor;
    }

    @Override
    public void register(Router router) {
        router.addRoute("POST", "/tools/invoke", this, true);
    }

    @Override
    public ActorResponse handle(RequestData request) {
        if (request.bodyJson() == null || !request.bodyJson().isObject()) {
            throw new ActorException(400, "Request body must be a JSON object");
        }
        InvocationRequest invocation;
        try {
            invocation = MAPPER.treeToValue(request.bodyJson(), InvocationRequest.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ActorException(400, "Invalid invocation request", e);
        }
        if (invocation.tool() == null || invocation.tool().name() == null || invocation.tool().name().isBlank()) {
            throw new ActorException(400, "Invocation request is missing the tool name");
        }

        try {
            return ActorResponse.ok(actor.callTool(invocation).join());
        } catch (ToolNotFoundException e) {
            throw new ActorException(404, e.getMessage(), e);
        }
    }
}
