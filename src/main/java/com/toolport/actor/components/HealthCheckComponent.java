package com.toolport.actor.components;

import com.toolport.actor.ActorComponent;
import com.toolport.actor.ActorResponse;
import com.toolport.actor.RequestData;
import com.toolport.actor.Router;
import com.toolport.actor.ToolActor;

/** {@code GET /health}. Always open so liveness probes need no secret. */
public class HealthCheckComponent implements ActorComponent {

    private final ToolActor actor;

    public HealthCheckComponent(ToolActor actor) {
        this.actor = actor;
    }

    @Override
    public void register(Router router) {
        router.addRoute("GET", "/health", this, false);
    }

    @Override
    public ActorResponse handle(RequestData request) {
        return ActorResponse.ok(actor.healthCheck());
    }
}
