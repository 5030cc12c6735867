package com.toolport.actor.components;

import com.toolport.actor.ActorComponent;
import com.toolport.actor.ActorResponse;
import com.toolport.actor.RequestData;
import com.toolport.actor.Router;
import com.toolport.actor.ToolActor;

/** {@code GET /tools}: the catalog listing. */
public class CatalogComponent implements ActorComponent {

    private final ToolActor actor;

    public CatalogComponent(ToolActor actor) {
        this.actor = actor;
    }

    @Override
    public void register(Router router) {
        router.addRoute("GET", "/tools", this, actor.catalogRequiresAuth());
    }

    @Override
    public ActorResponse handle(RequestData request) {
        return ActorResponse.ok(actor.listTools());
    }
}
