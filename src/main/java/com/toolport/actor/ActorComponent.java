package com.toolport.actor;

public interface ActorComponent extends RouteHandler {
    void register(Router router);
}
