package com.toolport.actor;

@FunctionalInterface
public interface RouteHandler {
    ActorResponse handle(RequestData request);
}
