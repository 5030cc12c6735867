package com.toolport.actor;

/** What components register their routes on. Paths are relative to the actor's base path. */
public interface Router {
    void addRoute(String method, String path, RouteHandler handler, boolean requireAuth);
}
