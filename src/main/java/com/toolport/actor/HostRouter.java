package com.toolport.actor;

/**
 * Binding to a concrete transport. Implementations translate host requests
 * into {@link RequestData}, answer 400 for malformed bodies and write the
 * {@link ActorResponse} back.
 */
public interface HostRouter {
    void addRoute(String method, String path, RouteHandler handler);
}
