package com.toolport.actor;

import java.util.LinkedHashMap;
import java.util.Map;

/** In-memory host that dispatches straight to the registered handlers. */
class RecordingRouter implements HostRouter {

    final Map<String, RouteHandler> routes = new LinkedHashMap<>();

    @Override
    public void addRoute(String method, String path, RouteHandler handler) {
        routes.put(method + " " + path, handler);
    }

    ActorResponse call(String method, String path, Map<String, String> headers, String body) {
        return call(method, path, headers, Map.of(), body);
    }

    ActorResponse call(String method, String path, Map<String, String> headers,
                       Map<String, String> query, String body) {
        var handler = routes.get(method + " " + path);
        if (handler == null) {
            return ActorResponse.error(404, "Not found");
        }
        return handler.handle(RequestData.of(path, method, headers, query, body));
    }
}
