package com.toolport.gateway;

import com.toolport.actor.ActorException;
import com.toolport.actor.ActorResponse;
import com.toolport.actor.HostRouter;
import com.toolport.actor.RequestData;
import com.toolport.actor.RouteHandler;
import jakarta.servlet.ServletException;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.RequestPredicates;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import java.io.IOException;
import java.util.LinkedHashMap;

/** Host binding on Spring WebMvc functional routes. */
public class SpringRouter implements HostRouter {

    private final RouterFunctions.Builder routes = RouterFunctions.route();

    @Override
    public void addRoute(String method, String path, RouteHandler handler) {
        routes.route(RequestPredicates.method(HttpMethod.valueOf(method)).and(RequestPredicates.path(path)),
                request -> handle(request, handler));
    }

    public RouterFunction<ServerResponse> build() {
        return routes.build();
    }

    ServerResponse handle(ServerRequest request, RouteHandler handler) throws ServletException, IOException {
        ActorResponse response;
        try {
            response = handler.handle(toRequestData(request));
        } catch (ActorException e) {
            response = ActorResponse.error(e.status(), e.getMessage());
        }
        return ServerResponse.status(response.status())
                .contentType(MediaType.APPLICATION_JSON)
                .body(response.bodyAsString());
    }

    private static RequestData toRequestData(ServerRequest request) throws ServletException, IOException {
        var query = new LinkedHashMap<String, String>();
        request.params().forEach((name, values) -> {
            if (!values.isEmpty()) query.put(name, values.get(0));
        });
        var body = HttpMethod.GET.equals(request.method()) ? null : request.body(String.class);
        return RequestData.of(request.path(), request.method().name(),
                request.headers().asHttpHeaders().toSingleValueMap(), query, body);
    }
}
