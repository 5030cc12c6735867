package com.toolport.actor.http;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import com.toolport.actor.ActorException;
import com.toolport.actor.ActorResponse;
import com.toolport.actor.HostRouter;
import com.toolport.actor.RequestData;
import com.toolport.actor.RouteHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/** Host binding on the JDK's built-in HTTP server. */
public class HttpServerRouter implements HostRouter, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServerRouter.class);

    private final HttpServer server;
    private final ExecutorService pool;
    // path -> method -> handler
    private final Map<String, Map<String, RouteHandler>> routes = new ConcurrentHashMap<>();

    /** Port 0 picks a free port; see {@link #port()}. */
    public HttpServerRouter(String host, int port, int threads) throws IOException {
        this.server = HttpServer.create(new InetSocketAddress(host, port), 0);
        this.pool = Executors.newFixedThreadPool(Math.max(1, threads));
        server.setExecutor(pool);
        server.createContext("/", this::handle);
    }

    @Override
    public void addRoute(String method, String path, RouteHandler handler) {
        routes.computeIfAbsent(normalize(path), p -> new ConcurrentHashMap<>())
                .put(method.toUpperCase(Locale.ROOT), handler);
    }

    public void start() {
        server.start();
        log.info("Listening on {}", server.getAddress());
    }

    public int port() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(0);
        pool.shutdown();
    }

    private void handle(HttpExchange exchange) throws IOException {
        try {
            var path = normalize(exchange.getRequestURI().getPath());
            var method = exchange.getRequestMethod().toUpperCase(Locale.ROOT);
            ActorResponse response;
            var byMethod = routes.get(path);
            if (byMethod == null) {
                response = ActorResponse.error(404, "Not found");
            } else if (!byMethod.containsKey(method)) {
                response = ActorResponse.error(405, "Method not allowed");
            } else {
                response = dispatch(exchange, path, method, byMethod.get(method));
            }
            write(exchange, response);
        } finally {
            exchange.close();
        }
    }

    private ActorResponse dispatch(HttpExchange exchange, String path, String method, RouteHandler handler)
            throws IOException {
        var headers = new LinkedHashMap<String, String>();
        exchange.getRequestHeaders().forEach((name, values) -> {
            if (!values.isEmpty()) headers.put(name, values.get(0));
        });
        var body = new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8);
        try {
            var request = RequestData.of(path, method, headers,
                    RequestData.parseQuery(exchange.getRequestURI().getRawQuery()), body);
            return handler.handle(request);
        } catch (ActorException e) {
            return ActorResponse.error(e.status(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unhandled failure on {} {}", method, path, e);
            return ActorResponse.error(500, "Internal server error");
        }
    }

    private static void write(HttpExchange exchange, ActorResponse response) throws IOException {
        var bytes = response.bodyAsString().getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(response.status(), bytes.length);
        try (var out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private static String normalize(String path) {
        if (path == null || path.isEmpty()) return "/";
        return path.length() > 1 && path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
