package com.toolport.actor;

import com.toolport.auth.SharedSecretAuthenticator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Prefixes component routes with the base path and runs the secret check
 * once per request, before the body is parsed or the component sees it.
 */
class AuthenticatingRouter implements Router {

    private static final Logger log = LoggerFactory.getLogger(AuthenticatingRouter.class);

    private final HostRouter host;
    private final String basePath;
    private final SharedSecretAuthenticator authenticator;

    /** @param authenticator null when authentication is disabled */
    AuthenticatingRouter(HostRouter host, String basePath, SharedSecretAuthenticator authenticator) {
        this.host = host;
        this.basePath = normalize(basePath);
        this.authenticator = authenticator;
    }

    @Override
    public void addRoute(String method, String path, RouteHandler handler, boolean requireAuth) {
        var fullPath = basePath + (path.startsWith("/") ? path : "/" + path);
        host.addRoute(method, fullPath, request -> dispatch(request, handler, requireAuth));
        log.debug("Route {} {} (auth: {})", method, fullPath, requireAuth && authenticator != null);
    }

    private ActorResponse dispatch(RequestData request, RouteHandler handler, boolean requireAuth) {
        if (requireAuth && authenticator != null
                && !authenticator.authenticate(request.header("Authorization"))) {
            log.debug("Rejected unauthenticated {} {}", request.method(), request.path());
            return ActorResponse.unauthorized();
        }
        try {
            return handler.handle(request.parseBody());
        } catch (ActorException e) {
            return ActorResponse.error(e.status(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Failed to handle {} {}", request.method(), request.path(), e);
            return ActorResponse.error(500, "Internal server error");
        }
    }

    private static String normalize(String basePath) {
        if (basePath == null || basePath.isBlank() || "/".equals(basePath)) {
            return "";
        }
        var path = basePath.startsWith("/") ? basePath : "/" + basePath;
        return path.endsWith("/") ? path.substring(0, path.length() - 1) : path;
    }
}
