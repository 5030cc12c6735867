package com.toolport.actor;

import com.toolport.actor.components.CallToolComponent;
import com.toolport.actor.components.CatalogComponent;
import com.toolport.actor.components.HealthCheckComponent;
import com.toolport.actor.components.ToolDefinitionComponent;
import com.toolport.auth.SharedSecretAuthenticator;
import com.toolport.catalog.ToolCatalog;
import com.toolport.catalog.ToolSummary;
import com.toolport.executor.ToolExecutor;
import com.toolport.shared.config.ActorConfig;
import com.toolport.shared.model.HealthStatus;
import com.toolport.shared.model.InvocationRequest;
import com.toolport.shared.model.InvocationResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;

/**
 * Exposes a catalog and an executor as worker routes on any host transport.
 * The secret is resolved once here: the configured value, then
 * {@code TOOLPORT_ACTOR_SECRET}.
 */
public class ToolActor {

    private static final Logger log = LoggerFactory.getLogger(ToolActor.class);

    public static final String SECRET_ENV = "TOOLPORT_ACTOR_SECRET";

    private final ToolCatalog catalog;
    private final ToolExecutor executor;
    private final ActorConfig config;
    private final SharedSecretAuthenticator authenticator;
    private final List<ActorComponent> components;

    public ToolActor(ToolCatalog catalog, ToolExecutor executor, ActorConfig config) {
        this(catalog, executor, config, System::getenv);
    }

    public ToolActor(ToolCatalog catalog, ToolExecutor executor, ActorConfig config, Function<String, String> env) {
        this.catalog = catalog;
        this.executor = executor;
        this.config = config;
        this.authenticator = config.disableAuth() ? null : new SharedSecretAuthenticator(resolveSecret(config, env));
        if (config.disableAuth()) {
            log.warn("Authentication is disabled; every route under {} is open", config.basePath());
        }
        this.components = List.of(
                new CatalogComponent(this),
                new CallToolComponent(this),
                new HealthCheckComponent(this),
                new ToolDefinitionComponent(this));
    }

    private static String resolveSecret(ActorConfig config, Function<String, String> env) {
        if (config.secret() != null && !config.secret().isBlank()) {
            return config.secret();
        }
        var fromEnv = env.apply(SECRET_ENV);
        if (fromEnv != null && !fromEnv.isBlank()) {
            return fromEnv;
        }
        throw new IllegalStateException("No secret set for the actor. Set actor.secret in the config or "
                + SECRET_ENV + " in the environment.");
    }

    public void registerRoutes(HostRouter host) {
        var router = new AuthenticatingRouter(host, config.basePath(), authenticator);
        for (var component : components) {
            component.register(router);
        }
        log.info("Actor routes registered under {} ({} tools)", config.basePath(), catalog.size());
    }

    public List<ToolSummary> listTools() {
        return catalog.list();
    }

    /** Looks the tool up and runs it. Unknown tools raise {@link com.toolport.errors.ToolNotFoundException}. */
    public CompletableFuture<InvocationResponse> callTool(InvocationRequest request) {
        var ref = request.tool();
        var tool = catalog.get(ref.name(), ref.version());
        return executor.run(tool, request.inputs(), request.toolContext());
    }

    public HealthStatus healthCheck() {
        return HealthStatus.ok(catalog.size());
    }

    public ToolCatalog catalog() {
        return catalog;
    }

    public boolean catalogRequiresAuth() {
        return config.catalogRequiresAuth();
    }
}
