package com.toolport.shared.config;

/**
 * @param secret shared worker secret; null falls back to {@code TOOLPORT_ACTOR_SECRET}
 * @param host   {@code spring} or {@code plain}
 */
public record ActorConfig(
    String basePath,
    String secret,
    boolean disableAuth,
    boolean catalogRequiresAuth,
    String host,
    int port
) {
    public static final String HOST_SPRING = "spring";
    public static final String HOST_PLAIN = "plain";

    public static ActorConfig defaults() {
        return new ActorConfig("/actor", null, false, true, HOST_SPRING, 8002);
    }

    public ActorConfig withSecret(String secret) {
        return new ActorConfig(basePath, secret, disableAuth, catalogRequiresAuth, host, port);
    }
}
