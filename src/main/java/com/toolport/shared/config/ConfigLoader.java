package com.toolport.shared.config;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.function.Function;

public class ConfigLoader {

    private static final Path DEFAULT_PATH = Path.of(
        System.getProperty("user.home"), ".toolport", "config.yaml"
    );

    public static ToolPortConfig load() {
        var override = System.getenv("TOOLPORT_CONFIG");
        return load(override != null && !override.isBlank() ? Path.of(override) : DEFAULT_PATH);
    }

    public static ToolPortConfig load(Path path) {
        return load(path, System::getenv);
    }

    @SuppressWarnings("unchecked")
    static ToolPortConfig load(Path path, Function<String, String> env) {
        Map<String, Object> raw;
        if (Files.exists(path)) {
            try (var in = Files.newInputStream(path)) {
                raw = new Yaml().load(in);
                if (raw == null) raw = Map.of();
            } catch (IOException e) {
                throw new UncheckedIOException("Failed to load config: " + path, e);
            }
        } else {
            raw = Map.of();
        }

        var actor = (Map<String, Object>) raw.getOrDefault("actor", Map.of());
        var executor = (Map<String, Object>) raw.getOrDefault("executor", Map.of());
        return new ToolPortConfig(parseActorConfig(actor, env), parseExecutorConfig(executor));
    }

    private static ActorConfig parseActorConfig(Map<String, Object> actor, Function<String, String> env) {
        var defaults = ActorConfig.defaults();
        var secret = actor.get("secret");
        return new ActorConfig(
            String.valueOf(actor.getOrDefault("base-path", defaults.basePath())),
            secret != null ? String.valueOf(secret) : null,
            Boolean.TRUE.equals(actor.getOrDefault("disable-auth", defaults.disableAuth())),
            Boolean.TRUE.equals(actor.getOrDefault("catalog-requires-auth", defaults.catalogRequiresAuth())),
            String.valueOf(actor.getOrDefault("host", defaults.host())),
            Integer.parseInt(envOrDefault(env, "TOOLPORT_PORT",
                String.valueOf(actor.getOrDefault("port", defaults.port()))))
        );
    }

    private static ExecutorConfig parseExecutorConfig(Map<String, Object> executor) {
        var defaults = ExecutorConfig.defaults();
        return new ExecutorConfig(
            Long.parseLong(String.valueOf(executor.getOrDefault("timeout-ms", defaults.timeoutMs()))),
            Integer.parseInt(String.valueOf(executor.getOrDefault("threads", defaults.threads())))
        );
    }

    private static String envOrDefault(Function<String, String> env, String name, String fallback) {
        var val = env.apply(name);
        return val != null ? val : fallback;
    }
}
