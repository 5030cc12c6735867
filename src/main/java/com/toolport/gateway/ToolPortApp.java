package com.toolport.gateway;

import com.toolport.actor.ToolActor;
import com.toolport.actor.http.HttpServerRouter;
import com.toolport.catalog.ToolCatalog;
import com.toolport.executor.ToolExecutor;
import com.toolport.observability.ToolMetrics;
import com.toolport.shared.config.ActorConfig;
import com.toolport.shared.config.ConfigLoader;
import com.toolport.shared.config.ToolPortConfig;
import com.toolport.toolkits.math.MathTools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.io.IOException;
import java.time.Clock;
import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.toolport")
public class ToolPortApp {

    private static final Logger log = LoggerFactory.getLogger(ToolPortApp.class);

    public static void main(String[] args) throws IOException {
        var config = ConfigLoader.load();

        if (ActorConfig.HOST_PLAIN.equalsIgnoreCase(config.actor().host())) {
            runPlain(config);
            return;
        }
        var app = new SpringApplication(ToolPortApp.class);
        app.setDefaultProperties(Map.of("server.port", config.actor().port()));
        app.run(args);
    }

    private static void runPlain(ToolPortConfig config) throws IOException {
        var executor = createExecutor(config, new ToolMetrics());
        var actor = createActor(config, executor);
        var router = new HttpServerRouter("0.0.0.0", config.actor().port(), config.executor().threads());
        actor.registerRoutes(router);
        router.start();
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            router.close();
            executor.close();
        }, "http-close"));
    }

    static ToolCatalog defaultCatalog() {
        var catalog = new ToolCatalog();
        catalog.addToolkit(MathTools.toolkit());
        return catalog;
    }

    static ToolExecutor createExecutor(ToolPortConfig config, ToolMetrics metrics) {
        return new ToolExecutor(metrics, Clock.systemUTC(), config.executor().timeout());
    }

    static ToolActor createActor(ToolPortConfig config, ToolExecutor executor) {
        var catalog = defaultCatalog();
        log.info("Serving {} tools", catalog.size());
        return new ToolActor(catalog, executor, config.actor());
    }
}
