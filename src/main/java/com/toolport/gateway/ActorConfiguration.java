package com.toolport.gateway;

import com.toolport.actor.ToolActor;
import com.toolport.executor.ToolExecutor;
import com.toolport.observability.ToolMetrics;
import com.toolport.shared.config.ConfigLoader;
import com.toolport.shared.config.ToolPortConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.ServerResponse;

@Configuration
public class ActorConfiguration {

    @Bean
    public ToolPortConfig toolPortConfig() {
        return ConfigLoader.load();
    }

    @Bean
    public ToolMetrics toolMetrics() {
        return new ToolMetrics();
    }

    @Bean
    public ToolExecutor toolExecutor(ToolPortConfig config, ToolMetrics metrics) {
        return ToolPortApp.createExecutor(config, metrics);
    }

    @Bean
    public ToolActor toolActor(ToolPortConfig config, ToolExecutor executor) {
        return ToolPortApp.createActor(config, executor);
    }

    @Bean
    public RouterFunction<ServerResponse> actorRoutes(ToolActor actor) {
        var router = new SpringRouter();
        actor.registerRoutes(router);
        return router.build();
    }
}
