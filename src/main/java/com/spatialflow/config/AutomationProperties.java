package com.spatialflow.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralizes engine, region, topic and executor configuration.
 *
 * Bound from application.yml under "spatialflow" prefix:
 *   spatialflow:
 *     engine:
 *       debounce: 300ms
 *       max-stack-depth: 5
 *       recent-event-limit: 50
 *     regions:
 *       auto-grow-padding: 20
 *       default-node-width: 280
 *       default-node-height: 140
 *     topics:
 *       events: spatialflow.events
 *       dlq: spatialflow.events.dlq
 *     executor:
 *       url: http://localhost:8090/api/steps/execute
 *
 * The field defaults are the reference values, so a plain
 * {@code new AutomationProperties()} behaves like the shipped config.
 */
@Component
@ConfigurationProperties(prefix = "spatialflow")
@Getter
@Setter
public class AutomationProperties {

    private Engine engine = new Engine();
    private Regions regions = new Regions();
    private Topics topics = new Topics();
    private Executor executor = new Executor();

    @Getter
    @Setter
    public static class Engine {
        /** Quiet period before a matched rule runs; new matches restart it. */
        private Duration debounce = Duration.ofMillis(300);
        /** Rules that may be executing at once along a trigger chain. */
        private int maxStackDepth = 5;
        private int recentEventLimit = 50;
    }

    @Getter
    @Setter
    public static class Regions {
        private double autoGrowPadding = 20;
        private double defaultNodeWidth = 280;
        private double defaultNodeHeight = 140;
    }

    @Getter
    @Setter
    public static class Topics {
        private String events = "spatialflow.events";
        private String dlq = "spatialflow.events.dlq";
    }

    @Getter
    @Setter
    public static class Executor {
        /** Remote step executor endpoint; blank means none is configured. */
        private String url = "";
        private int poolSize = 4;
    }
}
