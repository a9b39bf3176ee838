package com.yieldsolver;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.yieldsolver.adapter.in.web.HttpServerVerticle;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import io.vertx.core.json.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.FileWriter;
import java.io.IOException;
import java.io.InputStream;
import java.util.Map;

/**
 * Main application entry point
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final String CONFIG_RESOURCE = "application.yml";

    public static void main(String[] args) {
        log.info("Starting Yield Solver...");

        // Write PID to file for easy process management
        writePidToFile();

        // Load configuration from application.yml
        JsonObject config = loadConfig(CONFIG_RESOURCE);
        JsonObject vertxConfig = config.getJsonObject("vertx", new JsonObject());

        // Create Vertx instance with options
        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(vertxConfig.getInteger("worker-pool-size", 10))
                .setEventLoopPoolSize(vertxConfig.getInteger("event-loop-pool-size", 2));

        Vertx vertx = Vertx.vertx(options);

        vertx.deployVerticle(new HttpServerVerticle(), new DeploymentOptions()
                .setConfig(config)
                .setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    // Add shutdown hook
                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down Yield Solver...");
                        vertx.close();
                    }));

                    int port = config.getJsonObject("http", new JsonObject()).getInteger("port", 8080);
                    log.info("Yield Solver is ready!");
                    log.info("API Endpoint: http://localhost:{}/api/irr", port);
                    log.info("Health Check: http://localhost:{}/health", port);
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }

    /**
     * Read a YAML classpath resource into a JsonObject
     */
    static JsonObject loadConfig(String resource) {
        try (InputStream is = Main.class.getClassLoader().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IllegalStateException(resource + " not found in classpath");
            }

            ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
            Map<String, Object> yaml = yamlMapper.readValue(is, new TypeReference<Map<String, Object>>() {});
            JsonObject config = yaml == null ? new JsonObject() : new JsonObject(yaml);

            log.info("Loaded configuration from {}", resource);
            return config;

        } catch (IOException e) {
            log.error("Failed to load {}: {}", resource, e.getMessage());
            throw new IllegalStateException("Configuration error: " + resource + " required", e);
        }
    }

    /**
     * Write the current process PID to a file for easy management
     */
    private static void writePidToFile() {
        try {
            String pid = String.valueOf(ProcessHandle.current().pid());
            try (FileWriter writer = new FileWriter("app.pid")) {
                writer.write(pid);
            }
            log.info("PID written to app.pid: {}", pid);
        } catch (IOException e) {
            log.warn("Failed to write PID to file: {}", e.getMessage());
        }
    }
}
