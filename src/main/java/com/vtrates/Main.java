package com.vtrates;

import com.vtrates.adapter.in.web.HttpServerVerticle;
import com.vtrates.infrastructure.config.ConfigLoader;
import com.vtrates.infrastructure.config.ParserConfig;
import io.vertx.core.DeploymentOptions;
import io.vertx.core.Vertx;
import io.vertx.core.VertxOptions;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Main application entry point
 */
@Slf4j
public class Main {

    public static void main(String[] args) {
        log.info("Starting ValutaTrade Rates Service...");

        ParserConfig config;
        try {
            config = ConfigLoader.load();
        } catch (IllegalArgumentException e) {
            log.error("Configuration error: {}", e.getMessage());
            System.exit(1);
            return;
        }

        writePidToFile(config.storage().dataDir());

        VertxOptions options = new VertxOptions()
                .setWorkerPoolSize(4)
                .setEventLoopPoolSize(2);

        Vertx vertx = Vertx.vertx(options);

        vertx.deployVerticle(new HttpServerVerticle(config), new DeploymentOptions().setInstances(1))
                .onSuccess(deploymentId -> {
                    log.info("HTTP Server Verticle deployed successfully: {}", deploymentId);

                    Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                        log.info("Shutting down ValutaTrade Rates Service...");
                        vertx.close().toCompletionStage().toCompletableFuture().join();
                    }));

                    log.info("ValutaTrade Rates Service is ready!");
                    log.info("Rates: http://localhost:{}/api/rates", config.httpPort());
                    log.info("Health Check: http://localhost:{}/health", config.httpPort());
                })
                .onFailure(error -> {
                    log.error("Failed to deploy HTTP Server Verticle", error);
                    vertx.close();
                });
    }

    /**
     * Write the current process PID next to the rate files for process management
     */
    private static void writePidToFile(Path dataDir) {
        String pid = String.valueOf(ProcessHandle.current().pid());
        try {
            Files.createDirectories(dataDir);
            Files.writeString(dataDir.resolve("app.pid"), pid, StandardCharsets.UTF_8);
            log.info("PID written to {}: {}", dataDir.resolve("app.pid"), pid);
        } catch (IOException e) {
            log.warn("Failed to write PID to file: {}", e.getMessage());
        }
    }
}
