/*
 * Copyright 2025 Mark Andrew Ray-Smith Cityline Ltd
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package dev.mars.folio.server;

import dev.mars.folio.server.config.FolioServerConfig;
import dev.mars.folio.server.config.FolioServerOptions;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * Entry point for the Folio report server.
 *
 * <p>Reads {@link FolioServerConfig}, deploys a {@link FolioServerVerticle} and closes Vert.x on
 * JVM shutdown.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class FolioServer {

    private static final Logger logger = LoggerFactory.getLogger(FolioServer.class);
    private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

    public static void main(String[] args) {
        FolioServerConfig config = FolioServerConfig.get();
        try {
            config.validate();
        } catch (IllegalStateException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            System.exit(1);
        }

        Vertx vertx = Vertx.vertx();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received, stopping Folio server...");
            try {
                vertx.close().toCompletionStage().toCompletableFuture()
                        .get(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
            } catch (Exception e) {
                logger.warn("Error during shutdown: {}", e.getMessage());
            }
        }));

        vertx.deployVerticle(new FolioServerVerticle(FolioServerOptions.fromConfig(config)))
                .onSuccess(id -> logger.info("Folio server deployed ({})", id))
                .onFailure(err -> {
                    logger.error("Failed to start Folio server", err);
                    vertx.close();
                    System.exit(1);
                });
    }
}
