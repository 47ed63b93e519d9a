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

package dev.mars.folio.server.http;

import dev.mars.folio.server.http.handlers.ReportHandler;
import dev.mars.folio.server.service.ReportWorkflowService;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.http.HttpServer;
import io.vertx.core.json.JsonObject;
import io.vertx.ext.web.Router;
import io.vertx.ext.web.handler.BodyHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP front end of the report API.
 *
 * <p>Every request passes the request context handler, the body handler and the drain gate before
 * reaching a route. Failures from any route, and unmatched paths, are rendered by {@link GlobalErrorHandler}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class HttpApiServer {

    private static final Logger logger = LoggerFactory.getLogger(HttpApiServer.class);
    private static final long BODY_LIMIT_BYTES = 1024 * 1024;
    private static final String REPORT_PATH = "/api/v1/reports/:sessionId";
    private static final String SECTION_PATH = REPORT_PATH + "/sections/:sectionId";

    private final Vertx vertx;
    private final String host;
    private final int port;
    private final ReportWorkflowService service;
    private final DrainModeHandler drainModeHandler = new DrainModeHandler();
    private HttpServer httpServer;

    public HttpApiServer(Vertx vertx, String host, int port, ReportWorkflowService service) {
        this.vertx = vertx;
        this.host = host;
        this.port = port;
        this.service = service;
    }

    public Future<Void> start() {
        Router router = Router.router(vertx);
        ReportHandler reports = new ReportHandler(service);
        GlobalErrorHandler errorHandler = new GlobalErrorHandler();

        router.route().handler(new RequestContextHandler());
        router.route().handler(BodyHandler.create().setBodyLimit(BODY_LIMIT_BYTES));
        router.route().handler(drainModeHandler);

        router.get("/health")
                .respond(ctx -> Future.succeededFuture(new JsonObject().put("status", "UP")));

        router.post(REPORT_PATH + "/init").handler(reports.handleInit());
        router.get(REPORT_PATH + "/export").handler(reports.handleExport());
        router.post(REPORT_PATH + "/finalize").handler(reports.handleFinalize());
        router.post(SECTION_PATH + "/generate").handler(reports.handleGenerate());
        router.post(SECTION_PATH + "/review").handler(reports.handleReview());
        router.post(SECTION_PATH + "/reset").handler(reports.handleReset());
        router.get(REPORT_PATH).handler(reports.handleGet());

        router.route().failureHandler(errorHandler);
        router.errorHandler(404, errorHandler);
        router.errorHandler(405, errorHandler);

        httpServer = vertx.createHttpServer()
                .requestHandler(router);

        return httpServer.listen(port, host)
                .onSuccess(server -> logger.info("HTTP API Server listening on {}:{}", host, server.actualPort()))
                .onFailure(err -> logger.error("Failed to start HTTP API Server", err))
                .mapEmpty();
    }

    /**
     * Refuses new report commands from now on. Reads and health checks keep being served.
     */
    public void enterDrainMode() {
        drainModeHandler.enterDrainMode();
    }

    public boolean isDraining() {
        return drainModeHandler.isDraining();
    }

    /**
     * Stops accepting report requests, then closes the listener.
     */
    public Future<Void> stop() {
        enterDrainMode();
        if (httpServer != null) {
            return httpServer.close()
                    .onSuccess(v -> logger.info("HTTP API Server stopped"));
        }
        return Future.succeededFuture();
    }

    /**
     * Returns the bound port, which differs from the configured one when that was 0.
     */
    public int actualPort() {
        return httpServer != null ? httpServer.actualPort() : port;
    }
}
