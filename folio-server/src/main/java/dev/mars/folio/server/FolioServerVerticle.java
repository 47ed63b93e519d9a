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

import dev.mars.folio.core.workflow.ReportWorkflow;
import dev.mars.folio.server.config.FolioServerOptions;
import dev.mars.folio.server.export.ReportExporterRegistry;
import dev.mars.folio.server.generation.HttpSectionGenerator;
import dev.mars.folio.server.generation.MarkdownContentValidator;
import dev.mars.folio.server.generation.RulesSectionGenerator;
import dev.mars.folio.server.generation.SectionGenerator;
import dev.mars.folio.server.http.HttpApiServer;
import dev.mars.folio.server.observability.ServerMetrics;
import dev.mars.folio.server.plan.DefaultReportPlan;
import dev.mars.folio.server.service.ReportWorkflowService;
import dev.mars.folio.server.store.InMemoryReportRepository;
import dev.mars.folio.server.store.ReportRepository;
import io.vertx.core.AbstractVerticle;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;

/**
 * Main Verticle for the Folio report server.
 * Wires the repository, workflow service, generator and exporters, then starts the HTTP API.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public class FolioServerVerticle extends AbstractVerticle {

    private static final Logger logger = LoggerFactory.getLogger(FolioServerVerticle.class);

    private final FolioServerOptions options;
    private ReportWorkflowService service;
    private HttpApiServer apiServer;

    public FolioServerVerticle(FolioServerOptions options) {
        this.options = options;
    }

    @Override
    public void start(Promise<Void> startPromise) {
        logger.info("Starting FolioServerVerticle with {}", options);

        try {
            ReportRepository repository = new InMemoryReportRepository();
            ReportWorkflow workflow = new ReportWorkflow(Clock.systemUTC(), options.getDefaultMaxRevisions());
            SectionGenerator generator = options.getGenerationEndpoint()
                    .<SectionGenerator>map(endpoint ->
                            new HttpSectionGenerator(vertx, endpoint, options.getGenerationTimeoutMs()))
                    .orElseGet(() -> new RulesSectionGenerator(vertx, options.getRulesEngineDelayMs()));
            ServerMetrics metrics = new ServerMetrics(options.isMetricsEnabled(),
                    () -> repository.sessionIds().size());

            this.service = new ReportWorkflowService(vertx, repository, workflow, generator,
                    new MarkdownContentValidator(),
                    ReportExporterRegistry.withDefaults(options.getExportFormats()),
                    metrics, DefaultReportPlan.get(), options.getFinalizeStepDelayMs());
            this.apiServer = new HttpApiServer(vertx, options.getHost(), options.getPort(), service);

            apiServer.start()
                    .onSuccess(v -> {
                        logger.info("FolioServerVerticle started successfully (generator={})", generator.name());
                        startPromise.complete();
                    })
                    .onFailure(startPromise::fail);
        } catch (RuntimeException e) {
            startPromise.fail(e);
        }
    }

    @Override
    public void stop(Promise<Void> stopPromise) {
        logger.info("Stopping FolioServerVerticle...");
        if (apiServer != null) {
            apiServer.enterDrainMode();
        }
        Future<Void> drained = service != null
                ? service.awaitIdle(options.getDrainTimeoutMs())
                : Future.<Void>succeededFuture();
        drained
                .compose(v -> apiServer != null ? apiServer.stop() : Future.<Void>succeededFuture())
                .compose(v -> service != null ? service.close() : Future.<Void>succeededFuture())
                .onSuccess(v -> {
                    logger.info("FolioServerVerticle stopped");
                    stopPromise.complete();
                })
                .onFailure(stopPromise::fail);
    }

    /**
     * Returns the port the HTTP API is bound to.
     */
    public int getActualPort() {
        return apiServer != null ? apiServer.actualPort() : options.getPort();
    }
}
