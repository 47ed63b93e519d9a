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

package dev.mars.folio.server.http.handlers;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.folio.core.codec.FolioJson;
import dev.mars.folio.core.dto.InitReportRequest;
import dev.mars.folio.core.dto.ResetRequest;
import dev.mars.folio.core.dto.ReviewRequest;
import dev.mars.folio.server.http.ReportApiException;
import dev.mars.folio.server.service.ReportWorkflowService;
import io.vertx.core.Handler;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP handler for report operations.
 *
 * <p>Endpoints:
 * <ul>
 *   <li>{@code POST /api/v1/reports/:sessionId/init} - Create (or preview) the report</li>
 *   <li>{@code GET /api/v1/reports/:sessionId} - Get the report state</li>
 *   <li>{@code POST /api/v1/reports/:sessionId/sections/:sectionId/generate} - Start generation (202)</li>
 *   <li>{@code POST /api/v1/reports/:sessionId/sections/:sectionId/review} - Accept or reject</li>
 *   <li>{@code POST /api/v1/reports/:sessionId/sections/:sectionId/reset} - Reset a section</li>
 *   <li>{@code POST /api/v1/reports/:sessionId/finalize} - Start finalization (202)</li>
 *   <li>{@code GET /api/v1/reports/:sessionId/export?format=markdown} - Download the report</li>
 * </ul>
 *
 * <p>Bodies are read and written with the shared {@link FolioJson} mapper so the wire format matches
 * the client exactly.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ReportHandler {

    private static final Logger logger = LoggerFactory.getLogger(ReportHandler.class);

    private final ReportWorkflowService service;

    public ReportHandler(ReportWorkflowService service) {
        this.service = service;
    }

    public Handler<RoutingContext> handleInit() {
        return ctx -> {
            InitReportRequest request = readBody(ctx, InitReportRequest.class);
            if (request == null) {
                throw ReportApiException.badRequest("request body is required");
            }
            service.initialize(ctx.pathParam("sessionId"), request.isConfirm(), request.getSections())
                    .onSuccess(report -> sendJson(ctx, 200, report))
                    .onFailure(ctx::fail);
        };
    }

    public Handler<RoutingContext> handleGet() {
        return ctx -> service.getReport(ctx.pathParam("sessionId"))
                .onSuccess(report -> sendJson(ctx, 200, report))
                .onFailure(ctx::fail);
    }

    public Handler<RoutingContext> handleGenerate() {
        return ctx -> service.generateSection(ctx.pathParam("sessionId"), ctx.pathParam("sectionId"))
                .onSuccess(section -> sendJson(ctx, 202, section))
                .onFailure(ctx::fail);
    }

    public Handler<RoutingContext> handleReview() {
        return ctx -> {
            ReviewRequest request = readBody(ctx, ReviewRequest.class);
            if (request == null) {
                throw ReportApiException.badRequest("request body is required");
            }
            service.submitReview(ctx.pathParam("sessionId"), ctx.pathParam("sectionId"),
                            request.isAccepted(), request.getFeedback())
                    .onSuccess(section -> sendJson(ctx, 200, section))
                    .onFailure(ctx::fail);
        };
    }

    /**
     * The body is optional; without one the reset is not forced.
     */
    public Handler<RoutingContext> handleReset() {
        return ctx -> {
            ResetRequest request = readBody(ctx, ResetRequest.class);
            boolean force = request != null && request.isForce();
            service.resetSection(ctx.pathParam("sessionId"), ctx.pathParam("sectionId"), force)
                    .onSuccess(section -> sendJson(ctx, 200, section))
                    .onFailure(ctx::fail);
        };
    }

    public Handler<RoutingContext> handleFinalize() {
        return ctx -> service.finalizeReport(ctx.pathParam("sessionId"))
                .onSuccess(report -> sendJson(ctx, 202, report))
                .onFailure(ctx::fail);
    }

    public Handler<RoutingContext> handleExport() {
        return ctx -> {
            String format = ctx.request().getParam("format");
            if (format == null || format.isBlank()) {
                throw ReportApiException.badRequest("query parameter 'format' is required");
            }
            service.export(ctx.pathParam("sessionId"), format)
                    .onSuccess(artifact -> ctx.response()
                            .setStatusCode(200)
                            .putHeader("Content-Type", artifact.getContentType())
                            .putHeader("Content-Disposition", "attachment; filename=\"" + artifact.getFileName() + "\"")
                            .end(Buffer.buffer(artifact.getContent())))
                    .onFailure(ctx::fail);
        };
    }

    // ==================== Private Helpers ====================

    private static <T> T readBody(RoutingContext ctx, Class<T> type) {
        String raw = ctx.body().asString();
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return FolioJson.mapper().readValue(raw, type);
        } catch (JsonProcessingException e) {
            throw ReportApiException.badRequest("invalid JSON body: " + e.getOriginalMessage());
        }
    }

    private static void sendJson(RoutingContext ctx, int statusCode, Object value) {
        String json;
        try {
            json = FolioJson.toJson(value);
        } catch (JsonProcessingException e) {
            logger.error("Failed to encode response for {}: {}", ctx.request().path(), e.getMessage(), e);
            ctx.fail(ReportApiException.internal("response encoding failed", e));
            return;
        }
        ctx.response()
                .setStatusCode(statusCode)
                .putHeader("Content-Type", "application/json")
                .end(json);
    }
}
