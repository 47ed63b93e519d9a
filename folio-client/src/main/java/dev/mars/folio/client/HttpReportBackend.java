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

package dev.mars.folio.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.folio.client.config.ReportClientOptions;
import dev.mars.folio.core.ExportArtifact;
import dev.mars.folio.core.ExportFormat;
import dev.mars.folio.core.ReportState;
import dev.mars.folio.core.Section;
import dev.mars.folio.core.codec.FolioJson;
import dev.mars.folio.core.dto.InitReportRequest;
import dev.mars.folio.core.dto.ResetRequest;
import dev.mars.folio.core.dto.ReviewRequest;
import dev.mars.folio.core.exceptions.ErrorCode;
import dev.mars.folio.core.plan.SectionPlan;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import io.vertx.core.buffer.Buffer;
import io.vertx.ext.web.client.HttpRequest;
import io.vertx.ext.web.client.HttpResponse;
import io.vertx.ext.web.client.WebClient;
import io.vertx.ext.web.client.WebClientOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * {@link ReportBackend} over the report HTTP API.
 * Uses Vert.x WebClient for non-blocking HTTP communication and Jackson for the JSON wire format.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class HttpReportBackend implements ReportBackend {

    private static final Logger logger = LoggerFactory.getLogger(HttpReportBackend.class);
    private static final String REPORTS_PATH = "/api/v1/reports/";

    private final ReportClientOptions options;
    private final WebClient webClient;

    public HttpReportBackend(Vertx vertx, ReportClientOptions options) {
        this.options = options;
        this.webClient = WebClient.create(vertx, new WebClientOptions()
            .setConnectTimeout(options.getConnectTimeoutMs())
            .setIdleTimeout((int) options.getRequestTimeoutMs())
            .setIdleTimeoutUnit(TimeUnit.MILLISECONDS)
            .setUserAgent(options.getUserAgent()));
        logger.debug("HttpReportBackend initialized for {} (connectTimeout={}ms, requestTimeout={}ms)",
            options.getBaseUrl(), options.getConnectTimeoutMs(), options.getRequestTimeoutMs());
    }

    @Override
    public Future<ReportState> init(String sessionId, boolean confirm, SectionPlan plan) {
        InitReportRequest body = new InitReportRequest(confirm, plan != null ? plan.getDefinitions() : null);
        return sendJson(webClient.postAbs(reportUrl(sessionId) + "/init"), body, "initialize report")
            .compose(response -> requireSuccess(response, "initialize report"))
            .compose(response -> decode(response, ReportState.class, "initialize report"));
    }

    @Override
    public Future<Optional<ReportState>> getState(String sessionId) {
        String action = "fetch report";
        return webClient.getAbs(reportUrl(sessionId))
            .putHeader("Accept", "application/json")
            .send()
            .recover(err -> Future.failedFuture(ReportErrorClassifier.fromThrowable(err, action)))
            .compose(response -> {
                if (response.statusCode() == 404) {
                    ReportClientException notFound =
                        ReportErrorClassifier.fromResponse(404, response.bodyAsString(), action);
                    if (notFound.getErrorCode() == ErrorCode.REPORT_NOT_FOUND
                            || notFound.getErrorCode() == ErrorCode.NOT_FOUND) {
                        logger.debug("No report for session {}", sessionId);
                        return Future.succeededFuture(Optional.empty());
                    }
                    return Future.failedFuture(notFound);
                }
                return requireSuccess(response, action)
                    .compose(ok -> decode(ok, ReportState.class, action))
                    .map(Optional::of);
            });
    }

    @Override
    public Future<Section> generateSection(String sessionId, String sectionId) {
        String action = "generate section " + sectionId;
        return webClient.postAbs(sectionUrl(sessionId, sectionId) + "/generate")
            .putHeader("Accept", "application/json")
            .send()
            .recover(err -> Future.failedFuture(ReportErrorClassifier.fromThrowable(err, action)))
            .compose(response -> requireSuccess(response, action))
            .compose(response -> decode(response, Section.class, action));
    }

    @Override
    public Future<Section> submitReview(String sessionId, String sectionId, boolean accepted, String feedback) {
        String action = "review section " + sectionId;
        return sendJson(webClient.postAbs(sectionUrl(sessionId, sectionId) + "/review"),
                new ReviewRequest(accepted, feedback), action)
            .compose(response -> requireSuccess(response, action))
            .compose(response -> decode(response, Section.class, action));
    }

    @Override
    public Future<Section> resetSection(String sessionId, String sectionId, boolean force) {
        String action = "reset section " + sectionId;
        return sendJson(webClient.postAbs(sectionUrl(sessionId, sectionId) + "/reset"),
                new ResetRequest(force), action)
            .compose(response -> requireSuccess(response, action))
            .compose(response -> decode(response, Section.class, action));
    }

    @Override
    public Future<ReportState> finalizeReport(String sessionId) {
        String action = "finalize report";
        return webClient.postAbs(reportUrl(sessionId) + "/finalize")
            .putHeader("Accept", "application/json")
            .send()
            .recover(err -> Future.failedFuture(ReportErrorClassifier.fromThrowable(err, action)))
            .compose(response -> requireSuccess(response, action))
            .compose(response -> decode(response, ReportState.class, action));
    }

    @Override
    public Future<ExportArtifact> export(String sessionId, ExportFormat format) {
        String action = "export report as " + format.getWireName();
        return webClient.getAbs(reportUrl(sessionId) + "/export")
            .addQueryParam("format", format.getWireName())
            .send()
            .recover(err -> Future.failedFuture(ReportErrorClassifier.fromThrowable(err, action)))
            .compose(response -> requireSuccess(response, action))
            .map(response -> {
                Buffer body = response.bodyAsBuffer();
                byte[] bytes = body != null ? body.getBytes() : new byte[0];
                logger.debug("Exported report {} as {} ({} bytes)", sessionId, format.getWireName(), bytes.length);
                return new ExportArtifact(sessionId, format, response.getHeader("Content-Type"), bytes);
            });
    }

    /**
     * Shuts down the WebClient.
     *
     * @return Future that completes when shutdown is done
     */
    @Override
    public Future<Void> close() {
        logger.debug("Shutting down HttpReportBackend WebClient");
        webClient.close();
        return Future.succeededFuture();
    }

    // ==================== Private Helpers ====================

    private Future<HttpResponse<Buffer>> sendJson(HttpRequest<Buffer> request, Object body, String action) {
        Buffer payload;
        try {
            payload = Buffer.buffer(FolioJson.toJson(body));
        } catch (JsonProcessingException e) {
            return Future.failedFuture(new ReportClientException(ErrorCode.BAD_REQUEST,
                ErrorCode.BAD_REQUEST.formatMessage(e.getOriginalMessage()), e));
        }
        return request
            .putHeader("Content-Type", "application/json")
            .putHeader("Accept", "application/json")
            .sendBuffer(payload)
            .recover(err -> Future.failedFuture(ReportErrorClassifier.fromThrowable(err, action)));
    }

    private static Future<HttpResponse<Buffer>> requireSuccess(HttpResponse<Buffer> response, String action) {
        int status = response.statusCode();
        if (status >= 200 && status < 300) {
            return Future.succeededFuture(response);
        }
        ReportClientException failure = ReportErrorClassifier.fromResponse(status, response.bodyAsString(), action);
        logger.debug("Backend refused to {}: {}", action, failure.toString());
        return Future.failedFuture(failure);
    }

    private static <T> Future<T> decode(HttpResponse<Buffer> response, Class<T> type, String action) {
        try {
            return Future.succeededFuture(FolioJson.mapper().readValue(response.bodyAsString(), type));
        } catch (JsonProcessingException | IllegalArgumentException e) {
            return Future.failedFuture(new ReportClientException(ErrorCode.INTERNAL_ERROR,
                "Failed to " + action + ": unreadable response body", e));
        }
    }

    private String reportUrl(String sessionId) {
        return options.getBaseUrl() + REPORTS_PATH + encode(sessionId);
    }

    private String sectionUrl(String sessionId, String sectionId) {
        return reportUrl(sessionId) + "/sections/" + encode(sectionId);
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }
}
