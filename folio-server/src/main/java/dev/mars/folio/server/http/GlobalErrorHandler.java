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

import com.fasterxml.jackson.core.JsonProcessingException;
import dev.mars.folio.core.exceptions.ErrorCode;
import dev.mars.folio.core.exceptions.InvalidTransitionException;
import dev.mars.folio.core.exceptions.PlanValidationException;
import dev.mars.folio.core.exceptions.ReportWorkflowException;
import io.vertx.core.Handler;
import io.vertx.core.json.DecodeException;
import io.vertx.ext.web.RoutingContext;
import io.vertx.ext.web.handler.HttpException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Global error handler for the report API.
 *
 * <p>Catches all unhandled failures and converts them to standardized
 * {@link ErrorResponse} JSON responses.</p>
 *
 * <p>Exception mapping:</p>
 * <ul>
 *   <li>{@link HttpException} and bare router statuses → 404 NOT_FOUND, 405 METHOD_NOT_ALLOWED,
 *       413 PAYLOAD_TOO_LARGE and so on</li>
 *   <li>{@link ReportWorkflowException} → the rule's error code</li>
 *   <li>{@link ReportApiException} → the exception's error code</li>
 *   <li>{@link PlanValidationException} → 400 INVALID_PLAN</li>
 *   <li>{@link InvalidTransitionException} → 409 CONFLICT</li>
 *   <li>{@link IllegalArgumentException}, {@link DecodeException}, {@link JsonProcessingException} → 400 BAD_REQUEST</li>
 *   <li>All others → 500 INTERNAL_ERROR</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class GlobalErrorHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(GlobalErrorHandler.class);

    @Override
    public void handle(RoutingContext ctx) {
        Throwable failure = ctx.failure();
        String path = ctx.request().path();
        int statusCode = ctx.statusCode();
        String requestId = RequestContextHandler.getRequestId(ctx);

        ErrorResponse errorResponse;

        if (failure == null) {
            // No exception, just a status code (e.g., 404 from router)
            errorResponse = mapStatusCodeToError(statusCode, path, requestId);
        } else if (failure instanceof HttpException httpEx) {
            // Raised by Vert.x handlers such as the body limit
            errorResponse = mapStatusCodeToError(httpEx.getStatusCode(), path, requestId);
        } else if (failure instanceof ReportWorkflowException workflowEx) {
            errorResponse = ErrorResponse.withMessage(workflowEx.getErrorCode(), path, workflowEx.getMessage(), requestId);
            logError(workflowEx.getErrorCode(), failure, path);
        } else if (failure instanceof ReportApiException apiEx) {
            errorResponse = ErrorResponse.withMessage(apiEx.getErrorCode(), path, apiEx.getMessage(), requestId);
            logError(apiEx.getErrorCode(), failure, path);
        } else if (failure instanceof PlanValidationException) {
            errorResponse = ErrorResponse.of(ErrorCode.INVALID_PLAN, path, requestId, failure.getMessage());
            logError(ErrorCode.INVALID_PLAN, failure, path);
        } else if (failure instanceof InvalidTransitionException) {
            errorResponse = ErrorResponse.of(ErrorCode.CONFLICT, path, requestId, failure.getMessage());
            logError(ErrorCode.CONFLICT, failure, path);
        } else if (failure instanceof DecodeException || failure instanceof JsonProcessingException) {
            errorResponse = ErrorResponse.of(ErrorCode.BAD_REQUEST, path, requestId, "invalid JSON body");
            logError(ErrorCode.BAD_REQUEST, failure, path);
        } else if (failure instanceof IllegalArgumentException) {
            errorResponse = ErrorResponse.fromException(ErrorCode.BAD_REQUEST, failure, path, requestId);
            logError(ErrorCode.BAD_REQUEST, failure, path);
        } else if (failure instanceof NullPointerException) {
            // NPE - don't expose details to client
            errorResponse = ErrorResponse.of(ErrorCode.INTERNAL_ERROR, path, requestId, "unexpected error occurred");
            logger.error("NullPointerException at path {}", path, failure);
        } else {
            errorResponse = ErrorResponse.of(ErrorCode.INTERNAL_ERROR, path, requestId, "unexpected error occurred");
            logger.error("Unhandled exception at path {}: {}", path, failure.getMessage(), failure);
        }

        sendErrorResponse(ctx, errorResponse);
    }

    /**
     * Maps HTTP status codes (from router) to appropriate ErrorResponse.
     */
    private ErrorResponse mapStatusCodeToError(int statusCode, String path, String requestId) {
        return switch (statusCode) {
            case 400 -> ErrorResponse.of(ErrorCode.BAD_REQUEST, path, requestId, "bad request");
            case 403 -> ErrorResponse.of(ErrorCode.FORBIDDEN, path, requestId, path);
            case 404 -> ErrorResponse.of(ErrorCode.NOT_FOUND, path, requestId, path);
            case 405 -> ErrorResponse.of(ErrorCode.METHOD_NOT_ALLOWED, path, requestId, path);
            case 409 -> ErrorResponse.of(ErrorCode.CONFLICT, path, requestId, "resource conflict");
            case 413 -> ErrorResponse.of(ErrorCode.PAYLOAD_TOO_LARGE, path, requestId, path);
            case 503 -> ErrorResponse.of(ErrorCode.SERVICE_UNAVAILABLE, path, requestId, "server unavailable");
            default -> ErrorResponse.of(ErrorCode.INTERNAL_ERROR, path, requestId, "error " + statusCode);
        };
    }

    private void sendErrorResponse(RoutingContext ctx, ErrorResponse errorResponse) {
        if (ctx.response().ended()) {
            logger.debug("Response already ended, dropping error {}", errorResponse.errorCode().code());
            return;
        }
        ctx.response()
            .setStatusCode(errorResponse.httpStatus())
            .putHeader("Content-Type", "application/json")
            .end(errorResponse.toJson().encode());
    }

    /**
     * Logs the error with a level based on status code.
     * The request id and report coordinates are included via SLF4J MDC (set by {@link RequestContextHandler}).
     */
    private void logError(ErrorCode code, Throwable failure, String path) {
        if (code == ErrorCode.SERVICE_UNAVAILABLE) {
            logger.warn("Unavailable [{}] at {}: {}", code.code(), path, failure.getMessage());
        } else if (code.httpStatus() >= 500) {
            logger.error("Server error [{}] at {}: {}", code.code(), path, failure.getMessage(), failure);
        } else if (code.httpStatus() >= 400) {
            logger.info("Client error [{}] at {}: {}", code.code(), path, failure.getMessage());
        } else {
            logger.debug("Error [{}] at {}: {}", code.code(), path, failure.getMessage());
        }
    }
}
