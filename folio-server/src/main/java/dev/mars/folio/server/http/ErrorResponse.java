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

import dev.mars.folio.core.exceptions.ErrorCode;
import io.vertx.core.json.JsonObject;

import java.time.Instant;
import java.util.UUID;

/**
 * Standardized error response for all report API endpoints.
 *
 * <p>Example JSON output:</p>
 * <pre>{@code
 * {
 *   "error": {
 *     "code": "DEPENDENCY_UNMET",
 *     "message": "Section 'findings' is blocked by unaccepted dependencies [intro]",
 *     "timestamp": "2026-03-02T10:00:00Z",
 *     "path": "/api/v1/reports/s-1/sections/findings/generate",
 *     "requestId": "req-1a2b3c4d"
 *   }
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public record ErrorResponse(
    ErrorCode errorCode,
    String message,
    Instant timestamp,
    String path,
    String requestId
) {
    /**
     * Creates an ErrorResponse with an explicit message and the request's id.
     */
    public static ErrorResponse withMessage(ErrorCode code, String path, String message, String requestId) {
        return new ErrorResponse(
            code,
            message,
            Instant.now(),
            path,
            requestId != null ? requestId : generateRequestId()
        );
    }

    /**
     * Creates an ErrorResponse with a message formatted from the code's template.
     */
    public static ErrorResponse of(ErrorCode code, String path, String requestId, Object... messageArgs) {
        return withMessage(code, path, code.formatMessage(messageArgs), requestId);
    }

    /**
     * Creates an ErrorResponse from an exception, falling back on the code's template for the message.
     */
    public static ErrorResponse fromException(ErrorCode code, Throwable cause, String path, String requestId) {
        String message = cause.getMessage() != null
            ? cause.getMessage()
            : code.messageTemplate();
        return withMessage(code, path, message, requestId);
    }

    /**
     * Converts this error response to a JSON object suitable for HTTP response body.
     */
    public JsonObject toJson() {
        return new JsonObject()
            .put("error", new JsonObject()
                .put("code", errorCode.code())
                .put("message", message)
                .put("timestamp", timestamp.toString())
                .put("path", path)
                .put("requestId", requestId));
    }

    /**
     * Gets the HTTP status for this error. Client-side codes without a wire status map to 500.
     */
    public int httpStatus() {
        int status = errorCode.httpStatus();
        return status >= 400 ? status : 500;
    }

    private static String generateRequestId() {
        return "req-" + UUID.randomUUID().toString().substring(0, 8);
    }
}
