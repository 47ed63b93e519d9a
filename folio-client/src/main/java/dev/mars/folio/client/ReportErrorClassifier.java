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
import com.fasterxml.jackson.databind.JsonNode;
import dev.mars.folio.core.codec.FolioJson;
import dev.mars.folio.core.exceptions.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns backend responses and transport failures into classified {@link ReportClientException}s.
 *
 * <p>The wire code in the error payload wins; the HTTP status is only a fallback for responses that
 * carry no recognizable code (proxies, gateways, older backends). Anything that is not an HTTP
 * response at all is a {@link ErrorCode#TRANSPORT_FAILURE}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ReportErrorClassifier {

    private static final Logger logger = LoggerFactory.getLogger(ReportErrorClassifier.class);

    private ReportErrorClassifier() {
    }

    /**
     * Classifies a non-success HTTP response.
     *
     * @param httpStatus the response status
     * @param body       the response body, may be {@code null} or not JSON
     * @param action     short description of the attempted operation, used when the body has no message
     */
    public static ReportClientException fromResponse(int httpStatus, String body, String action) {
        String code = null;
        String message = null;
        String requestId = null;

        JsonNode error = parseErrorNode(body);
        if (error != null) {
            code = text(error, "code");
            message = text(error, "message");
            requestId = text(error, "requestId");
        }

        ErrorCode errorCode = code != null
                ? ErrorCode.fromCode(code).orElseGet(() -> ErrorCode.forHttpStatus(httpStatus))
                : ErrorCode.forHttpStatus(httpStatus);
        if (message == null || message.isBlank()) {
            message = "Failed to " + action + ": HTTP " + httpStatus;
        }
        return new ReportClientException(errorCode, message, httpStatus, requestId);
    }

    /**
     * Classifies a failed future. Already classified failures pass through unchanged.
     */
    public static ReportClientException fromThrowable(Throwable failure, String action) {
        if (failure instanceof ReportClientException classified) {
            return classified;
        }
        String detail = failure.getMessage() != null ? failure.getMessage() : failure.getClass().getSimpleName();
        return new ReportClientException(ErrorCode.TRANSPORT_FAILURE,
                ErrorCode.TRANSPORT_FAILURE.formatMessage(action + ": " + detail), failure);
    }

    private static JsonNode parseErrorNode(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode root = FolioJson.mapper().readTree(body);
            JsonNode error = root != null ? root.get("error") : null;
            return error != null && error.isObject() ? error : null;
        } catch (JsonProcessingException e) {
            logger.debug("Error response body is not JSON, falling back to HTTP status: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
