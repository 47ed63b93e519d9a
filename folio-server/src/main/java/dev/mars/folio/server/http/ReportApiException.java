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

/**
 * Exception thrown by API handlers to indicate a known error condition.
 *
 * <p>This exception carries an {@link ErrorCode} which determines the HTTP
 * status code and error format returned to the client. The
 * {@link GlobalErrorHandler} will catch this and convert it to a standardized
 * {@link ErrorResponse}.</p>
 *
 * <p>Usage in handlers:</p>
 * <pre>{@code
 * if (body == null) {
 *     throw ReportApiException.badRequest("Request body is required");
 * }
 * }</pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ReportApiException extends RuntimeException {

    private final ErrorCode errorCode;

    public ReportApiException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public ReportApiException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public int getHttpStatus() {
        return errorCode.httpStatus();
    }

    // ==================== Factory Methods ====================

    /**
     * Creates a "bad request" exception with a detail message.
     */
    public static ReportApiException badRequest(String detail) {
        return new ReportApiException(ErrorCode.BAD_REQUEST, ErrorCode.BAD_REQUEST.formatMessage(detail));
    }

    /**
     * Creates an exception whose message is formatted from the code's template.
     */
    public static ReportApiException of(ErrorCode code, Object... args) {
        return new ReportApiException(code, code.formatMessage(args));
    }

    /**
     * Creates an internal server error exception.
     */
    public static ReportApiException internal(String detail, Throwable cause) {
        return new ReportApiException(ErrorCode.INTERNAL_ERROR, ErrorCode.INTERNAL_ERROR.formatMessage(detail), cause);
    }
}
