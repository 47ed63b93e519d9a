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

import dev.mars.folio.core.exceptions.ErrorCode;
import dev.mars.folio.core.exceptions.FolioException;
import dev.mars.folio.core.exceptions.ReportErrorKind;
import dev.mars.folio.core.exceptions.ReportWorkflowException;

import java.util.Objects;

/**
 * Exception thrown by the report client when a command or fetch fails.
 *
 * <p>Always classified: every instance carries an {@link ErrorCode} and therefore a
 * {@link ReportErrorKind}. Presentation code switches on {@link #getKind()}; the HTTP status and the
 * backend request id are kept for logging.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ReportClientException extends FolioException {

    private final ErrorCode errorCode;
    private final int httpStatus;
    private final String requestId;

    public ReportClientException(ErrorCode errorCode, String message, int httpStatus, String requestId) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
        this.httpStatus = httpStatus;
        this.requestId = requestId;
    }

    public ReportClientException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
        this.httpStatus = errorCode.httpStatus();
        this.requestId = null;
    }

    /**
     * Creates a client-side failure that never reached the backend.
     */
    public static ReportClientException local(ErrorCode errorCode, Object... args) {
        return new ReportClientException(errorCode, errorCode.formatMessage(args), 0, null);
    }

    /**
     * Wraps an advisory rule violation detected against the last known snapshot.
     */
    public static ReportClientException fromWorkflow(ReportWorkflowException e) {
        return new ReportClientException(e.getErrorCode(), e.getMessage(), e);
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ReportErrorKind getKind() {
        return errorCode.kind();
    }

    /**
     * Returns the HTTP status of the failed exchange, {@code 0} when no response was received.
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    public String getRequestId() {
        return requestId;
    }

    public boolean isRecoverable() {
        return getKind().isRecoverable();
    }

    @Override
    public String toString() {
        return "ReportClientException{" +
               "code=" + errorCode.code() +
               ", kind=" + getKind() +
               ", status=" + httpStatus +
               (requestId != null ? ", requestId=" + requestId : "") +
               ", message=" + getMessage() +
               '}';
    }
}
