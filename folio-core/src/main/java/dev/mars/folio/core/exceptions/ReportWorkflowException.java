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

package dev.mars.folio.core.exceptions;

import java.util.Objects;

/**
 * Thrown when a report or section command violates a workflow rule.
 *
 * <p>Every instance carries the {@link ErrorCode} the backend answers with, so the HTTP layer can
 * render it without inspecting the message and clients can classify it by {@link ReportErrorKind}.
 * A rule violation never leaves a partially mutated report behind.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public class ReportWorkflowException extends FolioException {

    private final ErrorCode errorCode;

    public ReportWorkflowException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    public ReportWorkflowException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = Objects.requireNonNull(errorCode, "Error code cannot be null");
    }

    /**
     * Creates an exception whose message is the code's template formatted with the given arguments.
     */
    public static ReportWorkflowException of(ErrorCode errorCode, Object... args) {
        return new ReportWorkflowException(errorCode, errorCode.formatMessage(args));
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public ReportErrorKind getErrorKind() {
        return errorCode.kind();
    }
}
