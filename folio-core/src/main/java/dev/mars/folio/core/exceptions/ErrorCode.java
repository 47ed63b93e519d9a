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

import java.util.Arrays;
import java.util.Optional;

/**
 * Standardized error codes shared by the report backend and its clients.
 *
 * <p>Each error code includes:</p>
 * <ul>
 *   <li>A unique string code carried in the error payload (e.g., "DEPENDENCY_UNMET")</li>
 *   <li>The HTTP status code the backend answers with</li>
 *   <li>The {@link ReportErrorKind} clients classify it as</li>
 *   <li>A message template for consistent error messages</li>
 * </ul>
 *
 * <p>The HTTP status alone does not determine the kind: an unmet dependency and a duplicate
 * generate request both answer 409, but the first is a validation error and the second a
 * conflict. Clients classify by code first and fall back on {@link #forHttpStatus(int)}.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum ErrorCode {

    // ==================== Request Errors ====================

    /** Request body is missing or malformed */
    BAD_REQUEST("BAD_REQUEST", 400, ReportErrorKind.VALIDATION, "Invalid request: %s"),

    /** Rejection without feedback */
    FEEDBACK_REQUIRED("FEEDBACK_REQUIRED", 400, ReportErrorKind.VALIDATION,
            "Feedback is required to reject section '%s'"),

    /** Initialization without explicit confirmation where one is required */
    CONFIRMATION_REQUIRED("CONFIRMATION_REQUIRED", 400, ReportErrorKind.VALIDATION,
            "Explicit confirmation is required: %s"),

    /** Section plan is empty, has duplicates, unknown dependencies or cycles */
    INVALID_PLAN("INVALID_PLAN", 400, ReportErrorKind.VALIDATION, "Invalid section plan: %s"),

    /** Destructive reset of an accepted section without force */
    FORCE_REQUIRED("FORCE_REQUIRED", 403, ReportErrorKind.VALIDATION,
            "Resetting accepted section '%s' requires force"),

    /** Caller is not allowed to perform the command */
    FORBIDDEN("FORBIDDEN", 403, ReportErrorKind.VALIDATION, "Access denied: %s"),

    /** Route exists but not for this HTTP method */
    METHOD_NOT_ALLOWED("METHOD_NOT_ALLOWED", 405, ReportErrorKind.VALIDATION, "Method not allowed: %s"),

    /** Request body over the server's limit */
    PAYLOAD_TOO_LARGE("PAYLOAD_TOO_LARGE", 413, ReportErrorKind.VALIDATION, "Request body too large: %s"),

    // ==================== Lookup Errors ====================

    /** Generic resource not found */
    NOT_FOUND("NOT_FOUND", 404, ReportErrorKind.NOT_FOUND, "Resource not found: %s"),

    /** No report exists for the session */
    REPORT_NOT_FOUND("REPORT_NOT_FOUND", 404, ReportErrorKind.NOT_FOUND,
            "No report found for session '%s'"),

    /** Section id unknown within the report */
    SECTION_NOT_FOUND("SECTION_NOT_FOUND", 404, ReportErrorKind.NOT_FOUND,
            "Section '%s' not found"),

    // ==================== Workflow Validation Errors ====================

    /** One or more dependencies are not accepted */
    DEPENDENCY_UNMET("DEPENDENCY_UNMET", 409, ReportErrorKind.VALIDATION,
            "Section '%s' is blocked by unaccepted dependencies %s"),

    /** Regeneration budget exhausted */
    REVISION_LIMIT_REACHED("REVISION_LIMIT_REACHED", 409, ReportErrorKind.VALIDATION,
            "Max revisions (%s) reached for section '%s'"),

    /** Section status does not allow the command */
    INVALID_SECTION_STATE("INVALID_SECTION_STATE", 409, ReportErrorKind.VALIDATION,
            "Section '%s' is in state '%s', cannot %s"),

    /** Report phase does not allow the command */
    INVALID_REPORT_STATE("INVALID_REPORT_STATE", 409, ReportErrorKind.VALIDATION,
            "Report '%s' is in state '%s', cannot %s"),

    /** Report is completed; no section may change */
    REPORT_IMMUTABLE("REPORT_IMMUTABLE", 409, ReportErrorKind.VALIDATION,
            "Report '%s' is completed and can no longer be modified"),

    /** Export format not offered by this backend */
    UNSUPPORTED_EXPORT_FORMAT("UNSUPPORTED_EXPORT_FORMAT", 415, ReportErrorKind.VALIDATION,
            "Export format '%s' is not supported"),

    // ==================== Conflicts ====================

    /** Generic resource state conflict */
    CONFLICT("CONFLICT", 409, ReportErrorKind.CONFLICT, "Conflict: %s"),

    /** Section is already generating */
    GENERATION_IN_PROGRESS("GENERATION_IN_PROGRESS", 409, ReportErrorKind.CONFLICT,
            "Section '%s' is already generating"),

    /** Finalize already requested and not yet resolved */
    FINALIZE_IN_PROGRESS("FINALIZE_IN_PROGRESS", 409, ReportErrorKind.CONFLICT,
            "Report '%s' is already being finalized"),

    /** Client-side guard: a prior command for the same target has not returned yet */
    REQUEST_IN_FLIGHT("REQUEST_IN_FLIGHT", 409, ReportErrorKind.CONFLICT,
            "A request for '%s' is already in flight"),

    /** Report is validating or finalizing; section commands are locked out */
    REPORT_LOCKED("REPORT_LOCKED", 423, ReportErrorKind.CONFLICT,
            "Report '%s' is locked while %s"),

    // ==================== Server and Transport Errors ====================

    /** Unexpected backend error */
    INTERNAL_ERROR("INTERNAL_ERROR", 500, ReportErrorKind.BACKEND_FAILURE, "Internal server error: %s"),

    /** Export renderer failed */
    EXPORT_FAILED("EXPORT_FAILED", 500, ReportErrorKind.BACKEND_FAILURE, "Export to '%s' failed: %s"),

    /** Backend temporarily unavailable */
    SERVICE_UNAVAILABLE("SERVICE_UNAVAILABLE", 503, ReportErrorKind.TRANSPORT,
            "Service temporarily unavailable: %s"),

    /** No HTTP exchange completed (connection refused, timeout, reset) */
    TRANSPORT_FAILURE("TRANSPORT_FAILURE", 0, ReportErrorKind.TRANSPORT, "Transport failure: %s");

    private final String code;
    private final int httpStatus;
    private final ReportErrorKind kind;
    private final String messageTemplate;

    ErrorCode(String code, int httpStatus, ReportErrorKind kind, String messageTemplate) {
        this.code = code;
        this.httpStatus = httpStatus;
        this.kind = kind;
        this.messageTemplate = messageTemplate;
    }

    /**
     * Returns the string error code.
     */
    public String code() {
        return code;
    }

    /**
     * Returns the HTTP status code for this error, {@code 0} when no response exists.
     */
    public int httpStatus() {
        return httpStatus;
    }

    /**
     * Returns the client-side classification of this error.
     */
    public ReportErrorKind kind() {
        return kind;
    }

    /**
     * Returns the message template (may contain %s placeholders).
     */
    public String messageTemplate() {
        return messageTemplate;
    }

    /**
     * Formats the message template with the provided arguments.
     */
    public String formatMessage(Object... args) {
        return String.format(messageTemplate, args);
    }

    /**
     * Looks up an ErrorCode by its string code.
     */
    public static Optional<ErrorCode> fromCode(String code) {
        return Arrays.stream(values())
            .filter(e -> e.code.equals(code))
            .findFirst();
    }

    /**
     * Fallback mapping for responses that carry no recognizable code.
     *
     * @param httpStatus the HTTP status of the response
     * @return the most specific generic code for that status
     */
    public static ErrorCode forHttpStatus(int httpStatus) {
        return switch (httpStatus) {
            case 400, 422 -> BAD_REQUEST;
            case 403 -> FORBIDDEN;
            case 404 -> NOT_FOUND;
            case 405 -> METHOD_NOT_ALLOWED;
            case 409 -> CONFLICT;
            case 413 -> PAYLOAD_TOO_LARGE;
            case 415 -> UNSUPPORTED_EXPORT_FORMAT;
            case 423 -> REPORT_LOCKED;
            case 502, 503, 504 -> SERVICE_UNAVAILABLE;
            default -> INTERNAL_ERROR;
        };
    }
}
