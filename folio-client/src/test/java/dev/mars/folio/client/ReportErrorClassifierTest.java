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
import dev.mars.folio.core.exceptions.ReportErrorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.ConnectException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ReportErrorClassifier.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
class ReportErrorClassifierTest {

    @Test
    @DisplayName("Wire code wins over HTTP status")
    void testCodeWins() {
        String body = "{\"error\":{\"code\":\"GENERATION_IN_PROGRESS\",\"message\":\"Section 'intro' is already generating\","
                + "\"timestamp\":\"2026-03-02T10:00:00Z\",\"path\":\"/api/v1/reports/s1/sections/intro/generate\","
                + "\"requestId\":\"req-42\"}}";

        ReportClientException e = ReportErrorClassifier.fromResponse(409, body, "generate section intro");

        assertEquals(ErrorCode.GENERATION_IN_PROGRESS, e.getErrorCode());
        assertEquals(ReportErrorKind.CONFLICT, e.getKind());
        assertTrue(e.isRecoverable());
        assertEquals(409, e.getHttpStatus());
        assertEquals("req-42", e.getRequestId());
        assertEquals("Section 'intro' is already generating", e.getMessage());
    }

    @Test
    @DisplayName("Same HTTP status, different codes, different kinds")
    void testConflictStatusSplitsByCode() {
        ReportClientException unmet = ReportErrorClassifier.fromResponse(409,
                "{\"error\":{\"code\":\"DEPENDENCY_UNMET\",\"message\":\"blocked\"}}", "generate");
        ReportClientException busy = ReportErrorClassifier.fromResponse(409,
                "{\"error\":{\"code\":\"FINALIZE_IN_PROGRESS\",\"message\":\"busy\"}}", "finalize");

        assertEquals(ReportErrorKind.VALIDATION, unmet.getKind());
        assertFalse(unmet.isRecoverable());
        assertEquals(ReportErrorKind.CONFLICT, busy.getKind());
    }

    @ParameterizedTest(name = "HTTP {0} without code -> {1}")
    @CsvSource({
            "400, BAD_REQUEST",
            "403, FORBIDDEN",
            "404, NOT_FOUND",
            "409, CONFLICT",
            "415, UNSUPPORTED_EXPORT_FORMAT",
            "423, REPORT_LOCKED",
            "500, INTERNAL_ERROR",
            "502, SERVICE_UNAVAILABLE",
            "503, SERVICE_UNAVAILABLE",
            "504, SERVICE_UNAVAILABLE"
    })
    void testFallbackByStatus(int status, ErrorCode expected) {
        ReportClientException e = ReportErrorClassifier.fromResponse(status, "<html>Bad Gateway</html>", "fetch report");

        assertEquals(expected, e.getErrorCode());
        assertEquals("Failed to fetch report: HTTP " + status, e.getMessage());
        assertNull(e.getRequestId());
    }

    @Test
    @DisplayName("Unknown wire code falls back on status")
    void testUnknownCode() {
        ReportClientException e = ReportErrorClassifier.fromResponse(503,
                "{\"error\":{\"code\":\"SOMETHING_NEW\",\"message\":\"maintenance\"}}", "fetch report");

        assertEquals(ErrorCode.SERVICE_UNAVAILABLE, e.getErrorCode());
        assertEquals(ReportErrorKind.TRANSPORT, e.getKind());
        assertEquals("maintenance", e.getMessage());
    }

    @Test
    @DisplayName("Empty body is classified by status")
    void testEmptyBody() {
        ReportClientException e = ReportErrorClassifier.fromResponse(500, null, "finalize report");

        assertEquals(ErrorCode.INTERNAL_ERROR, e.getErrorCode());
        assertEquals(ReportErrorKind.BACKEND_FAILURE, e.getKind());
    }

    @Test
    @DisplayName("Raw transport errors become TRANSPORT_FAILURE")
    void testTransportFailure() {
        ReportClientException e = ReportErrorClassifier.fromThrowable(
                new ConnectException("Connection refused"), "fetch report");

        assertEquals(ErrorCode.TRANSPORT_FAILURE, e.getErrorCode());
        assertEquals(ReportErrorKind.TRANSPORT, e.getKind());
        assertEquals(0, e.getHttpStatus());
        assertInstanceOf(ConnectException.class, e.getCause());
    }

    @Test
    @DisplayName("Classified failures pass through unchanged")
    void testPassThrough() {
        ReportClientException original = ReportClientException.local(ErrorCode.REQUEST_IN_FLIGHT, "section:intro");

        assertSame(original, ReportErrorClassifier.fromThrowable(original, "generate"));
    }
}
