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

import io.vertx.core.Handler;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.MDC;

import java.util.UUID;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Puts the request id and the report coordinates of a request into the SLF4J MDC.
 *
 * <p>The request id comes from {@code X-Request-ID} when the caller sends a usable one, otherwise it is
 * generated, and it is echoed on the response. For report routes the session id and, where present,
 * the section id are taken from the path, so every log line of a command names the report it touched.
 * This handler runs for every route before path parameters are bound, hence the path is parsed
 * here.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class RequestContextHandler implements Handler<RoutingContext> {

    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    public static final String MDC_REQUEST_ID = "requestId";
    public static final String MDC_SESSION_ID = "sessionId";
    public static final String MDC_SECTION_ID = "sectionId";

    private static final Pattern REPORT_PATH =
            Pattern.compile("^/api/v1/reports/([^/]+)(?:/sections/([^/]+))?(?:/.*)?$");

    // Caller ids end up in logs and error bodies
    private static final Pattern USABLE_REQUEST_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    public void handle(RoutingContext ctx) {
        String requestId = ctx.request().getHeader(REQUEST_ID_HEADER);
        if (requestId == null || !USABLE_REQUEST_ID.matcher(requestId).matches()) {
            requestId = "req-" + UUID.randomUUID().toString().substring(0, 8);
        }
        ctx.put(MDC_REQUEST_ID, requestId);
        ctx.response().putHeader(REQUEST_ID_HEADER, requestId);
        MDC.put(MDC_REQUEST_ID, requestId);

        Matcher report = REPORT_PATH.matcher(ctx.request().path());
        if (report.matches()) {
            ctx.put(MDC_SESSION_ID, report.group(1));
            MDC.put(MDC_SESSION_ID, report.group(1));
            if (report.group(2) != null) {
                ctx.put(MDC_SECTION_ID, report.group(2));
                MDC.put(MDC_SECTION_ID, report.group(2));
            }
        }

        ctx.addEndHandler(v -> {
            MDC.remove(MDC_REQUEST_ID);
            MDC.remove(MDC_SESSION_ID);
            MDC.remove(MDC_SECTION_ID);
        });
        ctx.next();
    }

    /**
     * Returns the request id of a request, or {@code null} outside the HTTP pipeline.
     */
    public static String getRequestId(RoutingContext ctx) {
        return ctx.get(MDC_REQUEST_ID);
    }

    /**
     * Returns the session id parsed from a report route, or {@code null} for other routes.
     */
    public static String getSessionId(RoutingContext ctx) {
        return ctx.get(MDC_SESSION_ID);
    }
}
