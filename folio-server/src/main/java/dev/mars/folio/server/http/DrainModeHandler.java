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
import io.vertx.core.Handler;
import io.vertx.core.http.HttpMethod;
import io.vertx.ext.web.RoutingContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Gate that stops new report work once the server starts shutting down.
 *
 * <p>While draining, every report command ({@code init}, {@code generate}, {@code review},
 * {@code reset}, {@code finalize}) fails with {@code 503 SERVICE_UNAVAILABLE} and a
 * {@code Retry-After} header, so no new generation attempt or finalize run is started. Reads
 * keep working: a client can still poll a report until its pending drafts land, and can export a
 * completed report. Clients classify the 503 as a transport failure and retry elsewhere or later.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class DrainModeHandler implements Handler<RoutingContext> {

    private static final Logger logger = LoggerFactory.getLogger(DrainModeHandler.class);

    static final String RETRY_AFTER_SECONDS = "30";

    private final AtomicBoolean draining = new AtomicBoolean(false);

    @Override
    public void handle(RoutingContext ctx) {
        if (!draining.get() || ctx.request().method() == HttpMethod.GET) {
            ctx.next();
            return;
        }

        logger.debug("Refusing report command during drain: {} {}",
                ctx.request().method(), ctx.request().path());
        ctx.response().putHeader("Retry-After", RETRY_AFTER_SECONDS);
        ctx.fail(ReportApiException.of(ErrorCode.SERVICE_UNAVAILABLE, "server is draining, no new report work"));
    }

    /**
     * Enters drain mode. Idempotent.
     */
    public void enterDrainMode() {
        if (draining.compareAndSet(false, true)) {
            logger.info("Entered drain mode, refusing new report commands");
        }
    }

    public boolean isDraining() {
        return draining.get();
    }
}
