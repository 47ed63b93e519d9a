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

package dev.mars.folio.client.session;

import dev.mars.folio.client.HttpReportBackend;
import dev.mars.folio.client.ReportBackend;
import dev.mars.folio.client.config.ReportClientOptions;
import dev.mars.folio.client.observability.ReportClientMetrics;
import dev.mars.folio.client.sync.PollingPolicy;
import dev.mars.folio.core.workflow.ReportWorkflow;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Open report sessions keyed by session id.
 *
 * <p>Opening the same session twice returns the same {@link ReportSession}, so every view of a report
 * shares one state and one polling loop. Sessions of different ids never share state.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ReportSessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ReportSessionRegistry.class);

    private final Vertx vertx;
    private final ReportBackend backend;
    private final boolean ownsBackend;
    private final PollingPolicy pollingPolicy;
    private final ReportWorkflow workflow;
    private final ReportClientMetrics metrics;
    private final ConcurrentMap<String, ReportSession> sessions = new ConcurrentHashMap<>();

    private ReportSessionRegistry(Vertx vertx, ReportBackend backend, boolean ownsBackend,
                                  ReportClientOptions options) {
        this.vertx = vertx;
        this.backend = backend;
        this.ownsBackend = ownsBackend;
        this.pollingPolicy = PollingPolicy.from(options);
        this.workflow = new ReportWorkflow();
        this.metrics = new ReportClientMetrics(options.isMetricsEnabled());
    }

    /**
     * Creates a registry talking HTTP to {@link ReportClientOptions#getBaseUrl()}.
     */
    public static ReportSessionRegistry create(Vertx vertx, ReportClientOptions options) {
        return new ReportSessionRegistry(vertx, new HttpReportBackend(vertx, options), true, options);
    }

    /**
     * Creates a registry over an existing backend. The backend is not closed with the registry.
     */
    public static ReportSessionRegistry create(Vertx vertx, ReportBackend backend, ReportClientOptions options) {
        return new ReportSessionRegistry(vertx, backend, false, options);
    }

    /**
     * Opens the session, attaching its synchronization loop on first open.
     */
    public ReportSession open(String sessionId) {
        ReportSession session = sessions.computeIfAbsent(sessionId, id -> {
            logger.info("Opening report session {}", id);
            metrics.sessionOpened();
            return new ReportSession(id, vertx, backend, pollingPolicy, workflow, metrics);
        });
        session.getSynchronizer().start();
        return session;
    }

    public Optional<ReportSession> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Set<String> getOpenSessionIds() {
        return Set.copyOf(sessions.keySet());
    }

    /**
     * Closes and forgets the session. Closing an unknown session does nothing.
     */
    public Future<Void> close(String sessionId) {
        ReportSession session = sessions.remove(sessionId);
        if (session == null) {
            return Future.succeededFuture();
        }
        logger.info("Closing report session {}", sessionId);
        metrics.sessionClosed();
        return session.close();
    }

    /**
     * Closes every session and, when the registry created it, the backend.
     */
    public Future<Void> close() {
        List<Future<Void>> closing = new ArrayList<>();
        for (String sessionId : List.copyOf(sessions.keySet())) {
            closing.add(close(sessionId));
        }
        return Future.all(closing).compose(done -> ownsBackend ? backend.close() : Future.<Void>succeededFuture());
    }
}
