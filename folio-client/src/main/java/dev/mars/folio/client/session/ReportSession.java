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

import dev.mars.folio.client.ReportBackend;
import dev.mars.folio.client.observability.ReportClientMetrics;
import dev.mars.folio.client.orchestrator.ReportActionOrchestrator;
import dev.mars.folio.client.sync.PollingPolicy;
import dev.mars.folio.client.sync.ReportSynchronizer;
import dev.mars.folio.client.sync.ReportView;
import dev.mars.folio.client.sync.ReportViewListener;
import dev.mars.folio.client.view.ReportAffordances;
import dev.mars.folio.core.workflow.ReportWorkflow;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;

/**
 * Everything the client knows and does for one open report.
 *
 * <p>Commands and polling for a session share this object. The view is replaced atomically; listeners
 * see each replacement in order. In-flight keys stop the same target from being commanded twice while a
 * request is outstanding.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ReportSession {

    private static final Logger logger = LoggerFactory.getLogger(ReportSession.class);

    /** In-flight key for finalize, export and init. */
    public static final String REPORT_KEY = "report";

    private final String sessionId;
    private final AtomicReference<ReportView> view;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final List<ReportViewListener> listeners = new CopyOnWriteArrayList<>();
    private final AtomicLong fetchSequence = new AtomicLong(0);
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final ReportSynchronizer synchronizer;
    private final ReportActionOrchestrator orchestrator;
    private final ReportWorkflow workflow;

    public ReportSession(String sessionId, Vertx vertx, ReportBackend backend, PollingPolicy pollingPolicy,
                         ReportWorkflow workflow, ReportClientMetrics metrics) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be null or blank");
        }
        this.sessionId = sessionId;
        this.view = new AtomicReference<>(ReportView.initial(sessionId));
        this.workflow = Objects.requireNonNull(workflow, "Workflow cannot be null");
        this.synchronizer = new ReportSynchronizer(vertx, this, backend, pollingPolicy, metrics);
        this.orchestrator = new ReportActionOrchestrator(this, backend, synchronizer, workflow, metrics);
    }

    /**
     * Section-level in-flight key.
     */
    public static String sectionKey(String sectionId) {
        return "section:" + sectionId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public ReportView getView() {
        return view.get();
    }

    /**
     * Replaces the view with {@code change(current)} and notifies listeners when it changed.
     * A closed session keeps its last view.
     *
     * @return the view after the change
     */
    public synchronized ReportView update(UnaryOperator<ReportView> change) {
        ReportView previous = view.get();
        if (closed.get()) {
            return previous;
        }
        ReportView next = change.apply(previous);
        if (next == previous) {
            return previous;
        }
        view.set(next);
        for (ReportViewListener listener : listeners) {
            try {
                listener.onViewChanged(next);
            } catch (RuntimeException e) {
                logger.warn("View listener failed for session {}: {}", sessionId, e.getMessage(), e);
            }
        }
        return next;
    }

    public void addListener(ReportViewListener listener) {
        listeners.add(Objects.requireNonNull(listener, "Listener cannot be null"));
    }

    public void removeListener(ReportViewListener listener) {
        listeners.remove(listener);
    }

    /**
     * Issues the sequence number of a new fetch.
     */
    public long nextFetchSequence() {
        return fetchSequence.incrementAndGet();
    }

    /**
     * Returns the sequence number of the most recently issued fetch.
     */
    public long lastIssuedFetchSequence() {
        return fetchSequence.get();
    }

    /**
     * Marks {@code key} as in flight.
     *
     * @return {@code false} if a request for the key is already outstanding
     */
    public boolean tryBeginRequest(String key) {
        return inFlight.add(key);
    }

    public void endRequest(String key) {
        inFlight.remove(key);
    }

    public boolean isInFlight(String key) {
        return inFlight.contains(key);
    }

    public Set<String> getInFlight() {
        return Collections.unmodifiableSet(inFlight);
    }

    /**
     * Derives what the user can do right now from the current view.
     */
    public ReportAffordances getAffordances() {
        return ReportAffordances.derive(view.get(), inFlight);
    }

    public ReportSynchronizer getSynchronizer() {
        return synchronizer;
    }

    public ReportActionOrchestrator getOrchestrator() {
        return orchestrator;
    }

    public ReportWorkflow getWorkflow() {
        return workflow;
    }

    /**
     * Stops polling. Outstanding requests complete but no longer touch the view.
     */
    public Future<Void> close() {
        if (!closed.compareAndSet(false, true)) {
            return Future.succeededFuture();
        }
        synchronizer.stop();
        listeners.clear();
        logger.debug("Report session {} closed", sessionId);
        return Future.succeededFuture();
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public String toString() {
        return "ReportSession{sessionId='" + sessionId + "', view=" + view.get() + ", inFlight=" + inFlight + '}';
    }
}
