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

package dev.mars.folio.client.sync;

import dev.mars.folio.client.ReportBackend;
import dev.mars.folio.client.ReportClientException;
import dev.mars.folio.client.ReportErrorClassifier;
import dev.mars.folio.client.observability.ReportClientMetrics;
import dev.mars.folio.client.session.ReportSession;
import dev.mars.folio.core.ReportState;
import io.vertx.core.Future;
import io.vertx.core.Promise;
import io.vertx.core.Vertx;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Polling loop that keeps a session's view in line with the backend.
 *
 * <p>A fetch runs on attach, after every command and on a single Vert.x timer while the
 * {@link PollingPolicy} says the report is still moving. Only the completion of the most recently issued
 * fetch arms the next timer, so overlapping fetches never multiply the loop. Once quiescent the loop idles
 * until a command or {@link #syncNow()} wakes it.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ReportSynchronizer {

    private static final Logger logger = LoggerFactory.getLogger(ReportSynchronizer.class);
    private static final long NO_TIMER = -1L;

    private final Vertx vertx;
    private final ReportSession session;
    private final ReportBackend backend;
    private final PollingPolicy pollingPolicy;
    private final ReportClientMetrics metrics;

    private final AtomicLong timerId = new AtomicLong(NO_TIMER);
    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicBoolean stopped = new AtomicBoolean(false);

    public ReportSynchronizer(Vertx vertx, ReportSession session, ReportBackend backend,
                              PollingPolicy pollingPolicy, ReportClientMetrics metrics) {
        this.vertx = vertx;
        this.session = session;
        this.backend = backend;
        this.pollingPolicy = pollingPolicy;
        this.metrics = metrics;
    }

    /**
     * Attaches the loop: performs the first fetch. Subsequent calls do nothing.
     */
    public Future<ReportView> start() {
        if (!started.compareAndSet(false, true)) {
            return Future.succeededFuture(session.getView());
        }
        logger.debug("Starting report synchronization for session {}", session.getSessionId());
        return syncNow();
    }

    /**
     * Fetches the report immediately, replacing any scheduled poll.
     *
     * @return the view after the fetch was applied; never fails, sync failures are recorded on the view
     */
    public Future<ReportView> syncNow() {
        if (stopped.get()) {
            return Future.succeededFuture(session.getView());
        }
        cancelScheduledPoll();
        long sequence = session.nextFetchSequence();
        Promise<ReportView> promise = Promise.promise();

        backend.getState(session.getSessionId()).onComplete(ar -> {
            if (ar.succeeded()) {
                promise.complete(onFetched(sequence, ar.result()));
            } else {
                promise.complete(onFetchFailed(sequence,
                        ReportErrorClassifier.fromThrowable(ar.cause(), "fetch report")));
            }
        });
        return promise.future();
    }

    /**
     * Clears a visible sync error and tries again.
     */
    public Future<ReportView> retry() {
        logger.info("Manual sync retry for session {}", session.getSessionId());
        session.update(ReportReconciler::clearSyncError);
        return syncNow();
    }

    /**
     * Tears the loop down. In-flight fetches complete without touching the view.
     */
    public void stop() {
        if (stopped.compareAndSet(false, true)) {
            cancelScheduledPoll();
            logger.debug("Stopped report synchronization for session {}", session.getSessionId());
        }
    }

    public boolean isStopped() {
        return stopped.get();
    }

    /**
     * Check if a poll is currently scheduled.
     */
    public boolean isPolling() {
        return timerId.get() != NO_TIMER;
    }

    private ReportView onFetched(long sequence, Optional<ReportState> remote) {
        metrics.recordPoll(true);
        if (stopped.get()) {
            return session.getView();
        }
        ReportView view = session.update(local -> ReportReconciler.reconcile(local, remote, sequence, Instant.now()));
        if (view.getAppliedSequence() != sequence) {
            logger.debug("Discarded stale fetch #{} for session {}", sequence, session.getSessionId());
        }
        scheduleNextIfLatest(sequence, view);
        return view;
    }

    private ReportView onFetchFailed(long sequence, ReportClientException error) {
        metrics.recordPoll(false);
        if (stopped.get()) {
            return session.getView();
        }
        ReportView view = session.update(local -> ReportReconciler.recordSyncFailure(local, sequence, error));
        if (view.getSyncError().isPresent()) {
            logger.warn("Report for session {} could not be loaded, waiting for retry: {}",
                    session.getSessionId(), error.getMessage());
        } else if (view.getConsecutiveFailures() == 1) {
            logger.warn("Report sync failed for session {}: {}", session.getSessionId(), error.getMessage());
        } else {
            logger.debug("Report sync failed for session {} ({} consecutive): {}",
                    session.getSessionId(), view.getConsecutiveFailures(), error.getMessage());
        }
        scheduleNextIfLatest(sequence, view);
        return view;
    }

    private void scheduleNextIfLatest(long sequence, ReportView view) {
        if (sequence != session.lastIssuedFetchSequence() || stopped.get()) {
            return;
        }
        if (!pollingPolicy.shouldPoll(view)) {
            logger.debug("Report for session {} is quiescent, polling paused", session.getSessionId());
            return;
        }
        long delay = pollingPolicy.nextDelayMs(view.getConsecutiveFailures());
        long id = vertx.setTimer(delay, fired -> {
            if (timerId.compareAndSet(fired, NO_TIMER)) {
                syncNow();
            }
        });
        long previous = timerId.getAndSet(id);
        if (previous != NO_TIMER) {
            vertx.cancelTimer(previous);
        }
        logger.trace("Next poll for session {} in {}ms", session.getSessionId(), delay);
    }

    private void cancelScheduledPoll() {
        long previous = timerId.getAndSet(NO_TIMER);
        if (previous != NO_TIMER) {
            vertx.cancelTimer(previous);
        }
    }
}
