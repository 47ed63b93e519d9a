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

import dev.mars.folio.client.ReportClientException;
import dev.mars.folio.core.ReportState;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Local, possibly stale picture of one session's report.
 *
 * <p>Immutable; a session replaces its view atomically. Three situations are kept apart:</p>
 * <ul>
 *   <li>not synced yet ({@link #isSynced()} false): nothing is known</li>
 *   <li>synced and absent ({@link #isReportAbsent()}): the backend has no report for the session</li>
 *   <li>synced and present: {@link #getReport()} holds the last authoritative snapshot</li>
 * </ul>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ReportView {

    private final String sessionId;
    private final ReportState report;
    private final boolean synced;
    private final long appliedSequence;
    private final int consecutiveFailures;
    private final ReportClientException syncError;
    private final Instant lastSyncedAt;

    private ReportView(String sessionId, ReportState report, boolean synced, long appliedSequence,
                       int consecutiveFailures, ReportClientException syncError, Instant lastSyncedAt) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID cannot be null");
        this.report = report;
        this.synced = synced;
        this.appliedSequence = appliedSequence;
        this.consecutiveFailures = consecutiveFailures;
        this.syncError = syncError;
        this.lastSyncedAt = lastSyncedAt;
    }

    /**
     * Creates the view of a session nothing is known about yet.
     */
    public static ReportView initial(String sessionId) {
        return new ReportView(sessionId, null, false, 0L, 0, null, null);
    }

    ReportView withObservation(ReportState newReport, long sequence, Instant observedAt) {
        return new ReportView(sessionId, newReport, true, sequence, 0, null, observedAt);
    }

    ReportView withFailure(int failures, ReportClientException error) {
        return new ReportView(sessionId, report, synced, appliedSequence, failures, error, lastSyncedAt);
    }

    ReportView withoutSyncError() {
        return new ReportView(sessionId, report, synced, appliedSequence, consecutiveFailures, null, lastSyncedAt);
    }

    ReportView withLocalReport(ReportState newReport, long sequenceFloor) {
        return new ReportView(sessionId, newReport, true, Math.max(appliedSequence, sequenceFloor),
                consecutiveFailures, syncError, lastSyncedAt);
    }

    public String getSessionId() {
        return sessionId;
    }

    public Optional<ReportState> getReport() {
        return Optional.ofNullable(report);
    }

    /**
     * Check if at least one fetch or command outcome has been observed for the session.
     */
    public boolean isSynced() {
        return synced;
    }

    /**
     * Check if the backend confirmed there is no report for the session.
     */
    public boolean isReportAbsent() {
        return synced && report == null;
    }

    /**
     * Sequence number of the newest observation applied. Older fetch results are discarded.
     */
    public long getAppliedSequence() {
        return appliedSequence;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    /**
     * Returns the error to show the user. Set only when no sync has ever succeeded.
     */
    public Optional<ReportClientException> getSyncError() {
        return Optional.ofNullable(syncError);
    }

    public Optional<Instant> getLastSyncedAt() {
        return Optional.ofNullable(lastSyncedAt);
    }

    @Override
    public String toString() {
        return "ReportView{" +
               "sessionId='" + sessionId + '\'' +
               ", synced=" + synced +
               ", status=" + (report != null ? report.getReportStatus() : "absent") +
               ", sequence=" + appliedSequence +
               ", failures=" + consecutiveFailures +
               (syncError != null ? ", syncError=" + syncError.getErrorCode().code() : "") +
               '}';
    }
}
