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
import dev.mars.folio.core.Section;

import java.time.Instant;
import java.util.Optional;

/**
 * Pure functions folding observations into a {@link ReportView}.
 *
 * <p>The remote snapshot always wins: a successful fetch replaces the local report wholesale,
 * overwriting any optimistic local change. Every fetch carries the sequence number it was issued
 * with; a result whose sequence is not newer than the view's applied sequence is discarded, so a slow
 * early fetch can never overwrite a later one.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ReportReconciler {

    private ReportReconciler() {
    }

    /**
     * Applies a successful fetch.
     *
     * @param local    the current view
     * @param remote   the fetched report, empty when the backend has none
     * @param sequence the sequence number the fetch was issued with
     * @param fetchedAt when the fetch completed
     * @return the reconciled view, or {@code local} unchanged for a stale result
     */
    public static ReportView reconcile(ReportView local, Optional<ReportState> remote, long sequence,
                                       Instant fetchedAt) {
        if (sequence <= local.getAppliedSequence()) {
            return local;
        }
        return local.withObservation(remote.orElse(null), sequence, fetchedAt);
    }

    /**
     * Records a failed fetch.
     * <p>
     * Failures only count towards backoff. The error becomes visible only when the session has never
     * synced, because then there is nothing else to show.
     */
    public static ReportView recordSyncFailure(ReportView local, long sequence, ReportClientException error) {
        if (sequence < local.getAppliedSequence()) {
            return local;
        }
        int failures = local.getConsecutiveFailures() + 1;
        return local.withFailure(failures, local.isSynced() ? null : error);
    }

    /**
     * Clears a visible sync error before a manual retry.
     */
    public static ReportView clearSyncError(ReportView local) {
        return local.getSyncError().isPresent() ? local.withoutSyncError() : local;
    }

    /**
     * Applies a report returned by a command. Fetches issued before the command completed are treated as stale.
     *
     * @param sequenceFloor the highest fetch sequence issued so far
     */
    public static ReportView applyReport(ReportView local, ReportState report, long sequenceFloor) {
        return local.withLocalReport(report, sequenceFloor);
    }

    /**
     * Applies a section returned by a command to the local snapshot until the next fetch replaces it.
     * A section the snapshot does not contain is ignored.
     *
     * @param sequenceFloor the highest fetch sequence issued so far
     */
    public static ReportView applySection(ReportView local, Section section, long sequenceFloor) {
        Optional<ReportState> report = local.getReport();
        if (report.isEmpty() || report.get().findSection(section.getSectionId()).isEmpty()) {
            return local;
        }
        return local.withLocalReport(report.get().withSection(section), sequenceFloor);
    }
}
