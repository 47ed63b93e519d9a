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
import dev.mars.folio.client.ReportFixtures;
import dev.mars.folio.core.ReportState;
import dev.mars.folio.core.ReportStatus;
import dev.mars.folio.core.SectionStatus;
import dev.mars.folio.core.exceptions.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.Optional;

import static dev.mars.folio.client.ReportFixtures.section;
import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for ReportReconciler.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
class ReportReconcilerTest {

    private static final String SESSION = "s1";
    private static final Instant NOW = Instant.parse("2026-03-02T10:05:00Z");
    private static final ReportClientException TRANSPORT = ReportClientException.local(
            ErrorCode.TRANSPORT_FAILURE, "connection refused");

    @Test
    @DisplayName("Remote snapshot replaces the local one wholesale")
    void testRemoteWins() {
        ReportView local = ReportReconciler.reconcile(ReportView.initial(SESSION),
                Optional.of(ReportFixtures.planned(SESSION)), 1, NOW);
        local = ReportReconciler.applySection(local, section("intro", SectionStatus.GENERATING), 1);
        assertThat(local.getReport().orElseThrow().findSection("intro").orElseThrow().getStatus())
                .isEqualTo(SectionStatus.GENERATING);

        ReportState remote = ReportFixtures.report(SESSION, ReportStatus.IN_PROGRESS,
                section("intro", SectionStatus.ERROR),
                section("findings", SectionStatus.PLANNED, "intro"));
        ReportView reconciled = ReportReconciler.reconcile(local, Optional.of(remote), 2, NOW);

        assertThat(reconciled.getReport()).contains(remote);
        assertThat(reconciled.getAppliedSequence()).isEqualTo(2);
        assertThat(reconciled.getLastSyncedAt()).contains(NOW);
    }

    @Test
    @DisplayName("An older fetch never overwrites a newer one")
    void testStaleFetchDiscarded() {
        ReportState newer = ReportFixtures.report(SESSION, ReportStatus.IN_PROGRESS,
                section("intro", SectionStatus.REVIEW));
        ReportState older = ReportFixtures.report(SESSION, ReportStatus.IN_PROGRESS,
                section("intro", SectionStatus.GENERATING));

        ReportView view = ReportReconciler.reconcile(ReportView.initial(SESSION), Optional.of(newer), 5, NOW);
        ReportView after = ReportReconciler.reconcile(view, Optional.of(older), 4, NOW);

        assertThat(after).isSameAs(view);
    }

    @Test
    @DisplayName("A fetch issued before a command result is discarded")
    void testCommandRaisesSequenceFloor() {
        ReportView view = ReportReconciler.reconcile(ReportView.initial(SESSION),
                Optional.of(ReportFixtures.planned(SESSION)), 1, NOW);
        view = ReportReconciler.applySection(view, section("intro", SectionStatus.GENERATING), 2);

        ReportView afterStale = ReportReconciler.reconcile(view, Optional.of(ReportFixtures.planned(SESSION)), 2, NOW);

        assertThat(afterStale).isSameAs(view);
        assertThat(afterStale.getReport().orElseThrow().findSection("intro").orElseThrow().getStatus())
                .isEqualTo(SectionStatus.GENERATING);
    }

    @Test
    @DisplayName("Missing report is a synced observation")
    void testAbsentReport() {
        ReportView view = ReportReconciler.reconcile(ReportView.initial(SESSION), Optional.empty(), 1, NOW);

        assertThat(view.isSynced()).isTrue();
        assertThat(view.isReportAbsent()).isTrue();
        assertThat(view.getSyncError()).isEmpty();
    }

    @Test
    @DisplayName("Failure before first sync is visible")
    void testFailureBeforeFirstSync() {
        ReportView view = ReportReconciler.recordSyncFailure(ReportView.initial(SESSION), 1, TRANSPORT);

        assertThat(view.isSynced()).isFalse();
        assertThat(view.getSyncError()).contains(TRANSPORT);
        assertThat(view.getConsecutiveFailures()).isEqualTo(1);
    }

    @Test
    @DisplayName("Failure after a sync only counts towards backoff")
    void testFailureAfterSync() {
        ReportView synced = ReportReconciler.reconcile(ReportView.initial(SESSION),
                Optional.of(ReportFixtures.planned(SESSION)), 1, NOW);

        ReportView once = ReportReconciler.recordSyncFailure(synced, 2, TRANSPORT);
        ReportView twice = ReportReconciler.recordSyncFailure(once, 3, TRANSPORT);

        assertThat(twice.getSyncError()).isEmpty();
        assertThat(twice.getConsecutiveFailures()).isEqualTo(2);
        assertThat(twice.getReport()).isEqualTo(synced.getReport());

        ReportView recovered = ReportReconciler.reconcile(twice, Optional.of(ReportFixtures.planned(SESSION)), 4, NOW);
        assertThat(recovered.getConsecutiveFailures()).isZero();
    }

    @Test
    @DisplayName("Clearing the sync error keeps the failure count")
    void testClearSyncError() {
        ReportView failed = ReportReconciler.recordSyncFailure(ReportView.initial(SESSION), 1, TRANSPORT);

        ReportView cleared = ReportReconciler.clearSyncError(failed);

        assertThat(cleared.getSyncError()).isEmpty();
        assertThat(cleared.getConsecutiveFailures()).isEqualTo(1);
        assertThat(ReportReconciler.clearSyncError(cleared)).isSameAs(cleared);
    }

    @Test
    @DisplayName("Unknown sections in a command result are ignored")
    void testApplyUnknownSection() {
        ReportView view = ReportReconciler.reconcile(ReportView.initial(SESSION),
                Optional.of(ReportFixtures.planned(SESSION)), 1, NOW);

        assertThat(ReportReconciler.applySection(view, section("appendix", SectionStatus.GENERATING), 1))
                .isSameAs(view);
        assertThat(ReportReconciler.applySection(ReportView.initial(SESSION),
                section("intro", SectionStatus.GENERATING), 1).isSynced()).isFalse();
    }
}
