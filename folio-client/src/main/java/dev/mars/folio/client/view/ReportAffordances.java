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

package dev.mars.folio.client.view;

import dev.mars.folio.client.session.ReportSession;
import dev.mars.folio.client.sync.ReportView;
import dev.mars.folio.core.ReportState;
import dev.mars.folio.core.ReportStatus;
import dev.mars.folio.core.SectionStatus;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * What the user may do with a report in the current view, derived from the snapshot and the in-flight
 * requests of the session.
 *
 * <p>These are hints for presentation. The orchestrator checks the same rules again and the backend
 * has the final word.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ReportAffordances {

    private final ReportView view;
    private final List<SectionAffordances> sections;
    private final boolean reportInFlight;

    private ReportAffordances(ReportView view, List<SectionAffordances> sections, boolean reportInFlight) {
        this.view = view;
        this.sections = Collections.unmodifiableList(sections);
        this.reportInFlight = reportInFlight;
    }

    /**
     * Derives the affordances of a view.
     *
     * @param inFlightKeys keys of the requests currently outstanding for the session
     */
    public static ReportAffordances derive(ReportView view, Set<String> inFlightKeys) {
        List<SectionAffordances> sections = new ArrayList<>();
        Optional<ReportState> report = view.getReport();
        if (report.isPresent()) {
            ReportState state = report.get();
            boolean commandsAllowed = sectionCommandsAllowed(state);
            state.getSections().forEach(section -> sections.add(
                    SectionAffordances.derive(section, state.getSections(), commandsAllowed, inFlightKeys)));
        }
        return new ReportAffordances(view, sections, inFlightKeys.contains(ReportSession.REPORT_KEY));
    }

    private static boolean sectionCommandsAllowed(ReportState state) {
        ReportStatus status = state.getReportStatus();
        return state.isUserConfirmedStart()
               && status != ReportStatus.UNINITIALIZED
               && !status.isLocked()
               && !status.isTerminal();
    }

    public List<SectionAffordances> getSections() {
        return sections;
    }

    public Optional<SectionAffordances> getSection(String sectionId) {
        return sections.stream().filter(s -> s.getSectionId().equals(sectionId)).findFirst();
    }

    /**
     * Check if the report has to be initialized before anything else: absent or not confirmed.
     */
    public boolean needsInitialization() {
        if (!view.isSynced()) {
            return false;
        }
        return view.getReport().map(r -> !r.isUserConfirmedStart()).orElse(true);
    }

    public boolean canInitialize() {
        return needsInitialization() && !reportInFlight;
    }

    public boolean canFinalize() {
        return status().filter(s -> s == ReportStatus.AWAITING_FINAL_REVIEW).isPresent() && !reportInFlight;
    }

    public boolean canExport() {
        return status().filter(ReportStatus::isTerminal).isPresent() && !reportInFlight;
    }

    /**
     * Check if the report is in the finalize protocol and section commands are locked out.
     */
    public boolean isFinalizing() {
        return status().filter(ReportStatus::isLocked).isPresent();
    }

    public boolean isFailed() {
        return status().filter(s -> s == ReportStatus.FAILED).isPresent();
    }

    public Optional<String> getFailureReason() {
        return view.getReport().map(ReportState::getFailureReason);
    }

    public long getAcceptedCount() {
        return sections.stream().filter(s -> s.getStatus() == SectionStatus.ACCEPTED).count();
    }

    public int getSectionCount() {
        return sections.size();
    }

    private Optional<ReportStatus> status() {
        return view.getReport().map(ReportState::getReportStatus);
    }
}
