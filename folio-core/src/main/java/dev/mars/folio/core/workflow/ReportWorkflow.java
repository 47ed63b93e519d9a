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

package dev.mars.folio.core.workflow;

import dev.mars.folio.core.DependencyResolver;
import dev.mars.folio.core.ExportFormat;
import dev.mars.folio.core.ReportState;
import dev.mars.folio.core.ReportStatus;
import dev.mars.folio.core.Section;
import dev.mars.folio.core.SectionHistoryEntry;
import dev.mars.folio.core.SectionStatus;
import dev.mars.folio.core.exceptions.ErrorCode;
import dev.mars.folio.core.exceptions.InvalidTransitionException;
import dev.mars.folio.core.exceptions.PlanValidationException;
import dev.mars.folio.core.exceptions.ReportWorkflowException;
import dev.mars.folio.core.plan.SectionPlan;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * The report and section rules as pure functions over {@link ReportState} snapshots.
 *
 * <p>Every command takes a snapshot and either returns the successor snapshot or throws a
 * {@link ReportWorkflowException} carrying the {@link ErrorCode} of the violated rule. The input is
 * never modified, so a rejected command leaves no trace. The backend applies these functions to its
 * authoritative copy under a per-report lock; clients run the same functions against their last
 * fetched snapshot as an advisory pre-check.</p>
 *
 * <h3>Report phase gate</h3>
 * <p>Section commands are refused while the report is unconfirmed ({@code INVALID_REPORT_STATE}),
 * validating or finalizing ({@code REPORT_LOCKED}) and completed ({@code REPORT_IMMUTABLE}).
 * A section command accepted on a {@code failed} report clears the failure and re-derives the status.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public class ReportWorkflow {

    private final Clock clock;
    private final int defaultMaxRevisions;

    public ReportWorkflow() {
        this(Clock.systemUTC(), Section.DEFAULT_MAX_REVISIONS);
    }

    public ReportWorkflow(Clock clock, int defaultMaxRevisions) {
        this.clock = Objects.requireNonNull(clock, "Clock cannot be null");
        if (defaultMaxRevisions < 0) {
            throw new IllegalArgumentException("Default max revisions cannot be negative");
        }
        this.defaultMaxRevisions = defaultMaxRevisions;
    }

    public int getDefaultMaxRevisions() {
        return defaultMaxRevisions;
    }

    // ==================== Initialization ====================

    /**
     * Returns the report an init would create, unconfirmed and {@code uninitialized}. Nothing is persisted.
     *
     * @throws ReportWorkflowException {@code INVALID_PLAN} if the plan is unusable
     */
    public ReportState preview(String sessionId, SectionPlan plan) throws ReportWorkflowException {
        List<Section> sections = planSections(plan);
        Instant now = clock.instant();
        return ReportState.builder()
                .sessionId(sessionId)
                .userConfirmedStart(false)
                .reportStatus(ReportStatus.UNINITIALIZED)
                .sections(sections)
                .sectionOrderHash(SectionPlan.orderHash(sectionIds(sections)))
                .createdAt(now)
                .updatedAt(now)
                .build();
    }

    /**
     * Creates the confirmed report for a session.
     * <p>
     * If {@code existing} is already confirmed it is returned unchanged and the plan is ignored.
     *
     * @param sessionId the research session the report belongs to
     * @param plan      the sections to create
     * @param existing  the report currently stored for the session, or {@code null}
     * @return the confirmed report in {@code in_progress}
     * @throws ReportWorkflowException {@code INVALID_PLAN} if the plan is unusable
     */
    public ReportState initialize(String sessionId, SectionPlan plan, ReportState existing)
            throws ReportWorkflowException {
        if (existing != null && existing.isUserConfirmedStart()) {
            return existing;
        }
        ReportState draft = preview(sessionId, plan);
        return draft.toBuilder()
                .userConfirmedStart(true)
                .reportStatus(transition(sessionId, ReportStatus.UNINITIALIZED, ReportStatus.IN_PROGRESS, "initialize"))
                .build();
    }

    // ==================== Section commands ====================

    /**
     * Starts the first draft of a section, or retries it after an error.
     *
     * @throws ReportWorkflowException {@code GENERATION_IN_PROGRESS} if already generating,
     *         {@code INVALID_SECTION_STATE} from review or accepted, {@code DEPENDENCY_UNMET} if locked
     */
    public ReportState generate(ReportState state, String sectionId) throws ReportWorkflowException {
        requireSectionCommandsAllowed(state, "generate section");
        Section section = requireSection(state, sectionId);

        if (section.getStatus().isGenerating()) {
            throw ReportWorkflowException.of(ErrorCode.GENERATION_IN_PROGRESS, sectionId);
        }
        if (!section.getStatus().canStartGeneration()) {
            throw ReportWorkflowException.of(ErrorCode.INVALID_SECTION_STATE,
                    sectionId, section.getStatus().getWireName(), "generate");
        }
        List<String> blocking = DependencyResolver.unresolvedDependencies(section, state.getSections());
        if (!blocking.isEmpty()) {
            throw ReportWorkflowException.of(ErrorCode.DEPENDENCY_UNMET, sectionId, blocking);
        }

        Section generating = section.toBuilder()
                .status(transition(section, SectionStatus.GENERATING))
                .build();
        return applySectionChange(state, generating);
    }

    /**
     * Records a reviewer decision.
     * <p>
     * Acceptance moves the section to {@code accepted}. Rejection requires feedback and a remaining
     * revision; it increments {@code revision}, attaches the feedback to the rejected attempt and puts
     * the section back into {@code generating}.
     *
     * @throws ReportWorkflowException {@code INVALID_SECTION_STATE} outside review,
     *         {@code FEEDBACK_REQUIRED} for a rejection without feedback,
     *         {@code REVISION_LIMIT_REACHED} at the ceiling
     */
    public ReportState submitReview(ReportState state, String sectionId, boolean accepted, String feedback)
            throws ReportWorkflowException {
        requireSectionCommandsAllowed(state, "review section");
        Section section = requireSection(state, sectionId);

        if (section.getStatus() != SectionStatus.REVIEW) {
            throw ReportWorkflowException.of(ErrorCode.INVALID_SECTION_STATE,
                    sectionId, section.getStatus().getWireName(), accepted ? "accept" : "reject");
        }

        if (accepted) {
            Section acceptedSection = section.toBuilder()
                    .status(transition(section, SectionStatus.ACCEPTED))
                    .build();
            return applySectionChange(state, acceptedSection);
        }

        if (feedback == null || feedback.isBlank()) {
            throw ReportWorkflowException.of(ErrorCode.FEEDBACK_REQUIRED, sectionId);
        }
        if (!section.hasRevisionsRemaining()) {
            throw ReportWorkflowException.of(ErrorCode.REVISION_LIMIT_REACHED, section.getMaxRevisions(), sectionId);
        }

        String trimmed = feedback.trim();
        Section regenerating = section.toBuilder()
                .status(transition(section, SectionStatus.GENERATING))
                .revision(section.getRevision() + 1)
                .history(withFeedbackOnLatest(section.getHistory(), trimmed))
                .lastFeedback(trimmed)
                .build();
        ReportState updated = applySectionChange(state, regenerating);
        return updated.toBuilder().metrics(updated.getMetrics().withRevision()).build();
    }

    /**
     * Returns a section to {@code planned}: content, history and feedback cleared, revision 0.
     * <p>
     * Dependents are left as they are; those not yet generated re-lock through the resolver.
     *
     * @throws ReportWorkflowException {@code GENERATION_IN_PROGRESS} while generating,
     *         {@code FORCE_REQUIRED} for an accepted section without {@code force}
     */
    public ReportState reset(ReportState state, String sectionId, boolean force) throws ReportWorkflowException {
        requireSectionCommandsAllowed(state, "reset section");
        Section section = requireSection(state, sectionId);

        SectionStatus status = section.getStatus();
        if (status.isGenerating()) {
            throw ReportWorkflowException.of(ErrorCode.GENERATION_IN_PROGRESS, sectionId);
        }
        if (status == SectionStatus.ACCEPTED && !force) {
            throw ReportWorkflowException.of(ErrorCode.FORCE_REQUIRED, sectionId);
        }
        if (status != SectionStatus.PLANNED) {
            transition(section, SectionStatus.PLANNED);
        }
        return applySectionChange(state, section.resetToPlanned());
    }

    // ==================== Generation outcomes ====================

    /**
     * Applies a successful generation attempt: content set, history entry appended, status {@code review}.
     *
     * @throws ReportWorkflowException {@code INVALID_SECTION_STATE} if the section is no longer generating
     */
    public ReportState completeGeneration(ReportState state, String sectionId, String content, String modelName)
            throws ReportWorkflowException {
        Section section = requireGenerating(state, sectionId, "complete generation");
        Section reviewed = section.toBuilder()
                .status(transition(section, SectionStatus.REVIEW))
                .content(content)
                .addHistory(SectionHistoryEntry.forContent(content, modelName, clock.instant(), section.getRevision()))
                .build();
        ReportState updated = applyGenerationOutcome(state, reviewed);
        return updated.toBuilder().metrics(updated.getMetrics().withGeneration()).build();
    }

    /**
     * Applies a failed generation attempt: status {@code error}, content left as it was.
     *
     * @throws ReportWorkflowException {@code INVALID_SECTION_STATE} if the section is no longer generating
     */
    public ReportState failGeneration(ReportState state, String sectionId) throws ReportWorkflowException {
        Section section = requireGenerating(state, sectionId, "fail generation");
        Section failed = section.toBuilder()
                .status(transition(section, SectionStatus.ERROR))
                .build();
        return applyGenerationOutcome(state, failed);
    }

    // ==================== Finalize protocol ====================

    /**
     * Moves a fully accepted report into {@code validating}.
     *
     * @throws ReportWorkflowException {@code FINALIZE_IN_PROGRESS} while validating or finalizing,
     *         {@code REPORT_IMMUTABLE} once completed, {@code INVALID_REPORT_STATE} otherwise
     */
    public ReportState beginFinalize(ReportState state) throws ReportWorkflowException {
        ReportStatus status = state.getReportStatus();
        if (status.isLocked()) {
            throw ReportWorkflowException.of(ErrorCode.FINALIZE_IN_PROGRESS, state.getSessionId());
        }
        if (status.isTerminal()) {
            throw ReportWorkflowException.of(ErrorCode.REPORT_IMMUTABLE, state.getSessionId());
        }
        if (status != ReportStatus.AWAITING_FINAL_REVIEW) {
            throw ReportWorkflowException.of(ErrorCode.INVALID_REPORT_STATE,
                    state.getSessionId(), status.getWireName(), "finalize");
        }
        return state.toBuilder()
                .reportStatus(transition(state.getSessionId(), status, ReportStatus.VALIDATING, "finalize"))
                .failureReason(null)
                .updatedAt(clock.instant())
                .build();
    }

    /**
     * Checks a validating report and moves it to {@code finalizing}, or to {@code failed} with a reason.
     * Validation requires every section accepted with content and an unchanged section order.
     */
    public ReportState completeValidation(ReportState state) throws ReportWorkflowException {
        requireReportStatus(state, ReportStatus.VALIDATING, "complete validation");
        List<String> problems = validationProblems(state);
        if (!problems.isEmpty()) {
            return failFinalize(state, "Validation failed: " + String.join("; ", problems));
        }
        return state.toBuilder()
                .reportStatus(transition(state.getSessionId(), ReportStatus.VALIDATING, ReportStatus.FINALIZING,
                        "complete validation"))
                .updatedAt(clock.instant())
                .build();
    }

    /**
     * Marks a finalizing report {@code completed}. The report is immutable from here on.
     */
    public ReportState completeFinalization(ReportState state) throws ReportWorkflowException {
        requireReportStatus(state, ReportStatus.FINALIZING, "complete finalization");
        return state.toBuilder()
                .reportStatus(transition(state.getSessionId(), ReportStatus.FINALIZING, ReportStatus.COMPLETED,
                        "complete finalization"))
                .updatedAt(clock.instant())
                .build();
    }

    /**
     * Moves a validating or finalizing report to {@code failed}. Section states are not touched.
     *
     * @throws ReportWorkflowException {@code INVALID_REPORT_STATE} if the report is not in the finalize protocol
     */
    public ReportState failFinalize(ReportState state, String reason) throws ReportWorkflowException {
        ReportStatus status = state.getReportStatus();
        if (!status.isLocked()) {
            throw ReportWorkflowException.of(ErrorCode.INVALID_REPORT_STATE,
                    state.getSessionId(), status.getWireName(), "fail finalize");
        }
        return state.toBuilder()
                .reportStatus(transition(state.getSessionId(), status, ReportStatus.FAILED, "fail finalize"))
                .failureReason(reason)
                .updatedAt(clock.instant())
                .build();
    }

    /**
     * Checks that a report can be exported in {@code format} by a backend offering {@code supported}.
     *
     * @throws ReportWorkflowException {@code INVALID_REPORT_STATE} before completion,
     *         {@code UNSUPPORTED_EXPORT_FORMAT} for a format the backend does not render
     */
    public void checkExport(ReportState state, ExportFormat format, Set<ExportFormat> supported)
            throws ReportWorkflowException {
        ReportStatus status = state.getReportStatus();
        if (status != ReportStatus.COMPLETED) {
            throw ReportWorkflowException.of(ErrorCode.INVALID_REPORT_STATE,
                    state.getSessionId(), status.getWireName(), "export");
        }
        if (!supported.contains(format)) {
            throw ReportWorkflowException.of(ErrorCode.UNSUPPORTED_EXPORT_FORMAT, format.getWireName());
        }
    }

    /**
     * Lists the reasons a validating report cannot be finalized.
     */
    public List<String> validationProblems(ReportState state) {
        List<String> problems = new ArrayList<>();
        if (state.getSections().isEmpty()) {
            problems.add("report has no sections");
        }
        for (Section section : state.getSections()) {
            if (section.getStatus() != SectionStatus.ACCEPTED) {
                problems.add("section '" + section.getSectionId() + "' is " + section.getStatus().getWireName());
            } else if (section.getContent() == null || section.getContent().isBlank()) {
                problems.add("section '" + section.getSectionId() + "' has no content");
            }
        }
        if (state.getSectionOrderHash() != null
                && !state.getSectionOrderHash().equals(SectionPlan.orderHash(state.getSectionIds()))) {
            problems.add("section order changed since initialization");
        }
        return problems;
    }

    // ==================== Internals ====================

    private List<Section> planSections(SectionPlan plan) throws ReportWorkflowException {
        try {
            return plan.toSections(defaultMaxRevisions);
        } catch (PlanValidationException e) {
            throw new ReportWorkflowException(ErrorCode.INVALID_PLAN,
                    ErrorCode.INVALID_PLAN.formatMessage(String.join("; ", e.getProblems())), e);
        }
    }

    private void requireSectionCommandsAllowed(ReportState state, String action) throws ReportWorkflowException {
        ReportStatus status = state.getReportStatus();
        if (status.isTerminal()) {
            throw ReportWorkflowException.of(ErrorCode.REPORT_IMMUTABLE, state.getSessionId());
        }
        if (status.isLocked()) {
            throw ReportWorkflowException.of(ErrorCode.REPORT_LOCKED, state.getSessionId(), status.getWireName());
        }
        if (!state.isUserConfirmedStart() || status == ReportStatus.UNINITIALIZED) {
            throw ReportWorkflowException.of(ErrorCode.INVALID_REPORT_STATE,
                    state.getSessionId(), status.getWireName(), action);
        }
    }

    private void requireReportStatus(ReportState state, ReportStatus expected, String action)
            throws ReportWorkflowException {
        if (state.getReportStatus() != expected) {
            throw ReportWorkflowException.of(ErrorCode.INVALID_REPORT_STATE,
                    state.getSessionId(), state.getReportStatus().getWireName(), action);
        }
    }

    private Section requireSection(ReportState state, String sectionId) throws ReportWorkflowException {
        return state.findSection(sectionId)
                .orElseThrow(() -> ReportWorkflowException.of(ErrorCode.SECTION_NOT_FOUND, sectionId));
    }

    private Section requireGenerating(ReportState state, String sectionId, String action)
            throws ReportWorkflowException {
        Section section = requireSection(state, sectionId);
        if (!section.getStatus().isGenerating()) {
            throw ReportWorkflowException.of(ErrorCode.INVALID_SECTION_STATE,
                    sectionId, section.getStatus().getWireName(), action);
        }
        return section;
    }

    /**
     * Replaces a section after a user command and re-derives the report status, clearing any failure.
     */
    private ReportState applySectionChange(ReportState state, Section changed) throws ReportWorkflowException {
        ReportState replaced = state.withSection(changed);
        ReportStatus derived = ReportStatus.derive(true, replaced.getSections());
        ReportStatus current = state.getReportStatus();
        ReportStatus next = current == derived
                ? current
                : transition(state.getSessionId(), current, derived, "update section '" + changed.getSectionId() + "'");
        return replaced.toBuilder()
                .reportStatus(next)
                .failureReason(next == ReportStatus.FAILED ? state.getFailureReason() : null)
                .updatedAt(clock.instant())
                .build();
    }

    /**
     * Replaces a section after a generation outcome. Generation cannot change the report status because
     * neither {@code review} nor {@code error} is accepted and the section was already not accepted.
     */
    private ReportState applyGenerationOutcome(ReportState state, Section changed) {
        return state.withSection(changed).toBuilder()
                .updatedAt(clock.instant())
                .build();
    }

    private static List<SectionHistoryEntry> withFeedbackOnLatest(List<SectionHistoryEntry> history, String feedback) {
        if (history.isEmpty()) {
            return history;
        }
        List<SectionHistoryEntry> updated = new ArrayList<>(history);
        int last = updated.size() - 1;
        updated.set(last, updated.get(last).withFeedback(feedback));
        return updated;
    }

    private static List<String> sectionIds(List<Section> sections) {
        return sections.stream().map(Section::getSectionId).toList();
    }

    private static SectionStatus transition(Section section, SectionStatus target) throws ReportWorkflowException {
        try {
            return section.getStatus().transitionTo(section.getSectionId(), target);
        } catch (InvalidTransitionException e) {
            throw new ReportWorkflowException(ErrorCode.INVALID_SECTION_STATE, e.getMessage(), e);
        }
    }

    private static ReportStatus transition(String sessionId, ReportStatus from, ReportStatus target, String action)
            throws ReportWorkflowException {
        try {
            return from.transitionTo(sessionId, target);
        } catch (InvalidTransitionException e) {
            throw new ReportWorkflowException(ErrorCode.INVALID_REPORT_STATE,
                    ErrorCode.INVALID_REPORT_STATE.formatMessage(sessionId, from.getWireName(), action), e);
        }
    }
}
