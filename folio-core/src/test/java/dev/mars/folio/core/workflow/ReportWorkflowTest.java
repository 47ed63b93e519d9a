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

import dev.mars.folio.core.ExportFormat;
import dev.mars.folio.core.ReportState;
import dev.mars.folio.core.ReportStatus;
import dev.mars.folio.core.Section;
import dev.mars.folio.core.SectionStatus;
import dev.mars.folio.core.exceptions.ErrorCode;
import dev.mars.folio.core.exceptions.ReportErrorKind;
import dev.mars.folio.core.exceptions.ReportWorkflowException;
import dev.mars.folio.core.plan.SectionDefinition;
import dev.mars.folio.core.plan.SectionPlan;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ReportWorkflow")
class ReportWorkflowTest {

    private static final String SESSION = "session-42";
    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");

    private ReportWorkflow workflow;

    @BeforeEach
    void setUp() {
        workflow = new ReportWorkflow(Clock.fixed(NOW, ZoneOffset.UTC), 3);
    }

    // ==================== Helpers ====================

    private ReportState init(SectionDefinition... definitions) throws ReportWorkflowException {
        return workflow.initialize(SESSION, new SectionPlan(List.of(definitions)), null);
    }

    private ReportState draftAndReview(ReportState state, String sectionId) throws ReportWorkflowException {
        ReportState generating = workflow.generate(state, sectionId);
        return workflow.completeGeneration(generating, sectionId, "Draft of " + sectionId, "model-x");
    }

    private ReportState accept(ReportState state, String sectionId) throws ReportWorkflowException {
        return workflow.submitReview(draftAndReview(state, sectionId), sectionId, true, null);
    }

    private static Section section(ReportState state, String sectionId) {
        return state.findSection(sectionId).orElseThrow();
    }

    private static ErrorCode codeOf(ReportWorkflowException e) {
        return e.getErrorCode();
    }

    // ==================== Initialization ====================

    @Nested
    @DisplayName("initialize")
    class Initialize {

        @Test
        @DisplayName("confirmed init creates an in-progress report with planned sections")
        void confirmedInit() throws ReportWorkflowException {
            ReportState state = init(SectionDefinition.of("a", "A"), SectionDefinition.of("b", "B", "a"));

            assertTrue(state.isUserConfirmedStart());
            assertEquals(ReportStatus.IN_PROGRESS, state.getReportStatus());
            assertEquals(List.of("a", "b"), state.getSectionIds());
            assertEquals(SectionPlan.orderHash(List.of("a", "b")), state.getSectionOrderHash());
            assertEquals(NOW, state.getCreatedAt());
            state.getSections().forEach(s -> {
                assertEquals(SectionStatus.PLANNED, s.getStatus());
                assertEquals(3, s.getMaxRevisions());
            });
        }

        @Test
        @DisplayName("preview returns an unconfirmed uninitialized report")
        void preview() throws ReportWorkflowException {
            ReportState preview = workflow.preview(SESSION, new SectionPlan(List.of(SectionDefinition.of("a", "A"))));

            assertFalse(preview.isUserConfirmedStart());
            assertEquals(ReportStatus.UNINITIALIZED, preview.getReportStatus());
            assertEquals(1, preview.getSections().size());
        }

        @Test
        @DisplayName("confirmed init on a confirmed report returns it unchanged")
        void idempotentInit() throws ReportWorkflowException {
            ReportState existing = accept(init(SectionDefinition.of("a", "A")), "a");

            ReportState again = workflow.initialize(SESSION,
                    new SectionPlan(List.of(SectionDefinition.of("other", "Other"))), existing);

            assertSame(existing, again);
        }

        @Test
        @DisplayName("invalid plans are rejected with INVALID_PLAN")
        void invalidPlan() {
            ReportWorkflowException empty = assertThrows(ReportWorkflowException.class, () -> init());
            assertEquals(ErrorCode.INVALID_PLAN, codeOf(empty));

            ReportWorkflowException cycle = assertThrows(ReportWorkflowException.class,
                    () -> init(SectionDefinition.of("a", "A", "b"), SectionDefinition.of("b", "B", "a")));
            assertEquals(ErrorCode.INVALID_PLAN, codeOf(cycle));
            assertEquals(ReportErrorKind.VALIDATION, cycle.getErrorKind());
        }

        @Test
        @DisplayName("section commands on an unconfirmed report are rejected")
        void commandsBeforeConfirmation() throws ReportWorkflowException {
            ReportState preview = workflow.preview(SESSION, new SectionPlan(List.of(SectionDefinition.of("a", "A"))));

            ReportWorkflowException e = assertThrows(ReportWorkflowException.class,
                    () -> workflow.generate(preview, "a"));
            assertEquals(ErrorCode.INVALID_REPORT_STATE, codeOf(e));
        }
    }

    // ==================== Generation ====================

    @Nested
    @DisplayName("generate")
    class Generate {

        @Test
        @DisplayName("Scenario A/B: B is refused until A is accepted")
        void dependencyScenario() throws ReportWorkflowException {
            ReportState state = init(SectionDefinition.of("A", "A"), SectionDefinition.of("B", "B", "A"));

            ReportState initial = state;
            ReportWorkflowException e = assertThrows(ReportWorkflowException.class,
                    () -> workflow.generate(initial, "B"));
            assertEquals(ErrorCode.DEPENDENCY_UNMET, codeOf(e));
            assertTrue(e.getMessage().contains("[A]"));

            state = accept(state, "A");
            state = workflow.generate(state, "B");
            assertEquals(SectionStatus.GENERATING, section(state, "B").getStatus());
        }

        @Test
        @DisplayName("dependency in review still blocks generation")
        void dependencyInReviewBlocks() throws ReportWorkflowException {
            ReportState state = draftAndReview(
                    init(SectionDefinition.of("A", "A"), SectionDefinition.of("B", "B", "A")), "A");

            ReportState reviewed = state;
            assertEquals(ErrorCode.DEPENDENCY_UNMET, codeOf(assertThrows(ReportWorkflowException.class,
                    () -> workflow.generate(reviewed, "B"))));
        }

        @Test
        @DisplayName("duplicate generate while generating is a conflict")
        void duplicateGenerate() throws ReportWorkflowException {
            ReportState generating = workflow.generate(init(SectionDefinition.of("a", "A")), "a");

            ReportWorkflowException e = assertThrows(ReportWorkflowException.class,
                    () -> workflow.generate(generating, "a"));
            assertEquals(ErrorCode.GENERATION_IN_PROGRESS, codeOf(e));
            assertEquals(ReportErrorKind.CONFLICT, e.getErrorKind());
        }

        @Test
        @DisplayName("generate from review or accepted is invalid")
        void generateFromReview() throws ReportWorkflowException {
            ReportState review = draftAndReview(init(SectionDefinition.of("a", "A")), "a");

            assertEquals(ErrorCode.INVALID_SECTION_STATE, codeOf(assertThrows(ReportWorkflowException.class,
                    () -> workflow.generate(review, "a"))));
        }

        @Test
        @DisplayName("unknown section is SECTION_NOT_FOUND")
        void unknownSection() throws ReportWorkflowException {
            ReportState state = init(SectionDefinition.of("a", "A"));
            assertEquals(ErrorCode.SECTION_NOT_FOUND, codeOf(assertThrows(ReportWorkflowException.class,
                    () -> workflow.generate(state, "nope"))));
        }

        @Test
        @DisplayName("completion moves to review, records history and keeps revision")
        void completion() throws ReportWorkflowException {
            ReportState state = draftAndReview(init(SectionDefinition.of("a", "A")), "a");

            Section a = section(state, "a");
            assertEquals(SectionStatus.REVIEW, a.getStatus());
            assertEquals("Draft of a", a.getContent());
            assertEquals(0, a.getRevision());
            assertEquals(1, a.getHistory().size());
            assertEquals("model-x", a.getHistory().get(0).getModelName());
            assertTrue(a.getHistory().get(0).getContentSnapshotRef().startsWith("sha256:"));
            assertEquals(NOW, a.getHistory().get(0).getTimestamp());
            assertEquals(1, state.getMetrics().getGenerationCount());
        }

        @Test
        @DisplayName("failure moves to error and keeps earlier content; retry is free")
        void failureAndRetry() throws ReportWorkflowException {
            ReportState state = init(SectionDefinition.of("a", "A"));
            state = workflow.failGeneration(workflow.generate(state, "a"), "a");

            Section a = section(state, "a");
            assertEquals(SectionStatus.ERROR, a.getStatus());
            assertNull(a.getContent());

            state = workflow.generate(state, "a");
            assertEquals(SectionStatus.GENERATING, section(state, "a").getStatus());
            assertEquals(0, section(state, "a").getRevision());
        }

        @Test
        @DisplayName("completion for a section that is no longer generating is rejected")
        void staleCompletion() throws ReportWorkflowException {
            ReportState state = init(SectionDefinition.of("a", "A"));

            ReportState planned = state;
            assertEquals(ErrorCode.INVALID_SECTION_STATE, codeOf(assertThrows(ReportWorkflowException.class,
                    () -> workflow.completeGeneration(planned, "a", "late", "m"))));
        }
    }

    // ==================== Review ====================

    @Nested
    @DisplayName("submitReview")
    class SubmitReview {

        @Test
        @DisplayName("accepting twice: the second is an error, not a transition")
        void doubleAccept() throws ReportWorkflowException {
            ReportState accepted = accept(init(SectionDefinition.of("a", "A")), "a");

            ReportWorkflowException e = assertThrows(ReportWorkflowException.class,
                    () -> workflow.submitReview(accepted, "a", true, null));
            assertEquals(ErrorCode.INVALID_SECTION_STATE, codeOf(e));
            assertEquals(SectionStatus.ACCEPTED, section(accepted, "a").getStatus());
        }

        @Test
        @DisplayName("rejection requires feedback")
        void feedbackRequired() throws ReportWorkflowException {
            ReportState review = draftAndReview(init(SectionDefinition.of("a", "A")), "a");

            assertEquals(ErrorCode.FEEDBACK_REQUIRED, codeOf(assertThrows(ReportWorkflowException.class,
                    () -> workflow.submitReview(review, "a", false, "   "))));
            assertEquals(ErrorCode.FEEDBACK_REQUIRED, codeOf(assertThrows(ReportWorkflowException.class,
                    () -> workflow.submitReview(review, "a", false, null))));
        }

        @Test
        @DisplayName("rejection increments revision, records feedback and regenerates")
        void rejection() throws ReportWorkflowException {
            ReportState review = draftAndReview(init(SectionDefinition.of("a", "A")), "a");

            ReportState state = workflow.submitReview(review, "a", false, " More citations ");
            Section a = section(state, "a");

            assertEquals(SectionStatus.GENERATING, a.getStatus());
            assertEquals(1, a.getRevision());
            assertEquals("More citations", a.getLastFeedback());
            assertEquals("More citations", a.getHistory().get(0).getFeedback());
            assertEquals(1, state.getMetrics().getTotalRevisions());
        }

        @Test
        @DisplayName("max_revisions=2: two rejections allowed, the third refused without mutation")
        void revisionCeiling() throws ReportWorkflowException {
            ReportState state = init(new SectionDefinition("a", "A", null, null, 2));
            state = draftAndReview(state, "a");

            state = workflow.submitReview(state, "a", false, "first");
            state = workflow.completeGeneration(state, "a", "v2", "model-x");
            assertEquals(1, section(state, "a").getRevision());

            state = workflow.submitReview(state, "a", false, "second");
            state = workflow.completeGeneration(state, "a", "v3", "model-x");
            assertEquals(2, section(state, "a").getRevision());

            ReportState atCeiling = state;
            ReportWorkflowException e = assertThrows(ReportWorkflowException.class,
                    () -> workflow.submitReview(atCeiling, "a", false, "third"));
            assertEquals(ErrorCode.REVISION_LIMIT_REACHED, codeOf(e));
            assertEquals(SectionStatus.REVIEW, section(atCeiling, "a").getStatus());
            assertEquals(2, section(atCeiling, "a").getRevision());

            ReportState accepted = workflow.submitReview(atCeiling, "a", true, null);
            assertEquals(SectionStatus.ACCEPTED, section(accepted, "a").getStatus());
        }

        @Test
        @DisplayName("reaching all-accepted in any order gives awaiting_final_review")
        void acceptanceOrderIndependence() throws ReportWorkflowException {
            SectionDefinition[] plan = {
                    SectionDefinition.of("x", "X"), SectionDefinition.of("y", "Y"), SectionDefinition.of("z", "Z")};

            ReportState forward = init(plan);
            for (String id : List.of("x", "y", "z")) {
                assertEquals(ReportStatus.IN_PROGRESS, forward.getReportStatus());
                forward = accept(forward, id);
            }
            ReportState backward = init(plan);
            for (String id : List.of("z", "x", "y")) {
                assertEquals(ReportStatus.IN_PROGRESS, backward.getReportStatus());
                backward = accept(backward, id);
            }

            assertEquals(ReportStatus.AWAITING_FINAL_REVIEW, forward.getReportStatus());
            assertEquals(ReportStatus.AWAITING_FINAL_REVIEW, backward.getReportStatus());
        }
    }

    // ==================== Reset ====================

    @Nested
    @DisplayName("reset")
    class Reset {

        @Test
        @DisplayName("reset clears content, history and revision")
        void resetClears() throws ReportWorkflowException {
            ReportState state = draftAndReview(init(SectionDefinition.of("a", "A")), "a");
            state = workflow.submitReview(state, "a", false, "again");
            state = workflow.completeGeneration(state, "a", "v2", "m");

            state = workflow.reset(state, "a", false);
            Section a = section(state, "a");

            assertEquals(SectionStatus.PLANNED, a.getStatus());
            assertEquals(0, a.getRevision());
            assertNull(a.getContent());
            assertTrue(a.getHistory().isEmpty());
            assertNull(a.getLastFeedback());
        }

        @Test
        @DisplayName("resetting an accepted section needs force and does not cascade")
        void forcedReset() throws ReportWorkflowException {
            ReportState state = init(SectionDefinition.of("a", "A"), SectionDefinition.of("b", "B", "a"));
            state = accept(state, "a");
            state = accept(state, "b");
            assertEquals(ReportStatus.AWAITING_FINAL_REVIEW, state.getReportStatus());

            ReportState allAccepted = state;
            ReportWorkflowException e = assertThrows(ReportWorkflowException.class,
                    () -> workflow.reset(allAccepted, "a", false));
            assertEquals(ErrorCode.FORCE_REQUIRED, codeOf(e));

            state = workflow.reset(state, "a", true);
            assertEquals(SectionStatus.PLANNED, section(state, "a").getStatus());
            assertEquals(SectionStatus.ACCEPTED, section(state, "b").getStatus());
            assertEquals(ReportStatus.IN_PROGRESS, state.getReportStatus());
        }

        @Test
        @DisplayName("resetting a generating section is a conflict")
        void resetWhileGenerating() throws ReportWorkflowException {
            ReportState generating = workflow.generate(init(SectionDefinition.of("a", "A")), "a");

            ReportWorkflowException e = assertThrows(ReportWorkflowException.class,
                    () -> workflow.reset(generating, "a", true));
            assertEquals(ErrorCode.GENERATION_IN_PROGRESS, codeOf(e));
        }

        @Test
        @DisplayName("resetting an error section needs no force")
        void resetFromError() throws ReportWorkflowException {
            ReportState state = init(SectionDefinition.of("a", "A"));
            state = workflow.failGeneration(workflow.generate(state, "a"), "a");

            state = workflow.reset(state, "a", false);
            assertEquals(SectionStatus.PLANNED, section(state, "a").getStatus());
        }
    }

    // ==================== Finalize and export ====================

    @Nested
    @DisplayName("finalize and export")
    class FinalizeAndExport {

        private ReportState awaiting() throws ReportWorkflowException {
            ReportState state = init(SectionDefinition.of("a", "A"), SectionDefinition.of("b", "B", "a"));
            return accept(accept(state, "a"), "b");
        }

        @Test
        @DisplayName("finalize while in progress is rejected")
        void finalizeInProgress() throws ReportWorkflowException {
            ReportState state = init(SectionDefinition.of("a", "A"));

            ReportWorkflowException e = assertThrows(ReportWorkflowException.class,
                    () -> workflow.beginFinalize(state));
            assertEquals(ErrorCode.INVALID_REPORT_STATE, codeOf(e));
            assertEquals(ReportErrorKind.VALIDATION, e.getErrorKind());
        }

        @Test
        @DisplayName("full protocol: validating → finalizing → completed, then immutable")
        void fullProtocol() throws ReportWorkflowException {
            ReportState state = workflow.beginFinalize(awaiting());
            assertEquals(ReportStatus.VALIDATING, state.getReportStatus());

            ReportState validating = state;
            assertEquals(ErrorCode.FINALIZE_IN_PROGRESS, codeOf(assertThrows(ReportWorkflowException.class,
                    () -> workflow.beginFinalize(validating))));
            ReportWorkflowException locked = assertThrows(ReportWorkflowException.class,
                    () -> workflow.reset(validating, "a", true));
            assertEquals(ErrorCode.REPORT_LOCKED, codeOf(locked));
            assertEquals(ReportErrorKind.CONFLICT, locked.getErrorKind());

            state = workflow.completeValidation(state);
            assertEquals(ReportStatus.FINALIZING, state.getReportStatus());

            state = workflow.completeFinalization(state);
            assertEquals(ReportStatus.COMPLETED, state.getReportStatus());

            ReportState completed = state;
            assertEquals(ErrorCode.REPORT_IMMUTABLE, codeOf(assertThrows(ReportWorkflowException.class,
                    () -> workflow.reset(completed, "a", true))));
            assertEquals(ErrorCode.REPORT_IMMUTABLE, codeOf(assertThrows(ReportWorkflowException.class,
                    () -> workflow.beginFinalize(completed))));
            assertDoesNotThrow(() -> workflow.checkExport(completed, ExportFormat.MARKDOWN,
                    EnumSet.of(ExportFormat.MARKDOWN)));
        }

        @Test
        @DisplayName("export before completion is rejected")
        void exportBeforeCompletion() throws ReportWorkflowException {
            ReportState state = awaiting();

            ReportWorkflowException e = assertThrows(ReportWorkflowException.class,
                    () -> workflow.checkExport(state, ExportFormat.PDF, EnumSet.allOf(ExportFormat.class)));
            assertEquals(ErrorCode.INVALID_REPORT_STATE, codeOf(e));
        }

        @Test
        @DisplayName("unsupported export format fails cleanly")
        void unsupportedFormat() throws ReportWorkflowException {
            ReportState completed = workflow.completeFinalization(
                    workflow.completeValidation(workflow.beginFinalize(awaiting())));

            ReportWorkflowException e = assertThrows(ReportWorkflowException.class,
                    () -> workflow.checkExport(completed, ExportFormat.DOCX, Set.of(ExportFormat.MARKDOWN)));
            assertEquals(ErrorCode.UNSUPPORTED_EXPORT_FORMAT, codeOf(e));
        }

        @Test
        @DisplayName("validation fails when the section order changed")
        void validationFailure() throws ReportWorkflowException {
            ReportState validating = workflow.beginFinalize(awaiting());
            ReportState tampered = validating.toBuilder().sectionOrderHash("sha256:other").build();

            ReportState failed = workflow.completeValidation(tampered);

            assertEquals(ReportStatus.FAILED, failed.getReportStatus());
            assertTrue(failed.getFailureReason().contains("section order changed"));
            assertEquals(SectionStatus.ACCEPTED, section(failed, "a").getStatus());
        }

        @Test
        @DisplayName("a section command on a failed report clears the failure")
        void recoverFromFailure() throws ReportWorkflowException {
            ReportState failed = workflow.failFinalize(workflow.beginFinalize(awaiting()), "renderer crashed");
            assertEquals(ReportStatus.FAILED, failed.getReportStatus());
            assertEquals(ErrorCode.INVALID_REPORT_STATE, codeOf(assertThrows(ReportWorkflowException.class,
                    () -> workflow.beginFinalize(failed))));

            ReportState reset = workflow.reset(failed, "b", true);

            assertEquals(ReportStatus.IN_PROGRESS, reset.getReportStatus());
            assertNull(reset.getFailureReason());

            ReportState again = accept(reset, "b");
            assertEquals(ReportStatus.AWAITING_FINAL_REVIEW, again.getReportStatus());
        }
    }
}
