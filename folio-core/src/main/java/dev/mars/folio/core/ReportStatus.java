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

package dev.mars.folio.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import dev.mars.folio.core.exceptions.InvalidTransitionException;

import java.util.Collection;
import java.util.Locale;

/**
 * Lifecycle states for a report.
 * <p>
 * {@link #UNINITIALIZED}, {@link #IN_PROGRESS} and {@link #AWAITING_FINAL_REVIEW} are derived from
 * the confirmation flag and the section statuses (see {@link #derive(boolean, Collection)}).
 * {@link #VALIDATING}, {@link #FINALIZING}, {@link #COMPLETED} and {@link #FAILED} are set by the
 * backend while it runs the finalize protocol.
 * <pre>
 *   UNINITIALIZED → IN_PROGRESS → AWAITING_FINAL_REVIEW → VALIDATING → FINALIZING → COMPLETED
 *   VALIDATING, FINALIZING → FAILED → IN_PROGRESS (section edited)
 * </pre>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public enum ReportStatus {

    /** No report exists yet, or the user has not confirmed the start. */
    UNINITIALIZED,

    /** At least one section is not accepted. */
    IN_PROGRESS,

    /** Backend is checking the accepted sections before assembling the report. */
    VALIDATING,

    /** Every section is accepted and finalize has not been requested. */
    AWAITING_FINAL_REVIEW,

    /** Backend is assembling the final document. */
    FINALIZING,

    /** Final document assembled. Terminal; the report is immutable. */
    COMPLETED,

    /** Validation or assembly failed. Sections stay as they are for the user to edit. */
    FAILED;

    /**
     * Check if this status represents a terminal state.
     *
     * @return {@code true} only for {@link #COMPLETED}
     */
    public boolean isTerminal() {
        return this == COMPLETED;
    }

    /**
     * Check if the backend is running the finalize protocol, during which section commands are refused.
     *
     * @return {@code true} for {@link #VALIDATING} and {@link #FINALIZING}
     */
    public boolean isLocked() {
        return this == VALIDATING || this == FINALIZING;
    }

    /**
     * Checks whether a transition from this status to the given target status is valid.
     *
     * <p><strong>Valid transitions:</strong></p>
     * <pre>
     *   UNINITIALIZED         → IN_PROGRESS
     *   IN_PROGRESS           → AWAITING_FINAL_REVIEW
     *   AWAITING_FINAL_REVIEW → IN_PROGRESS, VALIDATING
     *   VALIDATING            → FINALIZING, FAILED
     *   FINALIZING            → COMPLETED, FAILED
     *   FAILED                → IN_PROGRESS, AWAITING_FINAL_REVIEW
     *   COMPLETED             → (terminal, no transitions)
     * </pre>
     *
     * @param target the target status to transition to
     * @return {@code true} if the transition is valid, {@code false} otherwise
     */
    public boolean canTransitionTo(ReportStatus target) {
        return switch (this) {
            case UNINITIALIZED -> target == IN_PROGRESS;
            case IN_PROGRESS -> target == AWAITING_FINAL_REVIEW;
            case AWAITING_FINAL_REVIEW -> target == IN_PROGRESS || target == VALIDATING;
            case VALIDATING -> target == FINALIZING || target == FAILED;
            case FINALIZING -> target == COMPLETED || target == FAILED;
            case FAILED -> target == IN_PROGRESS || target == AWAITING_FINAL_REVIEW;
            case COMPLETED -> false;
        };
    }

    /**
     * Returns all valid target statuses that this status can transition to.
     *
     * @return array of valid target statuses (empty for terminal states)
     */
    public ReportStatus[] getValidTransitions() {
        return switch (this) {
            case UNINITIALIZED -> new ReportStatus[]{IN_PROGRESS};
            case IN_PROGRESS -> new ReportStatus[]{AWAITING_FINAL_REVIEW};
            case AWAITING_FINAL_REVIEW -> new ReportStatus[]{IN_PROGRESS, VALIDATING};
            case VALIDATING -> new ReportStatus[]{FINALIZING, FAILED};
            case FINALIZING -> new ReportStatus[]{COMPLETED, FAILED};
            case FAILED -> new ReportStatus[]{IN_PROGRESS, AWAITING_FINAL_REVIEW};
            case COMPLETED -> new ReportStatus[0];
        };
    }

    /**
     * Returns {@code target} if the move is allowed, otherwise throws.
     *
     * @param sessionId the report being moved, used in the exception message
     * @param target    the requested status
     * @return the target status
     * @throws InvalidTransitionException if the transition table has no such edge
     */
    public ReportStatus transitionTo(String sessionId, ReportStatus target) throws InvalidTransitionException {
        if (!canTransitionTo(target)) {
            throw new InvalidTransitionException(sessionId, this, target, getValidTransitions());
        }
        return target;
    }

    /**
     * Computes the status implied by the confirmation flag and the section statuses alone.
     * <p>
     * An unconfirmed report is {@link #UNINITIALIZED}. A confirmed report is
     * {@link #AWAITING_FINAL_REVIEW} when every section is accepted (vacuously so for no sections),
     * otherwise {@link #IN_PROGRESS}. The result does not depend on the order sections were accepted.
     *
     * @param userConfirmedStart whether the user confirmed the start
     * @param sections           the sections of the report
     * @return the derived status, never one of the backend transients
     */
    public static ReportStatus derive(boolean userConfirmedStart, Collection<Section> sections) {
        if (!userConfirmedStart) {
            return UNINITIALIZED;
        }
        boolean allAccepted = sections.stream().allMatch(s -> s.getStatus() == SectionStatus.ACCEPTED);
        return allAccepted ? AWAITING_FINAL_REVIEW : IN_PROGRESS;
    }

    @JsonValue
    public String getWireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a wire value, case-insensitively.
     *
     * @throws IllegalArgumentException for unknown values
     */
    @JsonCreator
    public static ReportStatus fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Report status cannot be null");
        }
        return ReportStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
