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

import java.util.Locale;

/**
 * Lifecycle states for a report section.
 * <p>
 * Sections follow a defined lifecycle:
 * <pre>
 *   PLANNED → GENERATING → REVIEW → ACCEPTED
 *   REVIEW → GENERATING (regenerate with feedback)
 *   GENERATING → ERROR → GENERATING (retry)
 *   REVIEW, ACCEPTED, ERROR → PLANNED (reset)
 * </pre>
 * Wire values are the lowercase names ({@code "planned"}, {@code "generating"}, ...).
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public enum SectionStatus {

    /**
     * Section is part of the plan and has no content yet.
     * Initial state, and the state every reset returns to.
     */
    PLANNED,

    /**
     * A generation attempt has been issued and has not completed yet.
     */
    GENERATING,

    /**
     * Generated content is waiting for the reviewer.
     */
    REVIEW,

    /**
     * Reviewer accepted the content. Dependents unlock.
     */
    ACCEPTED,

    /**
     * The last generation attempt failed. Content, if any, is from an earlier attempt.
     */
    ERROR;

    /**
     * Check if a generation attempt is outstanding for this section.
     *
     * @return {@code true} while generating
     */
    public boolean isGenerating() {
        return this == GENERATING;
    }

    /**
     * Check if a new generation attempt may start from this status (first draft or retry).
     *
     * @return {@code true} for {@link #PLANNED} and {@link #ERROR}
     */
    public boolean canStartGeneration() {
        return this == PLANNED || this == ERROR;
    }

    /**
     * Checks whether a transition from this status to the given target status is valid.
     *
     * <p><strong>Valid transitions:</strong></p>
     * <pre>
     *   PLANNED    → GENERATING
     *   GENERATING → REVIEW, ERROR
     *   REVIEW     → GENERATING, ACCEPTED, PLANNED
     *   ACCEPTED   → PLANNED
     *   ERROR      → GENERATING, PLANNED
     * </pre>
     *
     * @param target the target status to transition to
     * @return {@code true} if the transition is valid, {@code false} otherwise
     */
    public boolean canTransitionTo(SectionStatus target) {
        return switch (this) {
            case PLANNED -> target == GENERATING;
            case GENERATING -> target == REVIEW || target == ERROR;
            case REVIEW -> target == GENERATING || target == ACCEPTED || target == PLANNED;
            case ACCEPTED -> target == PLANNED;
            case ERROR -> target == GENERATING || target == PLANNED;
        };
    }

    /**
     * Returns all valid target statuses that this status can transition to.
     *
     * @return array of valid target statuses
     */
    public SectionStatus[] getValidTransitions() {
        return switch (this) {
            case PLANNED -> new SectionStatus[]{GENERATING};
            case GENERATING -> new SectionStatus[]{REVIEW, ERROR};
            case REVIEW -> new SectionStatus[]{GENERATING, ACCEPTED, PLANNED};
            case ACCEPTED -> new SectionStatus[]{PLANNED};
            case ERROR -> new SectionStatus[]{GENERATING, PLANNED};
        };
    }

    /**
     * Returns {@code target} if the move is allowed, otherwise throws.
     *
     * @param sectionId the section being moved, used in the exception message
     * @param target    the requested status
     * @return the target status
     * @throws InvalidTransitionException if the transition table has no such edge
     */
    public SectionStatus transitionTo(String sectionId, SectionStatus target) throws InvalidTransitionException {
        if (!canTransitionTo(target)) {
            throw new InvalidTransitionException(sectionId, this, target, getValidTransitions());
        }
        return target;
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
    public static SectionStatus fromWireName(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Section status cannot be null");
        }
        return SectionStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
