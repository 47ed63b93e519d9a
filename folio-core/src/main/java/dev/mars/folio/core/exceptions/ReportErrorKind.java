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

package dev.mars.folio.core.exceptions;

/**
 * Stable classification of every failure a report command can produce.
 *
 * <p>Presentation code switches on this kind, never on HTTP status codes or exception types.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public enum ReportErrorKind {

    /** Precondition not met (dependency, revision budget, wrong phase). Never retried; nothing mutated. */
    VALIDATION,

    /** Someone or something is already handling this. Resynchronize and show current truth. */
    CONFLICT,

    /** Report or section does not exist. For a report this means "not started". */
    NOT_FOUND,

    /** The backend could not be reached or answered with a transient failure. */
    TRANSPORT,

    /** The backend failed while processing the command. */
    BACKEND_FAILURE;

    /**
     * Whether the caller should resynchronize after seeing this kind of failure.
     *
     * @return {@code true} for conflicts and transport failures
     */
    public boolean isRecoverable() {
        return this == CONFLICT || this == TRANSPORT;
    }
}
