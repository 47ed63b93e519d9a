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

import dev.mars.folio.core.ReportStatus;
import dev.mars.folio.core.SectionStatus;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class InvalidTransitionExceptionTest {

    @Test
    void messageNamesEntityStatesAndTargets() {
        InvalidTransitionException e = new InvalidTransitionException("methods",
                SectionStatus.REVIEW, SectionStatus.ERROR, SectionStatus.REVIEW.getValidTransitions());

        assertEquals("Invalid transition for 'methods': REVIEW → ERROR. Valid targets: [GENERATING, ACCEPTED, PLANNED]",
                e.getMessage());
        assertInstanceOf(FolioException.class, e);
    }

    @Test
    void terminalStateFormatsEmptyTargets() {
        InvalidTransitionException e = new InvalidTransitionException("session-1",
                ReportStatus.COMPLETED, ReportStatus.IN_PROGRESS, ReportStatus.COMPLETED.getValidTransitions());

        assertTrue(e.getMessage().endsWith("Valid targets: []"));
        assertEquals(0, e.getValidTransitions().length);
    }

    @Test
    void nullTargetsFormatAsEmpty() {
        InvalidTransitionException e = new InvalidTransitionException("x",
                SectionStatus.PLANNED, SectionStatus.ACCEPTED, null);

        assertTrue(e.getMessage().endsWith("Valid targets: []"));
    }
}
