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

package dev.mars.folio.server.plan;

import dev.mars.folio.core.plan.SectionDefinition;
import dev.mars.folio.core.plan.SectionPlan;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for DefaultReportPlan.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@DisplayName("DefaultReportPlan Tests")
class DefaultReportPlanTest {

    @Test
    @DisplayName("The outline is valid and in authoring order")
    void testOutline() {
        SectionPlan plan = DefaultReportPlan.get();

        assertTrue(plan.validate().isValid(), () -> plan.validate().getMessages().toString());
        List<String> ids = plan.getDefinitions().stream()
                .map(SectionDefinition::getSectionId)
                .collect(Collectors.toList());
        assertEquals(12, ids.size());
        assertEquals("abstract", ids.get(0));
        assertEquals("chapter_1", ids.get(1));
        assertEquals("appendix", ids.get(11));
    }

    @Test
    @DisplayName("The abstract is written last, after the chapters it summarizes")
    void testAbstractDependencies() {
        SectionDefinition abstractSection = DefaultReportPlan.get().getDefinitions().get(0);

        assertEquals(List.of("chapter_1", "chapter_4", "chapter_6", "chapter_8", "chapter_9"),
                abstractSection.getDependsOn());
        assertTrue(DefaultReportPlan.get().getDefinitions().stream()
                .filter(definition -> !definition.getSectionId().equals("abstract"))
                .allMatch(definition -> definition.getDependsOn().isEmpty()));
    }
}
