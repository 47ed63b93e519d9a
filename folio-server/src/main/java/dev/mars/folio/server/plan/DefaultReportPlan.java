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

import java.util.List;

/**
 * The research report outline used when an init request carries no plan of its own.
 *
 * <p>Abstract first, then ten chapters and an evidence appendix. The abstract is written last: it
 * depends on the introduction, methodology, implementation, results and conclusion.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class DefaultReportPlan {

    private static final SectionPlan PLAN = new SectionPlan(List.of(
            section("abstract", "Abstract", "Concise synthesis of the entire report (Generated Last).",
                    "chapter_1", "chapter_4", "chapter_6", "chapter_8", "chapter_9"),
            section("chapter_1", "Chapter 1: Introduction", "Background, problem statement, and objectives."),
            section("chapter_2", "Chapter 2: Literature Review", "Review of existing works and identification of gaps."),
            section("chapter_3", "Chapter 3: System Analysis", "Feasibility and requirements analysis."),
            section("chapter_4", "Chapter 4: Methodology", "Algorithms and modular decomposition."),
            section("chapter_5", "Chapter 5: System Design", "UML diagrams and architectural design."),
            section("chapter_6", "Chapter 6: System Implementation", "Details of the development process."),
            section("chapter_7", "Chapter 7: System Testing", "Testing strategies and summary."),
            section("chapter_8", "Chapter 8: Results", "Performance analysis and metrics."),
            section("chapter_9", "Chapter 9: Conclusion", "Summary of achievements."),
            section("chapter_10", "Chapter 10: Future Scope", "Future enhancements."),
            section("appendix", "Evidence Appendix", "Appendix and References.")
    ));

    private DefaultReportPlan() {
    }

    public static SectionPlan get() {
        return PLAN;
    }

    private static SectionDefinition section(String id, String title, String description, String... dependsOn) {
        return new SectionDefinition(id, title, description, List.of(dependsOn), null);
    }
}
