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

package dev.mars.folio.server.export;

import dev.mars.folio.core.ReportState;
import dev.mars.folio.core.exceptions.ReportWorkflowException;
import dev.mars.folio.core.plan.SectionDefinition;
import dev.mars.folio.core.plan.SectionPlan;
import dev.mars.folio.core.workflow.ReportWorkflow;

import java.util.List;

/**
 * Completed-looking reports for exporter tests: two accepted sections, intro before findings.
 */
final class ExportFixtures {

    private static final ReportWorkflow WORKFLOW = new ReportWorkflow();

    private ExportFixtures() {
    }

    static ReportState accepted(String sessionId, String introContent, String findingsContent)
            throws ReportWorkflowException {
        ReportState report = WORKFLOW.initialize(sessionId, new SectionPlan(List.of(
                SectionDefinition.of("intro", "Introduction"),
                SectionDefinition.of("findings", "Findings", "intro"))), null);
        report = WORKFLOW.generate(report, "intro");
        report = WORKFLOW.completeGeneration(report, "intro", introContent, "m");
        report = WORKFLOW.submitReview(report, "intro", true, null);
        report = WORKFLOW.generate(report, "findings");
        report = WORKFLOW.completeGeneration(report, "findings", findingsContent, "m");
        return WORKFLOW.submitReview(report, "findings", true, null);
    }

    static ReportState unwritten(String sessionId) throws ReportWorkflowException {
        return WORKFLOW.initialize(sessionId,
                new SectionPlan(List.of(SectionDefinition.of("intro", "Introduction"))), null);
    }
}
