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

package dev.mars.folio.client;

import dev.mars.folio.core.ExportArtifact;
import dev.mars.folio.core.ExportFormat;
import dev.mars.folio.core.ReportState;
import dev.mars.folio.core.Section;
import dev.mars.folio.core.plan.SectionPlan;
import io.vertx.core.Future;

import java.util.Optional;

/**
 * Logical operations of the authoritative report backend.
 *
 * <p>Every failed future carries a {@link ReportClientException}; implementations never surface raw
 * transport errors.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public interface ReportBackend {

    /**
     * Initializes the report for a session.
     *
     * @param sessionId the research session
     * @param confirm   {@code false} for a dry run that persists nothing
     * @param plan      the sections to create, or {@code null} for the backend's default outline
     */
    Future<ReportState> init(String sessionId, boolean confirm, SectionPlan plan);

    /**
     * Fetches the authoritative report.
     *
     * @return the report, or an empty optional when the backend has none for the session
     */
    Future<Optional<ReportState>> getState(String sessionId);

    /**
     * Requests the first draft of a section, or a retry after an error. Returns the section as accepted.
     */
    Future<Section> generateSection(String sessionId, String sectionId);

    Future<Section> submitReview(String sessionId, String sectionId, boolean accepted, String feedback);

    Future<Section> resetSection(String sessionId, String sectionId, boolean force);

    /**
     * Starts the finalize protocol. Returns the report as it entered validation.
     */
    Future<ReportState> finalizeReport(String sessionId);

    Future<ExportArtifact> export(String sessionId, ExportFormat format);

    /**
     * Releases the underlying connections.
     */
    Future<Void> close();
}
