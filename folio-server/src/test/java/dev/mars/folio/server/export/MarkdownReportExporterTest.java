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

import dev.mars.folio.core.ExportArtifact;
import dev.mars.folio.core.ExportFormat;
import dev.mars.folio.core.ReportState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for MarkdownReportExporter and ReportExporterRegistry.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@DisplayName("MarkdownReportExporter Tests")
class MarkdownReportExporterTest {

    private final MarkdownReportExporter exporter = new MarkdownReportExporter();

    @Test
    @DisplayName("Sections are concatenated in authoring order with their titles")
    void testExport() throws Exception {
        ReportState report = ExportFixtures.accepted("session-7", "Why this matters.", "## Findings\n\nIt worked.");

        ExportArtifact artifact = exporter.export(report);
        String markdown = new String(artifact.getContent(), StandardCharsets.UTF_8);

        assertEquals("# Introduction\n\nWhy this matters.\n\n## Findings\n\nIt worked.\n", markdown);
        assertEquals(ExportFormat.MARKDOWN, artifact.getFormat());
        assertEquals(ExportFormat.MARKDOWN.getContentType(), artifact.getContentType());
        assertEquals("report-session-7.md", artifact.getFileName());
    }

    @Test
    @DisplayName("A section without content cannot be exported")
    void testMissingContent() throws Exception {
        ReportState report = ExportFixtures.unwritten("session-7");

        assertThrows(ExportException.class, () -> exporter.export(report));
    }

    @Test
    @DisplayName("The registry offers only enabled formats that have an exporter")
    void testRegistry() {
        List<ReportExporter> markdownOnly = List.of(exporter);
        ReportExporterRegistry none = new ReportExporterRegistry(markdownOnly, EnumSet.of(ExportFormat.PDF));
        ReportExporterRegistry markdown = new ReportExporterRegistry(markdownOnly, EnumSet.of(ExportFormat.MARKDOWN));

        assertTrue(none.supportedFormats().isEmpty());
        assertTrue(none.find(ExportFormat.MARKDOWN).isEmpty());
        assertEquals(Set.of(ExportFormat.MARKDOWN), markdown.supportedFormats());
    }

    @Test
    @DisplayName("The built-in registry renders every format it is allowed to")
    void testDefaultRegistry() {
        ReportExporterRegistry all = ReportExporterRegistry.withDefaults(EnumSet.allOf(ExportFormat.class));
        ReportExporterRegistry docx = ReportExporterRegistry.withDefaults(EnumSet.of(ExportFormat.DOCX));

        assertEquals(EnumSet.allOf(ExportFormat.class), all.supportedFormats());
        assertInstanceOf(PdfReportExporter.class, all.find(ExportFormat.PDF).orElseThrow());
        assertInstanceOf(DocxReportExporter.class, all.find(ExportFormat.DOCX).orElseThrow());
        assertEquals(Set.of(ExportFormat.DOCX), docx.supportedFormats());
    }
}
