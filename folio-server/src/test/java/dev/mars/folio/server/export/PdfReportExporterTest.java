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
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for PdfReportExporter. Rendered documents are read back with PDFBox's text stripper.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@DisplayName("PdfReportExporter Tests")
class PdfReportExporterTest {

    private final PdfReportExporter exporter = new PdfReportExporter();

    private static String text(ExportArtifact artifact) throws Exception {
        try (PDDocument document = Loader.loadPDF(artifact.getContent())) {
            return new PDFTextStripper().getText(document);
        }
    }

    @Test
    @DisplayName("Sections are rendered in authoring order under their headings")
    void testExport() throws Exception {
        ReportState report = ExportFixtures.accepted("session-pdf", "Why this matters.",
                "## Findings\n\n- It worked.\n\n| Site | Result |\n|---|---|\n| north | pass |");

        ExportArtifact artifact = exporter.export(report);
        String text = text(artifact);

        assertThat(artifact.getFormat()).isEqualTo(ExportFormat.PDF);
        assertThat(artifact.getContentType()).isEqualTo("application/pdf");
        assertThat(artifact.getFileName()).isEqualTo("report-session-pdf.pdf");
        assertThat(new String(artifact.getContent(), 0, 5, StandardCharsets.US_ASCII))
                .isEqualTo("%PDF-");
        assertThat(text).contains("Introduction", "Why this matters.", "Findings", "It worked.", "north");
        assertThat(text.indexOf("Introduction")).isLessThan(text.indexOf("Findings"));
    }

    @Test
    @DisplayName("Long content flows onto further pages")
    void testPagination() throws Exception {
        String longParagraph = "Observation recorded at the field station. ".repeat(40);
        StringBuilder findings = new StringBuilder("## Findings\n\n");
        for (int i = 1; i <= 30; i++) {
            findings.append(longParagraph).append("Paragraph ").append(i).append(" ends here.\n\n");
        }
        ReportState report = ExportFixtures.accepted("session-long", "Short intro.", findings.toString());

        ExportArtifact artifact = exporter.export(report);

        try (PDDocument document = Loader.loadPDF(artifact.getContent())) {
            assertThat(document.getNumberOfPages()).isGreaterThan(1);
            assertThat(new PDFTextStripper().getText(document)).contains("Paragraph 30 ends here.");
            assertThat(document.getDocumentInformation().getTitle()).isEqualTo("Report session-long");
        }
    }

    @Test
    @DisplayName("Characters the standard fonts cannot encode are replaced instead of failing")
    void testUnencodableCharacters() throws Exception {
        ReportState report = ExportFixtures.accepted("session-glyphs", "Flow: A → B\tdone", "## Findings\n\n数据 ok");

        String text = text(exporter.export(report));

        assertThat(text).contains("Flow: A ? B", "ok");
    }

    @Test
    @DisplayName("A section without content cannot be exported")
    void testMissingContent() throws Exception {
        ReportState report = ExportFixtures.unwritten("session-pdf");

        assertThatThrownBy(() -> exporter.export(report))
                .isInstanceOf(ExportException.class)
                .hasMessageContaining("intro");
    }
}
