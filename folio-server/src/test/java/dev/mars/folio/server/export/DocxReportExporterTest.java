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
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for DocxReportExporter. Rendered documents are read back with POI.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@DisplayName("DocxReportExporter Tests")
class DocxReportExporterTest {

    private final DocxReportExporter exporter = new DocxReportExporter();

    private static XWPFDocument read(ExportArtifact artifact) throws Exception {
        return new XWPFDocument(new ByteArrayInputStream(artifact.getContent()));
    }

    @Test
    @DisplayName("Headings are bold and sized by level, paragraphs follow in order")
    void testHeadingsAndParagraphs() throws Exception {
        ReportState report = ExportFixtures.accepted("session-docx", "Why this matters.",
                "## Findings\n\nIt **worked**.\n\n> Keep it short.");

        ExportArtifact artifact = exporter.export(report);

        assertThat(artifact.getFormat()).isEqualTo(ExportFormat.DOCX);
        assertThat(artifact.getFileName()).isEqualTo("report-session-docx.docx");
        try (XWPFDocument document = read(artifact)) {
            List<XWPFParagraph> paragraphs = document.getParagraphs();
            assertThat(paragraphs).extracting(XWPFParagraph::getText)
                    .containsExactly("Introduction", "Why this matters.", "Findings", "It worked.", "Keep it short.");

            XWPFRun title = paragraphs.get(0).getRuns().get(0);
            assertThat(title.isBold()).isTrue();
            assertThat(title.getFontSizeAsDouble()).isEqualTo(20.0);
            assertThat(paragraphs.get(2).getRuns().get(0).getFontSizeAsDouble()).isEqualTo(16.0);
            assertThat(paragraphs.get(4).getRuns().get(0).isItalic()).isTrue();
            assertThat(document.getProperties().getCoreProperties().getTitle()).isEqualTo("Report session-docx");
        }
    }

    @Test
    @DisplayName("Pipe tables become Word tables")
    void testTable() throws Exception {
        ReportState report = ExportFixtures.accepted("session-table", "Intro.",
                "## Findings\n\n| Site | Result | Note |\n|---|---|---|\n| north | pass |\n");

        try (XWPFDocument document = read(exporter.export(report))) {
            assertThat(document.getTables()).hasSize(1);
            XWPFTable table = document.getTables().get(0);
            assertThat(table.getNumberOfRows()).isEqualTo(2);
            assertThat(table.getRow(0).getCell(2).getText()).isEqualTo("Note");
            assertThat(table.getRow(1).getCell(0).getText()).isEqualTo("north");
            assertThat(table.getRow(1).getCell(2).getText()).isEmpty();
        }
    }

    @Test
    @DisplayName("Fenced code is set in the monospaced face")
    void testCode() throws Exception {
        ReportState report = ExportFixtures.accepted("session-code", "Intro.",
                "## Findings\n\n```\nselect *\nfrom sites\n```");

        try (XWPFDocument document = read(exporter.export(report))) {
            XWPFParagraph code = document.getParagraphs().get(document.getParagraphs().size() - 1);
            assertThat(code.getRuns().get(0).getFontFamily()).isEqualTo(DocxReportExporter.CODE_FONT);
            assertThat(code.getText()).contains("select *", "from sites");
        }
    }

    @Test
    @DisplayName("A section without content cannot be exported")
    void testMissingContent() throws Exception {
        ReportState report = ExportFixtures.unwritten("session-docx");

        assertThatThrownBy(() -> exporter.export(report)).isInstanceOf(ExportException.class);
    }
}
