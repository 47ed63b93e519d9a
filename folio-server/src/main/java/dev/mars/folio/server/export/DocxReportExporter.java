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
import dev.mars.folio.server.export.ReportMarkdown.Block;
import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFRun;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;

/**
 * Builds a Word document from the assembled report with Apache POI.
 *
 * <p>Headings are bold runs sized by level, pipe tables become Word tables and fenced code is set in a
 * monospaced face. The title property of the document names the report.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class DocxReportExporter implements ReportExporter {

    static final String CODE_FONT = "Courier New";
    private static final int[] HEADING_SIZES = {20, 16, 14, 12, 11, 11};
    private static final int BODY_SIZE = 11;
    private static final int INDENT_TWIPS = 360;

    @Override
    public ExportFormat format() {
        return ExportFormat.DOCX;
    }

    @Override
    public ExportArtifact export(ReportState report) throws ExportException {
        String markdown = ReportMarkdown.assemble(report);
        try (XWPFDocument document = new XWPFDocument()) {
            document.getProperties().getCoreProperties().setTitle("Report " + report.getSessionId());
            for (Block block : ReportMarkdown.blocks(markdown)) {
                write(document, block);
            }
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.write(out);
            return new ExportArtifact(report.getSessionId(), ExportFormat.DOCX,
                    ExportFormat.DOCX.getContentType(), out.toByteArray());
        } catch (IOException e) {
            throw new ExportException("DOCX rendering failed: " + e.getMessage(), e);
        }
    }

    private static void write(XWPFDocument document, Block block) {
        switch (block.kind()) {
            case HEADING -> {
                XWPFRun run = document.createParagraph().createRun();
                run.setBold(true);
                run.setFontSize(HEADING_SIZES[Math.min(block.level(), HEADING_SIZES.length) - 1]);
                run.setText(block.text());
            }
            case PARAGRAPH -> text(document.createParagraph(), block.text());
            case LIST_ITEM -> {
                XWPFParagraph paragraph = document.createParagraph();
                paragraph.setIndentationLeft(INDENT_TWIPS);
                text(paragraph, block.text());
            }
            case QUOTE -> {
                XWPFParagraph paragraph = document.createParagraph();
                paragraph.setIndentationLeft(INDENT_TWIPS);
                text(paragraph, block.text()).setItalic(true);
            }
            case CODE -> {
                XWPFRun run = document.createParagraph().createRun();
                run.setFontFamily(CODE_FONT);
                run.setFontSize(BODY_SIZE - 1);
                String[] lines = block.text().split("\n", -1);
                for (int i = 0; i < lines.length; i++) {
                    if (i > 0) {
                        run.addBreak();
                    }
                    run.setText(lines[i], i);
                }
            }
            case TABLE -> table(document, block.rows());
        }
    }

    private static XWPFRun text(XWPFParagraph paragraph, String text) {
        XWPFRun run = paragraph.createRun();
        run.setFontSize(BODY_SIZE);
        run.setText(text);
        return run;
    }

    private static void table(XWPFDocument document, List<List<String>> rows) {
        int columns = rows.stream().mapToInt(List::size).max().orElse(1);
        XWPFTable table = document.createTable(rows.size(), columns);
        for (int r = 0; r < rows.size(); r++) {
            XWPFTableRow row = table.getRow(r);
            List<String> cells = rows.get(r);
            for (int c = 0; c < cells.size(); c++) {
                row.getCell(c).setText(cells.get(c));
            }
        }
    }
}
