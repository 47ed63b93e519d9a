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
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDFont;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Lays the assembled report out as an A4 PDF with PDFBox.
 *
 * <p>Text is set in the standard Helvetica and Courier faces, so characters outside their
 * WinAnsi encoding are printed as {@code ?}. Lines wrap at word boundaries and flow onto new pages.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class PdfReportExporter implements ReportExporter {

    private static final Logger logger = LoggerFactory.getLogger(PdfReportExporter.class);

    private static final float MARGIN = 56f;
    private static final float BODY_SIZE = 11f;
    private static final float CODE_SIZE = 9.5f;
    private static final float LEADING_FACTOR = 1.4f;
    private static final float INDENT = 18f;
    private static final float[] HEADING_SIZES = {20f, 16f, 14f, 12f, 11f, 11f};

    @Override
    public ExportFormat format() {
        return ExportFormat.PDF;
    }

    @Override
    public ExportArtifact export(ReportState report) throws ExportException {
        String markdown = ReportMarkdown.assemble(report);
        try (PDDocument document = new PDDocument()) {
            document.getDocumentInformation().setTitle("Report " + report.getSessionId());
            document.getDocumentInformation().setCreator("Folio");

            Layout layout = new Layout(document);
            try {
                for (Block block : ReportMarkdown.blocks(markdown)) {
                    layout.write(block);
                }
            } finally {
                layout.close();
            }

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            document.save(out);
            logger.debug("Rendered report {} as PDF: {} page(s)", report.getSessionId(), document.getNumberOfPages());
            return new ExportArtifact(report.getSessionId(), ExportFormat.PDF,
                    ExportFormat.PDF.getContentType(), out.toByteArray());
        } catch (IOException e) {
            throw new ExportException("PDF rendering failed: " + e.getMessage(), e);
        }
    }

    /**
     * Cursor over the pages of one document. Opens a new page whenever the next line does not fit.
     */
    private static final class Layout {

        private final PDDocument document;
        private final PDFont regular = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
        private final PDFont bold = new PDType1Font(Standard14Fonts.FontName.HELVETICA_BOLD);
        private final PDFont italic = new PDType1Font(Standard14Fonts.FontName.HELVETICA_OBLIQUE);
        private final PDFont mono = new PDType1Font(Standard14Fonts.FontName.COURIER);
        private final float width = PDRectangle.A4.getWidth() - 2 * MARGIN;

        private PDPageContentStream stream;
        private float y;

        private Layout(PDDocument document) {
            this.document = document;
        }

        void write(Block block) throws IOException {
            switch (block.kind()) {
                case HEADING -> {
                    float size = HEADING_SIZES[Math.min(block.level(), HEADING_SIZES.length) - 1];
                    gap(size * 0.8f);
                    lines(block.text(), bold, size, 0);
                    gap(size * 0.3f);
                }
                case PARAGRAPH -> {
                    lines(block.text(), regular, BODY_SIZE, 0);
                    gap(BODY_SIZE * 0.6f);
                }
                case LIST_ITEM -> lines(block.text(), regular, BODY_SIZE, INDENT);
                case QUOTE -> {
                    lines(block.text(), italic, BODY_SIZE, INDENT);
                    gap(BODY_SIZE * 0.6f);
                }
                case CODE -> {
                    for (String line : block.text().split("\n", -1)) {
                        lines(line.isEmpty() ? " " : line, mono, CODE_SIZE, INDENT);
                    }
                    gap(BODY_SIZE * 0.6f);
                }
                case TABLE -> {
                    for (List<String> row : block.rows()) {
                        lines(String.join("  |  ", row), regular, BODY_SIZE, 0);
                    }
                    gap(BODY_SIZE * 0.6f);
                }
            }
        }

        private void lines(String text, PDFont font, float size, float indent) throws IOException {
            String printable = printable(text, font);
            float leading = size * LEADING_FACTOR;
            for (String line : wrap(printable, font, size, width - indent)) {
                if (stream == null || y - leading < MARGIN) {
                    newPage();
                }
                y -= leading;
                stream.beginText();
                stream.setFont(font, size);
                stream.newLineAtOffset(MARGIN + indent, y);
                stream.showText(line);
                stream.endText();
            }
        }

        private void gap(float points) {
            if (stream != null) {
                y -= points;
            }
        }

        private void newPage() throws IOException {
            close();
            PDPage page = new PDPage(PDRectangle.A4);
            document.addPage(page);
            stream = new PDPageContentStream(document, page);
            y = PDRectangle.A4.getHeight() - MARGIN;
        }

        void close() throws IOException {
            if (stream != null) {
                stream.close();
                stream = null;
            }
        }

        private static List<String> wrap(String text, PDFont font, float size, float maxWidth) throws IOException {
            List<String> lines = new ArrayList<>();
            StringBuilder line = new StringBuilder();
            for (String word : text.split(" ")) {
                if (word.isEmpty()) {
                    continue;
                }
                String candidate = line.length() == 0 ? word : line + " " + word;
                if (width(candidate, font, size) <= maxWidth) {
                    line.setLength(0);
                    line.append(candidate);
                    continue;
                }
                if (line.length() > 0) {
                    lines.add(line.toString());
                    line.setLength(0);
                }
                // a single word wider than the column is broken by character
                while (width(word, font, size) > maxWidth && word.length() > 1) {
                    int cut = word.length() - 1;
                    while (cut > 1 && width(word.substring(0, cut), font, size) > maxWidth) {
                        cut--;
                    }
                    lines.add(word.substring(0, cut));
                    word = word.substring(cut);
                }
                line.append(word);
            }
            if (line.length() > 0 || lines.isEmpty()) {
                lines.add(line.toString());
            }
            return lines;
        }

        private static float width(String text, PDFont font, float size) throws IOException {
            return font.getStringWidth(text) / 1000f * size;
        }

        /**
         * Replaces characters the font cannot encode, and control characters, so {@code showText} never throws.
         */
        private static String printable(String text, PDFont font) throws IOException {
            StringBuilder out = new StringBuilder(text.length());
            text.codePoints().forEach(cp -> {
                if (cp == '\t') {
                    out.append("    ");
                } else if (Character.isISOControl(cp)) {
                    out.append(' ');
                } else {
                    out.appendCodePoint(cp);
                }
            });
            StringBuilder safe = new StringBuilder(out.length());
            for (int i = 0; i < out.length(); ) {
                int cp = out.codePointAt(i);
                String glyph = new String(Character.toChars(cp));
                try {
                    font.encode(glyph);
                    safe.append(glyph);
                } catch (IllegalArgumentException e) {
                    safe.append('?');
                }
                i += Character.charCount(cp);
            }
            return safe.toString();
        }
    }
}
