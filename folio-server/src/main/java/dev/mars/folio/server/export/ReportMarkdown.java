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
import dev.mars.folio.core.Section;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The assembled markdown of a report and the block structure the binary exporters lay out.
 *
 * <p>Only the markdown subset the section generators produce is recognised: ATX headings, list items,
 * block quotes, pipe tables, fenced code and paragraphs. Inline emphasis and code markers are dropped
 * from the text.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
final class ReportMarkdown {

    private static final Pattern HEADING = Pattern.compile("^(#{1,6})\\s+(.*?)\\s*#*\\s*$");
    private static final Pattern BULLET = Pattern.compile("^\\s*[-*+]\\s+(.*)$");
    private static final Pattern NUMBERED = Pattern.compile("^\\s*(\\d+[.)])\\s+(.*)$");
    private static final Pattern QUOTE = Pattern.compile("^\\s*>\\s?(.*)$");
    private static final Pattern TABLE_ROW = Pattern.compile("^\\s*\\|(.*)\\|\\s*$");
    private static final Pattern TABLE_SEPARATOR = Pattern.compile("^\\s*\\|[\\s:|-]+\\|\\s*$");
    private static final Pattern RULE = Pattern.compile("^\\s*([-*_])(\\s*\\1){2,}\\s*$");
    private static final Pattern INLINE_MARKERS = Pattern.compile("\\*\\*|__|`");

    enum Kind { HEADING, PARAGRAPH, LIST_ITEM, QUOTE, CODE, TABLE }

    /**
     * One laid-out unit. {@code level} is set for headings, {@code rows} for tables.
     */
    record Block(Kind kind, int level, String text, List<List<String>> rows) {

        static Block of(Kind kind, String text) {
            return new Block(kind, 0, text, List.of());
        }
    }

    private ReportMarkdown() {
    }

    /**
     * Joins the sections in authoring order. A section that does not open with its own heading gets
     * its title as a level-one heading.
     *
     * @throws ExportException if a section has no content
     */
    static String assemble(ReportState report) throws ExportException {
        StringBuilder document = new StringBuilder();
        for (Section section : report.getSections()) {
            String content = section.getContent();
            if (content == null || content.isBlank()) {
                throw new ExportException("Section '" + section.getSectionId() + "' has no content");
            }
            if (document.length() > 0) {
                document.append("\n\n");
            }
            String body = content.strip();
            if (!body.startsWith("#")) {
                document.append("# ").append(section.getTitle()).append("\n\n");
            }
            document.append(body);
        }
        return document.append('\n').toString();
    }

    static List<Block> blocks(String markdown) {
        List<Block> blocks = new ArrayList<>();
        List<String> paragraph = new ArrayList<>();
        List<String> quote = new ArrayList<>();
        List<List<String>> table = new ArrayList<>();
        StringBuilder code = null;

        for (String line : markdown.replace("\r\n", "\n").split("\n", -1)) {
            if (code != null) {
                if (line.strip().startsWith("```")) {
                    blocks.add(Block.of(Kind.CODE, code.toString()));
                    code = null;
                } else {
                    code.append(code.length() > 0 ? "\n" : "").append(line);
                }
                continue;
            }
            if (!TABLE_ROW.matcher(line).matches()) {
                flushTable(table, blocks);
            }
            if (!QUOTE.matcher(line).matches()) {
                flushText(Kind.QUOTE, quote, blocks);
            }

            Matcher m;
            if (line.strip().startsWith("```")) {
                flushText(Kind.PARAGRAPH, paragraph, blocks);
                code = new StringBuilder();
            } else if (line.isBlank() || RULE.matcher(line).matches()) {
                flushText(Kind.PARAGRAPH, paragraph, blocks);
            } else if ((m = HEADING.matcher(line)).matches()) {
                flushText(Kind.PARAGRAPH, paragraph, blocks);
                blocks.add(new Block(Kind.HEADING, m.group(1).length(), plain(m.group(2)), List.of()));
            } else if (TABLE_SEPARATOR.matcher(line).matches()) {
                // alignment row of a pipe table
                continue;
            } else if ((m = TABLE_ROW.matcher(line)).matches()) {
                flushText(Kind.PARAGRAPH, paragraph, blocks);
                table.add(Arrays.stream(m.group(1).split("\\|", -1)).map(ReportMarkdown::plain).toList());
            } else if ((m = QUOTE.matcher(line)).matches()) {
                flushText(Kind.PARAGRAPH, paragraph, blocks);
                quote.add(m.group(1));
            } else if ((m = BULLET.matcher(line)).matches()) {
                flushText(Kind.PARAGRAPH, paragraph, blocks);
                blocks.add(Block.of(Kind.LIST_ITEM, "• " + plain(m.group(1))));
            } else if ((m = NUMBERED.matcher(line)).matches()) {
                flushText(Kind.PARAGRAPH, paragraph, blocks);
                blocks.add(Block.of(Kind.LIST_ITEM, m.group(1) + " " + plain(m.group(2))));
            } else {
                paragraph.add(line.strip());
            }
        }
        if (code != null) {
            blocks.add(Block.of(Kind.CODE, code.toString()));
        }
        flushTable(table, blocks);
        flushText(Kind.QUOTE, quote, blocks);
        flushText(Kind.PARAGRAPH, paragraph, blocks);
        return blocks;
    }

    private static void flushText(Kind kind, List<String> lines, List<Block> blocks) {
        if (!lines.isEmpty()) {
            blocks.add(Block.of(kind, plain(String.join(" ", lines))));
            lines.clear();
        }
    }

    private static void flushTable(List<List<String>> rows, List<Block> blocks) {
        if (!rows.isEmpty()) {
            blocks.add(new Block(Kind.TABLE, 0, "", List.copyOf(rows)));
            rows.clear();
        }
    }

    private static String plain(String text) {
        return INLINE_MARKERS.matcher(text).replaceAll("").strip();
    }
}
