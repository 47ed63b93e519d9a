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

import dev.mars.folio.server.export.ReportMarkdown.Block;
import dev.mars.folio.server.export.ReportMarkdown.Kind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for the block structure the PDF and DOCX exporters lay out.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@DisplayName("ReportMarkdown Tests")
class ReportMarkdownTest {

    @Test
    @DisplayName("Headings, paragraphs and list items keep their order")
    void testBasicBlocks() {
        List<Block> blocks = ReportMarkdown.blocks("""
                # Introduction

                Sampling ran for **six** weeks
                across `three` sites.

                - first point
                2. second point
                """);

        assertThat(blocks)
                .extracting(Block::kind, Block::level, Block::text)
                .containsExactly(
                        tuple(Kind.HEADING, 1, "Introduction"),
                        tuple(Kind.PARAGRAPH, 0, "Sampling ran for six weeks across three sites."),
                        tuple(Kind.LIST_ITEM, 0, "• first point"),
                        tuple(Kind.LIST_ITEM, 0, "2. second point"));
    }

    @Test
    @DisplayName("Pipe tables drop their alignment row and split cells")
    void testTable() {
        List<Block> blocks = ReportMarkdown.blocks("""
                ### Builds On

                | Section | Status |
                |---|:---:|
                | intro | accepted |
                After the table.
                """);

        assertThat(blocks).extracting(Block::kind)
                .containsExactly(Kind.HEADING, Kind.TABLE, Kind.PARAGRAPH);
        assertThat(blocks.get(0).level()).isEqualTo(3);
        assertThat(blocks.get(1).rows())
                .containsExactly(List.of("Section", "Status"), List.of("intro", "accepted"));
    }

    @Test
    @DisplayName("Quotes join their lines and fenced code keeps its lines")
    void testQuoteAndCode() {
        List<Block> blocks = ReportMarkdown.blocks("""
                > Shorter please,
                > and cite the survey.

                ```
                select *
                  from sites
                ```
                ---
                """);

        assertThat(blocks)
                .extracting(Block::kind, Block::text)
                .containsExactly(
                        tuple(Kind.QUOTE, "Shorter please, and cite the survey."),
                        tuple(Kind.CODE, "select *\n  from sites"));
    }

    @Test
    @DisplayName("An unterminated code fence runs to the end of the document")
    void testUnterminatedFence() {
        List<Block> blocks = ReportMarkdown.blocks("Intro\n```\nx = 1");

        assertThat(blocks)
                .extracting(Block::kind, Block::text)
                .containsExactly(tuple(Kind.PARAGRAPH, "Intro"), tuple(Kind.CODE, "x = 1"));
    }
}
