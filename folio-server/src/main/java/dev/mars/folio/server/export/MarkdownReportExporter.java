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

import java.nio.charset.StandardCharsets;

/**
 * Concatenates the accepted sections, in authoring order, into one markdown document.
 *
 * <p>Each section becomes a level-one heading with its title followed by its content. A section whose
 * content already opens with its own heading is emitted as is.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class MarkdownReportExporter implements ReportExporter {

    @Override
    public ExportFormat format() {
        return ExportFormat.MARKDOWN;
    }

    @Override
    public ExportArtifact export(ReportState report) throws ExportException {
        byte[] document = ReportMarkdown.assemble(report).getBytes(StandardCharsets.UTF_8);
        return new ExportArtifact(report.getSessionId(), ExportFormat.MARKDOWN,
                ExportFormat.MARKDOWN.getContentType(), document);
    }
}
