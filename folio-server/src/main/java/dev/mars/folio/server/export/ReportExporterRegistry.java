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

import dev.mars.folio.core.ExportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * The exporters this server offers, restricted to the formats enabled in configuration.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ReportExporterRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ReportExporterRegistry.class);

    private final Map<ExportFormat, ReportExporter> exporters = new EnumMap<>(ExportFormat.class);

    public ReportExporterRegistry(Collection<? extends ReportExporter> available, Set<ExportFormat> enabled) {
        for (ReportExporter exporter : available) {
            if (enabled.contains(exporter.format())) {
                exporters.put(exporter.format(), exporter);
            }
        }
        for (ExportFormat format : enabled) {
            if (!exporters.containsKey(format)) {
                logger.warn("Export format '{}' is enabled but no exporter renders it", format.getWireName());
            }
        }
        logger.info("Export formats offered: {}", exporters.keySet());
    }

    /**
     * Registry with every built-in exporter, limited to {@code enabled}.
     */
    public static ReportExporterRegistry withDefaults(Set<ExportFormat> enabled) {
        return new ReportExporterRegistry(List.of(
                new MarkdownReportExporter(), new DocxReportExporter(), new PdfReportExporter()), enabled);
    }

    public Optional<ReportExporter> find(ExportFormat format) {
        return Optional.ofNullable(exporters.get(format));
    }

    public Set<ExportFormat> supportedFormats() {
        return Collections.unmodifiableSet(exporters.keySet());
    }
}
