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

package dev.mars.folio.server.observability;

import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.function.LongSupplier;

/**
 * OpenTelemetry metrics for the report server.
 *
 * Provides:
 * - folio.server.generations.total (counter) - Generation attempts, by outcome
 * - folio.server.generation.duration (histogram) - Generation attempt latency in milliseconds
 * - folio.server.finalizations.total (counter) - Finalize runs, by outcome
 * - folio.server.exports.total (counter) - Exports, by format and outcome
 * - folio.server.reports (gauge) - Reports held by the repository
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ServerMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ServerMetrics.class);
    private static final String METER_NAME = "folio-server";

    private static final AttributeKey<String> OUTCOME_KEY = AttributeKey.stringKey("outcome");
    private static final AttributeKey<String> FORMAT_KEY = AttributeKey.stringKey("format");

    private final LongCounter generationsTotal;
    private final LongHistogram generationDuration;
    private final LongCounter finalizationsTotal;
    private final LongCounter exportsTotal;

    /**
     * Creates metrics on the global OpenTelemetry instance, or on a no-op instance when disabled.
     *
     * @param reportCount supplies the number of stored reports for the gauge
     */
    public ServerMetrics(boolean enabled, LongSupplier reportCount) {
        Meter meter = (enabled ? GlobalOpenTelemetry.get() : OpenTelemetry.noop()).getMeter(METER_NAME);

        generationsTotal = meter.counterBuilder("folio.server.generations.total")
                .setDescription("Total number of section generation attempts")
                .setUnit("1")
                .build();

        generationDuration = meter.histogramBuilder("folio.server.generation.duration")
                .setDescription("Section generation attempt latency")
                .setUnit("ms")
                .ofLongs()
                .build();

        finalizationsTotal = meter.counterBuilder("folio.server.finalizations.total")
                .setDescription("Total number of finalize runs")
                .setUnit("1")
                .build();

        exportsTotal = meter.counterBuilder("folio.server.exports.total")
                .setDescription("Total number of report exports")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("folio.server.reports")
                .setDescription("Number of reports held by the server")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(reportCount.getAsLong()));

        logger.debug("ServerMetrics initialized (enabled={})", enabled);
    }

    /**
     * @param outcome {@code completed}, {@code failed} or {@code superseded}
     */
    public void recordGeneration(String outcome, long durationMs) {
        Attributes attributes = Attributes.of(OUTCOME_KEY, outcome);
        generationsTotal.add(1, attributes);
        generationDuration.record(durationMs, attributes);
    }

    public void recordFinalization(boolean completed) {
        finalizationsTotal.add(1, Attributes.of(OUTCOME_KEY, completed ? "completed" : "failed"));
    }

    public void recordExport(String format, boolean success) {
        exportsTotal.add(1, Attributes.of(FORMAT_KEY, format, OUTCOME_KEY, success ? "success" : "failed"));
    }
}
