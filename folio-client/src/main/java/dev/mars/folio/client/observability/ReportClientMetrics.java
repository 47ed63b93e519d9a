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

package dev.mars.folio.client.observability;

import dev.mars.folio.core.exceptions.ReportErrorKind;
import io.opentelemetry.api.GlobalOpenTelemetry;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * OpenTelemetry metrics for the report client.
 *
 * Provides:
 * - folio.client.commands.total (counter) - Commands issued, by command
 * - folio.client.commands.failed (counter) - Failed commands, by command and error kind
 * - folio.client.polls.total (counter) - State fetches issued by the synchronization loop
 * - folio.client.polls.failed (counter) - Failed state fetches
 * - folio.client.sessions.open (gauge) - Report sessions currently open
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public class ReportClientMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ReportClientMetrics.class);
    private static final String METER_NAME = "folio-client";

    private static final AttributeKey<String> COMMAND_KEY = AttributeKey.stringKey("command");
    private static final AttributeKey<String> KIND_KEY = AttributeKey.stringKey("error.kind");

    private final LongCounter commandsTotal;
    private final LongCounter commandsFailed;
    private final LongCounter pollsTotal;
    private final LongCounter pollsFailed;

    private final AtomicLong openSessions = new AtomicLong(0);

    /**
     * Creates metrics on the global OpenTelemetry instance, or on a no-op instance when disabled.
     */
    public ReportClientMetrics(boolean enabled) {
        Meter meter = (enabled ? GlobalOpenTelemetry.get() : OpenTelemetry.noop()).getMeter(METER_NAME);

        commandsTotal = meter.counterBuilder("folio.client.commands.total")
                .setDescription("Total number of report commands issued")
                .setUnit("1")
                .build();

        commandsFailed = meter.counterBuilder("folio.client.commands.failed")
                .setDescription("Number of report commands that failed")
                .setUnit("1")
                .build();

        pollsTotal = meter.counterBuilder("folio.client.polls.total")
                .setDescription("Total number of report state fetches")
                .setUnit("1")
                .build();

        pollsFailed = meter.counterBuilder("folio.client.polls.failed")
                .setDescription("Number of report state fetches that failed")
                .setUnit("1")
                .build();

        meter.gaugeBuilder("folio.client.sessions.open")
                .setDescription("Number of report sessions currently open")
                .ofLongs()
                .buildWithCallback(measurement -> measurement.record(openSessions.get()));

        logger.debug("ReportClientMetrics initialized (enabled={})", enabled);
    }

    public void recordCommand(String command) {
        commandsTotal.add(1, Attributes.of(COMMAND_KEY, command));
    }

    public void recordCommandFailure(String command, ReportErrorKind kind) {
        commandsFailed.add(1, Attributes.of(COMMAND_KEY, command, KIND_KEY, kind.name()));
    }

    public void recordPoll(boolean success) {
        pollsTotal.add(1);
        if (!success) {
            pollsFailed.add(1);
        }
    }

    public void sessionOpened() {
        openSessions.incrementAndGet();
    }

    public void sessionClosed() {
        openSessions.decrementAndGet();
    }

    public long getOpenSessions() {
        return openSessions.get();
    }
}
