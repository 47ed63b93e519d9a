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

package dev.mars.folio.server.config;

import dev.mars.folio.core.ExportFormat;

import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable settings for one server instance.
 *
 * <p>{@link dev.mars.folio.server.FolioServer} builds it from {@link FolioServerConfig}; tests use the
 * builder to bind an ephemeral port and shorten the asynchronous steps.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class FolioServerOptions {

    private final String host;
    private final int port;
    private final int defaultMaxRevisions;
    private final long finalizeStepDelayMs;
    private final long drainTimeoutMs;
    private final String generationEndpoint;
    private final long generationTimeoutMs;
    private final long rulesEngineDelayMs;
    private final Set<ExportFormat> exportFormats;
    private final boolean metricsEnabled;

    private FolioServerOptions(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.defaultMaxRevisions = builder.defaultMaxRevisions;
        this.finalizeStepDelayMs = builder.finalizeStepDelayMs;
        this.drainTimeoutMs = builder.drainTimeoutMs;
        this.generationEndpoint = builder.generationEndpoint;
        this.generationTimeoutMs = builder.generationTimeoutMs;
        this.rulesEngineDelayMs = builder.rulesEngineDelayMs;
        this.exportFormats = builder.exportFormats.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(builder.exportFormats));
        this.metricsEnabled = builder.metricsEnabled;
        if (defaultMaxRevisions < 0) {
            throw new IllegalArgumentException("Max revisions cannot be negative, got: " + defaultMaxRevisions);
        }
        if (finalizeStepDelayMs < 1 || rulesEngineDelayMs < 1) {
            throw new IllegalArgumentException("Timer delays must be at least 1ms");
        }
        if (drainTimeoutMs < 0) {
            throw new IllegalArgumentException("Drain timeout cannot be negative, got: " + drainTimeoutMs);
        }
    }

    /**
     * Creates options from the layered server configuration.
     */
    public static FolioServerOptions fromConfig(FolioServerConfig config) {
        return builder()
                .host(config.getHttpHost())
                .port(config.getHttpPort())
                .defaultMaxRevisions(config.getDefaultMaxRevisions())
                .finalizeStepDelayMs(config.getFinalizeStepDelayMs())
                .drainTimeoutMs(config.getDrainTimeoutMs())
                .generationEndpoint(config.getGenerationEndpoint().orElse(null))
                .generationTimeoutMs(config.getGenerationTimeoutMs())
                .rulesEngineDelayMs(config.getRulesEngineDelayMs())
                .exportFormats(config.getExportFormats())
                .metricsEnabled(config.isMetricsEnabled())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public int getDefaultMaxRevisions() {
        return defaultMaxRevisions;
    }

    public long getFinalizeStepDelayMs() {
        return finalizeStepDelayMs;
    }

    /**
     * How long shutdown waits for pending generations and finalize runs once new commands are refused.
     */
    public long getDrainTimeoutMs() {
        return drainTimeoutMs;
    }

    public Optional<String> getGenerationEndpoint() {
        return Optional.ofNullable(generationEndpoint);
    }

    public long getGenerationTimeoutMs() {
        return generationTimeoutMs;
    }

    public long getRulesEngineDelayMs() {
        return rulesEngineDelayMs;
    }

    public Set<ExportFormat> getExportFormats() {
        return exportFormats;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    @Override
    public String toString() {
        return "FolioServerOptions{" +
                "host='" + host + '\'' +
                ", port=" + port +
                ", defaultMaxRevisions=" + defaultMaxRevisions +
                ", generationEndpoint=" + (generationEndpoint != null ? generationEndpoint : "rules-engine") +
                ", exportFormats=" + exportFormats +
                '}';
    }

    public static class Builder {
        private String host = "0.0.0.0";
        private int port = 8080;
        private int defaultMaxRevisions = 3;
        private long finalizeStepDelayMs = 250;
        private long drainTimeoutMs = 10000;
        private String generationEndpoint;
        private long generationTimeoutMs = 120000;
        private long rulesEngineDelayMs = 500;
        private Set<ExportFormat> exportFormats = EnumSet.allOf(ExportFormat.class);
        private boolean metricsEnabled = true;

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder defaultMaxRevisions(int defaultMaxRevisions) {
            this.defaultMaxRevisions = defaultMaxRevisions;
            return this;
        }

        public Builder finalizeStepDelayMs(long finalizeStepDelayMs) {
            this.finalizeStepDelayMs = finalizeStepDelayMs;
            return this;
        }

        public Builder drainTimeoutMs(long drainTimeoutMs) {
            this.drainTimeoutMs = drainTimeoutMs;
            return this;
        }

        public Builder generationEndpoint(String generationEndpoint) {
            this.generationEndpoint = generationEndpoint;
            return this;
        }

        public Builder generationTimeoutMs(long generationTimeoutMs) {
            this.generationTimeoutMs = generationTimeoutMs;
            return this;
        }

        public Builder rulesEngineDelayMs(long rulesEngineDelayMs) {
            this.rulesEngineDelayMs = rulesEngineDelayMs;
            return this;
        }

        public Builder exportFormats(Set<ExportFormat> exportFormats) {
            this.exportFormats = EnumSet.noneOf(ExportFormat.class);
            this.exportFormats.addAll(exportFormats);
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public FolioServerOptions build() {
            return new FolioServerOptions(this);
        }
    }
}
