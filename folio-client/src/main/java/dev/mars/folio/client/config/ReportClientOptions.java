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

package dev.mars.folio.client.config;

import java.util.Objects;

/**
 * Immutable settings for one report client: backend location, HTTP timeouts and polling cadence.
 *
 * <p>Production code builds it from {@link FolioClientConfig}; tests use the builder.</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ReportClientOptions {

    private final String baseUrl;
    private final int connectTimeoutMs;
    private final long requestTimeoutMs;
    private final long pollIntervalMs;
    private final long pollMaxIntervalMs;
    private final double backoffMultiplier;
    private final boolean metricsEnabled;
    private final String userAgent;

    private ReportClientOptions(Builder builder) {
        String url = Objects.requireNonNull(builder.baseUrl, "Base URL cannot be null");
        this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
        this.connectTimeoutMs = builder.connectTimeoutMs;
        this.requestTimeoutMs = builder.requestTimeoutMs;
        this.pollIntervalMs = builder.pollIntervalMs;
        this.pollMaxIntervalMs = Math.max(builder.pollMaxIntervalMs, builder.pollIntervalMs);
        this.backoffMultiplier = builder.backoffMultiplier;
        this.metricsEnabled = builder.metricsEnabled;
        this.userAgent = builder.userAgent;
        if (pollIntervalMs <= 0) {
            throw new IllegalArgumentException("Poll interval must be positive, got: " + pollIntervalMs);
        }
        if (backoffMultiplier < 1.0) {
            throw new IllegalArgumentException("Backoff multiplier must be >= 1.0, got: " + backoffMultiplier);
        }
    }

    /**
     * Creates options from the layered client configuration.
     */
    public static ReportClientOptions fromConfig(FolioClientConfig config) {
        return builder()
                .baseUrl(config.getBaseUrl())
                .connectTimeoutMs(config.getConnectTimeoutMs())
                .requestTimeoutMs(config.getRequestTimeoutMs())
                .pollIntervalMs(config.getPollIntervalMs())
                .pollMaxIntervalMs(config.getPollMaxIntervalMs())
                .backoffMultiplier(config.getPollBackoffMultiplier())
                .metricsEnabled(config.isMetricsEnabled())
                .build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    public int getConnectTimeoutMs() {
        return connectTimeoutMs;
    }

    public long getRequestTimeoutMs() {
        return requestTimeoutMs;
    }

    public long getPollIntervalMs() {
        return pollIntervalMs;
    }

    public long getPollMaxIntervalMs() {
        return pollMaxIntervalMs;
    }

    public double getBackoffMultiplier() {
        return backoffMultiplier;
    }

    public boolean isMetricsEnabled() {
        return metricsEnabled;
    }

    public String getUserAgent() {
        return userAgent;
    }

    @Override
    public String toString() {
        return "ReportClientOptions{" +
               "baseUrl='" + baseUrl + '\'' +
               ", pollIntervalMs=" + pollIntervalMs +
               ", pollMaxIntervalMs=" + pollMaxIntervalMs +
               ", backoffMultiplier=" + backoffMultiplier +
               '}';
    }

    public static class Builder {
        private String baseUrl = "http://localhost:8080";
        private int connectTimeoutMs = 5000;
        private long requestTimeoutMs = 30000;
        private long pollIntervalMs = 3000;
        private long pollMaxIntervalMs = 30000;
        private double backoffMultiplier = 2.0;
        private boolean metricsEnabled = true;
        private String userAgent = "Folio-Client/1.0";

        public Builder baseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
            return this;
        }

        public Builder connectTimeoutMs(int connectTimeoutMs) {
            this.connectTimeoutMs = connectTimeoutMs;
            return this;
        }

        public Builder requestTimeoutMs(long requestTimeoutMs) {
            this.requestTimeoutMs = requestTimeoutMs;
            return this;
        }

        public Builder pollIntervalMs(long pollIntervalMs) {
            this.pollIntervalMs = pollIntervalMs;
            return this;
        }

        public Builder pollMaxIntervalMs(long pollMaxIntervalMs) {
            this.pollMaxIntervalMs = pollMaxIntervalMs;
            return this;
        }

        public Builder backoffMultiplier(double backoffMultiplier) {
            this.backoffMultiplier = backoffMultiplier;
            return this;
        }

        public Builder metricsEnabled(boolean metricsEnabled) {
            this.metricsEnabled = metricsEnabled;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public ReportClientOptions build() {
            return new ReportClientOptions(this);
        }
    }
}
