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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;

/**
 * Centralized configuration loader for the Folio report client.
 *
 * <p>Loads configuration from {@code folio-client.properties} with system property and environment
 * variable override support. Environment variables use the upper-cased key with dots and dashes
 * replaced by underscores ({@code FOLIO_CLIENT_BASE_URL}).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class FolioClientConfig {

    private static final Logger logger = LoggerFactory.getLogger(FolioClientConfig.class);
    private static final String CONFIG_FILE = "folio-client.properties";
    private static final FolioClientConfig INSTANCE = new FolioClientConfig();

    private final Properties properties;

    private FolioClientConfig() {
        this.properties = new Properties();
        loadProperties();
        logConfiguration();
    }

    /**
     * Gets the singleton configuration instance.
     */
    public static FolioClientConfig get() {
        return INSTANCE;
    }

    // ==================== Backend Connection ====================

    public String getBaseUrl() {
        return getString("folio.client.base-url", "http://localhost:8080");
    }

    public int getConnectTimeoutMs() {
        return getInt("folio.client.http.connect-timeout-ms", 5000);
    }

    public long getRequestTimeoutMs() {
        return getLong("folio.client.http.request-timeout-ms", 30000);
    }

    // ==================== Polling ====================

    public long getPollIntervalMs() {
        return getLong("folio.client.poll.interval-ms", 3000);
    }

    public long getPollMaxIntervalMs() {
        return getLong("folio.client.poll.max-interval-ms", 30000);
    }

    public double getPollBackoffMultiplier() {
        return getDouble("folio.client.poll.backoff-multiplier", 2.0);
    }

    // ==================== Telemetry ====================

    public boolean isMetricsEnabled() {
        return getBoolean("folio.client.metrics.enabled", true);
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with layered resolution.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., FOLIO_CLIENT_BASE_URL)</li>
     *   <li>System property (e.g., -Dfolio.client.base-url=...)</li>
     *   <li>Properties file (folio-client.properties)</li>
     *   <li>Default value</li>
     * </ol>
     */
    public String getString(String key, String defaultValue) {
        String envKey = key.toUpperCase().replace('.', '_').replace('-', '_');
        String envValue = System.getenv(envKey);
        if (envValue != null && !envValue.isEmpty()) {
            return envValue;
        }

        String sysProp = System.getProperty(key);
        if (sysProp != null && !sysProp.isEmpty()) {
            return sysProp;
        }

        return properties.getProperty(key, defaultValue);
    }

    /**
     * Validates that values are sensible. Called before the first session is opened to fail fast.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public void validate() {
        String baseUrl = getBaseUrl();
        if (!baseUrl.startsWith("http://") && !baseUrl.startsWith("https://")) {
            throw new IllegalStateException("Base URL must start with http:// or https://, got: " + baseUrl);
        }
        if (getPollIntervalMs() <= 0) {
            throw new IllegalStateException("Poll interval must be positive, got: " + getPollIntervalMs());
        }
        if (getPollMaxIntervalMs() < getPollIntervalMs()) {
            throw new IllegalStateException("Poll max interval " + getPollMaxIntervalMs()
                    + " is smaller than poll interval " + getPollIntervalMs());
        }
        if (getPollBackoffMultiplier() < 1.0) {
            throw new IllegalStateException("Backoff multiplier must be >= 1.0, got: " + getPollBackoffMultiplier());
        }
        logger.info("Client configuration validated successfully");
    }

    public int getInt(String key, int defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid integer value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public long getLong(String key, long defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid long value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public double getDouble(String key, double defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            logger.warn("Invalid decimal value for {}: '{}', using default {}", key, value, defaultValue);
            return defaultValue;
        }
    }

    public boolean getBoolean(String key, boolean defaultValue) {
        String value = getString(key, null);
        if (value == null) {
            return defaultValue;
        }
        return Boolean.parseBoolean(value.trim());
    }

    // ==================== Private Helpers ====================

    private void loadProperties() {
        try (InputStream input = getClass().getClassLoader().getResourceAsStream(CONFIG_FILE)) {
            if (input != null) {
                properties.load(input);
                logger.info("Loaded configuration from {}", CONFIG_FILE);
            } else {
                logger.warn("Configuration file {} not found, using defaults and environment variables", CONFIG_FILE);
            }
        } catch (IOException e) {
            logger.error("Error loading configuration file: {}", e.getMessage());
            logger.debug("Stack trace", e);
        }
    }

    private void logConfiguration() {
        logger.info("=== Folio Client Configuration ===");
        logger.info("  Base URL:             {}", getBaseUrl());
        logger.info("  Poll Interval:        {}ms", getPollIntervalMs());
        logger.info("  Poll Max Interval:    {}ms", getPollMaxIntervalMs());
        logger.info("  Backoff Multiplier:   {}", getPollBackoffMultiplier());
        logger.info("  Connect Timeout:      {}ms", getConnectTimeoutMs());
        logger.info("  Request Timeout:      {}ms", getRequestTimeoutMs());
    }
}
