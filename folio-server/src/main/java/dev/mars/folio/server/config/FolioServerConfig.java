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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Properties;
import java.util.Set;

/**
 * Centralized configuration loader for the Folio report server.
 *
 * <p>Loads configuration from {@code folio-server.properties} with system property and environment
 * variable override support. Environment variables use the upper-cased key with dots and dashes
 * replaced by underscores ({@code FOLIO_SERVER_HTTP_PORT}).</p>
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class FolioServerConfig {

    private static final Logger logger = LoggerFactory.getLogger(FolioServerConfig.class);
    private static final String CONFIG_FILE = "folio-server.properties";
    private static final FolioServerConfig INSTANCE = new FolioServerConfig();

    private final Properties properties;

    private FolioServerConfig() {
        this.properties = new Properties();
        loadProperties();
        logConfiguration();
    }

    /**
     * Gets the singleton configuration instance.
     */
    public static FolioServerConfig get() {
        return INSTANCE;
    }

    // ==================== HTTP ====================

    public String getHttpHost() {
        return getString("folio.server.http.host", "0.0.0.0");
    }

    public int getHttpPort() {
        return getInt("folio.server.http.port", 8080);
    }

    // ==================== Workflow ====================

    public int getDefaultMaxRevisions() {
        return getInt("folio.server.sections.max-revisions", 3);
    }

    public long getFinalizeStepDelayMs() {
        return getLong("folio.server.finalize.step-delay-ms", 250);
    }

    public long getDrainTimeoutMs() {
        return getLong("folio.server.shutdown.drain-timeout-ms", 10000);
    }

    // ==================== Generation ====================

    /**
     * Returns the external generation endpoint, or empty to use the built-in rules engine.
     */
    public Optional<String> getGenerationEndpoint() {
        String endpoint = getString("folio.server.generation.endpoint", "");
        return endpoint == null || endpoint.isBlank() ? Optional.empty() : Optional.of(endpoint.trim());
    }

    public long getGenerationTimeoutMs() {
        return getLong("folio.server.generation.timeout-ms", 120000);
    }

    public long getRulesEngineDelayMs() {
        return getLong("folio.server.generation.rules-delay-ms", 500);
    }

    // ==================== Export ====================

    /**
     * Returns the export formats this server offers. Unknown names are logged and skipped.
     */
    public Set<ExportFormat> getExportFormats() {
        String value = getString("folio.server.export.formats", "markdown,docx,pdf");
        Set<ExportFormat> formats = EnumSet.noneOf(ExportFormat.class);
        Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(name -> !name.isEmpty())
                .forEach(name -> ExportFormat.fromWireName(name).ifPresentOrElse(formats::add,
                        () -> logger.warn("Ignoring unknown export format '{}' in configuration", name)));
        return formats;
    }

    // ==================== Telemetry ====================

    public boolean isMetricsEnabled() {
        return getBoolean("folio.server.metrics.enabled", true);
    }

    // ==================== Core Property Accessors ====================

    /**
     * Gets a string property with layered resolution.
     *
     * <p>Resolution order (highest to lowest priority):
     * <ol>
     *   <li>Environment variable (e.g., FOLIO_SERVER_HTTP_PORT)</li>
     *   <li>System property (e.g., -Dfolio.server.http.port=...)</li>
     *   <li>Properties file (folio-server.properties)</li>
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
     * Validates that values are sensible. Called at startup to fail fast.
     *
     * @throws IllegalStateException if configuration is invalid
     */
    public void validate() {
        int port = getHttpPort();
        if (port < 0 || port > 65535) {
            throw new IllegalStateException("HTTP port must be between 0 and 65535, got: " + port);
        }
        if (getDefaultMaxRevisions() < 0) {
            throw new IllegalStateException("Max revisions cannot be negative, got: " + getDefaultMaxRevisions());
        }
        if (getExportFormats().isEmpty()) {
            throw new IllegalStateException("At least one export format must be configured");
        }
        getGenerationEndpoint().ifPresent(endpoint -> {
            if (!endpoint.startsWith("http://") && !endpoint.startsWith("https://")) {
                throw new IllegalStateException("Generation endpoint must start with http:// or https://, got: "
                        + endpoint);
            }
        });
        logger.info("Server configuration validated successfully");
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
        logger.info("=== Folio Server Configuration ===");
        logger.info("  HTTP:                 {}:{}", getHttpHost(), getHttpPort());
        logger.info("  Max Revisions:        {}", getDefaultMaxRevisions());
        logger.info("  Generation Endpoint:  {}", getGenerationEndpoint().orElse("(rules engine)"));
        logger.info("  Generation Timeout:   {}ms", getGenerationTimeoutMs());
        logger.info("  Finalize Step Delay:  {}ms", getFinalizeStepDelayMs());
        logger.info("  Drain Timeout:        {}ms", getDrainTimeoutMs());
        logger.info("  Export Formats:       {}", getExportFormats());
    }
}
