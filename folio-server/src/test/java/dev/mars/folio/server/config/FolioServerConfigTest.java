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
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for FolioServerConfig and FolioServerOptions.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
@DisplayName("FolioServerConfig Tests")
class FolioServerConfigTest {

    private static final String PORT_KEY = "folio.server.http.port";
    private static final String FORMATS_KEY = "folio.server.export.formats";
    private static final String ENDPOINT_KEY = "folio.server.generation.endpoint";

    @AfterEach
    void clearOverrides() {
        System.clearProperty(PORT_KEY);
        System.clearProperty(FORMATS_KEY);
        System.clearProperty(ENDPOINT_KEY);
    }

    @Test
    @DisplayName("Bundled properties supply the defaults")
    void testDefaults() {
        FolioServerConfig config = FolioServerConfig.get();

        assertEquals(8080, config.getHttpPort());
        assertEquals(3, config.getDefaultMaxRevisions());
        assertTrue(config.getGenerationEndpoint().isEmpty());
        assertEquals(EnumSet.allOf(ExportFormat.class), config.getExportFormats());
        assertEquals(10000, config.getDrainTimeoutMs());
        assertDoesNotThrow(config::validate);
    }

    @Test
    @DisplayName("System properties override the file")
    void testSystemPropertyOverride() {
        System.setProperty(PORT_KEY, "9191");
        System.setProperty(FORMATS_KEY, "markdown, PDF, rtf");

        FolioServerConfig config = FolioServerConfig.get();

        assertEquals(9191, config.getHttpPort());
        assertEquals(EnumSet.of(ExportFormat.MARKDOWN, ExportFormat.PDF), config.getExportFormats());
    }

    @Test
    @DisplayName("Unparseable numbers fall back to the default")
    void testInvalidNumber() {
        System.setProperty(PORT_KEY, "eighty");

        assertEquals(8080, FolioServerConfig.get().getHttpPort());
    }

    @Test
    @DisplayName("A generation endpoint must be an http(s) URL")
    void testInvalidEndpoint() {
        System.setProperty(ENDPOINT_KEY, "ftp://engine");

        assertThrows(IllegalStateException.class, () -> FolioServerConfig.get().validate());
    }

    @Test
    @DisplayName("Options built from config carry the configured values")
    void testOptionsFromConfig() {
        System.setProperty(ENDPOINT_KEY, "http://engine:9000/generate");

        FolioServerOptions options = FolioServerOptions.fromConfig(FolioServerConfig.get());

        assertEquals("http://engine:9000/generate", options.getGenerationEndpoint().orElseThrow());
        assertEquals(3, options.getDefaultMaxRevisions());
        assertEquals(EnumSet.allOf(ExportFormat.class), options.getExportFormats());
        assertEquals(10000, options.getDrainTimeoutMs());
    }

    @Test
    @DisplayName("Options reject negative revision budgets")
    void testOptionsValidation() {
        assertThrows(IllegalArgumentException.class,
                () -> FolioServerOptions.builder().defaultMaxRevisions(-1).build());
        assertThrows(IllegalArgumentException.class,
                () -> FolioServerOptions.builder().finalizeStepDelayMs(0).build());
        assertThrows(IllegalArgumentException.class,
                () -> FolioServerOptions.builder().drainTimeoutMs(-1).build());
    }
}
