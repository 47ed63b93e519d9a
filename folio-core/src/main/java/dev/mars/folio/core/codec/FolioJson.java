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

package dev.mars.folio.core.codec;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.mars.folio.core.ReportState;
import dev.mars.folio.core.Section;

/**
 * Shared Jackson configuration for the report wire format.
 * <p>
 * Instants are written as ISO-8601 strings and unknown properties are ignored, so a client keeps
 * reading reports from a backend that has added fields.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 * @version 1.0
 */
public final class FolioJson {

    private static final ObjectMapper MAPPER = configure(new ObjectMapper());

    private FolioJson() {
    }

    /**
     * Returns the shared, fully configured mapper. Do not reconfigure it.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * Applies the report wire settings to an existing mapper, for example the one Vert.x uses.
     */
    public static ObjectMapper configure(ObjectMapper mapper) {
        // Register JavaTimeModule for Java 8 date/time support
        mapper.registerModule(new JavaTimeModule());
        // Use ISO-8601 strings instead of numeric timestamps
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    public static String toJson(Object value) throws JsonProcessingException {
        return MAPPER.writeValueAsString(value);
    }

    public static ReportState readReport(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, ReportState.class);
    }

    public static Section readSection(String json) throws JsonProcessingException {
        return MAPPER.readValue(json, Section.class);
    }
}
