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

package dev.mars.folio.core;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Document formats a completed report can be exported to.
 * <p>
 * The set is fixed; which of them a backend actually renders is a capability of that backend.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @version 1.0
 * @since 2026-03-02
 */
public enum ExportFormat {

    MARKDOWN("markdown", "text/markdown; charset=utf-8", "md"),

    DOCX("docx", "application/vnd.openxmlformats-officedocument.wordprocessingml.document", "docx"),

    PDF("pdf", "application/pdf", "pdf");

    private final String wireName;
    private final String contentType;
    private final String fileExtension;

    ExportFormat(String wireName, String contentType, String fileExtension) {
        this.wireName = wireName;
        this.contentType = contentType;
        this.fileExtension = fileExtension;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public String getContentType() {
        return contentType;
    }

    public String getFileExtension() {
        return fileExtension;
    }

    /**
     * Looks up a format by its wire name, case-insensitively.
     */
    public static Optional<ExportFormat> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(f -> f.wireName.equals(normalized))
                .findFirst();
    }

    @JsonCreator
    static ExportFormat fromJson(String value) {
        return fromWireName(value)
                .orElseThrow(() -> new IllegalArgumentException("Unknown export format: " + value));
    }
}
