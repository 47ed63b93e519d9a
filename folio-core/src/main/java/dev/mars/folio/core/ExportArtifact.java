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

import java.util.Objects;

/**
 * Rendered bytes of a completed report in one {@link ExportFormat}.
 *
 * @author Mark Andrew Ray-Smith Cityline Ltd
 * @since 2026-03-02
 */
public final class ExportArtifact {

    private final String sessionId;
    private final ExportFormat format;
    private final String contentType;
    private final byte[] content;

    public ExportArtifact(String sessionId, ExportFormat format, String contentType, byte[] content) {
        this.sessionId = Objects.requireNonNull(sessionId, "Session ID cannot be null");
        this.format = Objects.requireNonNull(format, "Format cannot be null");
        this.contentType = contentType != null ? contentType : format.getContentType();
        this.content = content != null ? content.clone() : new byte[0];
    }

    public String getSessionId() {
        return sessionId;
    }

    public ExportFormat getFormat() {
        return format;
    }

    public String getContentType() {
        return contentType;
    }

    public byte[] getContent() {
        return content.clone();
    }

    public int getSize() {
        return content.length;
    }

    /**
     * Suggested download name, e.g. {@code report-abc123.md}.
     */
    public String getFileName() {
        return "report-" + sessionId + "." + format.getFileExtension();
    }

    @Override
    public String toString() {
        return "ExportArtifact{sessionId='" + sessionId + "', format=" + format + ", size=" + content.length + '}';
    }
}
